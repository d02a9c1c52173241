package com.voxelagent.domain.planning.model.valobj;

import com.voxelagent.domain.identifier.model.valobj.PlanId;
import com.voxelagent.types.enums.EntityKindEnum;

/**
 * 规范化后的依赖边。
 *
 * @param source       声明依赖的计划
 * @param target       依赖目标的规范 ID
 * @param targetKind   依赖目标的实体类型（计划或目标）
 * @param rawReference 改写前的原始引用
 */
public record DependencyEdge(PlanId source,
                             String target,
                             EntityKindEnum targetKind,
                             String rawReference) {
}
