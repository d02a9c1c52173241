package com.voxelagent.domain.identifier.model.valobj;

/**
 * 计划 ID 值对象：{@code plan_<3 位目标序号>_<2 位计划序号>}。
 * <p>
 * 两个字段都定宽补零，字典序即创建顺序。
 * </p>
 *
 * @param value        完整的规范字符串
 * @param goalSequence 所属目标的序号
 * @param planSequence 目标内计划序号，从 1 开始
 */
public record PlanId(String value, int goalSequence, int planSequence) {

    @Override
    public String toString() {
        return value;
    }
}
