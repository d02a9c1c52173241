package com.voxelagent.domain.planning.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 原始计划步骤。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawPlan {

    /**
     * 上游给出的原始 ID。
     */
    private String id;

    /**
     * 动作类型，原样透传。
     */
    private String actionType;

    /**
     * 步骤描述。
     */
    private String description;

    /**
     * 原始依赖引用，可能是其它步骤的原始 ID，也可能是无法解析的符号名。
     */
    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();
}
