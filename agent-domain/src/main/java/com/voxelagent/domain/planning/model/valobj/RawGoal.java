package com.voxelagent.domain.planning.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 原始目标。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawGoal {

    /**
     * 上游给出的原始 ID，可能为空、重复或形似规范 ID。
     */
    private String id;

    /**
     * 目标描述。
     */
    private String label;

    /**
     * 按输入顺序排列的计划步骤。
     */
    @Builder.Default
    private List<RawPlan> plans = new ArrayList<>();
}
