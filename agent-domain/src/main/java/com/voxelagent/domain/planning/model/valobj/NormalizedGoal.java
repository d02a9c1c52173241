package com.voxelagent.domain.planning.model.valobj;

import com.voxelagent.domain.identifier.model.valobj.GoalId;

import java.util.List;

/**
 * 规范化后的目标。
 */
public record NormalizedGoal(GoalId goalId,
                             String rawId,
                             String label,
                             List<NormalizedPlan> plans) {

    public NormalizedGoal {
        plans = plans == null ? List.of() : List.copyOf(plans);
    }
}
