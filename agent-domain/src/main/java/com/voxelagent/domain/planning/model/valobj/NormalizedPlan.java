package com.voxelagent.domain.planning.model.valobj;

import com.voxelagent.domain.identifier.model.valobj.PlanId;

import java.util.List;

/**
 * 规范化后的计划步骤。
 */
public record NormalizedPlan(PlanId planId,
                             String rawId,
                             String actionType,
                             String description,
                             List<DependencyEdge> dependsOn) {

    public NormalizedPlan {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }
}
