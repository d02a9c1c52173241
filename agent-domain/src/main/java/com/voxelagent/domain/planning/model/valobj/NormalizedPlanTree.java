package com.voxelagent.domain.planning.model.valobj;

import com.voxelagent.domain.identifier.model.valobj.SessionId;
import com.voxelagent.types.enums.NormalizationOutcomeEnum;

import java.util.List;

/**
 * 一次规划调用规范化后的完整结果，不可变。
 */
public record NormalizedPlanTree(SessionId session,
                                 NormalizationOutcomeEnum outcome,
                                 List<NormalizedGoal> goals,
                                 String talkToPlayer) {

    public NormalizedPlanTree {
        goals = goals == null ? List.of() : List.copyOf(goals);
    }

    public static NormalizedPlanTree empty(SessionId session, String talkToPlayer) {
        return new NormalizedPlanTree(session, NormalizationOutcomeEnum.EMPTY_TREE, List.of(), talkToPlayer);
    }

    public boolean isEmpty() {
        return outcome == NormalizationOutcomeEnum.EMPTY_TREE;
    }

    public List<NormalizedPlan> allPlans() {
        return goals.stream()
                .flatMap(goal -> goal.plans().stream())
                .toList();
    }
}
