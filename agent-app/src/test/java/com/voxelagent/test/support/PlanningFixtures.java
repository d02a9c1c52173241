package com.voxelagent.test.support;

import com.voxelagent.domain.planning.model.valobj.RawGoal;
import com.voxelagent.domain.planning.model.valobj.RawGoalPlanTree;
import com.voxelagent.domain.planning.model.valobj.RawPlan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 原始规划树测试构造工具。
 */
public final class PlanningFixtures {

    private PlanningFixtures() {
    }

    public static RawGoalPlanTree tree(RawGoal... goals) {
        RawGoalPlanTree tree = new RawGoalPlanTree();
        tree.setGoals(new ArrayList<>(Arrays.asList(goals)));
        return tree;
    }

    public static RawGoal goal(String id, String label, RawPlan... plans) {
        RawGoal goal = new RawGoal();
        goal.setId(id);
        goal.setLabel(label);
        goal.setPlans(new ArrayList<>(Arrays.asList(plans)));
        return goal;
    }

    public static RawPlan plan(String id, String description, String... dependsOn) {
        RawPlan plan = new RawPlan();
        plan.setId(id);
        plan.setActionType("build");
        plan.setDescription(description);
        plan.setDependsOn(new ArrayList<>(List.of(dependsOn)));
        return plan;
    }
}
