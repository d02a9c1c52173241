package com.voxelagent.trigger.application.common;

import com.voxelagent.api.dto.PlanningResultDTO;
import com.voxelagent.domain.planning.model.valobj.DependencyEdge;
import com.voxelagent.domain.planning.model.valobj.NormalizedGoal;
import com.voxelagent.domain.planning.model.valobj.NormalizedPlan;
import com.voxelagent.domain.planning.model.valobj.NormalizedPlanTree;

import java.util.ArrayList;
import java.util.List;

/**
 * 规范化结果到 API DTO 的装配器。
 */
public final class PlanningResultAssembler {

    private PlanningResultAssembler() {
    }

    public static PlanningResultDTO toDTO(NormalizedPlanTree tree) {
        PlanningResultDTO dto = new PlanningResultDTO();
        if (tree == null) {
            return dto;
        }
        dto.setSessionId(tree.session() == null ? null : tree.session().value());
        dto.setOutcome(tree.outcome() == null ? null : tree.outcome().getCode());
        dto.setTalkToPlayer(tree.talkToPlayer());
        List<PlanningResultDTO.GoalDTO> goals = new ArrayList<>(tree.goals().size());
        for (NormalizedGoal goal : tree.goals()) {
            goals.add(toGoalDTO(goal));
        }
        dto.setGoals(goals);
        return dto;
    }

    private static PlanningResultDTO.GoalDTO toGoalDTO(NormalizedGoal goal) {
        PlanningResultDTO.GoalDTO dto = new PlanningResultDTO.GoalDTO();
        dto.setGoalId(goal.goalId().value());
        dto.setRawId(goal.rawId());
        dto.setLabel(goal.label());
        List<PlanningResultDTO.PlanDTO> plans = new ArrayList<>();
        for (NormalizedPlan plan : goal.plans()) {
            plans.add(toPlanDTO(plan));
        }
        dto.setPlans(plans);
        return dto;
    }

    private static PlanningResultDTO.PlanDTO toPlanDTO(NormalizedPlan plan) {
        PlanningResultDTO.PlanDTO dto = new PlanningResultDTO.PlanDTO();
        dto.setPlanId(plan.planId().value());
        dto.setRawId(plan.rawId());
        dto.setActionType(plan.actionType());
        dto.setDescription(plan.description());
        List<PlanningResultDTO.DependencyDTO> dependsOn = new ArrayList<>();
        if (plan.dependsOn() != null) {
            for (DependencyEdge edge : plan.dependsOn()) {
                PlanningResultDTO.DependencyDTO dependency = new PlanningResultDTO.DependencyDTO();
                dependency.setTarget(edge.target());
                dependency.setTargetKind(edge.targetKind() == null ? null : edge.targetKind().getCode());
                dependency.setRawReference(edge.rawReference());
                dependsOn.add(dependency);
            }
        }
        dto.setDependsOn(dependsOn);
        return dto;
    }
}
