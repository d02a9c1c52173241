package com.voxelagent.domain.planning.service;

import com.voxelagent.domain.identifier.model.valobj.GoalId;
import com.voxelagent.domain.identifier.model.valobj.PlanId;
import com.voxelagent.domain.identifier.model.valobj.SessionId;
import com.voxelagent.domain.identifier.service.IdentifierFormatter;
import com.voxelagent.domain.planning.model.valobj.DependencyEdge;
import com.voxelagent.domain.planning.model.valobj.NormalizedGoal;
import com.voxelagent.domain.planning.model.valobj.NormalizedPlan;
import com.voxelagent.domain.planning.model.valobj.NormalizedPlanTree;
import com.voxelagent.domain.planning.model.valobj.RawGoal;
import com.voxelagent.domain.planning.model.valobj.RawGoalPlanTree;
import com.voxelagent.domain.planning.model.valobj.RawPlan;
import com.voxelagent.types.enums.EntityKindEnum;
import com.voxelagent.types.enums.NormalizationOutcomeEnum;
import com.voxelagent.types.enums.ResponseCode;
import com.voxelagent.types.exception.AppException;
import com.voxelagent.types.exception.UnresolvedDependencyException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 规划规范化领域服务：把上游原始目标/计划树改写为全部使用规范 ID 的等价树。
 * <p>
 * 上游 ID 一律不被信任，即使形似规范 ID 也重新签发；原始 ID 到规范 ID 的映射只在单次调用内存在。
 * 任一依赖无法解析时整次调用失败，不产出任何部分结果。
 * </p>
 */
@Service
public class PlanNormalizationDomainService {

    private final IdentifierFormatter identifierFormatter;

    public PlanNormalizationDomainService(IdentifierFormatter identifierFormatter) {
        this.identifierFormatter = identifierFormatter;
    }

    public NormalizedPlanTree normalize(SessionId session, RawGoalPlanTree rawTree) {
        return normalize(session, rawTree, 0);
    }

    /**
     * 规范化一次规划调用的输出。
     *
     * @param session            所属会话
     * @param rawTree            上游原始树
     * @param goalSequenceOffset 会话内已提交的目标数量，本次目标序号从 offset + 1 开始
     * @return 规范化结果；原始树没有目标时返回 {@link NormalizationOutcomeEnum#EMPTY_TREE}
     */
    public NormalizedPlanTree normalize(SessionId session, RawGoalPlanTree rawTree, int goalSequenceOffset) {
        if (session == null) {
            throw new IllegalArgumentException("session 不能为空");
        }
        if (goalSequenceOffset < 0) {
            throw new AppException(ResponseCode.INVALID_SEQUENCE, "goal sequence offset 不能为负数: " + goalSequenceOffset);
        }
        String talkToPlayer = rawTree == null ? null : rawTree.getTalkToPlayer();
        if (rawTree == null || rawTree.isEmpty()) {
            return NormalizedPlanTree.empty(session, talkToPlayer);
        }

        ReferenceScope scope = new ReferenceScope();
        List<PendingGoal> pendingGoals = new ArrayList<>();
        int goalPosition = 0;
        for (RawGoal rawGoal : rawTree.getGoals()) {
            goalPosition++;
            RawGoal goal = rawGoal == null ? new RawGoal() : rawGoal;
            GoalId goalId = identifierFormatter.formatGoalId(session, goalSequenceOffset + goalPosition);
            scope.registerGoal(goal.getId(), goalId);

            PendingGoal pendingGoal = new PendingGoal(goal, goalId, new ArrayList<>(), new HashMap<>());
            int planPosition = 0;
            List<RawPlan> rawPlans = goal.getPlans() == null ? List.of() : goal.getPlans();
            for (RawPlan rawPlan : rawPlans) {
                planPosition++;
                RawPlan plan = rawPlan == null ? new RawPlan() : rawPlan;
                PlanId planId = identifierFormatter.formatPlanId(goalId, planPosition);
                pendingGoal.plans().add(new PendingPlan(plan, planId, goalPosition, planPosition));
                scope.registerPlan(plan.getId(), planId, pendingGoal.localPlans());
            }
            pendingGoals.add(pendingGoal);
        }

        List<NormalizedGoal> goals = new ArrayList<>(pendingGoals.size());
        for (PendingGoal pendingGoal : pendingGoals) {
            List<NormalizedPlan> plans = new ArrayList<>(pendingGoal.plans().size());
            for (PendingPlan pendingPlan : pendingGoal.plans()) {
                List<DependencyEdge> edges = rewriteDependencies(pendingPlan, pendingGoal.localPlans(), scope);
                RawPlan raw = pendingPlan.raw();
                plans.add(new NormalizedPlan(pendingPlan.planId(), raw.getId(), raw.getActionType(), raw.getDescription(), edges));
            }
            RawGoal raw = pendingGoal.raw();
            goals.add(new NormalizedGoal(pendingGoal.goalId(), raw.getId(), raw.getLabel(), plans));
        }
        return new NormalizedPlanTree(session, NormalizationOutcomeEnum.NORMALIZED, goals, talkToPlayer);
    }

    private List<DependencyEdge> rewriteDependencies(PendingPlan pendingPlan,
                                                     Map<String, PlanId> localPlans,
                                                     ReferenceScope scope) {
        List<String> references = pendingPlan.raw().getDependsOn();
        if (references == null || references.isEmpty()) {
            return List.of();
        }
        List<DependencyEdge> edges = new ArrayList<>(references.size());
        for (String reference : references) {
            if (StringUtils.isBlank(reference)) {
                continue;
            }
            String key = reference.trim();
            PlanId localTarget = localPlans.get(key);
            if (localTarget != null) {
                edges.add(new DependencyEdge(pendingPlan.planId(), localTarget.value(), EntityKindEnum.PLAN, reference));
                continue;
            }
            PlanId planTarget = scope.plans.get(key);
            if (planTarget != null) {
                edges.add(new DependencyEdge(pendingPlan.planId(), planTarget.value(), EntityKindEnum.PLAN, reference));
                continue;
            }
            GoalId goalTarget = scope.goals.get(key);
            if (goalTarget != null) {
                edges.add(new DependencyEdge(pendingPlan.planId(), goalTarget.value(), EntityKindEnum.GOAL, reference));
                continue;
            }
            throw new UnresolvedDependencyException(reference, describeSource(pendingPlan));
        }
        return edges;
    }

    private String describeSource(PendingPlan pendingPlan) {
        String rawId = pendingPlan.raw().getId();
        if (StringUtils.isNotBlank(rawId)) {
            return rawId;
        }
        return "goal[" + pendingPlan.goalPosition() + "].plan[" + pendingPlan.planPosition() + "]";
    }

    /**
     * 单次调用内的原始 ID 映射；重复的原始 ID 以首次出现为准。
     */
    private static final class ReferenceScope {

        private final Map<String, GoalId> goals = new HashMap<>();
        private final Map<String, PlanId> plans = new HashMap<>();

        private void registerGoal(String rawId, GoalId goalId) {
            if (StringUtils.isNotBlank(rawId)) {
                goals.putIfAbsent(rawId.trim(), goalId);
            }
        }

        private void registerPlan(String rawId, PlanId planId, Map<String, PlanId> localPlans) {
            if (StringUtils.isNotBlank(rawId)) {
                plans.putIfAbsent(rawId.trim(), planId);
                localPlans.putIfAbsent(rawId.trim(), planId);
            }
        }
    }

    private record PendingGoal(RawGoal raw,
                               GoalId goalId,
                               List<PendingPlan> plans,
                               Map<String, PlanId> localPlans) {
    }

    private record PendingPlan(RawPlan raw,
                               PlanId planId,
                               int goalPosition,
                               int planPosition) {
    }
}
