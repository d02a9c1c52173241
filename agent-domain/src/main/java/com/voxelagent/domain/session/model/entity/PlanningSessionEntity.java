package com.voxelagent.domain.session.model.entity;

import com.voxelagent.domain.execution.service.ExecutionCounterRegistry;
import com.voxelagent.domain.identifier.model.valobj.GoalId;
import com.voxelagent.domain.identifier.model.valobj.PlanId;
import com.voxelagent.domain.identifier.model.valobj.SessionId;
import com.voxelagent.domain.planning.model.valobj.NormalizedGoal;
import com.voxelagent.domain.planning.model.valobj.NormalizedPlan;
import com.voxelagent.domain.planning.model.valobj.NormalizedPlanTree;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 规划会话领域实体
 * <p>
 * 持有会话级的规划锁、已提交的目标数量与计划，以及该会话执行层使用的命令计数器注册表。
 * 同一会话的规划调用在规划锁内串行，避免并发调用签发出相同的目标序号。
 * </p>
 *
 * @author voxelagent
 * @since 2025-09-09
 */
@Getter
public class PlanningSessionEntity {

    /**
     * 会话 ID
     */
    private final SessionId sessionId;

    /**
     * 是否由渲染客户端提供
     */
    private final boolean clientSupplied;

    /**
     * 创建时间
     */
    private final LocalDateTime createdAt;

    /**
     * 命令计数器注册表
     */
    private final ExecutionCounterRegistry counterRegistry;

    /**
     * 已提交的目标数量，下一次规划的目标序号从它 + 1 开始
     */
    private volatile int committedGoalCount;

    /**
     * 最近一次提交规划的时间
     */
    private volatile LocalDateTime lastPlannedAt;

    @Getter(AccessLevel.NONE)
    private final ReentrantLock planningLock = new ReentrantLock();

    @Getter(AccessLevel.NONE)
    private final Map<PlanId, NormalizedPlan> committedPlans = new ConcurrentHashMap<>();

    public PlanningSessionEntity(SessionId sessionId,
                                 boolean clientSupplied,
                                 LocalDateTime createdAt,
                                 ExecutionCounterRegistry counterRegistry) {
        if (sessionId == null || counterRegistry == null) {
            throw new IllegalArgumentException("sessionId 和 counterRegistry 不能为空");
        }
        this.sessionId = sessionId;
        this.clientSupplied = clientSupplied;
        this.createdAt = createdAt == null ? LocalDateTime.now() : createdAt;
        this.counterRegistry = counterRegistry;
    }

    /**
     * 在会话规划锁内执行。
     */
    public <T> T withPlanningLock(Supplier<T> action) {
        planningLock.lock();
        try {
            return action.get();
        } finally {
            planningLock.unlock();
        }
    }

    /**
     * 提交一次规范化结果，必须在规划锁内调用。空树不改变任何状态。
     */
    public void commit(NormalizedPlanTree tree) {
        if (!planningLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("提交规划结果前必须持有会话规划锁: " + sessionId.value());
        }
        if (tree == null || tree.isEmpty()) {
            return;
        }
        if (!sessionId.equals(tree.session())) {
            throw new IllegalArgumentException("规划结果不属于该会话: " + tree.session() + " != " + sessionId.value());
        }
        int expectedSequence = committedGoalCount;
        for (NormalizedGoal goal : tree.goals()) {
            GoalId goalId = goal.goalId();
            expectedSequence++;
            if (!sessionId.suffix().equals(goalId.sessionSuffix()) || goalId.sequence() != expectedSequence) {
                throw new IllegalStateException("目标序号与会话状态不一致: " + goalId.value()
                        + ", expectedSequence=" + expectedSequence);
            }
        }
        for (NormalizedPlan plan : tree.allPlans()) {
            committedPlans.put(plan.planId(), plan);
        }
        this.committedGoalCount = expectedSequence;
        this.lastPlannedAt = LocalDateTime.now();
    }

    public Optional<NormalizedPlan> findPlan(PlanId planId) {
        if (planId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(committedPlans.get(planId));
    }

    public boolean ownsPlan(PlanId planId) {
        return planId != null && committedPlans.containsKey(planId);
    }

    public int committedPlanCount() {
        return committedPlans.size();
    }
}
