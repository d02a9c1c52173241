package com.voxelagent.domain.execution.service;

import com.voxelagent.domain.execution.model.valobj.CommandAttempt;
import com.voxelagent.domain.identifier.model.valobj.CommandId;
import com.voxelagent.domain.identifier.model.valobj.PlanId;
import com.voxelagent.domain.identifier.service.IdentifierFormatter;
import com.voxelagent.types.enums.ResponseCode;
import com.voxelagent.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 命令计数器注册表：按计划维护单调递增的命令序号。
 * <p>
 * 不同计划之间互不阻塞，同一计划的调用在该计划自己的计数器上串行。
 * 注册表由执行层按会话创建并持有，条目不会自行淘汰；重置过的计划连同最后签发的序号一起退役，不再签发命令。
 * </p>
 */
@Slf4j
public class ExecutionCounterRegistry {

    private final IdentifierFormatter identifierFormatter;
    private final ConcurrentMap<PlanId, PlanCounter> counters = new ConcurrentHashMap<>();
    /** 已退役计划 -> 退役时最后签发的序号 */
    private final ConcurrentMap<PlanId, Integer> retiredPlans = new ConcurrentHashMap<>();
    private final ConcurrentMap<CommandId, CommandAttempt> retries = new ConcurrentHashMap<>();

    public ExecutionCounterRegistry(IdentifierFormatter identifierFormatter) {
        if (identifierFormatter == null) {
            throw new IllegalArgumentException("identifierFormatter 不能为空");
        }
        this.identifierFormatter = identifierFormatter;
    }

    /**
     * 为即将下发的命令签发下一个命令 ID。
     */
    public CommandId nextCommandId(PlanId plan) {
        requirePlan(plan);
        while (true) {
            PlanCounter counter = counters.computeIfAbsent(plan, PlanCounter::new);
            if (retiredPlans.containsKey(plan)) {
                counters.remove(plan, counter);
                throw new AppException(ResponseCode.UNKNOWN_PLAN, "计划计数器已重置退役: " + plan.value());
            }
            CommandId commandId = counter.next();
            if (commandId != null) {
                return commandId;
            }
            counters.remove(plan, counter);
        }
    }

    /**
     * 签发一次下发尝试；attemptOf 不为空时表示重试，必须是同一计划已签发过的命令。
     */
    public CommandAttempt nextAttempt(PlanId plan, CommandId attemptOf) {
        requirePlan(plan);
        if (attemptOf == null) {
            return new CommandAttempt(nextCommandId(plan), null, 1);
        }
        if (retiredPlans.containsKey(plan)) {
            throw new AppException(ResponseCode.UNKNOWN_PLAN, "计划计数器已重置退役: " + plan.value());
        }
        if (!plan.equals(attemptOf.plan())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER,
                    "重试的命令不属于该计划: command=" + attemptOf.value() + ", plan=" + plan.value());
        }
        if (attemptOf.sequence() > currentSequence(plan)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "重试的命令尚未签发: " + attemptOf.value());
        }
        int previousAttempt = findAttempt(attemptOf).map(CommandAttempt::attemptNumber).orElse(1);
        CommandAttempt attempt = new CommandAttempt(nextCommandId(plan), attemptOf, previousAttempt + 1);
        retries.put(attempt.commandId(), attempt);
        return attempt;
    }

    /**
     * 丢弃计划的计数器并退役其命名空间。
     *
     * @return 退役前最后签发的命令序号
     */
    public int reset(PlanId plan) {
        requirePlan(plan);
        PlanCounter counter = counters.get(plan);
        if (counter == null) {
            if (retiredPlans.containsKey(plan)) {
                throw new AppException(ResponseCode.UNKNOWN_PLAN, "计划计数器已重置退役: " + plan.value());
            }
            throw new AppException(ResponseCode.UNKNOWN_PLAN, "计划从未签发过命令: " + plan.value());
        }
        int lastSequence = counter.retire();
        counters.remove(plan, counter);
        log.info("COMMAND_COUNTER_RESET plan={}, lastSequence={}", plan.value(), lastSequence);
        return lastSequence;
    }

    /**
     * 计划最近一次签发的命令序号，未签发过为 0；已退役的计划返回退役时的序号。
     */
    public int currentSequence(PlanId plan) {
        requirePlan(plan);
        Integer retiredSequence = retiredPlans.get(plan);
        if (retiredSequence != null) {
            return retiredSequence;
        }
        PlanCounter counter = counters.get(plan);
        return counter == null ? 0 : counter.current();
    }

    public Optional<CommandId> findAttemptOf(CommandId commandId) {
        return findAttempt(commandId).map(CommandAttempt::attemptOf);
    }

    public Optional<CommandAttempt> findAttempt(CommandId commandId) {
        if (commandId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(retries.get(commandId));
    }

    public boolean isRetired(PlanId plan) {
        return plan != null && retiredPlans.containsKey(plan);
    }

    private void requirePlan(PlanId plan) {
        if (plan == null) {
            throw new IllegalArgumentException("plan 不能为空");
        }
    }

    /**
     * 单个计划的计数器，所有读写都在自身监视器上完成。
     */
    private final class PlanCounter {

        private final PlanId plan;
        private int value;
        private boolean retired;

        private PlanCounter(PlanId plan) {
            this.plan = plan;
        }

        /**
         * 先格式化再推进，格式化失败时计数器保持不变；已退役时返回 null。
         */
        private synchronized CommandId next() {
            if (retired) {
                return null;
            }
            CommandId commandId = identifierFormatter.formatCommandId(plan, value + 1);
            value = commandId.sequence();
            return commandId;
        }

        private synchronized int current() {
            return value;
        }

        /**
         * 退役记录在监视器内写入，拿到 null 的 next() 调用方一定能看到它。
         */
        private synchronized int retire() {
            retired = true;
            retiredPlans.merge(plan, value, Math::max);
            return value;
        }
    }
}
