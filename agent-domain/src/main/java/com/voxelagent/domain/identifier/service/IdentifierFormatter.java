package com.voxelagent.domain.identifier.service;

import com.voxelagent.domain.identifier.model.valobj.CommandId;
import com.voxelagent.domain.identifier.model.valobj.GoalId;
import com.voxelagent.domain.identifier.model.valobj.PlanId;
import com.voxelagent.domain.identifier.model.valobj.SessionId;
import com.voxelagent.types.enums.EntityKindEnum;

/**
 * 规范 ID 格式化器：目标、计划、命令 ID 只能由这里签发。
 * <p>
 * 每个子 ID 都嵌入了祖先信息，下游只凭 ID 字符串即可还原血缘。
 * </p>
 *
 * @author voxelagent
 * @since 2025-09-09
 */
public interface IdentifierFormatter {

    /**
     * 按时钟和随机后缀签发会话 ID，不会失败。
     *
     * @return 新会话 ID
     */
    SessionId formatSessionId();

    /**
     * 格式化目标 ID。
     *
     * @param session  所属会话
     * @param sequence 会话内序号，从 1 开始
     * @return 嵌入会话后缀的目标 ID
     */
    GoalId formatGoalId(SessionId session, int sequence);

    /**
     * 格式化计划 ID。
     *
     * @param goalSequence    所属目标的序号
     * @param planIndexInGoal 目标内的计划序号，从 1 开始
     * @return 计划 ID
     */
    PlanId formatPlanId(int goalSequence, int planIndexInGoal);

    /**
     * 在已签发的目标下格式化计划 ID。
     *
     * @param goal            所属目标，不能为空
     * @param planIndexInGoal 目标内的计划序号，从 1 开始
     * @return 计划 ID
     */
    default PlanId formatPlanId(GoalId goal, int planIndexInGoal) {
        if (goal == null) {
            throw new IllegalArgumentException("goal 不能为空");
        }
        return formatPlanId(goal.sequence(), planIndexInGoal);
    }

    /**
     * 格式化命令 ID。
     *
     * @param plan            所属计划
     * @param commandSequence 计划内的命令序号，从 1 开始
     * @return 以完整计划 ID 为前缀的命令 ID
     */
    CommandId formatCommandId(PlanId plan, int commandSequence);

    /**
     * 按实体类型的规范布局做结构校验。
     *
     * @param candidate 外部提供的字符串，可为 null
     * @param kind      实体类型
     * @return 可以原样保留时返回 true
     */
    boolean isCanonical(String candidate, EntityKindEnum kind);

    /**
     * 解析会话 ID，不合规范时抛出 INVALID_SESSION_FORMAT。
     */
    SessionId parseSessionId(String candidate);

    /**
     * 解析目标 ID，序号为零或不合规范时抛出 ILLEGAL_PARAMETER。
     */
    GoalId parseGoalId(String candidate);

    /**
     * 解析计划 ID，规则同 {@link #parseGoalId(String)}。
     */
    PlanId parsePlanId(String candidate);

    /**
     * 解析命令 ID，连同其中嵌入的计划 ID 一并还原。
     */
    CommandId parseCommandId(String candidate);
}
