package com.voxelagent.trigger.application.command;

import com.voxelagent.api.dto.CommandCounterResetResponseDTO;
import com.voxelagent.api.dto.CommandIssueRequestDTO;
import com.voxelagent.api.dto.CommandIssueResponseDTO;
import com.voxelagent.domain.execution.model.valobj.CommandAttempt;
import com.voxelagent.domain.execution.service.ExecutionCounterRegistry;
import com.voxelagent.domain.identifier.model.valobj.CommandId;
import com.voxelagent.domain.identifier.model.valobj.PlanId;
import com.voxelagent.domain.identifier.service.IdentifierFormatter;
import com.voxelagent.domain.session.model.entity.PlanningSessionEntity;
import com.voxelagent.domain.session.service.SessionAcquisitionDomainService;
import com.voxelagent.types.enums.ResponseCode;
import com.voxelagent.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 命令下发写用例：为会话中已提交的计划签发命令 ID，或重置计划计数器。
 */
@Slf4j
@Service
public class CommandDispatchCommandService {

    private final SessionAcquisitionDomainService sessionAcquisitionDomainService;
    private final IdentifierFormatter identifierFormatter;
    private final Counter issuedCounter;

    public CommandDispatchCommandService(SessionAcquisitionDomainService sessionAcquisitionDomainService,
                                         IdentifierFormatter identifierFormatter) {
        this.sessionAcquisitionDomainService = sessionAcquisitionDomainService;
        this.identifierFormatter = identifierFormatter;
        this.issuedCounter = Counter.builder("agent.command.issued.total").register(Metrics.globalRegistry);
    }

    public CommandIssueResponseDTO issue(String sessionId, String planId, CommandIssueRequestDTO request) {
        PlanningSessionEntity session = sessionAcquisitionDomainService.requireActive(sessionId);
        PlanId plan = requireOwnedPlan(session, planId);
        String retryOf = request == null ? null : StringUtils.trimToNull(request.getRetryOf());
        CommandId attemptOf = retryOf == null ? null : identifierFormatter.parseCommandId(retryOf);

        CommandAttempt attempt = session.getCounterRegistry().nextAttempt(plan, attemptOf);
        issuedCounter.increment();
        log.debug("COMMAND_ISSUED sessionId={}, commandId={}, attemptOf={}",
                session.getSessionId().value(), attempt.commandId().value(), retryOf);

        CommandIssueResponseDTO dto = new CommandIssueResponseDTO();
        dto.setCommandId(attempt.commandId().value());
        dto.setPlanId(plan.value());
        dto.setSequence(attempt.commandId().sequence());
        dto.setAttemptOf(attempt.attemptOf() == null ? null : attempt.attemptOf().value());
        dto.setAttemptNumber(attempt.attemptNumber());
        return dto;
    }

    public CommandCounterResetResponseDTO reset(String sessionId, String planId) {
        PlanningSessionEntity session = sessionAcquisitionDomainService.requireActive(sessionId);
        PlanId plan = requireOwnedPlan(session, planId);
        ExecutionCounterRegistry registry = session.getCounterRegistry();
        int lastSequence = registry.reset(plan);

        CommandCounterResetResponseDTO dto = new CommandCounterResetResponseDTO();
        dto.setPlanId(plan.value());
        dto.setLastSequence(lastSequence);
        return dto;
    }

    private PlanId requireOwnedPlan(PlanningSessionEntity session, String planId) {
        if (StringUtils.isBlank(planId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "planId 不能为空");
        }
        PlanId plan = identifierFormatter.parsePlanId(planId.trim());
        if (!session.ownsPlan(plan)) {
            throw new AppException(ResponseCode.UNKNOWN_PLAN,
                    "计划不属于该会话或尚未提交: " + plan.value());
        }
        return plan;
    }
}
