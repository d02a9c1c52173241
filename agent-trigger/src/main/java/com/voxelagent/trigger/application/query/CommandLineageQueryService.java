package com.voxelagent.trigger.application.query;

import com.voxelagent.api.dto.CommandLineageDTO;
import com.voxelagent.domain.execution.model.valobj.CommandAttempt;
import com.voxelagent.domain.identifier.model.valobj.CommandId;
import com.voxelagent.domain.identifier.model.valobj.PlanId;
import com.voxelagent.domain.identifier.service.IdentifierFormatter;
import com.voxelagent.domain.planning.model.valobj.NormalizedPlan;
import com.voxelagent.domain.session.model.entity.PlanningSessionEntity;
import com.voxelagent.domain.session.service.SessionAcquisitionDomainService;
import com.voxelagent.types.enums.ResponseCode;
import com.voxelagent.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 命令血缘读用例：祖先链完全由命令 ID 自身解析得到，计划描述取自会话已提交的规划。
 */
@Service
public class CommandLineageQueryService {

    private final SessionAcquisitionDomainService sessionAcquisitionDomainService;
    private final IdentifierFormatter identifierFormatter;

    public CommandLineageQueryService(SessionAcquisitionDomainService sessionAcquisitionDomainService,
                                      IdentifierFormatter identifierFormatter) {
        this.sessionAcquisitionDomainService = sessionAcquisitionDomainService;
        this.identifierFormatter = identifierFormatter;
    }

    public CommandLineageDTO getLineage(String sessionId, String commandId) {
        if (StringUtils.isBlank(commandId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "commandId 不能为空");
        }
        PlanningSessionEntity session = sessionAcquisitionDomainService.requireActive(sessionId);
        CommandId command = identifierFormatter.parseCommandId(commandId.trim());
        PlanId plan = command.plan();
        Optional<NormalizedPlan> committed = session.findPlan(plan);
        if (committed.isEmpty()) {
            throw new AppException(ResponseCode.UNKNOWN_PLAN, "计划不属于该会话或尚未提交: " + plan.value());
        }
        if (command.sequence() > session.getCounterRegistry().currentSequence(plan)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "命令尚未签发: " + command.value());
        }

        CommandLineageDTO dto = new CommandLineageDTO();
        dto.setCommandId(command.value());
        dto.setSessionId(session.getSessionId().value());
        dto.setGoalId(identifierFormatter.formatGoalId(session.getSessionId(), plan.goalSequence()).value());
        dto.setPlanId(plan.value());
        dto.setGoalSequence(plan.goalSequence());
        dto.setPlanSequence(plan.planSequence());
        dto.setCommandSequence(command.sequence());
        dto.setActionType(committed.get().actionType());
        dto.setDescription(committed.get().description());
        Optional<CommandAttempt> attempt = session.getCounterRegistry().findAttempt(command);
        dto.setAttemptOf(attempt.map(CommandAttempt::attemptOf).map(CommandId::value).orElse(null));
        dto.setAttemptNumber(attempt.map(CommandAttempt::attemptNumber).orElse(1));
        dto.setPlanRetired(session.getCounterRegistry().isRetired(plan));
        return dto;
    }
}
