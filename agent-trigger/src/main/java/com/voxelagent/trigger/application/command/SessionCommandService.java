package com.voxelagent.trigger.application.command;

import com.voxelagent.api.dto.SessionCloseResponseDTO;
import com.voxelagent.api.dto.SessionStartRequestDTO;
import com.voxelagent.api.dto.SessionStartResponseDTO;
import com.voxelagent.domain.session.model.entity.PlanningSessionEntity;
import com.voxelagent.domain.session.model.valobj.SessionAcquisition;
import com.voxelagent.domain.session.service.SessionAcquisitionDomainService;
import org.springframework.stereotype.Service;

/**
 * 会话生命周期写用例。
 */
@Service
public class SessionCommandService {

    private final SessionAcquisitionDomainService sessionAcquisitionDomainService;

    public SessionCommandService(SessionAcquisitionDomainService sessionAcquisitionDomainService) {
        this.sessionAcquisitionDomainService = sessionAcquisitionDomainService;
    }

    public SessionStartResponseDTO startSession(SessionStartRequestDTO request) {
        String clientSessionId = request == null ? null : request.getSessionId();
        SessionAcquisition acquisition = sessionAcquisitionDomainService.acquire(clientSessionId);
        PlanningSessionEntity session = acquisition.session();

        SessionStartResponseDTO dto = new SessionStartResponseDTO();
        dto.setSessionId(session.getSessionId().value());
        dto.setSuffix(session.getSessionId().suffix());
        dto.setClientSupplied(session.isClientSupplied());
        dto.setResumed(acquisition.resumed());
        dto.setCommittedGoalCount(session.getCommittedGoalCount());
        dto.setCreatedAt(session.getCreatedAt());
        return dto;
    }

    public SessionCloseResponseDTO closeSession(String sessionId) {
        SessionCloseResponseDTO dto = new SessionCloseResponseDTO();
        dto.setSessionId(sessionId);
        dto.setClosed(sessionAcquisitionDomainService.close(sessionId));
        return dto;
    }
}
