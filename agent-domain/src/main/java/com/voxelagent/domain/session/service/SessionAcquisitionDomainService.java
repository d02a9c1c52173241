package com.voxelagent.domain.session.service;

import com.voxelagent.domain.execution.service.ExecutionCounterRegistry;
import com.voxelagent.domain.identifier.model.valobj.SessionId;
import com.voxelagent.domain.identifier.service.IdentifierFormatter;
import com.voxelagent.domain.session.adapter.repository.IPlanningSessionRepository;
import com.voxelagent.domain.session.model.entity.PlanningSessionEntity;
import com.voxelagent.domain.session.model.valobj.SessionAcquisition;
import com.voxelagent.types.enums.EntityKindEnum;
import com.voxelagent.types.enums.ResponseCode;
import com.voxelagent.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 会话获取领域服务：服务端签发会话 ID，或校验并接纳渲染客户端提供的会话 ID。
 * <p>
 * 后缀是目标 ID 中唯一的会话标识，因此同一后缀同时只能归属一个会话；
 * 关闭或淘汰的会话在后缀台账中留下墓碑，其 ID 与后缀都不能再被获取。
 * </p>
 */
@Slf4j
@Service
public class SessionAcquisitionDomainService {

    private static final int MAX_MINT_ATTEMPTS = 8;

    private final IdentifierFormatter identifierFormatter;
    private final IPlanningSessionRepository planningSessionRepository;
    /** 后缀台账的检查与登记必须原子完成 */
    private final ReentrantLock acquisitionLock = new ReentrantLock();

    public SessionAcquisitionDomainService(IdentifierFormatter identifierFormatter,
                                           IPlanningSessionRepository planningSessionRepository) {
        this.identifierFormatter = identifierFormatter;
        this.planningSessionRepository = planningSessionRepository;
    }

    /**
     * 获取会话：未提供 ID 时签发新会话；提供了规范 ID 时创建或恢复该会话。
     * 后缀已被其他会话占用，或该会话已关闭、已淘汰时拒绝。
     *
     * @param clientSessionId 渲染客户端提供的会话 ID，可为空
     * @return 获取结果
     */
    public SessionAcquisition acquire(String clientSessionId) {
        if (StringUtils.isBlank(clientSessionId)) {
            return new SessionAcquisition(mint(), false);
        }
        String candidate = clientSessionId.trim();
        if (!identifierFormatter.isCanonical(candidate, EntityKindEnum.SESSION)) {
            log.warn("SESSION_REJECTED reason=invalid_format, candidate={}", StringUtils.abbreviate(candidate, 64));
            throw new AppException(ResponseCode.INVALID_SESSION_FORMAT,
                    "会话ID格式不合法，请申请服务端签发的会话ID: " + candidate);
        }
        SessionId sessionId = identifierFormatter.parseSessionId(candidate);
        PlanningSessionEntity stored;
        boolean resumed;
        acquisitionLock.lock();
        try {
            String owner = planningSessionRepository.findSuffixOwner(sessionId.suffix());
            if (owner != null && !owner.equals(sessionId.value())) {
                log.warn("SESSION_REJECTED reason=suffix_in_use, candidate={}, owner={}", sessionId.value(), owner);
                throw new AppException(ResponseCode.INVALID_SESSION_FORMAT,
                        "会话后缀已被其他会话占用，请申请服务端签发的会话ID: " + sessionId.value());
            }
            if (owner != null) {
                stored = planningSessionRepository.findById(sessionId.value());
                if (stored == null) {
                    log.warn("SESSION_REJECTED reason=retired, candidate={}", sessionId.value());
                    throw new AppException(ResponseCode.INVALID_SESSION_FORMAT,
                            "会话已关闭或过期，不能再次使用，请申请服务端签发的会话ID: " + sessionId.value());
                }
                resumed = true;
            } else {
                PlanningSessionEntity created = newSession(sessionId, true);
                stored = planningSessionRepository.saveIfAbsent(created);
                planningSessionRepository.claimSuffix(sessionId.suffix(), sessionId.value());
                resumed = stored != created;
            }
        } finally {
            acquisitionLock.unlock();
        }
        log.info("SESSION_STARTED sessionId={}, source=client, resumed={}, activeSessions={}",
                sessionId.value(), resumed, planningSessionRepository.countActive());
        return new SessionAcquisition(stored, resumed);
    }

    public PlanningSessionEntity requireActive(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "sessionId 不能为空");
        }
        PlanningSessionEntity session = planningSessionRepository.findById(sessionId.trim());
        if (session == null) {
            throw new AppException(ResponseCode.SESSION_NOT_FOUND, "会话不存在或已关闭: " + sessionId);
        }
        return session;
    }

    /**
     * 关闭会话，后缀台账中的记录保留为墓碑。
     */
    public boolean close(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            return false;
        }
        boolean removed = planningSessionRepository.deleteById(sessionId.trim());
        log.info("SESSION_CLOSED sessionId={}, removed={}", sessionId, removed);
        return removed;
    }

    private PlanningSessionEntity mint() {
        acquisitionLock.lock();
        try {
            return mintLocked();
        } finally {
            acquisitionLock.unlock();
        }
    }

    private PlanningSessionEntity mintLocked() {
        for (int attempt = 1; attempt <= MAX_MINT_ATTEMPTS; attempt++) {
            SessionId sessionId = identifierFormatter.formatSessionId();
            if (planningSessionRepository.findSuffixOwner(sessionId.suffix()) != null) {
                log.warn("SESSION_ID_COLLISION sessionId={}, attempt={}, reason=suffix_in_use", sessionId.value(), attempt);
                continue;
            }
            PlanningSessionEntity created = newSession(sessionId, false);
            if (planningSessionRepository.saveIfAbsent(created) == created) {
                planningSessionRepository.claimSuffix(sessionId.suffix(), sessionId.value());
                log.info("SESSION_STARTED sessionId={}, source=server, attempt={}, activeSessions={}",
                        sessionId.value(), attempt, planningSessionRepository.countActive());
                return created;
            }
            log.warn("SESSION_ID_COLLISION sessionId={}, attempt={}", sessionId.value(), attempt);
        }
        throw new AppException(ResponseCode.UN_ERROR, "会话ID连续冲突，签发失败");
    }

    private PlanningSessionEntity newSession(SessionId sessionId, boolean clientSupplied) {
        return new PlanningSessionEntity(sessionId,
                clientSupplied,
                LocalDateTime.now(),
                new ExecutionCounterRegistry(identifierFormatter));
    }
}
