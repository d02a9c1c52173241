package com.voxelagent.trigger.application.command;

import com.voxelagent.api.dto.PlanningResultDTO;
import com.voxelagent.domain.planning.adapter.gateway.IPlannerOutputReader;
import com.voxelagent.domain.planning.model.valobj.NormalizedPlanTree;
import com.voxelagent.domain.planning.model.valobj.RawGoalPlanTree;
import com.voxelagent.domain.planning.service.PlanNormalizationDomainService;
import com.voxelagent.domain.session.model.entity.PlanningSessionEntity;
import com.voxelagent.domain.session.service.SessionAcquisitionDomainService;
import com.voxelagent.trigger.application.common.PlanningResultAssembler;
import com.voxelagent.types.exception.AppException;
import com.voxelagent.types.exception.UnresolvedDependencyException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 规划提交写用例：读取上游输出，在会话规划锁内规范化并提交。
 * <p>
 * 被拒绝的调用不提交任何状态，会话的目标序号保持不变，重试从同样的序号开始。
 * </p>
 */
@Slf4j
@Service
public class PlanningCommandService {

    private final SessionAcquisitionDomainService sessionAcquisitionDomainService;
    private final IPlannerOutputReader plannerOutputReader;
    private final PlanNormalizationDomainService planNormalizationDomainService;
    private final Counter normalizeCounter;
    private final Counter rejectedCounter;

    public PlanningCommandService(SessionAcquisitionDomainService sessionAcquisitionDomainService,
                                  IPlannerOutputReader plannerOutputReader,
                                  PlanNormalizationDomainService planNormalizationDomainService) {
        this.sessionAcquisitionDomainService = sessionAcquisitionDomainService;
        this.plannerOutputReader = plannerOutputReader;
        this.planNormalizationDomainService = planNormalizationDomainService;
        this.normalizeCounter = Counter.builder("agent.planning.normalize.total").register(Metrics.globalRegistry);
        this.rejectedCounter = Counter.builder("agent.planning.normalize.rejected.total").register(Metrics.globalRegistry);
    }

    public PlanningResultDTO submit(String sessionId, String plannerOutput) {
        PlanningSessionEntity session = sessionAcquisitionDomainService.requireActive(sessionId);
        NormalizedPlanTree tree;
        try {
            RawGoalPlanTree rawTree = plannerOutputReader.read(plannerOutput);
            tree = session.withPlanningLock(() -> {
                NormalizedPlanTree normalized = planNormalizationDomainService.normalize(
                        session.getSessionId(), rawTree, session.getCommittedGoalCount());
                session.commit(normalized);
                return normalized;
            });
        } catch (UnresolvedDependencyException ex) {
            rejectedCounter.increment();
            log.warn("PLANNING_REJECTED sessionId={}, errorCode={}, reference={}, declaredBy={}",
                    session.getSessionId().value(), ex.getCode(), ex.getRawReference(), ex.getSourcePlanRawId());
            throw ex;
        } catch (AppException ex) {
            rejectedCounter.increment();
            log.warn("PLANNING_REJECTED sessionId={}, errorCode={}, errorMessage={}",
                    session.getSessionId().value(), ex.getCode(), ex.getInfo());
            throw ex;
        }

        normalizeCounter.increment();
        log.info("PLANNING_NORMALIZED sessionId={}, outcome={}, goals={}, plans={}, committedGoalCount={}",
                session.getSessionId().value(),
                tree.outcome().getCode(),
                tree.goals().size(),
                tree.allPlans().size(),
                session.getCommittedGoalCount());
        return PlanningResultAssembler.toDTO(tree);
    }
}
