package com.voxelagent.test;

import com.google.common.cache.Cache;
import com.voxelagent.Application;
import com.voxelagent.api.dto.CommandIssueResponseDTO;
import com.voxelagent.api.dto.SessionStartRequestDTO;
import com.voxelagent.api.dto.SessionStartResponseDTO;
import com.voxelagent.domain.session.model.entity.PlanningSessionEntity;
import com.voxelagent.trigger.application.command.CommandDispatchCommandService;
import com.voxelagent.trigger.application.command.PlanningCommandService;
import com.voxelagent.trigger.application.command.SessionCommandService;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * 应用上下文装配测试：验证配置类、缓存仓储与用例服务能够一起启动并协作。
 */
@Slf4j
@SpringBootTest(classes = Application.class)
public class ApiTest {

    @Autowired
    private SessionCommandService sessionCommandService;

    @Autowired
    private PlanningCommandService planningCommandService;

    @Autowired
    private CommandDispatchCommandService commandDispatchCommandService;

    @Autowired
    @Qualifier("planningSessionCache")
    private Cache<String, PlanningSessionEntity> planningSessionCache;

    @Test
    public void shouldWireSessionPlanningAndDispatch() {
        SessionStartResponseDTO session = sessionCommandService.startSession(new SessionStartRequestDTO());
        planningCommandService.submit(session.getSessionId(), "{\"plan\":[{\"id\":\"s1\",\"description\":\"dig\"}]}");

        CommandIssueResponseDTO command = commandDispatchCommandService.issue(session.getSessionId(), "plan_001_01", null);

        Assertions.assertEquals("cmd_plan_001_01_001", command.getCommandId());
        Assertions.assertNotNull(planningSessionCache.getIfPresent(session.getSessionId()));
        log.info("测试完成 sessionId={}", session.getSessionId());
    }

}
