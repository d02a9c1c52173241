package com.voxelagent.test;

import com.voxelagent.api.dto.PlanningResultDTO;
import com.voxelagent.api.dto.SessionStartRequestDTO;
import com.voxelagent.test.support.ApplicationStack;
import com.voxelagent.types.enums.ResponseCode;
import com.voxelagent.types.exception.AppException;
import com.voxelagent.types.exception.UnresolvedDependencyException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class PlanningCommandServiceTest {

    private static final String SESSION_ID = "sess_20250909_163532_ek30";
    private static final String SINGLE_GOAL = "{\"goals\":[{\"id\":\"g\",\"label\":\"x\",\"plans\":[{\"id\":\"s1\",\"description\":\"a\"}]}]}";

    private ApplicationStack stack;

    @BeforeEach
    public void setUp() {
        this.stack = new ApplicationStack();
        SessionStartRequestDTO request = new SessionStartRequestDTO();
        request.setSessionId(SESSION_ID);
        stack.sessionCommandService.startSession(request);
    }

    @Test
    public void shouldContinueGoalNumberingAcrossPlanningCalls() {
        PlanningResultDTO first = stack.planningCommandService.submit(SESSION_ID, SINGLE_GOAL);
        PlanningResultDTO second = stack.planningCommandService.submit(SESSION_ID, SINGLE_GOAL);

        Assertions.assertEquals("goal_ek30_001", first.getGoals().get(0).getGoalId());
        Assertions.assertEquals("goal_ek30_002", second.getGoals().get(0).getGoalId());
        Assertions.assertEquals("plan_002_01", second.getGoals().get(0).getPlans().get(0).getPlanId());
        Assertions.assertEquals("normalized", second.getOutcome());
    }

    @Test
    public void shouldCommitNothingWhenPlanningIsRejected() {
        String dangling = "{\"plan\":[{\"id\":\"s1\",\"depends_on\":\"stepX\"}]}";

        UnresolvedDependencyException ex = Assertions.assertThrows(UnresolvedDependencyException.class,
                () -> stack.planningCommandService.submit(SESSION_ID, dangling));
        PlanningResultDTO retry = stack.planningCommandService.submit(SESSION_ID, SINGLE_GOAL);

        Assertions.assertEquals("stepX", ex.getRawReference());
        Assertions.assertEquals("goal_ek30_001", retry.getGoals().get(0).getGoalId());
    }

    @Test
    public void shouldNotAdvanceNumberingForEmptyTree() {
        PlanningResultDTO empty = stack.planningCommandService.submit(SESSION_ID, "{\"talk_to_player\":\"hi\"}");
        PlanningResultDTO next = stack.planningCommandService.submit(SESSION_ID, SINGLE_GOAL);

        Assertions.assertEquals("empty_tree", empty.getOutcome());
        Assertions.assertTrue(empty.getGoals().isEmpty());
        Assertions.assertEquals("hi", empty.getTalkToPlayer());
        Assertions.assertEquals("goal_ek30_001", next.getGoals().get(0).getGoalId());
    }

    @Test
    public void shouldSerializeConcurrentPlanningCallsOfOneSession() throws Exception {
        int calls = 16;
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<PlanningResultDTO>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < calls; i++) {
                Callable<PlanningResultDTO> task = () -> stack.planningCommandService.submit(SESSION_ID, SINGLE_GOAL);
                futures.add(executor.submit(task));
            }
            Set<String> goalIds = new HashSet<>();
            for (Future<PlanningResultDTO> future : futures) {
                goalIds.add(future.get(10, TimeUnit.SECONDS).getGoals().get(0).getGoalId());
            }
            Assertions.assertEquals(calls, goalIds.size());
            Assertions.assertTrue(goalIds.contains("goal_ek30_016"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void shouldRejectPlanningForUnknownSession() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> stack.planningCommandService.submit("sess_20250909_163532_zzzz", SINGLE_GOAL));

        Assertions.assertTrue(ex.is(ResponseCode.SESSION_NOT_FOUND));
    }

    @Test
    public void shouldNeverReissueGoalIdsOfClosedSession() {
        PlanningResultDTO first = stack.planningCommandService.submit(SESSION_ID, SINGLE_GOAL);
        Assertions.assertEquals("goal_ek30_001", first.getGoals().get(0).getGoalId());
        stack.sessionCommandService.closeSession(SESSION_ID);

        SessionStartRequestDTO again = new SessionStartRequestDTO();
        again.setSessionId(SESSION_ID);
        AppException reopen = Assertions.assertThrows(AppException.class,
                () -> stack.sessionCommandService.startSession(again));
        AppException planning = Assertions.assertThrows(AppException.class,
                () -> stack.planningCommandService.submit(SESSION_ID, SINGLE_GOAL));

        Assertions.assertTrue(reopen.is(ResponseCode.INVALID_SESSION_FORMAT));
        Assertions.assertTrue(planning.is(ResponseCode.SESSION_NOT_FOUND));
    }
}
