package com.voxelagent.test.domain;

import com.voxelagent.domain.identifier.model.valobj.CommandId;
import com.voxelagent.domain.identifier.model.valobj.GoalId;
import com.voxelagent.domain.identifier.model.valobj.PlanId;
import com.voxelagent.domain.identifier.model.valobj.SessionId;
import com.voxelagent.domain.identifier.service.IdentifierFormatDomainService;
import com.voxelagent.types.enums.EntityKindEnum;
import com.voxelagent.types.enums.ResponseCode;
import com.voxelagent.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

public class IdentifierFormatDomainServiceTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-09-09T16:35:32Z"), ZoneOffset.UTC);

    private final IdentifierFormatDomainService formatter =
            new IdentifierFormatDomainService(FIXED_CLOCK, new Random(7L), 4, IdentifierFormatDomainService.DEFAULT_SUFFIX_ALPHABET);

    @Test
    public void shouldMintSessionIdFromClockAndAlphabet() {
        SessionId sessionId = formatter.formatSessionId();

        Assertions.assertTrue(sessionId.value().startsWith("sess_20250909_163532_"));
        Assertions.assertEquals(4, sessionId.suffix().length());
        Assertions.assertTrue(sessionId.value().endsWith("_" + sessionId.suffix()));
        for (char c : sessionId.suffix().toCharArray()) {
            Assertions.assertTrue(IdentifierFormatDomainService.DEFAULT_SUFFIX_ALPHABET.indexOf(c) >= 0);
        }
        Assertions.assertTrue(formatter.isCanonical(sessionId.value(), EntityKindEnum.SESSION));
    }

    @Test
    public void shouldFormatGoalAndPlanDeterministically() {
        SessionId session = formatter.parseSessionId("sess_20250909_163532_ek30");

        GoalId first = formatter.formatGoalId(session, 1);
        GoalId again = formatter.formatGoalId(session, 1);
        GoalId second = formatter.formatGoalId(session, 2);

        Assertions.assertEquals("goal_ek30_001", first.value());
        Assertions.assertEquals(first, again);
        Assertions.assertNotEquals(first.value(), second.value());
        Assertions.assertEquals("plan_001_01", formatter.formatPlanId(1, 1).value());
        Assertions.assertEquals("plan_002_10", formatter.formatPlanId(second, 10).value());
        Assertions.assertNotEquals(formatter.formatPlanId(1, 2).value(), formatter.formatPlanId(2, 1).value());
    }

    @Test
    public void shouldProduceInjectivePlanIds() {
        Set<String> seen = new HashSet<>();
        for (int goal = 1; goal <= 20; goal++) {
            for (int plan = 1; plan <= 20; plan++) {
                Assertions.assertTrue(seen.add(formatter.formatPlanId(goal, plan).value()));
            }
        }
    }

    @Test
    public void shouldEmbedFullPlanIdInCommandId() {
        PlanId plan = formatter.formatPlanId(1, 1);

        CommandId command = formatter.formatCommandId(plan, 1);

        Assertions.assertEquals("cmd_plan_001_01_001", command.value());
        CommandId parsed = formatter.parseCommandId(command.value());
        Assertions.assertEquals(plan, parsed.plan());
        Assertions.assertEquals(1, parsed.sequence());
    }

    @Test
    public void shouldRecognizeOnlyOwnKind() {
        String[][] samples = {
                {"sess_20250909_163532_ek30", "SESSION"},
                {"goal_ek30_001", "GOAL"},
                {"plan_001_02", "PLAN"},
                {"cmd_plan_001_02_003", "COMMAND"}
        };
        for (String[] sample : samples) {
            EntityKindEnum own = EntityKindEnum.valueOf(sample[1]);
            for (EntityKindEnum kind : EntityKindEnum.values()) {
                Assertions.assertEquals(kind == own, formatter.isCanonical(sample[0], kind),
                        sample[0] + " as " + kind);
            }
        }
    }

    @Test
    public void shouldRejectMalformedCandidates() {
        Assertions.assertFalse(formatter.isCanonical(null, EntityKindEnum.SESSION));
        Assertions.assertFalse(formatter.isCanonical("sess_20250909_163532_EK30", EntityKindEnum.SESSION));
        Assertions.assertFalse(formatter.isCanonical("sess_20250909_163532_ek3", EntityKindEnum.SESSION));
        Assertions.assertFalse(formatter.isCanonical("goal_ek30_000", EntityKindEnum.GOAL));
        Assertions.assertFalse(formatter.isCanonical("plan_001_00", EntityKindEnum.PLAN));
        Assertions.assertFalse(formatter.isCanonical("plan_1_1", EntityKindEnum.PLAN));
        Assertions.assertFalse(formatter.isCanonical("cmd_plan_001_01_000", EntityKindEnum.COMMAND));
        Assertions.assertFalse(formatter.isCanonical(" plan_001_01", EntityKindEnum.PLAN));
    }

    @Test
    public void shouldAcceptAnyLowercaseAlphanumericSuffixOnValidation() {
        Assertions.assertTrue(formatter.isCanonical("sess_20250909_163532_0l1o", EntityKindEnum.SESSION));
    }

    @Test
    public void shouldFailWithInvalidSequenceOnOverflowOrNonPositive() {
        SessionId session = formatter.parseSessionId("sess_20250909_163532_ek30");
        PlanId plan = formatter.formatPlanId(1, 1);

        assertInvalidSequence(() -> formatter.formatGoalId(session, 0));
        assertInvalidSequence(() -> formatter.formatGoalId(session, 1000));
        assertInvalidSequence(() -> formatter.formatPlanId(1, 100));
        assertInvalidSequence(() -> formatter.formatPlanId(-1, 1));
        assertInvalidSequence(() -> formatter.formatCommandId(plan, 1000));
        Assertions.assertEquals("goal_ek30_999", formatter.formatGoalId(session, 999).value());
        Assertions.assertEquals("cmd_plan_001_01_999", formatter.formatCommandId(plan, 999).value());
    }

    @Test
    public void shouldRaiseInvalidSessionFormatWhenParsingForeignSession() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> formatter.parseSessionId("session-42"));
        Assertions.assertTrue(ex.is(ResponseCode.INVALID_SESSION_FORMAT));

        AppException planEx = Assertions.assertThrows(AppException.class,
                () -> formatter.parsePlanId("step-1"));
        Assertions.assertTrue(planEx.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    @Test
    public void shouldHonorDocumentedPlanAndParseContracts() {
        GoalId goal = formatter.parseGoalId("goal_ek30_002");
        Assertions.assertEquals(formatter.formatPlanId(2, 3), formatter.formatPlanId(goal, 3));
        Assertions.assertThrows(IllegalArgumentException.class, () -> formatter.formatPlanId((GoalId) null, 1));

        AppException zero = Assertions.assertThrows(AppException.class, () -> formatter.parseGoalId("goal_ek30_000"));
        Assertions.assertTrue(zero.is(ResponseCode.ILLEGAL_PARAMETER));

        CommandId command = formatter.parseCommandId("cmd_plan_002_03_007");
        Assertions.assertEquals("plan_002_03", command.plan().value());
        Assertions.assertEquals(7, command.sequence());
    }

    @Test
    public void shouldRejectInvalidConstruction() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new IdentifierFormatDomainService(FIXED_CLOCK, new Random(), 0, "abc"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new IdentifierFormatDomainService(FIXED_CLOCK, new Random(), 4, "ABC"));
    }

    private void assertInvalidSequence(Runnable action) {
        AppException ex = Assertions.assertThrows(AppException.class, action::run);
        Assertions.assertEquals(ResponseCode.INVALID_SEQUENCE.getCode(), ex.getCode());
    }
}
