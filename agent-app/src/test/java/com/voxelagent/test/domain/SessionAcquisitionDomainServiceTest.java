package com.voxelagent.test.domain;

import com.voxelagent.domain.identifier.service.IdentifierFormatDomainService;
import com.voxelagent.domain.session.model.entity.PlanningSessionEntity;
import com.voxelagent.domain.session.model.valobj.SessionAcquisition;
import com.voxelagent.domain.session.service.SessionAcquisitionDomainService;
import com.voxelagent.infrastructure.repository.session.PlanningSessionRepositoryImpl;
import com.voxelagent.test.support.SessionTestSupport;
import com.voxelagent.types.enums.ResponseCode;
import com.voxelagent.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

public class SessionAcquisitionDomainServiceTest {

    private PlanningSessionRepositoryImpl repository;
    private SessionAcquisitionDomainService service;

    @BeforeEach
    public void setUp() {
        this.repository = SessionTestSupport.newRepository();
        this.service = new SessionAcquisitionDomainService(new IdentifierFormatDomainService(), repository);
    }

    @Test
    public void shouldMintSessionWhenClientSuppliesNothing() {
        SessionAcquisition acquisition = service.acquire("  ");

        PlanningSessionEntity session = acquisition.session();
        Assertions.assertFalse(acquisition.resumed());
        Assertions.assertFalse(session.isClientSupplied());
        Assertions.assertTrue(session.getSessionId().value().startsWith("sess_"));
        Assertions.assertSame(session, service.requireActive(session.getSessionId().value()));
        Assertions.assertEquals(1L, repository.countActive());
    }

    @Test
    public void shouldAcceptCanonicalClientSessionAndResumeOnSecondCall() {
        SessionAcquisition first = service.acquire("sess_20250909_163532_ek30");
        SessionAcquisition second = service.acquire(" sess_20250909_163532_ek30 ");

        Assertions.assertFalse(first.resumed());
        Assertions.assertTrue(first.session().isClientSupplied());
        Assertions.assertEquals("ek30", first.session().getSessionId().suffix());
        Assertions.assertTrue(second.resumed());
        Assertions.assertSame(first.session(), second.session());
    }

    @Test
    public void shouldRejectNonCanonicalClientSession() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.acquire("my-session"));

        Assertions.assertTrue(ex.is(ResponseCode.INVALID_SESSION_FORMAT));
        Assertions.assertEquals(0L, repository.countActive());
    }

    @Test
    public void shouldFailAfterRepeatedMintCollisions() {
        Clock clock = Clock.fixed(Instant.parse("2025-09-09T16:35:32Z"), ZoneOffset.UTC);
        SessionAcquisitionDomainService colliding = new SessionAcquisitionDomainService(
                new IdentifierFormatDomainService(clock, new Random(), 1, "a"), repository);
        colliding.acquire(null);

        AppException ex = Assertions.assertThrows(AppException.class, () -> colliding.acquire(null));

        Assertions.assertTrue(ex.is(ResponseCode.UN_ERROR));
    }

    @Test
    public void shouldReportClosedSessionAsNotFound() {
        String sessionId = service.acquire(null).session().getSessionId().value();

        Assertions.assertTrue(service.close(sessionId));
        Assertions.assertFalse(service.close(sessionId));

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.requireActive(sessionId));
        Assertions.assertTrue(ex.is(ResponseCode.SESSION_NOT_FOUND));
    }

    @Test
    public void shouldRejectReacquiringClosedSession() {
        service.acquire("sess_20250909_163532_ek30");
        Assertions.assertTrue(service.close("sess_20250909_163532_ek30"));

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.acquire("sess_20250909_163532_ek30"));

        Assertions.assertTrue(ex.is(ResponseCode.INVALID_SESSION_FORMAT));
        Assertions.assertEquals(0L, repository.countActive());
        Assertions.assertEquals("sess_20250909_163532_ek30", repository.findSuffixOwner("ek30"));
    }

    @Test
    public void shouldRejectReacquiringEvictedSession() {
        String sessionId = service.acquire(null).session().getSessionId().value();
        // 淘汰只移除活跃会话，后缀台账不受影响
        repository.deleteById(sessionId);

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.acquire(sessionId));

        Assertions.assertTrue(ex.is(ResponseCode.INVALID_SESSION_FORMAT));
    }

    @Test
    public void shouldRejectClientSessionReusingSuffixOfAnotherSession() {
        service.acquire("sess_20250909_163532_ek30");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.acquire("sess_20250910_080000_ek30"));

        Assertions.assertTrue(ex.is(ResponseCode.INVALID_SESSION_FORMAT));
        Assertions.assertEquals(1L, repository.countActive());
        Assertions.assertEquals("sess_20250909_163532_ek30", repository.findSuffixOwner("ek30"));
    }

    @Test
    public void shouldNotMintSuffixAlreadyClaimedAtAnotherTimestamp() {
        Clock clock = Clock.fixed(Instant.parse("2025-09-10T08:00:00Z"), ZoneOffset.UTC);
        SessionAcquisitionDomainService colliding = new SessionAcquisitionDomainService(
                new IdentifierFormatDomainService(clock, new Random(), 4, "a"), repository);
        colliding.acquire("sess_20250909_163532_aaaa");

        AppException ex = Assertions.assertThrows(AppException.class, () -> colliding.acquire(null));

        Assertions.assertTrue(ex.is(ResponseCode.UN_ERROR));
        Assertions.assertEquals(1L, repository.countActive());
    }
}
