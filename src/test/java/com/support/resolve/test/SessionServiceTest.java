package com.support.resolve.test;

import com.support.resolve.model.ChatSession;
import com.support.resolve.service.impl.SessionServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

public class SessionServiceTest {

    private SessionServiceImpl sessionService;

    @BeforeEach
    public void setUp() {
        sessionService = new SessionServiceImpl();
    }

    @Test
    public void startSessionShouldStoreIdentity() {
        ChatSession session = sessionService.startSession(" Jane ", " jane@example.com ");

        assertEquals("Jane", session.getCustomerName());
        assertEquals("jane@example.com", session.getEmail());
        assertSame(session, sessionService.getSession(session.getSessionId()));
        assertEquals(1, sessionService.getActiveSessionCount());
    }

    @Test
    public void startSessionShouldRejectInvalidEmail() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> sessionService.startSession("Jane", "jane-at-example"));
        assertEquals("Please enter a valid email address", e.getMessage());
        assertEquals(0, sessionService.getActiveSessionCount());
    }

    @Test
    public void firstTurnIsReportedOnce() {
        ChatSession session = sessionService.startSession("Jane", "jane@example.com");
        assertTrue(session.beginTurn());
        assertFalse(session.beginTurn());
        assertEquals(2, session.getTurnCount());
    }

    @Test
    public void endSessionShouldRemove() {
        ChatSession session = sessionService.startSession("Jane", "jane@example.com");

        assertTrue(sessionService.endSession(session.getSessionId()));
        assertFalse(sessionService.endSession(session.getSessionId()));
        assertNull(sessionService.getSession(session.getSessionId()));
        assertNull(sessionService.getSession(null));
    }

    @Test
    public void expiredSessionsAreCleaned() throws InterruptedException {
        ReflectionTestUtils.setField(sessionService, "sessionTimeoutMinutes", 0);
        sessionService.startSession("Jane", "jane@example.com");
        Thread.sleep(5);

        sessionService.cleanExpiredSessions();
        assertEquals(0, sessionService.getActiveSessionCount());
    }

    @Test
    public void expiredSessionIsNoLongerReturned() throws InterruptedException {
        ReflectionTestUtils.setField(sessionService, "sessionTimeoutMinutes", 0);
        ChatSession session = sessionService.startSession("Jane", "jane@example.com");
        Thread.sleep(20);

        assertNull(sessionService.getSession(session.getSessionId()));
        assertFalse(sessionService.endSession(session.getSessionId()));
    }

    @Test
    public void startSessionPurgesExpiredSessions() throws InterruptedException {
        ReflectionTestUtils.setField(sessionService, "sessionTimeoutMinutes", 0);
        ChatSession stale = sessionService.startSession("Jane", "jane@example.com");
        Thread.sleep(20);

        ChatSession fresh = sessionService.startSession("Bob", "bob@example.com");
        ReflectionTestUtils.setField(sessionService, "sessionTimeoutMinutes", 30);

        assertNull(sessionService.getSession(stale.getSessionId()));
        assertSame(fresh, sessionService.getSession(fresh.getSessionId()));
        assertEquals(1, sessionService.getActiveSessionCount());
    }

    @Test
    public void emailValidation() {
        assertTrue(sessionService.isValidEmail("john.doe+tag@mail.example.co"));
        assertFalse(sessionService.isValidEmail(""));
        assertFalse(sessionService.isValidEmail(null));
        assertFalse(sessionService.isValidEmail("no at sign"));
    }
}
