package me.growmies.assistant.domain.service;

import me.growmies.assistant.domain.model.ChatSession;
import me.growmies.assistant.domain.model.SessionKey;
import me.growmies.assistant.domain.model.Turn;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class SessionServiceTest {

    private static final SessionKey KEY = SessionKey.of("user1", "channel1");

    private AssistantProperties properties;
    private MutableClock clock;
    private SessionService service;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
        properties.getSession().setMaxTurns(10);
        properties.getSession().setRetainTurns(5);
        properties.getSession().setTimeout(Duration.ofMinutes(10));
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        service = new SessionService(properties, clock);
    }

    // ==================== bounds ====================

    @Test
    void compactsToRetainedExchangesWhenMaxTurnsExceeded() {
        for (int i = 0; i < 11; i++) {
            service.append(KEY, Turn.ROLE_USER, "question " + i);
            service.append(KEY, Turn.ROLE_ASSISTANT, "answer " + i);
        }

        ChatSession session = service.find(KEY).orElseThrow();
        assertEquals(5, session.getTurnCount());
        assertEquals(10, session.getTurns().size());
        assertEquals("question 6", session.getTurns().get(0).getContent());
        assertEquals("answer 10", session.getTurns().get(9).getContent());
    }

    @Test
    void turnCountNeverExceedsMaxTurns() {
        for (int i = 0; i < 40; i++) {
            ChatSession session = service.append(KEY, Turn.ROLE_USER, "message " + i);
            assertTrue(session.getTurnCount() <= 10);
        }
    }

    @Test
    void assistantOnlyAppendsAreCapped() {
        for (int i = 0; i < 30; i++) {
            service.append(KEY, Turn.ROLE_ASSISTANT, "note " + i);
        }

        ChatSession session = service.find(KEY).orElseThrow();
        assertEquals(20, session.getTurns().size());
        assertEquals(0, session.getTurnCount());
    }

    @Test
    void returnedSessionIsASnapshot() {
        ChatSession snapshot = service.append(KEY, Turn.ROLE_USER, "hello");
        snapshot.getTurns().clear();

        assertEquals(1, service.find(KEY).orElseThrow().getTurns().size());
    }

    // ==================== expiry ====================

    @Test
    void expiredSessionIsReplacedWithAFreshOne() {
        service.append(KEY, Turn.ROLE_USER, "hello");
        clock.advance(Duration.ofMinutes(11));

        assertTrue(service.find(KEY).isEmpty());
        ChatSession fresh = service.getOrCreate("user1", "channel1");
        assertTrue(fresh.getTurns().isEmpty());
        assertEquals(0, fresh.getTurnCount());
        assertEquals(clock.instant(), fresh.getCreatedAt());
    }

    @Test
    void activityExtendsTheSession() {
        service.append(KEY, Turn.ROLE_USER, "hello");
        clock.advance(Duration.ofMinutes(8));
        service.append(KEY, Turn.ROLE_USER, "still here");
        clock.advance(Duration.ofMinutes(8));

        ChatSession session = service.find(KEY).orElseThrow();
        assertEquals(2, session.getTurns().size());
        assertEquals(120, service.secondsRemaining(session));
    }

    @Test
    void evictExpiredRemovesOnlyIdleSessions() {
        service.append(KEY, Turn.ROLE_USER, "old");
        clock.advance(Duration.ofMinutes(9));
        service.append(SessionKey.of("user2", "channel1"), Turn.ROLE_USER, "new");
        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, service.evictExpired());
        assertEquals(1, service.size());
        assertTrue(service.find(SessionKey.of("user2", "channel1")).isPresent());
    }

    @Test
    void secondsRemainingNeverNegative() {
        ChatSession session = service.append(KEY, Turn.ROLE_USER, "hello");
        clock.advance(Duration.ofHours(1));

        assertEquals(0, service.secondsRemaining(session));
    }

    // ==================== clear ====================

    @Test
    void clearReportsWhetherTurnsExisted() {
        assertFalse(service.clear(KEY));

        service.append(KEY, Turn.ROLE_USER, "hello");
        assertTrue(service.clear(KEY));
        assertTrue(service.find(KEY).isEmpty());
        assertFalse(service.clear(KEY));
    }

    @Test
    void sessionsAreIsolatedPerChannel() {
        service.append(KEY, Turn.ROLE_USER, "in channel 1");
        service.append(SessionKey.of("user1", "channel2"), Turn.ROLE_USER, "in channel 2");

        service.clear(KEY);

        assertEquals("in channel 2",
                service.find(SessionKey.of("user1", "channel2")).orElseThrow().getTurns().get(0).getContent());
    }

    // ==================== concurrency ====================

    @Test
    void concurrentAppendsAreNotLost() throws Exception {
        properties.getSession().setMaxTurns(1000);
        properties.getSession().setRetainTurns(500);
        int threads = 8;
        int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        service.append(KEY, Turn.ROLE_USER, "m");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        ChatSession session = service.find(KEY).orElseThrow();
        assertEquals(threads * perThread, session.getTurns().size());
        assertEquals(threads * perThread, session.getTurnCount());
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
