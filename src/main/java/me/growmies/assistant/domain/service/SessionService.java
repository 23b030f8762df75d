package me.growmies.assistant.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.ChatSession;
import me.growmies.assistant.domain.model.SessionKey;
import me.growmies.assistant.domain.model.Turn;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.port.outbound.SessionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory, time- and turn-bounded session store keyed by (user, channel).
 *
 * <p>
 * Each key owns a slot with its own {@link ReentrantLock}; there is no global
 * lock. All reads and writes of a session happen under its slot lock, which
 * makes turn ordering and compaction linearizable per key. A slot removed by
 * {@link #clear} or {@link #evictExpired} is marked retired so that a caller
 * that raced with the removal retries on a fresh slot.
 *
 * <p>
 * Expiry is decided on every access; the background sweep only reclaims
 * memory of abandoned sessions.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService implements SessionPort {

    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final AssistantProperties properties;
    private final Clock clock;

    private final Map<SessionKey, SessionSlot> slots = new ConcurrentHashMap<>();

    private final ScheduledExecutorService sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "session-sweep");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        long intervalMs = properties.getSession().getSweepInterval().toMillis();
        sweepExecutor.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void destroy() {
        sweepExecutor.shutdownNow();
        try {
            sweepExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ChatSession getOrCreate(String userId, String channelId) {
        SessionKey key = SessionKey.of(userId, channelId);
        return withSlot(key, slot -> liveSession(key, slot).copy());
    }

    @Override
    public ChatSession append(SessionKey key, String role, String content) {
        return withSlot(key, slot -> {
            ChatSession session = liveSession(key, slot);
            Instant now = clock.instant();
            session.getTurns().add(Turn.builder()
                    .role(role)
                    .content(content)
                    .timestamp(now)
                    .build());
            if (Turn.ROLE_USER.equals(role)) {
                session.setTurnCount(session.getTurnCount() + 1);
            }
            enforceBounds(session);
            session.setLastActivityAt(now);
            return session.copy();
        });
    }

    @Override
    public Optional<ChatSession> find(SessionKey key) {
        SessionSlot slot = slots.get(key);
        if (slot == null) {
            return Optional.empty();
        }
        slot.lock.lock();
        try {
            if (slot.retired || slot.session == null || isExpired(slot.session, clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(slot.session.copy());
        } finally {
            slot.lock.unlock();
        }
    }

    @Override
    public boolean clear(SessionKey key) {
        SessionSlot slot = slots.get(key);
        if (slot == null) {
            return false;
        }
        slot.lock.lock();
        try {
            if (slot.retired) {
                return false;
            }
            slot.retired = true;
            slots.remove(key, slot);
            log.debug("[Session] Cleared session {}", key);
            return slot.session != null && !slot.session.getTurns().isEmpty();
        } finally {
            slot.lock.unlock();
        }
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;
        for (Map.Entry<SessionKey, SessionSlot> entry : slots.entrySet()) {
            SessionSlot slot = entry.getValue();
            // a busy slot is in use right now, so it cannot be idle
            if (!slot.lock.tryLock()) {
                continue;
            }
            try {
                if (!slot.retired && (slot.session == null || isExpired(slot.session, now))) {
                    slot.retired = true;
                    slots.remove(entry.getKey(), slot);
                    evicted++;
                }
            } finally {
                slot.lock.unlock();
            }
        }
        if (evicted > 0) {
            log.debug("[Session] Evicted {} expired sessions, {} active", evicted, slots.size());
        }
        return evicted;
    }

    @Override
    public int getMaxTurns() {
        return properties.getSession().getMaxTurns();
    }

    @Override
    public long secondsRemaining(ChatSession session) {
        Duration idle = Duration.between(session.getLastActivityAt(), clock.instant());
        long remaining = properties.getSession().getTimeout().minus(idle).getSeconds();
        return Math.max(0, remaining);
    }

    int size() {
        return slots.size();
    }

    private void sweep() {
        try {
            evictExpired();
        } catch (RuntimeException e) { // NOSONAR - keep the scheduler alive
            log.warn("[Session] Sweep failed: {}", e.getMessage());
        }
    }

    private <T> T withSlot(SessionKey key, Function<SessionSlot, T> action) {
        while (true) {
            SessionSlot slot = slots.computeIfAbsent(key, k -> new SessionSlot());
            slot.lock.lock();
            try {
                if (slot.retired) {
                    continue;
                }
                return action.apply(slot);
            } finally {
                slot.lock.unlock();
            }
        }
    }

    /**
     * Must be called with the slot lock held.
     */
    private ChatSession liveSession(SessionKey key, SessionSlot slot) {
        Instant now = clock.instant();
        if (slot.session != null && !isExpired(slot.session, now)) {
            return slot.session;
        }
        if (slot.session != null) {
            log.debug("[Session] Session {} expired, starting fresh", key);
        }
        slot.session = ChatSession.builder()
                .key(key)
                .turns(new ArrayList<>())
                .turnCount(0)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
        return slot.session;
    }

    private boolean isExpired(ChatSession session, Instant now) {
        Duration idle = Duration.between(session.getLastActivityAt(), now);
        return idle.compareTo(properties.getSession().getTimeout()) > 0;
    }

    private void enforceBounds(ChatSession session) {
        int maxTurns = properties.getSession().getMaxTurns();
        int retain = Math.max(1, Math.min(properties.getSession().getRetainTurns(), maxTurns));
        List<Turn> turns = session.getTurns();

        if (session.getTurnCount() > maxTurns) {
            int start = indexOfNthLastUserTurn(turns, retain);
            List<Turn> window = new ArrayList<>(turns.subList(start, turns.size()));
            turns.clear();
            turns.addAll(window);
            session.setTurnCount(retain);
            log.debug("[Session] Compacted {} to the last {} exchanges", session.getKey(), retain);
        }

        // Assistant-only appends never move the counter, so cap the list too
        int maxListSize = maxTurns * 2;
        if (turns.size() > maxListSize) {
            turns.subList(0, turns.size() - maxListSize).clear();
            session.setTurnCount((int) turns.stream().filter(Turn::isUser).count());
        }
    }

    private int indexOfNthLastUserTurn(List<Turn> turns, int n) {
        int seen = 0;
        for (int i = turns.size() - 1; i >= 0; i--) {
            if (turns.get(i).isUser()) {
                seen++;
                if (seen == n) {
                    return i;
                }
            }
        }
        return 0;
    }

    private static final class SessionSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private ChatSession session;
        private boolean retired;
    }
}
