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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.BackendState;
import me.growmies.assistant.domain.model.Conversation;
import me.growmies.assistant.domain.model.ConversationCategory;
import me.growmies.assistant.domain.model.ConversationMessage;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.port.outbound.ConversationRepositoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle of durable conversations: lazy creation, counters, archiving.
 *
 * <p>
 * Writes on the response path are best effort. A failing repository is logged
 * and the in-memory conversation keeps serving the request.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    public static final String END_REASON_USER_CLEARED = "user_cleared";
    public static final String END_REASON_IDLE = "idle_timeout";
    public static final String END_REASON_LIMIT = "limit_reached";

    private static final int LOCK_STRIPES = 64;

    private final ConversationRepositoryPort repository;
    private final AssistantProperties properties;
    private final Clock clock;

    private final Object[] creationLocks = createLocks();

    /**
     * Returns the active conversation of the channel, archiving it first when it
     * idled out or passed a cap. A restricted category upgrades a general
     * conversation; a general request never downgrades a restricted one.
     */
    public Conversation getOrCreateActive(String userId, String guildId, String channelId,
            ConversationCategory category) {
        synchronized (lockFor(userId, guildId, channelId)) {
            Instant now = clock.instant();
            Optional<Conversation> existing = findActive(userId, guildId, channelId);
            if (existing.isPresent()) {
                Conversation conversation = existing.get();
                if (isIdle(conversation, now)) {
                    archive(conversation, END_REASON_IDLE);
                } else if (exceedsCaps(conversation, now)) {
                    archive(conversation, END_REASON_LIMIT);
                } else {
                    if (category.isRestricted() && conversation.getCategory() != category) {
                        conversation.setCategory(category);
                        conversation.setAgeGated(true);
                    }
                    return conversation;
                }
            }

            Conversation created = Conversation.builder()
                    .id(UUID.randomUUID().toString())
                    .userId(userId)
                    .guildId(guildId)
                    .channelId(channelId)
                    .category(category)
                    .ageGated(category.isRestricted())
                    .startedAt(now)
                    .lastActivityAt(now)
                    .build();
            save(created);
            log.debug("[Conversation] Started {} ({}) for user {}", created.getId(), category.getCode(), userId);
            return created;
        }
    }

    public Optional<Conversation> findActive(String userId, String guildId, String channelId) {
        try {
            return repository.findActiveConversation(userId, guildId, channelId)
                    .filter(Conversation::isActive);
        } catch (RuntimeException e) { // NOSONAR - persistence is best effort
            log.warn("[Conversation] Failed to load active conversation: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Adds the counters of a completed exchange and archives the conversation
     * once it passes a cap.
     *
     * <p>
     * The increment is applied to the stored record under the channel lock, so
     * overlapping exchanges in one channel never lose counts. State carried by
     * {@code conversation} (category upgrade, age gate, backend state) is merged
     * into the stored record, and the resulting counters are copied back.
     */
    public void recordExchange(Conversation conversation, int messages, long tokens) {
        synchronized (lockFor(conversation.getUserId(), conversation.getGuildId(), conversation.getChannelId())) {
            Instant now = clock.instant();
            Conversation target = storedCopyOf(conversation);
            if (target == null) {
                return;
            }
            target.setMessageCount(target.getMessageCount() + messages);
            target.setTotalTokens(target.getTotalTokens() + tokens);
            target.setLastActivityAt(now);
            if (exceedsCaps(target, now)) {
                log.info("[Conversation] {} reached its limits ({} messages, {} tokens), archiving",
                        target.getId(), target.getMessageCount(), target.getTotalTokens());
                archive(target, END_REASON_LIMIT);
            } else {
                save(target);
            }
            copyCounters(target, conversation);
        }
    }

    /**
     * Persists the state changes of a failed exchange without touching the
     * counters.
     */
    public void saveState(Conversation conversation) {
        synchronized (lockFor(conversation.getUserId(), conversation.getGuildId(), conversation.getChannelId())) {
            Conversation target = storedCopyOf(conversation);
            if (target != null) {
                save(target);
                copyCounters(target, conversation);
            }
        }
    }

    /**
     * The stored record of {@code conversation} with the request's state merged
     * in, {@code conversation} itself when nothing is stored, or null when the
     * channel has moved on to another conversation.
     */
    private Conversation storedCopyOf(Conversation conversation) {
        Optional<Conversation> stored = findActive(conversation.getUserId(), conversation.getGuildId(),
                conversation.getChannelId());
        if (stored.isEmpty()) {
            return conversation;
        }
        Conversation target = stored.get();
        if (!target.getId().equals(conversation.getId())) {
            log.debug("[Conversation] {} was replaced by {}, counters not recorded", conversation.getId(),
                    target.getId());
            return null;
        }
        if (conversation.getCategory().isRestricted() && target.getCategory() != conversation.getCategory()) {
            target.setCategory(conversation.getCategory());
        }
        target.setAgeGated(target.isAgeGated() || conversation.isAgeGated());
        mergeBackendState(conversation, target);
        return target;
    }

    private static void mergeBackendState(Conversation source, Conversation target) {
        if (target.getBackendState() == BackendState.CHAT_ACTIVE) {
            target.setThreadId(null);
            return;
        }
        if (source.getBackendState() == BackendState.CHAT_ACTIVE
                || source.getBackendState() == BackendState.THREAD_FAILED) {
            target.setBackendState(BackendState.CHAT_ACTIVE);
            target.setThreadId(null);
        } else if (source.getBackendState() == BackendState.THREAD_ACTIVE && source.getThreadId() != null) {
            target.setBackendState(BackendState.THREAD_ACTIVE);
            target.setThreadId(source.getThreadId());
        }
    }

    private static void copyCounters(Conversation from, Conversation to) {
        if (from == to) {
            return;
        }
        to.setMessageCount(from.getMessageCount());
        to.setTotalTokens(from.getTotalTokens());
        to.setLastActivityAt(from.getLastActivityAt());
        to.setActive(from.isActive());
        to.setEndedAt(from.getEndedAt());
        to.setEndReason(from.getEndReason());
        to.setBackendState(from.getBackendState());
        to.setThreadId(from.getThreadId());
    }

    public void logMessage(ConversationMessage message) {
        try {
            repository.saveMessage(message);
        } catch (RuntimeException e) { // NOSONAR - persistence is best effort
            log.warn("[Conversation] Failed to log {} message for {}: {}", message.getRole(),
                    message.getConversationId(), e.getMessage());
        }
    }

    /**
     * Latest persisted messages of a conversation, oldest first. Empty when the
     * log cannot be read.
     */
    public List<ConversationMessage> recentMessages(String conversationId, int limit) {
        try {
            List<ConversationMessage> messages = repository.getRecentMessages(conversationId, limit);
            return messages != null ? messages : List.of();
        } catch (RuntimeException e) { // NOSONAR - history is best effort
            log.warn("[Conversation] Failed to read messages of {}: {}", conversationId, e.getMessage());
            return List.of();
        }
    }

    private void save(Conversation conversation) {
        try {
            repository.upsertConversation(conversation);
        } catch (RuntimeException e) { // NOSONAR - persistence is best effort
            log.warn("[Conversation] Failed to save {}: {}", conversation.getId(), e.getMessage());
        }
    }

    /**
     * Archives the active conversation of a channel.
     *
     * @return true if a conversation was archived
     */
    public boolean archiveActive(String userId, String guildId, String channelId, String reason) {
        synchronized (lockFor(userId, guildId, channelId)) {
            Optional<Conversation> active = findActive(userId, guildId, channelId);
            active.ifPresent(conversation -> archive(conversation, reason));
            return active.isPresent();
        }
    }

    private void archive(Conversation conversation, String reason) {
        conversation.setActive(false);
        conversation.setEndedAt(clock.instant());
        conversation.setEndReason(reason);
        try {
            repository.archiveConversation(conversation);
            log.debug("[Conversation] Archived {} ({})", conversation.getId(), reason);
        } catch (RuntimeException e) { // NOSONAR - persistence is best effort
            log.warn("[Conversation] Failed to archive {}: {}", conversation.getId(), e.getMessage());
        }
    }

    private boolean isIdle(Conversation conversation, Instant now) {
        Instant last = conversation.getLastActivityAt() != null
                ? conversation.getLastActivityAt()
                : conversation.getStartedAt();
        return last != null
                && Duration.between(last, now).compareTo(properties.getConversation().getIdleTimeout()) > 0;
    }

    private boolean exceedsCaps(Conversation conversation, Instant now) {
        AssistantProperties.ConversationProperties caps = properties.getConversation();
        boolean tooOld = conversation.getStartedAt() != null
                && Duration.between(conversation.getStartedAt(), now).compareTo(caps.getMaxAge()) > 0;
        return conversation.getMessageCount() > caps.getMaxMessages()
                || conversation.getTotalTokens() > caps.getMaxTokens()
                || tooOld;
    }

    private Object lockFor(String userId, String guildId, String channelId) {
        int hash = (userId + '|' + guildId + '|' + channelId).hashCode();
        return creationLocks[Math.floorMod(hash, LOCK_STRIPES)];
    }

    private static Object[] createLocks() {
        Object[] locks = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
        return locks;
    }
}
