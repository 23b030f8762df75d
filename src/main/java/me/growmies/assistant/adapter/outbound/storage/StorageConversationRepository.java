package me.growmies.assistant.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.Conversation;
import me.growmies.assistant.domain.model.ConversationMessage;
import me.growmies.assistant.domain.model.UserPreferences;
import me.growmies.assistant.port.outbound.ConversationRepositoryPort;
import me.growmies.assistant.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * JSON-file repository on top of {@link StoragePort}.
 *
 * <p>
 * Layout:
 * <ul>
 * <li>{@code conversations/<guild>/<user>/<channel>.json} - active conversation (atomic writes)
 * <li>{@code archive/<guild>/<conversationId>.json} - ended conversations
 * <li>{@code messages/<conversationId>.jsonl} - message log, one JSON per line
 * <li>{@code preferences/<guild>/<user>.json} - preferences (atomic writes)
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageConversationRepository implements ConversationRepositoryPort {

    static final String CONVERSATIONS_DIR = "conversations";
    static final String ARCHIVE_DIR = "archive";
    static final String MESSAGES_DIR = "messages";
    static final String PREFERENCES_DIR = "preferences";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Object messageLogLock = new Object();

    @Override
    public void saveMessage(ConversationMessage message) {
        String line = toJson(message).replace("\n", "") + "\n";
        synchronized (messageLogLock) {
            storagePort.appendText(MESSAGES_DIR, messagesPath(message.getConversationId()), line).join();
        }
    }

    @Override
    public void upsertConversation(Conversation conversation) {
        if (!conversation.isActive()) {
            archiveConversation(conversation);
            return;
        }
        storagePort.putTextAtomic(CONVERSATIONS_DIR, activePath(conversation.getUserId(), conversation.getGuildId(),
                conversation.getChannelId()), toJson(conversation), false).join();
    }

    @Override
    public Optional<Conversation> findActiveConversation(String userId, String guildId, String channelId) {
        String json = storagePort.getText(CONVERSATIONS_DIR, activePath(userId, guildId, channelId)).join();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(fromJson(json, Conversation.class));
    }

    @Override
    public void archiveConversation(Conversation conversation) {
        storagePort.putText(ARCHIVE_DIR, safe(conversation.getGuildId()) + "/" + safe(conversation.getId()) + ".json",
                toJson(conversation)).join();

        String path = activePath(conversation.getUserId(), conversation.getGuildId(), conversation.getChannelId());
        Optional<Conversation> current = findActiveConversation(conversation.getUserId(), conversation.getGuildId(),
                conversation.getChannelId());
        // a newer conversation may already occupy the channel
        if (current.isPresent() && conversation.getId().equals(current.get().getId())) {
            storagePort.deleteObject(CONVERSATIONS_DIR, path).join();
        }
    }

    @Override
    public List<ConversationMessage> getRecentMessages(String conversationId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String content = storagePort.getText(MESSAGES_DIR, messagesPath(conversationId)).join();
        if (content == null || content.isBlank()) {
            return List.of();
        }
        Deque<ConversationMessage> recent = new ArrayDeque<>(limit);
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                recent.addLast(objectMapper.readValue(line, ConversationMessage.class));
                if (recent.size() > limit) {
                    recent.removeFirst();
                }
            } catch (JsonProcessingException e) {
                log.warn("[Storage] Skipping malformed message line in {}: {}", conversationId, e.getMessage());
            }
        }
        return new ArrayList<>(recent);
    }

    @Override
    public UserPreferences getOrCreatePreferences(String userId, String guildId) {
        String json = storagePort.getText(PREFERENCES_DIR, preferencesPath(userId, guildId)).join();
        if (json != null && !json.isBlank()) {
            return fromJson(json, UserPreferences.class);
        }
        Instant now = clock.instant();
        UserPreferences created = UserPreferences.defaults(userId, guildId);
        created.setCreatedAt(now);
        created.setUpdatedAt(now);
        savePreferences(created);
        return created;
    }

    @Override
    public void savePreferences(UserPreferences preferences) {
        storagePort.putTextAtomic(PREFERENCES_DIR, preferencesPath(preferences.getUserId(), preferences.getGuildId()),
                toJson(preferences), false).join();
    }

    static String safe(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be blank");
        }
        return id.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    private static String activePath(String userId, String guildId, String channelId) {
        return safe(guildId) + "/" + safe(userId) + "/" + safe(channelId) + ".json";
    }

    private static String messagesPath(String conversationId) {
        return safe(conversationId) + ".jsonl";
    }

    private static String preferencesPath(String userId, String guildId) {
        return safe(guildId) + "/" + safe(userId) + ".json";
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse " + type.getSimpleName(), e);
        }
    }
}
