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

import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.AuditEvent;
import me.growmies.assistant.domain.model.ContentFilterLevel;
import me.growmies.assistant.domain.model.PreferencesUpdate;
import me.growmies.assistant.domain.model.ResponseStyle;
import me.growmies.assistant.domain.model.UserPreferences;
import me.growmies.assistant.port.outbound.AuditPort;
import me.growmies.assistant.port.outbound.ConversationRepositoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per (user, guild) preferences with validation on write.
 *
 * <p>
 * Preferences are cached after the first load. A failed write rolls the cache
 * back to the previous value and throws {@link IllegalStateException}; invalid
 * input throws {@link IllegalArgumentException} before anything is changed.
 */
@Service
@Slf4j
public class UserPreferencesService {

    private final ConversationRepositoryPort repository;
    private final AuditPort auditPort;
    private final Clock clock;

    private final Map<String, UserPreferences> cache = new ConcurrentHashMap<>();

    public UserPreferencesService(ConversationRepositoryPort repository, AuditPort auditPort, Clock clock) {
        this.repository = repository;
        this.auditPort = auditPort;
        this.clock = clock;
    }

    /**
     * Get preferences, creating defaults on first use. Falls back to uncached
     * defaults when the repository is unavailable.
     */
    public UserPreferences getPreferences(String userId, String guildId) {
        String key = cacheKey(userId, guildId);
        UserPreferences cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        try {
            UserPreferences loaded = repository.getOrCreatePreferences(userId, guildId);
            cache.putIfAbsent(key, loaded);
            return cache.get(key);
        } catch (RuntimeException e) { // NOSONAR - defaults keep the conversation path alive
            log.warn("[Preferences] Failed to load preferences for {}, using defaults: {}", userId, e.getMessage());
            return UserPreferences.defaults(userId, guildId);
        }
    }

    /**
     * Validate and apply a partial update.
     *
     * @throws IllegalArgumentException
     *             if any field is invalid
     * @throws IllegalStateException
     *             if persistence fails (cache is rolled back)
     */
    public UserPreferences update(String userId, String guildId, PreferencesUpdate update) {
        UserPreferences current = getPreferences(userId, guildId);
        UserPreferences updated = applyValidated(current, update);
        updated.setUpdatedAt(clock.instant());
        persist(userId, guildId, current, updated);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("changedFields", changedFields(update));
        auditPort.record(AuditEvent.builder()
                .type(AuditEvent.PREFERENCES_UPDATED)
                .userId(userId)
                .guildId(guildId)
                .timestamp(clock.instant())
                .details(details)
                .build());
        log.info("[Preferences] Updated preferences for user {} in guild {}", userId, guildId);
        return updated;
    }

    /**
     * Restore defaults, keeping the creation time.
     */
    public UserPreferences reset(String userId, String guildId) {
        UserPreferences current = getPreferences(userId, guildId);
        UserPreferences defaults = UserPreferences.defaults(userId, guildId);
        defaults.setCreatedAt(current.getCreatedAt());
        defaults.setUpdatedAt(clock.instant());
        persist(userId, guildId, current, defaults);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reset", true);
        auditPort.record(AuditEvent.builder()
                .type(AuditEvent.PREFERENCES_UPDATED)
                .userId(userId)
                .guildId(guildId)
                .timestamp(clock.instant())
                .details(details)
                .build());
        return defaults;
    }

    private void persist(String userId, String guildId, UserPreferences previous, UserPreferences next) {
        String key = cacheKey(userId, guildId);
        cache.put(key, next);
        try {
            repository.savePreferences(next);
        } catch (RuntimeException e) {
            cache.put(key, previous);
            log.error("[Preferences] Failed to save preferences, rolled back to previous state", e);
            throw new IllegalStateException("Failed to persist preferences", e);
        }
    }

    private UserPreferences applyValidated(UserPreferences current, PreferencesUpdate update) {
        if (update == null) {
            throw new IllegalArgumentException("Preferences update is required");
        }
        List<String> errors = new ArrayList<>();
        UserPreferences.UserPreferencesBuilder builder = current.toBuilder();

        if (update.getResponseStyle() != null) {
            Optional<ResponseStyle> style = ResponseStyle.fromCode(update.getResponseStyle());
            if (style.isPresent()) {
                builder.responseStyle(style.get());
            } else {
                errors.add("responseStyle must be one of casual, educational, conversational, technical");
            }
        }
        if (update.getContentFilterLevel() != null) {
            Optional<ContentFilterLevel> level = ContentFilterLevel.fromCode(update.getContentFilterLevel());
            if (level.isPresent()) {
                builder.contentFilterLevel(level.get());
            } else {
                errors.add("contentFilterLevel must be one of strict, moderate, minimal");
            }
        }
        if (update.getMaxResponseLength() != null) {
            int length = update.getMaxResponseLength();
            if (length < UserPreferences.MIN_RESPONSE_LENGTH || length > UserPreferences.MAX_RESPONSE_LENGTH) {
                errors.add("maxResponseLength must be between " + UserPreferences.MIN_RESPONSE_LENGTH + " and "
                        + UserPreferences.MAX_RESPONSE_LENGTH);
            } else {
                builder.maxResponseLength(length);
            }
        }
        if (update.getRestrictedAssistanceEnabled() != null) {
            builder.restrictedAssistanceEnabled(update.getRestrictedAssistanceEnabled());
        }
        if (update.getConversationHistoryEnabled() != null) {
            builder.conversationHistoryEnabled(update.getConversationHistoryEnabled());
        }
        if (update.getApiKey() != null) {
            String apiKey = update.getApiKey().trim();
            if (apiKey.isEmpty()) {
                builder.apiKey(null);
            } else if (apiKey.chars().anyMatch(Character::isWhitespace)) {
                errors.add("apiKey must not contain whitespace");
            } else {
                builder.apiKey(apiKey);
            }
        }
        if (update.getUseOwnApiKey() != null) {
            builder.useOwnApiKey(update.getUseOwnApiKey());
        }

        UserPreferences result = builder.build();
        if (result.isUseOwnApiKey() && (result.getApiKey() == null || result.getApiKey().isBlank())) {
            errors.add("apiKey is required when useOwnApiKey is enabled");
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", errors));
        }
        return result;
    }

    private List<String> changedFields(PreferencesUpdate update) {
        List<String> fields = new ArrayList<>();
        if (update.getRestrictedAssistanceEnabled() != null) {
            fields.add("restrictedAssistanceEnabled");
        }
        if (update.getResponseStyle() != null) {
            fields.add("responseStyle");
        }
        if (update.getMaxResponseLength() != null) {
            fields.add("maxResponseLength");
        }
        if (update.getContentFilterLevel() != null) {
            fields.add("contentFilterLevel");
        }
        if (update.getConversationHistoryEnabled() != null) {
            fields.add("conversationHistoryEnabled");
        }
        if (update.getUseOwnApiKey() != null) {
            fields.add("useOwnApiKey");
        }
        if (update.getApiKey() != null) {
            fields.add("apiKey");
        }
        return fields;
    }

    private static String cacheKey(String userId, String guildId) {
        return guildId + ":" + userId;
    }
}
