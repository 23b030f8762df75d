package me.growmies.assistant.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compliance audit record handed to the audit sink.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {

    public static final String CHAT_INTERACTION = "ai_chat_interaction";
    public static final String CHAT_ERROR = "ai_chat_error";
    public static final String CONVERSATION_CLEARED = "ai_conversation_cleared";
    public static final String PREFERENCES_UPDATED = "ai_preferences_updated";
    public static final String RESTRICTED_CONTENT_ESCALATED = "ai_restricted_content_escalated";

    public static final String SEVERITY_LOW = "low";
    public static final String SEVERITY_MEDIUM = "medium";
    public static final String SEVERITY_HIGH = "high";

    private String type;
    private String userId;
    private String guildId;
    private String channelId;

    @Builder.Default
    private String severity = SEVERITY_LOW;

    private Instant timestamp;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();
}
