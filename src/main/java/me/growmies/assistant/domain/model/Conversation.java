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

/**
 * Durable record of an ongoing exchange between a user and the assistant in
 * one channel.
 *
 * <p>
 * A conversation is created lazily on the first message, updated on every
 * exchange and archived (never deleted) when the user clears it, when it idles
 * out or when it exceeds the configured message/token/age caps. It also carries
 * the backend selection state and the provider-side thread handle.
 *
 * @since 1.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {

    private String id;
    private String userId;
    private String guildId;
    private String channelId;

    @Builder.Default
    private ConversationCategory category = ConversationCategory.GENERAL;

    private boolean ageGated;

    private int messageCount;
    private long totalTokens;

    private Instant startedAt;
    private Instant lastActivityAt;
    private Instant endedAt;
    private String endReason;

    @Builder.Default
    private boolean active = true;

    /** Provider-side thread id, present only while in thread mode. */
    private String threadId;

    @Builder.Default
    private BackendState backendState = BackendState.NO_BACKEND_CHOSEN;

    /**
     * Restricted categories are always age-gated, whatever the stored flag says.
     */
    public boolean isAgeGated() {
        return ageGated || (category != null && category.isRestricted());
    }
}
