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

import java.util.Objects;

/**
 * Composite key of an in-memory session: one session per user per channel.
 */
public record SessionKey(String userId, String channelId) {

    public SessionKey {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(channelId, "channelId");
    }

    public static SessionKey of(String userId, String channelId) {
        return new SessionKey(userId, channelId);
    }

    @Override
    public String toString() {
        return userId + ":" + channelId;
    }
}
