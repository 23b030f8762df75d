package me.growmies.assistant.port.outbound;

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

import me.growmies.assistant.domain.model.ChatSession;
import me.growmies.assistant.domain.model.SessionKey;

import java.util.Optional;

/**
 * Port for the in-memory session store. Every method returns copies; the
 * stored sessions are only mutated by the store itself.
 */
public interface SessionPort {

    /**
     * Returns the live session for the key, or a fresh empty one when none
     * exists or the existing one has idled past the timeout.
     */
    ChatSession getOrCreate(String userId, String channelId);

    /**
     * Appends a turn, applying the turn bound, and returns the resulting
     * session.
     */
    ChatSession append(SessionKey key, String role, String content);

    /**
     * Returns the session without creating one. Expired sessions are reported
     * as absent.
     */
    Optional<ChatSession> find(SessionKey key);

    boolean clear(SessionKey key);

    /**
     * Removes sessions idle past the timeout.
     *
     * @return number of sessions removed
     */
    int evictExpired();

    int getMaxTurns();

    /**
     * Seconds until the session expires if left idle.
     */
    long secondsRemaining(ChatSession session);
}
