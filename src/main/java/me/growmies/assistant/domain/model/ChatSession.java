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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ephemeral working set of recent turns for one (user, channel) pair.
 *
 * <p>
 * Owned by the session store and mutated only under its per-key lock. Callers
 * always receive {@link #copy() copies}.
 */
@Data
@Builder
public class ChatSession {

    private SessionKey key;

    @Builder.Default
    private List<Turn> turns = new ArrayList<>();

    /** Number of user turns since creation or the last compaction. */
    private int turnCount;

    private Instant createdAt;
    private Instant lastActivityAt;

    public ChatSession copy() {
        return ChatSession.builder()
                .key(key)
                .turns(new ArrayList<>(turns))
                .turnCount(turnCount)
                .createdAt(createdAt)
                .lastActivityAt(lastActivityAt)
                .build();
    }
}
