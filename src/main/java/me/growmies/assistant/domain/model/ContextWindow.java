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
import lombok.Value;

import java.util.List;

/**
 * Ordered messages sent to the backend: the system message first, then the
 * included history ending with the latest user turn.
 */
@Value
@Builder
public class ContextWindow {

    List<Turn> messages;

    /** True when the latest user turn had to be cut to fit the budget. */
    boolean truncated;

    /** Included history turns, the latest user turn included. */
    int includedHistoryCount;
    int droppedHistoryCount;
    int includedSnippetCount;
    int totalTokens;

    public Turn latestTurn() {
        return messages.get(messages.size() - 1);
    }
}
