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

import me.growmies.assistant.domain.model.GenerationSettings;
import me.growmies.assistant.domain.model.ThreadRun;

/**
 * Stateful assistant-thread backend. Conversation state lives on the provider;
 * each call appends to the thread and runs the assistant over it.
 *
 * <p>
 * All methods throw a {@link RuntimeException} on transport or provider
 * failure.
 */
public interface ThreadBackendPort {

    /**
     * Whether the backend is configured well enough to be attempted at all.
     */
    boolean isAvailable();

    String createThread(String credential);

    void appendMessage(String threadId, String text, String credential);

    ThreadRun startRun(String threadId, GenerationSettings settings, String credential);

    ThreadRun pollRun(String threadId, String runId, String credential);

    /**
     * Text of the newest message in the thread.
     *
     * @throws IllegalStateException
     *             if the newest message is not an assistant message
     */
    String getLatestMessage(String threadId, String credential);
}
