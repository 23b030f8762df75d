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

import me.growmies.assistant.domain.model.BackendReply;
import me.growmies.assistant.domain.model.GenerationSettings;
import me.growmies.assistant.domain.model.Turn;

import java.util.List;

/**
 * Stateless chat-completion backend: the full context is sent on every call.
 */
public interface ChatBackendPort {

    /**
     * @param credential
     *            api key to call with, or null for the shared credential
     * @throws RuntimeException
     *             on any transport or provider failure
     */
    BackendReply complete(List<Turn> messages, GenerationSettings settings, String credential);
}
