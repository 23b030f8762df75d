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

/**
 * Backend selection state of a single conversation.
 *
 * <pre>
 * NO_BACKEND_CHOSEN → THREAD_CREATING → THREAD_ACTIVE
 *                                     ↘ THREAD_FAILED → CHAT_ACTIVE
 * NO_BACKEND_CHOSEN → CHAT_ACTIVE
 * </pre>
 *
 * <p>
 * {@link #CHAT_ACTIVE} is terminal: a conversation never returns to thread mode.
 *
 * @since 1.0
 */
public enum BackendState {
    NO_BACKEND_CHOSEN,
    THREAD_CREATING,
    THREAD_ACTIVE,
    THREAD_FAILED,
    CHAT_ACTIVE
}
