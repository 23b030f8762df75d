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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a backend call. Fallback between backend modes is driven by this
 * value, not by exceptions.
 *
 * <ul>
 * <li>{@link Status#SUCCESS} - a reply was produced</li>
 * <li>{@link Status#RECOVERABLE_ERROR} - this mode failed, another mode may
 * still answer</li>
 * <li>{@link Status#FATAL_ERROR} - no mode is left to try</li>
 * </ul>
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class BackendResult {

    public enum Status {
        SUCCESS, RECOVERABLE_ERROR, FATAL_ERROR
    }

    private final Status status;
    private final BackendReply reply;
    private final String errorCode;
    private final String errorMessage;

    public static BackendResult success(BackendReply reply) {
        return new BackendResult(Status.SUCCESS, reply, null, null);
    }

    public static BackendResult recoverableError(String code, String message) {
        return new BackendResult(Status.RECOVERABLE_ERROR, null, code, message);
    }

    public static BackendResult fatalError(String code, String message) {
        return new BackendResult(Status.FATAL_ERROR, null, code, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isRecoverable() {
        return status == Status.RECOVERABLE_ERROR;
    }
}
