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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured result of {@code handleMessage}, returned to the command layer.
 *
 * <p>
 * On success {@link #text} holds the first page of the filtered reply and
 * {@link #additionalPages} the rest. On failure {@link #error} describes the
 * error; an eligibility failure additionally sets {@link #needsVerification}.
 *
 * @since 1.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatResponse {

    private boolean success;
    private String text;

    @Builder.Default
    private List<String> additionalPages = new ArrayList<>();

    private ComplianceInfo compliance;
    private UsageInfo usage;
    private SessionInfo session;

    private Boolean needsVerification;
    private ErrorInfo error;

    @Builder.Default
    private List<String> suggestions = new ArrayList<>();

    @Builder.Default
    private List<String> reactions = new ArrayList<>();

    private String conversationId;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ComplianceInfo {
        private String category;
        private boolean ageGated;
        private boolean restrictedContentDetected;
        private boolean escalated;
        private boolean filtered;
        @Builder.Default
        private List<String> issues = new ArrayList<>();
        private boolean contextTruncated;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UsageInfo {
        private int inputTokens;
        private int outputTokens;
        private int totalTokens;
        private long cost;
        private long deducted;
        private BillingMode billingMode;
        private String model;
        private BackendMode backendMode;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SessionInfo {
        private int turnCount;
        private int maxTurns;
        private long secondsRemaining;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorInfo {
        private ErrorType type;
        private String message;
        private boolean retryable;
    }

    public static ChatResponse failure(ErrorType type, String message, boolean retryable) {
        return ChatResponse.builder()
                .success(false)
                .error(ErrorInfo.builder().type(type).message(message).retryable(retryable).build())
                .build();
    }

    public static ChatResponse verificationRequired(String message) {
        ChatResponse response = failure(ErrorType.ELIGIBILITY, message, false);
        response.setNeedsVerification(Boolean.TRUE);
        return response;
    }
}
