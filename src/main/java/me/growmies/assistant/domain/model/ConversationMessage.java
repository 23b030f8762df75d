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
import java.util.ArrayList;
import java.util.List;

/**
 * One durable turn of a conversation. Written once, never updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessage {

    private String id;
    private String conversationId;
    private String userId;
    private String guildId;
    private String channelId;
    private String role;
    private String content;

    private boolean restrictedContent;
    private int tokenCount;

    private BackendMode backendMode;
    private String model;

    private boolean filtered;
    @Builder.Default
    private List<String> complianceIssues = new ArrayList<>();

    private long billedCost;
    private BillingMode billingMode;

    private Instant createdAt;
}
