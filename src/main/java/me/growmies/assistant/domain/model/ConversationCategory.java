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

import java.util.Locale;
import java.util.Optional;

/**
 * Subject category of a conversation. Every category except {@link #GENERAL}
 * covers age-gated subject matter and requires an eligible user.
 *
 * @since 1.0
 */
public enum ConversationCategory {

    GENERAL("general", false, "general"),
    STRAIN_ADVICE("strain_advice", true, "strains"),
    GROW_TIPS("grow_tips", true, "cultivation"),
    LEGAL_INFO("legal_info", true, "legal"),
    CANNABIS_EDUCATION("cannabis_education", true, "general"),
    CULTIVATION_ADVICE("cultivation_advice", true, "cultivation");

    private final String code;
    private final boolean restricted;
    private final String knowledgeTopic;

    ConversationCategory(String code, boolean restricted, String knowledgeTopic) {
        this.code = code;
        this.restricted = restricted;
        this.knowledgeTopic = knowledgeTopic;
    }

    public String getCode() {
        return code;
    }

    public boolean isRestricted() {
        return restricted;
    }

    /**
     * Topic of the curated knowledge base that augments this category.
     */
    public String getKnowledgeTopic() {
        return knowledgeTopic;
    }

    /**
     * Resolves a wire code. Blank input resolves to {@link #GENERAL}, unknown
     * codes resolve to empty.
     */
    public static Optional<ConversationCategory> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.of(GENERAL);
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ConversationCategory category : values()) {
            if (category.code.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
