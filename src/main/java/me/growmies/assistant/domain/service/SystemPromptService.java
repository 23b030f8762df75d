package me.growmies.assistant.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.growmies.assistant.domain.model.ContentFilterLevel;
import me.growmies.assistant.domain.model.ConversationCategory;
import me.growmies.assistant.domain.model.GenerationSettings;
import me.growmies.assistant.domain.model.UserPreferences;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import org.springframework.stereotype.Service;

/**
 * Persona, category rules and generation parameters for a request.
 */
@Service
@RequiredArgsConstructor
public class SystemPromptService {

    private static final String PERSONA = """
            You are a helpful cannabis education assistant for the GrowmiesNJ community. \
            You provide accurate, educational information while maintaining strict legal compliance.

            IMPORTANT COMPLIANCE RULES:
            - All information is for educational purposes only
            - Never provide medical advice - always recommend consulting healthcare professionals
            - Never facilitate commercial cannabis transactions
            - Focus on New Jersey cannabis laws and regulations
            - Always emphasize responsible adult use (21+)
            - Include appropriate disclaimers for safety and legal compliance""";

    private static final String AGE_VERIFIED_NOTE = "This conversation requires 21+ age verification. "
            + "The user has been verified as 21 or older.";

    private static final String CLOSING = "Always be helpful, educational, and compliant with cannabis laws "
            + "and community guidelines.";

    private static final String STRICT_NOTE = "Use strict content filtering and include comprehensive disclaimers.";

    private static final double TEMPERATURE_LEGAL = 0.3;
    private static final double TEMPERATURE_EDUCATIONAL = 0.5;
    private static final double TEMPERATURE_CULTIVATION = 0.6;
    private static final double TEMPERATURE_DEFAULT = 0.7;

    private final AssistantProperties properties;

    public String buildSystemPrompt(ConversationCategory category, UserPreferences preferences) {
        StringBuilder prompt = new StringBuilder(PERSONA)
                .append("\n\n")
                .append(categoryRules(category));
        if (category.isRestricted()) {
            prompt.append("\n\n").append(AGE_VERIFIED_NOTE);
        }
        String style = styleNote(preferences);
        if (style != null) {
            prompt.append("\n\n").append(style);
        }
        if (preferences != null && preferences.getContentFilterLevel() == ContentFilterLevel.STRICT) {
            prompt.append("\n\n").append(STRICT_NOTE);
        }
        prompt.append("\n\n").append(CLOSING);
        return prompt.toString();
    }

    /**
     * Run-level instructions for thread mode, where the persona lives on the
     * provider-side assistant.
     */
    public String buildThreadInstructions(ConversationCategory category, UserPreferences preferences) {
        StringBuilder instructions = new StringBuilder();
        if (category.isRestricted()) {
            instructions.append("This is a cannabis-related conversation. Ensure all responses comply with "
                    + "cannabis regulations and include appropriate disclaimers. ");
        }
        String style = styleNote(preferences);
        if (style != null) {
            instructions.append(style).append(' ');
        }
        if (preferences != null && preferences.getContentFilterLevel() == ContentFilterLevel.STRICT) {
            instructions.append(STRICT_NOTE);
        }
        return instructions.toString().trim();
    }

    public GenerationSettings chatSettings(ConversationCategory category, UserPreferences preferences) {
        return GenerationSettings.builder()
                .model(properties.getBackend().getChat().getModel())
                .temperature(temperatureFor(category))
                .maxTokens(maxTokens(preferences))
                .build();
    }

    public GenerationSettings threadSettings(ConversationCategory category, UserPreferences preferences) {
        return GenerationSettings.builder()
                .model(properties.getBackend().getThread().getModel())
                .temperature(temperatureFor(category))
                .maxTokens(maxTokens(preferences))
                .instructions(buildThreadInstructions(category, preferences))
                .build();
    }

    double temperatureFor(ConversationCategory category) {
        return switch (category) {
        case LEGAL_INFO -> TEMPERATURE_LEGAL;
        case STRAIN_ADVICE, CANNABIS_EDUCATION -> TEMPERATURE_EDUCATIONAL;
        case GROW_TIPS, CULTIVATION_ADVICE -> TEMPERATURE_CULTIVATION;
        default -> TEMPERATURE_DEFAULT;
        };
    }

    int maxTokens(UserPreferences preferences) {
        int limit = properties.getContext().getMaxResponseTokens();
        if (preferences == null || preferences.getMaxResponseLength() <= 0) {
            return limit;
        }
        return Math.min(preferences.getMaxResponseLength() / HeuristicTokenCounter.CHARS_PER_TOKEN, limit);
    }

    private String categoryRules(ConversationCategory category) {
        return switch (category) {
        case CANNABIS_EDUCATION -> "Focus on educational cannabis content including plant biology, history, "
                + "and general effects. Always include educational disclaimers.";
        case STRAIN_ADVICE -> "Provide strain information including genetics, typical effects, and growing "
                + "characteristics. Always remind users that effects vary by individual and to start with "
                + "small amounts.";
        case LEGAL_INFO -> "Provide general information about New Jersey cannabis laws and regulations. Always "
                + "clarify that this is not legal advice and recommend consulting legal professionals.";
        case GROW_TIPS, CULTIVATION_ADVICE -> "Provide cultivation education including growing techniques, "
                + "equipment, and best practices. Always emphasize legal compliance and following local laws.";
        default -> "Provide general information and friendly help. Keep cannabis topics educational.";
        };
    }

    private String styleNote(UserPreferences preferences) {
        if (preferences == null || preferences.getResponseStyle() == null) {
            return null;
        }
        return switch (preferences.getResponseStyle()) {
        case EDUCATIONAL -> "Focus on educational content with detailed explanations and learning opportunities.";
        case CONVERSATIONAL -> "Use a friendly, conversational tone while maintaining accuracy.";
        case TECHNICAL -> "Provide technical, detailed responses with scientific accuracy.";
        default -> null;
        };
    }
}
