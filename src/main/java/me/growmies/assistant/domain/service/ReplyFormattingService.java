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
import me.growmies.assistant.domain.model.ConversationCategory;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.security.ComplianceFilter;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Presentation helpers for replies: pagination to the platform message limit,
 * the AI footer, follow-up suggestions and suggested reactions.
 */
@Service
@RequiredArgsConstructor
public class ReplyFormattingService {

    private final AssistantProperties properties;
    private final ComplianceFilter complianceFilter;

    /**
     * Appends the footer and splits into pages no longer than the page limit.
     * Pages break at paragraph ends, then sentence ends, then blanks.
     */
    public List<String> paginate(String text) {
        String footer = properties.getReply().getFooter();
        String full = text == null ? "" : text.strip();
        if (footer != null && !footer.isBlank()) {
            full = full.isEmpty() ? footer : full + "\n\n" + footer;
        }
        int limit = Math.max(1, properties.getReply().getPageLimit());

        List<String> pages = new ArrayList<>();
        String remaining = full;
        while (remaining.length() > limit) {
            int cut = findCut(remaining, limit);
            String page = remaining.substring(0, cut).strip();
            if (!page.isEmpty()) {
                pages.add(page);
            }
            remaining = remaining.substring(cut).strip();
        }
        if (!remaining.isEmpty() || pages.isEmpty()) {
            pages.add(remaining);
        }
        return pages;
    }

    public List<String> suggestions(ConversationCategory category, String reply) {
        List<String> all = switch (category) {
        case STRAIN_ADVICE -> List.of("Ask about growing this strain", "Get cultivation tips",
                "Learn about similar strains");
        case GROW_TIPS, CULTIVATION_ADVICE -> List.of("Ask about nutrients", "Get harvest advice",
                "Learn about pest control");
        case LEGAL_INFO -> List.of("Ask about cultivation limits", "Learn about dispensary laws",
                "Get compliance help");
        default -> complianceFilter.classify(reply).restrictedSubject()
                ? List.of("Get more cannabis info", "Ask follow-up questions", "Learn about safety")
                : List.of("Ask follow-up questions", "Get more information", "Change topic");
        };
        int max = Math.max(0, properties.getReply().getMaxSuggestions());
        return all.size() > max ? all.subList(0, max) : all;
    }

    public List<String> reactions(String reply) {
        Set<String> reactions = new LinkedHashSet<>();
        if (reply != null && !reply.isBlank()) {
            String lower = reply.toLowerCase(Locale.ROOT);
            if (complianceFilter.classify(reply).restrictedSubject()) {
                reactions.add("🌿");
            }
            if (lower.contains("help") || lower.contains("assist")) {
                reactions.add("🤝");
            }
            if (lower.contains("learn") || lower.contains("education")) {
                reactions.add("📚");
            }
            if (lower.contains("legal") || lower.contains("law")) {
                reactions.add("⚖️");
            }
            if (lower.contains("grow") || lower.contains("cultivation")) {
                reactions.add("🌱");
            }
        }
        reactions.add("👍");
        return new ArrayList<>(reactions);
    }

    private int findCut(String text, int limit) {
        String window = text.substring(0, limit);
        int paragraph = window.lastIndexOf("\n\n");
        if (paragraph > limit / 2) {
            return paragraph;
        }
        int sentence = Math.max(window.lastIndexOf(". "), Math.max(window.lastIndexOf("! "),
                window.lastIndexOf("? ")));
        if (sentence > limit / 2) {
            return sentence + 1;
        }
        int blank = Math.max(window.lastIndexOf(' '), window.lastIndexOf('\n'));
        if (blank > 0) {
            return blank;
        }
        return limit;
    }
}
