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
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.ContextWindow;
import me.growmies.assistant.domain.model.Turn;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the bounded message list sent to a backend.
 *
 * <p>
 * The window is assembled in priority order:
 * <ol>
 * <li>system prompt, always first and never dropped</li>
 * <li>latest user turn, always included, hard-truncated only when it cannot
 * fit next to the system prompt</li>
 * <li>knowledge snippets, appended to the system message while they fit</li>
 * <li>prior history, newest first, whole turns only</li>
 * </ol>
 *
 * <p>
 * The total never exceeds the budget except when the system prompt alone is
 * larger than it; the result is then flagged as truncated.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextBudgetService {

    private static final String KNOWLEDGE_HEADER = "\n\nRelevant community knowledge:";

    private final TokenCounter tokenCounter;

    /**
     * @param history
     *            session turns, oldest first; the last element is the latest
     *            user turn
     */
    public ContextWindow buildContext(String systemPrompt, List<Turn> history, List<String> knowledgeSnippets,
            int budgetTokens) {
        if (history == null || history.isEmpty()) {
            throw new IllegalArgumentException("history must contain the latest user turn");
        }
        String system = systemPrompt != null ? systemPrompt : "";
        int systemTokens = tokenCounter.count(system);

        Turn latest = history.get(history.size() - 1);
        int latestTokens = tokenCounter.count(latest.getContent());
        boolean truncated = false;
        if (systemTokens + latestTokens > budgetTokens) {
            int allowed = Math.max(0, budgetTokens - systemTokens);
            latest = latest.withContent(tokenCounter.truncate(latest.getContent(), allowed));
            latestTokens = tokenCounter.count(latest.getContent());
            truncated = true;
            log.debug("[Context] Latest turn truncated to {} tokens (budget {}, system {})",
                    latestTokens, budgetTokens, systemTokens);
        }

        int used = systemTokens + latestTokens;

        StringBuilder systemContent = new StringBuilder(system);
        int includedSnippets = 0;
        if (knowledgeSnippets != null && !knowledgeSnippets.isEmpty() && !truncated) {
            int headerTokens = tokenCounter.count(KNOWLEDGE_HEADER);
            if (used + headerTokens < budgetTokens) {
                StringBuilder block = new StringBuilder(KNOWLEDGE_HEADER);
                int blockTokens = headerTokens;
                for (String snippet : knowledgeSnippets) {
                    if (snippet == null || snippet.isBlank()) {
                        continue;
                    }
                    String line = "\n- " + snippet;
                    int lineTokens = tokenCounter.count(line);
                    if (used + blockTokens + lineTokens > budgetTokens) {
                        continue;
                    }
                    block.append(line);
                    blockTokens += lineTokens;
                    includedSnippets++;
                }
                if (includedSnippets > 0) {
                    systemContent.append(block);
                    used = tokenCounter.count(systemContent.toString()) + latestTokens;
                }
            }
        }

        List<Turn> included = new ArrayList<>();
        int dropped = 0;
        for (int i = history.size() - 2; i >= 0; i--) {
            Turn turn = history.get(i);
            int turnTokens = tokenCounter.count(turn.getContent());
            if (used + turnTokens > budgetTokens) {
                dropped = i + 1;
                break;
            }
            included.add(turn);
            used += turnTokens;
        }
        Collections.reverse(included);

        List<Turn> messages = new ArrayList<>(included.size() + 2);
        messages.add(Turn.system(systemContent.toString()));
        messages.addAll(included);
        messages.add(latest);

        return ContextWindow.builder()
                .messages(messages)
                .truncated(truncated)
                .includedHistoryCount(included.size() + 1)
                .droppedHistoryCount(dropped)
                .includedSnippetCount(includedSnippets)
                .totalTokens(used)
                .build();
    }
}
