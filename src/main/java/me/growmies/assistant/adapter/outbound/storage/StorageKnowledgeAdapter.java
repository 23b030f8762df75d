package me.growmies.assistant.adapter.outbound.storage;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.ConversationCategory;
import me.growmies.assistant.port.outbound.KnowledgePort;
import me.growmies.assistant.port.outbound.StoragePort;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Keyword-ranked lookup over curated knowledge entries.
 *
 * <p>
 * Entries of a topic are read from {@code knowledge/<topic>.json} in storage,
 * falling back to the bundled {@code classpath:knowledge/<topic>.json}. Each
 * topic is loaded once and cached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageKnowledgeAdapter implements KnowledgePort {

    static final String KNOWLEDGE_DIR = "knowledge";
    static final int SNIPPET_CHARS = 200;

    private static final int MIN_WORD_LENGTH = 3;
    private static final TypeReference<List<KnowledgeEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final Map<String, List<KnowledgeEntry>> topics = new ConcurrentHashMap<>();

    @Override
    public List<String> search(ConversationCategory category, String query, int limit) {
        if (limit <= 0 || query == null || query.isBlank()) {
            return List.of();
        }
        Set<String> words = Arrays.stream(query.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(word -> word.length() >= MIN_WORD_LENGTH)
                .collect(Collectors.toSet());
        if (words.isEmpty()) {
            return List.of();
        }

        List<KnowledgeEntry> entries = topics.computeIfAbsent(category.getKnowledgeTopic(), this::loadTopic);
        List<Scored> scored = new ArrayList<>();
        for (KnowledgeEntry entry : entries) {
            int score = score(entry, words);
            if (score > 0) {
                scored.add(new Scored(entry, score));
            }
        }
        return scored.stream()
                .sorted(Comparator.comparingInt(Scored::score).reversed())
                .limit(limit)
                .map(s -> format(s.entry()))
                .toList();
    }

    /**
     * Drops cached topics so edited files are picked up.
     */
    public void reload() {
        topics.clear();
    }

    private int score(KnowledgeEntry entry, Set<String> words) {
        String text = ((entry.getTitle() != null ? entry.getTitle() : "") + " "
                + (entry.getContent() != null ? entry.getContent() : "")).toLowerCase(Locale.ROOT);
        int score = 0;
        for (String word : words) {
            if (text.contains(word)) {
                score++;
            }
            if (entry.getKeywords() != null && entry.getKeywords().stream()
                    .anyMatch(keyword -> keyword.toLowerCase(Locale.ROOT).equals(word))) {
                score += 2;
            }
        }
        return score;
    }

    private String format(KnowledgeEntry entry) {
        String content = entry.getContent() != null ? entry.getContent().strip() : "";
        if (content.length() > SNIPPET_CHARS) {
            content = content.substring(0, SNIPPET_CHARS).stripTrailing() + "...";
        }
        return entry.getTitle() != null && !entry.getTitle().isBlank() ? entry.getTitle() + ": " + content : content;
    }

    private List<KnowledgeEntry> loadTopic(String topic) {
        String file = topic + ".json";
        try {
            String json = storagePort.getText(KNOWLEDGE_DIR, file).join();
            if (json != null && !json.isBlank()) {
                return objectMapper.readValue(json, ENTRY_LIST);
            }
            ClassPathResource bundled = new ClassPathResource(KNOWLEDGE_DIR + "/" + file);
            if (bundled.exists()) {
                try (InputStream in = bundled.getInputStream()) {
                    return objectMapper.readValue(in, ENTRY_LIST);
                }
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - a broken topic only disables its snippets
            log.warn("[Knowledge] Failed to load topic {}: {}", topic, e.getMessage());
        }
        return List.of();
    }

    private record Scored(KnowledgeEntry entry, int score) {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KnowledgeEntry {
        private String title;
        private String content;
        private List<String> keywords;
    }
}
