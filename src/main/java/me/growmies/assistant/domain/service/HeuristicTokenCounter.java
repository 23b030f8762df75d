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

import org.springframework.stereotype.Component;

/**
 * Character-based token estimate: one token per four characters, rounded up.
 * Close enough for English text and independent of the provider tokenizer.
 */
@Component
public class HeuristicTokenCounter implements TokenCounter {

    static final int CHARS_PER_TOKEN = 4;
    private static final double SENTENCE_CUT_THRESHOLD = 0.8;
    private static final String ELLIPSIS = "...";

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    /**
     * Prefers to end on a sentence boundary when one lies in the last fifth of
     * the allowed length, otherwise cuts and marks the cut with an ellipsis.
     */
    @Override
    public String truncate(String text, int maxTokens) {
        if (text == null || count(text) <= maxTokens) {
            return text;
        }
        if (maxTokens <= 0) {
            return "";
        }
        int maxChars = maxTokens * CHARS_PER_TOKEN;
        String cut = text.substring(0, maxChars);
        int sentenceEnd = Math.max(cut.lastIndexOf('.'), Math.max(cut.lastIndexOf('!'), cut.lastIndexOf('?')));
        if (sentenceEnd > maxChars * SENTENCE_CUT_THRESHOLD) {
            return cut.substring(0, sentenceEnd + 1);
        }
        if (maxChars <= ELLIPSIS.length()) {
            return cut;
        }
        return cut.substring(0, maxChars - ELLIPSIS.length()) + ELLIPSIS;
    }
}
