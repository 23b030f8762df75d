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

import java.util.List;

/**
 * Lexical classification of a piece of text. A heuristic signal: absence of
 * matches does not prove the text is unrestricted.
 */
public record ComplianceVerdict(boolean restrictedSubject, List<String> matchedTerms) {

    public ComplianceVerdict {
        matchedTerms = matchedTerms != null ? List.copyOf(matchedTerms) : List.of();
    }

    public static ComplianceVerdict clean() {
        return new ComplianceVerdict(false, List.of());
    }

    public static ComplianceVerdict restricted(List<String> matchedTerms) {
        return new ComplianceVerdict(true, matchedTerms);
    }
}
