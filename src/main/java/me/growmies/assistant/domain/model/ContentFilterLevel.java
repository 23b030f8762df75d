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
 * How conservative the assistant should be with restricted subject matter.
 */
public enum ContentFilterLevel {
    STRICT,
    MODERATE,
    MINIMAL;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ContentFilterLevel> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        for (ContentFilterLevel level : values()) {
            if (level.getCode().equals(code.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
