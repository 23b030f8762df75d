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

/**
 * Per (user, guild) assistant settings. Created with defaults on first use,
 * changed only through validated updates and reset back to defaults instead of
 * being deleted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserPreferences {

    public static final int MIN_RESPONSE_LENGTH = 100;
    public static final int MAX_RESPONSE_LENGTH = 2000;

    private String userId;
    private String guildId;

    /** Opt-in for restricted-category assistance. */
    @Builder.Default
    private boolean restrictedAssistanceEnabled = false;

    @Builder.Default
    private ResponseStyle responseStyle = ResponseStyle.CASUAL;

    @Builder.Default
    private int maxResponseLength = MAX_RESPONSE_LENGTH;

    @Builder.Default
    private ContentFilterLevel contentFilterLevel = ContentFilterLevel.MODERATE;

    @Builder.Default
    private boolean conversationHistoryEnabled = true;

    /** Bring-your-own-key billing override. */
    @Builder.Default
    private boolean useOwnApiKey = false;

    private String apiKey;

    private Instant createdAt;
    private Instant updatedAt;

    public static UserPreferences defaults(String userId, String guildId) {
        return UserPreferences.builder()
                .userId(userId)
                .guildId(guildId)
                .build();
    }

    public boolean hasOwnApiKey() {
        return useOwnApiKey && apiKey != null && !apiKey.isBlank();
    }

    /**
     * Copy safe to hand out over the API: the api key is masked.
     */
    public UserPreferences masked() {
        String maskedKey = null;
        if (apiKey != null && !apiKey.isBlank()) {
            maskedKey = apiKey.length() <= 8 ? "****" : apiKey.substring(0, 3) + "****"
                    + apiKey.substring(apiKey.length() - 4);
        }
        return toBuilder().apiKey(maskedKey).build();
    }
}
