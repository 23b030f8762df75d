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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.EligibilityResult;
import me.growmies.assistant.port.outbound.EligibilityPort;
import me.growmies.assistant.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Reads age-verification records written by the verification flow from
 * {@code verification/<guild>/<user>.json}. A missing record means the user is
 * not verified.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageEligibilityAdapter implements EligibilityPort {

    static final String VERIFICATION_DIR = "verification";

    static final String REASON_NOT_VERIFIED = "not_verified";
    static final String REASON_UNDERAGE = "underage";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public EligibilityResult verify(String userId, String guildId) {
        String path = StorageConversationRepository.safe(guildId) + "/" + StorageConversationRepository.safe(userId)
                + ".json";
        String json = storagePort.getText(VERIFICATION_DIR, path).join();
        if (json == null || json.isBlank()) {
            return EligibilityResult.denied(REASON_NOT_VERIFIED);
        }
        VerificationRecord verification;
        try {
            verification = objectMapper.readValue(json, VerificationRecord.class);
        } catch (JsonProcessingException e) {
            log.warn("[Eligibility] Unreadable verification record for {}: {}", userId, e.getMessage());
            return EligibilityResult.denied(REASON_NOT_VERIFIED);
        }
        if (!verification.isVerified()) {
            return EligibilityResult.denied(REASON_NOT_VERIFIED);
        }
        if (verification.getAge() != null && verification.getAge() < 21) {
            return EligibilityResult.denied(REASON_UNDERAGE);
        }
        return EligibilityResult.allowed();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class VerificationRecord {
        private boolean verified;
        private Integer age;
        private Instant verifiedAt;
    }
}
