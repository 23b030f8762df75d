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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.port.outbound.LedgerPort;
import me.growmies.assistant.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * File-backed credit ledger, one JSON document per (guild, user) under
 * {@code ledger/}. Mutations are serialized so a deduction is an atomic
 * read-clamp-write.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageLedgerAdapter implements LedgerPort {

    static final String LEDGER_DIR = "ledger";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final AssistantProperties properties;
    private final Clock clock;

    @Override
    public synchronized long getBalance(String userId, String guildId) {
        return load(userId, guildId).getBalance();
    }

    @Override
    public synchronized long deduct(String userId, String guildId, long amount) {
        if (amount <= 0) {
            return 0;
        }
        LedgerEntry entry = load(userId, guildId);
        long deducted = Math.min(Math.max(0, entry.getBalance()), amount);
        if (deducted == 0) {
            return 0;
        }
        entry.setBalance(entry.getBalance() - deducted);
        entry.setTotalSpent(entry.getTotalSpent() + deducted);
        entry.setUpdatedAt(clock.instant());
        store(userId, guildId, entry);
        log.debug("[Billing] Ledger {}/{}: -{} -> {}", guildId, userId, deducted, entry.getBalance());
        return deducted;
    }

    @Override
    public synchronized long credit(String userId, String guildId, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Credit amount must be positive");
        }
        LedgerEntry entry = load(userId, guildId);
        entry.setBalance(Math.addExact(entry.getBalance(), amount));
        entry.setUpdatedAt(clock.instant());
        store(userId, guildId, entry);
        log.info("[Billing] Credited {} to {}/{}, balance {}", amount, guildId, userId, entry.getBalance());
        return entry.getBalance();
    }

    private LedgerEntry load(String userId, String guildId) {
        String json = storagePort.getText(LEDGER_DIR, path(userId, guildId)).join();
        if (json == null || json.isBlank()) {
            return new LedgerEntry(properties.getBilling().getInitialBalance(), 0, null);
        }
        try {
            return objectMapper.readValue(json, LedgerEntry.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted ledger entry for " + guildId + "/" + userId, e);
        }
    }

    private void store(String userId, String guildId, LedgerEntry entry) {
        try {
            storagePort.putTextAtomic(LEDGER_DIR, path(userId, guildId), objectMapper.writeValueAsString(entry), true)
                    .join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ledger entry", e);
        }
    }

    private static String path(String userId, String guildId) {
        return StorageConversationRepository.safe(guildId) + "/" + StorageConversationRepository.safe(userId)
                + ".json";
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class LedgerEntry {
        private long balance;
        private long totalSpent;
        private Instant updatedAt;
    }
}
