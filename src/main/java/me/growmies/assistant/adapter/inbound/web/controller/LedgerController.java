package me.growmies.assistant.adapter.inbound.web.controller;

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
import me.growmies.assistant.adapter.inbound.web.dto.BalanceResponse;
import me.growmies.assistant.adapter.inbound.web.dto.CreditRequest;
import me.growmies.assistant.domain.model.BillingDecision;
import me.growmies.assistant.domain.service.UsageMeterService;
import me.growmies.assistant.domain.service.UserPreferencesService;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.port.outbound.LedgerPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Credit balance lookup and top-up.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final LedgerPort ledgerPort;
    private final UsageMeterService usageMeter;
    private final UserPreferencesService preferencesService;
    private final AssistantProperties properties;

    @GetMapping("/{guildId}/{userId}")
    public Mono<ResponseEntity<BalanceResponse>> getBalance(@PathVariable String guildId,
            @PathVariable String userId) {
        return Mono.fromCallable(() -> toResponse(userId, guildId, ledgerPort.getBalance(userId, guildId)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{guildId}/{userId}/credit")
    public Mono<ResponseEntity<BalanceResponse>> credit(@PathVariable String guildId, @PathVariable String userId,
            @RequestBody CreditRequest request) {
        return Mono.fromCallable(() -> {
            if (request.getAmount() <= 0) {
                throw new IllegalArgumentException("amount must be positive");
            }
            long balance = ledgerPort.credit(userId, guildId, request.getAmount());
            log.info("[API] Credited {} to user {} in guild {}", request.getAmount(), userId, guildId);
            return toResponse(userId, guildId, balance);
        })
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private BalanceResponse toResponse(String userId, String guildId, long balance) {
        BillingDecision billing = usageMeter.chooseBillingMode(userId, guildId,
                preferencesService.getPreferences(userId, guildId));
        return BalanceResponse.builder()
                .userId(userId)
                .guildId(guildId)
                .balance(balance)
                .minimumBalance(properties.getBilling().getMinimumBalance())
                .billingMode(billing.getMode())
                .build();
    }
}
