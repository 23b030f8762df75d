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
import me.growmies.assistant.domain.model.BalanceCheck;
import me.growmies.assistant.domain.model.BillingDecision;
import me.growmies.assistant.domain.model.UserPreferences;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.port.outbound.LedgerPort;
import me.growmies.assistant.port.outbound.MembershipPort;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Billing mode selection, cost estimation and settlement.
 *
 * <p>
 * Modes are tried in order:
 * <ol>
 * <li>VIP - sponsored members, shared credential, never charged</li>
 * <li>self-pay - members with their own api key, never charged</li>
 * <li>credit - everyone else, charged per token from the ledger</li>
 * </ol>
 *
 * <p>
 * Cost is {@code ceil(in/1000 × inputRate + out/1000 × outputRate)} whole
 * credits. Settlement deducts at most the current balance: once a reply has
 * been produced it is delivered even if the balance does not cover it.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsageMeterService {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final LedgerPort ledgerPort;
    private final MembershipPort membershipPort;
    private final AssistantProperties properties;

    public BillingDecision chooseBillingMode(String userId, String guildId, UserPreferences preferences) {
        try {
            if (membershipPort.isVip(userId, guildId)) {
                return BillingDecision.vip();
            }
        } catch (RuntimeException e) { // NOSONAR - unknown membership bills as credit
            log.warn("[Billing] VIP lookup failed for {}, using credit mode: {}", userId, e.getMessage());
            return BillingDecision.credit();
        }
        if (preferences != null && preferences.hasOwnApiKey()) {
            return BillingDecision.selfPay(preferences.getApiKey());
        }
        return BillingDecision.credit();
    }

    /**
     * Pre-flight check run before any backend call. Non-metered modes always
     * pass.
     */
    public BalanceCheck checkBalance(BillingDecision decision, String userId, String guildId) {
        if (!decision.isMetered()) {
            return BalanceCheck.notMetered();
        }
        long minimum = properties.getBilling().getMinimumBalance();
        long balance = ledgerPort.getBalance(userId, guildId);
        return new BalanceCheck(balance >= minimum, balance, minimum);
    }

    public long currentBalance(String userId, String guildId) {
        return ledgerPort.getBalance(userId, guildId);
    }

    public long estimateCost(int tokensIn, int tokensOut, String model) {
        AssistantProperties.RateProperties rate = rateFor(model);
        BigDecimal input = BigDecimal.valueOf(Math.max(0, tokensIn))
                .multiply(BigDecimal.valueOf(rate.getInputPer1k()));
        BigDecimal output = BigDecimal.valueOf(Math.max(0, tokensOut))
                .multiply(BigDecimal.valueOf(rate.getOutputPer1k()));
        return input.add(output)
                .divide(THOUSAND, 0, RoundingMode.CEILING)
                .longValueExact();
    }

    /**
     * Deduct the cost of a produced reply.
     *
     * @return amount actually deducted, {@code min(balance, cost)} in credit
     *         mode and 0 otherwise
     */
    public long settle(String userId, String guildId, BillingDecision decision, long cost) {
        if (!decision.isMetered() || cost <= 0) {
            return 0;
        }
        long deducted = ledgerPort.deduct(userId, guildId, cost);
        long clamped = Math.max(0, Math.min(deducted, cost));
        if (clamped < cost) {
            log.info("[Billing] Balance of user {} covered {} of {} credits", userId, clamped, cost);
        } else {
            log.debug("[Billing] Deducted {} credits from user {}", clamped, userId);
        }
        return clamped;
    }

    private AssistantProperties.RateProperties rateFor(String model) {
        AssistantProperties.BillingProperties billing = properties.getBilling();
        if (model != null) {
            AssistantProperties.RateProperties rate = billing.getRates().get(model);
            if (rate != null) {
                return rate;
            }
            // dated snapshots such as gpt-4-0613 bill as their base model
            String bestKey = null;
            for (String key : billing.getRates().keySet()) {
                if (model.startsWith(key) && (bestKey == null || key.length() > bestKey.length())) {
                    bestKey = key;
                }
            }
            if (bestKey != null) {
                return billing.getRates().get(bestKey);
            }
        }
        AssistantProperties.RateProperties fallback = billing.getRates().get(billing.getDefaultModel());
        if (fallback == null) {
            throw new IllegalStateException("No rate configured for default model " + billing.getDefaultModel());
        }
        return fallback;
    }
}
