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

import lombok.Builder;
import lombok.Value;

/**
 * Billing mode chosen for one request and the credential to call the backend
 * with. A null credential means the shared service credential.
 */
@Value
@Builder
public class BillingDecision {

    BillingMode mode;
    String credential;

    public static BillingDecision vip() {
        return BillingDecision.builder().mode(BillingMode.VIP).build();
    }

    public static BillingDecision selfPay(String apiKey) {
        return BillingDecision.builder().mode(BillingMode.SELF_PAY).credential(apiKey).build();
    }

    public static BillingDecision credit() {
        return BillingDecision.builder().mode(BillingMode.CREDIT).build();
    }

    public boolean isMetered() {
        return mode == BillingMode.CREDIT;
    }

    @Override
    public String toString() {
        // never print the credential
        return "BillingDecision(mode=" + mode + ")";
    }
}
