package me.growmies.assistant.port.outbound;

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

/**
 * Virtual-currency ledger. Amounts are whole credits.
 */
public interface LedgerPort {

    long getBalance(String userId, String guildId);

    /**
     * Atomically deducts up to {@code amount}, never taking the balance below
     * zero.
     *
     * @return the amount actually deducted
     */
    long deduct(String userId, String guildId, long amount);

    /**
     * @return the new balance
     */
    long credit(String userId, String guildId, long amount);
}
