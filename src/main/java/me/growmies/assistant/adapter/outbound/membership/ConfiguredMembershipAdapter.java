package me.growmies.assistant.adapter.outbound.membership;

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
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.port.outbound.MembershipPort;
import org.springframework.stereotype.Component;

/**
 * VIP membership from {@code assistant.billing.vip-users}. A deployment wired
 * to the chat platform's role lookup replaces this bean.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredMembershipAdapter implements MembershipPort {

    private final AssistantProperties properties;

    @Override
    public boolean isVip(String userId, String guildId) {
        return userId != null && properties.getBilling().getVipUsers().contains(userId);
    }
}
