package me.growmies.assistant.port.inbound;

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

import me.growmies.assistant.domain.model.ChatRequest;
import me.growmies.assistant.domain.model.ChatResponse;
import me.growmies.assistant.domain.model.ConversationStats;

/**
 * Entry point used by the command layer.
 */
public interface ConversationPort {

    ChatResponse handleMessage(ChatRequest request);

    /**
     * Drops the session and archives the active conversation of the channel.
     *
     * @return true if there was anything to clear
     */
    boolean clearConversation(String userId, String guildId, String channelId);

    ConversationStats getConversationStats(String userId, String guildId, String channelId);
}
