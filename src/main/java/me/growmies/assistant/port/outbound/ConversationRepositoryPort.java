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

import me.growmies.assistant.domain.model.Conversation;
import me.growmies.assistant.domain.model.ConversationMessage;
import me.growmies.assistant.domain.model.UserPreferences;

import java.util.List;
import java.util.Optional;

/**
 * Persistence repository for conversations, their message log and user
 * preferences. Failures surface as runtime exceptions; callers on the
 * response path treat them as best effort.
 */
public interface ConversationRepositoryPort {

    void saveMessage(ConversationMessage message);

    void upsertConversation(Conversation conversation);

    Optional<Conversation> findActiveConversation(String userId, String guildId, String channelId);

    /**
     * Stores an ended conversation and detaches it from its channel.
     */
    void archiveConversation(Conversation conversation);

    /**
     * Latest messages of a conversation, oldest first.
     */
    List<ConversationMessage> getRecentMessages(String conversationId, int limit);

    UserPreferences getOrCreatePreferences(String userId, String guildId);

    void savePreferences(UserPreferences preferences);
}
