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
import me.growmies.assistant.domain.model.ChatRequest;
import me.growmies.assistant.domain.model.ChatResponse;
import me.growmies.assistant.domain.model.ConversationStats;
import me.growmies.assistant.port.inbound.ConversationPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Chat exchange endpoints used by the command layer.
 */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ConversationPort conversationPort;

    @PostMapping("/messages")
    public Mono<ResponseEntity<ChatResponse>> sendMessage(@RequestBody ChatRequest request) {
        return Mono.fromCallable(() -> conversationPort.handleMessage(request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(response -> ResponseEntity.status(statusFor(response)).body(response));
    }

    @DeleteMapping("/{guildId}/{userId}/{channelId}")
    public Mono<ResponseEntity<Map<String, Boolean>>> clearConversation(@PathVariable String guildId,
            @PathVariable String userId, @PathVariable String channelId) {
        return Mono.fromCallable(() -> conversationPort.clearConversation(userId, guildId, channelId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(cleared -> ResponseEntity.ok(Map.of("cleared", cleared)));
    }

    @GetMapping("/{guildId}/{userId}/{channelId}/stats")
    public Mono<ResponseEntity<ConversationStats>> getStats(@PathVariable String guildId,
            @PathVariable String userId, @PathVariable String channelId) {
        return Mono.fromCallable(() -> conversationPort.getConversationStats(userId, guildId, channelId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    static HttpStatus statusFor(ChatResponse response) {
        if (response.isSuccess()) {
            return HttpStatus.OK;
        }
        if (response.getError() == null || response.getError().getType() == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (response.getError().getType()) {
        case VALIDATION -> HttpStatus.BAD_REQUEST;
        case ELIGIBILITY -> HttpStatus.FORBIDDEN;
        case BILLING -> HttpStatus.PAYMENT_REQUIRED;
        case BACKEND -> HttpStatus.SERVICE_UNAVAILABLE;
        default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
