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
import me.growmies.assistant.adapter.inbound.web.dto.PreferencesUpdateRequest;
import me.growmies.assistant.domain.model.UserPreferences;
import me.growmies.assistant.domain.service.UserPreferencesService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Per-user assistant preferences. API keys are always returned masked.
 */
@RestController
@RequestMapping("/api/preferences")
@RequiredArgsConstructor
public class PreferencesController {

    private final UserPreferencesService preferencesService;

    @GetMapping("/{guildId}/{userId}")
    public Mono<ResponseEntity<UserPreferences>> getPreferences(@PathVariable String guildId,
            @PathVariable String userId) {
        return Mono.fromCallable(() -> preferencesService.getPreferences(userId, guildId).masked())
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PutMapping("/{guildId}/{userId}")
    public Mono<ResponseEntity<UserPreferences>> updatePreferences(@PathVariable String guildId,
            @PathVariable String userId, @RequestBody PreferencesUpdateRequest request) {
        return Mono.fromCallable(() -> preferencesService.update(userId, guildId, request.toUpdate()).masked())
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{guildId}/{userId}")
    public Mono<ResponseEntity<UserPreferences>> resetPreferences(@PathVariable String guildId,
            @PathVariable String userId) {
        return Mono.fromCallable(() -> preferencesService.reset(userId, guildId).masked())
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
