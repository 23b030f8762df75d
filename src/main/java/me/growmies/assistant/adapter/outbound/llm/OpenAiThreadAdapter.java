package me.growmies.assistant.adapter.outbound.llm;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.GenerationSettings;
import me.growmies.assistant.domain.model.LlmUsage;
import me.growmies.assistant.domain.model.RunStatus;
import me.growmies.assistant.domain.model.ThreadRun;
import me.growmies.assistant.domain.system.BackendErrorClassifier;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.infrastructure.http.FeignClientFactory;
import me.growmies.assistant.port.outbound.ThreadBackendPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Thread mode over the OpenAI Assistants API (v2) using Feign + OkHttp.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code assistant.backend.thread.enabled} - master switch
 * <li>{@code assistant.backend.thread.assistant-id} - provider-side assistant
 * <li>{@code assistant.backend.thread.base-url} - API base url
 * <li>{@code assistant.backend.thread.api-key} - shared key, falls back to
 * {@code assistant.backend.providers.openai.api-key}
 * </ul>
 *
 * <p>
 * The Feign client is created lazily on first use.
 *
 * @see me.growmies.assistant.infrastructure.http.FeignClientFactory
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiThreadAdapter implements ThreadBackendPort {

    static final String ROLE_USER = "user";
    static final String ROLE_ASSISTANT = "assistant";

    private final AssistantProperties properties;
    private final FeignClientFactory feignClientFactory;

    private volatile AssistantsApi client;

    @Override
    public boolean isAvailable() {
        AssistantProperties.ThreadBackendProperties thread = properties.getBackend().getThread();
        return thread.isEnabled()
                && thread.getAssistantId() != null && !thread.getAssistantId().isBlank()
                && sharedApiKey() != null;
    }

    @Override
    public String createThread(String credential) {
        ThreadObject thread = client().createThread(apiKey(credential), Map.of());
        if (thread == null || thread.getId() == null) {
            throw new IllegalStateException(BackendErrorClassifier.withCode(BackendErrorClassifier.THREAD_UNAVAILABLE,
                    "Thread creation returned no id"));
        }
        log.debug("[Backend] Created thread {}", thread.getId());
        return thread.getId();
    }

    @Override
    public void appendMessage(String threadId, String text, String credential) {
        MessageRequest request = new MessageRequest();
        request.setRole(ROLE_USER);
        request.setContent(text);
        client().createMessage(apiKey(credential), threadId, request);
    }

    @Override
    public ThreadRun startRun(String threadId, GenerationSettings settings, String credential) {
        AssistantProperties.ThreadBackendProperties thread = properties.getBackend().getThread();
        RunRequest request = new RunRequest();
        request.setAssistantId(thread.getAssistantId());
        request.setModel(settings.getModel() != null ? settings.getModel() : thread.getModel());
        if (settings.getInstructions() != null && !settings.getInstructions().isBlank()) {
            request.setAdditionalInstructions(settings.getInstructions());
        }
        request.setTemperature(settings.getTemperature());
        if (settings.getMaxTokens() > 0) {
            request.setMaxCompletionTokens(settings.getMaxTokens());
        }
        RunObject run = client().createRun(apiKey(credential), threadId, request);
        log.debug("[Backend] Started run {} on thread {}", run.getId(), threadId);
        return toThreadRun(run);
    }

    @Override
    public ThreadRun pollRun(String threadId, String runId, String credential) {
        return toThreadRun(client().getRun(apiKey(credential), threadId, runId));
    }

    @Override
    public String getLatestMessage(String threadId, String credential) {
        MessageList list = client().listLatestMessage(apiKey(credential), threadId);
        if (list == null || list.getData() == null || list.getData().isEmpty()) {
            throw new IllegalStateException(BackendErrorClassifier.withCode(
                    BackendErrorClassifier.THREAD_NO_ASSISTANT_MESSAGE, "Thread " + threadId + " has no messages"));
        }
        MessageObject latest = list.getData().get(0);
        if (!ROLE_ASSISTANT.equals(latest.getRole())) {
            throw new IllegalStateException(BackendErrorClassifier.withCode(
                    BackendErrorClassifier.THREAD_NO_ASSISTANT_MESSAGE,
                    "Latest message of thread " + threadId + " is from " + latest.getRole()));
        }
        StringBuilder text = new StringBuilder();
        if (latest.getContent() != null) {
            for (ContentPart part : latest.getContent()) {
                if ("text".equals(part.getType()) && part.getText() != null && part.getText().getValue() != null) {
                    if (text.length() > 0) {
                        text.append('\n');
                    }
                    text.append(part.getText().getValue());
                }
            }
        }
        return text.toString();
    }

    private ThreadRun toThreadRun(RunObject run) {
        if (run == null) {
            throw new IllegalStateException(BackendErrorClassifier.withCode(
                    BackendErrorClassifier.THREAD_RUN_FAILED, "Run response was empty"));
        }
        LlmUsage usage = null;
        if (run.getUsage() != null) {
            usage = LlmUsage.builder()
                    .inputTokens(run.getUsage().getPromptTokens())
                    .outputTokens(run.getUsage().getCompletionTokens())
                    .totalTokens(run.getUsage().getTotalTokens())
                    .build();
        }
        return ThreadRun.builder()
                .id(run.getId())
                .status(RunStatus.fromWire(run.getStatus()))
                .usage(usage)
                .model(run.getModel())
                .lastError(run.getLastError() != null ? run.getLastError().getMessage() : null)
                .build();
    }

    private AssistantsApi client() {
        AssistantsApi current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    String baseUrl = properties.getBackend().getThread().getBaseUrl();
                    while (baseUrl.endsWith("/")) {
                        baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
                    }
                    current = feignClientFactory.create(AssistantsApi.class, baseUrl);
                    client = current;
                    log.info("[Backend] Assistants API client initialized with URL: {}", baseUrl);
                }
            }
        }
        return current;
    }

    private String apiKey(String credential) {
        if (credential != null && !credential.isBlank()) {
            return credential;
        }
        String shared = sharedApiKey();
        if (shared == null) {
            throw new IllegalStateException(BackendErrorClassifier.withCode(BackendErrorClassifier.AUTHENTICATION,
                    "No API key configured for thread mode"));
        }
        return shared;
    }

    private String sharedApiKey() {
        String key = properties.getBackend().getThread().getApiKey();
        if (key != null && !key.isBlank()) {
            return key;
        }
        AssistantProperties.ProviderProperties openai = properties.getBackend().getProviders()
                .get(Langchain4jChatAdapter.PROVIDER_OPENAI);
        if (openai != null && openai.getApiKey() != null && !openai.getApiKey().isBlank()) {
            return openai.getApiKey();
        }
        return null;
    }

    // Feign API interface
    public interface AssistantsApi {

        @RequestLine("POST /threads")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}",
                "OpenAI-Beta: assistants=v2"
        })
        ThreadObject createThread(@Param("apiKey") String apiKey, Map<String, Object> body);

        @RequestLine("POST /threads/{threadId}/messages")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}",
                "OpenAI-Beta: assistants=v2"
        })
        MessageObject createMessage(@Param("apiKey") String apiKey, @Param("threadId") String threadId,
                MessageRequest request);

        @RequestLine("POST /threads/{threadId}/runs")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}",
                "OpenAI-Beta: assistants=v2"
        })
        RunObject createRun(@Param("apiKey") String apiKey, @Param("threadId") String threadId, RunRequest request);

        @RequestLine("GET /threads/{threadId}/runs/{runId}")
        @Headers({
                "Authorization: Bearer {apiKey}",
                "OpenAI-Beta: assistants=v2"
        })
        RunObject getRun(@Param("apiKey") String apiKey, @Param("threadId") String threadId,
                @Param("runId") String runId);

        @RequestLine("GET /threads/{threadId}/messages?order=desc&limit=1")
        @Headers({
                "Authorization: Bearer {apiKey}",
                "OpenAI-Beta: assistants=v2"
        })
        MessageList listLatestMessage(@Param("apiKey") String apiKey, @Param("threadId") String threadId);
    }

    // API DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ThreadObject {
        private String id;
    }

    @Data
    public static class MessageRequest {
        private String role;
        private String content;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RunRequest {
        @JsonProperty("assistant_id")
        private String assistantId;
        private String model;
        @JsonProperty("additional_instructions")
        private String additionalInstructions;
        private Double temperature;
        @JsonProperty("max_completion_tokens")
        private Integer maxCompletionTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RunObject {
        private String id;
        private String status;
        private String model;
        private ApiUsage usage;
        @JsonProperty("last_error")
        private ApiError lastError;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiError {
        private String code;
        private String message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessageList {
        private List<MessageObject> data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessageObject {
        private String id;
        private String role;
        private List<ContentPart> content;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContentPart {
        private String type;
        private TextValue text;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TextValue {
        private String value;
    }
}
