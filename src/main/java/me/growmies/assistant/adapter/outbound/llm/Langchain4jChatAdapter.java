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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.BackendMode;
import me.growmies.assistant.domain.model.BackendReply;
import me.growmies.assistant.domain.model.GenerationSettings;
import me.growmies.assistant.domain.model.LlmUsage;
import me.growmies.assistant.domain.model.Turn;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.port.outbound.ChatBackendPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stateless chat mode backed by langchain4j.
 *
 * <p>
 * The provider ({@code openai} or {@code anthropic}) comes from
 * {@code assistant.backend.chat.provider}; its shared key and optional base url
 * from {@code assistant.backend.providers.<name>}. Models built with the shared
 * key are cached per model name. A self-pay credential gets a throwaway model
 * so user keys are never retained.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jChatAdapter implements ChatBackendPort {

    static final String PROVIDER_OPENAI = "openai";
    static final String PROVIDER_ANTHROPIC = "anthropic";

    private final AssistantProperties properties;

    private final Map<String, ChatModel> sharedModels = new ConcurrentHashMap<>();

    @Override
    public BackendReply complete(List<Turn> messages, GenerationSettings settings, String credential) {
        String modelName = settings.getModel() != null
                ? settings.getModel()
                : properties.getBackend().getChat().getModel();

        ChatModel model = credential != null && !credential.isBlank()
                ? createModel(modelName, credential)
                : sharedModels.computeIfAbsent(modelName, name -> createModel(name, sharedApiKey()));

        ChatRequest request = ChatRequest.builder()
                .messages(convertMessages(messages))
                .temperature(settings.getTemperature())
                .maxOutputTokens(settings.getMaxTokens() > 0 ? settings.getMaxTokens() : null)
                .build();

        log.debug("[Backend] Chat completion: {} messages, model {}", messages.size(), modelName);
        ChatResponse response = model.chat(request);
        return convertResponse(response, modelName);
    }

    /**
     * Builds a model for one provider key.
     */
    protected ChatModel createModel(String modelName, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("No API key configured for chat provider " + provider());
        }
        AssistantProperties.ProviderProperties config = providerConfig();
        String baseUrl = config != null ? config.getBaseUrl() : null;

        if (PROVIDER_ANTHROPIC.equals(provider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(modelName)
                    .maxRetries(0)
                    .timeout(properties.getBackend().getChat().getTimeout());
            if (baseUrl != null && !baseUrl.isBlank()) {
                builder.baseUrl(baseUrl);
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .maxRetries(0)
                .timeout(properties.getBackend().getChat().getTimeout());
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(List<Turn> turns) {
        List<ChatMessage> messages = new ArrayList<>(turns.size());
        for (Turn turn : turns) {
            String content = turn.getContent() != null ? turn.getContent() : "";
            switch (turn.getRole()) {
            case Turn.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            case Turn.ROLE_ASSISTANT -> messages.add(AiMessage.from(content));
            default -> messages.add(toUserMessage(content, turn.getImageUrls()));
            }
        }
        return messages;
    }

    private UserMessage toUserMessage(String content, List<String> imageUrls) {
        if (imageUrls == null || imageUrls.isEmpty()) {
            return UserMessage.from(content);
        }
        List<Content> contents = new ArrayList<>();
        contents.add(TextContent.from(content));
        for (String url : imageUrls) {
            contents.add(ImageContent.from(url));
        }
        return UserMessage.from(contents);
    }

    private BackendReply convertResponse(ChatResponse response, String requestedModel) {
        AiMessage aiMessage = response.aiMessage();
        LlmUsage usage = LlmUsage.empty();
        TokenUsage tokenUsage = response.tokenUsage();
        if (tokenUsage != null) {
            usage = LlmUsage.of(valueOf(tokenUsage.inputTokenCount()), valueOf(tokenUsage.outputTokenCount()));
        }
        String model = response.modelName() != null ? response.modelName() : requestedModel;
        return BackendReply.builder()
                .text(aiMessage != null ? aiMessage.text() : null)
                .usage(usage)
                .model(model)
                .modeUsed(BackendMode.CHAT)
                .build();
    }

    private static int valueOf(Integer count) {
        return count != null ? count : 0;
    }

    private String provider() {
        String provider = properties.getBackend().getChat().getProvider();
        return provider != null ? provider.trim().toLowerCase(Locale.ROOT) : PROVIDER_OPENAI;
    }

    private AssistantProperties.ProviderProperties providerConfig() {
        return properties.getBackend().getProviders().get(provider());
    }

    private String sharedApiKey() {
        AssistantProperties.ProviderProperties config = providerConfig();
        return config != null ? config.getApiKey() : null;
    }
}
