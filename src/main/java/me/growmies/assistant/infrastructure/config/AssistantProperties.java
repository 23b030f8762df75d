package me.growmies.assistant.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the assistant, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code assistant.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - file-backed persistence</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link SessionProperties} - in-memory session bounds</li>
 * <li>{@link ConversationProperties} - durable conversation caps</li>
 * <li>{@link ContextProperties} - token budgets</li>
 * <li>{@link BackendProperties} - chat and thread backends</li>
 * <li>{@link BillingProperties} - rates and billing modes</li>
 * <li>{@link ComplianceProperties}, {@link AuditProperties},
 * {@link ReplyProperties}</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "assistant")
@Data
public class AssistantProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private SessionProperties session = new SessionProperties();
    private ConversationProperties conversation = new ConversationProperties();
    private ContextProperties context = new ContextProperties();
    private BackendProperties backend = new BackendProperties();
    private BillingProperties billing = new BillingProperties();
    private ComplianceProperties compliance = new ComplianceProperties();
    private AuditProperties audit = new AuditProperties();
    private ReplyProperties reply = new ReplyProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.growmies/assistant";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== SESSION ====================

    @Data
    public static class SessionProperties {
        /** Idle time after which a session is discarded. */
        private Duration timeout = Duration.ofMinutes(10);
        private int maxTurns = 10;
        /** Trailing user turns kept when max-turns is exceeded. */
        private int retainTurns = 5;
        private Duration sweepInterval = Duration.ofSeconds(60);
    }

    // ==================== CONVERSATION ====================

    @Data
    public static class ConversationProperties {
        private Duration idleTimeout = Duration.ofMinutes(60);
        private int maxMessages = 50;
        private long maxTokens = 10000;
        private Duration maxAge = Duration.ofHours(24);
    }

    // ==================== CONTEXT ====================

    @Data
    public static class ContextProperties {
        private int maxContextTokens = 3000;
        private int maxResponseTokens = 1000;
        private int knowledgeSnippetLimit = 5;
    }

    // ==================== BACKENDS ====================

    @Data
    public static class BackendProperties {
        /** Wall-clock ceiling for one backend dispatch, fallback included. */
        private Duration requestTimeout = Duration.ofSeconds(90);
        /** Worker threads running backend dispatches. */
        private int dispatchThreads = 16;
        /** Dispatches waiting for a worker before new requests are rejected. */
        private int dispatchQueueCapacity = 64;
        private ChatBackendProperties chat = new ChatBackendProperties();
        private ThreadBackendProperties thread = new ThreadBackendProperties();
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ChatBackendProperties {
        /** openai or anthropic */
        private String provider = "openai";
        private String model = "gpt-4-turbo-preview";
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class ThreadBackendProperties {
        private boolean enabled = false;
        private String assistantId;
        private String model = "gpt-4.1-mini";
        private String baseUrl = "https://api.openai.com/v1";
        /** Falls back to the openai provider key when blank. */
        private String apiKey;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration maxWait = Duration.ofSeconds(30);
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    // ==================== BILLING ====================

    @Data
    public static class BillingProperties {
        private long minimumBalance = 10;
        /** Rates of this model apply to models missing from {@link #rates}. */
        private String defaultModel = "gpt-4-turbo-preview";
        private Map<String, RateProperties> rates = defaultRates();
        private List<String> vipUsers = new ArrayList<>();
        /** Balance of a user the ledger has never seen. */
        private long initialBalance = 0;
    }

    /**
     * Credits per 1K tokens.
     */
    @Data
    public static class RateProperties {
        private double inputPer1k;
        private double outputPer1k;

        public static RateProperties of(double inputPer1k, double outputPer1k) {
            RateProperties rate = new RateProperties();
            rate.setInputPer1k(inputPer1k);
            rate.setOutputPer1k(outputPer1k);
            return rate;
        }
    }

    private static Map<String, RateProperties> defaultRates() {
        Map<String, RateProperties> rates = new LinkedHashMap<>();
        rates.put("gpt-4-turbo-preview", RateProperties.of(1.0, 3.0));
        rates.put("gpt-4", RateProperties.of(3.0, 6.0));
        rates.put("gpt-3.5-turbo", RateProperties.of(0.05, 0.15));
        rates.put("gpt-4.1-mini", RateProperties.of(0.5, 1.5));
        return rates;
    }

    // ==================== COMPLIANCE ====================

    public enum EscalationPolicy {
        /** Re-check eligibility and refuse when the user is not verified. */
        BLOCK,
        /** Continue and only flag the exchange. */
        ANNOTATE
    }

    @Data
    public static class ComplianceProperties {
        private EscalationPolicy escalationPolicy = EscalationPolicy.BLOCK;
    }

    @Data
    public static class AuditProperties {
        private String directory = "audit";
        private int queueCapacity = 1000;
    }

    @Data
    public static class ReplyProperties {
        private int pageLimit = 2000;
        private String footer = "*🤖 Generated by AI assistant*";
        private int maxSuggestions = 3;
    }
}
