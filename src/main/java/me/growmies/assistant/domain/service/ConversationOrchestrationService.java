package me.growmies.assistant.domain.service;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.AuditEvent;
import me.growmies.assistant.domain.model.BackendReply;
import me.growmies.assistant.domain.model.BackendResult;
import me.growmies.assistant.domain.model.BalanceCheck;
import me.growmies.assistant.domain.model.BillingDecision;
import me.growmies.assistant.domain.model.ChatRequest;
import me.growmies.assistant.domain.model.ChatResponse;
import me.growmies.assistant.domain.model.ChatSession;
import me.growmies.assistant.domain.model.ComplianceVerdict;
import me.growmies.assistant.domain.model.ContextWindow;
import me.growmies.assistant.domain.model.Conversation;
import me.growmies.assistant.domain.model.ConversationCategory;
import me.growmies.assistant.domain.model.ConversationMessage;
import me.growmies.assistant.domain.model.ConversationStats;
import me.growmies.assistant.domain.model.EligibilityResult;
import me.growmies.assistant.domain.model.ErrorType;
import me.growmies.assistant.domain.model.FilteredOutput;
import me.growmies.assistant.domain.model.ImageAttachment;
import me.growmies.assistant.domain.model.LlmUsage;
import me.growmies.assistant.domain.model.SessionKey;
import me.growmies.assistant.domain.model.Turn;
import me.growmies.assistant.domain.model.UserPreferences;
import me.growmies.assistant.domain.system.BackendErrorClassifier;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.infrastructure.i18n.MessageService;
import me.growmies.assistant.port.inbound.ConversationPort;
import me.growmies.assistant.port.outbound.AuditPort;
import me.growmies.assistant.port.outbound.EligibilityPort;
import me.growmies.assistant.port.outbound.KnowledgePort;
import me.growmies.assistant.port.outbound.SessionPort;
import me.growmies.assistant.security.ComplianceFilter;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one chat exchange end to end: validation, age gate, billing pre-flight,
 * conversation and session bookkeeping, context assembly, backend dispatch,
 * output filtering, settlement and reply formatting.
 *
 * <p>
 * The session is touched in two short critical sections (user turn before the
 * backend call, assistant turn after it); no session lock is held while the
 * backend works. The backend call itself runs on a bounded dispatch pool under
 * {@code assistant.backend.request-timeout} and is cancelled when the deadline
 * passes. Credits are only deducted after a reply was produced.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ConversationOrchestrationService implements ConversationPort {

    private static final AtomicInteger DISPATCH_THREADS = new AtomicInteger();

    private final SessionPort sessions;
    private final ConversationService conversations;
    private final UserPreferencesService preferencesService;
    private final UsageMeterService usageMeter;
    private final BackendSelectionService backendSelection;
    private final ContextBudgetService contextBudget;
    private final SystemPromptService promptService;
    private final ReplyFormattingService replyFormatting;
    private final ComplianceFilter complianceFilter;
    private final TokenCounter tokenCounter;
    private final EligibilityPort eligibilityPort;
    private final KnowledgePort knowledgePort;
    private final AuditPort auditPort;
    private final MessageService messages;
    private final AssistantProperties properties;
    private final Clock clock;

    private final ThreadPoolExecutor dispatchExecutor;

    @SuppressWarnings("PMD.ExcessiveParameterList")
    public ConversationOrchestrationService(SessionPort sessions, ConversationService conversations,
            UserPreferencesService preferencesService, UsageMeterService usageMeter,
            BackendSelectionService backendSelection, ContextBudgetService contextBudget,
            SystemPromptService promptService, ReplyFormattingService replyFormatting,
            ComplianceFilter complianceFilter, TokenCounter tokenCounter, EligibilityPort eligibilityPort,
            KnowledgePort knowledgePort, AuditPort auditPort, MessageService messages,
            AssistantProperties properties, Clock clock) {
        this.sessions = sessions;
        this.conversations = conversations;
        this.preferencesService = preferencesService;
        this.usageMeter = usageMeter;
        this.backendSelection = backendSelection;
        this.contextBudget = contextBudget;
        this.promptService = promptService;
        this.replyFormatting = replyFormatting;
        this.complianceFilter = complianceFilter;
        this.tokenCounter = tokenCounter;
        this.eligibilityPort = eligibilityPort;
        this.knowledgePort = knowledgePort;
        this.auditPort = auditPort;
        this.messages = messages;
        this.properties = properties;
        this.clock = clock;
        this.dispatchExecutor = buildDispatchExecutor(properties.getBackend());
    }

    private static ThreadPoolExecutor buildDispatchExecutor(AssistantProperties.BackendProperties backend) {
        int threads = Math.max(1, backend.getDispatchThreads());
        BlockingQueue<Runnable> queue = new ArrayBlockingQueue<>(Math.max(1, backend.getDispatchQueueCapacity()));
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "backend-dispatch-" + DISPATCH_THREADS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS, queue, factory);
    }

    @PreDestroy
    public void shutdown() {
        dispatchExecutor.shutdownNow();
    }

    @Override
    public ChatResponse handleMessage(ChatRequest request) {
        Optional<String> invalid = validate(request);
        if (invalid.isPresent()) {
            log.debug("[Orchestrator] Rejected request: {}", invalid.get());
            return ChatResponse.failure(ErrorType.VALIDATION, invalid.get(), false);
        }
        ConversationCategory category = ConversationCategory.fromCode(request.getCategory())
                .orElse(ConversationCategory.GENERAL);
        try {
            return process(request, category);
        } catch (RuntimeException e) { // NOSONAR - last line of defence for the command layer
            log.error("[Orchestrator] Unexpected failure for user {} in channel {}", request.getUserId(),
                    request.getChannelId(), e);
            recordError(request, category, "internal", e.getMessage());
            return ChatResponse.failure(ErrorType.BACKEND, messages.getMessage("chat.error.internal"), true);
        }
    }

    private ChatResponse process(ChatRequest request, ConversationCategory category) {
        String userId = request.getUserId();
        String guildId = request.getGuildId();
        String channelId = request.getChannelId();

        // 2. age gate
        if (category.isRestricted() && !isEligible(userId, guildId)) {
            log.info("[Orchestrator] User {} not verified for category {}", userId, category.getCode());
            return ChatResponse.verificationRequired(messages.getMessage("chat.error.verification"));
        }

        // 3. billing pre-flight
        UserPreferences preferences = preferencesService.getPreferences(userId, guildId);
        BillingDecision billing = usageMeter.chooseBillingMode(userId, guildId, preferences);
        BalanceCheck balance;
        try {
            balance = usageMeter.checkBalance(billing, userId, guildId);
        } catch (RuntimeException e) { // NOSONAR - ledger outage must not reach the backend
            log.warn("[Billing] Balance lookup failed for {}: {}", userId, e.getMessage());
            return ChatResponse.failure(ErrorType.BILLING, messages.getMessage("chat.error.billing_unavailable"),
                    true);
        }
        if (!balance.sufficient()) {
            log.info("[Billing] User {} has {} credits, {} required", userId, balance.balance(), balance.required());
            return ChatResponse.failure(ErrorType.BILLING,
                    messages.getMessage("chat.error.insufficient_balance", balance.required(), balance.balance()),
                    false);
        }

        // 4. conversation and session
        Conversation conversation = conversations.getOrCreateActive(userId, guildId, channelId, category);
        SessionKey key = SessionKey.of(userId, channelId);
        sessions.getOrCreate(userId, channelId);

        // 5. classification and escalation
        ComplianceVerdict verdict = complianceFilter.classify(request.getMessage());
        boolean escalated = !category.isRestricted() && verdict.restrictedSubject();
        if (escalated) {
            Optional<ChatResponse> blocked = handleEscalation(request, conversation, verdict);
            if (blocked.isPresent()) {
                return blocked.get();
            }
        }

        // 6. user turn, critical section 1
        ChatSession session = sessions.append(key, Turn.ROLE_USER, request.getMessage());
        conversations.logMessage(ConversationMessage.builder()
                .id(UUID.randomUUID().toString())
                .conversationId(conversation.getId())
                .userId(userId)
                .guildId(guildId)
                .channelId(channelId)
                .role(Turn.ROLE_USER)
                .content(request.getMessage())
                .restrictedContent(category.isRestricted() || verdict.restrictedSubject())
                .tokenCount(tokenCounter.count(request.getMessage()))
                .billingMode(billing.getMode())
                .createdAt(clock.instant())
                .build());

        // 7. context
        ContextWindow context = contextBudget.buildContext(
                promptService.buildSystemPrompt(category, preferences),
                history(session, conversation, preferences, request),
                knowledgeSnippets(category, request.getMessage()),
                properties.getContext().getMaxContextTokens());

        // 8. backend
        BackendResult result = dispatch(conversation, context, category, preferences, billing);
        if (!result.isSuccess()) {
            conversations.saveState(conversation);
            boolean retryable = BackendErrorClassifier.isTransient(result.getErrorCode());
            log.warn("[Orchestrator] Backend failed for conversation {} ({})", conversation.getId(),
                    result.getErrorCode());
            recordError(request, category, result.getErrorCode(), result.getErrorMessage());
            return ChatResponse.failure(ErrorType.BACKEND,
                    messages.getMessage(retryable ? "chat.error.backend_transient" : "chat.error.backend"),
                    retryable);
        }
        BackendReply reply = result.getReply();
        LlmUsage usage = effectiveUsage(reply, context);

        // 9. filter, assistant turn (critical section 2)
        FilteredOutput filtered = complianceFilter.filterOutput(reply.getText(), category);
        session = sessions.append(key, Turn.ROLE_ASSISTANT, filtered.text());
        long cost = billing.isMetered()
                ? usageMeter.estimateCost(usage.getInputTokens(), usage.getOutputTokens(), reply.getModel())
                : 0;
        conversations.logMessage(ConversationMessage.builder()
                .id(UUID.randomUUID().toString())
                .conversationId(conversation.getId())
                .userId(userId)
                .guildId(guildId)
                .channelId(channelId)
                .role(Turn.ROLE_ASSISTANT)
                .content(filtered.text())
                .restrictedContent(category.isRestricted() || complianceFilter.classify(filtered.text())
                        .restrictedSubject())
                .tokenCount(usage.getOutputTokens())
                .backendMode(reply.getModeUsed())
                .model(reply.getModel())
                .filtered(filtered.wasModified())
                .complianceIssues(new ArrayList<>(filtered.issues()))
                .billedCost(cost)
                .billingMode(billing.getMode())
                .createdAt(clock.instant())
                .build());

        // 10. settlement and counters
        long deducted = settle(userId, guildId, billing, cost);
        conversations.recordExchange(conversation, 2, usage.getTotalTokens());

        // 11. reply
        ChatResponse response = buildResponse(conversation, category, verdict, escalated, context, filtered, reply,
                usage, billing, cost, deducted, session);
        recordInteraction(request, conversation, category, escalated, reply, usage, filtered, billing, cost,
                deducted);
        return response;
    }

    @Override
    public boolean clearConversation(String userId, String guildId, String channelId) {
        requireIds(userId, guildId, channelId);
        boolean sessionCleared = sessions.clear(SessionKey.of(userId, channelId));
        boolean archived = conversations.archiveActive(userId, guildId, channelId,
                ConversationService.END_REASON_USER_CLEARED);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sessionCleared", sessionCleared);
        details.put("conversationArchived", archived);
        audit(AuditEvent.CONVERSATION_CLEARED, userId, guildId, channelId, AuditEvent.SEVERITY_LOW, details);
        log.info("[Orchestrator] Cleared conversation of user {} in channel {} (session: {}, archived: {})",
                userId, channelId, sessionCleared, archived);
        return sessionCleared || archived;
    }

    @Override
    public ConversationStats getConversationStats(String userId, String guildId, String channelId) {
        requireIds(userId, guildId, channelId);
        UserPreferences preferences = preferencesService.getPreferences(userId, guildId);
        BillingDecision billing = usageMeter.chooseBillingMode(userId, guildId, preferences);

        ConversationStats.ConversationStatsBuilder stats = ConversationStats.builder()
                .preferences(preferences.masked())
                .billingMode(billing.getMode());

        conversations.findActive(userId, guildId, channelId).ifPresent(conversation -> stats
                .conversationId(conversation.getId())
                .category(conversation.getCategory().getCode())
                .messageCount(conversation.getMessageCount())
                .totalTokens(conversation.getTotalTokens())
                .startedAt(conversation.getStartedAt())
                .lastActivityAt(conversation.getLastActivityAt())
                .backendState(conversation.getBackendState()));

        sessions.find(SessionKey.of(userId, channelId)).ifPresent(session -> stats.session(sessionInfo(session)));

        if (billing.isMetered()) {
            try {
                stats.balance(usageMeter.currentBalance(userId, guildId));
            } catch (RuntimeException e) { // NOSONAR - stats are informational
                log.warn("[Billing] Balance lookup failed for {}: {}", userId, e.getMessage());
            }
        }
        return stats.build();
    }

    // ==================== VALIDATION ====================

    Optional<String> validate(ChatRequest request) {
        if (request == null || isBlank(request.getUserId()) || isBlank(request.getGuildId())
                || isBlank(request.getChannelId())) {
            return Optional.of(messages.getMessage("chat.error.validation.ids"));
        }
        String message = request.getMessage();
        if (message == null || message.isBlank()) {
            return Optional.of(messages.getMessage("chat.error.validation.empty"));
        }
        if (message.length() > ChatRequest.MAX_MESSAGE_LENGTH) {
            return Optional.of(messages.getMessage("chat.error.validation.too_long", ChatRequest.MAX_MESSAGE_LENGTH));
        }
        if (ConversationCategory.fromCode(request.getCategory()).isEmpty()) {
            return Optional.of(messages.getMessage("chat.error.validation.category", request.getCategory()));
        }
        if (request.getImageAttachments() != null) {
            for (ImageAttachment attachment : request.getImageAttachments()) {
                if (!isValidImage(attachment)) {
                    return Optional.of(messages.getMessage("chat.error.validation.image",
                            attachment != null ? attachment.getUrl() : "null"));
                }
            }
        }
        return Optional.empty();
    }

    private boolean isValidImage(ImageAttachment attachment) {
        if (attachment == null || isBlank(attachment.getUrl()) || isBlank(attachment.getContentType())) {
            return false;
        }
        String url = attachment.getUrl().toLowerCase(Locale.ROOT);
        return (url.startsWith("https://") || url.startsWith("http://"))
                && attachment.getContentType().toLowerCase(Locale.ROOT).startsWith("image/");
    }

    private static void requireIds(String userId, String guildId, String channelId) {
        if (isBlank(userId) || isBlank(guildId) || isBlank(channelId)) {
            throw new IllegalArgumentException("userId, guildId and channelId are required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ==================== STEPS ====================

    private boolean isEligible(String userId, String guildId) {
        try {
            EligibilityResult result = eligibilityPort.verify(userId, guildId);
            return result != null && result.eligible();
        } catch (RuntimeException e) { // NOSONAR - unknown eligibility is treated as unverified
            log.warn("[Orchestrator] Eligibility check failed for {}: {}", userId, e.getMessage());
            return false;
        }
    }

    /**
     * A general-category message that mentions restricted subjects. Under
     * {@code BLOCK} the user must be verified to continue; under
     * {@code ANNOTATE} the exchange is only flagged.
     */
    private Optional<ChatResponse> handleEscalation(ChatRequest request, Conversation conversation,
            ComplianceVerdict verdict) {
        AssistantProperties.EscalationPolicy policy = properties.getCompliance().getEscalationPolicy();
        boolean eligible = policy != AssistantProperties.EscalationPolicy.BLOCK
                || isEligible(request.getUserId(), request.getGuildId());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("conversationId", conversation.getId());
        details.put("matchedTerms", verdict.matchedTerms());
        details.put("policy", policy.name());
        details.put("allowed", eligible);
        audit(AuditEvent.RESTRICTED_CONTENT_ESCALATED, request.getUserId(), request.getGuildId(),
                request.getChannelId(), AuditEvent.SEVERITY_MEDIUM, details);

        if (!eligible) {
            log.info("[Compliance] Escalated message from unverified user {} blocked", request.getUserId());
            return Optional.of(ChatResponse.verificationRequired(messages.getMessage("chat.error.verification")));
        }
        if (!conversation.isAgeGated()) {
            conversation.setAgeGated(true);
        }
        return Optional.empty();
    }

    private List<Turn> history(ChatSession session, Conversation conversation, UserPreferences preferences,
            ChatRequest request) {
        List<Turn> turns = session.getTurns();
        List<Turn> history;
        if (!preferences.isConversationHistoryEnabled()) {
            history = new ArrayList<>(turns.subList(turns.size() - 1, turns.size()));
        } else if (turns.size() == 1) {
            history = new ArrayList<>(persistedTurns(conversation, request.getMessage()));
            history.addAll(turns);
        } else {
            history = new ArrayList<>(turns);
        }
        if (request.getImageAttachments() != null && !request.getImageAttachments().isEmpty()) {
            List<String> urls = request.getImageAttachments().stream().map(ImageAttachment::getUrl).toList();
            int last = history.size() - 1;
            history.set(last, history.get(last).withImageUrls(urls));
        }
        return history;
    }

    /**
     * Earlier turns of a conversation whose in-memory session expired, read
     * back from the message log. The current message is logged before the
     * context is built and is left out.
     */
    private List<Turn> persistedTurns(Conversation conversation, String currentMessage) {
        List<ConversationMessage> logged = conversations.recentMessages(conversation.getId(),
                sessions.getMaxTurns() + 1);
        int end = logged.size();
        if (end > 0) {
            ConversationMessage latest = logged.get(end - 1);
            if (Turn.ROLE_USER.equals(latest.getRole()) && Objects.equals(latest.getContent(), currentMessage)) {
                end--;
            }
        }
        List<Turn> turns = new ArrayList<>();
        for (ConversationMessage message : logged.subList(0, end)) {
            if (Turn.ROLE_USER.equals(message.getRole()) || Turn.ROLE_ASSISTANT.equals(message.getRole())) {
                turns.add(Turn.builder()
                        .role(message.getRole())
                        .content(message.getContent())
                        .timestamp(message.getCreatedAt())
                        .build());
            }
        }
        if (!turns.isEmpty()) {
            log.debug("[Orchestrator] Restored {} turns of conversation {} from the message log", turns.size(),
                    conversation.getId());
        }
        return turns;
    }

    private List<String> knowledgeSnippets(ConversationCategory category, String query) {
        int limit = properties.getContext().getKnowledgeSnippetLimit();
        if (limit <= 0) {
            return List.of();
        }
        try {
            List<String> snippets = knowledgePort.search(category, query, limit);
            return snippets != null ? snippets : List.of();
        } catch (RuntimeException e) { // NOSONAR - knowledge is optional context
            log.debug("[Orchestrator] Knowledge lookup failed: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Runs the backend on the dispatch pool under the request timeout. The
     * backend works on a copy of the conversation; its backend state is taken
     * over only when the dispatch finished in time, so a cancelled task never
     * races the request thread.
     */
    private BackendResult dispatch(Conversation conversation, ContextWindow context, ConversationCategory category,
            UserPreferences preferences, BillingDecision billing) {
        Duration timeout = properties.getBackend().getRequestTimeout();
        Conversation working = conversation.toBuilder().build();
        Future<BackendResult> future;
        try {
            future = dispatchExecutor.submit(() -> backendSelection.respond(working, context,
                    promptService.chatSettings(category, preferences),
                    promptService.threadSettings(category, preferences),
                    billing.getCredential()));
        } catch (RejectedExecutionException e) {
            log.warn("[Orchestrator] Dispatch pool saturated, rejecting request for conversation {}",
                    conversation.getId());
            return BackendResult.fatalError(BackendErrorClassifier.OVERLOADED, "Dispatch pool saturated");
        }
        try {
            BackendResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            conversation.setBackendState(working.getBackendState());
            conversation.setThreadId(working.getThreadId());
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            return BackendResult.fatalError(BackendErrorClassifier.TIMEOUT,
                    "Backend did not answer within " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return BackendResult.fatalError(BackendErrorClassifier.REQUEST_ABORTED, "Request interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return BackendResult.fatalError(BackendErrorClassifier.classify(cause), cause.getMessage());
        }
    }

    /**
     * Usage reported by the backend, or a local estimate when it reported none.
     */
    private LlmUsage effectiveUsage(BackendReply reply, ContextWindow context) {
        LlmUsage usage = reply.getUsage();
        if (usage != null && usage.getTotalTokens() > 0) {
            return usage;
        }
        return LlmUsage.of(context.getTotalTokens(), tokenCounter.count(reply.getText()));
    }

    private long settle(String userId, String guildId, BillingDecision billing, long cost) {
        try {
            return usageMeter.settle(userId, guildId, billing, cost);
        } catch (RuntimeException e) { // NOSONAR - the reply is delivered even if settlement fails
            log.error("[Billing] Failed to deduct {} credits from user {}: {}", cost, userId, e.getMessage());
            return 0;
        }
    }

    // ==================== RESPONSE ====================

    @SuppressWarnings("java:S107")
    private ChatResponse buildResponse(Conversation conversation, ConversationCategory category,
            ComplianceVerdict verdict, boolean escalated, ContextWindow context, FilteredOutput filtered,
            BackendReply reply, LlmUsage usage, BillingDecision billing, long cost, long deducted,
            ChatSession session) {
        List<String> pages = replyFormatting.paginate(filtered.text());
        return ChatResponse.builder()
                .success(true)
                .text(pages.get(0))
                .additionalPages(new ArrayList<>(pages.subList(1, pages.size())))
                .compliance(ChatResponse.ComplianceInfo.builder()
                        .category(category.getCode())
                        .ageGated(conversation.isAgeGated())
                        .restrictedContentDetected(verdict.restrictedSubject())
                        .escalated(escalated)
                        .filtered(filtered.wasModified())
                        .issues(new ArrayList<>(filtered.issues()))
                        .contextTruncated(context.isTruncated())
                        .build())
                .usage(ChatResponse.UsageInfo.builder()
                        .inputTokens(usage.getInputTokens())
                        .outputTokens(usage.getOutputTokens())
                        .totalTokens(usage.getTotalTokens())
                        .cost(cost)
                        .deducted(deducted)
                        .billingMode(billing.getMode())
                        .model(reply.getModel())
                        .backendMode(reply.getModeUsed())
                        .build())
                .session(sessionInfo(session))
                .suggestions(replyFormatting.suggestions(category, filtered.text()))
                .reactions(replyFormatting.reactions(filtered.text()))
                .conversationId(conversation.getId())
                .build();
    }

    private ChatResponse.SessionInfo sessionInfo(ChatSession session) {
        return ChatResponse.SessionInfo.builder()
                .turnCount(session.getTurnCount())
                .maxTurns(sessions.getMaxTurns())
                .secondsRemaining(sessions.secondsRemaining(session))
                .build();
    }

    // ==================== AUDIT ====================

    @SuppressWarnings("java:S107")
    private void recordInteraction(ChatRequest request, Conversation conversation, ConversationCategory category,
            boolean escalated, BackendReply reply, LlmUsage usage, FilteredOutput filtered, BillingDecision billing,
            long cost, long deducted) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("conversationId", conversation.getId());
        details.put("category", category.getCode());
        details.put("ageGated", conversation.isAgeGated());
        details.put("escalated", escalated);
        details.put("backendMode", reply.getModeUsed() != null ? reply.getModeUsed().name() : null);
        details.put("fallbackUsed", reply.isFallbackUsed());
        details.put("model", reply.getModel());
        details.put("messageLength", request.getMessage().length());
        details.put("imageCount", request.getImageAttachments() != null ? request.getImageAttachments().size() : 0);
        details.put("totalTokens", usage.getTotalTokens());
        details.put("billingMode", billing.getMode().name());
        details.put("cost", cost);
        details.put("deducted", deducted);
        details.put("filtered", filtered.wasModified());
        details.put("complianceIssues", filtered.issues());
        String severity = category.isRestricted() || escalated ? AuditEvent.SEVERITY_MEDIUM : AuditEvent.SEVERITY_LOW;
        audit(AuditEvent.CHAT_INTERACTION, request.getUserId(), request.getGuildId(), request.getChannelId(),
                severity, details);
    }

    private void recordError(ChatRequest request, ConversationCategory category, String code, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("category", category.getCode());
        details.put("errorCode", code);
        details.put("error", message);
        audit(AuditEvent.CHAT_ERROR, request.getUserId(), request.getGuildId(), request.getChannelId(),
                AuditEvent.SEVERITY_HIGH, details);
    }

    private void audit(String type, String userId, String guildId, String channelId, String severity,
            Map<String, Object> details) {
        try {
            auditPort.record(AuditEvent.builder()
                    .type(type)
                    .userId(userId)
                    .guildId(guildId)
                    .channelId(channelId)
                    .severity(severity)
                    .timestamp(clock.instant())
                    .details(details)
                    .build());
        } catch (RuntimeException e) { // NOSONAR - auditing never affects the exchange
            log.warn("[Audit] Failed to record {}: {}", type, e.getMessage());
        }
    }
}
