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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.BackendMode;
import me.growmies.assistant.domain.model.BackendReply;
import me.growmies.assistant.domain.model.BackendResult;
import me.growmies.assistant.domain.model.BackendState;
import me.growmies.assistant.domain.model.ContextWindow;
import me.growmies.assistant.domain.model.Conversation;
import me.growmies.assistant.domain.model.GenerationSettings;
import me.growmies.assistant.domain.model.LlmUsage;
import me.growmies.assistant.domain.model.RunStatus;
import me.growmies.assistant.domain.model.ThreadRun;
import me.growmies.assistant.domain.system.BackendErrorClassifier;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.port.outbound.ChatBackendPort;
import me.growmies.assistant.port.outbound.ThreadBackendPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chooses between thread mode and chat mode for a conversation and falls back
 * from the former to the latter.
 *
 * <p>
 * Per conversation the backend moves through
 * {@code NO_BACKEND_CHOSEN -> THREAD_CREATING -> THREAD_ACTIVE | THREAD_FAILED -> CHAT_ACTIVE}.
 * A conversation that has left thread mode never returns to it: the state is
 * written on the {@link Conversation} (persisted by the caller) and its id is
 * also kept in a bounded in-process cache of recent downgrades, so a stale copy
 * loaded from storage cannot re-enter thread mode either.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BackendSelectionService {

    private final ChatBackendPort chatBackend;
    private final ThreadBackendPort threadBackend;
    private final AssistantProperties properties;

    static final int DOWNGRADE_CACHE_MAX_ENTRIES = 10_000;

    private final Map<String, Boolean> downgraded = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f,
            true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > DOWNGRADE_CACHE_MAX_ENTRIES;
        }
    });

    /**
     * Produces a reply for the latest turn of {@code context}. Mutates the
     * backend state and thread id of {@code conversation}.
     *
     * <p>
     * A recoverable thread failure falls back to chat mode. A fatal result, such
     * as an interrupted dispatch, is returned as is: the conversation keeps its
     * backend state and no chat completion is requested.
     */
    public BackendResult respond(Conversation conversation, ContextWindow context, GenerationSettings chatSettings,
            GenerationSettings threadSettings, String credential) {
        if (isThreadModeAllowed(conversation)) {
            BackendResult threadResult = respondViaThread(conversation, context, threadSettings, credential);
            if (!threadResult.isRecoverable()) {
                return threadResult;
            }
            if (Thread.currentThread().isInterrupted()) {
                return aborted();
            }
            downgrade(conversation, threadResult.getErrorCode(), threadResult.getErrorMessage());
            return respondViaChat(context, chatSettings, credential, true);
        }

        if (conversation.getBackendState() != BackendState.CHAT_ACTIVE) {
            conversation.setBackendState(BackendState.CHAT_ACTIVE);
        }
        return respondViaChat(context, chatSettings, credential, false);
    }

    public boolean isDowngraded(String conversationId) {
        return conversationId != null && downgraded.containsKey(conversationId);
    }

    boolean isThreadModeAllowed(Conversation conversation) {
        if (!properties.getBackend().getThread().isEnabled() || !threadBackend.isAvailable()) {
            return false;
        }
        BackendState state = conversation.getBackendState();
        if (state == BackendState.CHAT_ACTIVE || state == BackendState.THREAD_FAILED) {
            return false;
        }
        return !isDowngraded(conversation.getId());
    }

    private BackendResult respondViaThread(Conversation conversation, ContextWindow context,
            GenerationSettings settings, String credential) {
        try {
            String threadId = conversation.getThreadId();
            if (threadId == null || threadId.isBlank() || conversation.getBackendState() != BackendState.THREAD_ACTIVE) {
                conversation.setBackendState(BackendState.THREAD_CREATING);
                threadId = threadBackend.createThread(credential);
                conversation.setThreadId(threadId);
                log.info("[Backend] Thread created for conversation {}", conversation.getId());
            }
            conversation.setBackendState(BackendState.THREAD_ACTIVE);

            threadBackend.appendMessage(threadId, context.latestTurn().getContent(), credential);
            ThreadRun run = threadBackend.startRun(threadId, settings, credential);
            ThreadRun finished = awaitRun(threadId, run, credential);
            if (finished == null) {
                return BackendResult.recoverableError(BackendErrorClassifier.THREAD_RUN_TIMEOUT,
                        "Run " + run.getId() + " did not finish within "
                                + format(properties.getBackend().getThread().getMaxWait()));
            }
            if (finished.getStatus() != RunStatus.COMPLETED) {
                String detail = finished.getLastError() != null ? finished.getLastError() : "";
                return BackendResult.recoverableError(BackendErrorClassifier.THREAD_RUN_FAILED,
                        "Run " + finished.getId() + " ended with status " + finished.getStatus() + " " + detail);
            }

            String text = threadBackend.getLatestMessage(threadId, credential);
            if (text == null || text.isBlank()) {
                return BackendResult.recoverableError(BackendErrorClassifier.EMPTY_REPLY,
                        "Thread returned an empty assistant message");
            }
            return BackendResult.success(BackendReply.builder()
                    .text(text)
                    .usage(finished.getUsage() != null ? finished.getUsage() : LlmUsage.empty())
                    .model(finished.getModel() != null ? finished.getModel() : settings.getModel())
                    .modeUsed(BackendMode.THREAD)
                    .fallbackUsed(false)
                    .build());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return aborted();
        } catch (RuntimeException e) { // NOSONAR - any thread failure downgrades to chat mode
            if (Thread.currentThread().isInterrupted()) {
                return aborted();
            }
            return BackendResult.recoverableError(BackendErrorClassifier.classify(e), e.getMessage());
        }
    }

    /**
     * Polls until the run reaches a terminal status.
     *
     * @return the terminal run, or null when {@code max-wait} elapsed first
     */
    private ThreadRun awaitRun(String threadId, ThreadRun run, String credential) throws InterruptedException {
        AssistantProperties.ThreadBackendProperties threadProps = properties.getBackend().getThread();
        long pollMillis = Math.max(1, threadProps.getPollInterval().toMillis());
        long deadline = System.nanoTime() + threadProps.getMaxWait().toNanos();

        ThreadRun current = run;
        while (current.getStatus() == null || !current.getStatus().isTerminal()) {
            if (System.nanoTime() >= deadline) {
                return null;
            }
            Thread.sleep(pollMillis);
            current = threadBackend.pollRun(threadId, run.getId(), credential);
        }
        return current;
    }

    private BackendResult respondViaChat(ContextWindow context, GenerationSettings settings, String credential,
            boolean fallback) {
        try {
            BackendReply reply = chatBackend.complete(context.getMessages(), settings, credential);
            if (reply == null || reply.getText() == null || reply.getText().isBlank()) {
                return BackendResult.fatalError(BackendErrorClassifier.EMPTY_REPLY, "Chat backend returned no text");
            }
            return BackendResult.success(reply.toBuilder()
                    .modeUsed(BackendMode.CHAT)
                    .fallbackUsed(fallback)
                    .usage(reply.getUsage() != null ? reply.getUsage() : LlmUsage.empty())
                    .model(reply.getModel() != null ? reply.getModel() : settings.getModel())
                    .build());
        } catch (RuntimeException e) { // NOSONAR - classified and surfaced as a result
            String code = BackendErrorClassifier.classify(e);
            log.warn("[Backend] Chat completion failed ({}): {}", code, e.getMessage());
            return BackendResult.fatalError(code, e.getMessage());
        }
    }

    private static BackendResult aborted() {
        return BackendResult.fatalError(BackendErrorClassifier.REQUEST_ABORTED, "Dispatch cancelled");
    }

    private void downgrade(Conversation conversation, String code, String message) {
        conversation.setBackendState(BackendState.THREAD_FAILED);
        log.warn("[Backend] Thread mode failed for conversation {} ({}): {}, falling back to chat mode",
                conversation.getId(), code, message);
        conversation.setBackendState(BackendState.CHAT_ACTIVE);
        conversation.setThreadId(null);
        if (conversation.getId() != null) {
            downgraded.put(conversation.getId(), Boolean.TRUE);
        }
    }

    private static String format(Duration duration) {
        return duration.toMillis() + " ms";
    }
}
