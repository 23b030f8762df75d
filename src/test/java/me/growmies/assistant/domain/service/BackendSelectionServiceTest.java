package me.growmies.assistant.domain.service;

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
import me.growmies.assistant.domain.model.Turn;
import me.growmies.assistant.domain.system.BackendErrorClassifier;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.port.outbound.ChatBackendPort;
import me.growmies.assistant.port.outbound.ThreadBackendPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BackendSelectionServiceTest {

    private static final GenerationSettings CHAT_SETTINGS = GenerationSettings.builder()
            .model("gpt-4-turbo-preview").temperature(0.7).maxTokens(500).build();
    private static final GenerationSettings THREAD_SETTINGS = GenerationSettings.builder()
            .model("gpt-4.1-mini").temperature(0.7).maxTokens(500).instructions("be nice").build();

    private ChatBackendPort chatBackend;
    private ThreadBackendPort threadBackend;
    private AssistantProperties properties;
    private BackendSelectionService service;
    private ContextWindow context;

    @BeforeEach
    void setUp() {
        chatBackend = mock(ChatBackendPort.class);
        threadBackend = mock(ThreadBackendPort.class);
        properties = new AssistantProperties();
        properties.getBackend().getThread().setEnabled(true);
        properties.getBackend().getThread().setPollInterval(Duration.ofMillis(1));
        properties.getBackend().getThread().setMaxWait(Duration.ofMillis(50));
        when(threadBackend.isAvailable()).thenReturn(true);
        when(chatBackend.complete(any(), any(), any())).thenReturn(BackendReply.builder()
                .text("chat answer")
                .usage(LlmUsage.of(100, 20))
                .model("gpt-4-turbo-preview")
                .build());

        service = new BackendSelectionService(chatBackend, threadBackend, properties);
        context = ContextWindow.builder()
                .messages(List.of(Turn.system("system"),
                        Turn.builder().role(Turn.ROLE_USER).content("How do I water seedlings?").build()))
                .includedHistoryCount(1)
                .totalTokens(10)
                .build();
    }

    private static Conversation conversation(String id) {
        return Conversation.builder().id(id).userId("u1").guildId("g1").channelId("c1").build();
    }

    private static ThreadRun run(RunStatus status) {
        return ThreadRun.builder().id("run_1").status(status).build();
    }

    // ==================== thread mode ====================

    @Test
    void threadModeCreatesThreadAndReturnsAssistantMessage() {
        Conversation conversation = conversation("conv-1");
        when(threadBackend.createThread(null)).thenReturn("thread_1");
        when(threadBackend.startRun("thread_1", THREAD_SETTINGS, null)).thenReturn(run(RunStatus.QUEUED));
        when(threadBackend.pollRun("thread_1", "run_1", null)).thenReturn(
                run(RunStatus.IN_PROGRESS),
                ThreadRun.builder().id("run_1").status(RunStatus.COMPLETED).usage(LlmUsage.of(50, 10))
                        .model("gpt-4.1-mini-2025").build());
        when(threadBackend.getLatestMessage("thread_1", null)).thenReturn("thread answer");

        BackendResult result = service.respond(conversation, context, CHAT_SETTINGS, THREAD_SETTINGS, null);

        assertTrue(result.isSuccess());
        assertEquals("thread answer", result.getReply().getText());
        assertEquals(BackendMode.THREAD, result.getReply().getModeUsed());
        assertFalse(result.getReply().isFallbackUsed());
        assertEquals(60, result.getReply().getUsage().getTotalTokens());
        assertEquals("gpt-4.1-mini-2025", result.getReply().getModel());
        assertEquals(BackendState.THREAD_ACTIVE, conversation.getBackendState());
        assertEquals("thread_1", conversation.getThreadId());
        verify(threadBackend).appendMessage("thread_1", "How do I water seedlings?", null);
        verify(chatBackend, never()).complete(any(), any(), any());
    }

    @Test
    void activeThreadIsReused() {
        Conversation conversation = conversation("conv-1");
        conversation.setThreadId("thread_9");
        conversation.setBackendState(BackendState.THREAD_ACTIVE);
        when(threadBackend.startRun(eq("thread_9"), any(), any())).thenReturn(run(RunStatus.COMPLETED));
        when(threadBackend.getLatestMessage("thread_9", "sk-user")).thenReturn("again");

        BackendResult result = service.respond(conversation, context, CHAT_SETTINGS, THREAD_SETTINGS, "sk-user");

        assertTrue(result.isSuccess());
        assertEquals("gpt-4.1-mini", result.getReply().getModel());
        verify(threadBackend, never()).createThread(any());
    }

    @Test
    void threadCreationFailureDowngradesPermanently() {
        Conversation conversation = conversation("conv-2");
        when(threadBackend.createThread(any())).thenThrow(new IllegalStateException("boom"));

        BackendResult first = service.respond(conversation, context, CHAT_SETTINGS, THREAD_SETTINGS, null);

        assertTrue(first.isSuccess());
        assertEquals(BackendMode.CHAT, first.getReply().getModeUsed());
        assertTrue(first.getReply().isFallbackUsed());
        assertEquals(BackendState.CHAT_ACTIVE, conversation.getBackendState());
        assertNull(conversation.getThreadId());
        assertTrue(service.isDowngraded("conv-2"));

        BackendResult second = service.respond(conversation, context, CHAT_SETTINGS, THREAD_SETTINGS, null);

        assertTrue(second.isSuccess());
        assertFalse(second.getReply().isFallbackUsed());
        verify(threadBackend, times(1)).createThread(any());
        verify(chatBackend, times(2)).complete(any(), any(), any());
    }

    @Test
    void downgradeSurvivesAReloadedConversation() {
        when(threadBackend.createThread(any())).thenThrow(new IllegalStateException("boom"));
        service.respond(conversation("conv-3"), context, CHAT_SETTINGS, THREAD_SETTINGS, null);

        Conversation reloaded = conversation("conv-3");

        assertFalse(service.isThreadModeAllowed(reloaded));
    }

    @Test
    void failedRunFallsBackToChat() {
        Conversation conversation = conversation("conv-4");
        when(threadBackend.createThread(any())).thenReturn("thread_1");
        when(threadBackend.startRun(anyString(), any(), any())).thenReturn(run(RunStatus.FAILED));

        BackendResult result = service.respond(conversation, context, CHAT_SETTINGS, THREAD_SETTINGS, null);

        assertTrue(result.isSuccess());
        assertTrue(result.getReply().isFallbackUsed());
        assertEquals("chat answer", result.getReply().getText());
        verify(threadBackend, never()).getLatestMessage(anyString(), any());
    }

    @Test
    void runThatNeverFinishesFallsBackToChat() {
        Conversation conversation = conversation("conv-5");
        when(threadBackend.createThread(any())).thenReturn("thread_1");
        when(threadBackend.startRun(anyString(), any(), any())).thenReturn(run(RunStatus.QUEUED));
        when(threadBackend.pollRun(anyString(), anyString(), any())).thenReturn(run(RunStatus.IN_PROGRESS));

        BackendResult result = service.respond(conversation, context, CHAT_SETTINGS, THREAD_SETTINGS, null);

        assertTrue(result.isSuccess());
        assertEquals(BackendMode.CHAT, result.getReply().getModeUsed());
        assertTrue(result.getReply().isFallbackUsed());
        assertTrue(service.isDowngraded("conv-5"));
    }

    @Test
    void interruptedRunIsAbortedWithoutChatFallback() {
        Conversation conversation = conversation("conv-11");
        when(threadBackend.createThread(any())).thenReturn("thread_1");
        when(threadBackend.startRun(anyString(), any(), any())).thenReturn(run(RunStatus.QUEUED));
        when(threadBackend.pollRun(anyString(), anyString(), any())).thenReturn(run(RunStatus.IN_PROGRESS));

        BackendResult result;
        Thread.currentThread().interrupt();
        try {
            result = service.respond(conversation, context, CHAT_SETTINGS, THREAD_SETTINGS, null);
        } finally {
            Thread.interrupted();
        }

        assertEquals(BackendResult.Status.FATAL_ERROR, result.getStatus());
        assertEquals(BackendErrorClassifier.REQUEST_ABORTED, result.getErrorCode());
        assertFalse(service.isDowngraded("conv-11"));
        assertEquals(BackendState.THREAD_ACTIVE, conversation.getBackendState());
        assertEquals("thread_1", conversation.getThreadId());
        verifyNoInteractions(chatBackend);
    }

    @Test
    void threadFailureWhileInterruptedIsNotADowngrade() {
        Conversation conversation = conversation("conv-12");
        when(threadBackend.createThread(any())).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("socket closed");
        });

        BackendResult result;
        try {
            result = service.respond(conversation, context, CHAT_SETTINGS, THREAD_SETTINGS, null);
        } finally {
            Thread.interrupted();
        }

        assertEquals(BackendErrorClassifier.REQUEST_ABORTED, result.getErrorCode());
        assertFalse(service.isDowngraded("conv-12"));
        verify(chatBackend, never()).complete(any(), any(), any());
    }

    @Test
    void downgradeCacheEvictsOldestConversation() {
        when(threadBackend.createThread(any())).thenThrow(new IllegalStateException("boom"));

        for (int i = 0; i <= BackendSelectionService.DOWNGRADE_CACHE_MAX_ENTRIES; i++) {
            service.respond(conversation("bulk-" + i), context, CHAT_SETTINGS, THREAD_SETTINGS, null);
        }

        assertFalse(service.isDowngraded("bulk-0"));
        assertTrue(service.isDowngraded("bulk-1"));
        assertTrue(service.isDowngraded("bulk-" + BackendSelectionService.DOWNGRADE_CACHE_MAX_ENTRIES));
    }

    // ==================== chat mode ====================

    @Test
    void threadDisabledUsesChatWithoutFallbackFlag() {
        properties.getBackend().getThread().setEnabled(false);
        Conversation conversation = conversation("conv-6");

        BackendResult result = service.respond(conversation, context, CHAT_SETTINGS, THREAD_SETTINGS, "sk-user");

        assertTrue(result.isSuccess());
        assertFalse(result.getReply().isFallbackUsed());
        assertEquals(BackendState.CHAT_ACTIVE, conversation.getBackendState());
        verify(chatBackend).complete(context.getMessages(), CHAT_SETTINGS, "sk-user");
        verifyNoInteractions(threadBackend);
    }

    @Test
    void unavailableThreadBackendUsesChat() {
        when(threadBackend.isAvailable()).thenReturn(false);

        BackendResult result = service.respond(conversation("conv-7"), context, CHAT_SETTINGS, THREAD_SETTINGS, null);

        assertTrue(result.isSuccess());
        verify(threadBackend, never()).createThread(any());
    }

    @Test
    void chatFailureIsFatalAndClassified() {
        properties.getBackend().getThread().setEnabled(false);
        when(chatBackend.complete(any(), any(), any()))
                .thenThrow(new IllegalStateException("Rate limit reached for requests"));

        BackendResult result = service.respond(conversation("conv-8"), context, CHAT_SETTINGS, THREAD_SETTINGS, null);

        assertFalse(result.isSuccess());
        assertFalse(result.isRecoverable());
        assertEquals(BackendErrorClassifier.RATE_LIMIT, result.getErrorCode());
    }

    @Test
    void blankChatReplyIsAnError() {
        properties.getBackend().getThread().setEnabled(false);
        when(chatBackend.complete(any(), any(), any())).thenReturn(BackendReply.builder().text("  ").build());

        BackendResult result = service.respond(conversation("conv-9"), context, CHAT_SETTINGS, THREAD_SETTINGS, null);

        assertEquals(BackendResult.Status.FATAL_ERROR, result.getStatus());
        assertEquals(BackendErrorClassifier.EMPTY_REPLY, result.getErrorCode());
    }

    @Test
    void chatReplyWithoutUsageGetsDefaults() {
        properties.getBackend().getThread().setEnabled(false);
        when(chatBackend.complete(any(), any(), any())).thenReturn(BackendReply.builder().text("ok").build());

        BackendResult result = service.respond(conversation("conv-10"), context, CHAT_SETTINGS, THREAD_SETTINGS,
                null);

        assertEquals(0, result.getReply().getUsage().getTotalTokens());
        assertEquals("gpt-4-turbo-preview", result.getReply().getModel());
    }
}
