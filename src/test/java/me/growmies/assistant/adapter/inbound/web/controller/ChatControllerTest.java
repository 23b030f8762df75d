package me.growmies.assistant.adapter.inbound.web.controller;

import me.growmies.assistant.domain.model.ChatRequest;
import me.growmies.assistant.domain.model.ChatResponse;
import me.growmies.assistant.domain.model.ConversationStats;
import me.growmies.assistant.domain.model.ErrorType;
import me.growmies.assistant.port.inbound.ConversationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ChatControllerTest {

    private ConversationPort conversationPort;
    private ChatController controller;

    @BeforeEach
    void setUp() {
        conversationPort = mock(ConversationPort.class);
        controller = new ChatController(conversationPort);
    }

    @Test
    void successfulExchangeReturnsOk() {
        ChatRequest request = ChatRequest.builder()
                .userId("u1").guildId("g1").channelId("c1").message("hello").build();
        ChatResponse response = ChatResponse.builder().success(true).text("hi there").build();
        when(conversationPort.handleMessage(request)).thenReturn(response);

        StepVerifier.create(controller.sendMessage(request))
                .assertNext(entity -> {
                    assertEquals(HttpStatus.OK, entity.getStatusCode());
                    assertSame(response, entity.getBody());
                })
                .verifyComplete();
    }

    @Test
    void failedExchangeKeepsBody() {
        ChatRequest request = ChatRequest.builder()
                .userId("u1").guildId("g1").channelId("c1").message("").build();
        ChatResponse response = ChatResponse.failure(ErrorType.VALIDATION, "Please provide a message.", false);
        when(conversationPort.handleMessage(request)).thenReturn(response);

        StepVerifier.create(controller.sendMessage(request))
                .assertNext(entity -> {
                    assertEquals(HttpStatus.BAD_REQUEST, entity.getStatusCode());
                    assertEquals("Please provide a message.", entity.getBody().getError().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void errorTypesMapToStatuses() {
        assertEquals(HttpStatus.FORBIDDEN,
                ChatController.statusFor(ChatResponse.verificationRequired("verify first")));
        assertEquals(HttpStatus.PAYMENT_REQUIRED,
                ChatController.statusFor(ChatResponse.failure(ErrorType.BILLING, "low", false)));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                ChatController.statusFor(ChatResponse.failure(ErrorType.BACKEND, "down", true)));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
                ChatController.statusFor(ChatResponse.failure(ErrorType.PERSISTENCE, "disk", false)));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
                ChatController.statusFor(ChatResponse.builder().success(false).build()));
    }

    @Test
    void clearReportsWhetherAnythingWasCleared() {
        when(conversationPort.clearConversation("u1", "g1", "c1")).thenReturn(true);

        StepVerifier.create(controller.clearConversation("g1", "u1", "c1"))
                .assertNext(entity -> assertEquals(Map.of("cleared", true), entity.getBody()))
                .verifyComplete();
        verify(conversationPort).clearConversation("u1", "g1", "c1");
    }

    @Test
    void statsArePassedThrough() {
        ConversationStats stats = ConversationStats.builder().conversationId("conv-1").messageCount(4).build();
        when(conversationPort.getConversationStats("u1", "g1", "c1")).thenReturn(stats);

        StepVerifier.create(controller.getStats("g1", "u1", "c1"))
                .assertNext(entity -> {
                    assertEquals(HttpStatus.OK, entity.getStatusCode());
                    assertEquals(4, entity.getBody().getMessageCount());
                })
                .verifyComplete();
    }
}
