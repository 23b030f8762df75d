package me.growmies.assistant.domain.service;

import me.growmies.assistant.domain.model.AuditEvent;
import me.growmies.assistant.domain.model.ContentFilterLevel;
import me.growmies.assistant.domain.model.PreferencesUpdate;
import me.growmies.assistant.domain.model.ResponseStyle;
import me.growmies.assistant.domain.model.UserPreferences;
import me.growmies.assistant.port.outbound.AuditPort;
import me.growmies.assistant.port.outbound.ConversationRepositoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class UserPreferencesServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Instant CREATED = Instant.parse("2026-01-01T00:00:00Z");

    private ConversationRepositoryPort repository;
    private AuditPort auditPort;
    private UserPreferencesService service;

    @BeforeEach
    void setUp() {
        repository = mock(ConversationRepositoryPort.class);
        auditPort = mock(AuditPort.class);
        UserPreferences stored = UserPreferences.defaults("u1", "g1");
        stored.setCreatedAt(CREATED);
        when(repository.getOrCreatePreferences("u1", "g1")).thenReturn(stored);
        service = new UserPreferencesService(repository, auditPort, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void loadsOnceAndCaches() {
        UserPreferences first = service.getPreferences("u1", "g1");
        UserPreferences second = service.getPreferences("u1", "g1");

        assertSame(first, second);
        verify(repository, times(1)).getOrCreatePreferences("u1", "g1");
    }

    @Test
    void loadFailureFallsBackToDefaults() {
        when(repository.getOrCreatePreferences("u2", "g1")).thenThrow(new IllegalStateException("disk"));

        UserPreferences prefs = service.getPreferences("u2", "g1");

        assertEquals(ResponseStyle.CASUAL, prefs.getResponseStyle());
        assertEquals(UserPreferences.MAX_RESPONSE_LENGTH, prefs.getMaxResponseLength());
    }

    @Test
    void appliesPartialUpdateAndAudits() {
        UserPreferences updated = service.update("u1", "g1", PreferencesUpdate.builder()
                .responseStyle("Technical")
                .contentFilterLevel("strict")
                .maxResponseLength(500)
                .build());

        assertEquals(ResponseStyle.TECHNICAL, updated.getResponseStyle());
        assertEquals(ContentFilterLevel.STRICT, updated.getContentFilterLevel());
        assertEquals(500, updated.getMaxResponseLength());
        assertTrue(updated.isConversationHistoryEnabled());
        assertEquals(NOW, updated.getUpdatedAt());
        verify(repository).savePreferences(updated);

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditPort).record(captor.capture());
        assertEquals(AuditEvent.PREFERENCES_UPDATED, captor.getValue().getType());
        assertEquals(List.of("responseStyle", "maxResponseLength", "contentFilterLevel"),
                captor.getValue().getDetails().get("changedFields"));
    }

    @Test
    void rejectsInvalidValuesWithoutSaving() {
        PreferencesUpdate update = PreferencesUpdate.builder()
                .responseStyle("poetic")
                .maxResponseLength(50)
                .build();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> service.update("u1", "g1", update));

        assertTrue(error.getMessage().contains("responseStyle"));
        assertTrue(error.getMessage().contains("maxResponseLength"));
        verify(repository, never()).savePreferences(any());
        verifyNoInteractions(auditPort);
    }

    @Test
    void ownKeyRequiresAKey() {
        PreferencesUpdate update = PreferencesUpdate.builder().useOwnApiKey(true).build();

        assertThrows(IllegalArgumentException.class, () -> service.update("u1", "g1", update));
    }

    @Test
    void ownKeyWithKeyIsAccepted() {
        UserPreferences updated = service.update("u1", "g1", PreferencesUpdate.builder()
                .useOwnApiKey(true)
                .apiKey("  sk-test-123456  ")
                .build());

        assertTrue(updated.hasOwnApiKey());
        assertEquals("sk-test-123456", updated.getApiKey());
        assertEquals("sk-****3456", updated.masked().getApiKey());
    }

    @Test
    void failedSaveRollsBackCache() {
        UserPreferences before = service.getPreferences("u1", "g1");
        doThrow(new IllegalStateException("disk")).when(repository).savePreferences(any());

        assertThrows(IllegalStateException.class, () -> service.update("u1", "g1",
                PreferencesUpdate.builder().responseStyle("educational").build()));

        assertSame(before, service.getPreferences("u1", "g1"));
        assertEquals(ResponseStyle.CASUAL, service.getPreferences("u1", "g1").getResponseStyle());
    }

    @Test
    void resetRestoresDefaultsKeepingCreationTime() {
        service.update("u1", "g1", PreferencesUpdate.builder().responseStyle("technical").build());

        UserPreferences reset = service.reset("u1", "g1");

        assertEquals(ResponseStyle.CASUAL, reset.getResponseStyle());
        assertEquals(CREATED, reset.getCreatedAt());
        assertEquals(NOW, reset.getUpdatedAt());
        assertSame(reset, service.getPreferences("u1", "g1"));
    }
}
