package me.growmies.assistant.adapter.inbound.web.controller;

import me.growmies.assistant.adapter.inbound.web.dto.PreferencesUpdateRequest;
import me.growmies.assistant.domain.model.PreferencesUpdate;
import me.growmies.assistant.domain.model.ResponseStyle;
import me.growmies.assistant.domain.model.UserPreferences;
import me.growmies.assistant.domain.service.UserPreferencesService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PreferencesControllerTest {

    private UserPreferencesService preferencesService;
    private PreferencesController controller;

    @BeforeEach
    void setUp() {
        preferencesService = mock(UserPreferencesService.class);
        controller = new PreferencesController(preferencesService);
    }

    private static UserPreferences withKey() {
        UserPreferences prefs = UserPreferences.defaults("u1", "g1");
        prefs.setUseOwnApiKey(true);
        prefs.setApiKey("sk-abcdef123456");
        return prefs;
    }

    @Test
    void getReturnsMaskedKey() {
        when(preferencesService.getPreferences("u1", "g1")).thenReturn(withKey());

        StepVerifier.create(controller.getPreferences("g1", "u1"))
                .assertNext(entity -> assertEquals("sk-****3456", entity.getBody().getApiKey()))
                .verifyComplete();
    }

    @Test
    void updateForwardsRequestFields() {
        UserPreferences updated = withKey();
        updated.setResponseStyle(ResponseStyle.TECHNICAL);
        when(preferencesService.update(eq("u1"), eq("g1"), any(PreferencesUpdate.class))).thenReturn(updated);

        PreferencesUpdateRequest request = new PreferencesUpdateRequest();
        request.setResponseStyle("technical");
        request.setMaxResponseLength(500);

        StepVerifier.create(controller.updatePreferences("g1", "u1", request))
                .assertNext(entity -> {
                    assertEquals(ResponseStyle.TECHNICAL, entity.getBody().getResponseStyle());
                    assertEquals("sk-****3456", entity.getBody().getApiKey());
                })
                .verifyComplete();

        ArgumentCaptor<PreferencesUpdate> captor = ArgumentCaptor.forClass(PreferencesUpdate.class);
        verify(preferencesService).update(eq("u1"), eq("g1"), captor.capture());
        assertEquals("technical", captor.getValue().getResponseStyle());
        assertEquals(500, captor.getValue().getMaxResponseLength());
        assertNull(captor.getValue().getApiKey());
    }

    @Test
    void invalidUpdateSurfacesAsError() {
        when(preferencesService.update(eq("u1"), eq("g1"), any(PreferencesUpdate.class)))
                .thenThrow(new IllegalArgumentException("Unknown response style: loud"));

        PreferencesUpdateRequest request = new PreferencesUpdateRequest();
        request.setResponseStyle("loud");

        StepVerifier.create(controller.updatePreferences("g1", "u1", request))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void resetReturnsDefaults() {
        when(preferencesService.reset("u1", "g1")).thenReturn(UserPreferences.defaults("u1", "g1"));

        StepVerifier.create(controller.resetPreferences("g1", "u1"))
                .assertNext(entity -> {
                    assertEquals(ResponseStyle.CASUAL, entity.getBody().getResponseStyle());
                    assertNull(entity.getBody().getApiKey());
                })
                .verifyComplete();
    }
}
