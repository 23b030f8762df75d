package me.growmies.assistant.domain.service;

import me.growmies.assistant.domain.model.ContentFilterLevel;
import me.growmies.assistant.domain.model.ConversationCategory;
import me.growmies.assistant.domain.model.GenerationSettings;
import me.growmies.assistant.domain.model.ResponseStyle;
import me.growmies.assistant.domain.model.UserPreferences;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SystemPromptServiceTest {

    private AssistantProperties properties;
    private SystemPromptService service;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
        properties.getContext().setMaxResponseTokens(1000);
        properties.getBackend().getChat().setModel("gpt-4-turbo-preview");
        properties.getBackend().getThread().setModel("gpt-4.1-mini");
        service = new SystemPromptService(properties);
    }

    @Test
    void generalPromptHasPersonaWithoutAgeNote() {
        String prompt = service.buildSystemPrompt(ConversationCategory.GENERAL, UserPreferences.defaults("u", "g"));

        assertTrue(prompt.startsWith("You are a helpful cannabis education assistant"));
        assertTrue(prompt.contains("IMPORTANT COMPLIANCE RULES:"));
        assertFalse(prompt.contains("21+ age verification"));
        assertTrue(prompt.endsWith("community guidelines."));
    }

    @Test
    void restrictedPromptCarriesCategoryRulesAndAgeNote() {
        String prompt = service.buildSystemPrompt(ConversationCategory.LEGAL_INFO, null);

        assertTrue(prompt.contains("not legal advice"));
        assertTrue(prompt.contains("21+ age verification"));
    }

    @Test
    void styleAndStrictFilteringAreReflected() {
        UserPreferences prefs = UserPreferences.builder()
                .responseStyle(ResponseStyle.TECHNICAL)
                .contentFilterLevel(ContentFilterLevel.STRICT)
                .build();

        String prompt = service.buildSystemPrompt(ConversationCategory.GROW_TIPS, prefs);
        String instructions = service.buildThreadInstructions(ConversationCategory.GROW_TIPS, prefs);

        assertTrue(prompt.contains("scientific accuracy"));
        assertTrue(prompt.contains("strict content filtering"));
        assertTrue(instructions.startsWith("This is a cannabis-related conversation."));
        assertTrue(instructions.endsWith("comprehensive disclaimers."));
    }

    @Test
    void casualGeneralThreadInstructionsAreEmpty() {
        assertEquals("", service.buildThreadInstructions(ConversationCategory.GENERAL,
                UserPreferences.defaults("u", "g")));
    }

    @Test
    void temperatureDependsOnCategory() {
        assertEquals(0.3, service.temperatureFor(ConversationCategory.LEGAL_INFO));
        assertEquals(0.5, service.temperatureFor(ConversationCategory.STRAIN_ADVICE));
        assertEquals(0.6, service.temperatureFor(ConversationCategory.CULTIVATION_ADVICE));
        assertEquals(0.7, service.temperatureFor(ConversationCategory.GENERAL));
    }

    @Test
    void maxTokensFollowsPreferredLengthCappedByConfig() {
        assertEquals(500, service.maxTokens(UserPreferences.defaults("u", "g")));
        assertEquals(25, service.maxTokens(UserPreferences.builder().maxResponseLength(100).build()));
        assertEquals(1000, service.maxTokens(null));

        properties.getContext().setMaxResponseTokens(200);
        assertEquals(200, service.maxTokens(UserPreferences.defaults("u", "g")));
    }

    @Test
    void settingsUseTheConfiguredModels() {
        GenerationSettings chat = service.chatSettings(ConversationCategory.STRAIN_ADVICE, null);
        GenerationSettings thread = service.threadSettings(ConversationCategory.STRAIN_ADVICE, null);

        assertEquals("gpt-4-turbo-preview", chat.getModel());
        assertNull(chat.getInstructions());
        assertEquals("gpt-4.1-mini", thread.getModel());
        assertTrue(thread.getInstructions().contains("cannabis-related"));
        assertEquals(0.5, thread.getTemperature());
    }
}
