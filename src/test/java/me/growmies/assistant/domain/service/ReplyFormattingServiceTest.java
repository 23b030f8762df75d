package me.growmies.assistant.domain.service;

import me.growmies.assistant.domain.model.ConversationCategory;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.security.ComplianceFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReplyFormattingServiceTest {

    private static final String FOOTER = "*Generated by AI*";

    private AssistantProperties properties;
    private ReplyFormattingService service;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
        properties.getReply().setFooter(FOOTER);
        properties.getReply().setPageLimit(100);
        properties.getReply().setMaxSuggestions(3);
        service = new ReplyFormattingService(properties, new ComplianceFilter());
    }

    // ==================== paginate ====================

    @Test
    void shortReplyIsOnePageWithFooter() {
        List<String> pages = service.paginate("Hello there.");

        assertEquals(List.of("Hello there.\n\n" + FOOTER), pages);
    }

    @Test
    void longReplySplitsAtSentenceEnds() {
        StringBuilder text = new StringBuilder();
        for (int i = 1; i <= 12; i++) {
            text.append("This is sentence number ").append(i).append(". ");
        }

        List<String> pages = service.paginate(text.toString());

        assertTrue(pages.size() > 1);
        for (String page : pages) {
            assertTrue(page.length() <= 100, page);
        }
        for (int i = 0; i < pages.size() - 1; i++) {
            assertTrue(pages.get(i).endsWith("."), pages.get(i));
        }
        assertTrue(pages.get(pages.size() - 1).endsWith(FOOTER));
        String joined = String.join(" ", pages);
        for (int i = 1; i <= 12; i++) {
            assertTrue(joined.contains("sentence number " + i + "."));
        }
    }

    @Test
    void paragraphBreakPreferred() {
        String text = "a".repeat(60) + "\n\n" + "b ".repeat(40);

        List<String> pages = service.paginate(text);

        assertEquals("a".repeat(60), pages.get(0));
    }

    @Test
    void unbrokenTextIsHardCut() {
        properties.getReply().setFooter("");

        List<String> pages = service.paginate("x".repeat(250));

        assertEquals(List.of("x".repeat(100), "x".repeat(100), "x".repeat(50)), pages);
    }

    @Test
    void emptyReplyStillYieldsOnePage() {
        properties.getReply().setFooter("");

        assertEquals(List.of(""), service.paginate(null));
    }

    // ==================== suggestions ====================

    @Test
    void suggestionsFollowCategory() {
        assertEquals("Ask about growing this strain",
                service.suggestions(ConversationCategory.STRAIN_ADVICE, "x").get(0));
        assertEquals("Ask about nutrients", service.suggestions(ConversationCategory.GROW_TIPS, "x").get(0));
        assertEquals("Ask about cultivation limits",
                service.suggestions(ConversationCategory.LEGAL_INFO, "x").get(0));
    }

    @Test
    void generalSuggestionsDependOnReplyContent() {
        assertEquals("Get more cannabis info",
                service.suggestions(ConversationCategory.GENERAL, "THC is the main cannabinoid.").get(0));
        assertEquals("Ask follow-up questions",
                service.suggestions(ConversationCategory.GENERAL, "Tomatoes need sun.").get(0));
    }

    @Test
    void suggestionsAreCapped() {
        properties.getReply().setMaxSuggestions(1);

        assertEquals(1, service.suggestions(ConversationCategory.LEGAL_INFO, "x").size());
    }

    // ==================== reactions ====================

    @Test
    void reactionsReflectReplyTopics() {
        List<String> reactions = service.reactions("Happy to help you learn how to grow cannabis legally.");

        assertEquals(List.of("🌿", "🤝", "📚", "⚖️", "🌱", "👍"), reactions);
    }

    @Test
    void thumbsUpAlwaysPresent() {
        assertEquals(List.of("👍"), service.reactions("Okay."));
        assertEquals(List.of("👍"), service.reactions(null));
    }
}
