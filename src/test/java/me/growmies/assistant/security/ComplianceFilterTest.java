package me.growmies.assistant.security;

import me.growmies.assistant.domain.model.ComplianceVerdict;
import me.growmies.assistant.domain.model.ConversationCategory;
import me.growmies.assistant.domain.model.FilteredOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplianceFilterTest {

    private ComplianceFilter filter;

    @BeforeEach
    void setUp() {
        filter = new ComplianceFilter();
    }

    // ==================== classify ====================

    @Test
    void classifyDetectsRestrictedTerms() {
        ComplianceVerdict verdict = filter.classify("What THC level does this strain have?");

        assertTrue(verdict.restrictedSubject());
        assertTrue(verdict.matchedTerms().contains("thc"));
        assertTrue(verdict.matchedTerms().contains("strain"));
    }

    @Test
    void classifyMatchesPlurals() {
        assertTrue(filter.classify("Which edibles are mild?").restrictedSubject());
    }

    @Test
    void classifyUsesWordBoundaries() {
        ComplianceVerdict verdict = filter.classify("I planted a potato in a teapot yesterday");

        assertFalse(verdict.restrictedSubject());
        assertEquals(List.of(), verdict.matchedTerms());
    }

    @Test
    void classifyCleanForBlankOrNull() {
        assertFalse(filter.classify(null).restrictedSubject());
        assertFalse(filter.classify("   ").restrictedSubject());
    }

    // ==================== filterOutput ====================

    @Test
    void cleanTextPassesUnmodified() {
        String text = "Tomatoes like plenty of sun. Water them in the morning.";

        FilteredOutput output = filter.filterOutput(text, ConversationCategory.GENERAL);

        assertFalse(output.wasModified());
        assertEquals(text, output.text());
        assertTrue(output.issues().isEmpty());
    }

    @Test
    void commercialSentenceReplacedWithPlaceholder() {
        FilteredOutput output = filter.filterOutput(
                "Great question. You can buy it from a dealer. Stay safe!", ConversationCategory.GENERAL);

        assertTrue(output.wasModified());
        assertEquals("Great question. " + ComplianceFilter.COMMERCIAL_PLACEHOLDER + " Stay safe!"
                + ComplianceFilter.COMMERCIAL_NOTICE, output.text());
        assertEquals(List.of(ComplianceFilter.ISSUE_COMMERCIAL_REMOVED), output.issues());
    }

    @Test
    void consecutiveCommercialSentencesCollapseToOnePlaceholder() {
        FilteredOutput output = filter.filterOutput(
                "Hello there. Send cash by venmo. Shipping is free. Bye now.", ConversationCategory.GENERAL);

        String text = output.text();
        int first = text.indexOf(ComplianceFilter.COMMERCIAL_PLACEHOLDER);
        assertTrue(first >= 0);
        assertEquals(-1, text.indexOf(ComplianceFilter.COMMERCIAL_PLACEHOLDER, first + 1));
        assertTrue(text.startsWith("Hello there. "));
        assertTrue(text.contains("Bye now."));
    }

    @Test
    void commercialRedactionKeepsParagraphsAndLists() {
        String reply = "Watering tips:\n\n1. Water in the morning.\n2. Check the soil first.\n\n"
                + "You can buy a meter online.";

        FilteredOutput output = filter.filterOutput(reply, ConversationCategory.GENERAL);

        assertEquals("Watering tips:\n\n1. Water in the morning.\n2. Check the soil first.\n\n"
                + ComplianceFilter.COMMERCIAL_PLACEHOLDER + ComplianceFilter.COMMERCIAL_NOTICE, output.text());
    }

    @Test
    void commercialListItemKeepsItsMarker() {
        String reply = "Options:\n- Grow your own at home.\n- Buy clones from a dealer.\n- Ask a friend for advice.";

        FilteredOutput output = filter.filterOutput(reply, ConversationCategory.GENERAL);

        assertEquals("Options:\n- Grow your own at home.\n- " + ComplianceFilter.COMMERCIAL_PLACEHOLDER
                + "\n- Ask a friend for advice." + ComplianceFilter.COMMERCIAL_NOTICE, output.text());
    }

    @Test
    void decimalNumbersDoNotSplitSentences() {
        FilteredOutput output = filter.filterOutput("Keep the pH near 6.5 for soil. Prices vary by shop.",
                ConversationCategory.GENERAL);

        assertTrue(output.text().startsWith("Keep the pH near 6.5 for soil. "
                + ComplianceFilter.COMMERCIAL_PLACEHOLDER));
    }

    @Test
    void harmfulGuidanceIsSanitizedAndDisclaimed() {
        FilteredOutput output = filter.filterOutput(
                "If you are pregnant, cannabis can ease nausea.", ConversationCategory.GENERAL);

        assertTrue(output.wasModified());
        assertTrue(output.text().contains(
                "Pregnant individuals should consult healthcare providers about cannabis use."));
        assertFalse(output.text().contains("ease nausea"));
        assertTrue(output.text().contains("**Legal Disclaimer:**"));
        assertEquals(List.of(ComplianceFilter.ISSUE_HARMFUL_SANITIZED, ComplianceFilter.ISSUE_DISCLAIMER_ADDED),
                output.issues());
    }

    @Test
    void restrictedCategoryAlwaysGetsItsDisclaimer() {
        FilteredOutput legal = filter.filterOutput("Laws differ between states.", ConversationCategory.LEGAL_INFO);
        FilteredOutput grow = filter.filterOutput("Keep humidity near fifty percent.",
                ConversationCategory.GROW_TIPS);
        FilteredOutput strain = filter.filterOutput("It is known for a citrus aroma.",
                ConversationCategory.STRAIN_ADVICE);

        assertTrue(legal.text().endsWith("Consult with legal professionals for specific guidance."));
        assertTrue(legal.text().contains("**Legal Notice:**"));
        assertTrue(grow.text().contains("**Cultivation Notice:**"));
        assertTrue(strain.text().contains("**Information Notice:**"));
        assertEquals(List.of(ComplianceFilter.ISSUE_DISCLAIMER_ADDED), legal.issues());
    }

    @Test
    void restrictedSubjectInGeneralCategoryGetsGeneralDisclaimer() {
        FilteredOutput output = filter.filterOutput("CBD is non-intoxicating.", ConversationCategory.GENERAL);

        assertTrue(output.text().startsWith("CBD is non-intoxicating."));
        assertTrue(output.text().contains("**Legal Disclaimer:**"));
    }

    @Test
    void nullCategoryTreatedAsGeneral() {
        FilteredOutput output = filter.filterOutput("Weed is a slang word.", null);

        assertTrue(output.text().contains("**Legal Disclaimer:**"));
    }

    @Test
    void blankTextReturnedAsIs() {
        assertEquals("", filter.filterOutput("", ConversationCategory.LEGAL_INFO).text());
        assertNull(filter.filterOutput(null, ConversationCategory.LEGAL_INFO).text());
    }
}
