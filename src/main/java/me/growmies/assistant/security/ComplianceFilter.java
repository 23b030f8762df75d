package me.growmies.assistant.security;

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

import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.ComplianceVerdict;
import me.growmies.assistant.domain.model.ConversationCategory;
import me.growmies.assistant.domain.model.FilteredOutput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compliance filter for inbound and outbound text.
 *
 * <p>
 * Provides:
 * <ul>
 * <li>Classification - lexical detection of restricted (age-gated) subject
 * matter</li>
 * <li>Commercial redaction - sentences facilitating transactions are replaced
 * with a placeholder</li>
 * <li>Harm sanitizing - unsafe guidance is replaced with safety text</li>
 * <li>Disclaimers - the mandated notice for the conversation category</li>
 * </ul>
 *
 * <p>
 * Classification is a heuristic and may miss restricted content; the category
 * gate stays the primary control. The component is stateless and thread-safe,
 * and {@link #filterOutput} never throws.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ComplianceFilter {

    public static final String ISSUE_COMMERCIAL_REMOVED = "commercial_content_removed";
    public static final String ISSUE_DISCLAIMER_ADDED = "cannabis_disclaimers_added";
    public static final String ISSUE_HARMFUL_SANITIZED = "harmful_content_sanitized";

    static final String COMMERCIAL_PLACEHOLDER = "[removed: commercial content]";
    static final String COMMERCIAL_NOTICE = "\n\n🚫 **Compliance Notice:** Commercial cannabis activities are "
            + "prohibited in this community.";

    private static final String DISCLAIMER_GENERAL = "\n\n⚖️ **Legal Disclaimer:** Cannabis information is for "
            + "educational purposes only. Always follow federal, state, and local laws.";
    private static final String DISCLAIMER_LEGAL = "\n\n⚖️ **Legal Notice:** This is general information only and "
            + "not legal advice. Consult with legal professionals for specific guidance.";
    private static final String DISCLAIMER_CULTIVATION = "\n\n🌱 **Cultivation Notice:** Cannabis cultivation laws "
            + "vary by jurisdiction. Ensure compliance with all applicable laws.";
    private static final String DISCLAIMER_STRAIN = "\n\n📋 **Information Notice:** Strain effects may vary by "
            + "individual. Start with small amounts and consume responsibly.";

    private static final List<String> RESTRICTED_TERMS = List.of(
            "cannabis", "marijuana", "weed", "pot", "ganja", "mary jane", "medical marijuana",
            "thc", "cbd", "cbg", "cbn", "delta-8", "delta-9", "tetrahydrocannabinol", "cannabidiol",
            "cannabinoid", "terpene", "indica", "sativa", "strain", "cultivar",
            "dispensary", "budtender", "edible", "tincture", "joint", "blunt", "bong", "dab", "vape",
            "hash", "rosin", "shatter", "live resin", "distillate");

    private static final List<String> COMMERCIAL_TERMS = List.of(
            "buy", "sell", "purchase", "sale", "dealer", "plug", "selling", "buying", "trade", "exchange",
            "money", "price", "cost", "payment", "cash", "venmo", "paypal", "ship", "shipping", "delivery",
            "meet up", "meetup");

    private static final List<Pattern> RESTRICTED_PATTERNS = compileTerms(RESTRICTED_TERMS);
    private static final List<Pattern> COMMERCIAL_PATTERNS = compileTerms(COMMERCIAL_TERMS);

    // optional list marker, then a sentence ending at a terminator or at the line end
    private static final Pattern SENTENCE = Pattern.compile(
            "(?m)(^[ \\t]*(?:\\d{1,3}[.)]|[-*\u2022])[ \\t]+)?(\\S.*?(?:[.!?]+(?=\\s|$)|$))");

    private static final String IN_SENTENCE = "[^.!?\\n]*";

    private static final List<HarmRule> HARM_RULES = List.of(
            new HarmRule(sentence("driving", "under", "influence"),
                    "Never drive under the influence of cannabis - it is illegal and dangerous."),
            new HarmRule(sentence("drive", "while", "high"),
                    "Never drive under the influence of cannabis - it is illegal and dangerous."),
            new HarmRule(sentence("operate", "machinery", "cannabis"),
                    "Never operate machinery under the influence of cannabis."),
            new HarmRule(sentence("give", "cannabis", "minor"),
                    "Cannabis should never be provided to minors - it is illegal and harmful."),
            new HarmRule(sentence("underage", "consumption"),
                    "Cannabis should never be provided to minors - it is illegal and harmful."),
            new HarmRule(sentence("pregnant", "cannabis"),
                    "Pregnant individuals should consult healthcare providers about cannabis use."),
            new HarmRule(sentence("breastfeeding", "cannabis"),
                    "Breastfeeding individuals should consult healthcare providers about cannabis use."),
            new HarmRule(sentence("alcohol", "cannabis", "mix"),
                    "Mixing alcohol and cannabis increases impairment and is not recommended."));

    /**
     * Classify text for restricted subject matter.
     */
    public ComplianceVerdict classify(String text) {
        if (text == null || text.isBlank()) {
            return ComplianceVerdict.clean();
        }
        Set<String> matched = new LinkedHashSet<>();
        for (int i = 0; i < RESTRICTED_PATTERNS.size(); i++) {
            if (RESTRICTED_PATTERNS.get(i).matcher(text).find()) {
                matched.add(RESTRICTED_TERMS.get(i));
            }
        }
        if (matched.isEmpty()) {
            return ComplianceVerdict.clean();
        }
        return ComplianceVerdict.restricted(new ArrayList<>(matched));
    }

    /**
     * Redact, sanitize and annotate model output for the given category. On any
     * internal failure the original text is returned unmodified.
     */
    public FilteredOutput filterOutput(String text, ConversationCategory category) {
        if (text == null || text.isBlank()) {
            return FilteredOutput.unmodified(text);
        }
        try {
            return applyFilters(text, category != null ? category : ConversationCategory.GENERAL);
        } catch (RuntimeException e) { // NOSONAR - filtering must degrade to pass-through
            log.error("[Compliance] Output filtering failed, passing text through unfiltered", e);
            return FilteredOutput.unmodified(text);
        }
    }

    private FilteredOutput applyFilters(String text, ConversationCategory category) {
        List<String> issues = new ArrayList<>();
        String result = text;

        String withoutCommercial = removeCommercialContent(result);
        if (!withoutCommercial.equals(result)) {
            result = withoutCommercial + COMMERCIAL_NOTICE;
            issues.add(ISSUE_COMMERCIAL_REMOVED);
        }

        String sanitized = sanitizeHarmfulContent(result);
        if (!sanitized.equals(result)) {
            result = sanitized;
            issues.add(ISSUE_HARMFUL_SANITIZED);
        }

        if (category.isRestricted() || classify(text).restrictedSubject()) {
            result = result + disclaimerFor(category);
            issues.add(ISSUE_DISCLAIMER_ADDED);
        }

        if (!issues.isEmpty()) {
            log.debug("[Compliance] Output filtered for category {}: {}", category.getCode(), issues);
        }
        return new FilteredOutput(result, !result.equals(text), issues);
    }

    /**
     * Replaces commercial sentences in place. Line breaks, list markers and the
     * spacing between sentences are kept; a run of commercial sentences becomes
     * a single placeholder.
     */
    private String removeCommercialContent(String text) {
        Matcher matcher = SENTENCE.matcher(text);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        boolean changed = false;
        boolean lastWasPlaceholder = false;
        while (matcher.find()) {
            String gap = text.substring(last, matcher.start());
            String marker = matcher.group(1) != null ? matcher.group(1) : "";
            String sentence = matcher.group(2);
            last = matcher.end();
            if (!matchesAny(COMMERCIAL_PATTERNS, sentence)) {
                sb.append(gap).append(marker).append(sentence);
                lastWasPlaceholder = false;
                continue;
            }
            changed = true;
            if (!lastWasPlaceholder) {
                sb.append(gap).append(marker).append(COMMERCIAL_PLACEHOLDER);
                lastWasPlaceholder = true;
            }
        }
        if (!changed) {
            return text;
        }
        sb.append(text, last, text.length());
        return sb.toString();
    }

    private String sanitizeHarmfulContent(String text) {
        String result = text;
        for (HarmRule rule : HARM_RULES) {
            Matcher matcher = rule.pattern().matcher(result);
            if (matcher.find()) {
                result = matcher.replaceAll(Matcher.quoteReplacement(rule.replacement()));
            }
        }
        return result;
    }

    private String disclaimerFor(ConversationCategory category) {
        return switch (category) {
        case STRAIN_ADVICE -> DISCLAIMER_STRAIN;
        case GROW_TIPS, CULTIVATION_ADVICE -> DISCLAIMER_CULTIVATION;
        case LEGAL_INFO -> DISCLAIMER_LEGAL;
        default -> DISCLAIMER_GENERAL;
        };
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compileTerms(List<String> terms) {
        return terms.stream()
                .map(term -> Pattern.compile("\\b" + Pattern.quote(term.toLowerCase(Locale.ROOT)) + "s?\\b",
                        Pattern.CASE_INSENSITIVE))
                .toList();
    }

    private static Pattern sentence(String... words) {
        // sentence start: never a leading blank, so surrounding spacing survives
        StringBuilder regex = new StringBuilder("(?:[^.!?\\n\\s]" + IN_SENTENCE + ")?");
        for (int i = 0; i < words.length; i++) {
            regex.append("\\b").append(words[i]);
            if (i < words.length - 1) {
                regex.append(IN_SENTENCE);
            }
        }
        regex.append(IN_SENTENCE);
        regex.append("[.!?]?");
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
    }

    private record HarmRule(Pattern pattern, String replacement) {
    }
}
