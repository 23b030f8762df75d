package me.growmies.assistant.domain.service;

import me.growmies.assistant.domain.model.ContextWindow;
import me.growmies.assistant.domain.model.Turn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextBudgetServiceTest {

    private ContextBudgetService service;
    private HeuristicTokenCounter counter;

    @BeforeEach
    void setUp() {
        counter = new HeuristicTokenCounter();
        service = new ContextBudgetService(counter);
    }

    private static String tokens(char c, int count) {
        return String.valueOf(c).repeat(count * HeuristicTokenCounter.CHARS_PER_TOKEN);
    }

    private static Turn turn(String role, String content) {
        return Turn.builder().role(role).content(content).build();
    }

    @Test
    void keepsNewestHistoryThatFitsTheBudget() {
        List<Turn> history = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String role = i % 2 == 0 ? Turn.ROLE_USER : Turn.ROLE_ASSISTANT;
            history.add(turn(role, i + tokens('h', 150).substring(String.valueOf(i).length())));
        }
        history.add(turn(Turn.ROLE_USER, tokens('q', 100)));

        ContextWindow window = service.buildContext(tokens('s', 400), history, List.of(), 3000);

        assertEquals(17, window.getIncludedHistoryCount());
        assertEquals(4, window.getDroppedHistoryCount());
        assertEquals(2900, window.getTotalTokens());
        assertFalse(window.isTruncated());
        assertEquals(18, window.getMessages().size());
        assertEquals(Turn.ROLE_SYSTEM, window.getMessages().get(0).getRole());
        assertTrue(window.getMessages().get(1).getContent().startsWith("4"));
        assertEquals(tokens('q', 100), window.latestTurn().getContent());
    }

    @Test
    void totalNeverExceedsBudget() {
        List<Turn> history = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            history.add(turn(Turn.ROLE_USER, "x".repeat(37 + i * 11)));
        }

        ContextWindow window = service.buildContext("You are helpful.", history, List.of("tip one", "tip two"),
                500);

        int total = window.getMessages().stream().mapToInt(t -> counter.count(t.getContent())).sum();
        assertTrue(total <= 500);
        assertEquals(total, window.getTotalTokens());
    }

    @Test
    void truncatesLatestTurnWhenItCannotFitNextToTheSystemPrompt() {
        List<Turn> history = List.of(
                turn(Turn.ROLE_USER, "hi"),
                turn(Turn.ROLE_USER, tokens('a', 200)));

        ContextWindow window = service.buildContext(tokens('s', 100), history, List.of("ignored snippet"), 150);

        assertTrue(window.isTruncated());
        assertTrue(counter.count(window.latestTurn().getContent()) <= 50);
        assertEquals(1, window.getIncludedHistoryCount());
        assertEquals(1, window.getDroppedHistoryCount());
        assertEquals(0, window.getIncludedSnippetCount());
        assertEquals(2, window.getMessages().size());
    }

    @Test
    void skipsSnippetsThatDoNotFitAndKeepsSmallerOnes() {
        List<Turn> history = List.of(turn(Turn.ROLE_USER, tokens('q', 10)));

        ContextWindow window = service.buildContext(tokens('s', 10), history,
                List.of("x".repeat(200), "y".repeat(20)), 60);

        assertEquals(1, window.getIncludedSnippetCount());
        String system = window.getMessages().get(0).getContent();
        assertTrue(system.contains("Relevant community knowledge:"));
        assertTrue(system.contains("y".repeat(20)));
        assertFalse(system.contains("xxxx"));
        assertTrue(window.getTotalTokens() <= 60);
    }

    @Test
    void systemPromptStaysFirstWithoutSnippets() {
        List<Turn> history = List.of(
                turn(Turn.ROLE_USER, "first"),
                turn(Turn.ROLE_ASSISTANT, "reply"),
                turn(Turn.ROLE_USER, "second"));

        ContextWindow window = service.buildContext("system", history, null, 1000);

        assertEquals("system", window.getMessages().get(0).getContent());
        assertEquals(List.of("first", "reply", "second"),
                window.getMessages().subList(1, 4).stream().map(Turn::getContent).toList());
        assertEquals(3, window.getIncludedHistoryCount());
        assertEquals(0, window.getDroppedHistoryCount());
    }

    @Test
    void rejectsEmptyHistory() {
        assertThrows(IllegalArgumentException.class, () -> service.buildContext("system", List.of(), null, 100));
    }
}
