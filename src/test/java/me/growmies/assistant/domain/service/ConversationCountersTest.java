package me.growmies.assistant.domain.service;

import me.growmies.assistant.adapter.outbound.storage.LocalStorageAdapter;
import me.growmies.assistant.adapter.outbound.storage.StorageConversationRepository;
import me.growmies.assistant.domain.model.BackendState;
import me.growmies.assistant.domain.model.Conversation;
import me.growmies.assistant.domain.model.ConversationCategory;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Conversation counters against the file-backed repository.
 */
class ConversationCountersTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private AssistantProperties properties;
    private ConversationService service;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        StorageConversationRepository repository = new StorageConversationRepository(storage,
                AutoConfiguration.objectMapper(), clock);
        service = new ConversationService(repository, properties, clock);
    }

    private Conversation load() {
        return service.findActive("u1", "g1", "c1").orElseThrow();
    }

    @Test
    void overlappingExchangesKeepEveryIncrement() {
        Conversation first = service.getOrCreateActive("u1", "g1", "c1", ConversationCategory.GENERAL);
        service.recordExchange(first, 2, 100);

        Conversation a = service.getOrCreateActive("u1", "g1", "c1", ConversationCategory.GENERAL);
        Conversation b = service.getOrCreateActive("u1", "g1", "c1", ConversationCategory.GENERAL);
        service.recordExchange(a, 2, 100);
        service.recordExchange(b, 2, 100);

        Conversation stored = load();
        assertEquals(6, stored.getMessageCount());
        assertEquals(300, stored.getTotalTokens());
        assertEquals(6, b.getMessageCount());
    }

    @Test
    void concurrentExchangesAreAllCounted() throws Exception {
        properties.getConversation().setMaxMessages(1000);
        properties.getConversation().setMaxTokens(1_000_000);
        service.getOrCreateActive("u1", "g1", "c1", ConversationCategory.GENERAL);

        int threads = 8;
        int perThread = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    Conversation conversation = service.getOrCreateActive("u1", "g1", "c1",
                            ConversationCategory.GENERAL);
                    service.recordExchange(conversation, 2, 10);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        Conversation stored = load();
        assertEquals(threads * perThread * 2, stored.getMessageCount());
        assertEquals(threads * perThread * 10L, stored.getTotalTokens());
    }

    @Test
    void requestStateIsMergedIntoStoredRecord() {
        Conversation a = service.getOrCreateActive("u1", "g1", "c1", ConversationCategory.GENERAL);
        Conversation b = service.getOrCreateActive("u1", "g1", "c1", ConversationCategory.GROW_TIPS);
        b.setBackendState(BackendState.CHAT_ACTIVE);

        service.recordExchange(b, 2, 50);
        service.recordExchange(a, 2, 50);

        Conversation stored = load();
        assertEquals(ConversationCategory.GROW_TIPS, stored.getCategory());
        assertTrue(stored.isAgeGated());
        assertEquals(BackendState.CHAT_ACTIVE, stored.getBackendState());
        assertEquals(4, stored.getMessageCount());
    }

    @Test
    void exchangeOfReplacedConversationIsNotWrittenOver() {
        Conversation old = service.getOrCreateActive("u1", "g1", "c1", ConversationCategory.GENERAL);
        service.archiveActive("u1", "g1", "c1", ConversationService.END_REASON_USER_CLEARED);
        Conversation current = service.getOrCreateActive("u1", "g1", "c1", ConversationCategory.GENERAL);

        service.recordExchange(old, 2, 100);

        Conversation stored = load();
        assertEquals(current.getId(), stored.getId());
        assertEquals(0, stored.getMessageCount());
    }

    @Test
    void failedExchangeStateDoesNotResetCounters() {
        Conversation a = service.getOrCreateActive("u1", "g1", "c1", ConversationCategory.GENERAL);
        Conversation b = service.getOrCreateActive("u1", "g1", "c1", ConversationCategory.GENERAL);
        service.recordExchange(a, 2, 100);

        b.setAgeGated(true);
        service.saveState(b);

        Conversation stored = load();
        assertEquals(2, stored.getMessageCount());
        assertTrue(stored.isAgeGated());
    }
}
