package me.growmies.assistant.adapter.outbound.audit;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.domain.model.AuditEvent;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.port.outbound.AuditPort;
import me.growmies.assistant.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Asynchronous audit trail. Events go into a bounded queue drained by one
 * daemon thread into daily JSONL files ({@code audit/audit-YYYY-MM-DD.jsonl}).
 *
 * <p>
 * {@link #record(AuditEvent)} never blocks: when the queue is full the event is
 * dropped and a warning is logged.
 */
@Component
@Slf4j
public class StorageAuditSink implements AuditPort {

    private static final long POLL_TIMEOUT_MS = 500;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final AssistantProperties properties;
    private final Clock clock;
    private final BlockingQueue<AuditEvent> queue;

    private volatile boolean running;
    private Thread writer;

    public StorageAuditSink(StoragePort storagePort, ObjectMapper objectMapper, AssistantProperties properties,
            Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, properties.getAudit().getQueueCapacity()));
    }

    @PostConstruct
    public void start() {
        running = true;
        writer = new Thread(this::writeLoop, "audit-writer");
        writer.setDaemon(true);
        writer.start();
        log.info("[Audit] Audit sink started (capacity {})", properties.getAudit().getQueueCapacity());
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (writer != null) {
            writer.interrupt();
            try {
                writer.join(TimeUnit.SECONDS.toMillis(2));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int flushed = drain();
        if (flushed > 0) {
            log.info("[Audit] Flushed {} pending events on shutdown", flushed);
        }
    }

    @Override
    public void record(AuditEvent event) {
        if (event == null) {
            return;
        }
        if (event.getTimestamp() == null) {
            event.setTimestamp(clock.instant());
        }
        if (!queue.offer(event)) {
            log.warn("[Audit] Queue full, dropping {} event for user {}", event.getType(), event.getUserId());
        }
    }

    /**
     * Writes every queued event on the calling thread.
     *
     * @return number of events written
     */
    public int drain() {
        List<AuditEvent> batch = new ArrayList<>();
        queue.drainTo(batch);
        batch.forEach(this::write);
        return batch.size();
    }

    int pending() {
        return queue.size();
    }

    private void writeLoop() {
        while (running) {
            try {
                AuditEvent event = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    write(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private synchronized void write(AuditEvent event) {
        try {
            String line = objectMapper.writeValueAsString(event) + "\n";
            storagePort.appendText(properties.getAudit().getDirectory(), fileFor(event.getTimestamp()), line).join();
        } catch (JsonProcessingException e) {
            log.error("[Audit] Failed to serialize {} event: {}", event.getType(), e.getMessage());
        } catch (RuntimeException e) { // NOSONAR - audit failures must not kill the writer
            log.error("[Audit] Failed to write {} event: {}", event.getType(), e.getMessage());
        }
    }

    static String fileFor(Instant timestamp) {
        return "audit-" + LocalDate.ofInstant(timestamp, ZoneOffset.UTC) + ".jsonl";
    }
}
