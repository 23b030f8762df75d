package me.growmies.assistant.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.growmies.assistant.infrastructure.config.AssistantProperties;
import me.growmies.assistant.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link StoragePort} over a local directory tree.
 *
 * <p>
 * Every object lives under {@code assistant.storage.local.base-path} (default
 * {@code ${user.home}/.growmies/assistant}) in one of the data directories
 * listed in {@link #DIRECTORIES}. Logs ({@code messages/}, {@code audit/}) are
 * JSONL and only ever appended to; records that are rewritten in place
 * (conversations, preferences, ledger) go through {@link #putTextAtomic}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> DIRECTORIES = List.of("conversations", "archive", "messages", "preferences",
            "ledger", "verification", "knowledge", "audit");

    private static final String BACKUP_SUFFIX = ".bak";
    private static final String TEMP_SUFFIX = ".tmp";

    private final AssistantProperties properties;

    private Path root;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath()
                .replace("${user.home}", System.getProperty("user.home"));
        root = Paths.get(configured).toAbsolutePath().normalize();
        try {
            for (String directory : DIRECTORIES) {
                Files.createDirectories(root.resolve(directory));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create storage directories under " + root, e);
        }
        log.info("[Storage] Using local storage at {}", root);
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        return onFile(directory, path, "write", file -> {
            createParent(file);
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return null;
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return onFile(directory, path, "read",
                file -> Files.isRegularFile(file) ? Files.readString(file, StandardCharsets.UTF_8) : null);
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return onFile(directory, path, "delete", file -> {
            Files.deleteIfExists(file);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return onFile(directory, path, "append", file -> {
            createParent(file);
            Files.writeString(file, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
            return null;
        });
    }

    /**
     * Each write stages its content in its own temp file next to the target, so
     * concurrent writers of one object never share a staging file. The last
     * rename wins.
     */
    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return onFile(directory, path, "atomic write", file -> {
            createParent(file);
            Path staged = Files.createTempFile(file.getParent(), file.getFileName() + ".", TEMP_SUFFIX);
            try {
                Files.write(staged, content.getBytes(StandardCharsets.UTF_8), StandardOpenOption.WRITE,
                        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC);
                if (backup && Files.isRegularFile(file)) {
                    Files.copy(file, file.resolveSibling(file.getFileName() + BACKUP_SUFFIX),
                            StandardCopyOption.REPLACE_EXISTING);
                }
                replace(staged, file);
            } finally {
                Files.deleteIfExists(staged);
            }
            return null;
        });
    }

    private static void replace(Path staged, Path file) throws IOException {
        try {
            Files.move(staged, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic rename unsupported for {}, replacing non-atomically", file);
            Files.move(staged, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private <T> CompletableFuture<T> onFile(String directory, String path, String action, FileTask<T> task) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolve(directory, path);
            try {
                return task.apply(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Storage " + action + " failed for " + directory + "/" + path, e);
            }
        });
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private Path resolve(String directory, String path) {
        Path base = root.resolve(directory).normalize();
        Path resolved = base.resolve(path).normalize();
        if (!base.startsWith(root) || !resolved.startsWith(base)) {
            throw new IllegalArgumentException("Path escapes storage directory: " + directory + "/" + path);
        }
        return resolved;
    }

    @FunctionalInterface
    private interface FileTask<T> {
        T apply(Path file) throws IOException;
    }
}
