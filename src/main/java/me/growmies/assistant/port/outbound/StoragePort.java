package me.growmies.assistant.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for object storage, organised as directories of text objects.
 * Implementations resolve all paths under a single base location and must
 * reject paths that escape it.
 */
public interface StoragePort {

    CompletableFuture<Void> putText(String directory, String path, String content);

    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Replaces an object through a temp file and an atomic rename, optionally
     * keeping a {@code .bak} copy of the previous content.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
