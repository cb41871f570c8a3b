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

package me.golemcore.support.port.outbound;

import java.util.concurrent.CompletableFuture;

/**
 * Text file storage under the support workspace. The first path segment names
 * the kind of data (conversations, accounts, tickets, knowledge); failures
 * complete the returned future exceptionally with an {@link java.io.UncheckedIOException}.
 */
public interface StoragePort {

    /**
     * Replace the content of a file, creating parent directories.
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from file. Completes with {@code null} if the file does
     * not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file. Missing files are ignored.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Append to a file. Used for the JSONL message and ticket logs: if the file
     * ends in an unterminated line (a torn write), a newline is written first so
     * the appended record starts on its own line.
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Replace a file so readers see either the old or the new content, never
     * a partial write.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);
}
