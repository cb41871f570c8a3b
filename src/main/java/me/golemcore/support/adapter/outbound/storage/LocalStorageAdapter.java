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

package me.golemcore.support.adapter.outbound.storage;

import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * {@link StoragePort} backed by a directory on the local filesystem.
 *
 * <p>
 * Layout under {@code support.storage.local.base-path}:
 * <ul>
 * <li>conversations/ - one header JSON and one message JSONL per conversation
 * <li>accounts/ - customers, subscriptions and invoices
 * <li>tickets/ - created tickets (JSONL)
 * <li>knowledge/ - knowledge base documents
 * </ul>
 * Paths that resolve outside the base directory are rejected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final SupportProperties properties;

    private Path root;

    @FunctionalInterface
    private interface FileAction<T> {
        T apply(Path file) throws IOException;
    }

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        root = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        SupportProperties.DirectoriesProperties dirs = properties.getStorage().getDirectories();
        List<String> kinds = List.of(dirs.getConversations(), dirs.getAccounts(), dirs.getTickets(),
                dirs.getKnowledge());
        try {
            for (String kind : kinds) {
                Files.createDirectories(root.resolve(kind));
            }
            log.info("[Storage] Workspace ready at {}", root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create storage workspace at " + root, e);
        }
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        return run("write", directory, path, file -> {
            ensureParent(file);
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return null;
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return run("read", directory, path,
                file -> Files.isRegularFile(file) ? Files.readString(file, StandardCharsets.UTF_8) : null);
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return run("stat", directory, path, Files::exists);
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return run("delete", directory, path, file -> {
            Files.deleteIfExists(file);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return run("append", directory, path, file -> {
            ensureParent(file);
            appendOnFreshLine(file, content);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content) {
        return run("atomic write", directory, path, file -> {
            ensureParent(file);
            Path staging = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
            try {
                writeSynced(staging, content);
                replace(staging, file);
            } finally {
                Files.deleteIfExists(staging);
            }
            return null;
        });
    }

    private <T> CompletableFuture<T> run(String action, String directory, String path, FileAction<T> body) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolve(directory, path);
            try {
                return body.apply(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Storage " + action + " failed: " + directory + "/" + path, e);
            }
        });
    }

    private static void writeSynced(Path target, String content) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.CREATE_NEW,
                StandardOpenOption.WRITE)) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void appendOnFreshLine(Path target, String content) throws IOException {
        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.CREATE, StandardOpenOption.READ,
                StandardOpenOption.WRITE)) {
            long position = channel.size();
            String text = content;
            if (position > 0 && !endsWithNewline(channel, position)) {
                log.warn("[Storage] {} ends mid-line, starting the next record on a new line", target);
                text = "\n" + content;
            }
            ByteBuffer buffer = ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
        }
    }

    private static boolean endsWithNewline(FileChannel channel, long size) throws IOException {
        ByteBuffer last = ByteBuffer.allocate(1);
        return channel.read(last, size - 1) == 1 && last.get(0) == '\n';
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic rename unsupported for {}, falling back to plain move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void ensureParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private Path resolve(String directory, String path) {
        Path resolved = root.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes storage root: " + directory + "/" + path);
        }
        return resolved;
    }
}
