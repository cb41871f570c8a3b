package me.golemcore.support.adapter.outbound.storage;

import me.golemcore.support.infrastructure.config.SupportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TICKETS = "tickets";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;

    @BeforeEach
    void setUp() {
        SupportProperties properties = new SupportProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
    }

    @Test
    void initCreatesWorkspaceDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("conversations")));
        assertTrue(Files.isDirectory(tempDir.resolve("accounts")));
        assertTrue(Files.isDirectory(tempDir.resolve("tickets")));
        assertTrue(Files.isDirectory(tempDir.resolve("knowledge")));
    }

    @Test
    void putAndGetText() throws Exception {
        storage.putText(TICKETS, "nested/a.txt", "hello").get();

        assertEquals("hello", storage.getText(TICKETS, "nested/a.txt").get());
        assertTrue(storage.exists(TICKETS, "nested/a.txt").get());
    }

    @Test
    void getTextOfMissingFileIsNull() throws Exception {
        assertNull(storage.getText(TICKETS, "missing.txt").get());
        assertFalse(storage.exists(TICKETS, "missing.txt").get());
    }

    @Test
    void appendTextAccumulatesLines() throws Exception {
        storage.appendText(TICKETS, "log.jsonl", "{\"n\":1}\n").get();
        storage.appendText(TICKETS, "log.jsonl", "{\"n\":2}\n").get();

        assertEquals("{\"n\":1}\n{\"n\":2}\n", storage.getText(TICKETS, "log.jsonl").get());
    }

    @Test
    void appendTextAfterUnterminatedLineStartsNewLine() throws Exception {
        storage.putText(TICKETS, "log.jsonl", "{\"n\":1}\n{\"n\":").get();

        storage.appendText(TICKETS, "log.jsonl", "{\"n\":2}\n").get();

        assertEquals("{\"n\":1}\n{\"n\":\n{\"n\":2}\n", storage.getText(TICKETS, "log.jsonl").get());
    }

    @Test
    void putTextAtomicReplacesContentAndLeavesNoStagingFiles() throws Exception {
        storage.putText(TICKETS, "header.json", "old").get();

        storage.putTextAtomic(TICKETS, "header.json", "new").get();

        assertEquals("new", storage.getText(TICKETS, "header.json").get());
        try (Stream<Path> files = Files.list(tempDir.resolve(TICKETS))) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void deleteObjectIgnoresMissingFile() throws Exception {
        storage.putText(TICKETS, "gone.txt", "x").get();

        storage.deleteObject(TICKETS, "gone.txt").get();
        storage.deleteObject(TICKETS, "gone.txt").get();

        assertFalse(storage.exists(TICKETS, "gone.txt").get());
    }

    @Test
    void pathOutsideRootIsRejected() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> storage.getText(TICKETS, "../../outside.txt").get());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void ioFailureSurfacesAsUncheckedIoException() throws IOException {
        Files.createDirectories(tempDir.resolve(TICKETS).resolve("dir-not-file"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> storage.appendText(TICKETS, "dir-not-file", "line\n").get());

        assertInstanceOf(UncheckedIOException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("append"));
    }

    @Test
    void directoryIsNotReadAsText() throws Exception {
        Files.createDirectories(tempDir.resolve(TICKETS).resolve("sub"));

        assertNull(storage.getText(TICKETS, "sub").get());
    }
}
