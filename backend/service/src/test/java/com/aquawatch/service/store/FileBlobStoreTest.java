package com.aquawatch.service.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileBlobStoreTest {
    @TempDir
    Path root;

    @Test
    void savedBlobLoadsBackFromNestedKey() {
        FileBlobStore store = new FileBlobStore(root);

        store.save("processed/03339000/1756052100.csv", bytes("72.3,1,2,3,4\n"));

        assertEquals("72.3,1,2,3,4\n", text(store.load("processed/03339000/1756052100.csv").orElseThrow()));
        assertTrue(Files.isRegularFile(root.resolve("processed/03339000/1756052100.csv")));
    }

    @Test
    void missingKeyLoadsAsEmpty() {
        assertTrue(new FileBlobStore(root).load("processed/none.csv").isEmpty());
    }

    @Test
    void saveReplacesExistingContentWithoutLeavingTempFiles() throws Exception {
        FileBlobStore store = new FileBlobStore(root);

        store.save("dataset.csv", bytes("old\n"));
        store.save("dataset.csv", bytes("new\n"));

        assertEquals("new\n", text(store.load("dataset.csv").orElseThrow()));
        try (var files = Files.list(root)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void failedMoveRemovesTheTempFile() throws Exception {
        Path occupied = Files.createDirectories(root.resolve("dataset.csv"));
        Files.writeString(occupied.resolve("keep.txt"), "x");
        FileBlobStore store = new FileBlobStore(root);

        assertThrows(IllegalStateException.class, () -> store.save("dataset.csv", bytes("new\n")));

        try (var files = Files.list(root)) {
            assertEquals(List.of("dataset.csv"), files.map(path -> path.getFileName().toString()).toList());
        }
    }

    @Test
    void keysMayNotEscapeTheRoot() {
        FileBlobStore store = new FileBlobStore(root);

        assertThrows(IllegalArgumentException.class, () -> store.save("../outside.csv", bytes("x")));
        assertThrows(IllegalArgumentException.class, () -> store.load("processed/../../etc/passwd"));
        assertThrows(IllegalArgumentException.class, () -> store.load(" "));
        assertThrows(IllegalArgumentException.class, () -> store.resolve("."));
    }

    @Test
    void unwritableRootFailsWithKeyInMessage() throws Exception {
        Path blocker = root.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        FileBlobStore store = new FileBlobStore(blocker);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> store.save("a/b.csv", bytes("x")));
        assertTrue(ex.getMessage().contains("a/b.csv"));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
