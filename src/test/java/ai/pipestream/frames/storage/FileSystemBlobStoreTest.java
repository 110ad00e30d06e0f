package ai.pipestream.frames.storage;

import ai.pipestream.frames.exception.BlobStorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemBlobStoreTest {

    @TempDir
    Path root;

    private FileSystemBlobStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemBlobStore(root);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void putThenGet() {
        store.put("outputs/1/a.png", bytes("one"), "image/png");

        assertArrayEquals(bytes("one"), store.get("outputs/1/a.png").orElseThrow());
        assertTrue(Files.exists(root.resolve("outputs/1/a.png")));
    }

    @Test
    void putOverwrites() {
        store.put("outputs/1/a.png", bytes("one"), "image/png");
        store.put("outputs/1/a.png", bytes("two"), "image/png");

        assertArrayEquals(bytes("two"), store.get("outputs/1/a.png").orElseThrow());
    }

    @Test
    void missingKeyIsEmpty() {
        assertTrue(store.get("outputs/1/missing.png").isEmpty());
    }

    @Test
    void deleteIsIdempotent() {
        store.put("frames/1/template.png", bytes("t"), "image/png");

        store.delete("frames/1/template.png");
        store.delete("frames/1/template.png");

        assertTrue(store.get("frames/1/template.png").isEmpty());
    }

    @Test
    void deletePrefixRemovesOnlyThatProject() {
        store.put("outputs/1/a.png", bytes("a"), "image/png");
        store.put("outputs/1/b.png", bytes("b"), "image/png");
        store.put("outputs/11/c.png", bytes("c"), "image/png");

        assertEquals(2, store.deletePrefix(BlobKeys.outputPrefix(1L)));

        assertTrue(store.get("outputs/1/a.png").isEmpty());
        assertTrue(store.get("outputs/11/c.png").isPresent());
        assertEquals(0, store.deletePrefix(BlobKeys.outputPrefix(1L)));
    }

    @Test
    void keysCannotEscapeTheRoot() {
        assertThrows(BlobStorageException.class, () -> store.put("../outside.png", bytes("x"), "image/png"));
        assertThrows(BlobStorageException.class, () -> store.get("outputs/../../etc/passwd"));
        assertThrows(BlobStorageException.class, () -> store.delete(""));
        assertFalse(Files.exists(root.getParent().resolve("outside.png")));
    }

    @Test
    void pingSucceedsOnWritableRoot() {
        assertDoesNotThrow(store::ping);
        assertTrue(store.describe().startsWith("file://"));
    }
}
