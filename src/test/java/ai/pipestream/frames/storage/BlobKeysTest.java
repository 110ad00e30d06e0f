package ai.pipestream.frames.storage;

import ai.pipestream.frames.composite.ImageFormat;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlobKeysTest {

    @Test
    void templateAndOutputLayout() {
        assertEquals("frames/12/template.png", BlobKeys.template(12L, ImageFormat.PNG));
        assertEquals("outputs/12/SKU-1_a.jpg", BlobKeys.output(12L, "SKU-1_a", ImageFormat.JPEG));
        assertTrue(BlobKeys.output(12L, "x", ImageFormat.PNG).startsWith(BlobKeys.outputPrefix(12L)));
        assertTrue(BlobKeys.template(12L, ImageFormat.JPEG).startsWith(BlobKeys.templatePrefix(12L)));
    }

    @Test
    void safeIdsAreKeptAsIs() {
        assertEquals("ABC-123_x", BlobKeys.sanitizeProductId("ABC-123_x"));
    }

    @Test
    void unsafeCharactersAreStrippedAndHashed() {
        String key = BlobKeys.sanitizeProductId("../etc/passwd");

        assertTrue(key.matches("etcpasswd_[0-9a-f]{8}"), key);
    }

    @Test
    void idsThatDifferOnlyInStrippedCharactersGetDifferentKeys() {
        assertNotEquals(BlobKeys.sanitizeProductId("a/b"), BlobKeys.sanitizeProductId("a.b"));
        assertNotEquals(BlobKeys.sanitizeProductId("ab"), BlobKeys.sanitizeProductId("a b"));
    }

    @Test
    void nothingSafeFallsBackToHash() {
        assertTrue(BlobKeys.sanitizeProductId("日本語").matches("product_[0-9a-f]{8}"));
    }

    @Test
    void longIdsAreTruncatedWithHash() {
        String id = "x".repeat(80);

        String key = BlobKeys.sanitizeProductId(id);

        assertEquals(50 + 1 + 8, key.length());
        assertTrue(key.startsWith("x".repeat(50) + "_"));
    }

    @Test
    void sanitizingIsStable() {
        assertEquals(BlobKeys.sanitizeProductId("sku #1"), BlobKeys.sanitizeProductId("sku #1"));
    }
}
