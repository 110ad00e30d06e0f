package ai.pipestream.frames.storage;

import ai.pipestream.frames.composite.ImageFormat;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Key layout for frame blobs:
 * <pre>
 *   frames/&lt;projectId&gt;/template.&lt;ext&gt;
 *   outputs/&lt;projectId&gt;/&lt;product&gt;.&lt;ext&gt;
 * </pre>
 * Product ids are reduced to {@code [A-Za-z0-9_-]} and at most 50 characters.
 * When that changes the id, a short hash of the original is appended so two
 * distinct ids never share a key.
 */
public final class BlobKeys {

    private static final int MAX_SEGMENT = 50;

    private BlobKeys() {
    }

    public static String template(long projectId, ImageFormat format) {
        return "frames/" + projectId + "/template." + format.extension();
    }

    public static String outputPrefix(long projectId) {
        return "outputs/" + projectId + "/";
    }

    public static String templatePrefix(long projectId) {
        return "frames/" + projectId + "/";
    }

    public static String output(long projectId, String productId, ImageFormat format) {
        return outputPrefix(projectId) + sanitizeProductId(productId) + "." + format.extension();
    }

    static String sanitizeProductId(String productId) {
        StringBuilder safe = new StringBuilder();
        for (char c : productId.toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-' || c == '_') {
                safe.append(c);
            }
            if (safe.length() == MAX_SEGMENT) {
                break;
            }
        }
        if (safe.length() == 0) {
            return "product_" + shortHash(productId);
        }
        if (!safe.toString().equals(productId)) {
            safe.append('_').append(shortHash(productId));
        }
        return safe.toString();
    }

    private static String shortHash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
