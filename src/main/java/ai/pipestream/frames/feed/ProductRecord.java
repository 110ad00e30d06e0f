package ai.pipestream.frames.feed;

import java.util.Map;

/**
 * One product from a feed fetch. Lives only for the duration of a bulk run
 * or preview and is never persisted on its own.
 *
 * @param position   zero-based position of the entry in the document
 * @param attributes optional metadata (title, link, price, brand) keyed by local name
 */
public record ProductRecord(int position, String productId, String imageUrl, Map<String, String> attributes) {

    public ProductRecord {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId cannot be null or blank");
        }
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new IllegalArgumentException("imageUrl cannot be null or blank");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
