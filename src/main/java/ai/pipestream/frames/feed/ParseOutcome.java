package ai.pipestream.frames.feed;

/**
 * Per-entry result of parsing a feed: either a usable product or a skipped
 * entry with the reason it was skipped.
 */
public interface ParseOutcome {

    int position();

    record Parsed(ProductRecord product) implements ParseOutcome {
        @Override
        public int position() {
            return product.position();
        }
    }

    record Skipped(int position, String reason) implements ParseOutcome {
    }
}
