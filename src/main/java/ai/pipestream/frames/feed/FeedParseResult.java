package ai.pipestream.frames.feed;

import java.util.List;
import java.util.stream.Collectors;

/**
 * All entry outcomes of one feed document, in document order.
 */
public record FeedParseResult(List<ParseOutcome> outcomes) {

    public FeedParseResult {
        outcomes = List.copyOf(outcomes);
    }

    public List<ProductRecord> products() {
        return outcomes.stream()
                .filter(ParseOutcome.Parsed.class::isInstance)
                .map(o -> ((ParseOutcome.Parsed) o).product())
                .collect(Collectors.toList());
    }

    public List<ParseOutcome.Skipped> skipped() {
        return outcomes.stream()
                .filter(ParseOutcome.Skipped.class::isInstance)
                .map(ParseOutcome.Skipped.class::cast)
                .collect(Collectors.toList());
    }

    /**
     * Skipped entries rendered as {@code "entry <n>: <reason>"}.
     */
    public List<String> warnings() {
        return skipped().stream()
                .map(s -> "entry " + s.position() + ": " + s.reason())
                .collect(Collectors.toList());
    }
}
