package ai.pipestream.frames.output;

import java.util.List;

/**
 * One page of outputs for a paginated table.
 *
 * @param total    all outputs of the project, ignoring the filter
 * @param filtered outputs matching the filter
 */
public record OutputPage(long total, long filtered, int offset, int limit, List<StoredOutput> rows) {

    public OutputPage {
        rows = List.copyOf(rows);
    }
}
