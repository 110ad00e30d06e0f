package ai.pipestream.frames.http;

import java.util.List;

/**
 * @param total    outputs of the project, ignoring the search
 * @param filtered outputs matching the search
 */
public record OutputListResponse(long total, long filtered, int offset, int limit, List<OutputRow> outputs) {}
