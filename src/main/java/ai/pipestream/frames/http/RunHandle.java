package ai.pipestream.frames.http;

import java.time.Instant;

public record RunHandle(String runId, long projectId, Instant startedAt, String statusUrl) {}
