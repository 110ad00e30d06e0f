package ai.pipestream.frames.http;

public record ErrorResponse(String code, String operation, String message) {}
