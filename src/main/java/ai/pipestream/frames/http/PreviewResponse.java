package ai.pipestream.frames.http;

public record PreviewResponse(String mediaType, int width, int height, int sizeBytes, String dataUri) {}
