package ai.pipestream.frames.http;

import ai.pipestream.frames.composite.OverlayRect;
import ai.pipestream.frames.exception.FrameConfigurationException;

public record OverlayRequest(Integer x, Integer y, Integer width, Integer height) {

    public OverlayRect toRect(String operation) {
        if (x == null) {
            throw FrameConfigurationException.missingField(operation, "x");
        }
        if (y == null) {
            throw FrameConfigurationException.missingField(operation, "y");
        }
        if (width == null) {
            throw FrameConfigurationException.missingField(operation, "width");
        }
        if (height == null) {
            throw FrameConfigurationException.missingField(operation, "height");
        }
        return new OverlayRect(x, y, width, height);
    }
}
