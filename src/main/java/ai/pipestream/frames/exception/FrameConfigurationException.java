package ai.pipestream.frames.exception;

/**
 * Thrown when a frame project configuration is rejected: a bad template,
 * a missing field, or an overlay rectangle outside the template bounds.
 * Raised before any I/O and never retried.
 */
public class FrameConfigurationException extends FrameServiceException {

    public static final String CODE = "CONFIGURATION_ERROR";
    public static final String BOUNDS_CODE = "BOUNDS_ERROR";

    public FrameConfigurationException(String operation, String message) {
        super(CODE, operation, message);
    }

    public FrameConfigurationException(String operation, String message, Throwable cause) {
        super(CODE, operation, message, cause);
    }

    private FrameConfigurationException(String code, String operation, String message) {
        super(code, operation, message);
    }

    public boolean isBoundsError() {
        return BOUNDS_CODE.equals(getErrorCode());
    }

    public static FrameConfigurationException outOfBounds(int x, int y, int width, int height,
                                                          int templateWidth, int templateHeight) {
        return new FrameConfigurationException(BOUNDS_CODE, "overlay",
                String.format("rectangle (x=%d, y=%d, width=%d, height=%d) does not fit template %dx%d",
                        x, y, width, height, templateWidth, templateHeight));
    }

    public static FrameConfigurationException invalidRect(String reason) {
        return new FrameConfigurationException(BOUNDS_CODE, "overlay", reason);
    }

    public static FrameConfigurationException missingField(String operation, String fieldName) {
        return new FrameConfigurationException(operation, fieldName + " is required but missing");
    }
}
