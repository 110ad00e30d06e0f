package ai.pipestream.frames.composite;

import ai.pipestream.frames.exception.FrameConfigurationException;

/**
 * Pixel region of a template that receives the product image.
 */
public record OverlayRect(int x, int y, int width, int height) {

    public OverlayRect {
        if (x < 0 || y < 0) {
            throw FrameConfigurationException.invalidRect(
                    String.format("x and y must be non-negative (x=%d, y=%d)", x, y));
        }
        if (width <= 0 || height <= 0) {
            throw FrameConfigurationException.invalidRect(
                    String.format("width and height must be positive (width=%d, height=%d)", width, height));
        }
    }

    /**
     * The default rectangle for a fresh project: 100x100 at the origin,
     * shrunk to fit smaller templates.
     */
    public static OverlayRect initialFor(int templateWidth, int templateHeight) {
        return new OverlayRect(0, 0, Math.min(100, templateWidth), Math.min(100, templateHeight));
    }

    public boolean fitsWithin(int templateWidth, int templateHeight) {
        return (long) x + width <= templateWidth && (long) y + height <= templateHeight;
    }

    /**
     * @throws FrameConfigurationException with a bounds error code when the rectangle leaves the template
     */
    public void requireWithin(int templateWidth, int templateHeight) {
        if (!fitsWithin(templateWidth, templateHeight)) {
            throw FrameConfigurationException.outOfBounds(x, y, width, height, templateWidth, templateHeight);
        }
    }

    public double aspectRatio() {
        return (double) width / height;
    }
}
