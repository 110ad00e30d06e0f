package ai.pipestream.frames.composite;

import ai.pipestream.frames.exception.FrameConfigurationException;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * A decoded frame template. Instances are only created through
 * {@link #decode(byte[], long)}, so holding one means the template bytes were
 * a readable JPEG or PNG. The decoded image is shared read-only by every
 * composite that uses this template.
 */
public final class FrameTemplate {

    private final byte[] bytes;
    private final ImageFormat format;
    private final BufferedImage image;

    private FrameTemplate(byte[] bytes, ImageFormat format, BufferedImage image) {
        this.bytes = bytes;
        this.format = format;
        this.image = image;
    }

    /**
     * Largest accepted template width or height when no limit is given.
     */
    public static final int DEFAULT_MAX_DIMENSION = 8000;

    public static FrameTemplate decode(byte[] bytes, long maxBytes) {
        return decode(bytes, maxBytes, DEFAULT_MAX_DIMENSION);
    }

    /**
     * Decodes and validates template bytes. The declared pixel size is checked
     * against {@code maxDimension} before any pixels are read.
     *
     * @throws FrameConfigurationException when the bytes are empty, too large, or not a JPEG/PNG image
     */
    public static FrameTemplate decode(byte[] bytes, long maxBytes, int maxDimension) {
        if (bytes == null || bytes.length == 0) {
            throw new FrameConfigurationException("template", "template image is empty");
        }
        if (bytes.length > maxBytes) {
            throw new FrameConfigurationException("template",
                    String.format("template image is %d bytes (max %d)", bytes.length, maxBytes));
        }

        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new FrameConfigurationException("template", "template is not a recognised image");
            }
            ImageReader reader = readers.next();
            try {
                String formatName = reader.getFormatName();
                ImageFormat format = ImageFormat.fromReaderName(formatName)
                        .orElseThrow(() -> new FrameConfigurationException("template",
                                "template must be JPEG or PNG, got " + formatName));
                reader.setInput(in, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width <= 0 || height <= 0) {
                    throw new FrameConfigurationException("template", "template has no pixels");
                }
                if (width > maxDimension || height > maxDimension) {
                    throw new FrameConfigurationException("template",
                            String.format("template is %dx%d (max %d per side)", width, height, maxDimension));
                }
                BufferedImage image = reader.read(0);
                return new FrameTemplate(bytes.clone(), format, image);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            if (e instanceof FrameConfigurationException) {
                throw (FrameConfigurationException) e;
            }
            throw new FrameConfigurationException("template", "template could not be decoded: " + e.getMessage(), e);
        }
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int sizeBytes() {
        return bytes.length;
    }

    public ImageFormat format() {
        return format;
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    BufferedImage image() {
        return image;
    }
}
