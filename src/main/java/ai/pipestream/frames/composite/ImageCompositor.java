package ai.pipestream.frames.composite;

import ai.pipestream.frames.exception.CompositeException;
import org.jboss.logging.Logger;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Pastes a product image onto a copy of a frame template.
 * <p>
 * The product is scaled to cover the overlay rectangle and centre-cropped to
 * its exact size: no letterboxing and no distortion. The result is encoded in
 * the template's own format. Rectangle bounds are the caller's responsibility
 * (they are validated when the rectangle is set).
 */
public class ImageCompositor {

    private static final Logger LOG = Logger.getLogger(ImageCompositor.class);

    private final float jpegQuality;
    private final int minDimension;
    private final int maxDimension;

    public ImageCompositor(float jpegQuality, int minDimension, int maxDimension) {
        if (jpegQuality <= 0f || jpegQuality > 1f) {
            throw new IllegalArgumentException("jpegQuality must be in (0, 1]: " + jpegQuality);
        }
        this.jpegQuality = jpegQuality;
        this.minDimension = minDimension;
        this.maxDimension = maxDimension;
    }

    /**
     * Composites and encodes in the template's format.
     *
     * @throws CompositeException when the product cannot be decoded or the result cannot be encoded
     */
    public byte[] compose(FrameTemplate template, OverlayRect rect, byte[] productImage) {
        BufferedImage canvas = render(template, rect, productImage);
        return encode(canvas, template.format(), jpegQuality);
    }

    /**
     * Composites without encoding.
     */
    public BufferedImage render(FrameTemplate template, OverlayRect rect, byte[] productImage) {
        BufferedImage product = decodeProduct(productImage);
        BufferedImage fitted = coverFit(product, rect.width(), rect.height());

        BufferedImage base = template.image();
        int type = template.format().supportsAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage canvas = new BufferedImage(base.getWidth(), base.getHeight(), type);
        Graphics2D g = canvas.createGraphics();
        try {
            if (!template.format().supportsAlpha()) {
                g.setColor(Color.WHITE);
                g.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());
            }
            g.drawImage(base, 0, 0, null);
            g.setClip(rect.x(), rect.y(), rect.width(), rect.height());
            g.drawImage(fitted, rect.x(), rect.y(), null);
        } finally {
            g.dispose();
        }
        LOG.debugf("Composited %dx%d product into (%d, %d, %d, %d)",
                product.getWidth(), product.getHeight(), rect.x(), rect.y(), rect.width(), rect.height());
        return canvas;
    }

    /**
     * Scales {@code source} so it covers {@code width x height}, then crops the centre.
     */
    static BufferedImage coverFit(BufferedImage source, int width, int height) {
        double scale = Math.max((double) width / source.getWidth(), (double) height / source.getHeight());
        int scaledWidth = Math.max(width, (int) Math.round(source.getWidth() * scale));
        int scaledHeight = Math.max(height, (int) Math.round(source.getHeight() * scale));
        int offsetX = (scaledWidth - width) / 2;
        int offsetY = (scaledHeight - height) / 2;

        BufferedImage fitted = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = fitted.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, -offsetX, -offsetY, scaledWidth, scaledHeight, null);
        } finally {
            g.dispose();
        }
        return fitted;
    }

    /**
     * Scales an image down to fit within the given box, keeping its aspect ratio.
     * Images already inside the box are returned unchanged.
     */
    public static BufferedImage fitWithin(BufferedImage source, int maxWidth, int maxHeight) {
        if (source.getWidth() <= maxWidth && source.getHeight() <= maxHeight) {
            return source;
        }
        double scale = Math.min((double) maxWidth / source.getWidth(), (double) maxHeight / source.getHeight());
        int width = Math.max(1, (int) Math.round(source.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(source.getHeight() * scale));
        int type = source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage scaled = new BufferedImage(width, height, type);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    BufferedImage decodeProduct(byte[] productImage) {
        if (productImage == null || productImage.length == 0) {
            throw CompositeException.decodeFailed("product image is empty");
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(productImage))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw CompositeException.decodeFailed("unsupported or corrupt image data");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width < minDimension || height < minDimension
                        || width > maxDimension || height > maxDimension) {
                    throw new CompositeException(CompositeException.Kind.UNSUPPORTED_DIMENSIONS,
                            String.format("product image is %dx%d (allowed %d..%d per side)",
                                    width, height, minDimension, maxDimension));
                }
                return reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            if (e instanceof CompositeException) {
                throw (CompositeException) e;
            }
            throw CompositeException.decodeFailed("corrupt image data: " + e.getMessage(), e);
        }
    }

    /**
     * Encodes an image. JPEG output drops any alpha channel.
     *
     * @throws CompositeException with {@code ENCODE_FAILED} when no writer is available or writing fails
     */
    public static byte[] encode(BufferedImage image, ImageFormat format, float quality) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (format == ImageFormat.PNG) {
                if (!ImageIO.write(image, format.writerName(), out)) {
                    throw CompositeException.encodeFailed("no PNG writer available", null);
                }
                return out.toByteArray();
            }

            Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.writerName());
            if (!writers.hasNext()) {
                throw CompositeException.encodeFailed("no JPEG writer available", null);
            }
            ImageWriter writer = writers.next();
            try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
                writer.setOutput(ios);
                ImageWriteParam param = writer.getDefaultWriteParam();
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(quality);
                writer.write(null, new IIOImage(toRgb(image), null, null), param);
            } finally {
                writer.dispose();
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw CompositeException.encodeFailed(e.getMessage(), e);
        }
    }

    static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
