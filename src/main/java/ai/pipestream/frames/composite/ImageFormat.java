package ai.pipestream.frames.composite;

import java.util.Locale;
import java.util.Optional;

/**
 * Template formats the compositor can re-encode to.
 */
public enum ImageFormat {
    JPEG("jpeg", "jpg", "image/jpeg"),
    PNG("png", "png", "image/png");

    private final String writerName;
    private final String extension;
    private final String mediaType;

    ImageFormat(String writerName, String extension, String mediaType) {
        this.writerName = writerName;
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String writerName() {
        return writerName;
    }

    public String extension() {
        return extension;
    }

    public String mediaType() {
        return mediaType;
    }

    public boolean supportsAlpha() {
        return this == PNG;
    }

    /**
     * Maps an ImageIO reader format name ("JPEG", "jpeg", "png") to a supported format.
     */
    public static Optional<ImageFormat> fromReaderName(String formatName) {
        if (formatName == null) {
            return Optional.empty();
        }
        switch (formatName.toLowerCase(Locale.ROOT)) {
            case "jpeg":
            case "jpg":
                return Optional.of(JPEG);
            case "png":
                return Optional.of(PNG);
            default:
                return Optional.empty();
        }
    }
}
