package ai.pipestream.frames.preview;

import java.util.Base64;

/**
 * An encoded preview, ready to inline in a page.
 */
public record PreviewImage(byte[] bytes, String mediaType, int width, int height) {

    public String dataUri() {
        return "data:" + mediaType + ";base64," + Base64.getEncoder().encodeToString(bytes);
    }
}
