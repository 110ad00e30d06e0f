package ai.pipestream.frames.composite;

import ai.pipestream.frames.exception.FrameConfigurationException;
import ai.pipestream.frames.support.TestImages;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class FrameTemplateTest {

    @Test
    void decodesPngTemplate() {
        FrameTemplate template = FrameTemplate.decode(TestImages.png(640, 480, Color.WHITE), 1_000_000);

        assertEquals(ImageFormat.PNG, template.format());
        assertEquals(640, template.width());
        assertEquals(480, template.height());
    }

    @Test
    void decodesJpegTemplate() {
        FrameTemplate template = FrameTemplate.decode(TestImages.jpeg(64, 32, Color.GRAY), 1_000_000);

        assertEquals(ImageFormat.JPEG, template.format());
    }

    @Test
    void rejectsOtherFormats() throws Exception {
        ByteArrayOutputStream gif = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB), "gif", gif);

        FrameConfigurationException e = assertThrows(FrameConfigurationException.class,
                () -> FrameTemplate.decode(gif.toByteArray(), 1_000_000));

        assertTrue(e.getDetail().contains("JPEG or PNG"));
    }

    @Test
    void rejectsOversizedTemplates() {
        byte[] png = TestImages.png(100, 100, Color.WHITE);

        assertThrows(FrameConfigurationException.class, () -> FrameTemplate.decode(png, png.length - 1));
    }

    @Test
    void rejectsEmptyAndGarbage() {
        assertThrows(FrameConfigurationException.class, () -> FrameTemplate.decode(new byte[0], 100));
        assertThrows(FrameConfigurationException.class, () -> FrameTemplate.decode("hello".getBytes(), 100));
    }

    @Test
    void rejectsDeclaredSizeAboveLimitBeforeReadingPixels() {
        byte[] bomb = TestImages.withDeclaredPngSize(TestImages.png(10, 10, Color.WHITE), 30_000, 30_000);

        FrameConfigurationException e = assertThrows(FrameConfigurationException.class,
                () -> FrameTemplate.decode(bomb, 10_000_000));

        assertEquals(FrameConfigurationException.CODE, e.getErrorCode());
        assertTrue(e.getDetail().contains("30000x30000"));
    }

    @Test
    void honoursConfiguredDimensionLimit() {
        byte[] png = TestImages.png(200, 120, Color.WHITE);

        assertThrows(FrameConfigurationException.class, () -> FrameTemplate.decode(png, 1_000_000, 150));
        assertEquals(200, FrameTemplate.decode(png, 1_000_000, 200).width());
    }

    @Test
    void wrapsDecoderRuntimeFailures() {
        byte[] bomb = TestImages.withDeclaredPngSize(TestImages.png(10, 10, Color.WHITE), 30_000, 30_000);

        FrameConfigurationException e = assertThrows(FrameConfigurationException.class,
                () -> FrameTemplate.decode(bomb, 10_000_000, Integer.MAX_VALUE));

        assertTrue(e.getDetail().startsWith("template could not be decoded"));
    }
}
