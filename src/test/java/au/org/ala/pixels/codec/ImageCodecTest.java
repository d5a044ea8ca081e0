package au.org.ala.pixels.codec;

import au.org.ala.pixels.TestBase;
import au.org.ala.pixels.raster.PixelBuffer;
import com.google.common.io.ByteSource;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.Assert.*;

@RunWith(JUnit4.class)
public class ImageCodecTest extends TestBase {

    private final ImageCodec codec = new ImageCodec();

    @Test
    public void testPngKeepsPixelsAndAlpha() throws Exception {
        PixelBuffer image = unique(33, 17);
        image.setPixel(4, 4, 200, 100, 50, 77);
        byte[] png = codec.encode(image, ExportFormat.PNG);

        assertEquals("image/png", codec.detectContentType(ByteSource.wrap(png), null));
        assertEquals(image, codec.decode(png, "edited.png"));
    }

    @Test
    public void testJpegIsFlattenedOntoBackground() throws Exception {
        PixelBuffer transparent = solid(16, 16, 0, 0, 0, 0);
        byte[] jpeg = codec.encode(transparent, ExportFormat.JPG);

        assertEquals("image/jpeg", codec.detectContentType(ByteSource.wrap(jpeg), "export.jpg"));
        PixelBuffer decoded = codec.decode(jpeg, "export.jpg");
        assertEquals(16, decoded.getWidth());
        assertEquals(16, decoded.getHeight());
        assertEquals(255, decoded.getAlpha(8, 8));
        assertTrue(decoded.getRed(8, 8) > 240);
        assertTrue(decoded.getGreen(8, 8) > 240);
        assertTrue(decoded.getBlue(8, 8) > 240);
    }

    @Test
    public void testEncodeResult() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageCodec.Result result = codec.encode(gradient(20, 10), ExportFormat.JPG, out);
        assertEquals(20, result.width);
        assertEquals(10, result.height);
        assertEquals("image/jpeg", result.mimeType);
        assertTrue(out.size() > 0);
    }

    @Test
    public void testTextIsRejectedBeforeDecoding() throws Exception {
        byte[] text = "just some notes, definitely not pixels\n".getBytes(StandardCharsets.UTF_8);
        try {
            codec.decode(text, "notes.txt");
            fail("expected UnsupportedFileTypeException");
        } catch (UnsupportedFileTypeException e) {
            println("%s", e.getMessage());
            assertTrue(e.getContentType(), e.getContentType().startsWith("text/"));
        }
    }

    @Test(expected = UnsupportedFileTypeException.class)
    public void testUnknownBinaryRejected() throws Exception {
        codec.decode(new byte[]{0, 1, 2, 3, 4, 5, 6, 7}, null);
    }

    @Test
    public void testPngHasNormalOrientation() throws Exception {
        byte[] png = codec.encode(unique(4, 4), ExportFormat.PNG);
        assertEquals(ExifOrientation.Normal, codec.readOrientation(ByteSource.wrap(png)));
    }

    @Test
    public void testExportFormatParse() {
        assertEquals(ExportFormat.JPG, ExportFormat.parse("JPEG"));
        assertEquals(ExportFormat.PNG, ExportFormat.parse(" png "));
        assertEquals("jpg", ExportFormat.JPG.extension());
        try {
            ExportFormat.parse("gif");
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testTimestampedName() {
        Clock clock = Clock.fixed(Instant.parse("2023-12-31T23:59:01.250Z"), ZoneOffset.UTC);
        assertEquals("pixels-edited-2023-12-31T23-59-01.png",
                ExportFileNames.timestamped(ExportFileNames.DEFAULT_PREFIX, ExportFormat.PNG, clock));
        assertEquals("shot-2023-12-31T23-59-01.jpg", ExportFileNames.timestamped("shot-", ExportFormat.JPG, clock));
        assertFalse(ExportFileNames.timestamped(ExportFormat.PNG).contains(":"));
    }
}
