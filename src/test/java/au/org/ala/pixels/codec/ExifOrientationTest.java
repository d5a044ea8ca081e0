package au.org.ala.pixels.codec;

import au.org.ala.pixels.TestBase;
import au.org.ala.pixels.raster.PixelBuffer;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.*;

@RunWith(JUnit4.class)
public class ExifOrientationTest extends TestBase {

    @Test
    public void testFromTagValue() {
        for (ExifOrientation o : ExifOrientation.values()) {
            assertEquals(o, ExifOrientation.fromExifOrientation(o.value()));
        }
        assertEquals(ExifOrientation.Normal, ExifOrientation.fromExifOrientation(0));
        assertEquals(ExifOrientation.Normal, ExifOrientation.fromExifOrientation(42));
    }

    @Test
    public void testNormalIsUntouched() {
        PixelBuffer src = unique(5, 3);
        assertSame(src, ExifOrientation.Normal.apply(src));
    }

    @Test
    public void testRotateClockwiseSwapsDimensions() {
        PixelBuffer src = unique(5, 3);
        PixelBuffer upright = ExifOrientation.RotateCW90.apply(src);
        assertTrue(ExifOrientation.RotateCW90.isFlipDimensions());
        assertEquals(3, upright.getWidth());
        assertEquals(5, upright.getHeight());
        // stored bottom-left ends up top-left, stored top-left ends up top-right
        assertEquals(src.getPixel(0, 2), upright.getPixel(0, 0));
        assertEquals(src.getPixel(0, 0), upright.getPixel(2, 0));
        assertEquals(src.getPixel(4, 0), upright.getPixel(2, 4));
    }

    @Test
    public void testRotate180() {
        PixelBuffer src = unique(5, 3);
        PixelBuffer upright = ExifOrientation.Rotate180.apply(src);
        assertEquals(src.getPixel(4, 2), upright.getPixel(0, 0));
        assertEquals(src, ExifOrientation.Rotate180.apply(upright));
    }

    @Test
    public void testClockwiseThenCounterClockwise() {
        PixelBuffer src = unique(6, 4);
        assertEquals(src, ExifOrientation.RotateCCW90.apply(ExifOrientation.RotateCW90.apply(src)));
        assertEquals(src, ExifOrientation.Transpose.apply(ExifOrientation.Transpose.apply(src)));
        assertEquals(src, ExifOrientation.Transverse.apply(ExifOrientation.Transverse.apply(src)));
    }

    @Test
    public void testMirrors() {
        PixelBuffer src = unique(6, 4);
        assertEquals(src.getPixel(5, 1), ExifOrientation.FlipH.apply(src).getPixel(0, 1));
        assertEquals(src.getPixel(2, 3), ExifOrientation.FlipV.apply(src).getPixel(2, 0));
    }
}
