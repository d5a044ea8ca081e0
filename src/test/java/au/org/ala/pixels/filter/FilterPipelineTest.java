package au.org.ala.pixels.filter;

import au.org.ala.pixels.TestBase;
import au.org.ala.pixels.raster.PixelBuffer;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.*;

@RunWith(JUnit4.class)
public class FilterPipelineTest extends TestBase {

    private final FilterPipeline pipeline = new FilterPipeline();

    @Test
    public void testDefaultsReturnEqualCopy() {
        PixelBuffer src = unique(16, 16);
        PixelBuffer out = pipeline.apply(src, FilterState.defaults());
        assertEquals(src, out);
        assertNotSame(src, out);
    }

    @Test
    public void testBrightnessScalesChannels() {
        PixelBuffer src = solid(2, 2, 100, 40, 200, 255);
        PixelBuffer out = pipeline.apply(src, FilterState.defaults().with(FilterParameter.BRIGHTNESS, 150));
        assertEquals(150, out.getRed(0, 0));
        assertEquals(60, out.getGreen(0, 0));
        assertEquals(255, out.getBlue(0, 0));
        assertEquals(255, out.getAlpha(0, 0));
    }

    @Test
    public void testContrastPivotsOnMidGrey() {
        FilterState state = FilterState.defaults().with(FilterParameter.CONTRAST, 200);
        assertEquals(0, pipeline.apply(solid(1, 1, 64, 64, 64, 255), state).getRed(0, 0));
        assertEquals(128, pipeline.apply(solid(1, 1, 128, 128, 128, 255), state).getRed(0, 0));
        assertEquals(255, pipeline.apply(solid(1, 1, 192, 192, 192, 255), state).getRed(0, 0));
    }

    @Test
    public void testZeroSaturationGivesLuma() {
        PixelBuffer out = pipeline.apply(solid(1, 1, 255, 0, 0, 255),
                FilterState.defaults().with(FilterParameter.SATURATION, 0));
        // 0.299 * 255
        assertEquals(76, out.getRed(0, 0));
        assertEquals(76, out.getGreen(0, 0));
        assertEquals(76, out.getBlue(0, 0));
    }

    @Test
    public void testToneStagesClampBetweenSteps() {
        // brightness pushes 200 to 255 before contrast sees it
        FilterState state = FilterState.defaults()
                .with(FilterParameter.BRIGHTNESS, 200)
                .with(FilterParameter.CONTRAST, 50);
        PixelBuffer out = pipeline.apply(solid(1, 1, 200, 200, 200, 255), state);
        assertEquals(PixelBuffer.clamp((255 - 128) * 0.5 + 128), out.getRed(0, 0));
    }

    @Test
    public void testHueRotationOfPrimary() {
        PixelBuffer out = pipeline.apply(solid(1, 1, 255, 0, 0, 255),
                FilterState.defaults().with(FilterParameter.HUE, 120));
        assertEquals(0, out.getRed(0, 0));
        assertEquals(255, out.getGreen(0, 0));
        assertEquals(0, out.getBlue(0, 0));
    }

    @Test
    public void testFullHueTurnIsIdentity() {
        PixelBuffer src = unique(8, 8);
        assertEquals(src, pipeline.apply(src, FilterState.defaults().with(FilterParameter.HUE, 360)));
    }

    @Test
    public void testHueLeavesGreyAlone() {
        PixelBuffer src = solid(2, 2, 90, 90, 90, 200);
        assertEquals(src, pipeline.apply(src, FilterState.defaults().with(FilterParameter.HUE, 77)));
    }

    @Test
    public void testOpacityScalesAlphaOnly() {
        PixelBuffer out = pipeline.apply(solid(1, 1, 10, 20, 30, 255),
                FilterState.defaults().with(FilterParameter.OPACITY, 50));
        assertEquals(128, out.getAlpha(0, 0));
        assertEquals(10, out.getRed(0, 0));
        assertEquals(20, out.getGreen(0, 0));
        assertEquals(30, out.getBlue(0, 0));
    }

    @Test
    public void testBlurKeepsFlatAreasFlat() {
        PixelBuffer src = solid(12, 12, 100, 150, 200, 255);
        assertEquals(src, pipeline.apply(src, FilterState.defaults().with(FilterParameter.BLUR, 3)));
    }

    @Test
    public void testBlurSpreadsPointSymmetrically() {
        PixelBuffer src = solid(11, 11, 0, 0, 0, 255);
        src.setPixel(5, 5, 255, 255, 255, 255);
        PixelBuffer out = pipeline.apply(src, FilterState.defaults().with(FilterParameter.BLUR, 1));
        assertTrue(out.getRed(5, 5) < 255);
        assertTrue(out.getRed(4, 5) > 0);
        assertEquals(out.getRed(4, 5), out.getRed(6, 5));
        assertEquals(out.getRed(5, 4), out.getRed(5, 6));
        assertEquals(out.getRed(4, 5), out.getRed(5, 4));
        assertTrue(out.getRed(4, 5) > out.getRed(3, 5));
    }

    @Test
    public void testBlurDoesNotDarkenEdgesNextToTransparency() {
        PixelBuffer src = solid(20, 1, 0, 0, 0, 0);
        for (int x = 10; x < 20; x++) {
            src.setPixel(x, 0, 255, 255, 255, 255);
        }
        PixelBuffer out = pipeline.apply(src, FilterState.defaults().with(FilterParameter.BLUR, 2));
        for (int x = 0; x < 20; x++) {
            if (out.getAlpha(x, 0) > 0) {
                assertEquals("red at " + x, 255, out.getRed(x, 0));
                assertEquals("green at " + x, 255, out.getGreen(x, 0));
                assertEquals("blue at " + x, 255, out.getBlue(x, 0));
            }
        }
        assertTrue(out.getAlpha(10, 0) < 255);
        assertTrue(out.getAlpha(9, 0) > 0);
        assertEquals(0, out.getAlpha(0, 0));
        assertEquals(0, out.getRed(0, 0));
    }

    @Test
    public void testKernelIsNormalised() {
        double[] kernel = GaussianBlur.kernel(2.0);
        assertEquals(2 * 6 + 1, kernel.length);
        double sum = 0;
        for (double k : kernel) sum += k;
        assertEquals(1.0, sum, 1e-9);
    }

    @Test
    public void testBlurSigmaScale() {
        PixelBuffer src = solid(21, 1, 0, 0, 0, 255);
        src.setPixel(10, 0, 255, 255, 255, 255);
        FilterState state = FilterState.defaults().with(FilterParameter.BLUR, 1);
        PixelBuffer narrow = new FilterPipeline(0.5).apply(src, state);
        PixelBuffer wide = new FilterPipeline(2.0).apply(src, state);
        assertTrue(narrow.getRed(10, 0) > wide.getRed(10, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveBlurScaleRejected() {
        new FilterPipeline(0);
    }

    @Test
    public void testBrightenAndContrastRaisesBrightestPixel() {
        PixelBuffer src = gradient(64, 32);
        FilterState state = FilterState.defaults()
                .with(FilterParameter.BRIGHTNESS, 150)
                .with(FilterParameter.CONTRAST, 120);
        assertTrue(maxLuma(pipeline.apply(src, state)) > maxLuma(src));
    }

    @Test
    public void testGrayscalePresetRemovesColour() {
        PixelBuffer out = pipeline.apply(unique(10, 10), Preset.GRAYSCALE.applyTo(FilterState.defaults()));
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 10; x++) {
                assertEquals(out.getRed(x, y), out.getGreen(x, y));
                assertEquals(out.getGreen(x, y), out.getBlue(x, y));
            }
        }
    }

    @Test
    public void testHslConversions() {
        double[] hsl = new double[3];
        FilterPipeline.rgbToHsl(0, 0, 255, hsl);
        assertEquals(240.0, hsl[0], 1e-9);
        assertEquals(1.0, hsl[1], 1e-9);
        assertEquals(0.5, hsl[2], 1e-9);
        assertEquals(0x0000FF, FilterPipeline.hslToRgb(240.0, 1.0, 0.5));
        assertEquals(0x808080, FilterPipeline.hslToRgb(0, 0, 128 / 255.0));
    }
}
