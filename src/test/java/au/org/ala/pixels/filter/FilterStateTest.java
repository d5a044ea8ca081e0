package au.org.ala.pixels.filter;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.*;

@RunWith(JUnit4.class)
public class FilterStateTest {

    @Test
    public void testDefaults() {
        FilterState state = FilterState.defaults();
        assertEquals(100, state.getBrightness(), 0);
        assertEquals(100, state.getContrast(), 0);
        assertEquals(100, state.getSaturation(), 0);
        assertEquals(0, state.getBlur(), 0);
        assertEquals(0, state.getHue(), 0);
        assertEquals(0, state.getRotate(), 0);
        assertEquals(100, state.getOpacity(), 0);
        assertEquals(0, state.getSharpen(), 0);
        assertFalse(state.isFlipHorizontal());
        assertFalse(state.isFlipVertical());
        assertTrue(state.isDefault());
        assertFalse(state.hasGeometry());
    }

    @Test
    public void testWithIsCopyOnWrite() {
        FilterState defaults = FilterState.defaults();
        FilterState bright = defaults.with(FilterParameter.BRIGHTNESS, 150);
        assertEquals(100, defaults.getBrightness(), 0);
        assertEquals(150, bright.getBrightness(), 0);
        assertSame(bright, bright.with(FilterParameter.BRIGHTNESS, 150));
        assertFalse(bright.isDefault());
        assertEquals(defaults, bright.with(FilterParameter.BRIGHTNESS, 100));
    }

    @Test
    public void testOutOfRangeRejected() {
        for (FilterParameter p : FilterParameter.values()) {
            try {
                FilterState.defaults().with(p, p.getMax() + 1);
                fail("expected IllegalArgumentException for " + p);
            } catch (IllegalArgumentException e) {
                // expected
            }
            try {
                FilterState.defaults().with(p, p.getMin() - 1);
                fail("expected IllegalArgumentException for " + p);
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNRejected() {
        FilterState.defaults().with(FilterParameter.HUE, Double.NaN);
    }

    @Test
    public void testFlipsAndGeometry() {
        FilterState flipped = FilterState.defaults().toggleFlipHorizontal();
        assertTrue(flipped.isFlipHorizontal());
        assertTrue(flipped.hasGeometry());
        assertEquals(FilterState.defaults(), flipped.toggleFlipHorizontal());
        assertTrue(FilterState.defaults().with(FilterParameter.ROTATE, 90).hasGeometry());
        assertFalse(FilterState.defaults().with(FilterParameter.ROTATE, 360).hasGeometry());
    }

    @Test
    public void testParameterParse() {
        assertEquals(FilterParameter.SATURATION, FilterParameter.parse("Saturation"));
        assertEquals(FilterParameter.SHARPEN, FilterParameter.parse(" sharpen "));
        try {
            FilterParameter.parse("gamma");
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("gamma"));
        }
    }

    @Test
    public void testPresetLeavesOtherControlsAlone() {
        FilterState state = FilterState.defaults()
                .with(FilterParameter.ROTATE, 45)
                .with(FilterParameter.OPACITY, 60)
                .with(FilterParameter.SHARPEN, 30)
                .toggleFlipVertical();
        FilterState sepia = Preset.SEPIA.applyTo(state);
        assertEquals(110, sepia.getBrightness(), 0);
        assertEquals(90, sepia.getContrast(), 0);
        assertEquals(80, sepia.getSaturation(), 0);
        assertEquals(0, sepia.getBlur(), 0);
        assertEquals(20, sepia.getHue(), 0);
        assertEquals(45, sepia.getRotate(), 0);
        assertEquals(60, sepia.getOpacity(), 0);
        assertEquals(30, sepia.getSharpen(), 0);
        assertTrue(sepia.isFlipVertical());
    }

    @Test
    public void testNonePresetRestoresToneDefaults() {
        FilterState vintage = Preset.VINTAGE.applyTo(FilterState.defaults());
        assertEquals(0.5, vintage.getBlur(), 0);
        assertEquals(FilterState.defaults(), Preset.NONE.applyTo(vintage));
    }

    @Test
    public void testPresetParse() {
        for (Preset preset : Preset.values()) {
            assertEquals(preset, Preset.parse(preset.canonical()));
            assertEquals(preset, Preset.parse(preset.name()));
        }
        assertEquals(Preset.GRAYSCALE, Preset.parse("Greyscale"));
        try {
            Preset.parse("lomo");
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
