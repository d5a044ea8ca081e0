package au.org.ala.pixels.filter;

import au.org.ala.pixels.raster.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Colour adjustments applied in a fixed order: brightness, contrast, saturation, blur, hue rotation,
 * opacity. This is the order browsers use for a CSS filter chain, so presets look the same here as
 * they do on a canvas.
 * <p>
 * A stage whose parameter is at its identity value is skipped. The result is always a new buffer.
 */
public class FilterPipeline {

    private static final Logger log = LoggerFactory.getLogger(FilterPipeline.class);

    static final double LUMA_RED = 0.299;
    static final double LUMA_GREEN = 0.587;
    static final double LUMA_BLUE = 0.114;

    private final double blurSigmaScale;

    public FilterPipeline() {
        this(1.0);
    }

    /**
     * @param blurSigmaScale Gaussian standard deviation per unit of the blur control
     */
    public FilterPipeline(double blurSigmaScale) {
        if (!(blurSigmaScale > 0)) {
            throw new IllegalArgumentException("Blur sigma scale must be positive: " + blurSigmaScale);
        }
        this.blurSigmaScale = blurSigmaScale;
    }

    public PixelBuffer apply(PixelBuffer src, FilterState state) {
        PixelBuffer out = src;

        if (!state.isDefault(FilterParameter.BRIGHTNESS)
                || !state.isDefault(FilterParameter.CONTRAST)
                || !state.isDefault(FilterParameter.SATURATION)) {
            out = adjustTone(out, state.getBrightness(), state.getContrast(), state.getSaturation());
        }
        if (state.getBlur() > 0) {
            out = GaussianBlur.blur(out, state.getBlur() * blurSigmaScale);
        }
        double hue = state.getHue() % 360.0;
        if (hue != 0.0) {
            out = rotateHue(out, hue);
        }
        if (!state.isDefault(FilterParameter.OPACITY)) {
            out = scaleAlpha(out, state.getOpacity());
        }

        log.trace("Applied {} to {}", state, src);
        return out == src ? src.copy() : out;
    }

    /**
     * Brightness, contrast and saturation in one pass. Each stage clamps to 0-255; rounding happens
     * once at the end.
     */
    static PixelBuffer adjustTone(PixelBuffer src, double brightness, double contrast, double saturation) {
        double bf = brightness / 100.0;
        double cf = contrast / 100.0;
        double sf = saturation / 100.0;
        int w = src.getWidth();
        int h = src.getHeight();
        PixelBuffer dst = new PixelBuffer(w, h);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double r = src.getRed(x, y);
                double g = src.getGreen(x, y);
                double b = src.getBlue(x, y);

                if (bf != 1.0) {
                    r = clamp(r * bf);
                    g = clamp(g * bf);
                    b = clamp(b * bf);
                }
                if (cf != 1.0) {
                    r = clamp((r - 128) * cf + 128);
                    g = clamp((g - 128) * cf + 128);
                    b = clamp((b - 128) * cf + 128);
                }
                if (sf != 1.0) {
                    double l = LUMA_RED * r + LUMA_GREEN * g + LUMA_BLUE * b;
                    r = clamp(l + (r - l) * sf);
                    g = clamp(l + (g - l) * sf);
                    b = clamp(l + (b - l) * sf);
                }
                dst.setPixel(x, y, (int) Math.round(r), (int) Math.round(g), (int) Math.round(b), src.getAlpha(x, y));
            }
        }
        return dst;
    }

    static PixelBuffer rotateHue(PixelBuffer src, double degrees) {
        int w = src.getWidth();
        int h = src.getHeight();
        PixelBuffer dst = new PixelBuffer(w, h);
        double[] hsl = new double[3];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                rgbToHsl(src.getRed(x, y), src.getGreen(x, y), src.getBlue(x, y), hsl);
                double hue = (hsl[0] + degrees) % 360.0;
                if (hue < 0) hue += 360.0;
                int rgb = hslToRgb(hue, hsl[1], hsl[2]);
                dst.setPixel(x, y, (src.getAlpha(x, y) << 24) | rgb);
            }
        }
        return dst;
    }

    static PixelBuffer scaleAlpha(PixelBuffer src, double opacity) {
        double f = opacity / 100.0;
        int w = src.getWidth();
        int h = src.getHeight();
        PixelBuffer dst = new PixelBuffer(w, h);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                dst.setPixel(x, y, src.getRed(x, y), src.getGreen(x, y), src.getBlue(x, y),
                        PixelBuffer.clamp(src.getAlpha(x, y) * f));
            }
        }
        return dst;
    }

    /**
     * @param out receives hue in degrees [0, 360), saturation and lightness in [0, 1]
     */
    static void rgbToHsl(int red, int green, int blue, double[] out) {
        double r = red / 255.0;
        double g = green / 255.0;
        double b = blue / 255.0;
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double l = (max + min) / 2.0;
        double d = max - min;
        double hue = 0;
        double s = 0;
        if (d != 0) {
            s = l > 0.5 ? d / (2.0 - max - min) : d / (max + min);
            if (max == r) {
                hue = (g - b) / d + (g < b ? 6 : 0);
            } else if (max == g) {
                hue = (b - r) / d + 2;
            } else {
                hue = (r - g) / d + 4;
            }
            hue *= 60.0;
        }
        out[0] = hue;
        out[1] = s;
        out[2] = l;
    }

    /**
     * @return packed 0xRRGGBB
     */
    static int hslToRgb(double hue, double s, double l) {
        double r, g, b;
        if (s == 0) {
            r = g = b = l;
        } else {
            double q = l < 0.5 ? l * (1 + s) : l + s - l * s;
            double p = 2 * l - q;
            double hk = hue / 360.0;
            r = hueToChannel(p, q, hk + 1.0 / 3.0);
            g = hueToChannel(p, q, hk);
            b = hueToChannel(p, q, hk - 1.0 / 3.0);
        }
        return (PixelBuffer.clamp(r * 255.0) << 16) | (PixelBuffer.clamp(g * 255.0) << 8) | PixelBuffer.clamp(b * 255.0);
    }

    private static double hueToChannel(double p, double q, double t) {
        if (t < 0) t += 1;
        if (t > 1) t -= 1;
        if (t < 1.0 / 6.0) return p + (q - p) * 6 * t;
        if (t < 1.0 / 2.0) return q;
        if (t < 2.0 / 3.0) return p + (q - p) * (2.0 / 3.0 - t) * 6;
        return p;
    }

    private static double clamp(double v) {
        return v < 0 ? 0 : Math.min(v, 255);
    }
}
