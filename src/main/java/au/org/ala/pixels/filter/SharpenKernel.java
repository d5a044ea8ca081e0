package au.org.ala.pixels.filter;

import au.org.ala.pixels.raster.PixelBuffer;

/**
 * 3x3 unsharp-style sharpening. Each interior pixel's deviation from its four neighbours is
 * amplified:
 * <pre>
 *     out = clamp(c + amount * (5c - (N + S + E + W)))
 * </pre>
 * on the red, green and blue channels. Alpha and the one pixel border are copied unchanged, so the
 * kernel never samples outside the raster.
 */
public final class SharpenKernel {

    private SharpenKernel() {
    }

    /**
     * @param sharpen the sharpen control, 0-100; 0 returns an exact copy
     */
    public static PixelBuffer apply(PixelBuffer src, double sharpen) {
        return applyAmount(src, sharpen / 100.0);
    }

    public static PixelBuffer applyAmount(PixelBuffer src, double amount) {
        PixelBuffer out = src.copy();
        if (amount == 0) {
            return out;
        }
        int w = src.getWidth();
        int h = src.getHeight();
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                for (int c = 0; c < 3; c++) {
                    int center = src.getChannel(x, y, c);
                    int sum = src.getChannel(x, y - 1, c)
                            + src.getChannel(x, y + 1, c)
                            + src.getChannel(x - 1, y, c)
                            + src.getChannel(x + 1, y, c);
                    out.setChannel(x, y, c, PixelBuffer.clamp(center + amount * (5 * center - sum)));
                }
            }
        }
        return out;
    }
}
