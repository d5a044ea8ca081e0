package au.org.ala.pixels;

import au.org.ala.pixels.raster.PixelBuffer;

public class TestBase {

    protected void println(String fmt, Object...args) {
        System.out.println(String.format(fmt, args));
    }

    /**
     * Opaque buffer where red rises left to right, green rises top to bottom and blue is fixed.
     */
    protected PixelBuffer gradient(int width, int height) {
        PixelBuffer buffer = new PixelBuffer(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = width == 1 ? 0 : x * 255 / (width - 1);
                int g = height == 1 ? 0 : y * 255 / (height - 1);
                buffer.setPixel(x, y, r, g, 96, 255);
            }
        }
        return buffer;
    }

    /**
     * Opaque buffer where every pixel is distinct, so any permutation of pixels is detectable.
     */
    protected PixelBuffer unique(int width, int height) {
        PixelBuffer buffer = new PixelBuffer(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                buffer.setPixel(x, y, x % 256, y % 256, (x * 7 + y * 13) % 256, 255);
            }
        }
        return buffer;
    }

    protected PixelBuffer solid(int width, int height, int r, int g, int b, int a) {
        PixelBuffer buffer = new PixelBuffer(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                buffer.setPixel(x, y, r, g, b, a);
            }
        }
        return buffer;
    }

    protected int maxLuma(PixelBuffer buffer) {
        int max = 0;
        for (int y = 0; y < buffer.getHeight(); y++) {
            for (int x = 0; x < buffer.getWidth(); x++) {
                max = Math.max(max, buffer.getRed(x, y) + buffer.getGreen(x, y) + buffer.getBlue(x, y));
            }
        }
        return max;
    }
}
