package au.org.ala.pixels.raster;

import au.org.ala.pixels.InvalidDimensionsException;
import com.google.common.base.MoreObjects;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * A width x height raster of non-premultiplied RGBA samples, four bytes per pixel in
 * row-major order. The backing array always holds exactly {@code width * height * 4} bytes.
 * <p>
 * Transforms never write into their input; they return a new buffer and fill it through the
 * clamping setters.
 */
public final class PixelBuffer {

    public static final int CHANNELS = 4;
    public static final int RED = 0;
    public static final int GREEN = 1;
    public static final int BLUE = 2;
    public static final int ALPHA = 3;

    private final int width;
    private final int height;
    private final byte[] pixels;

    public PixelBuffer(int width, int height) {
        this(width, height, newStorage(width, height));
    }

    private PixelBuffer(int width, int height, byte[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /**
     * Wrap a copy of the given RGBA bytes.
     */
    public static PixelBuffer of(int width, int height, byte[] rgba) {
        byte[] storage = newStorage(width, height);
        if (rgba.length != storage.length) {
            throw new IllegalArgumentException("Expected " + storage.length + " RGBA bytes for "
                    + width + "x" + height + " but got " + rgba.length);
        }
        System.arraycopy(rgba, 0, storage, 0, storage.length);
        return new PixelBuffer(width, height, storage);
    }

    private static byte[] newStorage(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidDimensionsException(width, height);
        }
        long length = (long) width * height * CHANNELS;
        if (length > Integer.MAX_VALUE) {
            throw new InvalidDimensionsException(width, height, "Raster too large: " + width + "x" + height);
        }
        return new byte[(int) length];
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int length() {
        return pixels.length;
    }

    public boolean sameSize(PixelBuffer other) {
        return other != null && other.width == width && other.height == height;
    }

    public int getChannel(int x, int y, int channel) {
        return pixels[offset(x, y) + channel] & 0xFF;
    }

    /**
     * Write a single channel, clamping the value to 0-255.
     */
    public void setChannel(int x, int y, int channel, int value) {
        pixels[offset(x, y) + channel] = (byte) clamp(value);
    }

    public int getRed(int x, int y) {
        return getChannel(x, y, RED);
    }

    public int getGreen(int x, int y) {
        return getChannel(x, y, GREEN);
    }

    public int getBlue(int x, int y) {
        return getChannel(x, y, BLUE);
    }

    public int getAlpha(int x, int y) {
        return getChannel(x, y, ALPHA);
    }

    /**
     * @return the pixel packed as a non-premultiplied ARGB int, as used by {@link BufferedImage#getRGB(int, int)}
     */
    public int getPixel(int x, int y) {
        int i = offset(x, y);
        return ((pixels[i + ALPHA] & 0xFF) << 24)
                | ((pixels[i + RED] & 0xFF) << 16)
                | ((pixels[i + GREEN] & 0xFF) << 8)
                | (pixels[i + BLUE] & 0xFF);
    }

    public void setPixel(int x, int y, int argb) {
        int i = offset(x, y);
        pixels[i + RED] = (byte) (argb >>> 16);
        pixels[i + GREEN] = (byte) (argb >>> 8);
        pixels[i + BLUE] = (byte) argb;
        pixels[i + ALPHA] = (byte) (argb >>> 24);
    }

    public void setPixel(int x, int y, int r, int g, int b, int a) {
        int i = offset(x, y);
        pixels[i + RED] = (byte) clamp(r);
        pixels[i + GREEN] = (byte) clamp(g);
        pixels[i + BLUE] = (byte) clamp(b);
        pixels[i + ALPHA] = (byte) clamp(a);
    }

    public void fill(int argb) {
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                setPixel(x, y, argb);
            }
        }
    }

    public PixelBuffer copy() {
        return new PixelBuffer(width, height, pixels.clone());
    }

    /**
     * @return a copy of the raw RGBA bytes
     */
    public byte[] toByteArray() {
        return pixels.clone();
    }

    public static PixelBuffer fromBufferedImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        PixelBuffer buffer = new PixelBuffer(w, h);
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                buffer.setPixel(x, y, row[x]);
            }
        }
        return buffer;
    }

    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                row[x] = getPixel(x, y);
            }
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    public static int clamp(int value) {
        return value < 0 ? 0 : Math.min(value, 255);
    }

    public static int clamp(double value) {
        if (value <= 0) return 0;
        if (value >= 255) return 255;
        return (int) Math.round(value);
    }

    private int offset(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (" + x + "," + y + ") outside " + width + "x" + height);
        }
        return (y * width + x) * CHANNELS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer)) return false;
        PixelBuffer that = (PixelBuffer) o;
        return width == that.width && height == that.height && Arrays.equals(pixels, that.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("width", width)
                .add("height", height)
                .toString();
    }
}
