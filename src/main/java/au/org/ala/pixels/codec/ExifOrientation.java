package au.org.ala.pixels.codec;

import au.org.ala.pixels.raster.PixelBuffer;

/**
 * EXIF orientation tag values (TIFF tag 274) and the pixel remapping that brings a stored image
 * upright. Each constant maps a destination pixel back to the stored pixel it comes from, so the
 * result is an exact permutation with no resampling.
 */
public enum ExifOrientation {
    Normal(1, false) {
        @Override
        int sourceX(int x, int y, int w, int h) { return x; }
        @Override
        int sourceY(int x, int y, int w, int h) { return y; }
    },
    FlipH(2, false) {
        @Override
        int sourceX(int x, int y, int w, int h) { return w - 1 - x; }
        @Override
        int sourceY(int x, int y, int w, int h) { return y; }
    },
    Rotate180(3, false) {
        @Override
        int sourceX(int x, int y, int w, int h) { return w - 1 - x; }
        @Override
        int sourceY(int x, int y, int w, int h) { return h - 1 - y; }
    },
    FlipV(4, false) {
        @Override
        int sourceX(int x, int y, int w, int h) { return x; }
        @Override
        int sourceY(int x, int y, int w, int h) { return h - 1 - y; }
    },
    Transpose(5, true) {
        @Override
        int sourceX(int x, int y, int w, int h) { return y; }
        @Override
        int sourceY(int x, int y, int w, int h) { return x; }
    },
    RotateCW90(6, true) {
        @Override
        int sourceX(int x, int y, int w, int h) { return y; }
        @Override
        int sourceY(int x, int y, int w, int h) { return h - 1 - x; }
    },
    Transverse(7, true) {
        @Override
        int sourceX(int x, int y, int w, int h) { return w - 1 - y; }
        @Override
        int sourceY(int x, int y, int w, int h) { return h - 1 - x; }
    },
    RotateCCW90(8, true) {
        @Override
        int sourceX(int x, int y, int w, int h) { return w - 1 - y; }
        @Override
        int sourceY(int x, int y, int w, int h) { return x; }
    };

    private final int value; // TIFF tag 274 value
    private final boolean flipDimensions;

    ExifOrientation(int value, boolean flipDimensions) {
        this.value = value;
        this.flipDimensions = flipDimensions;
    }

    // w and h are the stored (source) dimensions
    abstract int sourceX(int x, int y, int w, int h);

    abstract int sourceY(int x, int y, int w, int h);

    public int value() {
        return value;
    }

    public boolean isFlipDimensions() {
        return flipDimensions;
    }

    public PixelBuffer apply(PixelBuffer src) {
        if (this == Normal) {
            return src;
        }
        int w = src.getWidth();
        int h = src.getHeight();
        int dw = flipDimensions ? h : w;
        int dh = flipDimensions ? w : h;
        PixelBuffer dst = new PixelBuffer(dw, dh);
        for (int y = 0; y < dh; y++) {
            for (int x = 0; x < dw; x++) {
                dst.setPixel(x, y, src.getPixel(sourceX(x, y, w, h), sourceY(x, y, w, h)));
            }
        }
        return dst;
    }

    public static ExifOrientation fromExifOrientation(final int orientation) {
        for (ExifOrientation o : values()) {
            if (o.value == orientation) {
                return o;
            }
        }
        return Normal;
    }
}
