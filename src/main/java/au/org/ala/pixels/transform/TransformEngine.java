package au.org.ala.pixels.transform;

import au.org.ala.pixels.InvalidDimensionsException;
import au.org.ala.pixels.crop.CropRect;
import au.org.ala.pixels.raster.PixelBuffer;
import org.imgscalr.Scalr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

/**
 * Geometric operations over a {@link PixelBuffer}. Every operation returns a new buffer and leaves
 * its input untouched.
 * <p>
 * In the render pipeline geometry always runs first: translate to the centre, mirror, rotate,
 * translate back. Colour filters and sharpening are applied to the result.
 */
public class TransformEngine {

    private static final Logger log = LoggerFactory.getLogger(TransformEngine.class);

    private final int minCropSize;

    public TransformEngine() {
        this(CropRect.MIN_SIZE);
    }

    public TransformEngine(int minCropSize) {
        this.minCropSize = minCropSize;
    }

    /**
     * Mirror the buffer through its centre. Flipping the same axis twice gives back the original pixels.
     */
    public PixelBuffer flip(PixelBuffer src, boolean horizontal, boolean vertical) {
        int w = src.getWidth();
        int h = src.getHeight();
        PixelBuffer dst = new PixelBuffer(w, h);
        for (int y = 0; y < h; y++) {
            int sy = vertical ? h - 1 - y : y;
            for (int x = 0; x < w; x++) {
                int sx = horizontal ? w - 1 - x : x;
                dst.setPixel(x, y, src.getPixel(sx, sy));
            }
        }
        return dst;
    }

    /**
     * Rotate about the canvas centre. The canvas keeps its size, so corners that leave it are clipped
     * and uncovered areas become transparent.
     */
    public PixelBuffer rotate(PixelBuffer src, double degrees) {
        return orient(src, false, false, degrees);
    }

    /**
     * The geometric step of the render pipeline: mirror on either axis, then rotate, both about the
     * centre, in a single resampling pass. Whole turns skip resampling entirely.
     */
    public PixelBuffer orient(PixelBuffer src, boolean flipHorizontal, boolean flipVertical, double degrees) {
        double angle = normaliseDegrees(degrees);
        if (angle == 0.0) {
            return flipHorizontal || flipVertical ? flip(src, flipHorizontal, flipVertical) : src.copy();
        }

        double cx = src.getWidth() / 2.0;
        double cy = src.getHeight() / 2.0;

        AffineTransform at = new AffineTransform();
        at.translate(cx, cy);
        at.scale(flipHorizontal ? -1 : 1, flipVertical ? -1 : 1);
        at.rotate(Math.toRadians(angle));
        at.translate(-cx, -cy);

        log.debug("Orienting {}x{} flipH={} flipV={} angle={}", src.getWidth(), src.getHeight(), flipHorizontal, flipVertical, angle);
        return transform(src, at);
    }

    /**
     * Resample to exactly {@code newWidth x newHeight} using imgscalr's quality mode.
     *
     * @throws InvalidDimensionsException if either dimension is not positive
     */
    public PixelBuffer resize(PixelBuffer src, int newWidth, int newHeight) {
        if (newWidth <= 0 || newHeight <= 0) {
            throw new InvalidDimensionsException(newWidth, newHeight,
                    "Resize dimensions must be positive: " + newWidth + "x" + newHeight);
        }
        if (newWidth == src.getWidth() && newHeight == src.getHeight()) {
            return src.copy();
        }
        BufferedImage image = src.toBufferedImage();
        BufferedImage scaled = Scalr.resize(image, Scalr.Method.QUALITY, Scalr.Mode.FIT_EXACT, newWidth, newHeight);
        try {
            if (scaled.getWidth() != newWidth || scaled.getHeight() != newHeight) {
                throw new IllegalStateException("Resampler produced " + scaled.getWidth() + "x" + scaled.getHeight()
                        + " instead of " + newWidth + "x" + newHeight);
            }
            return PixelBuffer.fromBufferedImage(scaled);
        } finally {
            image.flush();
            scaled.flush();
        }
    }

    /**
     * Fill in a missing dimension from the source aspect ratio, rounding to the nearest pixel.
     *
     * @param width  requested width, or null to derive it
     * @param height requested height, or null to derive it
     * @throws InvalidDimensionsException if both are missing or the result is not positive
     */
    public static Dimension deriveSize(int srcWidth, int srcHeight, Integer width, Integer height) {
        int w;
        int h;
        if (width != null && height != null) {
            w = width;
            h = height;
        } else if (width != null) {
            w = width;
            h = (int) Math.round(width * (srcHeight / (double) srcWidth));
        } else if (height != null) {
            h = height;
            w = (int) Math.round(height * (srcWidth / (double) srcHeight));
        } else {
            throw new InvalidDimensionsException(0, 0, "Resize needs a width or a height");
        }
        if (w <= 0 || h <= 0) {
            throw new InvalidDimensionsException(w, h, "Resize dimensions must be positive: " + w + "x" + h);
        }
        return new Dimension(w, h);
    }

    /**
     * Copy the rectangle into a new buffer of exactly {@code rect.width x rect.height}.
     *
     * @throws au.org.ala.pixels.InvalidRectException if the rectangle does not fit the buffer or is
     *                                                 below the minimum crop size
     */
    public PixelBuffer crop(PixelBuffer src, CropRect rect) {
        rect.validate(src.getWidth(), src.getHeight(), minCropSize);
        PixelBuffer dst = new PixelBuffer(rect.width, rect.height);
        for (int y = 0; y < rect.height; y++) {
            for (int x = 0; x < rect.width; x++) {
                dst.setPixel(x, y, src.getPixel(rect.x + x, rect.y + y));
            }
        }
        return dst;
    }

    static double normaliseDegrees(double degrees) {
        double angle = degrees % 360.0;
        if (angle < 0) angle += 360.0;
        return angle;
    }

    private PixelBuffer transform(PixelBuffer src, AffineTransform tx) {
        BufferedImage image = src.toBufferedImage();
        BufferedImage dst = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2 = dst.createGraphics();
        try {
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2.drawImage(image, tx, null);
        } finally {
            g2.dispose();
        }
        try {
            return PixelBuffer.fromBufferedImage(dst);
        } finally {
            image.flush();
            dst.flush();
        }
    }
}
