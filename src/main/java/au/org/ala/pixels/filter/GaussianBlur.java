package au.org.ala.pixels.filter;

import au.org.ala.pixels.raster.PixelBuffer;

import java.util.Arrays;

/**
 * Separable Gaussian blur. Colour is weighted by alpha before filtering (premultiplied) and divided
 * back out afterwards, so transparent neighbours do not darken visible pixels. The kernel radius is
 * {@code ceil(3 * sigma)} and samples outside the raster repeat the nearest edge pixel.
 */
public final class GaussianBlur {

    private GaussianBlur() {
    }

    public static PixelBuffer blur(PixelBuffer src, double sigma) {
        if (!(sigma > 0)) {
            return src.copy();
        }
        double[] kernel = kernel(sigma);
        int radius = kernel.length / 2;
        int w = src.getWidth();
        int h = src.getHeight();
        int channels = PixelBuffer.CHANNELS;
        int alpha = PixelBuffer.ALPHA;

        // premultiplied horizontal pass into an unrounded plane, vertical pass back to bytes
        double[] tmp = new double[w * h * channels];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int base = (y * w + x) * channels;
                for (int k = -radius; k <= radius; k++) {
                    int sx = Math.max(0, Math.min(w - 1, x + k));
                    double weight = kernel[k + radius];
                    int a = src.getAlpha(sx, y);
                    for (int c = 0; c < alpha; c++) {
                        tmp[base + c] += src.getChannel(sx, y, c) * a / 255.0 * weight;
                    }
                    tmp[base + alpha] += a * weight;
                }
            }
        }

        PixelBuffer dst = new PixelBuffer(w, h);
        double[] acc = new double[channels];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                Arrays.fill(acc, 0.0);
                for (int k = -radius; k <= radius; k++) {
                    int sy = Math.max(0, Math.min(h - 1, y + k));
                    double weight = kernel[k + radius];
                    int base = (sy * w + x) * channels;
                    for (int c = 0; c < channels; c++) {
                        acc[c] += tmp[base + c] * weight;
                    }
                }
                double a = acc[alpha];
                for (int c = 0; c < alpha; c++) {
                    dst.setChannel(x, y, c, a > 0 ? PixelBuffer.clamp(acc[c] * 255.0 / a) : 0);
                }
                dst.setChannel(x, y, alpha, PixelBuffer.clamp(a));
            }
        }
        return dst;
    }

    /**
     * Normalised 1-D kernel of length {@code 2 * ceil(3 * sigma) + 1}.
     */
    static double[] kernel(double sigma) {
        int radius = Math.max(1, (int) Math.ceil(3 * sigma));
        double[] kernel = new double[radius * 2 + 1];
        double twoSigmaSq = 2 * sigma * sigma;
        double sum = 0;
        for (int i = -radius; i <= radius; i++) {
            double v = Math.exp(-(i * i) / twoSigmaSq);
            kernel[i + radius] = v;
            sum += v;
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }
}
