package guraa.doccompare.visual;

import guraa.doccompare.model.Fingerprint;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Calculator for 64-bit DCT perceptual hashes.
 * The image is reduced to 32x32 luminance values, transformed with a 2-D DCT-II, and the
 * top-left 8x8 block of coefficients is thresholded against its median.
 *
 * <p>The DCT is unscaled (no orthonormal factor per frequency), the same convention as the
 * default DCT of scipy used by the common Python phash, so the DC row and column compare
 * against the median the same way. Resampling is bilinear rather than Lanczos, so a hash
 * computed here can still differ from an extractor's by a few bits.
 */
public final class PerceptualHashCalculator {

    private static final int SAMPLE_SIZE = 32;
    private static final int HASH_SIZE = 8;

    private static final double[][] DCT_COEFFICIENTS = dctMatrix(SAMPLE_SIZE);

    private PerceptualHashCalculator() {
    }

    /**
     * Compute the perceptual hash of an image.
     *
     * @param image The image
     * @return A 64-bit fingerprint
     */
    public static Fingerprint compute(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("Image must not be null");
        }

        double[][] luminance = luminance(resize(image));
        double[][] dct = transform(luminance);

        double[] block = new double[HASH_SIZE * HASH_SIZE];
        for (int u = 0; u < HASH_SIZE; u++) {
            for (int v = 0; v < HASH_SIZE; v++) {
                block[u * HASH_SIZE + v] = dct[u][v];
            }
        }

        double median = median(block);
        boolean[] bits = new boolean[block.length];
        for (int i = 0; i < block.length; i++) {
            bits[i] = block[i] > median;
        }
        return Fingerprint.fromBits(bits);
    }

    private static BufferedImage resize(BufferedImage image) {
        BufferedImage resized = new BufferedImage(SAMPLE_SIZE, SAMPLE_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, SAMPLE_SIZE, SAMPLE_SIZE, null);
        } finally {
            g.dispose();
        }
        return resized;
    }

    private static double[][] luminance(BufferedImage image) {
        double[][] values = new double[SAMPLE_SIZE][SAMPLE_SIZE];
        for (int y = 0; y < SAMPLE_SIZE; y++) {
            for (int x = 0; x < SAMPLE_SIZE; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                values[y][x] = (299 * r + 587 * g + 114 * b) / 1000.0;
            }
        }
        return values;
    }

    /**
     * Separable 2-D DCT-II: rows first, then columns.
     */
    private static double[][] transform(double[][] input) {
        int n = SAMPLE_SIZE;
        double[][] rows = new double[n][n];
        for (int y = 0; y < n; y++) {
            for (int u = 0; u < n; u++) {
                double sum = 0;
                for (int x = 0; x < n; x++) {
                    sum += DCT_COEFFICIENTS[u][x] * input[y][x];
                }
                rows[y][u] = sum;
            }
        }

        double[][] result = new double[n][n];
        for (int u = 0; u < n; u++) {
            for (int v = 0; v < n; v++) {
                double sum = 0;
                for (int y = 0; y < n; y++) {
                    sum += DCT_COEFFICIENTS[v][y] * rows[y][u];
                }
                result[v][u] = sum;
            }
        }
        return result;
    }

    private static double[][] dctMatrix(int n) {
        double[][] matrix = new double[n][n];
        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                matrix[k][i] = Math.cos(Math.PI * (2 * i + 1) * k / (2.0 * n));
            }
        }
        return matrix;
    }

    private static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
