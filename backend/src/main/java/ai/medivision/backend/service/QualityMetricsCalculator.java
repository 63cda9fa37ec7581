package ai.medivision.backend.service;

import ai.medivision.backend.model.ModalityProfile;
import ai.medivision.backend.model.dto.QualityMetrics;
import ai.medivision.backend.service.exception.MetricComputationException;
import ai.medivision.backend.service.imaging.ImageBuffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes PSNR and SSIM between an original and an enhanced buffer.
 *
 * <ul>
 *     <li>PSNR is {@code 10 log10(255^2 / MSE)} over all samples; identical buffers report
 *     {@link QualityMetrics#PSNR_IDENTICAL_SENTINEL} and SSIM 1.0.</li>
 *     <li>SSIM uses a 7x7 uniform window with sample covariance (K1 = 0.01, K2 = 0.03),
 *     averaged over all windows and channels and clamped to [0,1].</li>
 *     <li>Buffers of different size are compared after resampling the enhanced one to the
 *     original's size; the enhanced image itself is never resampled.</li>
 * </ul>
 *
 * Improvement percentages are copied from the chain's declared step effects.
 */
@Service
public class QualityMetricsCalculator {

    private static final Logger logger = LoggerFactory.getLogger(QualityMetricsCalculator.class);

    static final int WINDOW = 7;
    private static final double DATA_RANGE = ImageBuffer.MAX_SAMPLE;
    private static final double C1 = Math.pow(0.01 * DATA_RANGE, 2);
    private static final double C2 = Math.pow(0.03 * DATA_RANGE, 2);

    /**
     * Computes the metrics of one enhancement. Chains that flip polarity are measured
     * against the inverted original.
     *
     * @throws MetricComputationException if the buffers are too small or the result is not finite
     */
    public QualityMetrics computeMetrics(ImageBuffer original, ImageBuffer enhanced, ModalityProfile profile) {
        ImageBuffer reference = profile.invertsPolarity() ? original.inverted() : original;
        return computeMetrics(reference, enhanced,
                profile.getDeclaredContrastImprovement(), profile.getDeclaredSharpnessImprovement());
    }

    /**
     * Computes the metrics of two buffers with the given declared improvements.
     *
     * @throws MetricComputationException if the buffers are too small or the result is not finite
     */
    public QualityMetrics computeMetrics(ImageBuffer original, ImageBuffer enhanced,
                                         double contrastImprovement, double sharpnessImprovement) {
        ImageBuffer reference = original;
        ImageBuffer candidate = enhanced;
        if (candidate.getWidth() != reference.getWidth() || candidate.getHeight() != reference.getHeight()) {
            logger.debug("Resampling {} to {}x{} for metric computation",
                    candidate, reference.getWidth(), reference.getHeight());
            candidate = candidate.resized(reference.getWidth(), reference.getHeight());
        }
        if (candidate.getChannels() != reference.getChannels()) {
            reference = reference.toRgb();
            candidate = candidate.toRgb();
        }

        double mse = meanSquaredError(reference, candidate);
        if (mse == 0.0) {
            return new QualityMetrics(QualityMetrics.PSNR_IDENTICAL_SENTINEL, 1.0,
                    contrastImprovement, sharpnessImprovement);
        }

        double psnr = Math.min(10.0 * Math.log10(DATA_RANGE * DATA_RANGE / mse),
                QualityMetrics.PSNR_IDENTICAL_SENTINEL);
        double ssim = structuralSimilarity(reference, candidate);
        if (!Double.isFinite(psnr) || !Double.isFinite(ssim)) {
            throw new MetricComputationException("Non-finite metrics: psnr=" + psnr + ", ssim=" + ssim);
        }

        return new QualityMetrics(Math.max(psnr, 0.0), Math.min(Math.max(ssim, 0.0), 1.0),
                contrastImprovement, sharpnessImprovement);
    }

    double meanSquaredError(ImageBuffer a, ImageBuffer b) {
        int[] x = a.copySamples();
        int[] y = b.copySamples();
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            double d = x[i] - y[i];
            sum += d * d;
        }
        return sum / x.length;
    }

    /**
     * Mean SSIM over all 7x7 windows and channels, unclamped.
     */
    double structuralSimilarity(ImageBuffer a, ImageBuffer b) {
        int width = a.getWidth();
        int height = a.getHeight();
        if (width < WINDOW || height < WINDOW) {
            throw new MetricComputationException("Image " + width + "x" + height
                    + " is smaller than the " + WINDOW + "x" + WINDOW + " SSIM window");
        }

        double total = 0.0;
        for (int c = 0; c < a.getChannels(); c++) {
            total += channelSsim(a, b, c);
        }
        return total / a.getChannels();
    }

    private double channelSsim(ImageBuffer a, ImageBuffer b, int channel) {
        int width = a.getWidth();
        int height = a.getHeight();
        int stride = width + 1;

        // Summed-area tables; all entries are exact integers in double precision
        double[] sx = new double[stride * (height + 1)];
        double[] sy = new double[sx.length];
        double[] sxx = new double[sx.length];
        double[] syy = new double[sx.length];
        double[] sxy = new double[sx.length];
        for (int y = 0; y < height; y++) {
            double rx = 0, ry = 0, rxx = 0, ryy = 0, rxy = 0;
            for (int x = 0; x < width; x++) {
                double vx = a.getSample(x, y, channel);
                double vy = b.getSample(x, y, channel);
                rx += vx;
                ry += vy;
                rxx += vx * vx;
                ryy += vy * vy;
                rxy += vx * vy;
                int i = (y + 1) * stride + (x + 1);
                int above = y * stride + (x + 1);
                sx[i] = sx[above] + rx;
                sy[i] = sy[above] + ry;
                sxx[i] = sxx[above] + rxx;
                syy[i] = syy[above] + ryy;
                sxy[i] = sxy[above] + rxy;
            }
        }

        double n = WINDOW * WINDOW;
        double covNorm = n / (n - 1);
        double sum = 0.0;
        long windows = 0;
        for (int y = 0; y + WINDOW <= height; y++) {
            for (int x = 0; x + WINDOW <= width; x++) {
                double mx = boxSum(sx, stride, x, y) / n;
                double my = boxSum(sy, stride, x, y) / n;
                double vx = covNorm * (boxSum(sxx, stride, x, y) / n - mx * mx);
                double vy = covNorm * (boxSum(syy, stride, x, y) / n - my * my);
                double vxy = covNorm * (boxSum(sxy, stride, x, y) / n - mx * my);

                double numerator = (2 * mx * my + C1) * (2 * vxy + C2);
                double denominator = (mx * mx + my * my + C1) * (vx + vy + C2);
                sum += numerator / denominator;
                windows++;
            }
        }
        return sum / windows;
    }

    private static double boxSum(double[] table, int stride, int x, int y) {
        int x1 = x + WINDOW;
        int y1 = y + WINDOW;
        return table[y1 * stride + x1] - table[y * stride + x1] - table[y1 * stride + x] + table[y * stride + x];
    }
}
