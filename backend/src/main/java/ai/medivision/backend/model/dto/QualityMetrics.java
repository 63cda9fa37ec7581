package ai.medivision.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Objective quality metrics of one enhancement.
 *
 * The improvement percentages are the declared effects of the applied transform chain,
 * not values measured on the before/after images.
 */
public final class QualityMetrics {

    /**
     * PSNR reported for pixel-identical images, where the ratio is unbounded.
     */
    public static final double PSNR_IDENTICAL_SENTINEL = 100.0;

    @JsonProperty("psnr")
    private final double psnr;

    @JsonProperty("ssim")
    private final double ssim;

    @JsonProperty("contrast_improvement")
    private final double contrastImprovementPercent;

    @JsonProperty("sharpness_improvement")
    private final double sharpnessImprovementPercent;

    @JsonCreator
    public QualityMetrics(
            @JsonProperty("psnr") double psnr,
            @JsonProperty("ssim") double ssim,
            @JsonProperty("contrast_improvement") double contrastImprovementPercent,
            @JsonProperty("sharpness_improvement") double sharpnessImprovementPercent) {
        this.psnr = psnr;
        this.ssim = ssim;
        this.contrastImprovementPercent = contrastImprovementPercent;
        this.sharpnessImprovementPercent = sharpnessImprovementPercent;
    }

    public double getPsnr() {
        return psnr;
    }

    public double getSsim() {
        return ssim;
    }

    public double getContrastImprovementPercent() {
        return contrastImprovementPercent;
    }

    public double getSharpnessImprovementPercent() {
        return sharpnessImprovementPercent;
    }

    /**
     * Checks the metrics invariant: finite values, SSIM within [0,1], PSNR non-negative.
     */
    @JsonIgnore
    public boolean isValid() {
        return Double.isFinite(psnr) && Double.isFinite(ssim)
                && psnr >= 0.0 && ssim >= 0.0 && ssim <= 1.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QualityMetrics)) {
            return false;
        }
        QualityMetrics that = (QualityMetrics) o;
        return Double.compare(psnr, that.psnr) == 0
                && Double.compare(ssim, that.ssim) == 0
                && Double.compare(contrastImprovementPercent, that.contrastImprovementPercent) == 0
                && Double.compare(sharpnessImprovementPercent, that.sharpnessImprovementPercent) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(psnr, ssim, contrastImprovementPercent, sharpnessImprovementPercent);
    }

    @Override
    public String toString() {
        return "QualityMetrics{psnr=" + psnr + ", ssim=" + ssim
                + ", contrastImprovement=" + contrastImprovementPercent
                + "%, sharpnessImprovement=" + sharpnessImprovementPercent + "%}";
    }
}
