package ai.medivision.backend.model;

import ai.medivision.backend.model.dto.QualityMetrics;
import ai.medivision.backend.service.imaging.InvertStep;
import ai.medivision.backend.service.imaging.TransformStep;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable enhancement profile of one modality: its ordered transform chain and the
 * nominal metric values historically associated with that chain.
 *
 * Nominal values are a last-resort fallback for when real metrics cannot be computed.
 */
public final class ModalityProfile {

    private final ModalityTag tag;
    private final List<TransformStep> steps;
    private final double nominalPsnr;
    private final double nominalSsim;

    public ModalityProfile(ModalityTag tag, List<TransformStep> steps, double nominalPsnr, double nominalSsim) {
        this.tag = tag;
        this.steps = List.copyOf(steps);
        this.nominalPsnr = nominalPsnr;
        this.nominalSsim = nominalSsim;
    }

    public ModalityTag getTag() {
        return tag;
    }

    public List<TransformStep> getSteps() {
        return steps;
    }

    public double getNominalPsnr() {
        return nominalPsnr;
    }

    public double getNominalSsim() {
        return nominalSsim;
    }

    /**
     * Sum of the declared contrast effect of every step. Declared, not measured.
     */
    public double getDeclaredContrastImprovement() {
        return roundDeclared(steps.stream().mapToDouble(TransformStep::contrastEffectPercent).sum());
    }

    /**
     * Sum of the declared sharpness effect of every step. Declared, not measured.
     */
    public double getDeclaredSharpnessImprovement() {
        return roundDeclared(steps.stream().mapToDouble(TransformStep::sharpnessEffectPercent).sum());
    }

    // (factor - 1) * 100 leaves binary noise, e.g. 39.99999999999999 for a 1.4 factor
    private static double roundDeclared(double percent) {
        return Math.round(percent * 1e6) / 1e6;
    }

    /**
     * True when the chain flips intensity polarity (odd number of inversions).
     */
    public boolean invertsPolarity() {
        long inversions = steps.stream().filter(InvertStep.class::isInstance).count();
        return inversions % 2 == 1;
    }

    /**
     * Metrics reported when nothing could be measured, e.g. no image was supplied.
     */
    public QualityMetrics nominalMetrics() {
        return new QualityMetrics(nominalPsnr, nominalSsim,
                getDeclaredContrastImprovement(), getDeclaredSharpnessImprovement());
    }

    /**
     * Metrics reported when the image could not be decoded and was passed through untouched.
     */
    public QualityMetrics passthroughMetrics() {
        return new QualityMetrics(nominalPsnr, nominalSsim, 0.0, 0.0);
    }

    @Override
    public String toString() {
        return "ModalityProfile{" + tag + ", steps=" + steps.stream().map(TransformStep::getName).collect(Collectors.toList()) + "}";
    }
}
