package ai.medivision.backend.service.imaging;

/**
 * One deterministic, side-effect-free image operation of an enhancement chain.
 *
 * Steps also declare the contrast and sharpness effect they are nominally responsible
 * for, in percent. Those declared effects are what the pipeline reports as improvement
 * figures; they are not measured on the output.
 */
public interface TransformStep {

    /**
     * Human-readable name including parameters, e.g. {@code Contrast(factor=1.5)}.
     */
    String getName();

    /**
     * Applies the operation.
     *
     * @param image input buffer, never modified
     * @return a new buffer with the same dimensions
     */
    ImageBuffer apply(ImageBuffer image);

    default double contrastEffectPercent() {
        return 0.0;
    }

    default double sharpnessEffectPercent() {
        return 0.0;
    }
}
