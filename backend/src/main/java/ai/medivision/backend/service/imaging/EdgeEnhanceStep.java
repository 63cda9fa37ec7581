package ai.medivision.backend.service.imaging;

/**
 * Laplacian edge enhancement, in a normal and a strong variant.
 */
public final class EdgeEnhanceStep implements TransformStep {

    private static final int[] NORMAL_KERNEL = {
            -1, -1, -1,
            -1, 10, -1,
            -1, -1, -1
    };
    private static final int[] STRONG_KERNEL = {
            -1, -1, -1,
            -1, 9, -1,
            -1, -1, -1
    };

    private final boolean strong;

    public EdgeEnhanceStep(boolean strong) {
        this.strong = strong;
    }

    public boolean isStrong() {
        return strong;
    }

    @Override
    public String getName() {
        return strong ? "EdgeEnhance(strong)" : "EdgeEnhance()";
    }

    @Override
    public ImageBuffer apply(ImageBuffer image) {
        return strong
                ? PixelMath.convolve3x3(image, STRONG_KERNEL, 1)
                : PixelMath.convolve3x3(image, NORMAL_KERNEL, 2);
    }

    @Override
    public double sharpnessEffectPercent() {
        return strong ? 60.0 : 30.0;
    }
}
