package ai.medivision.backend.service.imaging;

/**
 * Moves every sample away from a smoothed copy of the image; factor 1 is the identity,
 * factor 2 doubles the local detail.
 */
public final class SharpnessStep implements TransformStep {

    private static final int[] SMOOTH_KERNEL = {
            1, 1, 1,
            1, 5, 1,
            1, 1, 1
    };
    private static final int SMOOTH_DIVISOR = 13;

    private final double factor;

    public SharpnessStep(double factor) {
        if (factor < 0) {
            throw new IllegalArgumentException("Sharpness factor must not be negative: " + factor);
        }
        this.factor = factor;
    }

    public double getFactor() {
        return factor;
    }

    @Override
    public String getName() {
        return "Sharpness(factor=" + factor + ")";
    }

    @Override
    public ImageBuffer apply(ImageBuffer image) {
        int[] smooth = PixelMath.convolve3x3(image, SMOOTH_KERNEL, SMOOTH_DIVISOR).samples();
        int[] in = image.samples();
        int[] out = new int[in.length];
        for (int i = 0; i < in.length; i++) {
            out[i] = PixelMath.blend(smooth[i], in[i], factor);
        }
        return ImageBuffer.wrap(image.getWidth(), image.getHeight(), image.getChannels(), out);
    }

    @Override
    public double sharpnessEffectPercent() {
        return (factor - 1.0) * 100.0;
    }
}
