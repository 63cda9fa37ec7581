package ai.medivision.backend.service.imaging;

/**
 * Multiplies every sample by a constant factor.
 */
public final class BrightnessStep implements TransformStep {

    private final double factor;

    public BrightnessStep(double factor) {
        if (factor < 0) {
            throw new IllegalArgumentException("Brightness factor must not be negative: " + factor);
        }
        this.factor = factor;
    }

    public double getFactor() {
        return factor;
    }

    @Override
    public String getName() {
        return "BrightnessAdjust(factor=" + factor + ")";
    }

    @Override
    public ImageBuffer apply(ImageBuffer image) {
        int[] in = image.samples();
        int[] out = new int[in.length];
        for (int i = 0; i < in.length; i++) {
            out[i] = PixelMath.blend(0, in[i], factor);
        }
        return ImageBuffer.wrap(image.getWidth(), image.getHeight(), image.getChannels(), out);
    }
}
