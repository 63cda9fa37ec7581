package ai.medivision.backend.service.imaging;

/**
 * Scales the distance of every sample from the mean luminance of the image.
 */
public final class ContrastStep implements TransformStep {

    private final double factor;

    public ContrastStep(double factor) {
        if (factor < 0) {
            throw new IllegalArgumentException("Contrast factor must not be negative: " + factor);
        }
        this.factor = factor;
    }

    public double getFactor() {
        return factor;
    }

    @Override
    public String getName() {
        return "Contrast(factor=" + factor + ")";
    }

    @Override
    public ImageBuffer apply(ImageBuffer image) {
        int mean = PixelMath.meanLuminance(image);
        int[] in = image.samples();
        int[] out = new int[in.length];
        for (int i = 0; i < in.length; i++) {
            out[i] = PixelMath.blend(mean, in[i], factor);
        }
        return ImageBuffer.wrap(image.getWidth(), image.getHeight(), image.getChannels(), out);
    }

    @Override
    public double contrastEffectPercent() {
        return (factor - 1.0) * 100.0;
    }
}
