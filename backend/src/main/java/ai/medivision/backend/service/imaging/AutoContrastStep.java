package ai.medivision.backend.service.imaging;

/**
 * Per-channel histogram stretch. The given percentage of pixels is cut from each end of
 * the histogram and the remaining range is mapped linearly onto 0..255.
 */
public final class AutoContrastStep implements TransformStep {

    private final double cutoffPercent;

    public AutoContrastStep(double cutoffPercent) {
        if (cutoffPercent < 0 || cutoffPercent >= 50) {
            throw new IllegalArgumentException("Cutoff must be within [0, 50): " + cutoffPercent);
        }
        this.cutoffPercent = cutoffPercent;
    }

    public double getCutoffPercent() {
        return cutoffPercent;
    }

    @Override
    public String getName() {
        return "AutoContrast(cutoffPercent=" + cutoffPercent + ")";
    }

    @Override
    public ImageBuffer apply(ImageBuffer image) {
        int channels = image.getChannels();
        int[] in = image.samples();
        int[] out = new int[in.length];
        int pixelCount = image.getWidth() * image.getHeight();
        for (int c = 0; c < channels; c++) {
            int[] histogram = new int[256];
            for (int i = c; i < in.length; i += channels) {
                histogram[in[i]]++;
            }
            int[] lut = buildLut(histogram, pixelCount);
            for (int i = c; i < in.length; i += channels) {
                out[i] = lut[in[i]];
            }
        }
        return ImageBuffer.wrap(image.getWidth(), image.getHeight(), channels, out);
    }

    private int[] buildLut(int[] histogram, int pixelCount) {
        int cut = (int) Math.floor(pixelCount * cutoffPercent / 100.0);

        int remaining = cut;
        for (int lo = 0; lo < 256 && remaining > 0; lo++) {
            int taken = Math.min(remaining, histogram[lo]);
            histogram[lo] -= taken;
            remaining -= taken;
        }
        remaining = cut;
        for (int hi = 255; hi >= 0 && remaining > 0; hi--) {
            int taken = Math.min(remaining, histogram[hi]);
            histogram[hi] -= taken;
            remaining -= taken;
        }

        int lo = 0;
        while (lo < 256 && histogram[lo] == 0) {
            lo++;
        }
        int hi = 255;
        while (hi >= 0 && histogram[hi] == 0) {
            hi--;
        }

        int[] lut = new int[256];
        if (hi <= lo) {
            for (int i = 0; i < 256; i++) {
                lut[i] = i;
            }
            return lut;
        }
        double scale = 255.0 / (hi - lo);
        double offset = -lo * scale;
        for (int i = 0; i < 256; i++) {
            int mapped = (int) (i * scale + offset);
            lut[i] = Math.min(Math.max(mapped, 0), 255);
        }
        return lut;
    }
}
