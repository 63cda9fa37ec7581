package ai.medivision.backend.service.imaging;

/**
 * Shared arithmetic of the transform steps. Results are rounded half-up and clamped to
 * the 8-bit range so every step is bit-for-bit reproducible.
 */
final class PixelMath {

    private PixelMath() {
    }

    static int clamp(double value) {
        int rounded = (int) Math.floor(value + 0.5);
        return Math.min(Math.max(rounded, 0), ImageBuffer.MAX_SAMPLE);
    }

    /**
     * {@code degenerate + factor * (value - degenerate)}: factor 1 keeps the value,
     * factor 0 yields the degenerate image.
     */
    static int blend(int degenerate, int value, double factor) {
        return clamp(degenerate + factor * (value - degenerate));
    }

    /**
     * Rounded mean luminance of the whole image.
     */
    static int meanLuminance(ImageBuffer image) {
        long sum = 0;
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                sum += image.getLuminance(x, y);
            }
        }
        double mean = (double) sum / ((long) image.getWidth() * image.getHeight());
        return (int) (mean + 0.5);
    }

    /**
     * Applies a 3x3 kernel to every channel. Border pixels are copied unchanged.
     *
     * @param kernel  nine weights in row-major order
     * @param divisor value the weighted sum is divided by
     */
    static ImageBuffer convolve3x3(ImageBuffer image, int[] kernel, int divisor) {
        int width = image.getWidth();
        int height = image.getHeight();
        int channels = image.getChannels();
        int[] out = image.copySamples();
        if (width < 3 || height < 3) {
            return ImageBuffer.wrap(width, height, channels, out);
        }
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                for (int c = 0; c < channels; c++) {
                    int sum = 0;
                    int k = 0;
                    for (int dy = -1; dy <= 1; dy++) {
                        for (int dx = -1; dx <= 1; dx++) {
                            sum += kernel[k++] * image.getSample(x + dx, y + dy, c);
                        }
                    }
                    out[(y * width + x) * channels + c] = clamp((double) sum / divisor);
                }
            }
        }
        return ImageBuffer.wrap(width, height, channels, out);
    }
}
