package ai.medivision.backend.service.imaging;

import java.util.Arrays;

/**
 * Median denoising over a square window; edge pixels are replicated.
 */
public final class MedianFilterStep implements TransformStep {

    private final int size;

    public MedianFilterStep(int size) {
        if (size < 1 || size % 2 == 0) {
            throw new IllegalArgumentException("Median window size must be a positive odd number: " + size);
        }
        this.size = size;
    }

    public int getSize() {
        return size;
    }

    @Override
    public String getName() {
        return "MedianFilter(size=" + size + ")";
    }

    @Override
    public ImageBuffer apply(ImageBuffer image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int channels = image.getChannels();
        int radius = size / 2;
        int[] window = new int[size * size];
        int[] out = new int[width * height * channels];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < channels; c++) {
                    int n = 0;
                    for (int dy = -radius; dy <= radius; dy++) {
                        for (int dx = -radius; dx <= radius; dx++) {
                            window[n++] = image.getClampedSample(x + dx, y + dy, c);
                        }
                    }
                    Arrays.sort(window);
                    out[(y * width + x) * channels + c] = window[window.length / 2];
                }
            }
        }
        return ImageBuffer.wrap(width, height, channels, out);
    }
}
