package ai.medivision.backend.service.imaging;

import java.util.Arrays;

/**
 * Decoded, rectangular 8-bit pixel buffer with one (gray) or three (RGB) channels.
 *
 * Samples are interleaved in row-major order. Instances are immutable: every
 * transformation produces a new buffer, so a buffer never outlives the request that
 * created it in a shared, mutable form.
 */
public final class ImageBuffer {

    public static final int MAX_SAMPLE = 255;

    private final int width;
    private final int height;
    private final int channels;
    private final int[] samples;

    public ImageBuffer(int width, int height, int channels, int[] samples) {
        this(width, height, channels, samples, true);
    }

    private ImageBuffer(int width, int height, int channels, int[] samples, boolean copy) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (channels != 1 && channels != 3) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        if (samples.length != width * height * channels) {
            throw new IllegalArgumentException("Sample count " + samples.length
                    + " does not match " + width + "x" + height + "x" + channels);
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.samples = copy ? samples.clone() : samples;
    }

    /**
     * Wraps an array the caller hands over and no longer touches.
     */
    static ImageBuffer wrap(int width, int height, int channels, int[] samples) {
        return new ImageBuffer(width, height, channels, samples, false);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    public boolean isColor() {
        return channels == 3;
    }

    public int getSample(int x, int y, int channel) {
        return samples[(y * width + x) * channels + channel];
    }

    /**
     * Sample at a position with coordinates clamped to the image edges.
     */
    public int getClampedSample(int x, int y, int channel) {
        int cx = Math.min(Math.max(x, 0), width - 1);
        int cy = Math.min(Math.max(y, 0), height - 1);
        return getSample(cx, cy, channel);
    }

    /**
     * ITU-R 601-2 luma of a pixel; the sample itself for gray buffers.
     */
    public int getLuminance(int x, int y) {
        if (channels == 1) {
            return getSample(x, y, 0);
        }
        int base = (y * width + x) * 3;
        return (samples[base] * 299 + samples[base + 1] * 587 + samples[base + 2] * 114 + 500) / 1000;
    }

    public int[] copySamples() {
        return samples.clone();
    }

    int[] samples() {
        return samples;
    }

    /**
     * Same pixels as a three-channel buffer; returns this instance when already RGB.
     */
    public ImageBuffer toRgb() {
        if (channels == 3) {
            return this;
        }
        int[] rgb = new int[width * height * 3];
        for (int i = 0; i < width * height; i++) {
            rgb[i * 3] = samples[i];
            rgb[i * 3 + 1] = samples[i];
            rgb[i * 3 + 2] = samples[i];
        }
        return wrap(width, height, 3, rgb);
    }

    public ImageBuffer inverted() {
        int[] out = new int[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = MAX_SAMPLE - samples[i];
        }
        return wrap(width, height, channels, out);
    }

    /**
     * Nearest-neighbour resample to the given size.
     */
    public ImageBuffer resized(int targetWidth, int targetHeight) {
        if (targetWidth == width && targetHeight == height) {
            return this;
        }
        int[] out = new int[targetWidth * targetHeight * channels];
        for (int y = 0; y < targetHeight; y++) {
            int sy = (int) ((long) y * height / targetHeight);
            for (int x = 0; x < targetWidth; x++) {
                int sx = (int) ((long) x * width / targetWidth);
                for (int c = 0; c < channels; c++) {
                    out[(y * targetWidth + x) * channels + c] = getSample(sx, sy, c);
                }
            }
        }
        return wrap(targetWidth, targetHeight, channels, out);
    }

    public boolean sameShape(ImageBuffer other) {
        return width == other.width && height == other.height && channels == other.channels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImageBuffer)) {
            return false;
        }
        ImageBuffer that = (ImageBuffer) o;
        return sameShape(that) && Arrays.equals(samples, that.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * width + height) + channels) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "ImageBuffer{" + width + "x" + height + "x" + channels + "}";
    }
}
