package ai.medivision.backend.service.imaging;

/**
 * Replaces every RGB pixel by its luminance on all three channels. Gray buffers have
 * no colour to remove and pass through unchanged.
 */
public final class GrayscaleStep implements TransformStep {

    @Override
    public String getName() {
        return "Grayscale()";
    }

    @Override
    public ImageBuffer apply(ImageBuffer image) {
        if (!image.isColor()) {
            return image;
        }
        int width = image.getWidth();
        int height = image.getHeight();
        int[] out = new int[width * height * 3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int luminance = image.getLuminance(x, y);
                int base = (y * width + x) * 3;
                out[base] = luminance;
                out[base + 1] = luminance;
                out[base + 2] = luminance;
            }
        }
        return ImageBuffer.wrap(width, height, 3, out);
    }
}
