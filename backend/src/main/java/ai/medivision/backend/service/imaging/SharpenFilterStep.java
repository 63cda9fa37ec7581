package ai.medivision.backend.service.imaging;

/**
 * Fixed 3x3 sharpening convolution.
 */
public final class SharpenFilterStep implements TransformStep {

    private static final int[] KERNEL = {
            -2, -2, -2,
            -2, 32, -2,
            -2, -2, -2
    };
    private static final int DIVISOR = 16;

    @Override
    public String getName() {
        return "SharpenFilter()";
    }

    @Override
    public ImageBuffer apply(ImageBuffer image) {
        return PixelMath.convolve3x3(image, KERNEL, DIVISOR);
    }
}
