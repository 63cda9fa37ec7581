package ai.medivision.backend.service.imaging;

/**
 * Photographic negative, used to show X-ray bone structures bright.
 */
public final class InvertStep implements TransformStep {

    @Override
    public String getName() {
        return "Invert()";
    }

    @Override
    public ImageBuffer apply(ImageBuffer image) {
        return image.inverted();
    }
}
