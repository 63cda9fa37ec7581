package ai.medivision.backend.service.exception;

/**
 * Raw bytes could not be interpreted as a supported image encoding.
 */
public class ImageDecodeException extends ImageProcessingException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
