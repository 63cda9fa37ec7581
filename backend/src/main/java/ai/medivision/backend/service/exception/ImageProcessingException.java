package ai.medivision.backend.service.exception;

/**
 * Raised when an image cannot be read, transformed or written.
 * Recovered by the pipeline, which passes the original bytes through.
 */
public class ImageProcessingException extends RuntimeException {

    public ImageProcessingException(String message) {
        super(message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
