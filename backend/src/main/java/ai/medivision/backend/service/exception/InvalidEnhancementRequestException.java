package ai.medivision.backend.service.exception;

/**
 * The request gives the pipeline nothing to do. This is the only failure surfaced to
 * the caller; every other problem degrades the result instead.
 */
public class InvalidEnhancementRequestException extends RuntimeException {

    public InvalidEnhancementRequestException(String message) {
        super(message);
    }
}
