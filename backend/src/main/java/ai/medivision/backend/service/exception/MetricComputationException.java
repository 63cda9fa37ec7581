package ai.medivision.backend.service.exception;

/**
 * Quality metrics could not be computed for the given buffers (too small, degenerate,
 * or non-finite result). Recovered by substituting the modality's nominal metrics.
 */
public class MetricComputationException extends RuntimeException {

    public MetricComputationException(String message) {
        super(message);
    }
}
