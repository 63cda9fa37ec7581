package ai.medivision.backend.service;

import ai.medivision.backend.service.imaging.ImageBuffer;
import ai.medivision.backend.service.imaging.TransformStep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Applies a transform chain strictly in order, each step's output feeding the next.
 *
 * Order is significant (denoise before sharpen, otherwise noise is amplified), so the
 * executor never reorders or parallelizes steps.
 */
@Service
public class TransformChainExecutor {

    private static final Logger logger = LoggerFactory.getLogger(TransformChainExecutor.class);

    /**
     * Runs the chain on the image.
     *
     * @param image the decoded input buffer, left untouched
     * @param chain ordered steps; an empty chain returns the input
     * @return the enhanced buffer
     */
    public ImageBuffer apply(ImageBuffer image, List<TransformStep> chain) {
        if (image == null) {
            throw new IllegalArgumentException("Image buffer must not be null");
        }
        if (chain == null || chain.isEmpty()) {
            return image;
        }

        ImageBuffer current = image;
        for (TransformStep step : chain) {
            long start = System.nanoTime();
            current = step.apply(current);
            if (logger.isDebugEnabled()) {
                logger.debug("Applied {} to {} in {} us", step.getName(), current,
                        (System.nanoTime() - start) / 1000);
            }
        }
        return current;
    }
}
