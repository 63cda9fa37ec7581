package ai.medivision.backend.service;

import ai.medivision.backend.model.dto.EnhancementRequest;
import ai.medivision.backend.model.dto.EnhancementResult;

import java.util.concurrent.CompletableFuture;

/**
 * Interface for the modality-aware image enhancement pipeline.
 */
public interface ImageEnhancementService {

    /**
     * Enhances an image, measures the result and attaches a textual analysis.
     *
     * Image and provider failures degrade the result instead of failing the request.
     *
     * @param request the enhancement request
     * @return the enhancement result
     * @throws ai.medivision.backend.service.exception.InvalidEnhancementRequestException if the request is malformed
     */
    EnhancementResult enhance(EnhancementRequest request);

    /**
     * Dispatches {@link #enhance(EnhancementRequest)} on the enhancement worker pool.
     *
     * @param request the enhancement request
     * @return a future completing with the result, or exceptionally for a malformed request
     */
    CompletableFuture<EnhancementResult> enhanceAsync(EnhancementRequest request);
}
