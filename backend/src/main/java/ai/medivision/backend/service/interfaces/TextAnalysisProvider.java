package ai.medivision.backend.service.interfaces;

import ai.medivision.backend.service.ai.AnalysisPrompt;
import ai.medivision.backend.service.exception.ProviderException;

import java.util.Optional;

/**
 * Interface for external generative text backends used for image analysis reports.
 *
 * Implementations are tried in priority order by the provider chain until one
 * produces usable text.
 */
public interface TextAnalysisProvider {

    /**
     * Gets the provider name recorded on the analysis it produces.
     *
     * @return provider name
     */
    String getName();

    /**
     * Gets the provider priority, lower numbers are tried first.
     *
     * @return provider priority
     */
    int getPriority();

    /**
     * Checks whether the provider is configured and should be tried at all.
     *
     * @return true if the provider is enabled
     */
    boolean isEnabled();

    /**
     * Generates analysis text for the prompt.
     *
     * @param prompt system and user prompt of the request
     * @return generated text, empty if the backend answered without any text
     * @throws ProviderException if the backend call failed
     */
    Optional<String> generate(AnalysisPrompt prompt);
}
