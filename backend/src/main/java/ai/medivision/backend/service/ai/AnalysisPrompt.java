package ai.medivision.backend.service.ai;

import ai.medivision.backend.model.ModalityTag;

/**
 * Immutable prompt sent to a text analysis provider.
 */
public final class AnalysisPrompt {

    private final ModalityTag modality;
    private final String systemPrompt;
    private final String userPrompt;
    private final boolean structuredOutputExpected;

    public AnalysisPrompt(ModalityTag modality, String systemPrompt, String userPrompt,
                          boolean structuredOutputExpected) {
        this.modality = modality;
        this.systemPrompt = systemPrompt;
        this.userPrompt = userPrompt;
        this.structuredOutputExpected = structuredOutputExpected;
    }

    public ModalityTag getModality() {
        return modality;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public String getUserPrompt() {
        return userPrompt;
    }

    /**
     * Whether the response must contain a JSON report to count as a success.
     */
    public boolean isStructuredOutputExpected() {
        return structuredOutputExpected;
    }

    /**
     * System and user prompt joined, for backends without a separate system role.
     */
    public String asSingleText() {
        return systemPrompt + "\n\n" + userPrompt;
    }
}
