package ai.medivision.backend.model.dto;

/**
 * Per-request switches of the enhancement pipeline.
 */
public class EnhancementOptions {

    /**
     * Whether a textual AI analysis should be attached to the result.
     */
    private boolean useAIAnalysis = true;

    /**
     * Whether providers are asked for a JSON report. An unparseable response then
     * counts as a provider failure.
     */
    private boolean structuredAnalysis;

    public EnhancementOptions() {
    }

    public EnhancementOptions(boolean useAIAnalysis, boolean structuredAnalysis) {
        this.useAIAnalysis = useAIAnalysis;
        this.structuredAnalysis = structuredAnalysis;
    }

    public static EnhancementOptions defaults() {
        return new EnhancementOptions();
    }

    public boolean isUseAIAnalysis() {
        return useAIAnalysis;
    }

    public void setUseAIAnalysis(boolean useAIAnalysis) {
        this.useAIAnalysis = useAIAnalysis;
    }

    public boolean isStructuredAnalysis() {
        return structuredAnalysis;
    }

    public void setStructuredAnalysis(boolean structuredAnalysis) {
        this.structuredAnalysis = structuredAnalysis;
    }
}
