package ai.medivision.backend.model.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Textual analysis attached to an enhancement result.
 *
 * At most one analysis is attached per result: the first provider that succeeded, or a
 * synthesized degraded-mode analysis with {@code succeeded == false}.
 */
public final class AiAnalysis {

    private final String providerName;
    private final String rawText;
    private final JsonNode structured;
    private final boolean succeeded;
    private final Integer qualityScore;

    private AiAnalysis(String providerName, String rawText, JsonNode structured,
                       boolean succeeded, Integer qualityScore) {
        this.providerName = providerName;
        this.rawText = rawText;
        this.structured = structured != null ? structured.deepCopy() : null;
        this.succeeded = succeeded;
        this.qualityScore = qualityScore;
    }

    public static AiAnalysis success(String providerName, String rawText, JsonNode structured, Integer qualityScore) {
        return new AiAnalysis(providerName, rawText, structured, true, qualityScore);
    }

    public static AiAnalysis degraded(String providerName, String rawText, Integer qualityScore) {
        return new AiAnalysis(providerName, rawText, null, false, qualityScore);
    }

    public String getProviderName() {
        return providerName;
    }

    public String getRawText() {
        return rawText;
    }

    /**
     * Structured data found in the provider output, if any. Returns a copy.
     */
    public Optional<JsonNode> getStructured() {
        if (structured == null) {
            return Optional.empty();
        }
        JsonNode copy = structured.deepCopy();
        return Optional.of(copy);
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    /**
     * Image quality score (0-100) quoted in the analysis text, if any.
     */
    public Optional<Integer> getQualityScore() {
        return Optional.ofNullable(qualityScore);
    }

    @Override
    public String toString() {
        return "AiAnalysis{provider=" + providerName + ", succeeded=" + succeeded
                + ", structured=" + (structured != null) + ", qualityScore=" + qualityScore + "}";
    }
}
