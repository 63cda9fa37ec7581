package ai.medivision.backend.service.ai;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Outcome of parsing one provider response. A failed parse keeps the raw text.
 */
public final class ParsedAnalysis {

    private final boolean succeeded;
    private final JsonNode structured;
    private final String rawText;

    private ParsedAnalysis(boolean succeeded, JsonNode structured, String rawText) {
        this.succeeded = succeeded;
        this.structured = structured;
        this.rawText = rawText;
    }

    public static ParsedAnalysis structured(JsonNode structured, String rawText) {
        return new ParsedAnalysis(true, structured, rawText);
    }

    public static ParsedAnalysis unparsed(String rawText) {
        return new ParsedAnalysis(false, null, rawText);
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    public Optional<JsonNode> getStructured() {
        return Optional.ofNullable(structured);
    }

    public String getRawText() {
        return rawText;
    }
}
