package ai.medivision.backend.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates a JSON report inside free-form provider output.
 *
 * Lookup order:
 * 1. the whole text as a JSON object or array
 * 2. the first fenced {@code ```json} block
 * 3. the first balanced, well-formed {@code {...}} or {@code [...]} span in the prose
 *
 * Parsing never throws; a response without JSON yields an unparsed result carrying the raw text.
 * {@link #parseReport(String)} applies the same lookup but only accepts a non-empty object.
 */
@Component
public class AnalysisResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisResponseParser.class);

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json|JSON)\\s*(.*?)```", Pattern.DOTALL);
    private static final Pattern QUALITY_SCORE = Pattern.compile("(\\d{1,3})\\s*/\\s*100");

    private final ObjectMapper objectMapper;

    public AnalysisResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the provider output, accepting any JSON object or array.
     *
     * @param rawText provider output, may be null
     * @return the tagged parse result
     */
    public ParsedAnalysis parse(String rawText) {
        return parse(rawText, JsonNode::isContainerNode);
    }

    /**
     * Parses output that was asked to be a single JSON report. Arrays, empty objects and
     * bracketed prose such as {@code [1]} or {@code - [ ]} do not count.
     *
     * @param rawText provider output, may be null
     * @return the tagged parse result
     */
    public ParsedAnalysis parseReport(String rawText) {
        return parse(rawText, node -> node.isObject() && node.size() > 0);
    }

    private ParsedAnalysis parse(String rawText, Predicate<JsonNode> accepted) {
        if (rawText == null || rawText.isBlank()) {
            return ParsedAnalysis.unparsed(rawText);
        }

        Optional<JsonNode> whole = readContainer(rawText.trim()).filter(accepted);
        if (whole.isPresent()) {
            return ParsedAnalysis.structured(whole.get(), rawText);
        }

        Matcher fenced = FENCED_JSON.matcher(rawText);
        while (fenced.find()) {
            Optional<JsonNode> block = readContainer(fenced.group(1).trim()).filter(accepted);
            if (block.isPresent()) {
                return ParsedAnalysis.structured(block.get(), rawText);
            }
        }

        Optional<JsonNode> embedded = findEmbedded(rawText, accepted);
        if (embedded.isPresent()) {
            return ParsedAnalysis.structured(embedded.get(), rawText);
        }

        logger.debug("No JSON found in provider output of {} characters", rawText.length());
        return ParsedAnalysis.unparsed(rawText);
    }

    /**
     * Extracts the image quality score: {@code quality_score} of the structured report,
     * else the first {@code NN/100} in the text.
     *
     * @return score in 0..100, or null when none is quoted
     */
    public Integer extractQualityScore(ParsedAnalysis parsed) {
        Optional<JsonNode> structured = parsed.getStructured();
        if (structured.isPresent()) {
            JsonNode score = structured.get().path("quality_score");
            if (score.canConvertToInt() && score.isNumber() && inRange(score.asInt())) {
                return score.asInt();
            }
        }
        if (parsed.getRawText() == null) {
            return null;
        }
        Matcher matcher = QUALITY_SCORE.matcher(parsed.getRawText());
        while (matcher.find()) {
            int value = Integer.parseInt(matcher.group(1));
            if (inRange(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean inRange(int score) {
        return score >= 0 && score <= 100;
    }

    private Optional<JsonNode> findEmbedded(String text, Predicate<JsonNode> accepted) {
        for (int start = 0; start < text.length(); start++) {
            char c = text.charAt(start);
            if (c != '{' && c != '[') {
                continue;
            }
            int end = matchingClose(text, start);
            if (end < 0) {
                continue;
            }
            Optional<JsonNode> node = readContainer(text.substring(start, end + 1)).filter(accepted);
            if (node.isPresent()) {
                return node;
            }
        }
        return Optional.empty();
    }

    /**
     * Index of the bracket closing the one at {@code start}, ignoring brackets inside
     * string literals; -1 when unbalanced.
     */
    static int matchingClose(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"':
                    inString = true;
                    break;
                case '{':
                case '[':
                    depth++;
                    break;
                case '}':
                case ']':
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                    if (depth < 0) {
                        return -1;
                    }
                    break;
                default:
                    break;
            }
        }
        return -1;
    }

    private Optional<JsonNode> readContainer(String candidate) {
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        char first = candidate.charAt(0);
        if (first != '{' && first != '[') {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isContainerNode() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
