package ai.medivision.backend.util;

import ai.medivision.backend.model.dto.QualityMetrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Converts {@link QualityMetrics} to and from the JSON stored with an enhanced image,
 * e.g. {@code {"psnr":35.2,"ssim":0.92,"contrast_improvement":50.0,"sharpness_improvement":100.0}}.
 */
@Component
public class MetricsSerializer {

    private final ObjectMapper objectMapper;

    public MetricsSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String serialize(QualityMetrics metrics) {
        try {
            return objectMapper.writeValueAsString(metrics);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize quality metrics", e);
        }
    }

    public QualityMetrics deserialize(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Metrics JSON must not be empty");
        }
        try {
            return objectMapper.readValue(json, QualityMetrics.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed metrics JSON: " + e.getOriginalMessage(), e);
        }
    }
}
