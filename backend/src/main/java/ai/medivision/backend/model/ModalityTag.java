package ai.medivision.backend.model;

import java.util.Locale;
import java.util.Map;

/**
 * Closed set of imaging modalities the enhancement pipeline knows how to tune for.
 *
 * Free-form modality strings are normalized case-insensitively (separators ignored);
 * anything unrecognized maps to {@link #OTHER} and uses the generic chain.
 */
public enum ModalityTag {

    XRAY("X-RAY"),
    CT("CT"),
    MRI("MRI"),
    ULTRASOUND("ULTRASOUND"),
    DXA("DXA"),
    OTHER("OTHER");

    // Keys are upper-case with every non-alphanumeric character removed
    private static final Map<String, ModalityTag> ALIASES = Map.of(
            "XRAY", XRAY,
            "CT", CT,
            "CTSCAN", CT,
            "MRI", MRI,
            "ULTRASOUND", ULTRASOUND,
            "DXA", DXA
    );

    private final String displayName;

    ModalityTag(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Normalizes a free-form modality string.
     *
     * @param value modality as delivered by the caller, may be null
     * @return the matching tag, or {@link #OTHER} when missing or unrecognized
     */
    public static ModalityTag fromString(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String key = value.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
        return ALIASES.getOrDefault(key, OTHER);
    }
}
