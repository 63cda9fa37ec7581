package ai.medivision.backend.service.exception;

import java.util.Locale;

/**
 * Failure of a single text analysis provider. Never reaches the pipeline caller:
 * the provider chain advances to the next provider instead.
 */
public class ProviderException extends RuntimeException {

    /**
     * Failure kinds, used for logging and metric tags.
     */
    public enum Kind {
        TIMEOUT,
        ERROR,
        EMPTY_RESPONSE,
        UNPARSEABLE;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final String providerName;
    private final Kind kind;

    public ProviderException(String providerName, Kind kind, String message) {
        super(message);
        this.providerName = providerName;
        this.kind = kind;
    }

    public ProviderException(String providerName, Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
        this.kind = kind;
    }

    public String getProviderName() {
        return providerName;
    }

    public Kind getKind() {
        return kind;
    }
}
