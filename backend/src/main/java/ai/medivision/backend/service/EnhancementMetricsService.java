package ai.medivision.backend.service;

import ai.medivision.backend.model.ModalityTag;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Micrometer metrics of the enhancement pipeline.
 *
 * Meters:
 * - image_enhancement_requests_total{modality,outcome}
 * - image_enhancement_duration_seconds{modality}
 * - ai_analysis_provider_attempts_total{provider,outcome}
 * - ai_analysis_degraded_total
 */
@Slf4j
@Service
public class EnhancementMetricsService {

    static final String REQUESTS_TOTAL = "image_enhancement_requests_total";
    static final String DURATION = "image_enhancement_duration_seconds";
    static final String PROVIDER_ATTEMPTS_TOTAL = "ai_analysis_provider_attempts_total";
    static final String DEGRADED_TOTAL = "ai_analysis_degraded_total";

    private final MeterRegistry meterRegistry;

    // Cache for Timer instances to avoid repeated creation
    private final ConcurrentMap<String, Timer> timerCache = new ConcurrentHashMap<>();

    private final ConcurrentMap<String, Counter> counterCache = new ConcurrentHashMap<>();

    private final Counter degradedCounter;

    @Autowired
    public EnhancementMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.degradedCounter = Counter.builder(DEGRADED_TOTAL)
                .description("Analyses that fell back to the degraded-mode template")
                .register(meterRegistry);
        log.info("EnhancementMetricsService initialized with MeterRegistry");
    }

    /**
     * Counts one finished enhancement request.
     *
     * @param modality resolved modality
     * @param outcome  e.g. "enhanced", "passthrough", "analysis_only", "rejected"
     */
    public void recordRequest(ModalityTag modality, String outcome) {
        String modalityTag = tagOf(modality);
        String key = "request." + modalityTag + "." + outcome;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder(REQUESTS_TOTAL)
                        .description("Total image enhancement requests")
                        .tag("modality", modalityTag)
                        .tag("outcome", outcome)
                        .register(meterRegistry)
        ).increment();
        log.debug("Recorded enhancement request: modality={}, outcome={}", modalityTag, outcome);
    }

    /**
     * Records the wall-clock time of one enhancement request.
     */
    public void recordDuration(ModalityTag modality, Duration duration) {
        String modalityTag = tagOf(modality);
        timerCache.computeIfAbsent(modalityTag, k ->
                Timer.builder(DURATION)
                        .description("Image enhancement duration in seconds")
                        .tag("modality", modalityTag)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(meterRegistry)
        ).record(duration);
    }

    /**
     * Counts one provider attempt.
     *
     * @param provider provider name
     * @param outcome  "success" or the failure kind
     */
    public void recordProviderAttempt(String provider, String outcome) {
        String key = "provider." + provider + "." + outcome;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder(PROVIDER_ATTEMPTS_TOTAL)
                        .description("Total text analysis provider attempts")
                        .tag("provider", provider)
                        .tag("outcome", outcome)
                        .register(meterRegistry)
        ).increment();
        log.debug("Recorded provider attempt: provider={}, outcome={}", provider, outcome);
    }

    public void recordDegradedAnalysis() {
        degradedCounter.increment();
    }

    private static String tagOf(ModalityTag modality) {
        return (modality != null ? modality : ModalityTag.OTHER).name().toLowerCase(Locale.ROOT);
    }
}
