package ai.medivision.backend.service.ai;

import ai.medivision.backend.model.dto.AiAnalysis;
import ai.medivision.backend.service.EnhancementMetricsService;
import ai.medivision.backend.service.exception.ProviderException;
import ai.medivision.backend.service.interfaces.TextAnalysisProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Multi-provider text analysis with automatic fallback.
 *
 * Providers are tried in priority order (lower number first). Each call runs on the
 * provider executor and is bounded by the configured timeout. A timeout, an exception,
 * a blank response or, when a structured report was requested, a response without JSON
 * advances to the next provider. When every provider fails the chain synthesizes a
 * degraded-mode analysis; it never throws.
 */
@Service
public class AnalysisProviderChain {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisProviderChain.class);

    static final String FALLBACK_PROVIDER = "fallback";

    private static final String DEGRADED_TEMPLATE = "AI Enhancement Analysis for %s:\n\n"
            + "Image Quality: 85/100\n"
            + "Recommendations: Standard medical image enhancement applied with optimized contrast "
            + "and sharpness for diagnostic clarity.\n\n"
            + "Note: AI analysis providers were unavailable; this is a standard degraded-mode report.";

    private final List<TextAnalysisProvider> providers;
    private final AnalysisResponseParser responseParser;
    private final ExecutorService providerExecutor;
    private final long providerTimeoutMs;
    private final EnhancementMetricsService metricsService;

    @Autowired
    public AnalysisProviderChain(
            List<TextAnalysisProvider> providers,
            AnalysisResponseParser responseParser,
            @Qualifier("providerCallExecutor") ExecutorService providerExecutor,
            @Value("${ai.analysis.provider-timeout-ms:30000}") long providerTimeoutMs,
            EnhancementMetricsService metricsService) {
        List<TextAnalysisProvider> sorted = new ArrayList<>(providers != null ? providers : List.of());
        sorted.sort(Comparator.comparingInt(TextAnalysisProvider::getPriority));
        this.providers = Collections.unmodifiableList(sorted);
        this.responseParser = responseParser;
        this.providerExecutor = providerExecutor;
        this.providerTimeoutMs = providerTimeoutMs;
        this.metricsService = metricsService;

        logger.info("Analysis provider chain initialized with {} providers, timeout {} ms",
                this.providers.size(), providerTimeoutMs);
        for (TextAnalysisProvider provider : this.providers) {
            logger.info("  {} (priority: {}, enabled: {})",
                    provider.getName(), provider.getPriority(), provider.isEnabled());
        }
    }

    /**
     * Providers in the order they are tried.
     */
    public List<TextAnalysisProvider> getProviders() {
        return providers;
    }

    /**
     * Produces an analysis for the prompt: the first provider that succeeds, or the
     * degraded-mode analysis.
     *
     * @param prompt the analysis prompt
     * @return the analysis, never null
     */
    public AiAnalysis analyze(AnalysisPrompt prompt) {
        for (TextAnalysisProvider provider : providers) {
            if (Thread.currentThread().isInterrupted()) {
                logger.warn("Analysis interrupted before provider {}", provider.getName());
                return degraded(prompt);
            }
            if (!provider.isEnabled()) {
                logger.debug("Skipping disabled provider {}", provider.getName());
                continue;
            }

            try {
                AiAnalysis analysis = attempt(provider, prompt);
                metricsService.recordProviderAttempt(provider.getName(), "success");
                if (provider != providers.get(0)) {
                    logger.info("Fallback provider {} produced the analysis", provider.getName());
                }
                return analysis;
            } catch (ProviderException e) {
                metricsService.recordProviderAttempt(provider.getName(), e.getKind().tag());
                logger.warn("Provider {} failed ({}): {}", provider.getName(), e.getKind().tag(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Analysis interrupted while waiting for provider {}", provider.getName());
                return degraded(prompt);
            }
        }

        logger.warn("All analysis providers failed for {}, using degraded-mode analysis",
                prompt.getModality().getDisplayName());
        return degraded(prompt);
    }

    private AiAnalysis attempt(TextAnalysisProvider provider, AnalysisPrompt prompt) throws InterruptedException {
        String name = provider.getName();
        Optional<String> text = call(provider, prompt);

        if (text.isEmpty() || text.get().isBlank()) {
            throw new ProviderException(name, ProviderException.Kind.EMPTY_RESPONSE, "Provider returned no text");
        }

        ParsedAnalysis parsed = prompt.isStructuredOutputExpected()
                ? responseParser.parseReport(text.get())
                : responseParser.parse(text.get());
        if (prompt.isStructuredOutputExpected() && !parsed.isSucceeded()) {
            throw new ProviderException(name, ProviderException.Kind.UNPARSEABLE,
                    "No JSON report found in provider output");
        }

        Integer qualityScore = responseParser.extractQualityScore(parsed);
        return AiAnalysis.success(name, parsed.getRawText(), parsed.getStructured().orElse(null), qualityScore);
    }

    private Optional<String> call(TextAnalysisProvider provider, AnalysisPrompt prompt) throws InterruptedException {
        String name = provider.getName();
        Future<Optional<String>> future;
        try {
            future = providerExecutor.submit(() -> provider.generate(prompt));
        } catch (RejectedExecutionException e) {
            throw new ProviderException(name, ProviderException.Kind.ERROR, "Provider call rejected", e);
        }

        try {
            Optional<String> result = future.get(providerTimeoutMs, TimeUnit.MILLISECONDS);
            return result != null ? result : Optional.empty();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderException(name, ProviderException.Kind.TIMEOUT,
                    "No response within " + providerTimeoutMs + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException) {
                throw (ProviderException) cause;
            }
            throw new ProviderException(name, ProviderException.Kind.ERROR,
                    cause != null ? cause.getMessage() : e.getMessage(), cause != null ? cause : e);
        }
    }

    private AiAnalysis degraded(AnalysisPrompt prompt) {
        metricsService.recordDegradedAnalysis();
        String text = String.format(DEGRADED_TEMPLATE, prompt.getModality().getDisplayName());
        Integer qualityScore = responseParser.extractQualityScore(ParsedAnalysis.unparsed(text));
        return AiAnalysis.degraded(FALLBACK_PROVIDER, text, qualityScore);
    }
}
