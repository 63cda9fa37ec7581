package ai.medivision.backend.health;

import ai.medivision.backend.service.ai.AnalysisProviderChain;
import ai.medivision.backend.service.interfaces.TextAnalysisProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Custom health indicator for the text analysis providers.
 *
 * This health indicator:
 * - Reports UP when the primary provider is enabled
 * - Reports DEGRADED when only backup providers are enabled
 * - Reports DOWN when no provider is enabled; analyses then use the degraded-mode template
 *
 * Image enhancement itself does not depend on any provider, so DOWN here never blocks requests.
 */
@Component
public class AnalysisProviderHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisProviderHealthIndicator.class);

    private final AnalysisProviderChain providerChain;

    public AnalysisProviderHealthIndicator(AnalysisProviderChain providerChain) {
        this.providerChain = providerChain;
    }

    @Override
    public Health health() {
        Health.Builder healthBuilder = new Health.Builder();
        List<TextAnalysisProvider> providers = providerChain.getProviders();

        Map<String, Object> providerStates = new LinkedHashMap<>();
        String activeProvider = null;
        for (TextAnalysisProvider provider : providers) {
            boolean enabled = provider.isEnabled();
            providerStates.put(provider.getName(), enabled ? "enabled" : "disabled");
            if (enabled && activeProvider == null) {
                activeProvider = provider.getName();
            }
        }

        if (activeProvider == null) {
            logger.debug("No analysis provider enabled, analyses will use the degraded-mode template");
            healthBuilder.down()
                .withDetail("status", "No analysis provider available")
                .withDetail("fallback_strategy", "Degraded-mode analysis template");
        } else if (activeProvider.equals(providers.get(0).getName())) {
            healthBuilder.up()
                .withDetail("status", "Primary provider available");
        } else {
            healthBuilder.status("DEGRADED")
                .withDetail("status", "Primary provider unavailable, using backup");
        }

        return healthBuilder
            .withDetail("service", "AI Analysis Providers")
            .withDetail("active_provider", activeProvider != null ? activeProvider : "none")
            .withDetail("providers", providerStates)
            .withDetail("last_check", Instant.now().toString())
            .build();
    }
}
