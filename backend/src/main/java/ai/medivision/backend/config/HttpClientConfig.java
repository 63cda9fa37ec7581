package ai.medivision.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Configuration class for HTTP client beans.
 *
 * Provides the RestTemplate used by HTTP analysis providers, with full SSL validation
 * and bounded connect/read timeouts.
 */
@Configuration
public class HttpClientConfig {

    /**
     * Creates the RestTemplate used for external analysis provider calls.
     *
     * @param builder          the RestTemplateBuilder provided by Spring Boot
     * @param connectTimeoutMs connect timeout in milliseconds
     * @param readTimeoutMs    read timeout in milliseconds
     * @return a configured RestTemplate instance
     */
    @Bean
    public RestTemplate providerRestTemplate(
            RestTemplateBuilder builder,
            @Value("${http.client.connect-timeout-ms:10000}") long connectTimeoutMs,
            @Value("${http.client.read-timeout-ms:30000}") long readTimeoutMs) {
        return builder
            .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
            .setReadTimeout(Duration.ofMillis(readTimeoutMs))
            .build();
    }
}
