package ai.medivision.backend.service.ai;

import ai.medivision.backend.service.exception.ProviderException;
import ai.medivision.backend.service.interfaces.TextAnalysisProvider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Primary analysis provider: Groq Cloud's OpenAI-compatible chat completions API.
 */
@Component
public class GroqAnalysisProvider implements TextAnalysisProvider {

    private static final Logger logger = LoggerFactory.getLogger(GroqAnalysisProvider.class);

    static final String NAME = "groq";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String apiKey;
    private final String model;
    private final boolean enabled;
    private final int priority;

    @Autowired
    public GroqAnalysisProvider(
            @Qualifier("providerRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            @Value("${ai.provider.groq.url:https://api.groq.com/openai/v1}") String apiUrl,
            @Value("${ai.provider.groq.api-key:}") String apiKey,
            @Value("${ai.provider.groq.model:llama-3.1-70b-versatile}") String model,
            @Value("${ai.provider.groq.enabled:true}") boolean enabled,
            @Value("${ai.provider.groq.priority:1}") int priority) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.enabled = enabled;
        this.priority = priority;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public boolean isEnabled() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Optional<String> generate(AnalysisPrompt prompt) {
        String url = apiUrl + "/chat/completions";

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
                Map.of("role", "system", "content", prompt.getSystemPrompt()),
                Map.of("role", "user", "content", prompt.getUserPrompt())));
        body.put("temperature", 0.3);
        body.put("max_tokens", 1500);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);

        try {
            logger.debug("Sending analysis request to Groq at: {}", url);
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

            if (response.getBody() == null || response.getBody().isBlank()) {
                logger.warn("Groq returned empty response body");
                return Optional.empty();
            }

            JsonNode content = objectMapper.readTree(response.getBody())
                    .path("choices").path(0).path("message").path("content");
            return content.isTextual() ? Optional.of(content.asText()) : Optional.empty();

        } catch (RestClientException e) {
            throw new ProviderException(NAME, ProviderException.Kind.ERROR,
                    "Failed to communicate with Groq: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ProviderException(NAME, ProviderException.Kind.ERROR,
                    "Malformed Groq response: " + e.getOriginalMessage(), e);
        }
    }
}
