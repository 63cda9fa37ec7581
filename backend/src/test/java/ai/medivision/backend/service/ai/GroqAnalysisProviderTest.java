package ai.medivision.backend.service.ai;

import ai.medivision.backend.model.ModalityTag;
import ai.medivision.backend.service.exception.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GroqAnalysisProvider using MockWebServer.
 */
class GroqAnalysisProviderTest {

    private MockWebServer mockWebServer;
    private GroqAnalysisProvider provider;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AnalysisPrompt prompt = new AnalysisPrompt(ModalityTag.MRI, "system prompt", "user prompt", false);

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        provider = new GroqAnalysisProvider(
                new RestTemplate(),
                objectMapper,
                mockWebServer.url("/openai/v1").toString(),
                "test-key",
                "llama-3.1-70b-versatile",
                true,
                1
        );
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void shouldReturnMessageContentOfFirstChoice() throws Exception {
        // Arrange
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"MRI report\"}}]}"));

        // Act
        Optional<String> result = provider.generate(prompt);

        // Assert
        assertEquals(Optional.of("MRI report"), result);

        RecordedRequest request = mockWebServer.takeRequest();
        assertEquals("/openai/v1/chat/completions", request.getPath());
        assertEquals("POST", request.getMethod());
        assertEquals("Bearer test-key", request.getHeader("Authorization"));

        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("llama-3.1-70b-versatile", body.get("model").asText());
        assertEquals(0.3, body.get("temperature").asDouble(), 1e-9);
        assertEquals(1500, body.get("max_tokens").asInt());
        assertEquals("system", body.path("messages").path(0).path("role").asText());
        assertEquals("system prompt", body.path("messages").path(0).path("content").asText());
        assertEquals("user prompt", body.path("messages").path(1).path("content").asText());
    }

    @Test
    void shouldReturnEmptyWhenResponseHasNoChoices() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[]}"));

        assertTrue(provider.generate(prompt).isEmpty());
    }

    @Test
    void shouldThrowProviderExceptionWhenServerReturnsError() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(500)
                .setBody("Internal Server Error"));

        assertThatThrownBy(() -> provider.generate(prompt))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertEquals(ProviderException.Kind.ERROR, ((ProviderException) e).getKind()));
    }

    @Test
    void shouldThrowProviderExceptionWhenResponseIsMalformed() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\": [ broken"));

        assertThatThrownBy(() -> provider.generate(prompt))
                .isInstanceOf(ProviderException.class);
    }

    @Test
    void shouldBeDisabledWithoutApiKey() {
        GroqAnalysisProvider withoutKey = new GroqAnalysisProvider(
                new RestTemplate(), objectMapper, "http://localhost:1", "", "model", true, 1);
        GroqAnalysisProvider switchedOff = new GroqAnalysisProvider(
                new RestTemplate(), objectMapper, "http://localhost:1", "key", "model", false, 1);

        assertFalse(withoutKey.isEnabled());
        assertFalse(switchedOff.isEnabled());
        assertTrue(provider.isEnabled());
        assertEquals("groq", provider.getName());
    }
}
