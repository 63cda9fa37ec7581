package ai.medivision.backend.service.ai;

import ai.medivision.backend.service.exception.ProviderException;
import ai.medivision.backend.service.interfaces.TextAnalysisProvider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.util.Optional;

/**
 * Backup analysis provider: Amazon Titan Text on Bedrock.
 *
 * Disabled when no {@link BedrockRuntimeClient} is configured.
 */
@Component
public class BedrockTitanAnalysisProvider implements TextAnalysisProvider {

    private static final Logger logger = LoggerFactory.getLogger(BedrockTitanAnalysisProvider.class);

    static final String NAME = "bedrock-titan";

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final String modelId;
    private final boolean enabled;
    private final int priority;

    @Autowired
    public BedrockTitanAnalysisProvider(
            ObjectProvider<BedrockRuntimeClient> bedrockClient,
            ObjectMapper objectMapper,
            @Value("${ai.provider.bedrock.model-id:amazon.titan-text-express-v1}") String modelId,
            @Value("${ai.provider.bedrock.enabled:false}") boolean enabled,
            @Value("${ai.provider.bedrock.priority:2}") int priority) {
        this(bedrockClient.getIfAvailable(), objectMapper, modelId, enabled, priority);
    }

    public BedrockTitanAnalysisProvider(BedrockRuntimeClient bedrockClient, ObjectMapper objectMapper,
                                        String modelId, boolean enabled, int priority) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.modelId = modelId;
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
        return enabled && bedrockClient != null;
    }

    @Override
    public Optional<String> generate(AnalysisPrompt prompt) {
        if (bedrockClient == null) {
            throw new ProviderException(NAME, ProviderException.Kind.ERROR, "Bedrock client is not configured");
        }

        try {
            ObjectNode body = objectMapper.createObjectNode();
            body.put("inputText", prompt.asSingleText());
            ObjectNode config = body.putObject("textGenerationConfig");
            config.put("maxTokenCount", 1000);
            config.put("temperature", 0.4);
            config.put("topP", 0.9);

            InvokeModelRequest request = InvokeModelRequest.builder()
                    .modelId(modelId)
                    .contentType("application/json")
                    .accept("application/json")
                    .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(body)))
                    .build();

            logger.debug("Invoking Bedrock model {}", modelId);
            InvokeModelResponse response = bedrockClient.invokeModel(request);
            if (response.body() == null) {
                return Optional.empty();
            }

            JsonNode outputText = objectMapper.readTree(response.body().asUtf8String())
                    .path("results").path(0).path("outputText");
            return outputText.isTextual() ? Optional.of(outputText.asText()) : Optional.empty();

        } catch (SdkException e) {
            throw new ProviderException(NAME, ProviderException.Kind.ERROR,
                    "Bedrock invocation failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ProviderException(NAME, ProviderException.Kind.ERROR,
                    "Malformed Bedrock response: " + e.getOriginalMessage(), e);
        }
    }
}
