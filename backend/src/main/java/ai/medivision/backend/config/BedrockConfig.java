package ai.medivision.backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;

/**
 * Configuration of the Amazon Bedrock runtime client used by the backup analysis provider.
 *
 * The client is only created when {@code ai.provider.bedrock.enabled=true}. Static
 * credentials are used when both keys are configured, otherwise the default AWS
 * credentials chain.
 */
@Configuration
@ConditionalOnProperty(name = "ai.provider.bedrock.enabled", havingValue = "true")
public class BedrockConfig {

    private static final Logger logger = LoggerFactory.getLogger(BedrockConfig.class);

    @Value("${ai.provider.bedrock.region:us-east-1}")
    private String region;

    @Value("${ai.provider.bedrock.access-key-id:}")
    private String accessKeyId;

    @Value("${ai.provider.bedrock.secret-access-key:}")
    private String secretAccessKey;

    @Bean(destroyMethod = "close")
    public BedrockRuntimeClient bedrockRuntimeClient() {
        logger.info("Configuring BedrockRuntimeClient for region: {}", region);
        return BedrockRuntimeClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider())
                .build();
    }

    private AwsCredentialsProvider credentialsProvider() {
        if (accessKeyId == null || accessKeyId.isEmpty() || secretAccessKey == null || secretAccessKey.isEmpty()) {
            logger.info("Bedrock static credentials not configured, using default AWS credentials chain");
            return DefaultCredentialsProvider.create();
        }
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey));
    }
}
