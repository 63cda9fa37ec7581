package ai.medivision.backend.service;

import ai.medivision.backend.model.ModalityProfile;
import ai.medivision.backend.model.ModalityTag;
import ai.medivision.backend.model.dto.AiAnalysis;
import ai.medivision.backend.model.dto.EnhancementOptions;
import ai.medivision.backend.model.dto.EnhancementRequest;
import ai.medivision.backend.model.dto.EnhancementResult;
import ai.medivision.backend.model.dto.QualityMetrics;
import ai.medivision.backend.service.ai.AnalysisPrompt;
import ai.medivision.backend.service.ai.AnalysisPromptBuilder;
import ai.medivision.backend.service.ai.AnalysisProviderChain;
import ai.medivision.backend.service.exception.ImageProcessingException;
import ai.medivision.backend.service.exception.InvalidEnhancementRequestException;
import ai.medivision.backend.service.exception.MetricComputationException;
import ai.medivision.backend.service.imaging.ImageBuffer;
import ai.medivision.backend.service.imaging.ImageCodec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Default implementation of the ImageEnhancementService.
 *
 * This service is responsible for:
 * <ul>
 *     <li>Resolving the modality profile of the request</li>
 *     <li>Decoding, enhancing, encoding and measuring the image, when one is supplied</li>
 *     <li>Requesting a textual analysis from the provider chain, when enabled</li>
 *     <li>Handing everything to the result aggregator</li>
 * </ul>
 *
 * Only a malformed request fails; undecodable images are passed through unmodified.
 */
@Service
public class ImageEnhancementServiceImpl implements ImageEnhancementService {

    private static final Logger logger = LoggerFactory.getLogger(ImageEnhancementServiceImpl.class);

    private final ModalityProfileRegistry profileRegistry;
    private final ImageCodec imageCodec;
    private final TransformChainExecutor chainExecutor;
    private final QualityMetricsCalculator metricsCalculator;
    private final AnalysisPromptBuilder promptBuilder;
    private final AnalysisProviderChain providerChain;
    private final ResultAggregator resultAggregator;
    private final EnhancementMetricsService metricsService;
    private final ExecutorService enhancementExecutor;

    @Autowired
    public ImageEnhancementServiceImpl(ModalityProfileRegistry profileRegistry,
                                       ImageCodec imageCodec,
                                       TransformChainExecutor chainExecutor,
                                       QualityMetricsCalculator metricsCalculator,
                                       AnalysisPromptBuilder promptBuilder,
                                       AnalysisProviderChain providerChain,
                                       ResultAggregator resultAggregator,
                                       EnhancementMetricsService metricsService,
                                       @Qualifier("enhancementExecutor") ExecutorService enhancementExecutor) {
        this.profileRegistry = profileRegistry;
        this.imageCodec = imageCodec;
        this.chainExecutor = chainExecutor;
        this.metricsCalculator = metricsCalculator;
        this.promptBuilder = promptBuilder;
        this.providerChain = providerChain;
        this.resultAggregator = resultAggregator;
        this.metricsService = metricsService;
        this.enhancementExecutor = enhancementExecutor;
    }

    @Override
    public EnhancementResult enhance(EnhancementRequest request) {
        validate(request);
        long start = System.nanoTime();

        ModalityTag modality = ModalityTag.fromString(request.getModality());
        if (modality == ModalityTag.OTHER && request.hasModality()
                && !"OTHER".equalsIgnoreCase(request.getModality().trim())) {
            logger.warn("Unsupported modality '{}', using the generic enhancement chain", request.getModality());
        }
        ModalityProfile profile = profileRegistry.resolveProfile(modality);
        EnhancementOptions options = request.getOptions();

        logger.info("Enhancing {} image for patient {}", modality.getDisplayName(), request.getPatientId());

        byte[] outputBytes = null;
        QualityMetrics metrics = null;
        String outcome;

        if (request.hasImage()) {
            try {
                ImageBuffer original = imageCodec.decode(request.getImageBytes());
                ImageBuffer enhanced = chainExecutor.apply(original, profile.getSteps());
                outputBytes = imageCodec.encodePng(enhanced);
                metrics = measure(original, enhanced, profile);
                outcome = "enhanced";
            } catch (ImageProcessingException e) {
                logger.warn("Image processing failed for {}, passing original bytes through: {}",
                        modality.getDisplayName(), e.getMessage());
                outputBytes = request.getImageBytes();
                metrics = profile.passthroughMetrics();
                outcome = "passthrough";
            }
        } else {
            logger.debug("No image supplied, reporting nominal metrics for {}", modality.getDisplayName());
            outcome = "analysis_only";
        }

        AiAnalysis analysis = null;
        if (options.isUseAIAnalysis()) {
            AnalysisPrompt prompt = promptBuilder.build(request, modality, options.isStructuredAnalysis());
            analysis = providerChain.analyze(prompt);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        metricsService.recordRequest(modality, outcome);
        metricsService.recordDuration(modality, elapsed);

        EnhancementResult result = resultAggregator.aggregate(
                request, profile, outputBytes, metrics, analysis, elapsed.toMillis());
        logger.info("Finished {} enhancement ({}) in {} ms", modality.getDisplayName(), outcome, elapsed.toMillis());
        return result;
    }

    @Override
    public CompletableFuture<EnhancementResult> enhanceAsync(EnhancementRequest request) {
        return CompletableFuture.supplyAsync(() -> enhance(request), enhancementExecutor);
    }

    private QualityMetrics measure(ImageBuffer original, ImageBuffer enhanced, ModalityProfile profile) {
        try {
            return metricsCalculator.computeMetrics(original, enhanced, profile);
        } catch (MetricComputationException e) {
            logger.warn("Metric computation failed for {}, using nominal values: {}",
                    profile.getTag().getDisplayName(), e.getMessage());
            return profile.nominalMetrics();
        }
    }

    private void validate(EnhancementRequest request) {
        if (request == null) {
            metricsService.recordRequest(ModalityTag.OTHER, "rejected");
            throw new InvalidEnhancementRequestException("Enhancement request must not be null");
        }
        if (!request.hasModality() && !request.hasImage() && !request.getOptions().isUseAIAnalysis()) {
            metricsService.recordRequest(ModalityTag.OTHER, "rejected");
            throw new InvalidEnhancementRequestException(
                    "Enhancement request has no modality, no image and AI analysis disabled");
        }
    }
}
