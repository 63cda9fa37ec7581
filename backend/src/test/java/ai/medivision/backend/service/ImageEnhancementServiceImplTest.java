package ai.medivision.backend.service;

import ai.medivision.backend.model.ModalityTag;
import ai.medivision.backend.model.dto.AiAnalysis;
import ai.medivision.backend.model.dto.EnhancementOptions;
import ai.medivision.backend.model.dto.EnhancementRequest;
import ai.medivision.backend.model.dto.EnhancementResult;
import ai.medivision.backend.model.dto.QualityMetrics;
import ai.medivision.backend.service.ai.AnalysisPrompt;
import ai.medivision.backend.service.ai.AnalysisPromptBuilder;
import ai.medivision.backend.service.ai.AnalysisProviderChain;
import ai.medivision.backend.service.exception.InvalidEnhancementRequestException;
import ai.medivision.backend.service.imaging.ImageBuffer;
import ai.medivision.backend.service.imaging.ImageCodec;
import ai.medivision.backend.service.imaging.ImageFixtures;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImageEnhancementServiceImplTest {

    @Mock
    private AnalysisProviderChain providerChain;

    private final ImageCodec codec = new ImageCodec();
    private final ModalityProfileRegistry registry = new ModalityProfileRegistry();

    private MeterRegistry meterRegistry;
    private ExecutorService enhancementExecutor;
    private ImageEnhancementServiceImpl service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        enhancementExecutor = Executors.newFixedThreadPool(2);
        service = new ImageEnhancementServiceImpl(
                registry,
                codec,
                new TransformChainExecutor(),
                new QualityMetricsCalculator(),
                new AnalysisPromptBuilder(),
                providerChain,
                new ResultAggregator(),
                new EnhancementMetricsService(meterRegistry),
                enhancementExecutor);
    }

    @AfterEach
    void tearDown() {
        enhancementExecutor.shutdownNow();
    }

    @Test
    void enhance_XrayNoise_ShouldReturnSameSizePngWithMeasuredMetrics() {
        // Arrange
        byte[] input = ImageFixtures.png(ImageFixtures.noise(256, 256, 1, 2024L));
        when(providerChain.analyze(any(AnalysisPrompt.class)))
                .thenReturn(AiAnalysis.success("groq", "Image Quality: 90/100", null, 90));
        EnhancementRequest request = new EnhancementRequest("P-1", "Jane Roe", "xray", input, null);

        // Act
        EnhancementResult result = service.enhance(request);

        // Assert
        ImageBuffer output = codec.decode(result.getEnhancedImageBytes().orElseThrow());
        assertEquals(256, output.getWidth());
        assertEquals(256, output.getHeight());

        QualityMetrics metrics = result.getMetrics();
        assertThat(metrics.getSsim()).isStrictlyBetween(0.0, 1.0);
        assertThat(metrics.getPsnr()).isGreaterThanOrEqualTo(0.0);
        assertTrue(Double.isFinite(metrics.getPsnr()));
        assertEquals(50.0, metrics.getContrastImprovementPercent(), 1e-9);
        assertEquals(100.0, metrics.getSharpnessImprovementPercent(), 1e-9);

        assertEquals(ModalityTag.XRAY, result.getModality());
        assertTrue(result.getAnalysis().isPresent());
        assertThat(result.getEnhancedFileName()).startsWith("enhanced_xray_").endsWith(".png");
        assertEquals(1.0, meterRegistry.get("image_enhancement_requests_total")
                .tag("modality", "xray").tag("outcome", "enhanced").counter().count());
    }

    @Test
    void enhance_UnknownModalityWithoutImage_ShouldReportGenericNominalMetrics() {
        // Arrange
        when(providerChain.analyze(any(AnalysisPrompt.class)))
                .thenReturn(AiAnalysis.degraded("fallback", "AI Enhancement Analysis for OTHER", 85));
        EnhancementRequest request = new EnhancementRequest("P-2", "John Doe", "unknown-modality-xyz", null, null);

        // Act
        EnhancementResult result = service.enhance(request);

        // Assert
        assertTrue(result.getEnhancedImageBytes().isEmpty());
        assertEquals(ModalityTag.OTHER, result.getModality());
        assertEquals(registry.resolveProfile(ModalityTag.OTHER).nominalMetrics(), result.getMetrics());
        assertEquals(30.0, result.getMetrics().getContrastImprovementPercent(), 1e-9);
        assertEquals(50.0, result.getMetrics().getSharpnessImprovementPercent(), 1e-9);
        assertTrue(result.getAnalysis().isPresent());
    }

    @Test
    void enhance_NullRequest_ShouldBeRejected() {
        assertThatThrownBy(() -> service.enhance(null))
                .isInstanceOf(InvalidEnhancementRequestException.class);
    }

    @Test
    void enhance_RequestWithNothingToDo_ShouldBeRejected() {
        EnhancementRequest request = new EnhancementRequest("P-3", "Jane Roe", " ", null,
                new EnhancementOptions(false, false));

        assertThatThrownBy(() -> service.enhance(request))
                .isInstanceOf(InvalidEnhancementRequestException.class);
        verifyNoInteractions(providerChain);
    }

    @Test
    void enhance_UndecodableImage_ShouldPassOriginalBytesThrough() {
        // Arrange
        byte[] garbage = "corrupted DICOM export".getBytes(StandardCharsets.UTF_8);
        EnhancementRequest request = new EnhancementRequest("P-4", "Jane Roe", "CT", garbage,
                new EnhancementOptions(false, false));

        // Act
        EnhancementResult result = service.enhance(request);

        // Assert
        assertArrayEquals(garbage, result.getEnhancedImageBytes().orElseThrow());
        assertEquals(0.0, result.getMetrics().getContrastImprovementPercent());
        assertEquals(0.0, result.getMetrics().getSharpnessImprovementPercent());
        assertEquals(36.8, result.getMetrics().getPsnr(), 1e-9);
        assertTrue(result.getAnalysis().isEmpty());
        verifyNoInteractions(providerChain);
    }

    @Test
    void enhance_ImageTooSmallForMetrics_ShouldReportNominalMetrics() {
        byte[] input = ImageFixtures.png(ImageFixtures.noise(4, 4, 3, 11L));
        EnhancementRequest request = new EnhancementRequest("P-5", "Jane Roe", "ct", input,
                new EnhancementOptions(false, false));

        EnhancementResult result = service.enhance(request);

        assertEquals(registry.resolveProfile(ModalityTag.CT).nominalMetrics(), result.getMetrics());
        assertEquals(4, codec.decode(result.getEnhancedImageBytes().orElseThrow()).getWidth());
    }

    @Test
    void enhance_StructuredOption_ShouldRequestStructuredAnalysis() {
        // Arrange
        when(providerChain.analyze(any(AnalysisPrompt.class)))
                .thenReturn(AiAnalysis.success("groq", "{}", null, null));
        EnhancementRequest request = new EnhancementRequest("P-6", "Jane Roe", "MRI", null,
                new EnhancementOptions(true, true));

        // Act
        service.enhance(request);

        // Assert
        ArgumentCaptor<AnalysisPrompt> captor = ArgumentCaptor.forClass(AnalysisPrompt.class);
        verify(providerChain).analyze(captor.capture());
        assertTrue(captor.getValue().isStructuredOutputExpected());
        assertEquals(ModalityTag.MRI, captor.getValue().getModality());
    }

    @Test
    void enhanceAsync_ShouldCompleteWithResult() {
        byte[] input = ImageFixtures.png(ImageFixtures.gradient(32, 32));
        EnhancementRequest request = new EnhancementRequest("P-8", "Jane Roe", "ultrasound", input,
                new EnhancementOptions(false, false));

        EnhancementResult result = service.enhanceAsync(request).join();

        assertEquals(ModalityTag.ULTRASOUND, result.getModality());
        assertTrue(result.getMetrics().isValid());
    }

    @Test
    void enhanceAsync_ShouldCompleteExceptionallyForMalformedRequest() {
        CompletableFuture<EnhancementResult> future = service.enhanceAsync(null);

        assertThatThrownBy(future::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(InvalidEnhancementRequestException.class);
    }
}
