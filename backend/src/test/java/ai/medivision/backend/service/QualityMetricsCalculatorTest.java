package ai.medivision.backend.service;

import ai.medivision.backend.model.ModalityProfile;
import ai.medivision.backend.model.ModalityTag;
import ai.medivision.backend.model.dto.QualityMetrics;
import ai.medivision.backend.service.exception.MetricComputationException;
import ai.medivision.backend.service.imaging.ImageBuffer;
import ai.medivision.backend.service.imaging.ImageFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QualityMetricsCalculatorTest {

    private final QualityMetricsCalculator calculator = new QualityMetricsCalculator();
    private final ModalityProfileRegistry registry = new ModalityProfileRegistry();
    private final TransformChainExecutor executor = new TransformChainExecutor();

    @Test
    void identicalImages_ShouldReportPerfectSimilarity() {
        ImageBuffer image = ImageFixtures.noise(32, 32, 3, 5L);

        QualityMetrics metrics = calculator.computeMetrics(image, image, 0.0, 0.0);

        assertEquals(QualityMetrics.PSNR_IDENTICAL_SENTINEL, metrics.getPsnr());
        assertEquals(1.0, metrics.getSsim());
    }

    @Test
    void uniformOffset_ShouldMatchClosedFormValues() {
        // Arrange - every sample differs by 10, so MSE = 100 and all windows have zero variance
        ImageBuffer original = ImageFixtures.uniform(16, 16, 100);
        ImageBuffer enhanced = ImageFixtures.uniform(16, 16, 110);
        double c1 = Math.pow(0.01 * 255, 2);
        double expectedSsim = (2 * 100.0 * 110.0 + c1) / (100.0 * 100.0 + 110.0 * 110.0 + c1);

        // Act
        QualityMetrics metrics = calculator.computeMetrics(original, enhanced, 12.5, 7.5);

        // Assert
        assertThat(metrics.getPsnr()).isCloseTo(10 * Math.log10(255.0 * 255.0 / 100.0), within(1e-9));
        assertThat(metrics.getSsim()).isCloseTo(expectedSsim, within(1e-9));
        assertEquals(12.5, metrics.getContrastImprovementPercent());
        assertEquals(7.5, metrics.getSharpnessImprovementPercent());
    }

    @ParameterizedTest
    @EnumSource(ModalityTag.class)
    void enhancedImages_ShouldSatisfyMetricInvariants(ModalityTag tag) {
        // Arrange
        ModalityProfile profile = registry.resolveProfile(tag);
        ImageBuffer original = ImageFixtures.noise(40, 40, 1, 99L);
        ImageBuffer enhanced = executor.apply(original, profile.getSteps());

        // Act
        QualityMetrics metrics = calculator.computeMetrics(original, enhanced, profile);

        // Assert
        assertTrue(metrics.isValid(), metrics.toString());
        assertThat(metrics.getSsim()).isBetween(0.0, 1.0);
        assertThat(metrics.getPsnr()).isGreaterThanOrEqualTo(0.0);
        assertEquals(profile.getDeclaredContrastImprovement(), metrics.getContrastImprovementPercent());
        assertEquals(profile.getDeclaredSharpnessImprovement(), metrics.getSharpnessImprovementPercent());
    }

    @Test
    void invertingChain_ShouldBeMeasuredAgainstInvertedOriginal() {
        // Arrange - an enhancement that only flips polarity
        ModalityProfile xray = registry.resolveProfile(ModalityTag.XRAY);
        ImageBuffer original = ImageFixtures.gradient(32, 32);

        // Act
        QualityMetrics metrics = calculator.computeMetrics(original, original.inverted(), xray);

        // Assert
        assertEquals(QualityMetrics.PSNR_IDENTICAL_SENTINEL, metrics.getPsnr());
        assertEquals(1.0, metrics.getSsim());
        assertEquals(50.0, metrics.getContrastImprovementPercent(), 1e-9);
        assertEquals(100.0, metrics.getSharpnessImprovementPercent(), 1e-9);
    }

    @Test
    void differentSizes_ShouldResampleEnhancedImageForComparison() {
        ImageBuffer original = ImageFixtures.gradient(64, 64);
        ImageBuffer smaller = original.resized(32, 32);

        QualityMetrics metrics = calculator.computeMetrics(original, smaller, 0.0, 0.0);

        assertTrue(metrics.isValid());
        assertThat(metrics.getSsim()).isGreaterThan(0.5);
    }

    @Test
    void channelMismatch_ShouldCompareAsRgb() {
        ImageBuffer gray = ImageFixtures.gradient(16, 16);

        QualityMetrics metrics = calculator.computeMetrics(gray, gray.toRgb(), 0.0, 0.0);

        assertEquals(QualityMetrics.PSNR_IDENTICAL_SENTINEL, metrics.getPsnr());
        assertEquals(1.0, metrics.getSsim());
    }

    @Test
    void imagesSmallerThanWindow_ShouldFail() {
        ImageBuffer original = ImageFixtures.uniform(5, 5, 10);
        ImageBuffer enhanced = ImageFixtures.uniform(5, 5, 20);

        assertThatThrownBy(() -> calculator.computeMetrics(original, enhanced, 0.0, 0.0))
                .isInstanceOf(MetricComputationException.class)
                .hasMessageContaining("smaller than");
    }
}
