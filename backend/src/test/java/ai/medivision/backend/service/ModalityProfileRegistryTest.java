package ai.medivision.backend.service;

import ai.medivision.backend.model.ModalityProfile;
import ai.medivision.backend.model.ModalityTag;
import ai.medivision.backend.model.dto.QualityMetrics;
import ai.medivision.backend.service.imaging.TransformStep;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModalityProfileRegistryTest {

    private final ModalityProfileRegistry registry = new ModalityProfileRegistry();

    @ParameterizedTest
    @EnumSource(ModalityTag.class)
    void resolveProfile_ShouldReturnProfileForEveryModality(ModalityTag tag) {
        ModalityProfile profile = registry.resolveProfile(tag);

        assertEquals(tag, profile.getTag());
        assertFalse(profile.getSteps().isEmpty());
    }

    @Test
    void resolveProfile_ShouldMapNullToOther() {
        assertEquals(ModalityTag.OTHER, registry.resolveProfile((ModalityTag) null).getTag());
    }

    @Test
    void resolveProfile_ShouldNormalizeFreeFormStrings() {
        assertEquals(ModalityTag.XRAY, registry.resolveProfile("X-Ray").getTag());
        assertEquals(ModalityTag.OTHER, registry.resolveProfile("unknown-modality-xyz").getTag());
    }

    @Test
    void resolveProfile_ShouldReturnSameInstanceOnEveryCall() {
        assertSame(registry.resolveProfile(ModalityTag.MRI), registry.resolveProfile(ModalityTag.MRI));
    }

    @Test
    void xrayChain_ShouldRunInDocumentedOrder() {
        ModalityProfile profile = registry.resolveProfile(ModalityTag.XRAY);

        assertThat(profile.getSteps()).extracting(TransformStep::getName).containsExactly(
                "AutoContrast(cutoffPercent=2.0)",
                "Invert()",
                "Contrast(factor=1.5)",
                "Sharpness(factor=2.0)",
                "SharpenFilter()");
        assertTrue(profile.invertsPolarity());
    }

    @Test
    void ultrasoundChain_ShouldDenoiseBeforeSharpening() {
        ModalityProfile profile = registry.resolveProfile(ModalityTag.ULTRASOUND);

        assertThat(profile.getSteps().get(0).getName()).isEqualTo("MedianFilter(size=5)");
        assertFalse(profile.invertsPolarity());
    }

    @ParameterizedTest
    @CsvSource({
            "XRAY, 35.2, 0.92, 50, 100",
            "CT, 36.8, 0.90, 40, 60",
            "MRI, 38.5, 0.94, 60, 50",
            "ULTRASOUND, 33.5, 0.88, 30, 40",
            "DXA, 34.0, 0.91, 70, 120",
            "OTHER, 32.5, 0.88, 30, 50"
    })
    void nominalMetrics_ShouldMatchProfileTable(ModalityTag tag, double psnr, double ssim,
                                                double contrast, double sharpness) {
        QualityMetrics nominal = registry.resolveProfile(tag).nominalMetrics();

        assertEquals(psnr, nominal.getPsnr());
        assertEquals(ssim, nominal.getSsim());
        assertEquals(contrast, nominal.getContrastImprovementPercent());
        assertEquals(sharpness, nominal.getSharpnessImprovementPercent());
    }

    @Test
    void passthroughMetrics_ShouldReportNoImprovement() {
        QualityMetrics passthrough = registry.resolveProfile(ModalityTag.CT).passthroughMetrics();

        assertEquals(36.8, passthrough.getPsnr(), 1e-9);
        assertEquals(0.0, passthrough.getContrastImprovementPercent());
        assertEquals(0.0, passthrough.getSharpnessImprovementPercent());
    }
}
