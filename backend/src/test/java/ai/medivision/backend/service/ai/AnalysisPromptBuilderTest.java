package ai.medivision.backend.service.ai;

import ai.medivision.backend.model.ModalityTag;
import ai.medivision.backend.model.dto.EnhancementRequest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalysisPromptBuilderTest {

    private final AnalysisPromptBuilder builder = new AnalysisPromptBuilder();

    @Test
    void build_ShouldIncludePatientAndModality() {
        EnhancementRequest request = new EnhancementRequest("P-1001", "Jane Roe", "xray", null, null);

        AnalysisPrompt prompt = builder.build(request, ModalityTag.XRAY, false);

        assertEquals(ModalityTag.XRAY, prompt.getModality());
        assertEquals(AnalysisPromptBuilder.SYSTEM_PROMPT, prompt.getSystemPrompt());
        assertThat(prompt.getUserPrompt())
                .contains("analyze this X-RAY medical image")
                .contains("Patient: Jane Roe (ID: P-1001)")
                .contains("Contrast adjustment (%)")
                .doesNotContain("JSON");
        assertFalse(prompt.isStructuredOutputExpected());
    }

    @Test
    void build_ShouldAskForJsonInStructuredMode() {
        EnhancementRequest request = new EnhancementRequest(null, null, "ct", null, null);

        AnalysisPrompt prompt = builder.build(request, ModalityTag.CT, true);

        assertTrue(prompt.isStructuredOutputExpected());
        assertThat(prompt.getUserPrompt())
                .contains("Patient: Unknown (ID: Unknown)")
                .contains("single JSON object")
                .contains("\"quality_score\"");
    }

    @Test
    void asSingleText_ShouldJoinSystemAndUserPrompt() {
        AnalysisPrompt prompt = new AnalysisPrompt(ModalityTag.MRI, "sys", "usr", false);

        assertEquals("sys\n\nusr", prompt.asSingleText());
    }
}
