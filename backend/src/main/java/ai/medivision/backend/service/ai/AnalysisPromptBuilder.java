package ai.medivision.backend.service.ai;

import ai.medivision.backend.model.ModalityTag;
import ai.medivision.backend.model.dto.EnhancementRequest;

import org.springframework.stereotype.Component;

/**
 * Builds the radiology report prompt for an enhancement request.
 */
@Component
public class AnalysisPromptBuilder {

    static final String SYSTEM_PROMPT = "You are an expert medical imaging AI assistant specializing in "
            + "radiology and diagnostic image enhancement. Provide technical, accurate medical insights.";

    private static final String REPORT_TEMPLATE =
            "As an expert medical AI radiologist, analyze this %1$s medical image and provide detailed "
            + "enhancement recommendations.\n\n"
            + "Patient: %2$s (ID: %3$s)\n"
            + "Image Type: %1$s\n\n"
            + "Provide a professional medical image enhancement report including:\n"
            + "1. **Image Quality Assessment** (score 0-100)\n"
            + "2. **Key Areas Needing Enhancement** (be specific to %1$s)\n"
            + "3. **Recommended Technical Adjustments**:\n"
            + "   - Contrast adjustment (%%)\n"
            + "   - Brightness/Exposure (%%)\n"
            + "   - Sharpening intensity\n"
            + "   - Noise reduction level\n"
            + "4. **Expected Diagnostic Improvements**\n"
            + "5. **Clinical Value** of this enhancement\n\n"
            + "Format as a clear, professional radiology report. Be concise but thorough.";

    private static final String STRUCTURED_SUFFIX = "\n\nRespond with a single JSON object with the keys "
            + "\"quality_score\" (integer 0-100), \"key_areas\" (array of strings), "
            + "\"adjustments\" (object with \"contrast_percent\", \"brightness_percent\", "
            + "\"sharpening\", \"noise_reduction\"), \"diagnostic_improvements\" and \"clinical_value\". "
            + "Do not add any text outside the JSON object.";

    /**
     * Builds the prompt for a request whose modality has already been resolved.
     *
     * @param request    the enhancement request
     * @param modality   the resolved modality
     * @param structured whether a JSON report is requested
     * @return the prompt
     */
    public AnalysisPrompt build(EnhancementRequest request, ModalityTag modality, boolean structured) {
        String patientName = orUnknown(request.getPatientName());
        String patientId = orUnknown(request.getPatientId());

        String userPrompt = String.format(REPORT_TEMPLATE, modality.getDisplayName(), patientName, patientId);
        if (structured) {
            userPrompt = userPrompt + STRUCTURED_SUFFIX;
        }
        return new AnalysisPrompt(modality, SYSTEM_PROMPT, userPrompt, structured);
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "Unknown" : value;
    }
}
