package ai.medivision.backend.model.dto;

import ai.medivision.backend.model.ModalityTag;

import java.time.Instant;
import java.util.Optional;

/**
 * Final, immutable outcome of one enhancement request, handed to the persistence
 * collaborator. Metrics are always present; image bytes and analysis may be absent.
 */
public final class EnhancementResult {

    private final String patientId;
    private final String patientName;
    private final byte[] enhancedImageBytes;
    private final QualityMetrics metrics;
    private final AiAnalysis analysis;
    private final ModalityTag modality;
    private final Instant generatedAt;
    private final long processingTimeMs;
    private final String enhancedFileName;

    public EnhancementResult(String patientId, String patientName, byte[] enhancedImageBytes,
                             QualityMetrics metrics, AiAnalysis analysis, ModalityTag modality,
                             Instant generatedAt, long processingTimeMs, String enhancedFileName) {
        this.patientId = patientId;
        this.patientName = patientName;
        this.enhancedImageBytes = enhancedImageBytes != null ? enhancedImageBytes.clone() : null;
        this.metrics = metrics;
        this.analysis = analysis;
        this.modality = modality;
        this.generatedAt = generatedAt;
        this.processingTimeMs = processingTimeMs;
        this.enhancedFileName = enhancedFileName;
    }

    public String getPatientId() {
        return patientId;
    }

    public String getPatientName() {
        return patientName;
    }

    public Optional<byte[]> getEnhancedImageBytes() {
        return Optional.ofNullable(enhancedImageBytes).map(byte[]::clone);
    }

    public QualityMetrics getMetrics() {
        return metrics;
    }

    public Optional<AiAnalysis> getAnalysis() {
        return Optional.ofNullable(analysis);
    }

    public ModalityTag getModality() {
        return modality;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    /**
     * Suggested storage name of the enhanced image, null when no image was produced.
     */
    public String getEnhancedFileName() {
        return enhancedFileName;
    }
}
