package ai.medivision.backend.service;

import ai.medivision.backend.model.ModalityProfile;
import ai.medivision.backend.model.dto.AiAnalysis;
import ai.medivision.backend.model.dto.EnhancementRequest;
import ai.medivision.backend.model.dto.EnhancementResult;
import ai.medivision.backend.model.dto.QualityMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Assembles the final {@link EnhancementResult} of a request. Pure assembly, no I/O.
 */
@Service
public class ResultAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ResultAggregator.class);

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public ResultAggregator() {
        this(Clock.systemUTC());
    }

    public ResultAggregator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds the result. Absent or invalid metrics are replaced by the profile's nominal metrics.
     *
     * @param request            the originating request
     * @param profile            the resolved modality profile
     * @param enhancedImageBytes encoded output image, null when no image was supplied
     * @param metrics            measured metrics, may be null
     * @param analysis           attached analysis, null when analysis was not requested
     * @param processingTimeMs   wall-clock processing time
     * @return the immutable result
     */
    public EnhancementResult aggregate(EnhancementRequest request, ModalityProfile profile, byte[] enhancedImageBytes,
                                       QualityMetrics metrics, AiAnalysis analysis, long processingTimeMs) {
        QualityMetrics reported = metrics;
        if (reported == null || !reported.isValid()) {
            if (reported != null) {
                logger.warn("Discarding invalid metrics {} for {}, using nominal values", reported, profile.getTag());
            }
            reported = profile.nominalMetrics();
        }

        Instant generatedAt = clock.instant();
        String fileName = "enhanced_" + profile.getTag().name().toLowerCase(Locale.ROOT) + "_"
                + FILE_TIMESTAMP.format(generatedAt) + ".png";

        return new EnhancementResult(
                request.getPatientId(),
                request.getPatientName(),
                enhancedImageBytes,
                reported,
                analysis,
                profile.getTag(),
                generatedAt,
                processingTimeMs,
                fileName);
    }
}
