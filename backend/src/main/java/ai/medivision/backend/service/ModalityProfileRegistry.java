package ai.medivision.backend.service;

import ai.medivision.backend.model.ModalityProfile;
import ai.medivision.backend.model.ModalityTag;
import ai.medivision.backend.service.imaging.AutoContrastStep;
import ai.medivision.backend.service.imaging.BrightnessStep;
import ai.medivision.backend.service.imaging.ContrastStep;
import ai.medivision.backend.service.imaging.EdgeEnhanceStep;
import ai.medivision.backend.service.imaging.GrayscaleStep;
import ai.medivision.backend.service.imaging.InvertStep;
import ai.medivision.backend.service.imaging.MedianFilterStep;
import ai.medivision.backend.service.imaging.SharpenFilterStep;
import ai.medivision.backend.service.imaging.SharpnessStep;
import ai.medivision.backend.service.imaging.TransformStep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only table of enhancement profiles, one per modality.
 *
 * The chains are data: adding a modality means adding a row here, not a branch in the
 * pipeline. The table is built once and never mutated, so it can be shared by
 * concurrent requests.
 */
@Service
public class ModalityProfileRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ModalityProfileRegistry.class);

    private final Map<ModalityTag, ModalityProfile> profiles;

    public ModalityProfileRegistry() {
        Map<ModalityTag, ModalityProfile> table = new EnumMap<>(ModalityTag.class);

        register(table, ModalityTag.XRAY, 35.2, 0.92,
                new AutoContrastStep(2),
                new InvertStep(),
                new ContrastStep(1.5),
                new SharpnessStep(2.0),
                new SharpenFilterStep());

        register(table, ModalityTag.CT, 36.8, 0.90,
                new GrayscaleStep(),
                new AutoContrastStep(1),
                new ContrastStep(1.4),
                new EdgeEnhanceStep(true),
                new BrightnessStep(1.1));

        register(table, ModalityTag.MRI, 38.5, 0.94,
                new AutoContrastStep(3),
                new ContrastStep(1.6),
                new MedianFilterStep(3),
                new BrightnessStep(1.15),
                new SharpnessStep(1.5));

        register(table, ModalityTag.ULTRASOUND, 33.5, 0.88,
                new MedianFilterStep(5),
                new AutoContrastStep(2),
                new ContrastStep(1.3),
                new SharpnessStep(1.4));

        register(table, ModalityTag.DXA, 34.0, 0.91,
                new GrayscaleStep(),
                new AutoContrastStep(1),
                new ContrastStep(1.7),
                new SharpenFilterStep(),
                new SharpnessStep(2.2));

        register(table, ModalityTag.OTHER, 32.5, 0.88,
                new AutoContrastStep(2),
                new ContrastStep(1.3),
                new SharpnessStep(1.5));

        this.profiles = Collections.unmodifiableMap(table);
        logger.info("Modality profile registry initialized with {} profiles", profiles.size());
    }

    private static void register(Map<ModalityTag, ModalityProfile> table, ModalityTag tag,
                                 double nominalPsnr, double nominalSsim,
                                 TransformStep... steps) {
        table.put(tag, new ModalityProfile(tag, List.of(steps), nominalPsnr, nominalSsim));
    }

    /**
     * Looks up the profile of a modality. Total: a null tag resolves to OTHER.
     *
     * @param tag the modality, may be null
     * @return the profile, never null
     */
    public ModalityProfile resolveProfile(ModalityTag tag) {
        ModalityProfile profile = profiles.get(tag != null ? tag : ModalityTag.OTHER);
        return profile != null ? profile : profiles.get(ModalityTag.OTHER);
    }

    /**
     * Normalizes a free-form modality string and looks up its profile.
     */
    public ModalityProfile resolveProfile(String modality) {
        return resolveProfile(ModalityTag.fromString(modality));
    }
}
