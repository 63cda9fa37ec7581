package ai.medivision.backend.model.dto;

/**
 * DTO representing one image enhancement request, as handed over by the service layer
 * after any transport encoding (e.g. base64) has been removed.
 */
public class EnhancementRequest {

    /**
     * ID of the patient the image belongs to.
     */
    private String patientId;

    /**
     * Display name of the patient, used in the analysis prompt.
     */
    private String patientName;

    /**
     * Free-form modality tag, e.g. "X-Ray" or "ct scan".
     */
    private String modality;

    /**
     * Raw encoded image bytes. May be absent for an analysis-only request.
     */
    private byte[] imageBytes;

    private EnhancementOptions options = EnhancementOptions.defaults();

    /**
     * Default constructor.
     */
    public EnhancementRequest() {
    }

    /**
     * Constructor with all fields.
     *
     * @param patientId   patient ID
     * @param patientName patient display name
     * @param modality    free-form modality tag
     * @param imageBytes  raw image bytes, may be null
     * @param options     pipeline options, defaults when null
     */
    public EnhancementRequest(String patientId, String patientName, String modality,
                              byte[] imageBytes, EnhancementOptions options) {
        this.patientId = patientId;
        this.patientName = patientName;
        this.modality = modality;
        this.imageBytes = imageBytes;
        this.options = options != null ? options : EnhancementOptions.defaults();
    }

    public String getPatientId() {
        return patientId;
    }

    public void setPatientId(String patientId) {
        this.patientId = patientId;
    }

    public String getPatientName() {
        return patientName;
    }

    public void setPatientName(String patientName) {
        this.patientName = patientName;
    }

    public String getModality() {
        return modality;
    }

    public void setModality(String modality) {
        this.modality = modality;
    }

    public byte[] getImageBytes() {
        return imageBytes;
    }

    public void setImageBytes(byte[] imageBytes) {
        this.imageBytes = imageBytes;
    }

    public EnhancementOptions getOptions() {
        return options;
    }

    public void setOptions(EnhancementOptions options) {
        this.options = options != null ? options : EnhancementOptions.defaults();
    }

    public boolean hasImage() {
        return imageBytes != null && imageBytes.length > 0;
    }

    public boolean hasModality() {
        return modality != null && !modality.isBlank();
    }
}
