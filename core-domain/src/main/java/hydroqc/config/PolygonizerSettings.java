package hydroqc.config;

import hydroqc.domain.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros de la vectorización de regiones anómalas.
 */
@Value
@Builder
@With
public class PolygonizerSettings {

    @Builder.Default
    double anomalyThreshold = 0.6;

    /**
     * Tamaño mínimo de componente, en píxeles. Por encima de 1 activa además la apertura morfológica.
     */
    @Builder.Default
    int minAreaPixels = 25;

    /**
     * Tolerancia base de simplificación, en grados.
     */
    @Builder.Default
    double simplifyTolerance = 1e-4;

    @Builder.Default
    int maxScanComponents = 2000;

    @Builder.Default
    int maxAnomalies = 2000;

    @Builder.Default
    double highConfidence = 0.8;

    @Builder.Default
    double mediumConfidence = 0.5;

    @Builder.Default
    ClassificationSettings classification = ClassificationSettings.builder().build();

    @Builder.Default
    PrioritySettings priority = PrioritySettings.builder().build();

    public static PolygonizerSettings from(ProcessingConfig config) {
        String prefix = "outputs.polygons.";
        PolygonizerSettings settings = PolygonizerSettings.builder()
                .anomalyThreshold(config.getDouble(prefix + "anomaly_threshold", 0.6))
                .minAreaPixels(config.getInt(prefix + "min_area_pixels", 25))
                .simplifyTolerance(config.getDouble(prefix + "simplify_tolerance", 1e-4))
                .maxScanComponents(config.getInt(prefix + "max_scan_components", 2000))
                .maxAnomalies(config.getInt(prefix + "max_anomalies", 2000))
                .highConfidence(config.getDouble("scoring.confidence_thresholds.high", 0.8))
                .mediumConfidence(config.getDouble("scoring.confidence_thresholds.medium", 0.5))
                .classification(ClassificationSettings.from(config))
                .priority(PrioritySettings.from(config))
                .build();
        settings.validate();
        return settings;
    }

    public void validate() {
        if (!(anomalyThreshold >= 0.0 && anomalyThreshold <= 1.0)) {
            throw new InvalidConfigurationException("anomaly_threshold debe estar en [0, 1]: " + anomalyThreshold);
        }
        if (minAreaPixels < 1) {
            throw new InvalidConfigurationException("min_area_pixels debe ser al menos 1: " + minAreaPixels);
        }
        if (simplifyTolerance < 0.0) {
            throw new InvalidConfigurationException("simplify_tolerance no puede ser negativa: " + simplifyTolerance);
        }
        if (maxScanComponents < 1 || maxAnomalies < 1) {
            throw new InvalidConfigurationException("Los límites de seguridad deben ser positivos.");
        }
        if (mediumConfidence > highConfidence) {
            throw new InvalidConfigurationException("El umbral de confianza media no puede superar al de confianza alta.");
        }
    }
}
