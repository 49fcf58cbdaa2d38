package hydroqc.config;

import hydroqc.domain.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * Configuración completa de la etapa de detección: detectores, pesos de combinación
 * y umbral de anomalía.
 */
@Value
@Builder
@With
public class DetectionSettings {

    public static final double DEFAULT_DETECTOR_WEIGHT = 0.1;

    @Builder.Default
    IsolationForestSettings isolationForest = IsolationForestSettings.builder().build();

    @Builder.Default
    ZScoreSettings zScore = ZScoreSettings.builder().build();

    /**
     * Petición explícita del detector de consistencia espacial (no implementado).
     */
    @Builder.Default
    boolean spatialConsistencyRequested = false;

    /**
     * Pesos por clave de detector ({@code isolation_forest}, {@code zscore}...).
     */
    @Singular
    Map<String, Double> weights;

    /**
     * Peso aplicado a un detector que no aparece en {@link #weights}.
     */
    @Builder.Default
    double defaultWeight = DEFAULT_DETECTOR_WEIGHT;

    /**
     * Probabilidad combinada a partir de la cual una celda es anómala (estrictamente mayor).
     */
    @Builder.Default
    double anomalyThreshold = 0.6;

    public static DetectionSettings from(ProcessingConfig config) {
        DetectionSettings settings = DetectionSettings.builder()
                .isolationForest(IsolationForestSettings.from(config))
                .zScore(ZScoreSettings.from(config))
                .spatialConsistencyRequested(config.getBoolean("anomaly_detection.spatial_consistency.enabled", false))
                .weights(config.getDoubleMap("scoring.weights", Map.of(
                        "isolation_forest", 0.5,
                        "zscore", 0.3,
                        "spatial_consistency", 0.2)))
                .defaultWeight(config.getDouble("scoring.default_weight", DEFAULT_DETECTOR_WEIGHT))
                .anomalyThreshold(config.getDouble("outputs.polygons.anomaly_threshold", 0.6))
                .build();
        settings.validate();
        return settings;
    }

    public void validate() {
        if (!(anomalyThreshold >= 0.0 && anomalyThreshold <= 1.0)) {
            throw new InvalidConfigurationException("anomaly_threshold debe estar en [0, 1]: " + anomalyThreshold);
        }
        if (defaultWeight < 0.0) {
            throw new InvalidConfigurationException("scoring.default_weight no puede ser negativo: " + defaultWeight);
        }
        weights.forEach((key, weight) -> {
            if (weight == null || weight < 0.0 || !Double.isFinite(weight)) {
                throw new InvalidConfigurationException("Peso inválido para el detector '" + key + "': " + weight);
            }
        });
    }

    /**
     * Peso efectivo de un detector.
     */
    public double weightOf(String detectorKey) {
        return weights.getOrDefault(detectorKey, defaultWeight);
    }
}
