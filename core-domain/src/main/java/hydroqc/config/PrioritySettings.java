package hydroqc.config;

import lombok.Builder;
import lombok.Value;

/**
 * Pesos de la prioridad de revisión (QC priority).
 */
@Value
@Builder
public class PrioritySettings {

    @Builder.Default
    double scoreWeight = 0.5;

    @Builder.Default
    double depthVarianceWeight = 0.3;

    @Builder.Default
    double clusterWeight = 0.2;

    /**
     * Área (en unidades de la rejilla al cuadrado) que satura el término de tamaño.
     */
    @Builder.Default
    double areaNormalization = 100.0;

    public static PrioritySettings from(ProcessingConfig config) {
        return PrioritySettings.builder()
                .scoreWeight(config.getDouble("scoring.priority.score_weight", 0.5))
                .depthVarianceWeight(config.getDouble("scoring.priority.depth_variance_weight", 0.3))
                .clusterWeight(config.getDouble("scoring.priority.cluster_weight", 0.2))
                .areaNormalization(config.getDouble("scoring.priority.area_normalization", 100.0))
                .build();
    }
}
