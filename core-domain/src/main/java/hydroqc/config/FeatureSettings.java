package hydroqc.config;

import hydroqc.domain.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Value;

/**
 * Tamaños de ventana usados por el extractor de características.
 */
@Value
@Builder
public class FeatureSettings {

    /**
     * Ventana (en celdas) de la puntuación z local y de las estadísticas de vecindario.
     */
    @Builder.Default
    int neighborhoodWindow = 5;

    /**
     * Ventana (en celdas) de la rugosidad (desviación típica local).
     */
    @Builder.Default
    int roughnessWindow = 3;

    public static FeatureSettings from(ProcessingConfig config) {
        FeatureSettings settings = FeatureSettings.builder()
                .neighborhoodWindow(config.getInt("features.neighborhood.window_size", 5))
                .roughnessWindow(config.getInt("features.roughness.window_size", 3))
                .build();
        settings.validate();
        return settings;
    }

    public void validate() {
        if (neighborhoodWindow < 1) {
            throw new InvalidConfigurationException("features.neighborhood.window_size debe ser positivo: " + neighborhoodWindow);
        }
        if (roughnessWindow < 1) {
            throw new InvalidConfigurationException("features.roughness.window_size debe ser positivo: " + roughnessWindow);
        }
    }
}
