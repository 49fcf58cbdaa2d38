package hydroqc.config;

import hydroqc.domain.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros del generador de isóbatas.
 */
@Value
@Builder
@With
public class ContourSettings {

    /**
     * Separación entre niveles, en unidades de profundidad.
     */
    @Builder.Default
    double interval = 5.0;

    @Builder.Default
    int smoothingIterations = 3;

    /**
     * Número mínimo de vértices de una línea antes del suavizado.
     */
    @Builder.Default
    int minLength = 10;

    @Builder.Default
    int maxLevels = 50;

    public static ContourSettings from(ProcessingConfig config) {
        ContourSettings settings = ContourSettings.builder()
                .interval(config.getDouble("contours.interval", 5.0))
                .smoothingIterations(config.getInt("contours.smoothing_iterations", 3))
                .minLength(config.getInt("contours.min_length", 10))
                .maxLevels(config.getInt("contours.max_levels", 50))
                .build();
        settings.validate();
        return settings;
    }

    public void validate() {
        if (!(interval > 0.0)) {
            throw new InvalidConfigurationException("El intervalo de isóbatas debe ser positivo: " + interval);
        }
        if (smoothingIterations < 0) {
            throw new InvalidConfigurationException("smoothing_iterations no puede ser negativo: " + smoothingIterations);
        }
        if (minLength < 2) {
            throw new InvalidConfigurationException("min_length debe ser al menos 2: " + minLength);
        }
        if (maxLevels < 2) {
            throw new InvalidConfigurationException("max_levels debe ser al menos 2: " + maxLevels);
        }
    }
}
