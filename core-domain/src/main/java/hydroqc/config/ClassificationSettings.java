package hydroqc.config;

import hydroqc.domain.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Value;

/**
 * Razones de la heurística de tipificación de anomalías.
 * <p>
 * Se comparan contra la mediana global de profundidad, por lo que asumen
 * profundidades positivas hacia abajo.
 */
@Value
@Builder
public class ClassificationSettings {

    /**
     * Media local mayor que {@code spikeRatio × mediana} ⇒ pico.
     */
    @Builder.Default
    double spikeRatio = 1.5;

    /**
     * Media local menor que {@code holeRatio × mediana} ⇒ hueco.
     */
    @Builder.Default
    double holeRatio = 0.6;

    /**
     * Puntuación media del bosque de aislamiento por encima de la cual se etiqueta banda de ruido.
     */
    @Builder.Default
    double noiseBandScore = 0.8;

    public static ClassificationSettings from(ProcessingConfig config) {
        ClassificationSettings settings = ClassificationSettings.builder()
                .spikeRatio(config.getDouble("classification.spike_ratio", 1.5))
                .holeRatio(config.getDouble("classification.hole_ratio", 0.6))
                .noiseBandScore(config.getDouble("classification.noise_band_score", 0.8))
                .build();
        if (settings.holeRatio > settings.spikeRatio) {
            throw new InvalidConfigurationException("classification.hole_ratio no puede superar a spike_ratio.");
        }
        return settings;
    }
}
