package hydroqc.config;

import hydroqc.domain.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros del detector estadístico robusto basado en la puntuación z.
 */
@Value
@Builder
@With
public class ZScoreSettings {

    @Builder.Default
    boolean enabled = true;

    /**
     * Umbral de |z| cuando no se usa la MAD.
     */
    @Builder.Default
    double threshold = 3.0;

    @Builder.Default
    boolean useMad = true;

    /**
     * Umbral de la puntuación z modificada.
     */
    @Builder.Default
    double madThreshold = 3.5;

    /**
     * Factor aplicado a la MAD. 1.0 usa la MAD bruta; 1.4826 la hace consistente
     * con la desviación típica de una normal.
     */
    @Builder.Default
    double madScale = 1.0;

    public static ZScoreSettings from(ProcessingConfig config) {
        String prefix = "anomaly_detection.zscore.";
        ZScoreSettings settings = ZScoreSettings.builder()
                .enabled(config.getBoolean(prefix + "enabled", true))
                .threshold(config.getDouble(prefix + "threshold", 3.0))
                .useMad(config.getBoolean(prefix + "use_mad", true))
                .madThreshold(config.getDouble(prefix + "mad_threshold", 3.5))
                .madScale(config.getDouble(prefix + "mad_scale", 1.0))
                .build();
        settings.validate();
        return settings;
    }

    public void validate() {
        if (!(threshold > 0.0)) {
            throw new InvalidConfigurationException("zscore.threshold debe ser positivo: " + threshold);
        }
        if (!(madThreshold > 0.0)) {
            throw new InvalidConfigurationException("zscore.mad_threshold debe ser positivo: " + madThreshold);
        }
        if (!(madScale > 0.0)) {
            throw new InvalidConfigurationException("zscore.mad_scale debe ser positivo: " + madScale);
        }
    }
}
