package hydroqc.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros del generador de levantamientos sintéticos.
 * <p>
 * Las profundidades son negativas bajo el nivel del mar, como en los ficheros
 * de muestra; los picos se desplazan hacia cero y los huecos se alejan de él.
 */
@Value
@Builder
@With
public class SyntheticSurveyConfig {

    @Builder.Default
    int width = 500;

    @Builder.Default
    int height = 500;

    /**
     * Resolución nominal en metros por píxel.
     */
    @Builder.Default
    double resolutionMeters = 1.0;

    @Builder.Default
    double baseDepth = -50.0;

    @Builder.Default
    int spikeCount = 5;

    @Builder.Default
    int holeCount = 5;

    @Builder.Default
    int seamCount = 2;

    /**
     * Desviación típica del ruido gaussiano de fondo.
     */
    @Builder.Default
    double noiseLevel = 0.5;

    /**
     * Si es nulo, la banda de ruido se incluye o no de forma aleatoria (50 %).
     */
    Boolean includeNoiseBand;

    @Builder.Default
    long seed = 42L;

    @Builder.Default
    double originLongitude = 138.4;

    @Builder.Default
    double originLatitude = -35.0;

    /**
     * Metros por grado usados para convertir la resolución a grados.
     */
    @Builder.Default
    double metersPerDegree = 111_000.0;
}
