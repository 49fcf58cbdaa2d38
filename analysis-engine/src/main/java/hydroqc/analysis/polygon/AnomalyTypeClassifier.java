package hydroqc.analysis.polygon;

import hydroqc.config.ClassificationSettings;
import hydroqc.domain.anomaly.AnomalyType;

/**
 * Heurística de tipificación por comparación con la mediana global de profundidad.
 */
class AnomalyTypeClassifier {

    private final ClassificationSettings settings;

    AnomalyTypeClassifier(ClassificationSettings settings) {
        this.settings = settings;
    }

    /**
     * @param localDepthMean      Media de las profundidades válidas de la región, o {@code null}.
     * @param globalMedian        Mediana de las profundidades válidas de la rejilla.
     * @param isolationForestMean Puntuación media del bosque de aislamiento en la región (0 si no se ejecutó).
     */
    AnomalyType classify(Double localDepthMean, double globalMedian, double isolationForestMean) {
        if (localDepthMean == null || Double.isNaN(globalMedian)) {
            return AnomalyType.UNKNOWN;
        }
        if (localDepthMean > globalMedian * settings.getSpikeRatio()) {
            return AnomalyType.SPIKE;
        }
        if (localDepthMean < globalMedian * settings.getHoleRatio()) {
            return AnomalyType.HOLE;
        }
        if (isolationForestMean > settings.getNoiseBandScore()) {
            return AnomalyType.NOISE_BAND;
        }
        return AnomalyType.UNKNOWN;
    }
}
