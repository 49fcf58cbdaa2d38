package hydroqc.analysis.polygon;

import hydroqc.config.PrioritySettings;

/**
 * Prioridad de revisión: {@code w₁·p + w₂·min(CV, 1) + w₃·min(área / norma, 1)}.
 * <p>
 * CV es el coeficiente de variación de las profundidades de la región
 * ({@code std / (media|d| + 1e-10)}) y solo cuenta con más de una profundidad válida.
 */
class QcPriorityCalculator {

    private static final double EPSILON = 1e-10;

    private final PrioritySettings settings;

    QcPriorityCalculator(PrioritySettings settings) {
        this.settings = settings;
    }

    double priority(double probability, double area, double[] localDepths) {
        double score = probability * settings.getScoreWeight();

        double depthTerm = 0.0;
        if (localDepths.length > 1) {
            double mean = 0.0;
            double meanAbs = 0.0;
            for (double d : localDepths) {
                mean += d;
                meanAbs += Math.abs(d);
            }
            mean /= localDepths.length;
            meanAbs /= localDepths.length;
            double variance = 0.0;
            for (double d : localDepths) {
                variance += (d - mean) * (d - mean);
            }
            double std = Math.sqrt(variance / localDepths.length);
            depthTerm = Math.min(std / (meanAbs + EPSILON), 1.0) * settings.getDepthVarianceWeight();
        }

        double areaTerm = Math.min(area / settings.getAreaNormalization(), 1.0) * settings.getClusterWeight();
        return score + depthTerm + areaTerm;
    }
}
