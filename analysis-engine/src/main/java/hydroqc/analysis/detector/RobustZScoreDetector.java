package hydroqc.analysis.detector;

import hydroqc.config.ZScoreSettings;
import hydroqc.domain.anomaly.DetectorKind;
import hydroqc.domain.feature.FeatureSet;
import hydroqc.domain.feature.FeatureType;
import hydroqc.domain.grid.DepthGrid;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;
import java.util.Objects;

/**
 * Detector estadístico robusto sobre la superficie de puntuación z local.
 * <p>
 * Con MAD (por defecto): {@code |z − mediana| / (MAD · escala)}, dividido por
 * {@code madThreshold} y saturado en 1. Si la MAD es prácticamente nula se usa
 * directamente {@code |z − mediana|}. Sin MAD: {@code min(|z| / threshold, 1)}.
 */
@Slf4j
public class RobustZScoreDetector implements ScoreDetector {

    private static final double MIN_MAD = 1e-10;

    private final ZScoreSettings settings;

    public RobustZScoreDetector(ZScoreSettings settings) {
        this.settings = Objects.requireNonNull(settings, "La configuración del detector z no puede ser nula.");
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.ZSCORE;
    }

    @Override
    public double[] score(DepthGrid grid, FeatureSet features) {
        double[] z = features.get(FeatureType.Z_SCORE).values();
        double[] result = new double[z.length];

        if (!settings.isUseMad()) {
            for (int i = 0; i < z.length; i++) {
                result[i] = Double.isFinite(z[i]) ? Math.min(Math.abs(z[i]) / settings.getThreshold(), 1.0) : 0.0;
            }
            return result;
        }

        double[] finite = Arrays.stream(z).filter(Double::isFinite).toArray();
        if (finite.length == 0) {
            return result;
        }
        Median median = new Median();
        double center = median.evaluate(finite);
        double[] deviations = new double[finite.length];
        for (int k = 0; k < finite.length; k++) {
            deviations[k] = Math.abs(finite[k] - center);
        }
        double mad = median.evaluate(deviations) * settings.getMadScale();
        boolean degenerate = mad < MIN_MAD;
        if (degenerate) {
            log.debug("MAD prácticamente nula ({}); se usa la desviación absoluta a la mediana.", mad);
        }

        for (int i = 0; i < z.length; i++) {
            if (!Double.isFinite(z[i])) {
                continue;
            }
            double deviation = Math.abs(z[i] - center);
            double modified = degenerate ? deviation : deviation / mad;
            result[i] = Math.min(modified / settings.getMadThreshold(), 1.0);
        }
        return result;
    }
}
