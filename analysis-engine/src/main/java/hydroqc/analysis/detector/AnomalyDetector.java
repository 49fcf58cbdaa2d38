package hydroqc.analysis.detector;

import hydroqc.analysis.ProgressListener;
import hydroqc.config.DetectionSettings;
import hydroqc.domain.anomaly.DetectionResult;
import hydroqc.domain.anomaly.DetectorKind;
import hydroqc.domain.feature.FeatureSet;
import hydroqc.domain.grid.DepthGrid;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ejecuta los detectores habilitados y combina sus puntuaciones.
 * <p>
 * <b>Combinación:</b> {@code combinada = Σ wᵢ·sᵢ / Σ wᵢ} sobre los detectores que
 * realmente se ejecutaron. Un detector sin peso configurado usa el peso por defecto.
 * Si la suma de pesos es 0, la superficie combinada es 0 en todas las celdas válidas.
 * <p>
 * La consistencia espacial forma parte de los pesos por defecto pero no tiene
 * implementación: si se pide explícitamente se avisa y su peso queda fuera del
 * denominador.
 */
@Slf4j
public class AnomalyDetector {

    private final DetectionSettings settings;
    private final List<ScoreDetector> detectors;

    /**
     * Crea el detector con los detectores que habilita la configuración.
     */
    public AnomalyDetector(DetectionSettings settings) {
        this(settings, defaultDetectors(settings));
    }

    /**
     * Crea el detector con una lista explícita de detectores (en orden de ejecución).
     */
    public AnomalyDetector(DetectionSettings settings, List<ScoreDetector> detectors) {
        this.settings = Objects.requireNonNull(settings, "La configuración de detección no puede ser nula.");
        this.detectors = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(detectors, "La lista de detectores no puede ser nula.")));
    }

    private static List<ScoreDetector> defaultDetectors(DetectionSettings settings) {
        List<ScoreDetector> list = new ArrayList<>();
        if (settings.getIsolationForest().isEnabled()) {
            list.add(new IsolationForestDetector(settings.getIsolationForest()));
        }
        if (settings.getZScore().isEnabled()) {
            list.add(new RobustZScoreDetector(settings.getZScore()));
        }
        return list;
    }

    public List<ScoreDetector> getDetectors() {
        return detectors;
    }

    public DetectionResult detect(DepthGrid grid, FeatureSet features) {
        return detect(grid, features, ProgressListener.NONE);
    }

    /**
     * Ejecuta todos los detectores y construye el resultado combinado.
     *
     * @param grid     Rejilla de profundidades.
     * @param features Superficies de características de la misma rejilla.
     * @param progress Receptor de avance (60–80 %).
     * @return Superficies por detector, combinada y máscara.
     */
    public DetectionResult detect(DepthGrid grid, FeatureSet features, ProgressListener progress) {
        Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        Objects.requireNonNull(features, "Las características no pueden ser nulas.");
        if (features.getWidth() != grid.width() || features.getHeight() != grid.height()) {
            throw new IllegalArgumentException("Las características no tienen la forma de la rejilla.");
        }
        final int cells = grid.cellCount();

        // 1. Detectores individuales
        Map<DetectorKind, double[]> scores = new EnumMap<>(DetectorKind.class);
        for (ScoreDetector detector : detectors) {
            progress.onProgress(progressFor(detector.kind()), stepFor(detector.kind()));
            double[] raw = detector.score(grid, features);
            scores.put(detector.kind(), sanitize(raw, grid, detector.kind()));
        }
        if (settings.isSpatialConsistencyRequested() && !scores.containsKey(DetectorKind.SPATIAL_CONSISTENCY)) {
            log.warn("El detector de consistencia espacial está habilitado pero no implementado; su peso ({}) se excluye de la combinación.",
                    settings.weightOf(DetectorKind.SPATIAL_CONSISTENCY.getKey()));
        }

        // 2. Combinación ponderada
        progress.onProgress(80, "Combining detector scores");
        double[] combined = new double[cells];
        double totalWeight = 0.0;
        for (Map.Entry<DetectorKind, double[]> entry : scores.entrySet()) {
            double weight = settings.weightOf(entry.getKey().getKey());
            double[] values = entry.getValue();
            for (int i = 0; i < cells; i++) {
                combined[i] += weight * values[i];
            }
            totalWeight += weight;
        }
        if (totalWeight <= 0.0 && !scores.isEmpty()) {
            log.warn("La suma de pesos de los detectores es 0; la probabilidad combinada será 0.");
        }
        for (int i = 0; i < cells; i++) {
            if (!grid.isValidIndex(i)) {
                combined[i] = Double.NaN;
            } else if (totalWeight > 0.0) {
                combined[i] = Math.min(1.0, Math.max(0.0, combined[i] / totalWeight));
            } else {
                combined[i] = 0.0;
            }
        }

        DetectionResult result = new DetectionResult(grid.width(), grid.height(), scores, combined,
                settings.getAnomalyThreshold());
        log.info("Detección completada: {} detectores, {} celdas sobre el umbral {}.",
                scores.size(), result.anomalousCellCount(), settings.getAnomalyThreshold());
        return result;
    }

    // Fuerza el contrato de salida: forma correcta, [0,1], 0 en celdas inválidas.
    private static double[] sanitize(double[] raw, DepthGrid grid, DetectorKind kind) {
        if (raw == null || raw.length != grid.cellCount()) {
            throw new IllegalStateException("El detector " + kind.getKey() + " devolvió una superficie con forma incorrecta.");
        }
        double[] clean = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            double v = raw[i];
            clean[i] = (!grid.isValidIndex(i) || Double.isNaN(v)) ? 0.0 : Math.min(1.0, Math.max(0.0, v));
        }
        return clean;
    }

    private static int progressFor(DetectorKind kind) {
        return switch (kind) {
            case ISOLATION_FOREST -> 60;
            case ZSCORE -> 70;
            default -> 75;
        };
    }

    private static String stepFor(DetectorKind kind) {
        return switch (kind) {
            case ISOLATION_FOREST -> "Running Isolation Forest";
            case ZSCORE -> "Running Z-score detector";
            default -> "Running " + kind.getKey() + " detector";
        };
    }
}
