package hydroqc.domain.anomaly;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Salida de la etapa de detección.
 * <ul>
 *     <li>Una superficie [0,1] por detector ejecutado (0 en celdas inválidas).</li>
 *     <li>La probabilidad combinada: [0,1] en celdas válidas, {@code NaN} en inválidas.</li>
 *     <li>La máscara binaria {@code combinada > umbral}, siempre falsa en celdas inválidas.</li>
 * </ul>
 */
public final class DetectionResult {

    private final int width;
    private final int height;
    private final Map<DetectorKind, double[]> detectorScores;
    private final double[] combined;
    private final boolean[] mask;
    private final double threshold;

    public DetectionResult(int width, int height, Map<DetectorKind, double[]> detectorScores,
                           double[] combined, double threshold) {
        Objects.requireNonNull(detectorScores, "Las puntuaciones por detector no pueden ser nulas.");
        Objects.requireNonNull(combined, "La superficie combinada no puede ser nula.");
        int cells = width * height;
        if (combined.length != cells) {
            throw new IllegalArgumentException("La superficie combinada no tiene la forma " + width + "x" + height);
        }
        EnumMap<DetectorKind, double[]> copy = new EnumMap<>(DetectorKind.class);
        detectorScores.forEach((kind, scores) -> {
            if (scores.length != cells) {
                throw new IllegalArgumentException("La superficie de " + kind.getKey() + " no tiene la forma de la rejilla.");
            }
            copy.put(kind, scores.clone());
        });
        this.width = width;
        this.height = height;
        this.detectorScores = copy;
        this.combined = combined.clone();
        this.threshold = threshold;
        this.mask = new boolean[cells];
        for (int i = 0; i < cells; i++) {
            // NaN > x es falso: las celdas inválidas nunca entran en la máscara.
            this.mask[i] = this.combined[i] > threshold;
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double getThreshold() {
        return threshold;
    }

    public Set<DetectorKind> detectors() {
        return Collections.unmodifiableSet(detectorScores.keySet());
    }

    public double[] scores(DetectorKind kind) {
        double[] scores = detectorScores.get(kind);
        if (scores == null) {
            throw new IllegalStateException("El detector " + kind.getKey() + " no se ejecutó.");
        }
        return scores.clone();
    }

    public double scoreAt(DetectorKind kind, int index) {
        double[] scores = detectorScores.get(kind);
        return scores == null ? 0.0 : scores[index];
    }

    public double[] combined() {
        return combined.clone();
    }

    public double combinedAt(int index) {
        return combined[index];
    }

    public boolean[] mask() {
        return mask.clone();
    }

    public int anomalousCellCount() {
        int count = 0;
        for (boolean flagged : mask) {
            if (flagged) {
                count++;
            }
        }
        return count;
    }
}
