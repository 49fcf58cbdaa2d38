package hydroqc.analysis.detector;

import hydroqc.config.IsolationForestSettings;
import hydroqc.domain.anomaly.DetectorKind;
import hydroqc.domain.feature.FeatureSet;
import hydroqc.domain.feature.FeatureType;
import hydroqc.domain.grid.DepthGrid;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Detector multivariante basado en {@link IsolationForest}.
 * <p>
 * La matriz de entrada tiene una fila por celda válida y como columnas
 * {@link FeatureType#ISOLATION_INPUTS}. Los valores no finitos se sustituyen
 * (NaN → 0, ±∞ → ±máximo representable). El bosque se entrena y evalúa sobre la
 * misma matriz; la decisión se invierte y se normaliza min-max a [0, 1].
 */
@Slf4j
public class IsolationForestDetector implements ScoreDetector {

    private static final double NORMALIZATION_EPSILON = 1e-10;

    private final IsolationForestSettings settings;

    public IsolationForestDetector(IsolationForestSettings settings) {
        this.settings = Objects.requireNonNull(settings, "La configuración del bosque no puede ser nula.");
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.ISOLATION_FOREST;
    }

    @Override
    public double[] score(DepthGrid grid, FeatureSet features) {
        final int cells = grid.cellCount();
        double[] result = new double[cells];
        int validCount = grid.validCount();
        if (validCount == 0) {
            log.debug("Sin celdas válidas: el bosque de aislamiento devuelve ceros.");
            return result;
        }

        // 1. Matriz de características de las celdas válidas
        FeatureType[] columns = FeatureType.ISOLATION_INPUTS.toArray(new FeatureType[0]);
        double[][] columnValues = new double[columns.length][];
        for (int f = 0; f < columns.length; f++) {
            columnValues[f] = features.get(columns[f]).values();
        }
        int[] cellOfRow = new int[validCount];
        double[][] matrix = new double[validCount][columns.length];
        int row = 0;
        for (int i = 0; i < cells; i++) {
            if (!grid.isValidIndex(i)) {
                continue;
            }
            cellOfRow[row] = i;
            for (int f = 0; f < columns.length; f++) {
                matrix[row][f] = finite(columnValues[f][i]);
            }
            row++;
        }

        // 2. Entrenamiento y decisión (mayor = más anómalo)
        IsolationForest forest = IsolationForest.fit(matrix, settings);
        double[] decision = forest.decisionFunction(matrix);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int k = 0; k < decision.length; k++) {
            decision[k] = -decision[k];
            min = Math.min(min, decision[k]);
            max = Math.max(max, decision[k]);
        }

        // 3. Normalización min-max y dispersión a la rejilla
        double range = max - min + NORMALIZATION_EPSILON;
        for (int k = 0; k < decision.length; k++) {
            result[cellOfRow[k]] = (decision[k] - min) / range;
        }
        log.debug("Bosque de aislamiento evaluado sobre {} celdas (desplazamiento {}).", validCount, forest.getOffset());
        return result;
    }

    private static double finite(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        if (value == Double.POSITIVE_INFINITY) {
            return Double.MAX_VALUE;
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return -Double.MAX_VALUE;
        }
        return value;
    }
}
