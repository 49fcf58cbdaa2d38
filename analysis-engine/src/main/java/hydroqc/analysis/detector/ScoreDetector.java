package hydroqc.analysis.detector;

import hydroqc.domain.anomaly.DetectorKind;
import hydroqc.domain.feature.FeatureSet;
import hydroqc.domain.grid.DepthGrid;

/**
 * Capacidad común de todos los detectores: producir una superficie de puntuación.
 * <p>
 * Contrato de la salida:
 * <ul>
 *     <li>Misma forma que la rejilla ({@code width × height}, por filas).</li>
 *     <li>Valores en [0, 1], mayor = más anómalo.</li>
 *     <li>0 en las celdas inválidas de la rejilla.</li>
 * </ul>
 */
public interface ScoreDetector {

    DetectorKind kind();

    double[] score(DepthGrid grid, FeatureSet features);
}
