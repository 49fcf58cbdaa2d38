package hydroqc.chart.sounding;

import hydroqc.config.SoundingSettings;
import hydroqc.domain.chart.SelectionMode;
import hydroqc.domain.chart.SoundingPoint;
import hydroqc.domain.chart.SoundingSet;
import hydroqc.domain.exception.InvalidConfigurationException;
import hydroqc.domain.grid.DepthGrid;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decima una rejilla en sondas representativas para la compilación de cartas.
 * <p>
 * La rejilla se divide en celdas de {@code cellSize} unidades del CRS. En cada celda
 * con profundidades válidas se elige un valor según el modo:
 * <ul>
 *     <li><b>shoal:</b> mínimo |profundidad|, conservando el signo (criterio de seguridad).</li>
 *     <li><b>deep:</b> máximo |profundidad|.</li>
 *     <li><b>representative:</b> mediana.</li>
 * </ul>
 * La sonda se sitúa en el centro del píxel más cercano al valor elegido; los empates
 * se resuelven por el primero en orden de filas.
 */
@Slf4j
public class SoundingSelector {

    private final SoundingSettings settings;

    public SoundingSelector(SoundingSettings settings) {
        this.settings = Objects.requireNonNull(settings, "La configuración de sondas no puede ser nula.");
    }

    public SoundingSet select(DepthGrid grid) {
        return select(grid, settings.getCellSize(), settings.getMode());
    }

    public SoundingSet select(DepthGrid grid, double cellSize, SelectionMode mode) {
        return select(grid, cellSize, mode, null);
    }

    /**
     * Selección con la densidad de la escala de carta más cercana, siempre en modo shoal.
     */
    public SoundingSet selectForScale(DepthGrid grid, int targetScale) {
        if (targetScale <= 0) {
            throw new InvalidConfigurationException("La escala objetivo debe ser positiva: " + targetScale);
        }
        double cellSize = ChartScaleTable.cellSizeFor(targetScale);
        log.debug("Escala 1:{} -> celda de {} m", targetScale, cellSize);
        return select(grid, cellSize, SelectionMode.SHOAL, targetScale);
    }

    private SoundingSet select(DepthGrid grid, double cellSize, SelectionMode mode, Integer targetScale) {
        Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        Objects.requireNonNull(mode, "El modo de selección no puede ser nulo.");
        if (!(cellSize > 0.0)) {
            throw new InvalidConfigurationException("El tamaño de celda debe ser positivo: " + cellSize);
        }

        int cellPixelsX = Math.max(1, (int) Math.floor(cellSize / grid.transform().resolutionX()));
        int cellPixelsY = Math.max(1, (int) Math.floor(cellSize / grid.transform().resolutionY()));
        log.info("Seleccionando sondas ({}): celda {}x{} píxeles sobre rejilla {}x{}",
                mode.getKey(), cellPixelsX, cellPixelsY, grid.width(), grid.height());

        List<SoundingPoint> soundings = new ArrayList<>();
        double[] buffer = new double[cellPixelsX * cellPixelsY];
        for (int rowStart = 0; rowStart < grid.height(); rowStart += cellPixelsY) {
            for (int colStart = 0; colStart < grid.width(); colStart += cellPixelsX) {
                int rowEnd = Math.min(rowStart + cellPixelsY, grid.height());
                int colEnd = Math.min(colStart + cellPixelsX, grid.width());

                // 1. Profundidades válidas de la celda, en orden de filas
                int n = 0;
                for (int r = rowStart; r < rowEnd; r++) {
                    for (int c = colStart; c < colEnd; c++) {
                        if (grid.isValid(r, c)) {
                            buffer[n++] = grid.depthAt(r, c);
                        }
                    }
                }
                if (n == 0) {
                    continue;
                }

                // 2. Valor según el modo
                double selected = switch (mode) {
                    case SHOAL -> extremeByMagnitude(buffer, n, true);
                    case DEEP -> extremeByMagnitude(buffer, n, false);
                    case REPRESENTATIVE -> new Median().evaluate(buffer, 0, n);
                };

                // 3. Píxel más cercano al valor elegido
                int bestRow = -1;
                int bestCol = -1;
                double bestDistance = Double.POSITIVE_INFINITY;
                for (int r = rowStart; r < rowEnd; r++) {
                    for (int c = colStart; c < colEnd; c++) {
                        if (!grid.isValid(r, c)) {
                            continue;
                        }
                        double distance = Math.abs(grid.depthAt(r, c) - selected);
                        if (distance < bestDistance) {
                            bestDistance = distance;
                            bestRow = r;
                            bestCol = c;
                        }
                    }
                }

                Coordinate center = grid.transform().pixelCenter(bestCol, bestRow);
                soundings.add(new SoundingPoint(center.x, center.y, selected, mode,
                        rowStart / cellPixelsY, colStart / cellPixelsX));
            }
        }
        log.info("Seleccionadas {} sondas.", soundings.size());
        return new SoundingSet(soundings, cellSize, mode, targetScale);
    }

    private static double extremeByMagnitude(double[] values, int n, boolean smallest) {
        double best = values[0];
        for (int i = 1; i < n; i++) {
            double candidate = Math.abs(values[i]);
            double current = Math.abs(best);
            if (smallest ? candidate < current : candidate > current) {
                best = values[i];
            }
        }
        return best;
    }
}
