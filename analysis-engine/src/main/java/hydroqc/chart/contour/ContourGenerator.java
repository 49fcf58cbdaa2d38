package hydroqc.chart.contour;

import hydroqc.config.ContourSettings;
import hydroqc.domain.chart.ContourLine;
import hydroqc.domain.chart.ContourSet;
import hydroqc.domain.grid.AffineTransform;
import hydroqc.domain.grid.DepthGrid;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Genera isóbatas suavizadas a partir de una rejilla de profundidades.
 * <p>
 * Por nivel: marching squares, descarte de trayectorias con menos de
 * {@code minLength} vértices, suavizado de Chaikin y paso a coordenadas de mundo
 * en el centro de píxel. La conversión a mundo se hace siempre después del suavizado.
 */
@Slf4j
public class ContourGenerator {

    private final ContourSettings settings;
    private final GeometryFactory geometryFactory = new GeometryFactory();

    public ContourGenerator(ContourSettings settings) {
        this.settings = Objects.requireNonNull(settings, "La configuración de isóbatas no puede ser nula.");
        settings.validate();
    }

    public ContourSet generate(DepthGrid grid) {
        return generate(grid, null, null);
    }

    /**
     * @param grid     Rejilla de profundidades.
     * @param minDepth Límite inferior del rango de niveles, o {@code null} para usar el de la rejilla.
     * @param maxDepth Límite superior, o {@code null}.
     * @return Las isóbatas generadas (vacío si la rejilla no tiene celdas válidas).
     */
    public ContourSet generate(DepthGrid grid, Double minDepth, Double maxDepth) {
        Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        double[] depths = grid.depths();

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double d : depths) {
            if (!Double.isNaN(d)) {
                min = Math.min(min, d);
                max = Math.max(max, d);
            }
        }
        if (min > max) {
            log.warn("La rejilla no tiene profundidades válidas; no se generan isóbatas.");
            return new ContourSet(List.of(), settings.getInterval(), settings.getSmoothingIterations());
        }
        if (minDepth != null) {
            min = minDepth;
        }
        if (maxDepth != null) {
            max = maxDepth;
        }
        if (min > max) {
            throw new IllegalArgumentException("Rango de profundidades inválido: [" + min + ", " + max + "]");
        }

        List<Double> levels = ContourLevels.levels(min, max, settings.getInterval(), settings.getMaxLevels());
        log.info("Generando {} niveles de isóbata de {} a {}", levels.size(), min, max);

        MarchingSquares tracer = new MarchingSquares(depths, grid.width(), grid.height());
        List<ContourLine> contours = new ArrayList<>();
        for (int i = 0; i < levels.size(); i++) {
            double level = levels.get(i);
            if (i % 10 == 0) {
                log.debug("Procesando nivel {}/{}: {}", i + 1, levels.size(), level);
            }
            for (List<double[]> path : tracer.trace(level)) {
                if (path.size() < settings.getMinLength()) {
                    continue;
                }
                List<double[]> smoothed = ChaikinSmoother.smooth(path, settings.getSmoothingIterations());
                if (smoothed.size() < 2) {
                    continue;
                }
                // Las muestras de la rejilla representan el centro de cada píxel: se desplazan
                // medio píxel antes de aplicar la transformación de esquinas.
                LineString line = toWorld(smoothed, grid.transform());
                contours.add(new ContourLine(level, line, line.getLength(), ChaikinSmoother.isClosed(smoothed)));
            }
        }
        log.info("Generadas {} isóbatas.", contours.size());
        return new ContourSet(contours, settings.getInterval(), settings.getSmoothingIterations());
    }

    private LineString toWorld(List<double[]> points, AffineTransform transform) {
        Coordinate[] coordinates = new Coordinate[points.size()];
        for (int i = 0; i < points.size(); i++) {
            double[] p = points.get(i);
            coordinates[i] = transform.apply(p[0] + 0.5, p[1] + 0.5);
        }
        return geometryFactory.createLineString(coordinates);
    }
}
