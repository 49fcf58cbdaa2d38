package hydroqc.analysis.feature;

import hydroqc.analysis.ProgressListener;
import hydroqc.config.FeatureSettings;
import hydroqc.domain.feature.FeatureSet;
import hydroqc.domain.feature.FeatureSurface;
import hydroqc.domain.feature.FeatureType;
import hydroqc.domain.grid.DepthGrid;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Calcula las superficies de características de una rejilla de profundidades.
 * <p>
 * <b>Ventanas enmascaradas:</b> las estadísticas locales (media, desviación, z)
 * solo cuentan celdas válidas dentro de la rejilla. Una celda inválida o fuera de
 * borde no aporta al sumatorio ni al denominador. Los momentos se acumulan sobre
 * {@code v − v_centro}, de modo que una superficie constante da dispersión exactamente 0.
 * <p>
 * <b>Núcleos fijos (Sobel, Laplace):</b> bordes reflejados. Un vecino inválido toma
 * el valor de la celda central, así que no introduce diferencia: la ausencia de dato
 * nunca se interpreta como profundidad cero.
 * <p>
 * Todas las superficies valen {@code NaN} exactamente en las celdas inválidas de la rejilla.
 */
@Slf4j
public class FeatureExtractor {

    private static final double MIN_STD = 1e-10;

    private static final int[] SOBEL_SMOOTH = {1, 2, 1};

    private final FeatureSettings settings;

    public FeatureExtractor(FeatureSettings settings) {
        this.settings = Objects.requireNonNull(settings, "La configuración de características no puede ser nula.");
    }

    public FeatureSet extract(DepthGrid grid) {
        return extract(grid, ProgressListener.NONE);
    }

    /**
     * Calcula todas las superficies en orden fijo, notificando el avance.
     *
     * @param grid     Rejilla de entrada.
     * @param progress Receptor de avance (10–55 %).
     * @return Conjunto con las siete superficies.
     */
    public FeatureSet extract(DepthGrid grid, ProgressListener progress) {
        Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        final int width = grid.width();
        final int height = grid.height();
        final double[] depths = grid.depths();
        final boolean[] valid = new boolean[depths.length];
        for (int i = 0; i < depths.length; i++) {
            valid[i] = !Double.isNaN(depths[i]);
        }

        int neighborhood = oddWindow(settings.getNeighborhoodWindow(), "features.neighborhood.window_size");
        int roughnessWindow = oddWindow(settings.getRoughnessWindow(), "features.roughness.window_size");

        Map<FeatureType, FeatureSurface> surfaces = new EnumMap<>(FeatureType.class);

        // 1. Puntuación z local
        progress.onProgress(10, "Computing local z-scores");
        WindowStats neighborStats = windowStats(depths, valid, width, height, neighborhood);
        double[] zScore = new double[depths.length];
        for (int i = 0; i < depths.length; i++) {
            zScore[i] = valid[i]
                    ? (depths[i] - neighborStats.mean[i]) / Math.max(neighborStats.std[i], MIN_STD)
                    : Double.NaN;
        }
        surfaces.put(FeatureType.Z_SCORE, new FeatureSurface(FeatureType.Z_SCORE, width, height, zScore));

        // 2. Pendiente (módulo del gradiente de Sobel)
        progress.onProgress(20, "Computing slope");
        double[] gradX = sobel(depths, valid, width, height, true);
        double[] gradY = sobel(depths, valid, width, height, false);
        double[] slope = new double[depths.length];
        for (int i = 0; i < depths.length; i++) {
            slope[i] = valid[i] ? Math.sqrt(gradX[i] * gradX[i] + gradY[i] * gradY[i]) : Double.NaN;
        }
        surfaces.put(FeatureType.SLOPE, new FeatureSurface(FeatureType.SLOPE, width, height, slope));

        // 3. Curvatura (Sobel aplicado dos veces por eje)
        progress.onProgress(30, "Computing curvature");
        double[] secondX = sobel(gradX, valid, width, height, true);
        double[] secondY = sobel(gradY, valid, width, height, false);
        double[] curvature = new double[depths.length];
        for (int i = 0; i < depths.length; i++) {
            curvature[i] = valid[i] ? (Math.abs(secondX[i]) + Math.abs(secondY[i])) / 2.0 : Double.NaN;
        }
        surfaces.put(FeatureType.CURVATURE, new FeatureSurface(FeatureType.CURVATURE, width, height, curvature));

        // 4. Rugosidad (desviación típica local)
        progress.onProgress(40, "Computing roughness");
        WindowStats roughnessStats = roughnessWindow == neighborhood
                ? neighborStats
                : windowStats(depths, valid, width, height, roughnessWindow);
        surfaces.put(FeatureType.ROUGHNESS, new FeatureSurface(FeatureType.ROUGHNESS, width, height, roughnessStats.std));

        // 5. Laplaciana
        progress.onProgress(50, "Computing Laplacian");
        surfaces.put(FeatureType.LAPLACIAN,
                new FeatureSurface(FeatureType.LAPLACIAN, width, height, laplacian(depths, valid, width, height)));

        // 6. Estadísticas de vecindario
        progress.onProgress(55, "Computing neighborhood statistics");
        surfaces.put(FeatureType.NEIGHBOR_MEAN, new FeatureSurface(FeatureType.NEIGHBOR_MEAN, width, height, neighborStats.mean));
        surfaces.put(FeatureType.NEIGHBOR_STD, new FeatureSurface(FeatureType.NEIGHBOR_STD, width, height, neighborStats.std));

        log.debug("Características calculadas para rejilla {}x{} (ventana {}, rugosidad {}).",
                width, height, neighborhood, roughnessWindow);
        return new FeatureSet(width, height, surfaces);
    }

    private static int oddWindow(int window, String key) {
        if (window % 2 == 0) {
            log.warn("{} = {} es par; se usa {} para mantener la ventana centrada.", key, window, window + 1);
            return window + 1;
        }
        return window;
    }

    // --- Estadísticas de ventana enmascarada ---

    private static final class WindowStats {
        final double[] mean;
        final double[] std;

        WindowStats(double[] mean, double[] std) {
            this.mean = mean;
            this.std = std;
        }
    }

    static WindowStats windowStats(double[] values, boolean[] valid, int width, int height, int window) {
        int half = window / 2;
        double[] mean = new double[values.length];
        double[] std = new double[values.length];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int index = row * width + col;
                if (!valid[index]) {
                    mean[index] = Double.NaN;
                    std[index] = Double.NaN;
                    continue;
                }
                double center = values[index];
                double sum = 0.0;
                double sumSquares = 0.0;
                int count = 0;
                for (int r = Math.max(0, row - half); r <= Math.min(height - 1, row + half); r++) {
                    int base = r * width;
                    for (int c = Math.max(0, col - half); c <= Math.min(width - 1, col + half); c++) {
                        if (valid[base + c]) {
                            double d = values[base + c] - center;
                            sum += d;
                            sumSquares += d * d;
                            count++;
                        }
                    }
                }
                // count >= 1: la propia celda central es válida.
                double meanShift = sum / count;
                double variance = Math.max(sumSquares / count - meanShift * meanShift, 0.0);
                mean[index] = center + meanShift;
                std[index] = Math.sqrt(variance);
            }
        }
        return new WindowStats(mean, std);
    }

    // --- Núcleos fijos ---

    /**
     * Sobel 3×3. {@code alongColumns = true} deriva en la dirección de las columnas (x).
     */
    static double[] sobel(double[] values, boolean[] valid, int width, int height, boolean alongColumns) {
        double[] out = new double[values.length];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int index = row * width + col;
                if (!valid[index]) {
                    out[index] = Double.NaN;
                    continue;
                }
                double center = values[index];
                double acc = 0.0;
                for (int k = -1; k <= 1; k++) {
                    double weight = SOBEL_SMOOTH[k + 1];
                    double forward;
                    double backward;
                    if (alongColumns) {
                        forward = sample(values, valid, width, height, row + k, col + 1, center);
                        backward = sample(values, valid, width, height, row + k, col - 1, center);
                    } else {
                        forward = sample(values, valid, width, height, row + 1, col + k, center);
                        backward = sample(values, valid, width, height, row - 1, col + k, center);
                    }
                    acc += weight * (forward - backward);
                }
                out[index] = acc;
            }
        }
        return out;
    }

    /**
     * Laplaciana discreta de 4 vecinos: Σ (vecino − centro).
     */
    static double[] laplacian(double[] values, boolean[] valid, int width, int height) {
        double[] out = new double[values.length];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int index = row * width + col;
                if (!valid[index]) {
                    out[index] = Double.NaN;
                    continue;
                }
                double center = values[index];
                out[index] = (sample(values, valid, width, height, row - 1, col, center) - center)
                        + (sample(values, valid, width, height, row + 1, col, center) - center)
                        + (sample(values, valid, width, height, row, col - 1, center) - center)
                        + (sample(values, valid, width, height, row, col + 1, center) - center);
            }
        }
        return out;
    }

    // Borde reflejado (d c b a | a b c d); vecino inválido -> valor central.
    private static double sample(double[] values, boolean[] valid, int width, int height, int row, int col, double center) {
        int r = reflect(row, height);
        int c = reflect(col, width);
        int index = r * width + c;
        return valid[index] ? values[index] : center;
    }

    private static int reflect(int i, int size) {
        if (i < 0) {
            return Math.min(-i - 1, size - 1);
        }
        if (i >= size) {
            return Math.max(2 * size - i - 1, 0);
        }
        return i;
    }
}
