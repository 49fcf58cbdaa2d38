package hydroqc.factory;

import hydroqc.config.SyntheticSurveyConfig;
import hydroqc.domain.anomaly.AnomalyType;
import hydroqc.domain.grid.AffineTransform;
import hydroqc.domain.grid.CoordinateReference;
import hydroqc.domain.grid.DepthGrid;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Fábrica de levantamientos batimétricos sintéticos con artefactos conocidos.
 * <p>
 * La superficie base combina tres frecuencias sobre el dominio [0, 4π]²:
 * <pre>
 *   z = base + 5·sin(X/2)·cos(Y/2) + 2·sin(X)·sin(Y) + 0.5·sin(2X)·cos(2Y) + N(0, ruido)
 * </pre>
 * Sobre ella se insertan, en este orden y con la misma secuencia aleatoria:
 * <ol>
 * <li><b>Picos:</b> discos desplazados hacia la superficie (5–15 m).</li>
 * <li><b>Huecos:</b> discos desplazados hacia el fondo (5–15 m).</li>
 * <li><b>Costuras:</b> escalones horizontales o verticales de 1–3 m que afectan a todo
 * lo que queda por debajo (o a la derecha) de la línea.</li>
 * <li><b>Banda de ruido:</b> franja horizontal con ruido gaussiano de σ = 3 m.</li>
 * </ol>
 * Con la misma semilla el resultado es idéntico.
 *
 * @since 0.1.0
 */
@Slf4j
public class SyntheticBathymetryFactory {

    private static final double DOMAIN_EXTENT = 4.0 * Math.PI;

    /**
     * Genera un levantamiento sintético georreferenciado en WGS84.
     *
     * @param config Parámetros del levantamiento.
     * @return La rejilla y la lista de artefactos insertados.
     */
    public SyntheticSurvey createSurvey(SyntheticSurveyConfig config) {
        final int width = config.getWidth();
        final int height = config.getHeight();
        if (width < 4 || height < 4) {
            throw new IllegalArgumentException("El levantamiento sintético necesita al menos 4x4 celdas.");
        }
        Random random = new Random(config.getSeed());

        // 1. Superficie base con ruido
        double[] depths = new double[width * height];
        for (int row = 0; row < height; row++) {
            double y = height == 1 ? 0.0 : DOMAIN_EXTENT * row / (height - 1);
            for (int col = 0; col < width; col++) {
                double x = width == 1 ? 0.0 : DOMAIN_EXTENT * col / (width - 1);
                double surface = Math.sin(x / 2) * Math.cos(y / 2) * 5
                        + Math.sin(x) * Math.sin(y) * 2
                        + Math.sin(x * 2) * Math.cos(y * 2) * 0.5;
                depths[row * width + col] = config.getBaseDepth() + surface
                        + random.nextGaussian() * config.getNoiseLevel();
            }
        }

        List<EmbeddedAnomaly> embedded = new ArrayList<>();
        int marginX = Math.min(50, width / 4);
        int marginY = Math.min(50, height / 4);

        // 2. Picos y huecos
        for (int i = 0; i < config.getSpikeCount(); i++) {
            embedded.add(embedDisk(depths, width, height, random, marginX, marginY, AnomalyType.SPIKE, +1.0));
        }
        for (int i = 0; i < config.getHoleCount(); i++) {
            embedded.add(embedDisk(depths, width, height, random, marginX, marginY, AnomalyType.HOLE, -1.0));
        }

        // 3. Costuras
        int seamMarginX = Math.min(100, width / 4);
        int seamMarginY = Math.min(100, height / 4);
        for (int i = 0; i < config.getSeamCount(); i++) {
            double offset = uniform(random, 1.0, 3.0);
            if (random.nextDouble() > 0.5) {
                int seamRow = randomBetween(random, seamMarginY, height - seamMarginY);
                for (int row = seamRow; row < height; row++) {
                    for (int col = 0; col < width; col++) {
                        depths[row * width + col] += offset;
                    }
                }
                embedded.add(new EmbeddedAnomaly(AnomalyType.SEAM, seamRow, -1, 0, offset));
            } else {
                int seamCol = randomBetween(random, seamMarginX, width - seamMarginX);
                for (int row = 0; row < height; row++) {
                    for (int col = seamCol; col < width; col++) {
                        depths[row * width + col] += offset;
                    }
                }
                embedded.add(new EmbeddedAnomaly(AnomalyType.SEAM, -1, seamCol, 0, offset));
            }
        }

        // 4. Banda de ruido (opcional)
        boolean band = config.getIncludeNoiseBand() != null
                ? config.getIncludeNoiseBand()
                : random.nextDouble() > 0.5;
        if (band) {
            int bandHeight = Math.min(randomBetween(random, 20, 50), Math.max(1, height / 2));
            int bandStart = randomBetween(random, 0, Math.max(1, height - bandHeight));
            for (int row = bandStart; row < bandStart + bandHeight; row++) {
                for (int col = 0; col < width; col++) {
                    depths[row * width + col] += random.nextGaussian() * 3.0;
                }
            }
            embedded.add(new EmbeddedAnomaly(AnomalyType.NOISE_BAND, bandStart, 0, bandHeight, 3.0));
        }

        // 5. Georreferenciación aproximada (metros -> grados)
        double pixelDegrees = config.getResolutionMeters() / config.getMetersPerDegree();
        double maxLat = config.getOriginLatitude() + height * pixelDegrees;
        AffineTransform transform = AffineTransform.northUp(config.getOriginLongitude(), maxLat, pixelDegrees, pixelDegrees);

        DepthGrid grid = new DepthGrid(width, height, depths, transform, CoordinateReference.WGS84, null);
        log.info("Levantamiento sintético generado: {}x{} celdas, {} artefactos insertados (semilla {}).",
                width, height, embedded.size(), config.getSeed());
        return new SyntheticSurvey(grid, embedded);
    }

    private EmbeddedAnomaly embedDisk(double[] depths, int width, int height, Random random,
                                      int marginX, int marginY, AnomalyType type, double sign) {
        int cx = randomBetween(random, marginX, width - marginX);
        int cy = randomBetween(random, marginY, height - marginY);
        int radius = randomBetween(random, 5, 15);
        double magnitude = uniform(random, 5.0, 15.0);
        long radiusSquared = (long) radius * radius;
        for (int row = Math.max(0, cy - radius); row <= Math.min(height - 1, cy + radius); row++) {
            for (int col = Math.max(0, cx - radius); col <= Math.min(width - 1, cx + radius); col++) {
                long dx = col - cx;
                long dy = row - cy;
                if (dx * dx + dy * dy <= radiusSquared) {
                    depths[row * width + col] += sign * magnitude;
                }
            }
        }
        log.debug("Insertado {} en ({}, {}) con radio {} y magnitud {}", type.getCode(), cy, cx, radius, magnitude);
        return new EmbeddedAnomaly(type, cy, cx, radius, magnitude);
    }

    // Entero en [lower, upper); si el rango está vacío devuelve lower.
    private static int randomBetween(Random random, int lower, int upper) {
        if (upper <= lower) {
            return lower;
        }
        return lower + random.nextInt(upper - lower);
    }

    private static double uniform(Random random, double lower, double upper) {
        return lower + (upper - lower) * random.nextDouble();
    }
}
