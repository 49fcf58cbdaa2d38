package hydroqc.analysis.polygon;

import hydroqc.analysis.ProgressListener;
import hydroqc.config.PolygonizerSettings;
import hydroqc.domain.anomaly.Anomaly;
import hydroqc.domain.anomaly.AnomalyType;
import hydroqc.domain.anomaly.ConfidenceLevel;
import hydroqc.domain.anomaly.DetectionResult;
import hydroqc.domain.anomaly.DetectorKind;
import hydroqc.domain.anomaly.ReviewDecision;
import hydroqc.domain.grid.AffineTransform;
import hydroqc.domain.grid.CoordinateReference;
import hydroqc.domain.grid.DepthGrid;
import hydroqc.geo.CrsTransformer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Pruebas unitarias para {@link AnomalyPolygonizer} sobre resultados de detección sintéticos.
 */
class AnomalyPolygonizerTest {

    private static final int SIZE = 50;

    private double[] depths;
    private double[] scores;

    @BeforeEach
    void setUp() {
        depths = new double[SIZE * SIZE];
        Arrays.fill(depths, 50.0);
        scores = new double[SIZE * SIZE];
    }

    // --- Utilidades ---

    private void fillBlock(double[] target, int row0, int col0, int rows, int cols, double value) {
        for (int r = row0; r < row0 + rows; r++) {
            for (int c = col0; c < col0 + cols; c++) {
                target[r * SIZE + c] = value;
            }
        }
    }

    private DepthGrid grid() {
        return new DepthGrid(SIZE, SIZE, depths, null, null, null);
    }

    private DetectionResult detection() {
        return new DetectionResult(SIZE, SIZE, Map.of(DetectorKind.ZSCORE, scores), scores, 0.6);
    }

    private static Supplier<UUID> fixedIds() {
        Iterator<UUID> ids = List.of(
                UUID.fromString("00000000-0000-0000-0000-000000000001"),
                UUID.fromString("00000000-0000-0000-0000-000000000002"),
                UUID.fromString("00000000-0000-0000-0000-000000000003"),
                UUID.fromString("00000000-0000-0000-0000-000000000004"),
                UUID.fromString("00000000-0000-0000-0000-000000000005")).iterator();
        return ids::next;
    }

    private static AnomalyPolygonizer polygonizer(PolygonizerSettings settings) {
        return new AnomalyPolygonizer(settings, new CrsTransformer(), fixedIds());
    }

    // --- Pruebas ---

    @Test
    @DisplayName("Un bloque sobre el umbral debería producir una anomalía con sus atributos")
    void polygonize_singleBlock_shouldProduceOneAnomaly() {
        // --- 1. Arrange ---
        fillBlock(scores, 10, 10, 10, 10, 0.9);
        AnomalyPolygonizer polygonizer = polygonizer(PolygonizerSettings.builder().build());

        // --- 2. Act ---
        List<Anomaly> anomalies = polygonizer.polygonize(grid(), detection());

        // --- 3. Assert ---
        assertEquals(1, anomalies.size());
        Anomaly anomaly = anomalies.get(0);
        assertEquals(UUID.fromString("00000000-0000-0000-0000-000000000001"), anomaly.getId());
        assertEquals(100, anomaly.getPixelCount());
        assertEquals(100.0, anomaly.getAreaSqMeters(), 1e-9);
        assertEquals(100.0, anomaly.getGeometry().getArea(), 1e-9);
        // Transformación unitaria norte-arriba: x = columna, y = -fila.
        assertEquals(15.0, anomaly.getCentroidX(), 1e-9);
        assertEquals(-15.0, anomaly.getCentroidY(), 1e-9);
        assertEquals(0.9, anomaly.getProbability(), 1e-12);
        assertEquals(ConfidenceLevel.HIGH, anomaly.getConfidence());
        // 0.5 * 0.9 + 0 (profundidad constante) + 0.2 * min(100 / 100, 1)
        assertEquals(0.65, anomaly.getQcPriority(), 1e-12);
        assertEquals(50.0, anomaly.getLocalDepthMean(), 1e-12);
        assertEquals(0.0, anomaly.getLocalDepthStd(), 1e-12);
        assertEquals(AnomalyType.UNKNOWN, anomaly.getType());
        assertEquals(ReviewDecision.PENDING, anomaly.getReviewDecision());

        assertEquals(DetectorKind.ZSCORE.getReason(), anomaly.getExplanation().primaryReason());
        assertThat(anomaly.getExplanation().triggered()).containsExactly("zscore");
        assertEquals(0.9, anomaly.getExplanation().detectorScores().get("zscore"), 1e-12);
        assertEquals(0.6, anomaly.getExplanation().thresholds().get("anomaly_threshold"), 1e-12);
        assertEquals(100, anomaly.getExplanation().pixelCount());
    }

    @Test
    @DisplayName("Una región menos profunda que la mediana debería tipificarse como pico y una más profunda como hueco")
    void polygonize_depthContrast_shouldClassifySpikeAndHole() {
        // --- 1. Arrange ---
        fillBlock(scores, 5, 5, 6, 6, 0.9);
        fillBlock(depths, 5, 5, 6, 6, 100.0);
        fillBlock(scores, 30, 30, 6, 6, 0.9);
        fillBlock(depths, 30, 30, 6, 6, 10.0);
        AnomalyPolygonizer polygonizer = polygonizer(PolygonizerSettings.builder().build());

        // --- 2. Act ---
        List<Anomaly> anomalies = polygonizer.polygonize(grid(), detection());

        // --- 3. Assert ---
        assertThat(anomalies).extracting(Anomaly::getType)
                .containsExactlyInAnyOrder(AnomalyType.SPIKE, AnomalyType.HOLE);
    }

    @Test
    @DisplayName("La apertura y el área mínima deberían descartar píxeles sueltos y regiones pequeñas")
    void polygonize_smallRegions_shouldBeDiscarded() {
        // --- 1. Arrange ---
        scores[2 * SIZE + 2] = 0.95;
        fillBlock(scores, 20, 20, 4, 4, 0.95);
        AnomalyPolygonizer polygonizer = polygonizer(PolygonizerSettings.builder().minAreaPixels(25).build());

        // --- 2. Act ---
        List<Anomaly> anomalies = polygonizer.polygonize(grid(), detection());

        // --- 3. Assert ---
        assertThat(anomalies).isEmpty();
    }

    @Test
    @DisplayName("Con área mínima 1 debería conservar cada píxel aislado")
    void polygonize_minAreaOne_shouldKeepSinglePixels() {
        scores[2 * SIZE + 2] = 0.95;
        scores[40 * SIZE + 40] = 0.7;

        List<Anomaly> anomalies = polygonizer(PolygonizerSettings.builder().minAreaPixels(1).build())
                .polygonize(grid(), detection());

        assertEquals(2, anomalies.size());
        assertThat(anomalies).allSatisfy(a -> assertEquals(1, a.getPixelCount()));
    }

    @Test
    @DisplayName("Debería ordenar las anomalías por prioridad descendente")
    void polygonize_shouldSortByPriorityDescending() {
        // --- 1. Arrange ---
        fillBlock(scores, 5, 5, 6, 6, 0.7);
        fillBlock(scores, 30, 30, 6, 6, 0.95);
        AnomalyPolygonizer polygonizer = polygonizer(PolygonizerSettings.builder().build());

        // --- 2. Act ---
        List<Anomaly> anomalies = polygonizer.polygonize(grid(), detection());

        // --- 3. Assert ---
        assertEquals(2, anomalies.size());
        assertEquals(0.95, anomalies.get(0).getProbability(), 1e-12);
        assertEquals(0.7, anomalies.get(1).getProbability(), 1e-12);
        assertTrue(anomalies.get(0).getQcPriority() > anomalies.get(1).getQcPriority());
        assertEquals(ConfidenceLevel.MEDIUM, anomalies.get(1).getConfidence());
    }

    @Test
    @DisplayName("El límite de anomalías debería truncar exactamente la salida")
    void polygonize_maxAnomalies_shouldTruncate() {
        for (int k = 0; k < 10; k++) {
            scores[(3 * k + 1) * SIZE + 1] = 0.9;
        }
        PolygonizerSettings settings = PolygonizerSettings.builder().minAreaPixels(1).maxAnomalies(3).build();

        List<Anomaly> anomalies = polygonizer(settings).polygonize(grid(), detection());

        assertEquals(3, anomalies.size());
    }

    @Test
    @DisplayName("El límite de componentes examinadas debería detener el recorrido")
    void polygonize_maxScanComponents_shouldStopScanning() {
        for (int k = 0; k < 10; k++) {
            scores[(3 * k + 1) * SIZE + 1] = 0.9;
        }
        PolygonizerSettings settings = PolygonizerSettings.builder().minAreaPixels(1).maxScanComponents(4).build();

        List<Anomaly> anomalies = polygonizer(settings).polygonize(grid(), detection());

        assertEquals(4, anomalies.size());
    }

    @Test
    @DisplayName("Sin celdas sobre el umbral no debería emitir anomalías")
    void polygonize_belowThreshold_shouldReturnEmpty() {
        fillBlock(scores, 10, 10, 10, 10, 0.6);

        List<Anomaly> anomalies = polygonizer(PolygonizerSettings.builder().build()).polygonize(grid(), detection());

        assertThat(anomalies).isEmpty();
    }

    @Test
    @DisplayName("Las celdas inválidas no deberían entrar en ninguna región")
    void polygonize_invalidCells_shouldBeExcluded() {
        fillBlock(scores, 10, 10, 10, 10, 0.9);
        fillBlock(depths, 10, 10, 10, 5, Double.NaN);

        List<Anomaly> anomalies = polygonizer(PolygonizerSettings.builder().build()).polygonize(grid(), detection());

        assertEquals(1, anomalies.size());
        assertEquals(50, anomalies.get(0).getPixelCount());
    }

    @Test
    @DisplayName("Una rejilla proyectada debería reproyectar la geometría a grados")
    void polygonize_projectedGrid_shouldReprojectToWgs84() {
        // --- 1. Arrange ---
        fillBlock(scores, 10, 10, 10, 10, 0.9);
        DepthGrid projected = new DepthGrid(SIZE, SIZE, depths,
                AffineTransform.northUp(500000.0, 6100000.0, 10.0, 10.0),
                CoordinateReference.projected(32754), null);

        // --- 2. Act ---
        List<Anomaly> anomalies = polygonizer(PolygonizerSettings.builder().build()).polygonize(projected, detection());

        // --- 3. Assert ---
        assertEquals(1, anomalies.size());
        Anomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getCentroidX()).isBetween(140.5, 141.5);
        assertThat(anomaly.getCentroidY()).isBetween(-35.8, -34.6);
        assertEquals(10000.0, anomaly.getAreaSqMeters(), 1e-6, "El área se calcula en el CRS de origen.");
    }

    @Test
    @DisplayName("Debería notificar la etapa de poligonización")
    void polygonize_shouldReportProgress() {
        ProgressListener listener = mock(ProgressListener.class);

        polygonizer(PolygonizerSettings.builder().build())
                .polygonize(grid(), detection(), Map.of("anomaly_threshold", 0.6), listener);

        verify(listener).onProgress(90, "Creating anomaly polygons");
    }

    @Test
    @DisplayName("Un resultado de detección de otra forma debería rechazarse")
    void polygonize_shapeMismatch_shouldThrow() {
        DetectionResult other = new DetectionResult(2, 2, Map.of(), new double[4], 0.6);

        assertThrows(IllegalArgumentException.class,
                () -> polygonizer(PolygonizerSettings.builder().build()).polygonize(grid(), other));
    }
}
