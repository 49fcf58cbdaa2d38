package hydroqc.analysis.detector;

import hydroqc.analysis.ProgressListener;
import hydroqc.config.DetectionSettings;
import hydroqc.config.IsolationForestSettings;
import hydroqc.config.ZScoreSettings;
import hydroqc.domain.anomaly.DetectionResult;
import hydroqc.domain.anomaly.DetectorKind;
import hydroqc.domain.feature.FeatureSet;
import hydroqc.domain.grid.DepthGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Pruebas unitarias para {@link AnomalyDetector}, con detectores simulados.
 */
@ExtendWith(MockitoExtension.class)
class AnomalyDetectorTest {

    @Mock
    private ScoreDetector forestDetector;

    @Mock
    private ScoreDetector zScoreDetector;

    private DepthGrid grid;
    private FeatureSet features;

    @BeforeEach
    void setUp() {
        // La última celda es inválida.
        grid = new DepthGrid(2, 2, new double[]{10.0, 11.0, 12.0, Double.NaN}, null, null, null);
        features = new FeatureSet(2, 2, Map.of());
        lenient().when(forestDetector.kind()).thenReturn(DetectorKind.ISOLATION_FOREST);
        lenient().when(zScoreDetector.kind()).thenReturn(DetectorKind.ZSCORE);
    }

    private static DetectionSettings weighted(double forestWeight, double zScoreWeight) {
        return DetectionSettings.builder()
                .weight("isolation_forest", forestWeight)
                .weight("zscore", zScoreWeight)
                .build();
    }

    @Test
    @DisplayName("Debería combinar las puntuaciones con la media ponderada normalizada")
    void detect_shouldCombineWithWeightedMean() {
        // --- 1. Arrange ---
        when(forestDetector.score(grid, features)).thenReturn(new double[]{1.0, 0.0, 0.5, 0.9});
        when(zScoreDetector.score(grid, features)).thenReturn(new double[]{0.0, 1.0, 0.5, 0.9});
        AnomalyDetector detector = new AnomalyDetector(weighted(0.5, 0.3), List.of(forestDetector, zScoreDetector));

        // --- 2. Act ---
        DetectionResult result = detector.detect(grid, features);

        // --- 3. Assert ---
        double[] combined = result.combined();
        assertEquals(0.625, combined[0], 1e-12);
        assertEquals(0.375, combined[1], 1e-12);
        assertEquals(0.5, combined[2], 1e-12);
        assertTrue(Double.isNaN(combined[3]), "Las celdas inválidas deben quedar como NaN.");

        assertArrayEquals(new boolean[]{true, false, false, false}, result.mask());
        assertEquals(0.0, result.scoreAt(DetectorKind.ISOLATION_FOREST, 3),
                "Las puntuaciones por detector deben ser 0 en celdas inválidas.");
        assertThat(result.detectors()).containsExactlyInAnyOrder(DetectorKind.ISOLATION_FOREST, DetectorKind.ZSCORE);
    }

    @Test
    @DisplayName("Con suma de pesos nula la probabilidad combinada debería ser 0")
    void detect_zeroWeights_shouldProduceZeroProbability() {
        // --- 1. Arrange ---
        when(forestDetector.score(grid, features)).thenReturn(new double[]{1.0, 1.0, 1.0, 1.0});
        when(zScoreDetector.score(grid, features)).thenReturn(new double[]{1.0, 1.0, 1.0, 1.0});
        AnomalyDetector detector = new AnomalyDetector(weighted(0.0, 0.0), List.of(forestDetector, zScoreDetector));

        // --- 2. Act ---
        DetectionResult result = detector.detect(grid, features);

        // --- 3. Assert ---
        assertEquals(0.0, result.combinedAt(0));
        assertEquals(0.0, result.combinedAt(2));
        assertTrue(Double.isNaN(result.combinedAt(3)));
        assertEquals(0, result.anomalousCellCount());
    }

    @Test
    @DisplayName("Un detector sin peso configurado debería usar el peso por defecto")
    void detect_missingWeight_shouldUseDefaultWeight() {
        when(forestDetector.score(grid, features)).thenReturn(new double[]{1.0, 0.0, 0.0, 0.0});
        when(zScoreDetector.score(grid, features)).thenReturn(new double[]{0.0, 0.0, 0.0, 0.0});
        DetectionSettings settings = DetectionSettings.builder()
                .weight("zscore", 0.3)
                .build();
        AnomalyDetector detector = new AnomalyDetector(settings, List.of(forestDetector, zScoreDetector));

        DetectionResult result = detector.detect(grid, features);

        assertEquals(0.1 / 0.4, result.combinedAt(0), 1e-12);
    }

    @Test
    @DisplayName("Las puntuaciones fuera de rango deberían recortarse a [0, 1]")
    void detect_outOfRangeScores_shouldBeClamped() {
        when(forestDetector.score(grid, features)).thenReturn(new double[]{1.7, -0.4, Double.NaN, 0.0});
        AnomalyDetector detector = new AnomalyDetector(weighted(0.5, 0.3), List.of(forestDetector));

        DetectionResult result = detector.detect(grid, features);

        assertArrayEquals(new double[]{1.0, 0.0, 0.0, 0.0}, result.scores(DetectorKind.ISOLATION_FOREST), 0.0);
        assertEquals(1.0, result.combinedAt(0), 1e-12);
    }

    @Test
    @DisplayName("Una superficie con forma incorrecta debería rechazarse")
    void detect_wrongShape_shouldThrow() {
        when(forestDetector.score(grid, features)).thenReturn(new double[]{1.0});
        AnomalyDetector detector = new AnomalyDetector(weighted(0.5, 0.3), List.of(forestDetector));

        assertThrows(IllegalStateException.class, () -> detector.detect(grid, features));
    }

    @Test
    @DisplayName("Debería notificar el avance de cada detector y de la combinación")
    void detect_shouldReportProgress() {
        // --- 1. Arrange ---
        when(forestDetector.score(grid, features)).thenReturn(new double[4]);
        when(zScoreDetector.score(grid, features)).thenReturn(new double[4]);
        ProgressListener listener = mock(ProgressListener.class);
        AnomalyDetector detector = new AnomalyDetector(weighted(0.5, 0.3), List.of(forestDetector, zScoreDetector));

        // --- 2. Act ---
        detector.detect(grid, features, listener);

        // --- 3. Assert ---
        verify(listener).onProgress(eq(60), anyString());
        verify(listener).onProgress(eq(70), anyString());
        verify(listener).onProgress(80, "Combining detector scores");
    }

    @Test
    @DisplayName("La consistencia espacial solicitada no debería alterar la combinación")
    void detect_spatialConsistencyRequested_shouldBeExcludedFromWeights() {
        when(zScoreDetector.score(grid, features)).thenReturn(new double[]{0.8, 0.0, 0.0, 0.0});
        DetectionSettings settings = weighted(0.5, 0.3).withSpatialConsistencyRequested(true);
        AnomalyDetector detector = new AnomalyDetector(settings, List.of(zScoreDetector));

        DetectionResult result = detector.detect(grid, features);

        assertEquals(0.8, result.combinedAt(0), 1e-12);
        assertFalse(result.detectors().contains(DetectorKind.SPATIAL_CONSISTENCY));
    }

    @Test
    @DisplayName("La configuración por defecto debería habilitar el bosque y la puntuación z")
    void constructor_defaults_shouldBuildEnabledDetectors() {
        AnomalyDetector both = new AnomalyDetector(DetectionSettings.builder().build());
        AnomalyDetector onlyZ = new AnomalyDetector(DetectionSettings.builder()
                .isolationForest(IsolationForestSettings.builder().enabled(false).build())
                .zScore(ZScoreSettings.builder().build())
                .build());

        assertThat(both.getDetectors()).extracting(ScoreDetector::kind)
                .containsExactly(DetectorKind.ISOLATION_FOREST, DetectorKind.ZSCORE);
        assertThat(onlyZ.getDetectors()).extracting(ScoreDetector::kind)
                .containsExactly(DetectorKind.ZSCORE);
    }
}
