package hydroqc.analysis.feature;

import hydroqc.analysis.ProgressListener;
import hydroqc.config.FeatureSettings;
import hydroqc.domain.feature.FeatureSet;
import hydroqc.domain.feature.FeatureType;
import hydroqc.domain.grid.DepthGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;

/**
 * Pruebas unitarias para {@link FeatureExtractor}.
 */
class FeatureExtractorTest {

    private FeatureExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new FeatureExtractor(FeatureSettings.builder().build());
    }

    private static DepthGrid flatGrid(int size, double depth) {
        double[] depths = new double[size * size];
        Arrays.fill(depths, depth);
        return new DepthGrid(size, size, depths, null, null, null);
    }

    @Test
    @DisplayName("Una rejilla uniforme debería dar todas las superficies a cero")
    void extract_uniformGrid_shouldProduceZeroSurfaces() {
        // --- 1. Arrange ---
        DepthGrid grid = flatGrid(12, 50.0);

        // --- 2. Act ---
        FeatureSet features = extractor.extract(grid);

        // --- 3. Assert ---
        assertThat(features.types()).hasSize(FeatureType.values().length);
        for (FeatureType type : new FeatureType[]{FeatureType.Z_SCORE, FeatureType.SLOPE, FeatureType.CURVATURE,
                FeatureType.ROUGHNESS, FeatureType.LAPLACIAN, FeatureType.NEIGHBOR_STD}) {
            assertThat(features.get(type).values())
                    .as("La superficie %s debería ser nula en una rejilla plana", type.getKey())
                    .containsOnly(0.0);
        }
        assertThat(features.get(FeatureType.NEIGHBOR_MEAN).values()).containsOnly(50.0);
    }

    @Test
    @DisplayName("Un pico aislado debería destacar con una puntuación z alta")
    void extract_isolatedSpike_shouldProduceHighZScore() {
        // --- 1. Arrange ---
        double[] depths = new double[40 * 40];
        Arrays.fill(depths, 50.0);
        depths[20 * 40 + 20] = 100.0;
        DepthGrid grid = new DepthGrid(40, 40, depths, null, null, null);

        // --- 2. Act ---
        FeatureSet features = extractor.extract(grid);

        // --- 3. Assert ---
        // Ventana 5x5: 24 vecinos a 50 y el pico a 100 -> media 52, desviación sqrt(96).
        double expected = 48.0 / Math.sqrt(96.0);
        assertEquals(expected, features.get(FeatureType.Z_SCORE).valueAt(20, 20), 1e-9);
        assertEquals(-2.0 / Math.sqrt(96.0), features.get(FeatureType.Z_SCORE).valueAt(20, 22), 1e-9,
                "Un vecino dentro de la ventana del pico debería tener una puntuación z pequeña y negativa.");
        assertEquals(0.0, features.get(FeatureType.Z_SCORE).valueAt(5, 5), 1e-12);
        assertEquals(-200.0, features.get(FeatureType.LAPLACIAN).valueAt(20, 20), 1e-9);
        assertTrue(features.get(FeatureType.ROUGHNESS).valueAt(20, 20) > 0.0);
    }

    @Test
    @DisplayName("Las celdas inválidas deberían ser NaN en todas las superficies y no contaminar a sus vecinas")
    void extract_invalidCells_shouldStayNaNOnlyWhereInvalid() {
        // --- 1. Arrange ---
        double[] depths = new double[8 * 8];
        Arrays.fill(depths, 20.0);
        depths[3 * 8 + 3] = Double.NaN;
        DepthGrid grid = new DepthGrid(8, 8, depths, null, null, null);

        // --- 2. Act ---
        FeatureSet features = extractor.extract(grid);

        // --- 3. Assert ---
        for (FeatureType type : FeatureType.values()) {
            double[] values = features.get(type).values();
            assertTrue(Double.isNaN(values[3 * 8 + 3]), "La celda inválida debe ser NaN en " + type.getKey());
            long nanCount = Arrays.stream(values).filter(Double::isNaN).count();
            assertEquals(1, nanCount, "Solo la celda inválida debería ser NaN en " + type.getKey());
        }
        assertFalse(Double.isNaN(features.get(FeatureType.SLOPE).valueAt(3, 4)));
        assertEquals(0.0, features.get(FeatureType.SLOPE).valueAt(3, 4), 1e-12);
    }

    @Test
    @DisplayName("Debería notificar el avance de cada etapa en orden")
    void extract_shouldReportProgressInOrder() {
        // --- 1. Arrange ---
        ProgressListener listener = mock(ProgressListener.class);

        // --- 2. Act ---
        extractor.extract(flatGrid(6, 10.0), listener);

        // --- 3. Assert ---
        InOrder order = inOrder(listener);
        order.verify(listener).onProgress(eq(10), anyString());
        order.verify(listener).onProgress(eq(20), anyString());
        order.verify(listener).onProgress(eq(30), anyString());
        order.verify(listener).onProgress(eq(40), anyString());
        order.verify(listener).onProgress(eq(50), anyString());
        order.verify(listener).onProgress(eq(55), anyString());
    }

    @Test
    @DisplayName("Una ventana par debería ampliarse a la impar siguiente")
    void extract_evenWindow_shouldBeWidened() {
        // --- 1. Arrange ---
        FeatureExtractor evenExtractor = new FeatureExtractor(FeatureSettings.builder()
                .neighborhoodWindow(4)
                .build());
        double[] depths = new double[9 * 9];
        Arrays.fill(depths, 50.0);
        depths[4 * 9 + 4] = 100.0;
        DepthGrid grid = new DepthGrid(9, 9, depths, null, null, null);

        // --- 2. Act ---
        FeatureSet features = evenExtractor.extract(grid);

        // --- 3. Assert ---
        // Ventana efectiva 5x5, igual que la de por defecto.
        assertEquals(48.0 / Math.sqrt(96.0), features.get(FeatureType.Z_SCORE).valueAt(4, 4), 1e-9);
    }
}
