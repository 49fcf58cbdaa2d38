package hydroqc.chart.sounding;

import hydroqc.config.SoundingSettings;
import hydroqc.domain.chart.SelectionMode;
import hydroqc.domain.chart.SoundingPoint;
import hydroqc.domain.chart.SoundingSet;
import hydroqc.domain.exception.InvalidConfigurationException;
import hydroqc.domain.grid.AffineTransform;
import hydroqc.domain.grid.CoordinateReference;
import hydroqc.domain.grid.DepthGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Pruebas unitarias para {@link SoundingSelector} y {@link ChartScaleTable}.
 */
class SoundingSelectorTest {

    private static final double NAN = Double.NaN;

    private DepthGrid grid;
    private SoundingSelector selector;

    @BeforeEach
    void setUp() {
        grid = DepthGrid.of(new double[][]{
                {5, 3, 10, 12},
                {4, 8, 11, NAN},
                {NAN, NAN, 7, 7},
                {NAN, NAN, 9, 1}
        }, null, null);
        selector = new SoundingSelector(SoundingSettings.builder().cellSize(2.0).build());
    }

    @Test
    @DisplayName("El modo shoal debería elegir la menor profundidad de cada celda y omitir celdas vacías")
    void select_shoal_shouldPickShallowest() {
        // --- 1. Arrange (setUp) ---

        // --- 2. Act ---
        SoundingSet set = selector.select(grid);

        // --- 3. Assert ---
        assertEquals(3, set.size(), "La celda sin datos válidos no debe generar sonda.");
        assertThat(set.soundings()).extracting(SoundingPoint::depth).containsExactly(3.0, 10.0, 1.0);

        SoundingPoint first = set.soundings().get(0);
        assertEquals(1.5, first.x(), 1e-12, "La sonda se sitúa en el centro del píxel elegido.");
        assertEquals(-0.5, first.y(), 1e-12);
        assertEquals(0, first.cellRow());
        assertEquals(0, first.cellCol());

        SoundingPoint last = set.soundings().get(2);
        assertEquals(1, last.cellRow());
        assertEquals(1, last.cellCol());
        assertEquals(3.5, last.x(), 1e-12);
        assertEquals(-3.5, last.y(), 1e-12);
        assertEquals(SelectionMode.SHOAL, set.mode());
        assertNull(set.targetScale());
    }

    @Test
    @DisplayName("El modo deep debería elegir la mayor profundidad de cada celda")
    void select_deep_shouldPickDeepest() {
        SoundingSet set = selector.select(grid, 2.0, SelectionMode.DEEP);

        assertThat(set.soundings()).extracting(SoundingPoint::depth).containsExactly(8.0, 12.0, 9.0);
    }

    @Test
    @DisplayName("El modo representativo debería usar la mediana y situarla en el primer píxel más cercano")
    void select_representative_shouldUseMedian() {
        // --- 2. Act ---
        SoundingSet set = selector.select(grid, 2.0, SelectionMode.REPRESENTATIVE);

        // --- 3. Assert ---
        assertThat(set.soundings()).extracting(SoundingPoint::depth).containsExactly(4.5, 11.0, 7.0);
        // Empate entre 5 y 4 (ambos a 0.5 de la mediana): gana el primero en orden de filas.
        assertEquals(0.5, set.soundings().get(0).x(), 1e-12);
        assertEquals(-0.5, set.soundings().get(0).y(), 1e-12);
    }

    @Test
    @DisplayName("Con profundidades negativas shoal debería comparar por magnitud")
    void select_negativeDepths_shouldCompareMagnitudes() {
        DepthGrid negative = DepthGrid.of(new double[][]{{-5, -2}, {-9, -3}}, null, null);

        SoundingSet set = selector.select(negative, 2.0, SelectionMode.SHOAL);

        assertEquals(1, set.size());
        assertEquals(-2.0, set.soundings().get(0).depth());
    }

    @Test
    @DisplayName("Una celda menor que el píxel debería usar un píxel por celda")
    void select_cellSmallerThanPixel_shouldUseOnePixel() {
        SoundingSet set = selector.select(grid, 0.3, SelectionMode.SHOAL);

        assertEquals(grid.validCount(), set.size());
    }

    @Test
    @DisplayName("Debería derivar la celda de la escala de carta más cercana")
    void selectForScale_shouldUseNearestScaleCellSize() {
        // --- 1. Arrange ---
        double[] depths = new double[20 * 20];
        Arrays.fill(depths, 30.0);
        DepthGrid projected = new DepthGrid(20, 20, depths,
                AffineTransform.northUp(500000, 4200000, 10, 10), CoordinateReference.projected(32630), null);

        // --- 2. Act ---
        SoundingSet set = selector.selectForScale(projected, 12000);

        // --- 3. Assert ---
        // 1:10 000 -> 50 m -> celdas de 5x5 píxeles -> 4x4 celdas.
        assertEquals(16, set.size());
        assertEquals(50.0, set.cellSize());
        assertEquals(Integer.valueOf(12000), set.targetScale());
        assertEquals(SelectionMode.SHOAL, set.mode());
    }

    @Test
    @DisplayName("Una escala no positiva o una celda no positiva deberían rechazarse")
    void select_invalidArguments_shouldThrow() {
        assertThrows(InvalidConfigurationException.class, () -> selector.selectForScale(grid, 0));
        assertThrows(InvalidConfigurationException.class, () -> selector.select(grid, 0.0, SelectionMode.SHOAL));
    }

    @Test
    @DisplayName("La tabla de escalas debería resolver empates hacia la escala menor")
    void chartScaleTable_shouldResolveNearestScale() {
        assertEquals(10_000, ChartScaleTable.nearestScale(17_500));
        assertEquals(25_000, ChartScaleTable.nearestScale(30_000));
        assertEquals(200_000, ChartScaleTable.nearestScale(1_000_000));
        assertEquals(10_000, ChartScaleTable.nearestScale(1));
        assertEquals(200.0, ChartScaleTable.cellSizeFor(60_000));
        assertEquals(800.0, ChartScaleTable.cellSizeFor(150_001));
    }
}
