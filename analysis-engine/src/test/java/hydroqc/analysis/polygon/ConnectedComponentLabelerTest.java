package hydroqc.analysis.polygon;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Pruebas unitarias para {@link ConnectedComponentLabeler} y {@link BinaryMorphology}.
 */
class ConnectedComponentLabelerTest {

    private static boolean[] parse(String... rows) {
        int width = rows[0].length();
        boolean[] mask = new boolean[width * rows.length];
        for (int r = 0; r < rows.length; r++) {
            for (int c = 0; c < width; c++) {
                mask[r * width + c] = rows[r].charAt(c) == '#';
            }
        }
        return mask;
    }

    @Test
    @DisplayName("Debería etiquetar con conectividad 4 en orden de barrido")
    void label_shouldUseFourConnectivityInScanOrder() {
        // --- 1. Arrange ---
        // Las diagonales no conectan: (0,3) y (1,2) son componentes distintas.
        boolean[] mask = parse(
                "##.#",
                "..#.",
                "....",
                "####");

        // --- 2. Act ---
        List<ConnectedComponentLabeler.Component> components = ConnectedComponentLabeler.label(mask, 4, 4);

        // --- 3. Assert ---
        assertEquals(4, components.size());
        assertEquals(1, components.get(0).label());
        assertArrayEquals(new int[]{0, 1}, components.get(0).indices());
        assertArrayEquals(new int[]{3}, components.get(1).indices());
        assertArrayEquals(new int[]{6}, components.get(2).indices());
        ConnectedComponentLabeler.Component bottom = components.get(3);
        assertEquals(4, bottom.label());
        assertEquals(4, bottom.pixelCount());
        assertEquals(3, bottom.minRow());
        assertEquals(3, bottom.maxRow());
        assertEquals(4, bottom.cropWidth());
        assertEquals(1, bottom.cropHeight());
    }

    @Test
    @DisplayName("Una forma en U debería ser una sola componente con índices ordenados")
    void label_uShape_shouldBeSingleComponent() {
        boolean[] mask = parse(
                "#.#",
                "#.#",
                "###");

        List<ConnectedComponentLabeler.Component> components = ConnectedComponentLabeler.label(mask, 3, 3);

        assertEquals(1, components.size());
        assertArrayEquals(new int[]{0, 2, 3, 5, 6, 7, 8}, components.get(0).indices());
    }

    @Test
    @DisplayName("La apertura debería borrar píxeles sueltos y conservar bloques de 3x3")
    void opening_shouldRemoveSpecklesAndKeepBlocks() {
        // --- 1. Arrange ---
        boolean[] mask = parse(
                "#.....",
                "......",
                "...###",
                "...###",
                "...###");

        // --- 2. Act ---
        boolean[] opened = BinaryMorphology.opening(mask, 6, 5);

        // --- 3. Assert ---
        assertFalse(opened[0]);
        int count = 0;
        for (boolean b : opened) {
            if (b) {
                count++;
            }
        }
        assertEquals(9, count, "El bloque 3x3 debería sobrevivir intacto a la apertura.");

        boolean[] interior = parse(
                ".....",
                ".###.",
                ".###.",
                ".###.",
                ".....");
        assertArrayEquals(interior, BinaryMorphology.opening(interior, 5, 5));
        assertTrue(BinaryMorphology.dilate(parse("...", ".#.", "..."), 3, 3)[0]);
    }
}
