package hydroqc.chart.sounding;

import java.util.Map;
import java.util.TreeMap;

/**
 * Densidad de sondas por escala de carta: denominador de escala → tamaño de celda (m).
 */
public final class ChartScaleTable {

    private static final TreeMap<Integer, Double> CELL_SIZE_BY_SCALE = new TreeMap<>(Map.of(
            10_000, 50.0,
            25_000, 100.0,
            50_000, 200.0,
            100_000, 400.0,
            200_000, 800.0));

    private ChartScaleTable() {
    }

    /**
     * Escala de la tabla más cercana al denominador pedido. En caso de empate gana la menor.
     */
    public static int nearestScale(int targetScale) {
        int best = CELL_SIZE_BY_SCALE.firstKey();
        long bestDistance = Long.MAX_VALUE;
        // Recorrido ascendente: con '<' estricto el empate se queda con la escala menor.
        for (int scale : CELL_SIZE_BY_SCALE.keySet()) {
            long distance = Math.abs((long) scale - targetScale);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = scale;
            }
        }
        return best;
    }

    public static double cellSizeFor(int targetScale) {
        return CELL_SIZE_BY_SCALE.get(nearestScale(targetScale));
    }
}
