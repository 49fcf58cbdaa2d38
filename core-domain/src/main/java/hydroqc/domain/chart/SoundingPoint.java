package hydroqc.domain.chart;

/**
 * Sonda seleccionada para la carta.
 *
 * @param x       Coordenada x (centro del píxel de origen) en el CRS de la rejilla.
 * @param y       Coordenada y.
 * @param depth   Profundidad seleccionada.
 * @param mode    Criterio aplicado.
 * @param cellRow Fila de la celda de decimación.
 * @param cellCol Columna de la celda de decimación.
 */
public record SoundingPoint(double x, double y, double depth, SelectionMode mode, int cellRow, int cellCol) {
}
