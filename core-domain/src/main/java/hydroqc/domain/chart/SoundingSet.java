package hydroqc.domain.chart;

import java.util.List;
import java.util.Objects;

/**
 * Resultado de una selección de sondas.
 *
 * @param soundings     Sondas en orden de celda (filas, luego columnas).
 * @param cellSize      Tamaño de celda aplicado.
 * @param mode          Criterio de selección.
 * @param targetScale   Denominador de escala pedido, o {@code null} si se dio el tamaño de celda.
 */
public record SoundingSet(List<SoundingPoint> soundings, double cellSize, SelectionMode mode, Integer targetScale) {

    public SoundingSet {
        Objects.requireNonNull(mode, "El modo de selección no puede ser nulo.");
        soundings = List.copyOf(soundings);
    }

    public int size() {
        return soundings.size();
    }
}
