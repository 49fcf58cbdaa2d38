package hydroqc.factory;

import hydroqc.domain.anomaly.AnomalyType;

/**
 * Artefacto insertado a propósito en un levantamiento sintético.
 * <p>
 * Según el tipo, los campos significan:
 * <ul>
 *     <li>Pico / hueco: centro ({@code row}, {@code col}), {@code extent} = radio en píxeles.</li>
 *     <li>Costura horizontal: {@code row} = primera fila desplazada, {@code col} = -1.</li>
 *     <li>Costura vertical: {@code col} = primera columna desplazada, {@code row} = -1.</li>
 *     <li>Banda de ruido: filas [{@code row}, {@code row + extent}).</li>
 * </ul>
 *
 * @param type      Tipo de artefacto.
 * @param row       Fila de referencia.
 * @param col       Columna de referencia.
 * @param extent    Radio o alto, en píxeles.
 * @param magnitude Desplazamiento vertical aplicado (o desviación del ruido de la banda).
 */
public record EmbeddedAnomaly(AnomalyType type, int row, int col, int extent, double magnitude) {
}
