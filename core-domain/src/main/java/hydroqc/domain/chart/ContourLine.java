package hydroqc.domain.chart;

import org.locationtech.jts.geom.LineString;

import java.util.Objects;

/**
 * Isóbata suavizada.
 *
 * @param depth    Nivel de profundidad.
 * @param geometry Línea en coordenadas de mundo.
 * @param length   Longitud en unidades del CRS.
 * @param closed   {@code true} si la línea forma un anillo.
 */
public record ContourLine(double depth, LineString geometry, double length, boolean closed) {

    public ContourLine {
        Objects.requireNonNull(geometry, "La geometría de la isóbata no puede ser nula.");
    }
}
