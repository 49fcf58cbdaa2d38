package hydroqc.domain.grid;

import java.util.Objects;
import java.util.Optional;

/**
 * Sistema de referencia de una rejilla: código EPSG opcional y unidades explícitas.
 * <p>
 * Las unidades se fijan al leer la rejilla (clave de tipo de modelo GeoTIFF), no
 * se deducen comparando cadenas del identificador.
 *
 * @param epsg  Código EPSG, o {@code null} si no se conoce.
 * @param units Unidades horizontales.
 */
public record CoordinateReference(Integer epsg, CrsUnits units) {

    public static final int WGS84_EPSG = 4326;
    public static final CoordinateReference WGS84 = new CoordinateReference(WGS84_EPSG, CrsUnits.DEGREES);

    public CoordinateReference {
        Objects.requireNonNull(units, "Las unidades del CRS no pueden ser nulas.");
        if (epsg != null && epsg <= 0) {
            throw new IllegalArgumentException("Código EPSG inválido: " + epsg);
        }
    }

    public static CoordinateReference unknown() {
        return new CoordinateReference(null, CrsUnits.UNKNOWN);
    }

    public static CoordinateReference projected(int epsg) {
        return new CoordinateReference(epsg, CrsUnits.METERS);
    }

    public static CoordinateReference geographic(int epsg) {
        return new CoordinateReference(epsg, CrsUnits.DEGREES);
    }

    public boolean isGeographic() {
        return units == CrsUnits.DEGREES;
    }

    public boolean isWgs84() {
        return epsg != null && epsg == WGS84_EPSG;
    }

    /**
     * Identificador en la forma {@code EPSG:xxxx}.
     */
    public Optional<String> identifier() {
        return epsg == null ? Optional.empty() : Optional.of("EPSG:" + epsg);
    }

    @Override
    public String toString() {
        return identifier().orElse("UNKNOWN") + " (" + units + ")";
    }
}
