package hydroqc.domain.grid;

import lombok.Builder;

import java.util.Objects;
import java.util.Optional;

/**
 * Metadatos descriptivos de una rejilla cargada.
 *
 * @param crs           Sistema de referencia de origen.
 * @param wgs84Bounds   Envolvente en WGS84 para visualización, o {@code null} si es desconocida.
 * @param width         Columnas.
 * @param height        Filas.
 * @param transform     Transformación afín de origen.
 * @param nodataValue   Centinela de origen, o {@code null}.
 */
@Builder
public record GridMetadata(
        CoordinateReference crs,
        GeoBounds wgs84Bounds,
        int width,
        int height,
        AffineTransform transform,
        Double nodataValue
) {

    public GridMetadata {
        Objects.requireNonNull(crs, "El CRS no puede ser nulo.");
        Objects.requireNonNull(transform, "La transformación no puede ser nula.");
    }

    public Optional<GeoBounds> bounds() {
        return Optional.ofNullable(wgs84Bounds);
    }

    public double resolutionX() {
        return transform.resolutionX();
    }

    public double resolutionY() {
        return transform.resolutionY();
    }

    /**
     * Metadatos derivados directamente de una rejilla en memoria, con la envolvente
     * solo si la rejilla ya está en grados.
     */
    public static GridMetadata describe(DepthGrid grid) {
        GeoBounds bounds = null;
        if (grid.crs().isGeographic()) {
            GeoBounds raw = GeoBounds.ofGrid(grid.transform(), grid.width(), grid.height());
            bounds = raw.isWithinGeographicRange() ? raw : null;
        }
        return new GridMetadata(grid.crs(), bounds, grid.width(), grid.height(), grid.transform(), grid.nodataValue());
    }
}
