package hydroqc.domain.grid;

import org.locationtech.jts.geom.Envelope;

/**
 * Rectángulo envolvente en coordenadas de mundo.
 */
public record GeoBounds(double minX, double minY, double maxX, double maxY) {

    public GeoBounds {
        if (minX > maxX || minY > maxY) {
            throw new IllegalArgumentException("Límites invertidos: [" + minX + ", " + minY + ", " + maxX + ", " + maxY + "]");
        }
    }

    public static GeoBounds of(Envelope envelope) {
        return new GeoBounds(envelope.getMinX(), envelope.getMinY(), envelope.getMaxX(), envelope.getMaxY());
    }

    /**
     * Límites de una rejilla completa según su transformación (las cuatro esquinas).
     */
    public static GeoBounds ofGrid(AffineTransform transform, int width, int height) {
        Envelope envelope = new Envelope(transform.apply(0, 0));
        envelope.expandToInclude(transform.apply(width, 0));
        envelope.expandToInclude(transform.apply(0, height));
        envelope.expandToInclude(transform.apply(width, height));
        return of(envelope);
    }

    /**
     * Indica si los límites caben en el rango de longitud/latitud válido.
     */
    public boolean isWithinGeographicRange() {
        return Math.abs(minX) <= 180.0 && Math.abs(maxX) <= 180.0
                && Math.abs(minY) <= 90.0 && Math.abs(maxY) <= 90.0;
    }
}
