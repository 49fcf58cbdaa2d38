package hydroqc.geo;

import hydroqc.domain.grid.AffineTransform;
import hydroqc.domain.grid.CoordinateReference;
import hydroqc.domain.grid.GeoBounds;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reproyección a WGS84 (EPSG:4326) con proj4j.
 * <p>
 * Todas las operaciones son "best effort": un CRS desconocido o un fallo de
 * transformación devuelve vacío y deja un aviso en el log, nunca una excepción.
 * Las transformaciones se cachean por código EPSG.
 */
@Slf4j
public class CrsTransformer {

    /**
     * Muestras por borde al reproyectar una envolvente (los bordes rectos dejan de serlo).
     */
    static final int EDGE_SAMPLES = 21;

    private static final String WGS84_NAME = "EPSG:4326";

    private final CRSFactory crsFactory = new CRSFactory();
    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
    private final Map<Integer, CoordinateTransform> cache = new ConcurrentHashMap<>();

    /**
     * Transformación origen → WGS84, si el CRS tiene código EPSG y proj4j lo conoce.
     */
    public Optional<CoordinateTransform> toWgs84(CoordinateReference source) {
        if (source == null || source.epsg() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(cache.computeIfAbsent(source.epsg(), epsg -> {
                CoordinateReferenceSystem from = crsFactory.createFromName("EPSG:" + epsg);
                CoordinateReferenceSystem to = crsFactory.createFromName(WGS84_NAME);
                return transformFactory.createTransform(from, to);
            }));
        } catch (Proj4jException e) {
            log.warn("No se pudo crear la transformación {} -> {}: {}", source, WGS84_NAME, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reproyecta una geometría a WGS84.
     *
     * @param geometry Geometría en el CRS de origen (no se modifica).
     * @param source   CRS de origen.
     * @return Una copia reproyectada, o vacío si la reproyección no es posible.
     */
    public Optional<Geometry> reprojectToWgs84(Geometry geometry, CoordinateReference source) {
        if (source != null && source.isWgs84()) {
            return Optional.of(geometry.copy());
        }
        Optional<CoordinateTransform> transform = toWgs84(source);
        if (transform.isEmpty()) {
            return Optional.empty();
        }
        Geometry copy = geometry.copy();
        try {
            ProjectionFilter filter = new ProjectionFilter(transform.get());
            copy.apply(filter);
            if (filter.failed) {
                log.warn("La reproyección a WGS84 produjo coordenadas no finitas; se conservan las de origen.");
                return Optional.empty();
            }
            copy.geometryChanged();
            return Optional.of(copy);
        } catch (Proj4jException e) {
            log.warn("Fallo al reproyectar geometría desde {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Envolvente WGS84 de una rejilla, muestreando {@value #EDGE_SAMPLES} puntos por borde.
     *
     * @return La envolvente, o vacío si la reproyección falla.
     */
    public Optional<GeoBounds> gridBoundsToWgs84(AffineTransform transform, int width, int height,
                                                 CoordinateReference source) {
        Optional<CoordinateTransform> ct = toWgs84(source);
        if (ct.isEmpty()) {
            return Optional.empty();
        }
        Envelope envelope = new Envelope();
        ProjCoordinate src = new ProjCoordinate();
        ProjCoordinate dst = new ProjCoordinate();
        try {
            for (int k = 0; k < EDGE_SAMPLES; k++) {
                double t = (double) k / (EDGE_SAMPLES - 1);
                Coordinate[] edgePoints = {
                        transform.apply(t * width, 0),
                        transform.apply(t * width, height),
                        transform.apply(0, t * height),
                        transform.apply(width, t * height)
                };
                for (Coordinate point : edgePoints) {
                    src.x = point.x;
                    src.y = point.y;
                    ct.get().transform(src, dst);
                    if (!Double.isFinite(dst.x) || !Double.isFinite(dst.y)) {
                        log.warn("La envolvente reproyectada contiene coordenadas no finitas.");
                        return Optional.empty();
                    }
                    envelope.expandToInclude(dst.x, dst.y);
                }
            }
        } catch (Proj4jException e) {
            log.warn("Fallo al reproyectar la envolvente desde {}: {}", source, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(GeoBounds.of(envelope));
    }

    private static final class ProjectionFilter implements CoordinateSequenceFilter {

        private final CoordinateTransform transform;
        private final ProjCoordinate src = new ProjCoordinate();
        private final ProjCoordinate dst = new ProjCoordinate();
        private boolean failed;

        private ProjectionFilter(CoordinateTransform transform) {
            this.transform = transform;
        }

        @Override
        public void filter(CoordinateSequence seq, int i) {
            src.x = seq.getX(i);
            src.y = seq.getY(i);
            transform.transform(src, dst);
            if (!Double.isFinite(dst.x) || !Double.isFinite(dst.y)) {
                failed = true;
            }
            seq.setOrdinate(i, 0, dst.x);
            seq.setOrdinate(i, 1, dst.y);
        }

        @Override
        public boolean isDone() {
            return failed;
        }

        @Override
        public boolean isGeometryChanged() {
            return true;
        }
    }
}
