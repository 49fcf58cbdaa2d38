package hydroqc.analysis.polygon;

import hydroqc.domain.grid.AffineTransform;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.operation.union.UnaryUnionOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Convierte una componente conexa en un polígono en coordenadas de mundo.
 * <p>
 * Se trabaja sobre el recorte de la caja envolvente: cada tramo horizontal de
 * píxeles de la fila se convierte en un rectángulo en espacio de píxel del recorte,
 * se unen todos y el resultado se lleva a mundo con la transformación desplazada
 * al origen del recorte.
 */
class MaskVectorizer {

    private final GeometryFactory geometryFactory;

    MaskVectorizer(GeometryFactory geometryFactory) {
        this.geometryFactory = geometryFactory;
    }

    Polygon vectorize(ConnectedComponentLabeler.Component component, int gridWidth, AffineTransform transform) {
        // 1. Tramos por fila en espacio del recorte
        List<Geometry> cells = new ArrayList<>();
        int[] indices = component.indices();
        int i = 0;
        while (i < indices.length) {
            int row = indices[i] / gridWidth;
            int startCol = indices[i] % gridWidth;
            int endCol = startCol;
            while (i + 1 < indices.length
                    && indices[i + 1] / gridWidth == row
                    && indices[i + 1] % gridWidth == endCol + 1) {
                endCol++;
                i++;
            }
            i++;
            cells.add(rectangle(startCol - component.minCol(), row - component.minRow(),
                    endCol - component.minCol() + 1, row - component.minRow() + 1));
        }

        // 2. Unión; una componente 4-conexa da un único polígono
        Geometry union = UnaryUnionOp.union(cells);
        Polygon polygon = largestPolygon(union);

        // 3. Espacio del recorte -> mundo
        AffineTransform cropTransform = transform.translate(component.minCol(), component.minRow());
        return (Polygon) cropTransform.toJts().transform(polygon);
    }

    private Polygon rectangle(double x0, double y0, double x1, double y1) {
        return geometryFactory.createPolygon(new Coordinate[]{
                new Coordinate(x0, y0),
                new Coordinate(x1, y0),
                new Coordinate(x1, y1),
                new Coordinate(x0, y1),
                new Coordinate(x0, y0)
        });
    }

    private static Polygon largestPolygon(Geometry geometry) {
        if (geometry instanceof Polygon polygon) {
            return polygon;
        }
        Polygon largest = null;
        for (int n = 0; n < geometry.getNumGeometries(); n++) {
            Geometry part = geometry.getGeometryN(n);
            if (part instanceof Polygon polygon && (largest == null || polygon.getArea() > largest.getArea())) {
                largest = polygon;
            }
        }
        if (largest == null) {
            throw new IllegalStateException("La vectorización no produjo ningún polígono.");
        }
        return largest;
    }
}
