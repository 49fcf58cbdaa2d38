package hydroqc.domain.grid;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.util.AffineTransformation;


/**
 * Transformación afín píxel → mundo de una rejilla.
 * <p>
 * {@code x = a·col + b·row + c}, {@code y = d·col + e·row + f}. La esquina superior
 * izquierda del píxel (0, 0) está en (c, f); su centro en {@code apply(0.5, 0.5)}.
 *
 * @param a Tamaño del píxel en x (columna).
 * @param b Rotación (término de fila en x).
 * @param c Origen x.
 * @param d Rotación (término de columna en y).
 * @param e Tamaño del píxel en y (fila), negativo en rejillas norte-arriba.
 * @param f Origen y.
 */
public record AffineTransform(double a, double b, double c, double d, double e, double f) {

    public AffineTransform {
        if (!Double.isFinite(a) || !Double.isFinite(b) || !Double.isFinite(c)
                || !Double.isFinite(d) || !Double.isFinite(e) || !Double.isFinite(f)) {
            throw new IllegalArgumentException("Los coeficientes de la transformación afín deben ser finitos.");
        }
        if (a * e - b * d == 0.0) {
            throw new IllegalArgumentException("La transformación afín es degenerada (determinante nulo).");
        }
    }

    /**
     * Transformación usada cuando el ráster no trae georreferenciación: píxeles unitarios, norte arriba.
     */
    public static AffineTransform unitNorthUp() {
        return new AffineTransform(1.0, 0.0, 0.0, 0.0, -1.0, 0.0);
    }

    /**
     * Transformación norte-arriba a partir de la esquina superior izquierda y el tamaño de píxel.
     */
    public static AffineTransform northUp(double originX, double originY, double pixelWidth, double pixelHeight) {
        return new AffineTransform(pixelWidth, 0.0, originX, 0.0, -Math.abs(pixelHeight), originY);
    }

    /**
     * Aplica la transformación a una posición de píxel (columna, fila), admitiendo fracciones.
     */
    public Coordinate apply(double col, double row) {
        return new Coordinate(a * col + b * row + c, d * col + e * row + f);
    }

    /**
     * Coordenadas de mundo del centro del píxel.
     */
    public Coordinate pixelCenter(int col, int row) {
        return apply(col + 0.5, row + 0.5);
    }

    /**
     * Transformación de un recorte cuya esquina superior izquierda es el píxel (colOffset, rowOffset).
     */
    public AffineTransform translate(int colOffset, int rowOffset) {
        return new AffineTransform(a, b, a * colOffset + b * rowOffset + c,
                d, e, d * colOffset + e * rowOffset + f);
    }

    public double resolutionX() {
        return Math.abs(a);
    }

    public double resolutionY() {
        return Math.abs(e);
    }

    /**
     * Área de un píxel en unidades del CRS al cuadrado.
     */
    public double pixelArea() {
        return Math.abs(a * e);
    }

    /**
     * Equivalente JTS, para transformar geometrías construidas en espacio de píxel.
     */
    public AffineTransformation toJts() {
        return new AffineTransformation(a, b, c, d, e, f);
    }
}
