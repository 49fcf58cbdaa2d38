package hydroqc.domain.grid;

import lombok.Builder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Rejilla de profundidades de una sola banda, inmutable.
 * <p>
 * Los valores se guardan por filas ({@code index = row·width + col}). Las celdas
 * sin dato son {@code NaN}: el centinela original ({@code nodataValue}) solo se
 * conserva como metadato y nunca aparece en {@code depths}.
 *
 * @param width       Número de columnas.
 * @param height      Número de filas.
 * @param depths      Profundidades por filas, {@code NaN} = inválida.
 * @param transform   Transformación píxel → mundo.
 * @param crs         Sistema de referencia.
 * @param nodataValue Centinela de "sin dato" del fichero de origen, o {@code null}.
 */
@Builder(toBuilder = true)
public record DepthGrid(
        int width,
        int height,
        double[] depths,
        AffineTransform transform,
        CoordinateReference crs,
        Double nodataValue
) {

    public DepthGrid {
        Objects.requireNonNull(depths, "El array de profundidades no puede ser nulo.");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensiones de rejilla inválidas: " + width + "x" + height);
        }
        if (depths.length != width * height) {
            throw new IllegalArgumentException("El array de profundidades tiene " + depths.length
                    + " valores y la rejilla " + width + "x" + height + " necesita " + (width * height) + ".");
        }
        if (transform == null) {
            transform = AffineTransform.unitNorthUp();
        }
        if (crs == null) {
            crs = CoordinateReference.unknown();
        }
        // Copia y normalización: cualquier no finito o centinela pasa a NaN.
        double[] copy = depths.clone();
        for (int i = 0; i < copy.length; i++) {
            double v = copy[i];
            if (!Double.isFinite(v) || (nodataValue != null && v == nodataValue)) {
                copy[i] = Double.NaN;
            }
        }
        depths = copy;
    }

    /**
     * Construye una rejilla a partir de una matriz {@code [fila][columna]}.
     */
    public static DepthGrid of(double[][] rows, AffineTransform transform, CoordinateReference crs) {
        Objects.requireNonNull(rows, "La matriz de profundidades no puede ser nula.");
        if (rows.length == 0 || rows[0].length == 0) {
            throw new IllegalArgumentException("La matriz de profundidades no puede estar vacía.");
        }
        int height = rows.length;
        int width = rows[0].length;
        double[] flat = new double[width * height];
        for (int r = 0; r < height; r++) {
            if (rows[r].length != width) {
                throw new IllegalArgumentException("La fila " + r + " tiene " + rows[r].length + " columnas; se esperaban " + width);
            }
            System.arraycopy(rows[r], 0, flat, r * width, width);
        }
        return new DepthGrid(width, height, flat, transform, crs, null);
    }

    /**
     * Copia de las profundidades.
     */
    @Override
    public double[] depths() {
        return depths.clone();
    }

    public double depthAt(int row, int col) {
        return depths[index(row, col)];
    }

    public boolean isValid(int row, int col) {
        return !Double.isNaN(depths[index(row, col)]);
    }

    public boolean isValidIndex(int index) {
        return !Double.isNaN(depths[index]);
    }

    public double depthAtIndex(int index) {
        return depths[index];
    }

    public int cellCount() {
        return depths.length;
    }

    public int validCount() {
        int count = 0;
        for (double v : depths) {
            if (!Double.isNaN(v)) {
                count++;
            }
        }
        return count;
    }

    public int index(int row, int col) {
        if (row < 0 || row >= height || col < 0 || col >= width) {
            throw new IndexOutOfBoundsException("Celda (" + row + ", " + col + ") fuera de la rejilla " + width + "x" + height);
        }
        return row * width + col;
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DepthGrid that = (DepthGrid) o;
        return width == that.width && height == that.height
                && Arrays.equals(depths, that.depths)
                && Objects.equals(transform, that.transform)
                && Objects.equals(crs, that.crs)
                && Objects.equals(nodataValue, that.nodataValue);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(width, height, transform, crs, nodataValue);
        result = 31 * result + Arrays.hashCode(depths);
        return result;
    }

    @Override
    public String toString() {
        return "DepthGrid[" + width + "x" + height + ", crs=" + crs + ", valid=" + validCount() + "]";
    }
}
