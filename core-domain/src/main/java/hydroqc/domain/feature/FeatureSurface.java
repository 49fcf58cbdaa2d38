package hydroqc.domain.feature;

import java.util.Arrays;
import java.util.Objects;

/**
 * Superficie de una característica con la misma forma que la rejilla de origen.
 * Las celdas inválidas en la rejilla son {@code NaN}.
 */
public record FeatureSurface(FeatureType type, int width, int height, double[] values) {

    public FeatureSurface {
        Objects.requireNonNull(type, "El tipo de característica no puede ser nulo.");
        Objects.requireNonNull(values, "Los valores no pueden ser nulos.");
        if (values.length != width * height) {
            throw new IllegalArgumentException("La superficie " + type.getKey() + " no coincide con la forma " + width + "x" + height);
        }
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public double valueAt(int row, int col) {
        return values[row * width + col];
    }

    public double valueAtIndex(int index) {
        return values[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FeatureSurface that = (FeatureSurface) o;
        return width == that.width && height == that.height && type == that.type
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(type, width, height) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureSurface[" + type.getKey() + ", " + width + "x" + height + "]";
    }
}
