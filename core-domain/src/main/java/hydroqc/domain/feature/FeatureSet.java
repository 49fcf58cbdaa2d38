package hydroqc.domain.feature;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Conjunto de superficies de características de una rejilla.
 */
public final class FeatureSet {

    private final int width;
    private final int height;
    private final Map<FeatureType, FeatureSurface> surfaces;

    public FeatureSet(int width, int height, Map<FeatureType, FeatureSurface> surfaces) {
        Objects.requireNonNull(surfaces, "El mapa de superficies no puede ser nulo.");
        for (FeatureSurface surface : surfaces.values()) {
            if (surface.width() != width || surface.height() != height) {
                throw new IllegalArgumentException("La superficie " + surface.type().getKey() + " no tiene la forma del conjunto.");
            }
        }
        this.width = width;
        this.height = height;
        this.surfaces = surfaces.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(surfaces));
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @throws IllegalStateException si la característica no se ha calculado.
     */
    public FeatureSurface get(FeatureType type) {
        FeatureSurface surface = surfaces.get(type);
        if (surface == null) {
            throw new IllegalStateException("La característica " + type.getKey() + " no está disponible.");
        }
        return surface;
    }

    public boolean contains(FeatureType type) {
        return surfaces.containsKey(type);
    }

    public Set<FeatureType> types() {
        return surfaces.keySet();
    }
}
