package hydroqc.domain.feature;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Superficies derivadas que produce el extractor de características.
 */
@Getter
@RequiredArgsConstructor
public enum FeatureType {

    Z_SCORE("z_score"),
    SLOPE("slope"),
    CURVATURE("curvature"),
    ROUGHNESS("roughness"),
    LAPLACIAN("laplacian"),
    NEIGHBOR_MEAN("neighbor_mean"),
    NEIGHBOR_STD("neighbor_std");

    private final String key;

    /**
     * Columnas de la matriz de entrada del bosque de aislamiento, en este orden.
     */
    public static final Set<FeatureType> ISOLATION_INPUTS =
            EnumSet.of(Z_SCORE, SLOPE, CURVATURE, ROUGHNESS, LAPLACIAN);
}
