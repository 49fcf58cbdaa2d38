package hydroqc.domain.anomaly;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Detectores conocidos por el motor. La clave es la usada en la configuración
 * (pesos) y en las explicaciones.
 */
@Getter
@RequiredArgsConstructor
public enum DetectorKind {

    ISOLATION_FOREST("isolation_forest", "Unusual feature combination detected by Isolation Forest"),
    ZSCORE("zscore", "Depth significantly different from neighbors"),
    SPATIAL_CONSISTENCY("spatial_consistency", "Inconsistent with surrounding surface");

    /**
     * Motivo genérico cuando ningún detector supera el umbral por sí solo.
     */
    public static final String FALLBACK_REASON = "Score exceeded threshold";

    @JsonValue
    private final String key;

    /**
     * Frase que se muestra al revisor cuando este detector es el principal.
     */
    private final String reason;

    public static Optional<DetectorKind> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase();
        return Arrays.stream(values()).filter(kind -> kind.key.equals(normalized)).findFirst();
    }
}
