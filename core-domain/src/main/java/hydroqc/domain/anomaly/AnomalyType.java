package hydroqc.domain.anomaly;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Tipología de artefactos batimétricos.
 */
@Getter
@RequiredArgsConstructor
public enum AnomalyType {

    SPIKE("spike"),
    HOLE("hole"),
    SEAM("seam"),
    NOISE_BAND("noise_band"),
    DISCONTINUITY("discontinuity"),
    DENSITY_GAP("density_gap"),
    UNKNOWN("unknown");

    @JsonValue
    private final String code;
}
