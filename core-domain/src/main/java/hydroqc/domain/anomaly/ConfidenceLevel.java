package hydroqc.domain.anomaly;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ConfidenceLevel {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    @JsonValue
    private final String code;

    /**
     * Clasifica una probabilidad media según los umbrales (ambos inclusivos).
     */
    public static ConfidenceLevel from(double probability, double highThreshold, double mediumThreshold) {
        if (probability >= highThreshold) {
            return HIGH;
        }
        if (probability >= mediumThreshold) {
            return MEDIUM;
        }
        return LOW;
    }
}
