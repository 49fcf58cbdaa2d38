package hydroqc.domain.anomaly;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Decisión del revisor humano. El motor siempre emite {@link #PENDING}.
 */
@Getter
@RequiredArgsConstructor
public enum ReviewDecision {

    PENDING("pending"),
    ACCEPTED("accepted"),
    REJECTED("rejected");

    @JsonValue
    private final String code;
}
