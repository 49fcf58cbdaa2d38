package hydroqc.domain.anomaly;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Explicación legible de por qué se marcó una región.
 *
 * @param primaryReason   Frase del detector con mayor puntuación entre los disparados.
 * @param detectorScores  Puntuación media de cada detector sobre la región.
 * @param thresholds      Umbrales vigentes en la ejecución.
 * @param triggered       Detectores cuya media supera el umbral de anomalía.
 * @param pixelCount      Píxeles de la región.
 */
public record Explanation(
        @JsonProperty("primary_reason") String primaryReason,
        @JsonProperty("features") Map<String, Double> detectorScores,
        @JsonProperty("thresholds") Map<String, Double> thresholds,
        @JsonProperty("detector_flags") List<String> triggered,
        @JsonProperty("pixel_count") int pixelCount
) {

    public Explanation {
        Objects.requireNonNull(primaryReason, "El motivo principal no puede ser nulo.");
        detectorScores = Collections.unmodifiableMap(new LinkedHashMap<>(detectorScores));
        thresholds = Collections.unmodifiableMap(new LinkedHashMap<>(thresholds));
        triggered = List.copyOf(triggered);
    }
}
