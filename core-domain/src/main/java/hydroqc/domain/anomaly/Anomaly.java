package hydroqc.domain.anomaly;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import org.locationtech.jts.geom.Geometry;

import java.util.UUID;

/**
 * Región anómala detectada, lista para la cola de revisión.
 * <p>
 * Las coordenadas del centroide y la geometría están en el CRS de salida
 * (WGS84 si la rejilla era proyectada y la reproyección tuvo éxito). El área
 * siempre se expresa en unidades de la rejilla de origen al cuadrado.
 * <p>
 * El motor no modifica una anomalía una vez creada; el subsistema de revisión
 * deriva copias con {@link #withReviewDecision(ReviewDecision)}.
 */
@Value
@Builder
@With
public class Anomaly {

    @NonNull
    UUID id;

    double centroidX;
    double centroidY;

    @NonNull
    Geometry geometry;

    int pixelCount;

    double areaSqMeters;

    @NonNull
    AnomalyType type;

    /**
     * Media de la probabilidad combinada sobre la región.
     */
    double probability;

    @NonNull
    ConfidenceLevel confidence;

    double qcPriority;

    @NonNull
    Explanation explanation;

    /**
     * Media de las profundidades válidas de la región, o {@code null} si no hay ninguna.
     */
    Double localDepthMean;

    Double localDepthStd;

    @NonNull
    @Builder.Default
    ReviewDecision reviewDecision = ReviewDecision.PENDING;
}
