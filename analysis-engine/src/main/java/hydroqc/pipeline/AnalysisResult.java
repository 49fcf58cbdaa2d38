package hydroqc.pipeline;

import hydroqc.domain.anomaly.Anomaly;
import hydroqc.domain.anomaly.ConfidenceLevel;
import hydroqc.domain.anomaly.DetectionResult;
import hydroqc.domain.grid.GridMetadata;
import hydroqc.domain.grid.GridStatistics;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Resumen de una ejecución del análisis.
 */
@Value
@Builder
public class AnalysisResult {

    @NonNull
    String runId;

    /**
     * Anomalías en orden de cola de revisión (prioridad descendente).
     */
    @Singular
    List<Anomaly> anomalies;

    @NonNull
    DetectionResult detection;

    @NonNull
    GridMetadata metadata;

    @NonNull
    GridStatistics statistics;

    /**
     * Ruta del mapa de calor, o {@code null} si la ejecución fue solo en memoria.
     */
    Path heatmapPath;

    Path anomaliesPath;

    @NonNull
    String configFingerprint;

    @NonNull
    String engineVersion;

    public int getTotalAnomalies() {
        return anomalies.size();
    }

    public long countByConfidence(ConfidenceLevel level) {
        return anomalies.stream().filter(a -> a.getConfidence() == level).count();
    }

    public long getHighConfidenceCount() {
        return countByConfidence(ConfidenceLevel.HIGH);
    }

    public long getMediumConfidenceCount() {
        return countByConfidence(ConfidenceLevel.MEDIUM);
    }

    public long getLowConfidenceCount() {
        return countByConfidence(ConfidenceLevel.LOW);
    }
}
