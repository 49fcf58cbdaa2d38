package hydroqc.pipeline;

import hydroqc.analysis.ProgressListener;
import hydroqc.analysis.detector.AnomalyDetector;
import hydroqc.analysis.feature.FeatureExtractor;
import hydroqc.analysis.polygon.AnomalyPolygonizer;
import hydroqc.config.DetectionSettings;
import hydroqc.config.FeatureSettings;
import hydroqc.config.OutputSettings;
import hydroqc.config.PolygonizerSettings;
import hydroqc.config.ProcessingConfig;
import hydroqc.domain.anomaly.Anomaly;
import hydroqc.domain.anomaly.DetectionResult;
import hydroqc.domain.feature.FeatureSet;
import hydroqc.domain.grid.DepthGrid;
import hydroqc.domain.grid.GridMetadata;
import hydroqc.domain.grid.GridStatistics;
import hydroqc.domain.grid.LoadedGrid;
import hydroqc.geo.CrsTransformer;
import hydroqc.io.GeoJsonMapper;
import hydroqc.io.GeoTiffGridLoader;
import hydroqc.io.HeatmapWriter;
import hydroqc.io.JsonFileHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Orquestación lineal del análisis de una rejilla:
 * carga → características → detección → mapa de calor → polígonos → GeoJSON.
 * <p>
 * Cada llamada es independiente: la instancia solo guarda la configuración y los
 * componentes sin estado, así que puede compartirse entre ejecuciones concurrentes.
 */
@Slf4j
public class AnalysisPipeline {

    public static final String ENGINE_VERSION = "0.1.0";

    private final ProcessingConfig config;
    private final DetectionSettings detectionSettings;
    private final PolygonizerSettings polygonizerSettings;
    private final OutputSettings outputSettings;
    private final GeoTiffGridLoader loader;
    private final FeatureExtractor featureExtractor;
    private final AnomalyDetector detector;
    private final AnomalyPolygonizer polygonizer;
    private final HeatmapWriter heatmapWriter;
    private final JsonFileHandler jsonFileHandler = new JsonFileHandler();

    public AnalysisPipeline(ProcessingConfig config) {
        this(config, new CrsTransformer(), UUID::randomUUID);
    }

    /**
     * @param config         Configuración de procesamiento (no se modifica).
     * @param crsTransformer Reproyección compartida por carga y poligonización.
     * @param idSupplier     Origen de los identificadores de anomalía.
     */
    public AnalysisPipeline(ProcessingConfig config, CrsTransformer crsTransformer, Supplier<UUID> idSupplier) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.detectionSettings = DetectionSettings.from(config);
        this.polygonizerSettings = PolygonizerSettings.from(config);
        this.outputSettings = OutputSettings.from(config);
        this.loader = new GeoTiffGridLoader(crsTransformer);
        this.featureExtractor = new FeatureExtractor(FeatureSettings.from(config));
        this.detector = new AnomalyDetector(detectionSettings);
        this.polygonizer = new AnomalyPolygonizer(polygonizerSettings, crsTransformer, idSupplier);
        this.heatmapWriter = new HeatmapWriter(outputSettings);
    }

    /**
     * Ejecuta el análisis completo de un GeoTIFF y escribe las salidas en {@code outputDir}.
     *
     * @param runId     Identificador de la ejecución (se copia en el GeoJSON).
     * @param input     GeoTIFF de entrada.
     * @param outputDir Directorio de salida (se crea si no existe).
     * @param progress  Receptor de avance.
     * @throws java.io.FileNotFoundException Si el ráster no existe.
     * @throws hydroqc.domain.exception.RasterFormatException Si el ráster no es legible.
     */
    public AnalysisResult run(String runId, Path input, Path outputDir, ProgressListener progress) throws IOException {
        Objects.requireNonNull(outputDir, "El directorio de salida no puede ser nulo.");
        log.info("[{}] Iniciando análisis de {}", runId, input);

        // 1. Carga
        progress.onProgress(5, "Loading raster data");
        LoadedGrid loaded = loader.load(input);

        return analyze(runId, loaded.grid(), loaded.metadata(), loaded.statistics(), outputDir, progress);
    }

    /**
     * Analiza una rejilla en memoria. Con {@code outputDir} nulo no se escribe ningún fichero.
     */
    public AnalysisResult analyze(String runId, DepthGrid grid, Path outputDir, ProgressListener progress) throws IOException {
        return analyze(runId, grid, GridMetadata.describe(grid), GridStatistics.of(grid), outputDir, progress);
    }

    private AnalysisResult analyze(String runId, DepthGrid grid, GridMetadata metadata, GridStatistics statistics,
                                   Path outputDir, ProgressListener progress) throws IOException {
        Objects.requireNonNull(runId, "El identificador de ejecución no puede ser nulo.");
        Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        ProgressListener listener = progress != null ? progress : ProgressListener.NONE;

        // 2. Características
        FeatureSet features = featureExtractor.extract(grid, listener);

        // 3. Detección
        DetectionResult detection = detector.detect(grid, features, listener);

        // 4. Mapa de calor
        Path heatmapPath = null;
        if (outputDir != null) {
            listener.onProgress(85, "Generating heatmap");
            heatmapPath = heatmapWriter.write(outputDir.resolve(outputSettings.getHeatmapFileName()),
                    detection.combined(), grid);
        }

        // 5. Polígonos
        List<Anomaly> anomalies = polygonizer.polygonize(grid, detection, thresholdSnapshot(), listener);

        // 6. GeoJSON
        Path anomaliesPath = null;
        if (outputDir != null) {
            listener.onProgress(95, "Writing anomaly GeoJSON");
            anomaliesPath = outputDir.resolve(outputSettings.getAnomaliesFileName());
            jsonFileHandler.writeToFile(GeoJsonMapper.anomalies(anomalies, runId), anomaliesPath);
        }

        listener.onProgress(100, "Complete");
        AnalysisResult result = AnalysisResult.builder()
                .runId(runId)
                .anomalies(anomalies)
                .detection(detection)
                .metadata(metadata)
                .statistics(statistics)
                .heatmapPath(heatmapPath)
                .anomaliesPath(anomaliesPath)
                .configFingerprint(config.fingerprint())
                .engineVersion(ENGINE_VERSION)
                .build();
        log.info("[{}] Análisis completado: {} anomalías (alta {}, media {}, baja {}).", runId,
                result.getTotalAnomalies(), result.getHighConfidenceCount(),
                result.getMediumConfidenceCount(), result.getLowConfidenceCount());
        return result;
    }

    /**
     * Umbrales que se copian en la explicación de cada anomalía.
     */
    Map<String, Double> thresholdSnapshot() {
        Map<String, Double> thresholds = new LinkedHashMap<>();
        thresholds.put("anomaly_threshold", polygonizerSettings.getAnomalyThreshold());
        thresholds.put("zscore_threshold", detectionSettings.getZScore().getThreshold());
        thresholds.put("isolation_contamination", detectionSettings.getIsolationForest().getContamination());
        return thresholds;
    }
}
