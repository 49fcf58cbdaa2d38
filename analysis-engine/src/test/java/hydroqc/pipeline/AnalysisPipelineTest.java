package hydroqc.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import hydroqc.analysis.ProgressListener;
import hydroqc.config.ProcessingConfig;
import hydroqc.config.SyntheticSurveyConfig;
import hydroqc.domain.anomaly.Anomaly;
import hydroqc.domain.anomaly.AnomalyType;
import hydroqc.domain.anomaly.ConfidenceLevel;
import hydroqc.domain.grid.AffineTransform;
import hydroqc.domain.grid.CoordinateReference;
import hydroqc.domain.grid.DepthGrid;
import hydroqc.factory.SyntheticBathymetryFactory;
import hydroqc.geo.CrsTransformer;
import hydroqc.io.GeoTiffWriter;
import hydroqc.io.JsonFileHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;

/**
 * Pruebas de integración del {@link AnalysisPipeline} completo.
 */
class AnalysisPipelineTest {

    private static final UUID FIXED_ID = UUID.fromString("00000000-0000-0000-0000-0000000000aa");

    @TempDir
    Path tempDir;

    /**
     * Solo puntuación z y área mínima de un píxel: el resultado es determinista y fácil de razonar.
     */
    private static ProcessingConfig zScoreOnlyConfig() {
        return ProcessingConfig.defaults()
                .with("anomaly_detection.isolation_forest.enabled", false)
                .with("outputs.polygons.min_area_pixels", 1);
    }

    private static DepthGrid flatGridWithSpike() {
        double[] depths = new double[40 * 40];
        Arrays.fill(depths, 50.0);
        depths[20 * 40 + 20] = 100.0;
        return new DepthGrid(40, 40, depths, AffineTransform.northUp(0.0, 40.0, 1.0, 1.0), null, null);
    }

    @Test
    @DisplayName("Un pico aislado debería detectarse como una anomalía de tipo pico")
    void analyze_isolatedSpike_shouldYieldOneSpikeAnomaly() throws IOException {
        // --- 1. Arrange ---
        AnalysisPipeline pipeline = new AnalysisPipeline(zScoreOnlyConfig(), new CrsTransformer(), () -> FIXED_ID);

        // --- 2. Act ---
        AnalysisResult result = pipeline.analyze("run-spike", flatGridWithSpike(), null, ProgressListener.NONE);

        // --- 3. Assert ---
        assertEquals(1, result.getTotalAnomalies());
        Anomaly spike = result.getAnomalies().get(0);
        assertEquals(FIXED_ID, spike.getId());
        assertEquals(AnomalyType.SPIKE, spike.getType());
        assertEquals(ConfidenceLevel.HIGH, spike.getConfidence());
        assertEquals(1, spike.getPixelCount());
        assertEquals(1.0, spike.getProbability(), 1e-12);
        assertEquals(20.5, spike.getCentroidX(), 1e-9);
        assertEquals(19.5, spike.getCentroidY(), 1e-9);
        assertEquals(1, result.getHighConfidenceCount());
        assertEquals(0, result.getLowConfidenceCount());
        assertNull(result.getHeatmapPath(), "Sin directorio de salida no se escribe el mapa de calor.");
        assertNull(result.getAnomaliesPath());
        assertEquals(AnalysisPipeline.ENGINE_VERSION, result.getEngineVersion());
        assertEquals(zScoreOnlyConfig().fingerprint(), result.getConfigFingerprint());
        assertThat(spike.getExplanation().thresholds())
                .containsKeys("anomaly_threshold", "zscore_threshold", "isolation_contamination");
    }

    @Test
    @DisplayName("Una rejilla uniforme no debería producir anomalías con la configuración por defecto")
    void analyze_uniformGrid_shouldYieldNoAnomalies() throws IOException {
        // --- 1. Arrange ---
        double[] depths = new double[30 * 30];
        Arrays.fill(depths, 25.0);
        DepthGrid grid = new DepthGrid(30, 30, depths, null, null, null);
        AnalysisPipeline pipeline = new AnalysisPipeline(ProcessingConfig.defaults());

        // --- 2. Act ---
        AnalysisResult result = pipeline.analyze("run-flat", grid, null, ProgressListener.NONE);

        // --- 3. Assert ---
        assertEquals(0, result.getTotalAnomalies());
        assertThat(result.getDetection().combined()).containsOnly(0.0);
    }

    @Test
    @DisplayName("Una rejilla sin celdas válidas debería terminar sin anomalías")
    void analyze_allInvalid_shouldYieldEmptyResult() throws IOException {
        double[] depths = new double[10 * 10];
        Arrays.fill(depths, -9999.0);
        DepthGrid grid = new DepthGrid(10, 10, depths, null, null, -9999.0);
        AnalysisPipeline pipeline = new AnalysisPipeline(ProcessingConfig.defaults());

        AnalysisResult result = pipeline.analyze("run-empty", grid, tempDir, ProgressListener.NONE);

        assertEquals(0, result.getTotalAnomalies());
        assertEquals(0, result.getStatistics().validCount());
        assertTrue(Files.exists(result.getAnomaliesPath()));
    }

    @Test
    @DisplayName("Dos ejecuciones con la misma semilla deberían dar resultados idénticos salvo los identificadores")
    void analyze_sameInput_shouldBeReproducible() throws IOException {
        // --- 1. Arrange ---
        DepthGrid grid = new SyntheticBathymetryFactory().createSurvey(SyntheticSurveyConfig.builder()
                .width(80)
                .height(80)
                .build()).grid();
        AnalysisPipeline pipeline = new AnalysisPipeline(ProcessingConfig.defaults());

        // --- 2. Act ---
        AnalysisResult first = pipeline.analyze("run-a", grid, null, ProgressListener.NONE);
        AnalysisResult second = pipeline.analyze("run-b", grid, null, ProgressListener.NONE);

        // --- 3. Assert ---
        assertArrayEquals(first.getDetection().combined(), second.getDetection().combined(), 0.0);
        assertEquals(summary(first), summary(second));
    }

    private static List<String> summary(AnalysisResult result) {
        return result.getAnomalies().stream()
                .map(a -> a.getType() + "|" + a.getPixelCount() + "|" + a.getProbability() + "|"
                        + a.getCentroidX() + "|" + a.getCentroidY() + "|" + a.getQcPriority())
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Una ejecución desde fichero debería escribir el mapa de calor y el GeoJSON y notificar el avance")
    void run_fromGeoTiff_shouldWriteOutputsAndReportProgress() throws IOException {
        // --- 1. Arrange ---
        DepthGrid source = new DepthGrid(40, 40, flatGridWithSpike().depths(),
                AffineTransform.northUp(500000.0, 4200000.0, 1.0, 1.0), CoordinateReference.projected(32630), null);
        Path input = tempDir.resolve("input.tif");
        new GeoTiffWriter().writeGrid(input, source);
        Path outputDir = tempDir.resolve("outputs");
        ProgressListener listener = mock(ProgressListener.class);
        AnalysisPipeline pipeline = new AnalysisPipeline(zScoreOnlyConfig());

        // --- 2. Act ---
        AnalysisResult result = pipeline.run("run-file", input, outputDir, listener);

        // --- 3. Assert ---
        assertEquals(outputDir.resolve("anomaly_heatmap.tif"), result.getHeatmapPath());
        assertTrue(Files.exists(result.getHeatmapPath()));
        JsonNode geojson = new JsonFileHandler().readTree(result.getAnomaliesPath());
        assertEquals(1, geojson.get("features").size());
        JsonNode properties = geojson.get("features").get(0).get("properties");
        assertEquals("run-file", properties.get("run_id").asText());
        assertEquals("spike", properties.get("anomaly_type").asText());
        // Reproyectado desde UTM 30N: longitud cercana al meridiano central (-3).
        double lon = geojson.get("features").get(0).get("geometry").get("coordinates").get(0).get(0).get(0).asDouble();
        assertThat(lon).isBetween(-3.1, -2.9);

        InOrder order = inOrder(listener);
        order.verify(listener).onProgress(5, "Loading raster data");
        order.verify(listener).onProgress(eq(10), anyString());
        order.verify(listener).onProgress(80, "Combining detector scores");
        order.verify(listener).onProgress(85, "Generating heatmap");
        order.verify(listener).onProgress(90, "Creating anomaly polygons");
        order.verify(listener).onProgress(95, "Writing anomaly GeoJSON");
        order.verify(listener).onProgress(100, "Complete");
    }

    @Test
    @DisplayName("Un ráster inexistente debería propagar FileNotFoundException")
    void run_missingInput_shouldThrowFileNotFound() {
        AnalysisPipeline pipeline = new AnalysisPipeline(ProcessingConfig.defaults());

        assertThrows(FileNotFoundException.class,
                () -> pipeline.run("run-missing", tempDir.resolve("nope.tif"), tempDir, ProgressListener.NONE));
    }

    @Test
    @DisplayName("La instantánea de umbrales debería reflejar la configuración")
    void thresholdSnapshot_shouldReflectConfig() {
        AnalysisPipeline pipeline = new AnalysisPipeline(ProcessingConfig.defaults()
                .with("outputs.polygons.anomaly_threshold", 0.7));

        assertThat(pipeline.thresholdSnapshot())
                .containsEntry("anomaly_threshold", 0.7)
                .containsEntry("zscore_threshold", 3.0)
                .containsEntry("isolation_contamination", 0.1);
    }
}
