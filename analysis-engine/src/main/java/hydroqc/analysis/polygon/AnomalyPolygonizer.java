package hydroqc.analysis.polygon;

import hydroqc.analysis.ProgressListener;
import hydroqc.config.PolygonizerSettings;
import hydroqc.domain.anomaly.Anomaly;
import hydroqc.domain.anomaly.AnomalyType;
import hydroqc.domain.anomaly.ConfidenceLevel;
import hydroqc.domain.anomaly.DetectionResult;
import hydroqc.domain.anomaly.DetectorKind;
import hydroqc.domain.anomaly.Explanation;
import hydroqc.domain.grid.CrsUnits;
import hydroqc.domain.grid.DepthGrid;
import hydroqc.geo.CrsTransformer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.simplify.TopologyPreservingSimplifier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.IntToDoubleFunction;
import java.util.function.Supplier;

/**
 * Convierte la superficie de probabilidad en regiones anómalas explicadas.
 * <p>
 * <b>Pasos:</b>
 * <ol>
 * <li>Máscara {@code combinada > umbral}; apertura 3×3 si el área mínima es mayor que 1.</li>
 * <li>Componentes 4-conexas en orden de barrido, con límites de seguridad de componentes
 * examinadas y de anomalías emitidas (aviso y corte, no error).</li>
 * <li>Descarte de componentes menores que el área mínima.</li>
 * <li>Vectorización, reproyección a WGS84 si procede y simplificación topológica.</li>
 * <li>Estadísticas, tipo, confianza, prioridad y explicación de cada región.</li>
 * </ol>
 * El resultado se ordena por prioridad descendente: es la cola de revisión.
 */
@Slf4j
public class AnomalyPolygonizer {

    private final PolygonizerSettings settings;
    private final CrsTransformer crsTransformer;
    private final Supplier<UUID> idSupplier;
    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final MaskVectorizer vectorizer = new MaskVectorizer(geometryFactory);
    private final AnomalyTypeClassifier classifier;
    private final QcPriorityCalculator priorityCalculator;

    public AnomalyPolygonizer(PolygonizerSettings settings) {
        this(settings, new CrsTransformer(), UUID::randomUUID);
    }

    public AnomalyPolygonizer(PolygonizerSettings settings, CrsTransformer crsTransformer, Supplier<UUID> idSupplier) {
        this.settings = Objects.requireNonNull(settings, "La configuración del poligonizador no puede ser nula.");
        this.crsTransformer = Objects.requireNonNull(crsTransformer, "El transformador de CRS no puede ser nulo.");
        this.idSupplier = Objects.requireNonNull(idSupplier, "El proveedor de identificadores no puede ser nulo.");
        this.classifier = new AnomalyTypeClassifier(settings.getClassification());
        this.priorityCalculator = new QcPriorityCalculator(settings.getPriority());
    }

    public List<Anomaly> polygonize(DepthGrid grid, DetectionResult detection) {
        return polygonize(grid, detection, Map.of("anomaly_threshold", settings.getAnomalyThreshold()), ProgressListener.NONE);
    }

    /**
     * @param grid       Rejilla de origen.
     * @param detection  Resultado de la detección sobre la misma rejilla.
     * @param thresholds Umbrales de la ejecución que se copian en cada explicación.
     * @param progress   Receptor de avance.
     * @return Anomalías ordenadas por prioridad descendente.
     */
    public List<Anomaly> polygonize(DepthGrid grid, DetectionResult detection,
                                    Map<String, Double> thresholds, ProgressListener progress) {
        Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        Objects.requireNonNull(detection, "El resultado de detección no puede ser nulo.");
        if (detection.getWidth() != grid.width() || detection.getHeight() != grid.height()) {
            throw new IllegalArgumentException("El resultado de detección no tiene la forma de la rejilla.");
        }
        progress.onProgress(90, "Creating anomaly polygons");

        int width = grid.width();
        int height = grid.height();
        double threshold = settings.getAnomalyThreshold();

        // 1. Máscara y limpieza morfológica
        boolean[] mask = new boolean[grid.cellCount()];
        for (int i = 0; i < mask.length; i++) {
            mask[i] = grid.isValidIndex(i) && detection.combinedAt(i) > threshold;
        }
        if (settings.getMinAreaPixels() > 1) {
            mask = BinaryMorphology.opening(mask, width, height);
        }

        // 2. Componentes
        List<ConnectedComponentLabeler.Component> components = ConnectedComponentLabeler.label(mask, width, height);
        log.debug("Poligonizador: {} componentes conexas sobre el umbral {}", components.size(), threshold);
        if (components.isEmpty()) {
            return List.of();
        }

        double globalMedian = globalMedian(grid);
        if (globalMedian <= 0.0) {
            log.warn("La mediana de profundidad es {} (<= 0). La tipificación pico/hueco asume profundidades "
                    + "positivas hacia abajo y puede invertir los tipos.", globalMedian);
        }

        // 3. Regiones
        List<Anomaly> anomalies = new ArrayList<>();
        for (ConnectedComponentLabeler.Component component : components) {
            if (component.label() > settings.getMaxScanComponents()) {
                log.warn("Límite de componentes examinadas alcanzado ({}). Se detiene la vectorización.",
                        settings.getMaxScanComponents());
                break;
            }
            if (anomalies.size() >= settings.getMaxAnomalies()) {
                log.warn("Límite de anomalías alcanzado ({}). Se detiene la vectorización.", settings.getMaxAnomalies());
                break;
            }
            if (component.pixelCount() < settings.getMinAreaPixels()) {
                continue;
            }
            anomalies.add(buildAnomaly(grid, detection, component, globalMedian, thresholds));
        }

        anomalies.sort(Comparator.comparingDouble(Anomaly::getQcPriority).reversed());
        log.info("Poligonizador: {} anomalías emitidas de {} componentes.", anomalies.size(), components.size());
        return anomalies;
    }

    private Anomaly buildAnomaly(DepthGrid grid, DetectionResult detection, ConnectedComponentLabeler.Component component,
                                 double globalMedian, Map<String, Double> thresholds) {
        int[] indices = component.indices();
        double threshold = settings.getAnomalyThreshold();

        // Geometría
        Polygon polygon = vectorizer.vectorize(component, grid.width(), grid.transform());
        Geometry geometry = polygon;
        CrsUnits units = grid.crs().units();
        if (!grid.crs().isWgs84()) {
            Optional<Geometry> reprojected = crsTransformer.reprojectToWgs84(polygon, grid.crs());
            if (reprojected.isPresent()) {
                geometry = reprojected.get();
                units = CrsUnits.DEGREES;
            }
        }
        SimplifyTolerance tolerance = SimplifyTolerance.forUnits(settings.getSimplifyTolerance(), units);
        if (tolerance.isEnabled()) {
            geometry = TopologyPreservingSimplifier.simplify(geometry, tolerance.value());
        }
        Point centroid = geometry.getCentroid();
        double area = component.pixelCount() * grid.transform().pixelArea();

        // Puntuaciones por detector
        Map<String, Double> detectorScores = new LinkedHashMap<>();
        List<String> triggered = new ArrayList<>();
        DetectorKind primary = null;
        double primaryScore = Double.NEGATIVE_INFINITY;
        for (DetectorKind kind : detection.detectors()) {
            double mean = nanMean(indices, idx -> detection.scoreAt(kind, idx));
            detectorScores.put(kind.getKey(), mean);
            if (mean > threshold) {
                triggered.add(kind.getKey());
                if (mean > primaryScore) {
                    primaryScore = mean;
                    primary = kind;
                }
            }
        }
        double probability = nanMean(indices, detection::combinedAt);
        ConfidenceLevel confidence = ConfidenceLevel.from(probability, settings.getHighConfidence(), settings.getMediumConfidence());

        // Profundidades locales
        double[] localDepths = validDepths(grid, indices);
        Double depthMean = null;
        Double depthStd = null;
        if (localDepths.length > 0) {
            double sum = 0.0;
            for (double d : localDepths) {
                sum += d;
            }
            double mean = sum / localDepths.length;
            double variance = 0.0;
            for (double d : localDepths) {
                variance += (d - mean) * (d - mean);
            }
            depthMean = mean;
            depthStd = Math.sqrt(variance / localDepths.length);
        }

        double qcPriority = priorityCalculator.priority(probability, area, localDepths);
        double isolationMean = detectorScores.getOrDefault(DetectorKind.ISOLATION_FOREST.getKey(), 0.0);
        AnomalyType type = classifier.classify(depthMean, globalMedian, isolationMean);

        Explanation explanation = new Explanation(
                primary != null ? primary.getReason() : DetectorKind.FALLBACK_REASON,
                detectorScores,
                thresholds,
                triggered,
                component.pixelCount());

        return Anomaly.builder()
                .id(idSupplier.get())
                .centroidX(centroid.getX())
                .centroidY(centroid.getY())
                .geometry(geometry)
                .pixelCount(component.pixelCount())
                .areaSqMeters(area)
                .type(type)
                .probability(probability)
                .confidence(confidence)
                .qcPriority(qcPriority)
                .explanation(explanation)
                .localDepthMean(depthMean)
                .localDepthStd(depthStd)
                .build();
    }

    private static double globalMedian(DepthGrid grid) {
        double[] valid = new double[grid.validCount()];
        int n = 0;
        for (int i = 0; i < grid.cellCount(); i++) {
            if (grid.isValidIndex(i)) {
                valid[n++] = grid.depthAtIndex(i);
            }
        }
        return new Median().evaluate(valid);
    }

    private static double[] validDepths(DepthGrid grid, int[] indices) {
        double[] values = new double[indices.length];
        int n = 0;
        for (int idx : indices) {
            if (grid.isValidIndex(idx)) {
                values[n++] = grid.depthAtIndex(idx);
            }
        }
        return n == values.length ? values : Arrays.copyOf(values, n);
    }

    private static double nanMean(int[] indices, IntToDoubleFunction values) {
        double sum = 0.0;
        int count = 0;
        for (int idx : indices) {
            double v = values.applyAsDouble(idx);
            if (!Double.isNaN(v)) {
                sum += v;
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }
}
