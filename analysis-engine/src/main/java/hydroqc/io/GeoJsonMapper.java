package hydroqc.io;

import hydroqc.domain.anomaly.Anomaly;
import hydroqc.domain.chart.ContourLine;
import hydroqc.domain.chart.ContourSet;
import hydroqc.domain.chart.SoundingPoint;
import hydroqc.domain.chart.SoundingSet;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Convierte los resultados del motor en FeatureCollections GeoJSON representadas
 * como mapas, listas para serializar con Jackson.
 */
public final class GeoJsonMapper {

    private GeoJsonMapper() {
    }

    // --- Anomalías ---

    /**
     * @param anomalies Anomalías en orden de cola de revisión.
     * @param runId     Identificador de la ejecución, o {@code null}.
     */
    public static Map<String, Object> anomalies(List<Anomaly> anomalies, String runId) {
        List<Map<String, Object>> features = new ArrayList<>();
        for (Anomaly anomaly : anomalies) {
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("anomaly_id", anomaly.getId().toString());
            if (runId != null) {
                properties.put("run_id", runId);
            }
            properties.put("anomaly_type", anomaly.getType().getCode());
            properties.put("anomaly_probability", round(anomaly.getProbability(), 4));
            properties.put("confidence_level", anomaly.getConfidence().getCode());
            properties.put("qc_priority", round(anomaly.getQcPriority(), 4));
            properties.put("review_decision", anomaly.getReviewDecision().getCode());
            properties.put("explanation", anomaly.getExplanation());
            properties.put("area_sq_meters", anomaly.getAreaSqMeters());
            properties.put("local_depth_mean", anomaly.getLocalDepthMean());
            properties.put("local_depth_std", anomaly.getLocalDepthStd());

            Map<String, Object> feature = feature(geometry(anomaly.getGeometry()), properties);
            feature.put("id", anomaly.getId().toString());
            features.add(feature);
        }
        return featureCollection(features, Map.of());
    }

    // --- Sondas ---

    /**
     * @param appliedCellSize Tamaño de celda derivado de la escala, o {@code null} si se pidió directamente.
     */
    public static Map<String, Object> soundings(SoundingSet set, Double appliedCellSize) {
        List<Map<String, Object>> features = new ArrayList<>();
        for (SoundingPoint point : set.soundings()) {
            Map<String, Object> geometry = new LinkedHashMap<>();
            geometry.put("type", "Point");
            geometry.put("coordinates", List.of(point.x(), point.y()));

            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("depth", round(point.depth(), 2));
            properties.put("selection_type", point.mode().getKey());
            properties.put("cell_row", point.cellRow());
            properties.put("cell_col", point.cellCol());
            features.add(feature(geometry, properties));
        }
        Map<String, Object> collection = new LinkedHashMap<>();
        collection.put("cell_size_meters", set.cellSize());
        collection.put("selection_mode", set.mode().getKey());
        collection.put("total_soundings", set.size());
        if (set.targetScale() != null) {
            collection.put("target_scale", set.targetScale());
            collection.put("applied_cell_size", appliedCellSize != null ? appliedCellSize : set.cellSize());
        }
        return featureCollection(features, collection);
    }

    // --- Isóbatas ---

    public static Map<String, Object> contours(ContourSet set) {
        List<Map<String, Object>> features = new ArrayList<>();
        for (ContourLine contour : set.contours()) {
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("depth", round(contour.depth(), 1));
            properties.put("length_m", round(contour.length(), 1));
            properties.put("is_closed", contour.closed());
            features.add(feature(geometry(contour.geometry()), properties));
        }
        Map<String, Object> collection = new LinkedHashMap<>();
        collection.put("contour_interval", set.interval());
        collection.put("smoothing_iterations", set.smoothingIterations());
        collection.put("total_contours", set.size());
        return featureCollection(features, collection);
    }

    // --- Geometrías ---

    /**
     * Geometría JTS → objeto GeoJSON. Admite Point, LineString, Polygon y MultiPolygon.
     */
    public static Map<String, Object> geometry(Geometry geometry) {
        Map<String, Object> json = new LinkedHashMap<>();
        if (geometry instanceof Point point) {
            json.put("type", "Point");
            json.put("coordinates", position(point.getCoordinate()));
        } else if (geometry instanceof LineString line) {
            json.put("type", "LineString");
            json.put("coordinates", positions(line.getCoordinates()));
        } else if (geometry instanceof Polygon polygon) {
            json.put("type", "Polygon");
            json.put("coordinates", rings(polygon));
        } else if (geometry instanceof MultiPolygon multi) {
            List<Object> polygons = new ArrayList<>();
            for (int i = 0; i < multi.getNumGeometries(); i++) {
                polygons.add(rings((Polygon) multi.getGeometryN(i)));
            }
            json.put("type", "MultiPolygon");
            json.put("coordinates", polygons);
        } else {
            throw new IllegalArgumentException("Tipo de geometría no soportado en GeoJSON: " + geometry.getGeometryType());
        }
        return json;
    }

    private static List<Object> rings(Polygon polygon) {
        List<Object> rings = new ArrayList<>();
        rings.add(positions(polygon.getExteriorRing().getCoordinates()));
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            rings.add(positions(polygon.getInteriorRingN(i).getCoordinates()));
        }
        return rings;
    }

    private static List<Object> positions(Coordinate[] coordinates) {
        List<Object> list = new ArrayList<>(coordinates.length);
        for (Coordinate c : coordinates) {
            list.add(position(c));
        }
        return list;
    }

    private static List<Double> position(Coordinate c) {
        return List.of(c.x, c.y);
    }

    private static Map<String, Object> feature(Map<String, Object> geometry, Map<String, Object> properties) {
        Map<String, Object> feature = new LinkedHashMap<>();
        feature.put("type", "Feature");
        feature.put("geometry", geometry);
        feature.put("properties", properties);
        return feature;
    }

    private static Map<String, Object> featureCollection(List<Map<String, Object>> features, Map<String, Object> properties) {
        Map<String, Object> collection = new LinkedHashMap<>();
        collection.put("type", "FeatureCollection");
        collection.put("features", features);
        if (!properties.isEmpty()) {
            collection.put("properties", properties);
        }
        return collection;
    }

    static double round(double value, int decimals) {
        if (!Double.isFinite(value)) {
            return value;
        }
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
