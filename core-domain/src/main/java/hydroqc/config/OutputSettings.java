package hydroqc.config;

import lombok.Builder;
import lombok.Value;

/**
 * Nombres y valores de los ficheros que produce una ejecución.
 */
@Value
@Builder
public class OutputSettings {

    @Builder.Default
    double heatmapNodata = -9999.0;

    @Builder.Default
    String heatmapFileName = "anomaly_heatmap.tif";

    @Builder.Default
    String anomaliesFileName = "anomalies.geojson";

    public static OutputSettings from(ProcessingConfig config) {
        return OutputSettings.builder()
                .heatmapNodata(config.getDouble("outputs.heatmap.nodata_value", -9999.0))
                .heatmapFileName(config.getString("outputs.heatmap.file_name", "anomaly_heatmap.tif"))
                .anomaliesFileName(config.getString("outputs.polygons.file_name", "anomalies.geojson"))
                .build();
    }
}
