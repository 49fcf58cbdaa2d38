package hydroqc.domain.grid;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Estadísticas resumen de las celdas válidas de una rejilla.
 * <p>
 * Con cero celdas válidas los valores son {@code null} ("indefinidos"), pero los
 * contadores siguen rellenos. La desviación típica es poblacional.
 */
public record GridStatistics(
        @JsonProperty("z_min") Double min,
        @JsonProperty("z_max") Double max,
        @JsonProperty("z_mean") Double mean,
        @JsonProperty("z_std") Double std,
        @JsonProperty("z_median") Double median,
        @JsonProperty("valid_count") long validCount,
        @JsonProperty("nodata_count") long nodataCount,
        @JsonProperty("total_count") long totalCount
) {

    public static GridStatistics of(DepthGrid grid) {
        double[] valid = new double[grid.validCount()];
        int k = 0;
        for (int i = 0; i < grid.cellCount(); i++) {
            if (grid.isValidIndex(i)) {
                valid[k++] = grid.depthAtIndex(i);
            }
        }
        long total = grid.cellCount();
        if (valid.length == 0) {
            return new GridStatistics(null, null, null, null, null, 0, total, total);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : valid) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new GridStatistics(
                min,
                max,
                new Mean().evaluate(valid),
                new StandardDeviation(false).evaluate(valid),
                new Median().evaluate(valid),
                valid.length,
                total - valid.length,
                total);
    }

    @JsonIgnore
    public boolean isDefined() {
        return validCount > 0;
    }

    /**
     * Porcentaje de celdas sin dato (0 si la rejilla está vacía).
     */
    @JsonProperty("nodata_percentage")
    public double nodataPercentage() {
        return totalCount == 0 ? 0.0 : 100.0 * nodataCount / totalCount;
    }
}
