package hydroqc.chart.contour;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Cálculo de los niveles de isóbata.
 */
@Slf4j
final class ContourLevels {

    private ContourLevels() {
    }

    /**
     * Niveles múltiplos de {@code interval} que cubren {@code [min, max]}. Si superan
     * {@code maxLevels} se submuestrean en índices {@code ⌊k·(n−1)/(maxLevels−1)⌋},
     * de forma que se conservan el primero y el último.
     */
    static List<Double> levels(double min, double max, double interval, int maxLevels) {
        double start = Math.floor(min / interval) * interval;
        double end = Math.ceil(max / interval) * interval;
        long steps = Math.round((end - start) / interval);

        List<Double> all = new ArrayList<>();
        for (long k = 0; k <= steps; k++) {
            all.add(start + k * interval);
        }
        if (all.size() <= maxLevels) {
            return all;
        }

        log.info("Reduciendo niveles de isóbata de {} a {}", all.size(), maxLevels);
        int n = all.size();
        List<Double> sampled = new ArrayList<>(maxLevels);
        for (int k = 0; k < maxLevels; k++) {
            int index = (int) ((long) k * (n - 1) / (maxLevels - 1));
            sampled.add(all.get(index));
        }
        return sampled;
    }
}
