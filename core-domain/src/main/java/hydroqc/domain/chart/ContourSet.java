package hydroqc.domain.chart;

import java.util.List;

/**
 * Isóbatas generadas para una rejilla, con los parámetros usados.
 */
public record ContourSet(List<ContourLine> contours, double interval, int smoothingIterations) {

    public ContourSet {
        contours = List.copyOf(contours);
    }

    public int size() {
        return contours.size();
    }
}
