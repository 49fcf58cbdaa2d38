package hydroqc.factory;

import hydroqc.domain.grid.DepthGrid;

import java.util.List;

/**
 * Levantamiento sintético y la lista de artefactos que contiene.
 */
public record SyntheticSurvey(DepthGrid grid, List<EmbeddedAnomaly> embeddedAnomalies) {

    public SyntheticSurvey {
        embeddedAnomalies = List.copyOf(embeddedAnomalies);
    }
}
