package hydroqc.domain.grid;

import java.util.Objects;

/**
 * Resultado de cargar un ráster: la rejilla, sus metadatos y sus estadísticas.
 */
public record LoadedGrid(DepthGrid grid, GridMetadata metadata, GridStatistics statistics) {

    public LoadedGrid {
        Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        Objects.requireNonNull(metadata, "Los metadatos no pueden ser nulos.");
        Objects.requireNonNull(statistics, "Las estadísticas no pueden ser nulas.");
    }
}
