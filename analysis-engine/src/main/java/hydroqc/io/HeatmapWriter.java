package hydroqc.io;

import hydroqc.config.OutputSettings;
import hydroqc.domain.grid.DepthGrid;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Escribe la superficie de probabilidad combinada como GeoTIFF float32.
 * <p>
 * Hereda la transformación y el CRS de la rejilla de origen. Las celdas {@code NaN}
 * se escriben con el centinela configurado ({@code outputs.heatmap.nodata_value}).
 */
@Slf4j
public class HeatmapWriter {

    private final OutputSettings settings;
    private final GeoTiffWriter tiffWriter;

    public HeatmapWriter(OutputSettings settings) {
        this(settings, new GeoTiffWriter());
    }

    public HeatmapWriter(OutputSettings settings, GeoTiffWriter tiffWriter) {
        this.settings = Objects.requireNonNull(settings, "La configuración de salida no puede ser nula.");
        this.tiffWriter = Objects.requireNonNull(tiffWriter, "El escritor GeoTIFF no puede ser nulo.");
    }

    /**
     * @param path        Fichero de destino.
     * @param probability Probabilidad combinada por filas, con la forma de {@code source}.
     * @param source      Rejilla de la que se toma la georreferenciación.
     * @return La ruta escrita.
     */
    public Path write(Path path, double[] probability, DepthGrid source) throws IOException {
        Objects.requireNonNull(probability, "La superficie de probabilidad no puede ser nula.");
        if (probability.length != source.cellCount()) {
            throw new IllegalArgumentException("La superficie de probabilidad no tiene la forma de la rejilla.");
        }
        int nodataCells = 0;
        for (double v : probability) {
            if (Double.isNaN(v)) {
                nodataCells++;
            }
        }
        log.debug("Mapa de calor: {} celdas sin dato se escriben como {}", nodataCells, settings.getHeatmapNodata());
        tiffWriter.writeFloat32(path, source.width(), source.height(), probability,
                source.transform(), source.crs(), settings.getHeatmapNodata());
        return path;
    }
}
