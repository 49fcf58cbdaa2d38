package hydroqc.config;

import hydroqc.domain.chart.SelectionMode;
import hydroqc.domain.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros por defecto de la selección de sondas.
 */
@Value
@Builder
@With
public class SoundingSettings {

    /**
     * Lado de la celda de decimación, en unidades del CRS de la rejilla.
     */
    @Builder.Default
    double cellSize = 50.0;

    @Builder.Default
    SelectionMode mode = SelectionMode.SHOAL;

    public static SoundingSettings from(ProcessingConfig config) {
        SoundingSettings settings = SoundingSettings.builder()
                .cellSize(config.getDouble("soundings.cell_size_meters", 50.0))
                .mode(SelectionMode.fromKey(config.getString("soundings.selection_mode", "shoal")))
                .build();
        settings.validate();
        return settings;
    }

    public void validate() {
        if (!(cellSize > 0.0)) {
            throw new InvalidConfigurationException("El tamaño de celda debe ser positivo: " + cellSize);
        }
    }
}
