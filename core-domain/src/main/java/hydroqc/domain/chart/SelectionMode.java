package hydroqc.domain.chart;

import com.fasterxml.jackson.annotation.JsonValue;
import hydroqc.domain.exception.InvalidConfigurationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Criterio para elegir la sonda representativa de una celda.
 */
@Getter
@RequiredArgsConstructor
public enum SelectionMode {

    /**
     * Valor más somero: mínimo |profundidad|, conservando el signo.
     */
    SHOAL("shoal"),

    /**
     * Valor más profundo: máximo |profundidad|.
     */
    DEEP("deep"),

    /**
     * Mediana de la celda.
     */
    REPRESENTATIVE("representative");

    @JsonValue
    private final String key;

    public static SelectionMode fromKey(String key) {
        if (key == null) {
            throw new InvalidConfigurationException("El modo de selección no puede ser nulo.");
        }
        String normalized = key.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(mode -> mode.key.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidConfigurationException("Modo de selección desconocido: " + key));
    }
}
