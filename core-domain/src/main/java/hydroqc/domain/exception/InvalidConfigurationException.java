package hydroqc.domain.exception;

/**
 * Valor de configuración fuera de rango o con un tipo que no se puede interpretar
 * (ventana negativa, umbral fuera de [0,1], modo de selección desconocido...).
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
