package hydroqc.domain.exception;

import java.io.IOException;

/**
 * Se lanza cuando un fichero ráster existe pero no puede interpretarse como una
 * rejilla de profundidades de una sola banda (cabecera corrupta, banda ausente,
 * dimensiones inconsistentes...).
 * <p>
 * Es una {@link IOException} porque el fallo pertenece a la capa de entrada/salida:
 * el llamador lo trata igual que cualquier otro error de lectura fatal.
 */
public class RasterFormatException extends IOException {

    public RasterFormatException(String message) {
        super(message);
    }

    public RasterFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
