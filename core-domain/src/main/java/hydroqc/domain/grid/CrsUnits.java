package hydroqc.domain.grid;

/**
 * Unidades horizontales de un sistema de referencia.
 */
public enum CrsUnits {
    DEGREES,
    METERS,
    UNKNOWN
}
