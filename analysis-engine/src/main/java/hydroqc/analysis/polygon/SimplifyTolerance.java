package hydroqc.analysis.polygon;

import hydroqc.domain.grid.CrsUnits;

/**
 * Tolerancia de simplificación expresada en las unidades de las coordenadas que se simplifican.
 *
 * @param value Tolerancia.
 * @param units Unidades de {@code value}.
 */
record SimplifyTolerance(double value, CrsUnits units) {

    /**
     * Deriva la tolerancia a partir de la base configurada (pensada en grados).
     * En grados se usa tal cual; en metros (o desconocidas) se multiplica por 10
     * si la base es menor que 0.1.
     */
    static SimplifyTolerance forUnits(double base, CrsUnits units) {
        if (units == CrsUnits.DEGREES) {
            return new SimplifyTolerance(base, units);
        }
        return new SimplifyTolerance(base < 0.1 ? base * 10.0 : base, units);
    }

    boolean isEnabled() {
        return value > 0.0;
    }
}
