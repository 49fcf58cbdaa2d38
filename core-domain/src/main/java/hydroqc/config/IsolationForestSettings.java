package hydroqc.config;

import hydroqc.domain.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Hiperparámetros del bosque de aislamiento.
 * <p>
 * {@code maxSamples} admite tres formas:
 * <ul>
 *     <li>{@code "auto"}: min(256, n).</li>
 *     <li>Un entero: número absoluto de muestras por árbol (limitado a n).</li>
 *     <li>Un decimal en (0, 1]: fracción de n.</li>
 * </ul>
 */
@Value
@Builder
@With
public class IsolationForestSettings {

    public static final String AUTO = "auto";
    public static final int AUTO_MAX_SAMPLES = 256;

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    int estimators = 100;

    /**
     * Proporción esperada de atípicos. Solo desplaza el umbral de decisión.
     */
    @Builder.Default
    double contamination = 0.1;

    @Builder.Default
    String maxSamples = AUTO;

    @Builder.Default
    long randomState = 42L;

    /**
     * Hilos de trabajo. -1 usa todos los procesadores disponibles.
     */
    @Builder.Default
    int jobs = -1;

    public static IsolationForestSettings from(ProcessingConfig config) {
        String prefix = "anomaly_detection.isolation_forest.";
        IsolationForestSettings settings = IsolationForestSettings.builder()
                .enabled(config.getBoolean(prefix + "enabled", true))
                .estimators(config.getInt(prefix + "n_estimators", 100))
                .contamination(config.getDouble(prefix + "contamination", 0.1))
                .maxSamples(config.getString(prefix + "max_samples", AUTO))
                .randomState(config.getLong(prefix + "random_state", 42L))
                .jobs(config.getInt(prefix + "n_jobs", -1))
                .build();
        settings.validate();
        return settings;
    }

    public void validate() {
        if (estimators < 1) {
            throw new InvalidConfigurationException("n_estimators debe ser al menos 1: " + estimators);
        }
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new InvalidConfigurationException("contamination debe estar en (0, 0.5]: " + contamination);
        }
        if (jobs == 0 || jobs < -1) {
            throw new InvalidConfigurationException("n_jobs debe ser -1 o positivo: " + jobs);
        }
        // Fuerza la interpretación para detectar valores inválidos al cargar.
        resolveSampleSize(Integer.MAX_VALUE);
    }

    /**
     * Calcula el tamaño de submuestra ψ para un conjunto de {@code n} filas.
     *
     * @param n Número de filas disponibles.
     * @return ψ en [1, n] (o 0 si n es 0).
     */
    public int resolveSampleSize(int n) {
        if (n <= 0) {
            return 0;
        }
        String raw = maxSamples == null ? AUTO : maxSamples.trim();
        if (AUTO.equalsIgnoreCase(raw)) {
            return Math.min(AUTO_MAX_SAMPLES, n);
        }
        try {
            if (!raw.contains(".")) {
                int count = Integer.parseInt(raw);
                if (count < 1) {
                    throw new InvalidConfigurationException("max_samples debe ser positivo: " + raw);
                }
                return Math.min(count, n);
            }
            double fraction = Double.parseDouble(raw);
            if (!(fraction > 0.0 && fraction <= 1.0)) {
                throw new InvalidConfigurationException("max_samples fraccionario debe estar en (0, 1]: " + raw);
            }
            return Math.max(1, (int) (fraction * n));
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("max_samples no reconocido: " + raw, e);
        }
    }

    /**
     * Número efectivo de hilos.
     */
    public int resolveJobs() {
        return jobs == -1 ? Runtime.getRuntime().availableProcessors() : jobs;
    }
}
