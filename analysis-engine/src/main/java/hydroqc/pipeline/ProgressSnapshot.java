package hydroqc.pipeline;

import java.time.Instant;

/**
 * Último estado conocido de una ejecución.
 *
 * @param runId     Identificador de la ejecución.
 * @param percent   Porcentaje completado.
 * @param step      Etiqueta de la etapa.
 * @param state     Estado del ciclo de vida.
 * @param error     Mensaje de error si la ejecución falló, o {@code null}.
 * @param updatedAt Instante de la última actualización.
 */
public record ProgressSnapshot(String runId, int percent, String step, RunState state, String error, Instant updatedAt) {

    ProgressSnapshot advance(int newPercent, String newStep) {
        return new ProgressSnapshot(runId, newPercent, newStep, state, error, Instant.now());
    }

    ProgressSnapshot finish(RunState finalState, String message) {
        int finalPercent = finalState == RunState.COMPLETED ? 100 : percent;
        return new ProgressSnapshot(runId, finalPercent, step, finalState, message, Instant.now());
    }
}
