package hydroqc.pipeline;

import hydroqc.analysis.ProgressListener;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Ejecuta análisis fuera del hilo del llamador y mantiene su avance.
 * <p>
 * Cada envío registra la ejecución en el {@link RunProgressRegistry}, la lanza en el
 * ejecutor y la retira del registro al terminar. Los fallos se registran en el log
 * y se propagan sin envolver a través del futuro.
 */
@Slf4j
public class AnalysisRunService implements AutoCloseable {

    private final AnalysisPipeline pipeline;
    private final ExecutorService executor;
    private final RunProgressRegistry registry;

    public AnalysisRunService(AnalysisPipeline pipeline, int workers) {
        this(pipeline, Executors.newFixedThreadPool(workers), new RunProgressRegistry());
    }

    public AnalysisRunService(AnalysisPipeline pipeline, ExecutorService executor, RunProgressRegistry registry) {
        this.pipeline = Objects.requireNonNull(pipeline, "El pipeline no puede ser nulo.");
        this.executor = Objects.requireNonNull(executor, "El ejecutor no puede ser nulo.");
        this.registry = Objects.requireNonNull(registry, "El registro de avance no puede ser nulo.");
    }

    /**
     * Encola el análisis de un ráster.
     *
     * @param runId     Identificador único de la ejecución.
     * @param input     GeoTIFF de entrada.
     * @param outputDir Directorio de salida.
     * @return Futuro con el resultado; falla con la excepción original del pipeline.
     */
    public CompletableFuture<AnalysisResult> submit(String runId, Path input, Path outputDir) {
        ProgressListener listener = registry.start(runId);
        CompletableFuture<AnalysisResult> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    AnalysisResult result = pipeline.run(runId, input, outputDir, listener);
                    registry.complete(runId);
                    future.complete(result);
                } catch (Throwable e) {
                    // Un Error del pipeline también debe cerrar la ejecución y el futuro.
                    log.error("La ejecución {} ha fallado", runId, e);
                    registry.fail(runId, e.getMessage());
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("No se pudo encolar la ejecución {}", runId, e);
            registry.fail(runId, e.getMessage());
            future.completeExceptionally(e);
        }
        log.info("Ejecución {} encolada para {}", runId, input);
        return future;
    }

    public Optional<ProgressSnapshot> progress(String runId) {
        return registry.get(runId);
    }

    /**
     * Último estado de una ejecución terminada; solo se entrega una vez.
     */
    public Optional<ProgressSnapshot> finishedProgress(String runId) {
        return registry.takeFinished(runId);
    }

    public RunProgressRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Las ejecuciones no terminaron en 30 s; se fuerza el apagado.");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
