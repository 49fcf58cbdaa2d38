package hydroqc.pipeline;

import hydroqc.analysis.ProgressListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Pruebas unitarias para {@link RunProgressRegistry}.
 */
class RunProgressRegistryTest {

    private RunProgressRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RunProgressRegistry();
    }

    @Test
    @DisplayName("El receptor devuelto al registrar debería actualizar el avance de la ejecución")
    void start_listener_shouldUpdateSnapshot() {
        // --- 1. Arrange ---
        ProgressListener listener = registry.start("run-1");

        // --- 2. Act ---
        listener.onProgress(45, "Computing roughness");

        // --- 3. Assert ---
        ProgressSnapshot snapshot = registry.get("run-1").orElseThrow();
        assertEquals(45, snapshot.percent());
        assertEquals("Computing roughness", snapshot.step());
        assertEquals(RunState.RUNNING, snapshot.state());
        assertEquals(1, registry.activeCount());
    }

    @Test
    @DisplayName("Al completarse la ejecución debería salir del registro activo y entregarse una sola vez")
    void complete_shouldMoveToFinishedOnce() {
        // --- 1. Arrange ---
        registry.start("run-1").onProgress(95, "Writing anomaly GeoJSON");

        // --- 2. Act ---
        registry.complete("run-1");

        // --- 3. Assert ---
        assertThat(registry.get("run-1")).isEmpty();
        assertEquals(0, registry.activeCount());
        ProgressSnapshot finished = registry.takeFinished("run-1").orElseThrow();
        assertEquals(RunState.COMPLETED, finished.state());
        assertEquals(100, finished.percent());
        assertThat(registry.takeFinished("run-1")).isEmpty();
    }

    @Test
    @DisplayName("Un fallo debería conservar el último avance y el mensaje de error")
    void fail_shouldKeepLastPercentAndMessage() {
        registry.start("run-2").onProgress(60, "Running Isolation Forest");

        registry.fail("run-2", "boom");

        ProgressSnapshot failed = registry.takeFinished("run-2").orElseThrow();
        assertEquals(RunState.FAILED, failed.state());
        assertEquals(60, failed.percent());
        assertEquals("boom", failed.error());
    }

    @Test
    @DisplayName("Registrar dos veces la misma ejecución activa debería fallar")
    void start_duplicateActiveRun_shouldThrow() {
        registry.start("run-3");

        assertThrows(IllegalStateException.class, () -> registry.start("run-3"));
    }

    @Test
    @DisplayName("Los avisos tras terminar no deberían resucitar la ejecución")
    void listener_afterFinish_shouldBeIgnored() {
        ProgressListener listener = registry.start("run-4");
        registry.complete("run-4");

        listener.onProgress(10, "late");

        assertThat(registry.get("run-4")).isEmpty();
        assertTrue(registry.takeFinished("run-4").isPresent());
    }

    @Test
    @DisplayName("Los estados terminados sin recoger deberían descartarse por antigüedad al superar el límite")
    void complete_beyondFinishedLimit_shouldEvictOldestSnapshots() {
        // --- 1. Arrange ---
        RunProgressRegistry bounded = new RunProgressRegistry(2);

        // --- 2. Act ---
        for (int i = 1; i <= 3; i++) {
            bounded.start("run-" + i);
            bounded.complete("run-" + i);
        }

        // --- 3. Assert ---
        assertEquals(2, bounded.finishedCount());
        assertThat(bounded.takeFinished("run-1")).isEmpty();
        assertTrue(bounded.takeFinished("run-2").isPresent());
        assertTrue(bounded.takeFinished("run-3").isPresent());
        assertEquals(0, bounded.finishedCount());
    }

    @Test
    @DisplayName("Un límite no positivo de estados terminados debería rechazarse")
    void constructor_nonPositiveLimit_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new RunProgressRegistry(0));
    }
}
