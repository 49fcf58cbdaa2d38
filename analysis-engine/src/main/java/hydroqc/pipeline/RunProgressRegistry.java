package hydroqc.pipeline;

import hydroqc.analysis.ProgressListener;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registro de avance de las ejecuciones en curso.
 * <p>
 * Una ejecución se registra al empezar ({@link #start(String)}) y desaparece del
 * registro activo al completarse o fallar. Su último estado queda disponible una
 * sola vez mediante {@link #takeFinished(String)}.
 * <p>
 * Los estados terminados que nadie recoge se descartan por antigüedad a partir de
 * {@link #DEFAULT_MAX_FINISHED} (o del límite indicado en el constructor).
 * <p>
 * El motor no conoce este registro: recibe el {@link ProgressListener} que
 * devuelve {@code start}.
 */
@Slf4j
public class RunProgressRegistry {

    public static final int DEFAULT_MAX_FINISHED = 1000;

    private final Lock lock = new ReentrantLock();
    private final Map<String, ProgressSnapshot> active = new HashMap<>();
    private final Map<String, ProgressSnapshot> finished;

    public RunProgressRegistry() {
        this(DEFAULT_MAX_FINISHED);
    }

    public RunProgressRegistry(int maxFinished) {
        if (maxFinished < 1) {
            throw new IllegalArgumentException("El límite de ejecuciones terminadas debe ser positivo: " + maxFinished);
        }
        this.finished = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ProgressSnapshot> eldest) {
                boolean evict = size() > maxFinished;
                if (evict) {
                    log.debug("Se descarta el estado terminado de {} sin recoger.", eldest.getKey());
                }
                return evict;
            }
        };
    }

    /**
     * Registra una ejecución y devuelve el receptor que actualiza su avance.
     *
     * @throws IllegalStateException Si ya hay una ejecución activa con ese identificador.
     */
    public ProgressListener start(String runId) {
        lock.lock();
        try {
            if (active.containsKey(runId)) {
                throw new IllegalStateException("La ejecución " + runId + " ya está registrada.");
            }
            finished.remove(runId);
            active.put(runId, new ProgressSnapshot(runId, 0, "Queued", RunState.RUNNING, null, Instant.now()));
        } finally {
            lock.unlock();
        }
        log.debug("Ejecución {} registrada.", runId);
        return (percent, step) -> update(runId, percent, step);
    }

    private void update(String runId, int percent, String step) {
        lock.lock();
        try {
            ProgressSnapshot current = active.get(runId);
            if (current != null) {
                active.put(runId, current.advance(percent, step));
            }
        } finally {
            lock.unlock();
        }
        log.debug("[{}] {}% {}", runId, percent, step);
    }

    public Optional<ProgressSnapshot> get(String runId) {
        lock.lock();
        try {
            return Optional.ofNullable(active.get(runId));
        } finally {
            lock.unlock();
        }
    }

    public void complete(String runId) {
        finish(runId, RunState.COMPLETED, null);
    }

    public void fail(String runId, String message) {
        finish(runId, RunState.FAILED, message);
    }

    private void finish(String runId, RunState state, String message) {
        lock.lock();
        try {
            ProgressSnapshot current = active.remove(runId);
            if (current != null) {
                finished.put(runId, current.finish(state, message));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Devuelve (y olvida) el último estado de una ejecución terminada.
     */
    public Optional<ProgressSnapshot> takeFinished(String runId) {
        lock.lock();
        try {
            return Optional.ofNullable(finished.remove(runId));
        } finally {
            lock.unlock();
        }
    }

    public int finishedCount() {
        lock.lock();
        try {
            return finished.size();
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return active.size();
        } finally {
            lock.unlock();
        }
    }
}
