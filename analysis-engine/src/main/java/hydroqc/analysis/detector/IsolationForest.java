package hydroqc.analysis.detector;

import hydroqc.config.IsolationForestSettings;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Bosque de aislamiento (Liu, Ting y Zhou, 2008).
 * <p>
 * <b>Entrenamiento:</b> cada árbol se construye sobre una submuestra sin reemplazo de
 * tamaño ψ. En cada nodo se elige una característica no constante al azar y un umbral
 * uniforme entre su mínimo y su máximo; {@code x <= umbral} va a la izquierda. La
 * profundidad se limita a ⌈log₂ max(ψ, 2)⌉.
 * <p>
 * <b>Puntuación:</b> {@code score = −2^(−E[h(x)] / c(ψ))}, donde h es la profundidad
 * alcanzada más c(tamaño de la hoja). Valores más negativos = más anómalos. La
 * función de decisión resta el desplazamiento calculado como el percentil
 * {@code 100·contamination} de las puntuaciones de entrenamiento.
 * <p>
 * <b>Determinismo:</b> las semillas de cada árbol se extraen en secuencia de la semilla
 * maestra y la suma de profundidades se acumula siempre en el orden de los árboles,
 * así que el resultado no depende del número de hilos.
 */
@Slf4j
public final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649;

    /**
     * Rango mínimo para considerar que una característica no es constante en un nodo.
     */
    private static final double FEATURE_THRESHOLD = 1e-7;

    private final List<Node> trees;

    @Getter
    private final int sampleSize;

    @Getter
    private final int featureCount;

    @Getter
    private final double offset;

    private final int jobs;

    private IsolationForest(List<Node> trees, int sampleSize, int featureCount, int jobs, double[][] trainingData,
                            double contamination) {
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.featureCount = featureCount;
        this.jobs = jobs;
        double[] trainingScores = scoreSamples(trainingData);
        this.offset = new Percentile()
                .withEstimationType(EstimationType.R_7)
                .evaluate(trainingScores, 100.0 * contamination);
    }

    /**
     * Entrena un bosque sobre una matriz {@code [fila][característica]} sin valores no finitos.
     *
     * @param data     Matriz de entrenamiento (al menos una fila).
     * @param settings Hiperparámetros.
     * @return El modelo entrenado.
     */
    public static IsolationForest fit(double[][] data, IsolationForestSettings settings) {
        Objects.requireNonNull(data, "La matriz de entrenamiento no puede ser nula.");
        Objects.requireNonNull(settings, "La configuración del bosque no puede ser nula.");
        if (data.length == 0) {
            throw new IllegalArgumentException("No se puede entrenar un bosque de aislamiento sin muestras.");
        }
        final int rows = data.length;
        final int features = data[0].length;
        final int psi = settings.resolveSampleSize(rows);
        final int maxDepth = (int) Math.ceil(log2(Math.max(psi, 2)));
        final int jobs = Math.max(1, settings.resolveJobs());

        // Semillas por árbol, extraídas en secuencia para no depender del paralelismo.
        Random master = new Random(settings.getRandomState());
        long[] seeds = new long[settings.getEstimators()];
        for (int t = 0; t < seeds.length; t++) {
            seeds[t] = master.nextLong();
        }

        List<Callable<Node>> tasks = new ArrayList<>(seeds.length);
        for (long seed : seeds) {
            tasks.add(() -> buildTree(data, features, psi, maxDepth, new Random(seed)));
        }
        List<Node> trees = runAll(tasks, jobs);

        log.debug("Bosque de aislamiento entrenado: {} árboles, ψ = {}, profundidad máxima {}, {} hilos.",
                trees.size(), psi, maxDepth, jobs);
        return new IsolationForest(trees, psi, features, jobs, data, settings.getContamination());
    }

    /**
     * Puntuación bruta: {@code −2^(−E[h]/c(ψ))}, en [−1, 0).
     */
    public double[] scoreSamples(double[][] data) {
        final int rows = data.length;
        final double[] scores = new double[rows];
        final double normalizer = averagePathLength(sampleSize);
        int chunks = Math.min(jobs, Math.max(1, rows));
        int chunkSize = (rows + chunks - 1) / Math.max(chunks, 1);

        List<Callable<Void>> tasks = new ArrayList<>(chunks);
        for (int start = 0; start < rows; start += Math.max(chunkSize, 1)) {
            final int from = start;
            final int to = Math.min(rows, start + chunkSize);
            tasks.add(() -> {
                for (int i = from; i < to; i++) {
                    double totalDepth = 0.0;
                    for (Node tree : trees) {
                        totalDepth += pathLength(tree, data[i]);
                    }
                    double meanDepth = totalDepth / trees.size();
                    double ratio = normalizer == 0.0 ? 1.0 : meanDepth / normalizer;
                    scores[i] = -Math.pow(2.0, -ratio);
                }
                return null;
            });
        }
        runAll(tasks, jobs);
        return scores;
    }

    /**
     * Función de decisión: negativa para atípicos.
     */
    public double[] decisionFunction(double[][] data) {
        double[] scores = scoreSamples(data);
        for (int i = 0; i < scores.length; i++) {
            scores[i] -= offset;
        }
        return scores;
    }

    public int treeCount() {
        return trees.size();
    }

    /**
     * Longitud media de búsqueda infructuosa en un árbol binario de n elementos.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    // --- Construcción ---

    private static Node buildTree(double[][] data, int features, int psi, int maxDepth, Random random) {
        int[] sample = sampleWithoutReplacement(data.length, psi, random);
        return split(data, sample, 0, sample.length, features, 0, maxDepth, random);
    }

    private static Node split(double[][] data, int[] idx, int from, int to, int features,
                              int depth, int maxDepth, Random random) {
        int size = to - from;
        if (depth >= maxDepth || size <= 1) {
            return Node.leaf(size);
        }

        // Se prueban las características en orden aleatorio hasta encontrar una no constante.
        int[] order = new int[features];
        for (int f = 0; f < features; f++) {
            order[f] = f;
        }
        for (int remaining = features; remaining > 0; remaining--) {
            int pick = random.nextInt(remaining);
            int feature = order[pick];
            order[pick] = order[remaining - 1];

            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int k = from; k < to; k++) {
                double v = data[idx[k]][feature];
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            if (max - min <= FEATURE_THRESHOLD) {
                continue;
            }

            double threshold = min + random.nextDouble() * (max - min);
            if (threshold >= max) {
                threshold = min;
            }

            // Partición en el sitio: [from, mid) <= umbral < [mid, to)
            int mid = from;
            for (int k = from; k < to; k++) {
                if (data[idx[k]][feature] <= threshold) {
                    int tmp = idx[mid];
                    idx[mid] = idx[k];
                    idx[k] = tmp;
                    mid++;
                }
            }
            Node left = split(data, idx, from, mid, features, depth + 1, maxDepth, random);
            Node right = split(data, idx, mid, to, features, depth + 1, maxDepth, random);
            return Node.internal(feature, threshold, left, right);
        }
        // Todas las características son constantes en este nodo.
        return Node.leaf(size);
    }

    // Fisher-Yates parcial sobre un índice disperso: O(k) en memoria.
    private static int[] sampleWithoutReplacement(int n, int k, Random random) {
        Map<Integer, Integer> swapped = new HashMap<>();
        int[] sample = new int[k];
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int atJ = swapped.getOrDefault(j, j);
            int atI = swapped.getOrDefault(i, i);
            swapped.put(j, atI);
            sample[i] = atJ;
        }
        return sample;
    }

    private static double pathLength(Node node, double[] row) {
        int depth = 0;
        Node current = node;
        while (!current.isLeaf()) {
            current = row[current.feature] <= current.threshold ? current.left : current.right;
            depth++;
        }
        return depth + averagePathLength(current.size);
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2.0);
    }

    // --- Ejecución ---

    private static <T> List<T> runAll(List<Callable<T>> tasks, int jobs) {
        List<T> results = new ArrayList<>(tasks.size());
        if (jobs <= 1 || tasks.size() <= 1) {
            for (Callable<T> task : tasks) {
                try {
                    results.add(task.call());
                } catch (Exception e) {
                    throw new IllegalStateException("Fallo en el bosque de aislamiento.", e);
                }
            }
            return results;
        }
        ExecutorService threadPool = Executors.newFixedThreadPool(Math.min(jobs, tasks.size()));
        try {
            List<Future<T>> futures = threadPool.invokeAll(tasks);
            for (Future<T> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Bosque de aislamiento interrumpido.", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Fallo en un hilo del bosque de aislamiento.", e.getCause());
        } finally {
            threadPool.shutdownNow();
        }
    }

    // --- Nodo ---

    private static final class Node {
        final int feature;
        final double threshold;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double threshold, Node left, Node right, int size) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }

        static Node internal(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, left, right, 0);
        }

        boolean isLeaf() {
            return feature < 0;
        }
    }
}
