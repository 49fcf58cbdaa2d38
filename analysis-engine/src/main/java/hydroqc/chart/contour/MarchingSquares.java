package hydroqc.chart.contour;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracción de isolíneas por marching squares con interpolación lineal.
 * <p>
 * Las muestras están en los nodos (fila, columna) de la rejilla. Una celda con alguna
 * esquina {@code NaN} no genera segmentos. Los segmentos se enlazan por la arista que
 * comparten; las trayectorias cerradas repiten su primer punto al final.
 * Las coordenadas devueltas son {@code {columna, fila}} fraccionarias.
 */
final class MarchingSquares {

    private static final int TOP = 0;
    private static final int RIGHT = 1;
    private static final int BOTTOM = 2;
    private static final int LEFT = 3;

    private final double[] values;
    private final int width;
    private final int height;

    MarchingSquares(double[] values, int width, int height) {
        this.values = values;
        this.width = width;
        this.height = height;
    }

    /**
     * Trayectorias de la isolínea {@code level}, cada una como lista de puntos {columna, fila}.
     */
    List<List<double[]>> trace(double level) {
        // 1. Segmentos por celda, identificados por sus dos aristas
        List<long[]> segments = new ArrayList<>();
        for (int r = 0; r < height - 1; r++) {
            for (int c = 0; c < width - 1; c++) {
                double tl = values[r * width + c];
                double tr = values[r * width + c + 1];
                double br = values[(r + 1) * width + c + 1];
                double bl = values[(r + 1) * width + c];
                if (Double.isNaN(tl) || Double.isNaN(tr) || Double.isNaN(br) || Double.isNaN(bl)) {
                    continue;
                }
                int caseIndex = (tl >= level ? 8 : 0) | (tr >= level ? 4 : 0) | (br >= level ? 2 : 0) | (bl >= level ? 1 : 0);
                switch (caseIndex) {
                    case 1, 14 -> segments.add(segment(r, c, LEFT, BOTTOM));
                    case 2, 13 -> segments.add(segment(r, c, BOTTOM, RIGHT));
                    case 3, 12 -> segments.add(segment(r, c, LEFT, RIGHT));
                    case 4, 11 -> segments.add(segment(r, c, TOP, RIGHT));
                    case 6, 9 -> segments.add(segment(r, c, TOP, BOTTOM));
                    case 7, 8 -> segments.add(segment(r, c, TOP, LEFT));
                    case 5 -> {
                        boolean centerAbove = (tl + tr + br + bl) / 4.0 >= level;
                        if (centerAbove) {
                            segments.add(segment(r, c, TOP, LEFT));
                            segments.add(segment(r, c, BOTTOM, RIGHT));
                        } else {
                            segments.add(segment(r, c, TOP, RIGHT));
                            segments.add(segment(r, c, LEFT, BOTTOM));
                        }
                    }
                    case 10 -> {
                        boolean centerAbove = (tl + tr + br + bl) / 4.0 >= level;
                        if (centerAbove) {
                            segments.add(segment(r, c, TOP, RIGHT));
                            segments.add(segment(r, c, LEFT, BOTTOM));
                        } else {
                            segments.add(segment(r, c, TOP, LEFT));
                            segments.add(segment(r, c, BOTTOM, RIGHT));
                        }
                    }
                    default -> {
                        // 0 y 15: la isolínea no cruza la celda
                    }
                }
            }
        }

        // 2. Índice arista -> segmentos
        Map<Long, List<Integer>> byEdge = new HashMap<>();
        for (int s = 0; s < segments.size(); s++) {
            byEdge.computeIfAbsent(segments.get(s)[0], k -> new ArrayList<>(2)).add(s);
            byEdge.computeIfAbsent(segments.get(s)[1], k -> new ArrayList<>(2)).add(s);
        }

        // 3. Enlazado: primero las trayectorias abiertas (desde aristas con un solo segmento)
        boolean[] used = new boolean[segments.size()];
        List<List<double[]>> paths = new ArrayList<>();
        for (int s = 0; s < segments.size(); s++) {
            if (used[s]) {
                continue;
            }
            for (long edge : segments.get(s)) {
                if (!used[s] && byEdge.get(edge).size() == 1) {
                    paths.add(walk(s, edge, segments, byEdge, used, level));
                }
            }
        }
        // Lo que queda son anillos
        for (int s = 0; s < segments.size(); s++) {
            if (!used[s]) {
                paths.add(walk(s, segments.get(s)[0], segments, byEdge, used, level));
            }
        }
        return paths;
    }

    private List<double[]> walk(int startSegment, long startEdge, List<long[]> segments,
                                Map<Long, List<Integer>> byEdge, boolean[] used, double level) {
        List<double[]> path = new ArrayList<>();
        path.add(edgePoint(startEdge, level));
        int segment = startSegment;
        long edge = startEdge;
        while (segment >= 0) {
            used[segment] = true;
            long[] ends = segments.get(segment);
            edge = ends[0] == edge ? ends[1] : ends[0];
            path.add(edgePoint(edge, level));
            segment = -1;
            for (int candidate : byEdge.get(edge)) {
                if (!used[candidate]) {
                    segment = candidate;
                    break;
                }
            }
        }
        return path;
    }

    private long[] segment(int r, int c, int from, int to) {
        return new long[]{edgeId(r, c, from), edgeId(r, c, to)};
    }

    /**
     * Aristas horizontales (nodo (r,c)–(r,c+1)) con id par, verticales ((r,c)–(r+1,c)) con id impar.
     */
    private long edgeId(int r, int c, int side) {
        return switch (side) {
            case TOP -> 2L * ((long) r * width + c);
            case BOTTOM -> 2L * ((long) (r + 1) * width + c);
            case LEFT -> 2L * ((long) r * width + c) + 1;
            case RIGHT -> 2L * ((long) r * width + c + 1) + 1;
            default -> throw new IllegalArgumentException("Lado de celda desconocido: " + side);
        };
    }

    private double[] edgePoint(long edgeId, double level) {
        long node = edgeId / 2;
        int r = (int) (node / width);
        int c = (int) (node % width);
        double v0 = values[r * width + c];
        if (edgeId % 2 == 0) {
            double v1 = values[r * width + c + 1];
            return new double[]{c + interpolate(v0, v1, level), r};
        }
        double v1 = values[(r + 1) * width + c];
        return new double[]{c, r + interpolate(v0, v1, level)};
    }

    private static double interpolate(double v0, double v1, double level) {
        if (v1 == v0) {
            return 0.5;
        }
        return (level - v0) / (v1 - v0);
    }
}
