package hydroqc.analysis.polygon;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Etiquetado de componentes 4-conexas de una máscara binaria.
 * <p>
 * Las etiquetas se asignan en orden de barrido (filas, luego columnas) según el
 * primer píxel de cada componente, empezando en 1.
 */
final class ConnectedComponentLabeler {

    private ConnectedComponentLabeler() {
    }

    /**
     * Componente etiquetada.
     *
     * @param label   Etiqueta (1..n) en orden de barrido.
     * @param indices Índices lineales de sus píxeles, ordenados por filas.
     * @param minRow  Primera fila de la caja envolvente.
     * @param maxRow  Última fila (inclusiva).
     * @param minCol  Primera columna.
     * @param maxCol  Última columna (inclusiva).
     */
    record Component(int label, int[] indices, int minRow, int maxRow, int minCol, int maxCol) {

        int pixelCount() {
            return indices.length;
        }

        int cropWidth() {
            return maxCol - minCol + 1;
        }

        int cropHeight() {
            return maxRow - minRow + 1;
        }
    }

    static List<Component> label(boolean[] mask, int width, int height) {
        int[] labels = new int[mask.length];
        List<Component> components = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        int next = 1;

        for (int start = 0; start < mask.length; start++) {
            if (!mask[start] || labels[start] != 0) {
                continue;
            }
            int label = next++;
            labels[start] = label;
            stack.push(start);

            int[] buffer = new int[16];
            int size = 0;
            int minRow = Integer.MAX_VALUE;
            int maxRow = Integer.MIN_VALUE;
            int minCol = Integer.MAX_VALUE;
            int maxCol = Integer.MIN_VALUE;

            while (!stack.isEmpty()) {
                int idx = stack.pop();
                if (size == buffer.length) {
                    buffer = Arrays.copyOf(buffer, size * 2);
                }
                buffer[size++] = idx;
                int row = idx / width;
                int col = idx % width;
                minRow = Math.min(minRow, row);
                maxRow = Math.max(maxRow, row);
                minCol = Math.min(minCol, col);
                maxCol = Math.max(maxCol, col);

                if (row > 0) visit(mask, labels, stack, idx - width, label);
                if (row < height - 1) visit(mask, labels, stack, idx + width, label);
                if (col > 0) visit(mask, labels, stack, idx - 1, label);
                if (col < width - 1) visit(mask, labels, stack, idx + 1, label);
            }

            int[] indices = Arrays.copyOf(buffer, size);
            Arrays.sort(indices);
            components.add(new Component(label, indices, minRow, maxRow, minCol, maxCol));
        }
        return components;
    }

    private static void visit(boolean[] mask, int[] labels, Deque<Integer> stack, int idx, int label) {
        if (mask[idx] && labels[idx] == 0) {
            labels[idx] = label;
            stack.push(idx);
        }
    }
}
