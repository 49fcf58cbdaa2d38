package hydroqc.analysis.polygon;

/**
 * Morfología binaria con elemento estructurante 3×3. Fuera de la rejilla se considera {@code false}.
 */
final class BinaryMorphology {

    private BinaryMorphology() {
    }

    /**
     * Apertura: erosión seguida de dilatación. Elimina componentes de menos de 3×3 píxeles.
     */
    static boolean[] opening(boolean[] mask, int width, int height) {
        return dilate(erode(mask, width, height), width, height);
    }

    static boolean[] erode(boolean[] mask, int width, int height) {
        boolean[] out = new boolean[mask.length];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                out[row * width + col] = allNeighbours(mask, width, height, row, col);
            }
        }
        return out;
    }

    static boolean[] dilate(boolean[] mask, int width, int height) {
        boolean[] out = new boolean[mask.length];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                out[row * width + col] = anyNeighbour(mask, width, height, row, col);
            }
        }
        return out;
    }

    private static boolean allNeighbours(boolean[] mask, int width, int height, int row, int col) {
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                int r = row + dr;
                int c = col + dc;
                if (r < 0 || r >= height || c < 0 || c >= width || !mask[r * width + c]) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean anyNeighbour(boolean[] mask, int width, int height, int row, int col) {
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                int r = row + dr;
                int c = col + dc;
                if (r >= 0 && r < height && c >= 0 && c < width && mask[r * width + c]) {
                    return true;
                }
            }
        }
        return false;
    }
}
