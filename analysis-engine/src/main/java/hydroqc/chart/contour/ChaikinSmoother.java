package hydroqc.chart.contour;

import java.util.ArrayList;
import java.util.List;

/**
 * Suavizado por recorte de esquinas de Chaikin: cada arista se sustituye por sus
 * puntos a 1/4 y 3/4.
 * <p>
 * Las trayectorias abiertas conservan sus extremos; las cerradas se vuelven a cerrar
 * repitiendo el primer punto.
 */
final class ChaikinSmoother {

    private ChaikinSmoother() {
    }

    static List<double[]> smooth(List<double[]> points, int iterations) {
        List<double[]> result = points;
        for (int it = 0; it < iterations && result.size() >= 3; it++) {
            boolean closed = isClosed(result);
            List<double[]> next = new ArrayList<>(result.size() * 2);
            if (!closed) {
                next.add(result.get(0));
            }
            for (int i = 0; i < result.size() - 1; i++) {
                double[] p0 = result.get(i);
                double[] p1 = result.get(i + 1);
                next.add(new double[]{0.75 * p0[0] + 0.25 * p1[0], 0.75 * p0[1] + 0.25 * p1[1]});
                next.add(new double[]{0.25 * p0[0] + 0.75 * p1[0], 0.25 * p0[1] + 0.75 * p1[1]});
            }
            if (closed) {
                next.add(next.get(0));
            } else {
                next.add(result.get(result.size() - 1));
            }
            result = next;
        }
        return result;
    }

    static boolean isClosed(List<double[]> points) {
        if (points.size() < 3) {
            return false;
        }
        double[] first = points.get(0);
        double[] last = points.get(points.size() - 1);
        return first[0] == last[0] && first[1] == last[1];
    }
}
