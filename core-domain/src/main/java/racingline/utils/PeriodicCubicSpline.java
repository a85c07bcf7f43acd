package racingline.utils;

/**
 * Spline cúbico periódico C2 para una función escalar sobre un parámetro cíclico.
 * <p>
 * Recibe m valores distintos en los nodos u[0..m-1] y el periodo total; el valor en u = periodo
 * coincide con el valor en u[0]. Las segundas derivadas se obtienen de un sistema tridiagonal cíclico.
 */
public class PeriodicCubicSpline {

    private final double[] knots;   // m + 1 nodos, el último = periodo
    private final double[] values;  // m + 1 valores, el último = values[0]
    private final double[] secondDerivatives; // m + 1, el último = el primero
    private final double period;

    /**
     * @param knots  nodos estrictamente crecientes en [0, period).
     * @param values valores en cada nodo (sin duplicado de cierre).
     * @param period longitud del ciclo, mayor que el último nodo.
     * @throws ArithmeticException si el sistema resulta degenerado.
     */
    public PeriodicCubicSpline(double[] knots, double[] values, double period) {
        int m = knots.length;
        if (m < 3 || values.length != m) {
            throw new IllegalArgumentException("El spline periódico requiere al menos 3 nodos con sus valores.");
        }
        this.period = period;
        this.knots = new double[m + 1];
        this.values = new double[m + 1];
        System.arraycopy(knots, 0, this.knots, 0, m);
        System.arraycopy(values, 0, this.values, 0, m);
        this.knots[m] = period;
        this.values[m] = values[0];

        double[] h = new double[m];
        for (int i = 0; i < m; i++) {
            h[i] = this.knots[i + 1] - this.knots[i];
            if (!(h[i] > 0.0)) {
                throw new ArithmeticException("Intervalo nulo o negativo en el nodo " + i);
            }
        }

        double[] sub = new double[m];
        double[] diag = new double[m];
        double[] sup = new double[m];
        double[] rhs = new double[m];
        for (int i = 0; i < m; i++) {
            int prev = ClosedLoops.wrap(i - 1, m);
            double hPrev = h[prev];
            double hCur = h[i];
            double yPrev = this.values[prev];
            sub[i] = hPrev;
            diag[i] = 2.0 * (hPrev + hCur);
            sup[i] = hCur;
            rhs[i] = 6.0 * ((this.values[i + 1] - this.values[i]) / hCur - (this.values[i] - yPrev) / hPrev);
        }

        double[] solved = TridiagonalSolver.solveCyclic(sub, diag, sup, rhs);
        this.secondDerivatives = new double[m + 1];
        System.arraycopy(solved, 0, secondDerivatives, 0, m);
        secondDerivatives[m] = solved[0];

        for (double v : secondDerivatives) {
            if (!Double.isFinite(v)) {
                throw new ArithmeticException("El ajuste periódico produjo valores no finitos.");
            }
        }
    }

    public double value(double u) {
        double t = u % period;
        if (t < 0) {
            t += period;
        }
        int i = findInterval(t);
        double h = knots[i + 1] - knots[i];
        double a = (knots[i + 1] - t) / h;
        double b = (t - knots[i]) / h;
        return a * values[i] + b * values[i + 1]
                + ((a * a * a - a) * secondDerivatives[i] + (b * b * b - b) * secondDerivatives[i + 1]) * h * h / 6.0;
    }

    private int findInterval(double t) {
        int lo = 0;
        int hi = knots.length - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (knots[mid] <= t) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
