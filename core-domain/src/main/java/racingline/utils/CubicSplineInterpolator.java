package racingline.utils;

/**
 * Spline cúbico natural (segunda derivada nula en los extremos) sobre nodos estrictamente crecientes.
 * <p>
 * Fuera del rango de nodos extrapola con el polinomio del tramo extremo. Se usa para las tablas
 * aerodinámicas y como ajuste no periódico de respaldo en el remuestreo de pistas.
 */
public class CubicSplineInterpolator {

    private final double[] knots;
    private final double[] values;
    private final double[] secondDerivatives;

    public CubicSplineInterpolator(double[] knots, double[] values) {
        if (knots == null || values == null || knots.length != values.length) {
            throw new IllegalArgumentException("Nodos y valores deben tener la misma longitud.");
        }
        if (knots.length < 2) {
            throw new IllegalArgumentException("Se requieren al menos 2 nodos para interpolar.");
        }
        for (int i = 1; i < knots.length; i++) {
            if (!(knots[i] > knots[i - 1])) {
                throw new IllegalArgumentException("Los nodos deben ser estrictamente crecientes (índice " + i + ").");
            }
        }
        this.knots = knots.clone();
        this.values = values.clone();
        this.secondDerivatives = solveNatural(this.knots, this.values);
    }

    public double value(double t) {
        int i = findInterval(t);
        double h = knots[i + 1] - knots[i];
        double a = (knots[i + 1] - t) / h;
        double b = (t - knots[i]) / h;
        return a * values[i] + b * values[i + 1]
                + ((a * a * a - a) * secondDerivatives[i] + (b * b * b - b) * secondDerivatives[i + 1]) * h * h / 6.0;
    }

    private int findInterval(double t) {
        int last = knots.length - 2;
        if (t <= knots[0]) return 0;
        if (t >= knots[last + 1]) return last;
        int lo = 0;
        int hi = last + 1;
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

    // Sistema tridiagonal del spline natural resuelto con el algoritmo de Thomas.
    private static double[] solveNatural(double[] x, double[] y) {
        int n = x.length;
        double[] m = new double[n];
        if (n == 2) {
            return m;
        }
        int inner = n - 2;
        double[] sub = new double[inner];
        double[] diag = new double[inner];
        double[] sup = new double[inner];
        double[] rhs = new double[inner];
        for (int k = 0; k < inner; k++) {
            int i = k + 1;
            double h0 = x[i] - x[i - 1];
            double h1 = x[i + 1] - x[i];
            sub[k] = h0;
            diag[k] = 2.0 * (h0 + h1);
            sup[k] = h1;
            rhs[k] = 6.0 * ((y[i + 1] - y[i]) / h1 - (y[i] - y[i - 1]) / h0);
        }
        double[] solution = TridiagonalSolver.solve(sub, diag, sup, rhs);
        System.arraycopy(solution, 0, m, 1, inner);
        return m;
    }
}
