package racingline.utils;

/**
 * Resolución de sistemas tridiagonales (abiertos y cíclicos).
 * <p>
 * {@code sub[i]} multiplica a x[i-1], {@code diag[i]} a x[i] y {@code sup[i]} a x[i+1].
 * En el caso abierto se ignoran {@code sub[0]} y {@code sup[n-1]}.
 */
public final class TridiagonalSolver {

    private static final double PIVOT_EPSILON = 1e-300;

    private TridiagonalSolver() {}

    /**
     * Algoritmo de Thomas.
     *
     * @throws ArithmeticException si aparece un pivote nulo (sistema singular).
     */
    public static double[] solve(double[] sub, double[] diag, double[] sup, double[] rhs) {
        int n = diag.length;
        double[] c = new double[n];
        double[] d = new double[n];

        double pivot = diag[0];
        checkPivot(pivot, 0);
        c[0] = sup[0] / pivot;
        d[0] = rhs[0] / pivot;
        for (int i = 1; i < n; i++) {
            pivot = diag[i] - sub[i] * c[i - 1];
            checkPivot(pivot, i);
            c[i] = sup[i] / pivot;
            d[i] = (rhs[i] - sub[i] * d[i - 1]) / pivot;
        }

        double[] x = new double[n];
        x[n - 1] = d[n - 1];
        for (int i = n - 2; i >= 0; i--) {
            x[i] = d[i] - c[i] * x[i + 1];
        }
        return x;
    }

    /**
     * Sistema tridiagonal cíclico mediante Sherman-Morrison.
     * <p>
     * {@code sub[0]} acopla la fila 0 con x[n-1] y {@code sup[n-1]} acopla la fila n-1 con x[0].
     * Requiere n >= 3.
     */
    public static double[] solveCyclic(double[] sub, double[] diag, double[] sup, double[] rhs) {
        int n = diag.length;
        if (n < 3) {
            throw new IllegalArgumentException("El sistema cíclico requiere al menos 3 incógnitas.");
        }
        double alpha = sub[0];
        double beta = sup[n - 1];
        double gamma = -diag[0];
        checkPivot(gamma, 0);

        double[] modifiedDiag = diag.clone();
        modifiedDiag[0] = diag[0] - gamma;
        modifiedDiag[n - 1] = diag[n - 1] - alpha * beta / gamma;

        double[] x = solve(sub, modifiedDiag, sup, rhs);

        double[] u = new double[n];
        u[0] = gamma;
        u[n - 1] = beta;
        double[] z = solve(sub, modifiedDiag, sup, u);

        double denominator = 1.0 + z[0] + alpha * z[n - 1] / gamma;
        checkPivot(denominator, n - 1);
        double factor = (x[0] + alpha * x[n - 1] / gamma) / denominator;
        for (int i = 0; i < n; i++) {
            x[i] -= factor * z[i];
        }
        return x;
    }

    private static void checkPivot(double pivot, int row) {
        if (Math.abs(pivot) < PIVOT_EPSILON || !Double.isFinite(pivot)) {
            throw new ArithmeticException("Sistema tridiagonal singular en la fila " + row);
        }
    }
}
