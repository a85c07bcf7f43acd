package racingline.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TridiagonalSolverTest {

    @Test
    @DisplayName("Sistema cíclico: la solución satisface todas las filas, incluidas las esquinas")
    void solveCyclic_shouldSatisfyCornerCoupling() {
        // ARRANGE: x conocido, construimos rhs = A·x
        double[] expected = {1.0, -2.0, 0.5, 3.0, -1.0};
        int n = expected.length;
        double[] sub = {1, 1, 1, 1, 1};
        double[] diag = {4, 4, 4, 4, 4};
        double[] sup = {1, 1, 1, 1, 1};
        double[] rhs = new double[n];
        for (int i = 0; i < n; i++) {
            rhs[i] = sub[i] * expected[(i - 1 + n) % n] + diag[i] * expected[i] + sup[i] * expected[(i + 1) % n];
        }

        // ACT
        double[] x = TridiagonalSolver.solveCyclic(sub, diag, sup, rhs);

        // ASSERT
        assertArrayEquals(expected, x, 1e-10);
    }

    @Test
    @DisplayName("Pivote nulo: ArithmeticException")
    void solve_shouldRejectSingularSystem() {
        assertThrows(ArithmeticException.class, () -> TridiagonalSolver.solve(
                new double[]{0, 1}, new double[]{0, 1}, new double[]{1, 0}, new double[]{1, 1}));
    }
}
