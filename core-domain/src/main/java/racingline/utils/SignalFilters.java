package racingline.utils;

import java.util.Arrays;

/**
 * Filtros de suavizado 1D sobre señales cíclicas (circuitos cerrados).
 * <p>
 * El núcleo gaussiano se trunca a 4 sigmas. Todas las funciones devuelven un array
 * nuevo y nunca modifican la entrada.
 */
public final class SignalFilters {

    private static final double TRUNCATE_SIGMAS = 4.0;

    private SignalFilters() {}

    /**
     * Filtro gaussiano con contorno periódico.
     *
     * @param signal valores abiertos del bucle (sin duplicado de cierre).
     * @param sigma  desviación típica en número de muestras. Si es <= 0 se devuelve una copia.
     */
    public static double[] gaussianWrap(double[] signal, double sigma) {
        int n = signal.length;
        if (sigma <= 0.0 || n == 0) {
            return signal.clone();
        }
        double[] kernel = gaussianKernel(sigma);
        int radius = kernel.length / 2;

        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double acc = 0.0;
            for (int k = -radius; k <= radius; k++) {
                acc += kernel[k + radius] * signal[ClosedLoops.wrap(i + k, n)];
            }
            out[i] = acc;
        }
        return out;
    }

    /** Aplica varios gaussianos periódicos en cascada. */
    public static double[] cascadeWrap(double[] signal, double... sigmas) {
        double[] current = signal.clone();
        for (double sigma : sigmas) {
            current = gaussianWrap(current, sigma);
        }
        return current;
    }

    /** Media móvil centrada de 3 puntos con contorno periódico. */
    public static double[] movingAverageWrap(double[] signal) {
        int n = signal.length;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = (signal[ClosedLoops.wrap(i - 1, n)] + signal[i] + signal[ClosedLoops.wrap(i + 1, n)]) / 3.0;
        }
        return out;
    }

    /**
     * Percentil con interpolación lineal entre rangos (misma definición que la habitual en NumPy).
     *
     * @param p percentil en [0, 100].
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            throw new IllegalArgumentException("No se puede calcular el percentil de una serie vacía.");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = Math.max(0.0, Math.min(100.0, p)) / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double frac = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * frac;
    }

    private static double[] gaussianKernel(double sigma) {
        int radius = (int) Math.ceil(TRUNCATE_SIGMAS * sigma);
        double[] kernel = new double[2 * radius + 1];
        double sum = 0.0;
        for (int k = -radius; k <= radius; k++) {
            double w = Math.exp(-0.5 * (k * k) / (sigma * sigma));
            kernel[k + radius] = w;
            sum += w;
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }
}
