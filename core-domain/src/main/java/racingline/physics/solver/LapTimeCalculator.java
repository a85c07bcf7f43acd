package racingline.physics.solver;

/**
 * Tiempo de vuelta: Σ longitudSegmento / velocidadMedia(puntos consecutivos).
 */
public final class LapTimeCalculator {

    private LapTimeCalculator() {}

    /**
     * @param x                coordenadas cerradas de la línea.
     * @param speeds           una velocidad por punto.
     * @param minSegmentLength longitud mínima asignada a cada segmento.
     * @param speedFloor       suelo aplicado a cada velocidad antes de promediar.
     */
    public static double lapTime(double[] x, double[] y, double[] speeds, double minSegmentLength, double speedFloor) {
        if (x.length != y.length || x.length != speeds.length) {
            throw new IllegalArgumentException("Coordenadas y velocidades deben tener la misma longitud.");
        }
        double total = 0.0;
        for (int i = 0; i < x.length - 1; i++) {
            double segment = Math.max(Math.hypot(x[i + 1] - x[i], y[i + 1] - y[i]), minSegmentLength);
            double average = (Math.max(speeds[i], speedFloor) + Math.max(speeds[i + 1], speedFloor)) / 2.0;
            total += segment / average;
        }
        return total;
    }
}
