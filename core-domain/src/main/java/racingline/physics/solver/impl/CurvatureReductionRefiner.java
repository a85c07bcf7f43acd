package racingline.physics.solver.impl;

import racingline.domain.track.TrackGeometry;
import racingline.utils.ClosedLoops;
import racingline.utils.SignalFilters;

/**
 * Pasada de refinamiento que aproxima la minimización iterativa de curvatura.
 * <p>
 * Toma los puntos de la línea por encima del percentil 75 de curvatura de tres puntos y los desplaza
 * hacia el interior del giro una cantidad proporcional al ángulo de giro local y a la velocidad local.
 * Después se vuelve a acotar y se aplica una media móvil de 3 puntos.
 */
public class CurvatureReductionRefiner {

    private static final double HIGH_CURVATURE_PERCENTILE = 75.0;
    private static final double REFERENCE_SPEED = 50.0;
    private static final double MAX_SPEED_FACTOR = 2.0;

    private final double gain;

    /**
     * @param gain fracción del desplazamiento máximo aplicada por iteración.
     */
    public CurvatureReductionRefiner(double gain) {
        this.gain = gain;
    }

    /**
     * @param centerline geometría sobre cuya normal se expresan los desplazamientos.
     * @param offsets    desplazamientos cerrados actuales.
     * @param speeds     velocidades cerradas sobre la línea actual.
     * @param maxOffset  cota de |desplazamiento|.
     * @return nuevos desplazamientos cerrados.
     */
    public double[] refine(TrackGeometry centerline, double[] offsets, double[] speeds, double maxOffset) {
        int m = centerline.getLoopSize();
        double[] x = new double[m];
        double[] y = new double[m];
        for (int i = 0; i < m; i++) {
            x[i] = centerline.getX(i) + offsets[i] * centerline.getNormalX(i);
            y[i] = centerline.getY(i) + offsets[i] * centerline.getNormalY(i);
        }

        double[] curvature = new double[m];
        double[] turnAngle = new double[m];
        double[] turnSign = new double[m];
        for (int i = 0; i < m; i++) {
            int prev = ClosedLoops.wrap(i - 1, m);
            int next = ClosedLoops.wrap(i + 1, m);
            double v1x = x[i] - x[prev], v1y = y[i] - y[prev];
            double v2x = x[next] - x[i], v2y = y[next] - y[i];
            double norms = Math.hypot(v1x, v1y) * Math.hypot(v2x, v2y);
            if (norms < 1e-12) {
                continue;
            }
            double cross = v1x * v2y - v1y * v2x;
            double dot = v1x * v2x + v1y * v2y;
            curvature[i] = Math.abs(cross) / norms;
            turnAngle[i] = Math.acos(Math.max(-1.0, Math.min(1.0, dot / norms)));
            turnSign[i] = Math.signum(cross);
        }

        double threshold = SignalFilters.percentile(curvature, HIGH_CURVATURE_PERCENTILE);
        double[] refined = ClosedLoops.open(offsets);
        for (int i = 0; i < m; i++) {
            if (curvature[i] <= threshold) {
                continue;
            }
            double turnFactor = turnAngle[i] / Math.PI;
            double speedFactor = Math.min(speeds[i] / REFERENCE_SPEED, MAX_SPEED_FACTOR);
            // Normal izquierda: un giro a la izquierda (cross > 0) tiene el interior en +n
            refined[i] += maxOffset * turnFactor * speedFactor * gain * turnSign[i];
        }

        double[] smoothed = SignalFilters.movingAverageWrap(LateApexOffsetSolver.bound(refined, maxOffset));
        return ClosedLoops.close(LateApexOffsetSolver.bound(smoothed, maxOffset));
    }
}
