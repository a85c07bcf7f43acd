package racingline.physics.solver.impl;

import racingline.domain.track.TrackGeometry;
import racingline.utils.ClosedLoops;
import racingline.utils.SignalFilters;

/**
 * Solver de desplazamiento lateral con heurística de vértice tardío.
 * <p>
 * Cada punto se clasifica por su curvatura suavizada:
 * <ul>
 * <li>Recta: busca la siguiente curva dentro de la ventana y se abre hacia el lado contrario al giro,
 * con más intensidad cuanto más cerca está la curva.</li>
 * <li>Curva: la fase (entrada, vértice, salida o arco de radio constante) se decide comparando la
 * curvatura actual con las medias delante y detrás. El vértice va hacia el interior; la entrada y la
 * salida hacia el exterior; el arco constante se queda en el centro.</li>
 * </ul>
 * Los desplazamientos son escalares sobre la normal izquierda, así que acotar su módulo conserva la
 * dirección. El suavizado final es una combinación convexa y no rompe la cota.
 */
public class LateApexOffsetSolver {

    private final LateApexParameters parameters;

    public LateApexOffsetSolver(LateApexParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @param speeds una velocidad por punto de la geometría (array cerrado).
     * @return desplazamientos cerrados, uno por punto, con |d| <= ancho · usageFraction.
     */
    public double[] computeOffsets(TrackGeometry geometry, double[] speeds, double trackWidth) {
        int m = geometry.getLoopSize();
        double maxOffset = maxOffset(trackWidth);
        double[] curvature = SignalFilters.gaussianWrap(
                ClosedLoops.open(geometry.getCurvature()), parameters.curvatureSmoothingSigma());

        double[] raw = new double[m];
        for (int i = 0; i < m; i++) {
            raw[i] = Math.abs(curvature[i]) > parameters.cornerThreshold()
                    ? cornerOffset(curvature, i, speeds[i], maxOffset)
                    : straightOffset(curvature, i, maxOffset);
        }

        double[] lagged = ClosedLoops.roll(raw, parameters.lateApexLag());
        double[] smoothed = SignalFilters.cascadeWrap(bound(lagged, maxOffset), parameters.smoothing().getSigmas());
        return ClosedLoops.close(bound(smoothed, maxOffset));
    }

    public double maxOffset(double trackWidth) {
        return trackWidth * parameters.usageFraction();
    }

    /** Acota el módulo de cada desplazamiento conservando su signo. */
    public static double[] bound(double[] offsets, double maxOffset) {
        double[] out = new double[offsets.length];
        for (int i = 0; i < offsets.length; i++) {
            double magnitude = Math.abs(offsets[i]);
            out[i] = magnitude > maxOffset ? offsets[i] * (maxOffset / magnitude) : offsets[i];
        }
        return out;
    }

    private double cornerOffset(double[] curvature, int i, double speed, double maxOffset) {
        int m = curvature.length;
        int window = parameters.phaseWindow();
        double current = Math.abs(curvature[i]);
        double behind = 0.0;
        double ahead = 0.0;
        for (int k = 1; k <= window; k++) {
            behind += Math.abs(curvature[ClosedLoops.wrap(i - k, m)]);
            ahead += Math.abs(curvature[ClosedLoops.wrap(i + k, m)]);
        }
        behind /= window;
        ahead /= window;

        double tolerance = parameters.steadyTolerance() * current;
        if (Math.abs(ahead - current) <= tolerance && Math.abs(behind - current) <= tolerance) {
            return 0.0;
        }

        double inside = Math.signum(curvature[i]);
        double weight;
        if (behind <= current && ahead <= current) {
            weight = parameters.apexWeight();
        } else if (ahead > current) {
            weight = -parameters.entryWeight();
        } else {
            weight = -parameters.exitWeight();
        }
        return maxOffset * weight * inside * parameters.speedFactor(speed);
    }

    private double straightOffset(double[] curvature, int i, double maxOffset) {
        int m = curvature.length;
        int window = Math.min(parameters.lookAheadWindow(), m - 1);
        for (int d = 1; d <= window; d++) {
            double upcoming = curvature[ClosedLoops.wrap(i + d, m)];
            if (Math.abs(upcoming) > parameters.cornerThreshold()) {
                double transition = Math.max(parameters.minTransition(), 1.0 - (double) d / window);
                return -Math.signum(upcoming) * maxOffset * parameters.setupWeight() * transition;
            }
        }
        return 0.0;
    }
}
