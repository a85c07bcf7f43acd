package racingline.physics.solver.impl;

import racingline.config.VehicleConfig;
import racingline.domain.track.TrackGeometry;
import racingline.physics.solver.SpeedLimits;
import racingline.physics.solver.SpeedProfileSolver;
import racingline.utils.ClosedLoops;

/**
 * Solver de forma cerrada punto a punto.
 * <p>
 * Curva (|κ| > umbral): velocidad estacionaria con carga aerodinámica. Recta: velocidad punta
 * limitada por resistencia. En curvas suaves se toma el mínimo de ambas, ya que ningún punto
 * puede superar la velocidad punta.
 */
public class SteadyStateSpeedSolver implements SpeedProfileSolver {

    private static final double CORNER_CURVATURE = 1e-6;

    private final CorneringSpeedCalculator cornering;
    private final SpeedLimits limits;

    public SteadyStateSpeedSolver(CorneringSpeedCalculator cornering, SpeedLimits limits) {
        this.cornering = cornering;
        this.limits = limits;
    }

    @Override
    public double[] solve(TrackGeometry geometry, VehicleConfig vehicle, double friction) {
        int m = geometry.getLoopSize();
        double topSpeed = Math.min(cornering.topSpeed(vehicle), limits.ceiling());

        double[] speeds = new double[m];
        for (int i = 0; i < m; i++) {
            double absCurvature = Math.abs(geometry.getCurvature(i));
            double speed = absCurvature > CORNER_CURVATURE
                    ? Math.min(cornering.steadyStateSpeed(absCurvature, vehicle, friction), topSpeed)
                    : topSpeed;
            speeds[i] = limits.clamp(speed);
        }
        return ClosedLoops.close(speeds);
    }
}
