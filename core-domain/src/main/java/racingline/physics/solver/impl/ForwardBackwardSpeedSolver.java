package racingline.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import racingline.config.VehicleConfig;
import racingline.domain.track.TrackGeometry;
import racingline.physics.model.AerodynamicModel;
import racingline.physics.solver.SpeedLimits;
import racingline.physics.solver.SpeedProfileSolver;
import racingline.utils.ClosedLoops;
import racingline.utils.SignalFilters;

/**
 * Solver de integración hacia adelante y hacia atrás (tres pasadas).
 * <ol>
 * <li>Velocidad estacionaria por punto, sin historia de aceleración.</li>
 * <li>Pasada hacia adelante: v² += 2·F_acel·Δs/m, acotada por la estacionaria. La fuerza de
 * tracción se reduce por la demanda lateral y por la resistencia aerodinámica.</li>
 * <li>Pasada hacia atrás con fuerza de frenado (múltiplo de la de tracción, asistida por la
 * resistencia), acotada por la pasada hacia adelante.</li>
 * </ol>
 * Al ser un circuito cerrado, ambas pasadas recorren el bucle completo empezando en el punto
 * estacionario más lento, donde la velocidad ya está fijada por la adherencia.
 */
@Slf4j
public class ForwardBackwardSpeedSolver implements SpeedProfileSolver {

    private static final double CORNER_CURVATURE = 1e-6;
    private static final double MIN_SEGMENT_LENGTH = 0.1;
    private static final double MAX_CORNERING_LOSS = 0.3;
    private static final double CORNERING_LOSS_SCALE = 50.0; // m/s² de demanda lateral para pérdida total
    private static final double BRAKE_FORCE_MULTIPLIER = 3.0;
    private static final double MAX_BRAKE_LOSS = 0.4;
    private static final double BRAKE_LOSS_SCALE = 30.0;
    private static final double SMOOTHING_SIGMA = 0.8;

    private final CorneringSpeedCalculator cornering;
    private final SpeedLimits limits;

    public ForwardBackwardSpeedSolver(CorneringSpeedCalculator cornering, SpeedLimits limits) {
        this.cornering = cornering;
        this.limits = limits;
    }

    @Override
    public double[] solve(TrackGeometry geometry, VehicleConfig vehicle, double friction) {
        int m = geometry.getLoopSize();
        double mass = vehicle.mass();
        double tractionForce = mass * vehicle.maxAcceleration();
        AerodynamicModel aero = cornering.getAerodynamics();
        double area = vehicle.effectiveFrontalArea();

        // 1. Estacionaria
        double[] steady = steadyState(geometry, vehicle, friction);
        int start = 0;
        for (int i = 1; i < m; i++) {
            if (steady[i] < steady[start]) start = i;
        }

        // 2. Hacia adelante
        double[] forward = new double[m];
        forward[start] = steady[start];
        for (int k = 1; k < m; k++) {
            int idx = ClosedLoops.wrap(start + k, m);
            int prev = ClosedLoops.wrap(idx - 1, m);
            double v = forward[prev];
            double lateralDemand = v * v * Math.abs(geometry.getCurvature(prev));
            double loss = Math.min(lateralDemand / CORNERING_LOSS_SCALE, MAX_CORNERING_LOSS);
            double drag = aero.forces(v, area, vehicle.dragCoefficient(), vehicle.liftCoefficient()).drag();
            double netForce = Math.max(tractionForce * (1.0 - loss) - drag, 0.0);
            double ds = Math.max(geometry.getSegmentLength(prev), MIN_SEGMENT_LENGTH);
            double reachable = Math.sqrt(v * v + 2.0 * netForce * ds / mass);
            forward[idx] = Math.min(reachable, steady[idx]);
        }

        // 3. Hacia atrás
        double[] backward = new double[m];
        backward[start] = forward[start];
        for (int k = 1; k < m; k++) {
            int idx = ClosedLoops.wrap(start - k, m);
            int next = ClosedLoops.wrap(idx + 1, m);
            double v = backward[next];
            double lateralDemand = v * v * Math.abs(geometry.getCurvature(next));
            double loss = Math.min(lateralDemand / BRAKE_LOSS_SCALE, MAX_BRAKE_LOSS);
            double drag = aero.forces(v, area, vehicle.dragCoefficient(), vehicle.liftCoefficient()).drag();
            double brakeForce = BRAKE_FORCE_MULTIPLIER * tractionForce * (1.0 - loss) + drag;
            double ds = Math.max(geometry.getSegmentLength(idx), MIN_SEGMENT_LENGTH);
            double reachable = Math.sqrt(v * v + 2.0 * brakeForce * ds / mass);
            backward[idx] = Math.min(reachable, forward[idx]);
        }

        double[] smoothed = SignalFilters.gaussianWrap(backward, SMOOTHING_SIGMA);
        log.trace("Perfil adelante/atrás calculado desde el índice {} ({} puntos)", start, m);
        return ClosedLoops.close(limits.clampAll(smoothed));
    }

    /** Velocidad estacionaria por punto del bucle (sin cierre), ya acotada. */
    public double[] steadyState(TrackGeometry geometry, VehicleConfig vehicle, double friction) {
        int m = geometry.getLoopSize();
        double topSpeed = Math.min(cornering.topSpeed(vehicle), limits.ceiling());
        double[] steady = new double[m];
        for (int i = 0; i < m; i++) {
            double absCurvature = Math.abs(geometry.getCurvature(i));
            double speed = absCurvature > CORNER_CURVATURE
                    ? Math.min(cornering.steadyStateSpeed(absCurvature, vehicle, friction), topSpeed)
                    : topSpeed;
            steady[i] = limits.clamp(speed);
        }
        return steady;
    }
}
