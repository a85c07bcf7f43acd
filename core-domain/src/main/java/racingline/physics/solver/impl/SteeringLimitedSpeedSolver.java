package racingline.physics.solver.impl;

import racingline.config.VehicleConfig;
import racingline.domain.track.TrackGeometry;
import racingline.physics.solver.SpeedLimits;
import racingline.physics.solver.SpeedProfileSolver;
import racingline.utils.ClosedLoops;
import racingline.utils.SignalFilters;

/**
 * Solver geométrico que añade el límite de dirección del vehículo.
 * <p>
 * Por debajo del radio mínimo de giro (batalla / tan(ángulo máximo)) la velocidad queda en
 * min(15, sqrt(μ·g·r)). En el resto de curvas se usa la velocidad con carga aerodinámica (3
 * iteraciones sin amortiguar), corregida por masa y aceleración respecto a un monoplaza de
 * referencia de 750 kg y 10 m/s², y por un factor de seguridad. El perfil final se suaviza.
 */
public class SteeringLimitedSpeedSolver implements SpeedProfileSolver {

    private static final double CORNER_CURVATURE = 1e-6;
    private static final double WHEELBASE_RATIO = 0.6;
    private static final double TIGHT_TURN_SPEED_CAP = 15.0;
    private static final int DOWNFORCE_ITERATIONS = 3;
    private static final double REFERENCE_MASS = 750.0;
    private static final double REFERENCE_ACCELERATION = 10.0;
    private static final double SAFETY_FACTOR = 0.85;
    private static final double SMOOTHING_SIGMA = 2.0;

    private final CorneringSpeedCalculator cornering;
    private final SpeedLimits limits;

    public SteeringLimitedSpeedSolver(CorneringSpeedCalculator cornering, SpeedLimits limits) {
        this.cornering = cornering;
        this.limits = limits;
    }

    @Override
    public double[] solve(TrackGeometry geometry, VehicleConfig vehicle, double friction) {
        int m = geometry.getLoopSize();
        double topSpeed = Math.min(cornering.topSpeed(vehicle), limits.ceiling());
        double minTurnRadius = minimumTurnRadius(vehicle);
        double correction = Math.sqrt(REFERENCE_MASS / vehicle.mass())
                * Math.sqrt(vehicle.maxAcceleration() / REFERENCE_ACCELERATION)
                * SAFETY_FACTOR;

        double[] speeds = new double[m];
        for (int i = 0; i < m; i++) {
            double absCurvature = Math.abs(geometry.getCurvature(i));
            if (absCurvature <= CORNER_CURVATURE) {
                speeds[i] = topSpeed;
                continue;
            }
            double radius = 1.0 / absCurvature;
            if (radius < minTurnRadius) {
                speeds[i] = Math.min(TIGHT_TURN_SPEED_CAP, Math.sqrt(friction * CorneringSpeedCalculator.GRAVITY * radius));
            } else {
                speeds[i] = Math.min(downforceSpeed(radius, vehicle, friction) * correction, topSpeed);
            }
        }

        double[] smoothed = SignalFilters.gaussianWrap(speeds, SMOOTHING_SIGMA);
        return ClosedLoops.close(limits.clampAll(smoothed));
    }

    /** Radio mínimo de giro a partir de la batalla estimada y el ángulo máximo de dirección. */
    public static double minimumTurnRadius(VehicleConfig vehicle) {
        double wheelbase = vehicle.length() * WHEELBASE_RATIO;
        return wheelbase / Math.tan(Math.toRadians(vehicle.maxSteeringAngle()));
    }

    private double downforceSpeed(double radius, VehicleConfig vehicle, double friction) {
        double mass = vehicle.mass();
        double speed = Math.sqrt(friction * CorneringSpeedCalculator.GRAVITY * radius);
        for (int i = 0; i < DOWNFORCE_ITERATIONS; i++) {
            double downforce = cornering.getAerodynamics()
                    .forces(speed, vehicle.effectiveFrontalArea(), vehicle.dragCoefficient(), vehicle.liftCoefficient())
                    .downforce();
            speed = Math.sqrt(friction * (mass * CorneringSpeedCalculator.GRAVITY + downforce) * radius / mass);
        }
        return speed;
    }
}
