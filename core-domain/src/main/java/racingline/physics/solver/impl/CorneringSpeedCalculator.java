package racingline.physics.solver.impl;

import racingline.config.VehicleConfig;
import racingline.physics.model.AerodynamicModel;

/**
 * Velocidad de paso por curva en régimen estacionario con carga aerodinámica.
 * <p>
 * Resuelve v = sqrt(μ · (m·g + F_down(v)) / (m · |κ|)) por punto fijo con actualización amortiguada
 * (70% valor anterior, 30% nuevo) porque la carga depende de la propia velocidad.
 */
public class CorneringSpeedCalculator {

    public static final double GRAVITY = 9.81;

    private static final int MAX_ITERATIONS = 5;
    private static final double TOLERANCE = 0.5; // m/s
    private static final double INITIAL_ESTIMATE = 30.0;
    private static final double DAMPING = 0.7;

    private final AerodynamicModel aerodynamics;

    public CorneringSpeedCalculator(AerodynamicModel aerodynamics) {
        this.aerodynamics = aerodynamics;
    }

    /**
     * @param absCurvature |κ| del punto, mayor que 0.
     * @return velocidad sin acotar; el llamador aplica sus propios límites.
     */
    public double steadyStateSpeed(double absCurvature, VehicleConfig vehicle, double friction) {
        double mass = vehicle.mass();
        double area = vehicle.effectiveFrontalArea();
        double speed = INITIAL_ESTIMATE;

        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double downforce = aerodynamics.forces(speed, area, vehicle.dragCoefficient(), vehicle.liftCoefficient()).downforce();
            double next = Math.sqrt(friction * (mass * GRAVITY + downforce) / (mass * absCurvature));
            if (!Double.isFinite(next)) {
                return speed;
            }
            if (Math.abs(next - speed) < TOLERANCE) {
                return next;
            }
            speed = DAMPING * speed + (1.0 - DAMPING) * next;
        }
        return speed;
    }

    /** Velocidad punta en recta con toda la fuerza de tracción (m · a) contra la resistencia. */
    public double topSpeed(VehicleConfig vehicle) {
        return aerodynamics.dragLimitedSpeed(
                vehicle.mass() * vehicle.maxAcceleration(), vehicle.effectiveFrontalArea(), vehicle.dragCoefficient());
    }

    public AerodynamicModel getAerodynamics() {
        return aerodynamics;
    }
}
