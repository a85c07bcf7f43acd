package racingline.physics.model;

import lombok.extern.slf4j.Slf4j;
import racingline.utils.CubicSplineInterpolator;

/**
 * Modelo aerodinámico dependiente de la velocidad.
 * <p>
 * Los coeficientes de resistencia (Cd), carga (Cl) y la posición del centro de presiones se
 * obtienen de una tabla velocidad → coeficiente interpolada con splines cúbicos. Las curvas
 * describen un vehículo de referencia (Cd = 1.0, Cl = 3.0); los coeficientes propios de cada
 * vehículo escalan la curva en proporción.
 * <p>
 * Fuerzas: F = 0.5 · ρ · v² · C · A. Inmutable y thread-safe.
 */
@Slf4j
public class AerodynamicModel {

    public static final double AIR_DENSITY = 1.225; // kg/m³ a nivel del mar

    // --- Tabla del vehículo de referencia ---
    private static final double[] SPEED_POINTS = {0, 20, 40, 60, 80, 100};
    private static final double[] DRAG_POINTS = {1.0, 1.2, 1.4, 1.6, 1.8, 2.0};
    private static final double[] LIFT_POINTS = {0.5, 1.5, 2.5, 3.2, 3.7, 4.0};
    private static final double[] CENTER_OF_PRESSURE_POINTS = {2.5, 2.6, 2.7, 2.8, 2.9, 3.0};

    public static final double REFERENCE_DRAG_COEFFICIENT = 1.0;
    public static final double REFERENCE_LIFT_COEFFICIENT = 3.0;

    // --- Rangos físicamente plausibles (protegen de sobreoscilaciones del spline) ---
    private static final double MAX_LOOKUP_SPEED = 120.0;
    private static final double MIN_DRAG = 0.3, MAX_DRAG = 3.0;
    private static final double MIN_LIFT = 0.5, MAX_LIFT = 8.0;
    private static final double MIN_CENTER_OF_PRESSURE = 2.0, MAX_CENTER_OF_PRESSURE = 3.5;

    // --- Iteración de velocidad punta ---
    private static final int MAX_ITERATIONS = 10;
    private static final double SPEED_TOLERANCE = 0.1;
    private static final double INITIAL_SPEED_ESTIMATE = 50.0;
    private static final double MIN_DRAG_LIMITED_SPEED = 10.0;
    private static final double MAX_DRAG_LIMITED_SPEED = 120.0;

    private final CubicSplineInterpolator dragCurve;
    private final CubicSplineInterpolator liftCurve;
    private final CubicSplineInterpolator centerOfPressureCurve;

    public AerodynamicModel() {
        this.dragCurve = new CubicSplineInterpolator(SPEED_POINTS, DRAG_POINTS);
        this.liftCurve = new CubicSplineInterpolator(SPEED_POINTS, LIFT_POINTS);
        this.centerOfPressureCurve = new CubicSplineInterpolator(SPEED_POINTS, CENTER_OF_PRESSURE_POINTS);
    }

    public double dragCoefficient(double speed) {
        return clamp(dragCurve.value(lookupSpeed(speed)), MIN_DRAG, MAX_DRAG);
    }

    public double liftCoefficient(double speed) {
        return clamp(liftCurve.value(lookupSpeed(speed)), MIN_LIFT, MAX_LIFT);
    }

    public double centerOfPressure(double speed) {
        return clamp(centerOfPressureCurve.value(lookupSpeed(speed)), MIN_CENTER_OF_PRESSURE, MAX_CENTER_OF_PRESSURE);
    }

    /** Fuerzas del vehículo de referencia. */
    public AerodynamicForces forces(double speed, double frontalArea) {
        return forces(speed, frontalArea, REFERENCE_DRAG_COEFFICIENT, REFERENCE_LIFT_COEFFICIENT);
    }

    /**
     * Fuerzas con los coeficientes de un vehículo concreto.
     *
     * @param dragOverride Cd del vehículo; escala la curva por dragOverride / 1.0.
     * @param liftOverride Cl del vehículo; escala la curva por liftOverride / 3.0.
     */
    public AerodynamicForces forces(double speed, double frontalArea, double dragOverride, double liftOverride) {
        double cd = dragCoefficient(speed) * (dragOverride / REFERENCE_DRAG_COEFFICIENT);
        double cl = liftCoefficient(speed) * (liftOverride / REFERENCE_LIFT_COEFFICIENT);
        double dynamicPressure = 0.5 * AIR_DENSITY * speed * speed;
        return new AerodynamicForces(dynamicPressure * cd * frontalArea, dynamicPressure * cl * frontalArea);
    }

    /**
     * Velocidad punta limitada por resistencia: v = sqrt(2F / (ρ · Cd(v) · A)), resuelta por punto fijo
     * porque Cd depende de la velocidad.
     *
     * @param availableForce fuerza de tracción disponible (N).
     * @param dragOverride   Cd del vehículo.
     * @return velocidad en m/s acotada a [10, 120].
     */
    public double dragLimitedSpeed(double availableForce, double frontalArea, double dragOverride) {
        if (availableForce <= 0 || frontalArea <= 0) {
            return MIN_DRAG_LIMITED_SPEED;
        }
        double speed = INITIAL_SPEED_ESTIMATE;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double cd = dragCoefficient(speed) * (dragOverride / REFERENCE_DRAG_COEFFICIENT);
            double next = Math.sqrt(2.0 * availableForce / (AIR_DENSITY * cd * frontalArea));
            if (!Double.isFinite(next)) {
                break;
            }
            boolean converged = Math.abs(next - speed) < SPEED_TOLERANCE;
            speed = next;
            if (converged) {
                log.trace("Velocidad punta convergida en {} iteraciones: {} m/s", i + 1, speed);
                break;
            }
        }
        return clamp(speed, MIN_DRAG_LIMITED_SPEED, MAX_DRAG_LIMITED_SPEED);
    }

    public AerodynamicCoefficients coefficientInfo(double speed) {
        double cd = dragCoefficient(speed);
        double cl = liftCoefficient(speed);
        return new AerodynamicCoefficients(speed, speed * 3.6, cd, cl, centerOfPressure(speed), cl / cd);
    }

    private static double lookupSpeed(double speed) {
        if (Double.isNaN(speed)) {
            return 0.0;
        }
        return clamp(speed, 0.0, MAX_LOOKUP_SPEED);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
