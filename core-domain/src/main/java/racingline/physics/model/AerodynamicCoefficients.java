package racingline.physics.model;

/**
 * Instantánea de los coeficientes aerodinámicos a una velocidad dada.
 *
 * @param centerOfPressure Posición longitudinal del centro de presiones (m desde el eje delantero).
 * @param liftToDragRatio  Cl / Cd.
 */
public record AerodynamicCoefficients(
        double speedMs,
        double speedKmh,
        double dragCoefficient,
        double liftCoefficient,
        double centerOfPressure,
        double liftToDragRatio
) {
}
