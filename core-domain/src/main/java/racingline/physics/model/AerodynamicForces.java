package racingline.physics.model;

/** Fuerzas aerodinámicas instantáneas en Newtons. */
public record AerodynamicForces(double drag, double downforce) {
}
