package racingline.physics.solver.impl;

/**
 * Niveles de suavizado en cascada (sigmas gaussianos, en muestras).
 */
public enum SmoothingLevel {
    LIGHT(0.5, 1.0),
    MEDIUM(0.8, 1.2, 1.8),
    HEAVY(1.0, 1.5, 2.0, 2.5);

    private final double[] sigmas;

    SmoothingLevel(double... sigmas) {
        this.sigmas = sigmas;
    }

    public double[] getSigmas() {
        return sigmas.clone();
    }
}
