package racingline.physics.solver;

/**
 * Ventana de velocidades admisibles (m/s) de un solver.
 */
public record SpeedLimits(double floor, double ceiling) {

    public SpeedLimits {
        if (!(floor > 0) || !(ceiling > floor)) {
            throw new IllegalArgumentException("Límites de velocidad inválidos: [" + floor + ", " + ceiling + "]");
        }
    }

    /** Acota un valor; NaN se convierte en el suelo. */
    public double clamp(double speed) {
        if (Double.isNaN(speed)) {
            return floor;
        }
        return Math.max(floor, Math.min(ceiling, speed));
    }

    public double[] clampAll(double[] speeds) {
        double[] out = new double[speeds.length];
        for (int i = 0; i < speeds.length; i++) {
            out[i] = clamp(speeds[i]);
        }
        return out;
    }
}
