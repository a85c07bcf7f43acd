package racingline.domain.track;

/**
 * Geometría derivada e inmutable de una pista cerrada y remuestreada.
 * <p>
 * Todos los arrays tienen la misma longitud (pointCount) y el último punto repite al primero.
 * Se guardan, por punto: abscisa curvilínea {@code s}, tangente unitaria, normal unitaria izquierda
 * (-ty, tx) y curvatura con signo (positiva = giro a la izquierda, siempre finita).
 * <p>
 * Los arrays se clonan en la construcción y en los getters; los accesos por índice
 * existen para los bucles de los solvers.
 */
public final class TrackGeometry {

    private final double[] x;
    private final double[] y;
    private final double[] s;
    private final double[] tangentX;
    private final double[] tangentY;
    private final double[] normalX;
    private final double[] normalY;
    private final double[] curvature;
    private final double trackWidth;

    public TrackGeometry(double[] x, double[] y, double[] s,
                         double[] tangentX, double[] tangentY,
                         double[] normalX, double[] normalY,
                         double[] curvature, double trackWidth) {
        int n = x.length;
        if (n < 4) {
            throw new IllegalArgumentException("Una pista cerrada necesita al menos 3 puntos distintos más el cierre.");
        }
        if (y.length != n || s.length != n || tangentX.length != n || tangentY.length != n
                || normalX.length != n || normalY.length != n || curvature.length != n) {
            throw new IllegalArgumentException("Todos los arrays de la geometría deben tener " + n + " elementos.");
        }
        if (trackWidth <= 0) {
            throw new IllegalArgumentException("El ancho de pista debe ser positivo.");
        }
        for (int i = 1; i < n; i++) {
            if (s[i] < s[i - 1]) {
                throw new IllegalArgumentException("La abscisa s debe ser no decreciente (índice " + i + ").");
            }
        }
        this.x = x.clone();
        this.y = y.clone();
        this.s = s.clone();
        this.tangentX = tangentX.clone();
        this.tangentY = tangentY.clone();
        this.normalX = normalX.clone();
        this.normalY = normalY.clone();
        this.curvature = curvature.clone();
        this.trackWidth = trackWidth;
    }

    /** Número de puntos, incluido el punto de cierre. */
    public int getPointCount() {
        return x.length;
    }

    /** Número de puntos distintos del bucle (sin el cierre). */
    public int getLoopSize() {
        return x.length - 1;
    }

    public double getTotalLength() {
        return s[s.length - 1];
    }

    public double getTrackWidth() {
        return trackWidth;
    }

    public double getHalfWidth() {
        return trackWidth / 2.0;
    }

    public double getX(int i) { return x[i]; }

    public double getY(int i) { return y[i]; }

    public double getS(int i) { return s[i]; }

    public double getTangentX(int i) { return tangentX[i]; }

    public double getTangentY(int i) { return tangentY[i]; }

    public double getNormalX(int i) { return normalX[i]; }

    public double getNormalY(int i) { return normalY[i]; }

    public double getCurvature(int i) { return curvature[i]; }

    /** Longitud del segmento entre el punto i y el i+1 (i en [0, loopSize)). */
    public double getSegmentLength(int i) {
        return s[i + 1] - s[i];
    }

    public double[] getX() { return x.clone(); }

    public double[] getY() { return y.clone(); }

    public double[] getS() { return s.clone(); }

    public double[] getCurvature() { return curvature.clone(); }
}
