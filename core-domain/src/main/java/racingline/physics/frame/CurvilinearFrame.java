package racingline.physics.frame;

import racingline.domain.track.CurvilinearRates;
import racingline.domain.track.CurvilinearState;
import racingline.domain.track.GlobalPose;
import racingline.domain.track.TrackGeometry;
import racingline.domain.track.TrackProperties;
import racingline.domain.track.TurnDirection;

/**
 * Marco de coordenadas curvilíneas (s, n, ξ) ligado a una {@link TrackGeometry}.
 * <p>
 * Se construye una vez por petición y es de solo lectura. Convenciones:
 * <ul>
 * <li>s: abscisa a lo largo de la línea central, acotada a [0, longitud].</li>
 * <li>n: desplazamiento lateral, positivo hacia la normal izquierda (-ty, tx).</li>
 * <li>ξ: rumbo relativo a la tangente local, normalizado a (-π, π].</li>
 * </ul>
 * La métrica 1 - nκ se acota inferiormente para evitar la singularidad cuando nκ → 1.
 */
public class CurvilinearFrame {

    public static final double METRIC_FLOOR = 1e-6;
    private static final double STRAIGHT_CURVATURE = 1e-10;

    private final TrackGeometry geometry;
    private final double cornerThreshold;

    /**
     * @param cornerThreshold |κ| a partir del cual {@link #propertiesAt(double)} marca el punto como curva.
     */
    public CurvilinearFrame(TrackGeometry geometry, double cornerThreshold) {
        this.geometry = geometry;
        this.cornerThreshold = cornerThreshold;
    }

    public TrackGeometry getGeometry() {
        return geometry;
    }

    /**
     * Proyección de un punto global sobre la polilínea central (búsqueda lineal por segmentos).
     */
    public CurvilinearState toCurvilinear(double x, double y, double heading) {
        int bestSegment = 0;
        double bestT = 0.0;
        double bestDistanceSq = Double.POSITIVE_INFINITY;

        for (int i = 0; i < geometry.getLoopSize(); i++) {
            double ax = geometry.getX(i);
            double ay = geometry.getY(i);
            double dx = geometry.getX(i + 1) - ax;
            double dy = geometry.getY(i + 1) - ay;
            double lengthSq = dx * dx + dy * dy;
            double t = lengthSq > 0 ? ((x - ax) * dx + (y - ay) * dy) / lengthSq : 0.0;
            t = Math.max(0.0, Math.min(1.0, t));
            double px = ax + t * dx - x;
            double py = ay + t * dy - y;
            double distanceSq = px * px + py * py;
            if (distanceSq < bestDistanceSq) {
                bestDistanceSq = distanceSq;
                bestSegment = i;
                bestT = t;
            }
        }

        int i = bestSegment;
        double footX = geometry.getX(i) + bestT * (geometry.getX(i + 1) - geometry.getX(i));
        double footY = geometry.getY(i) + bestT * (geometry.getY(i + 1) - geometry.getY(i));
        double[] normal = interpolateUnit(geometry.getNormalX(i), geometry.getNormalY(i),
                geometry.getNormalX(i + 1), geometry.getNormalY(i + 1), bestT);
        double[] tangent = interpolateUnit(geometry.getTangentX(i), geometry.getTangentY(i),
                geometry.getTangentX(i + 1), geometry.getTangentY(i + 1), bestT);

        double s = geometry.getS(i) + bestT * geometry.getSegmentLength(i);
        double n = (x - footX) * normal[0] + (y - footY) * normal[1];
        double trackHeading = Math.atan2(tangent[1], tangent[0]);
        return new CurvilinearState(s, n, normalizeAngle(heading - trackHeading));
    }

    /**
     * Transformación inversa: interpola posición, tangente y normal en s (acotada) y desplaza n sobre la normal.
     */
    public GlobalPose toGlobal(double s, double n, double xi) {
        double clamped = clampS(s);
        int i = segmentIndex(clamped);
        double t = segmentFraction(i, clamped);

        double cx = geometry.getX(i) + t * (geometry.getX(i + 1) - geometry.getX(i));
        double cy = geometry.getY(i) + t * (geometry.getY(i + 1) - geometry.getY(i));
        double[] normal = interpolateUnit(geometry.getNormalX(i), geometry.getNormalY(i),
                geometry.getNormalX(i + 1), geometry.getNormalY(i + 1), t);
        double[] tangent = interpolateUnit(geometry.getTangentX(i), geometry.getTangentY(i),
                geometry.getTangentX(i + 1), geometry.getTangentY(i + 1), t);

        double heading = normalizeAngle(Math.atan2(tangent[1], tangent[0]) + xi);
        return new GlobalPose(cx + n * normal[0], cy + n * normal[1], heading);
    }

    public TrackProperties propertiesAt(double s) {
        double clamped = clampS(s);
        double curvature = curvatureAt(clamped);
        double magnitude = Math.abs(curvature);
        double radius = magnitude < STRAIGHT_CURVATURE ? Double.POSITIVE_INFINITY : 1.0 / magnitude;
        return new TrackProperties(
                clamped,
                curvature,
                radius,
                magnitude > cornerThreshold,
                TurnDirection.fromCurvature(curvature, cornerThreshold));
    }

    /** Curvatura interpolada linealmente en s; nunca extrapola fuera de los arrays. */
    public double curvatureAt(double s) {
        double clamped = clampS(s);
        int i = segmentIndex(clamped);
        double t = segmentFraction(i, clamped);
        return geometry.getCurvature(i) + t * (geometry.getCurvature(i + 1) - geometry.getCurvature(i));
    }

    /**
     * Ecuaciones cinemáticas en el marco curvilíneo para velocidades de cuerpo (u, v) y guiñada ω.
     * <p>
     * ṡ = (u cos ξ - v sin ξ) / (1 - nκ), ṅ = u sin ξ + v cos ξ, ξ̇ = ω - κ ṡ.
     */
    public CurvilinearRates kinematics(CurvilinearState state, double u, double v, double yawRate) {
        double curvature = curvatureAt(state.s());
        double metric = Math.max(1.0 - state.n() * curvature, METRIC_FLOOR);
        double sDot = (u * Math.cos(state.xi()) - v * Math.sin(state.xi())) / metric;
        double nDot = u * Math.sin(state.xi()) + v * Math.cos(state.xi());
        double xiDot = yawRate - curvature * sDot;
        return new CurvilinearRates(sDot, nDot, xiDot);
    }

    /** true si (s, n) cae dentro de la pista: s en [0, longitud] y |n| no mayor que el semiancho. */
    public boolean isWithinTrack(double s, double n) {
        return s >= 0.0 && s <= geometry.getTotalLength() && Math.abs(n) <= geometry.getHalfWidth();
    }

    /**
     * Aplica un desplazamiento lateral por punto sobre la normal de cada punto de la línea central.
     *
     * @param offsets array cerrado con un desplazamiento por punto de la geometría.
     * @return coordenadas [x[], y[]] de la línea resultante.
     */
    public double[][] toGlobalLine(double[] offsets) {
        int count = geometry.getPointCount();
        if (offsets.length != count) {
            throw new IllegalArgumentException("Se esperaban " + count + " desplazamientos, recibidos " + offsets.length);
        }
        double[] x = new double[count];
        double[] y = new double[count];
        for (int i = 0; i < count; i++) {
            x[i] = geometry.getX(i) + offsets[i] * geometry.getNormalX(i);
            y[i] = geometry.getY(i) + offsets[i] * geometry.getNormalY(i);
        }
        // Invariante de cierre
        x[count - 1] = x[0];
        y[count - 1] = y[0];
        return new double[][]{x, y};
    }

    public static double normalizeAngle(double angle) {
        double normalized = Math.atan2(Math.sin(angle), Math.cos(angle));
        return normalized == -Math.PI ? Math.PI : normalized;
    }

    private double clampS(double s) {
        if (Double.isNaN(s)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(geometry.getTotalLength(), s));
    }

    // Último índice i con s[i] <= s, acotado a [0, loopSize - 1]
    private int segmentIndex(double s) {
        int lo = 0;
        int hi = geometry.getPointCount() - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (geometry.getS(mid) <= s) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return Math.min(lo, geometry.getLoopSize() - 1);
    }

    private double segmentFraction(int i, double s) {
        double length = geometry.getSegmentLength(i);
        if (length <= 0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, (s - geometry.getS(i)) / length));
    }

    private static double[] interpolateUnit(double ax, double ay, double bx, double by, double t) {
        double x = ax + t * (bx - ax);
        double y = ay + t * (by - ay);
        double norm = Math.hypot(x, y);
        if (norm < 1e-12) {
            return new double[]{ax, ay};
        }
        return new double[]{x / norm, y / norm};
    }
}
