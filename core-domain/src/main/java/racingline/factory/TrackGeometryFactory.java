package racingline.factory;

import lombok.extern.slf4j.Slf4j;
import racingline.config.OptimizerConfig;
import racingline.domain.dto.TrackPoint;
import racingline.domain.exception.InvalidOptimizationRequestException;
import racingline.domain.track.TrackGeometry;
import racingline.utils.ClosedLoops;
import racingline.utils.CubicSplineInterpolator;
import racingline.utils.PeriodicCubicSpline;
import racingline.utils.SignalFilters;

import java.util.ArrayList;
import java.util.List;

/**
 * Fábrica responsable de convertir polilíneas de usuario en instancias de {@link TrackGeometry}.
 * <p>
 * Proceso en cascada:
 * <ol>
 * <li>Limpieza: se eliminan puntos consecutivos duplicados y el duplicado de cierre.</li>
 * <li>Remuestreo: spline cúbico periódico con parametrización por cuerda, evaluado en parámetros
 * equiespaciados. Si el ajuste periódico es degenerado se usa un spline natural y se fuerza el cierre.</li>
 * <li>Diferenciales: tangentes y normales por diferencias centrales cíclicas.</li>
 * <li>Curvatura con signo por la fórmula plana, saneada y suavizada con un gaussiano periódico.</li>
 * </ol>
 */
@Slf4j
public class TrackGeometryFactory {

    private static final double DUPLICATE_EPSILON = 1e-9;
    private static final double CURVATURE_DENOMINATOR_FLOOR = 1e-10;

    private TrackGeometryFactory() {}

    /**
     * Construye la geometría remuestreada a partir de la línea central de entrada.
     *
     * @throws InvalidOptimizationRequestException si hay menos de 3 puntos distintos.
     */
    public static TrackGeometry fromCenterline(List<TrackPoint> points, double trackWidth, OptimizerConfig config) {
        if (points == null || points.size() < 3) {
            throw new InvalidOptimizationRequestException(
                    "Se requieren al menos 3 puntos de pista (recibidos: " + (points == null ? 0 : points.size()) + ")");
        }

        // 1. Limpieza y cierre
        double[][] loop = distinctLoop(points, config.closureTolerance());
        if (loop[0].length < 3) {
            throw new InvalidOptimizationRequestException(
                    "La pista debe contener al menos 3 puntos distintos (encontrados: " + loop[0].length + ")");
        }

        // 2. Remuestreo (pointCount incluye el cierre)
        int distinctSamples = config.resamplePointCount() - 1;
        double[][] resampled = resample(loop[0], loop[1], distinctSamples);
        log.debug("Pista remuestreada: {} puntos de entrada -> {} puntos distintos", points.size(), distinctSamples);

        // 3 y 4. Diferenciales y curvatura
        return buildFromLoop(resampled[0], resampled[1], trackWidth, config.curvatureSmoothingSigma());
    }

    /**
     * Construye la geometría de una polilínea que ya está cerrada y remuestreada (por ejemplo, una
     * línea de carrera). No elimina puntos, de modo que los índices siguen alineados con los de entrada.
     *
     * @param x coordenadas cerradas (último = primero, dentro de la tolerancia de cierre).
     */
    public static TrackGeometry fromClosedPolyline(double[] x, double[] y, double trackWidth, OptimizerConfig config) {
        if (x.length != y.length || x.length < 4) {
            throw new IllegalArgumentException("La polilínea cerrada requiere al menos 4 puntos (3 distintos más el cierre).");
        }
        double[] loopX = ClosedLoops.open(x);
        double[] loopY = ClosedLoops.open(y);
        return buildFromLoop(loopX, loopY, trackWidth, config.curvatureSmoothingSigma());
    }

    /**
     * Curvatura plana con signo de un bucle cerrado: κ = (x'y'' - y'x'') / (x'² + y'²)^1.5,
     * con diferencias centrales cíclicas. Los valores no finitos se sustituyen por 0.
     *
     * @return curvatura de cada punto del bucle (sin cierre).
     */
    public static double[] signedCurvature(double[] loopX, double[] loopY) {
        int m = loopX.length;
        double[] curvature = new double[m];
        for (int i = 0; i < m; i++) {
            int prev = ClosedLoops.wrap(i - 1, m);
            int next = ClosedLoops.wrap(i + 1, m);
            double dx = (loopX[next] - loopX[prev]) / 2.0;
            double dy = (loopY[next] - loopY[prev]) / 2.0;
            double ddx = loopX[next] - 2.0 * loopX[i] + loopX[prev];
            double ddy = loopY[next] - 2.0 * loopY[i] + loopY[prev];
            double denominator = Math.max(Math.pow(dx * dx + dy * dy, 1.5), CURVATURE_DENOMINATOR_FLOOR);
            double k = (dx * ddy - dy * ddx) / denominator;
            curvature[i] = Double.isFinite(k) ? k : 0.0;
        }
        return curvature;
    }

    private static TrackGeometry buildFromLoop(double[] loopX, double[] loopY, double trackWidth, double smoothingSigma) {
        int m = loopX.length;

        double[] tx = new double[m];
        double[] ty = new double[m];
        for (int i = 0; i < m; i++) {
            int prev = ClosedLoops.wrap(i - 1, m);
            int next = ClosedLoops.wrap(i + 1, m);
            double dx = loopX[next] - loopX[prev];
            double dy = loopY[next] - loopY[prev];
            double norm = Math.hypot(dx, dy);
            if (norm < DUPLICATE_EPSILON) {
                // Punto sin dirección definida: hereda la tangente anterior
                tx[i] = i > 0 ? tx[i - 1] : 1.0;
                ty[i] = i > 0 ? ty[i - 1] : 0.0;
            } else {
                tx[i] = dx / norm;
                ty[i] = dy / norm;
            }
        }

        double[] curvature = SignalFilters.gaussianWrap(signedCurvature(loopX, loopY), smoothingSigma);

        double[] s = new double[m + 1];
        for (int i = 1; i <= m; i++) {
            int prev = i - 1;
            int cur = i % m;
            s[i] = s[i - 1] + Math.hypot(loopX[cur] - loopX[prev], loopY[cur] - loopY[prev]);
        }

        double[] closedTx = ClosedLoops.close(tx);
        double[] closedTy = ClosedLoops.close(ty);
        double[] normalX = new double[m + 1];
        double[] normalY = new double[m + 1];
        for (int i = 0; i <= m; i++) {
            normalX[i] = -closedTy[i];
            normalY[i] = closedTx[i];
        }

        return new TrackGeometry(
                ClosedLoops.close(loopX), ClosedLoops.close(loopY), s,
                closedTx, closedTy, normalX, normalY,
                ClosedLoops.close(curvature), trackWidth);
    }

    private static double[][] distinctLoop(List<TrackPoint> points, double closureTolerance) {
        List<TrackPoint> distinct = new ArrayList<>();
        for (TrackPoint p : points) {
            if (distinct.isEmpty()) {
                distinct.add(p);
                continue;
            }
            TrackPoint last = distinct.get(distinct.size() - 1);
            if (Math.hypot(p.x() - last.x(), p.y() - last.y()) > DUPLICATE_EPSILON) {
                distinct.add(p);
            }
        }
        // El bucle se representa abierto: si el usuario ya lo cerró, se quita el duplicado
        while (distinct.size() > 1) {
            TrackPoint first = distinct.get(0);
            TrackPoint last = distinct.get(distinct.size() - 1);
            if (Math.hypot(first.x() - last.x(), first.y() - last.y()) <= closureTolerance) {
                distinct.remove(distinct.size() - 1);
            } else {
                break;
            }
        }

        double[] x = new double[distinct.size()];
        double[] y = new double[distinct.size()];
        for (int i = 0; i < distinct.size(); i++) {
            x[i] = distinct.get(i).x();
            y[i] = distinct.get(i).y();
        }
        return new double[][]{x, y};
    }

    private static double[][] resample(double[] loopX, double[] loopY, int samples) {
        int m = loopX.length;

        // Parametrización por longitud de cuerda normalizada a [0, 1)
        double[] u = new double[m];
        double perimeter = 0.0;
        for (int i = 0; i < m; i++) {
            u[i] = perimeter;
            int next = ClosedLoops.wrap(i + 1, m);
            perimeter += Math.hypot(loopX[next] - loopX[i], loopY[next] - loopY[i]);
        }
        for (int i = 0; i < m; i++) {
            u[i] /= perimeter;
        }

        double[] outX = new double[samples];
        double[] outY = new double[samples];
        try {
            PeriodicCubicSpline splineX = new PeriodicCubicSpline(u, loopX, 1.0);
            PeriodicCubicSpline splineY = new PeriodicCubicSpline(u, loopY, 1.0);
            for (int k = 0; k < samples; k++) {
                double t = (double) k / samples;
                outX[k] = splineX.value(t);
                outY[k] = splineY.value(t);
            }
        } catch (ArithmeticException | IllegalArgumentException e) {
            log.warn("Ajuste periódico degenerado ({}). Se usa un spline no periódico con cierre forzado.", e.getMessage());
            return resampleOpen(loopX, loopY, u, samples);
        }
        return new double[][]{outX, outY};
    }

    // Respaldo: spline natural sobre el bucle explícitamente cerrado (u = 1 repite el primer punto).
    private static double[][] resampleOpen(double[] loopX, double[] loopY, double[] u, int samples) {
        int m = loopX.length;
        double[] knots = new double[m + 1];
        System.arraycopy(u, 0, knots, 0, m);
        knots[m] = 1.0;
        CubicSplineInterpolator splineX = new CubicSplineInterpolator(knots, ClosedLoops.close(loopX));
        CubicSplineInterpolator splineY = new CubicSplineInterpolator(knots, ClosedLoops.close(loopY));

        double[] outX = new double[samples];
        double[] outY = new double[samples];
        for (int k = 0; k < samples; k++) {
            double t = (double) k / samples;
            outX[k] = splineX.value(t);
            outY[k] = splineY.value(t);
        }
        return new double[][]{outX, outY};
    }
}
