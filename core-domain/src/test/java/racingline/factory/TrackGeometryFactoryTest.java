package racingline.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import racingline.config.OptimizerConfig;
import racingline.domain.dto.TrackPoint;
import racingline.domain.exception.InvalidOptimizationRequestException;
import racingline.domain.track.TrackGeometry;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrackGeometryFactoryTest {

    private static final double RADIUS = 100.0;
    private final OptimizerConfig config = OptimizerConfig.defaults();

    @Test
    @DisplayName("Remuestreo: exactamente resamplePointCount puntos con el primero igual al último")
    void fromCenterline_shouldProduceClosedLoopOfTargetSize() {
        // ARRANGE: polilínea abierta (no repite el primer punto)
        List<TrackPoint> square = List.of(
                new TrackPoint(0, 0), new TrackPoint(100, 0),
                new TrackPoint(100, 100), new TrackPoint(0, 100));

        // ACT
        TrackGeometry geometry = TrackGeometryFactory.fromCenterline(square, 12.0, config);

        // ASSERT
        int last = geometry.getPointCount() - 1;
        assertEquals(config.resamplePointCount(), geometry.getPointCount());
        assertEquals(geometry.getX(0), geometry.getX(last), 1e-9);
        assertEquals(geometry.getY(0), geometry.getY(last), 1e-9);
        assertEquals(12.0, geometry.getTrackWidth());
    }

    @Test
    @DisplayName("Circunferencia de radio R: curvatura casi constante e igual a 1/R, positiva en sentido antihorario")
    void fromCenterline_circle_shouldHaveCurvatureOneOverR() {
        TrackGeometry geometry = TrackGeometryFactory.fromCenterline(SampleTrackFactory.circle(RADIUS, 100), 15.0, config);

        for (int i = 0; i < geometry.getPointCount(); i++) {
            assertEquals(1.0 / RADIUS, geometry.getCurvature(i), 2e-4,
                    "La curvatura en el índice " + i + " debería ser ~1/R");
        }
    }

    @Test
    @DisplayName("Abscisa s: no decreciente, empieza en 0 y termina en la longitud total")
    void fromCenterline_shouldHaveMonotonicArcLength() {
        TrackGeometry geometry = TrackGeometryFactory.fromCenterline(SampleTrackFactory.circle(RADIUS, 100), 15.0, config);

        assertEquals(0.0, geometry.getS(0));
        for (int i = 1; i < geometry.getPointCount(); i++) {
            assertTrue(geometry.getS(i) >= geometry.getS(i - 1));
        }
        assertEquals(geometry.getTotalLength(), geometry.getS(geometry.getPointCount() - 1));
        assertEquals(2 * Math.PI * RADIUS, geometry.getTotalLength(), 2 * Math.PI * RADIUS * 0.01);
    }

    @Test
    @DisplayName("Tangente y normal unitarias; la normal apunta a la izquierda (hacia el centro en un giro antihorario)")
    void fromCenterline_shouldProduceUnitLeftNormals() {
        TrackGeometry geometry = TrackGeometryFactory.fromCenterline(SampleTrackFactory.circle(RADIUS, 100), 15.0, config);

        for (int i = 0; i < geometry.getPointCount(); i++) {
            assertEquals(1.0, Math.hypot(geometry.getTangentX(i), geometry.getTangentY(i)), 1e-9);
            assertEquals(1.0, Math.hypot(geometry.getNormalX(i), geometry.getNormalY(i)), 1e-9);
            double towardCenter = -(geometry.getX(i) * geometry.getNormalX(i) + geometry.getY(i) * geometry.getNormalY(i));
            assertTrue(towardCenter > 0, "La normal izquierda debe apuntar al centro del círculo");
        }
    }

    @Test
    @DisplayName("Puntos consecutivos duplicados y cierre explícito se toleran")
    void fromCenterline_shouldIgnoreDuplicatePoints() {
        List<TrackPoint> points = new ArrayList<>(SampleTrackFactory.circle(50.0, 40));
        points.add(5, points.get(5));
        points.add(5, points.get(5));

        TrackGeometry geometry = TrackGeometryFactory.fromCenterline(points, 10.0, config);

        for (int i = 0; i < geometry.getPointCount(); i++) {
            assertTrue(Double.isFinite(geometry.getCurvature(i)));
        }
        for (int i = 0; i < geometry.getLoopSize(); i++) {
            assertTrue(geometry.getSegmentLength(i) > 0.0);
        }
    }

    @Test
    @DisplayName("Menos de 3 puntos: error de validación")
    void fromCenterline_withTwoPoints_shouldThrow() {
        List<TrackPoint> points = List.of(new TrackPoint(0, 0), new TrackPoint(10, 0));

        InvalidOptimizationRequestException ex = assertThrows(InvalidOptimizationRequestException.class,
                () -> TrackGeometryFactory.fromCenterline(points, 10.0, config));
        assertTrue(ex.getMessage().contains("3 puntos"));
    }

    @Test
    @DisplayName("Tres puntos de los que solo dos son distintos: error de validación")
    void fromCenterline_withCollapsedPoints_shouldThrow() {
        List<TrackPoint> points = List.of(new TrackPoint(0, 0), new TrackPoint(0, 0), new TrackPoint(10, 0));

        assertThrows(InvalidOptimizationRequestException.class,
                () -> TrackGeometryFactory.fromCenterline(points, 10.0, config));
    }

    @Test
    @DisplayName("fromClosedPolyline conserva los índices de entrada")
    void fromClosedPolyline_shouldKeepPointCount() {
        TrackGeometry circle = TrackGeometryFactory.fromCenterline(SampleTrackFactory.circle(RADIUS, 100), 15.0, config);

        TrackGeometry rebuilt = TrackGeometryFactory.fromClosedPolyline(circle.getX(), circle.getY(), 15.0, config);

        assertEquals(circle.getPointCount(), rebuilt.getPointCount());
        assertEquals(circle.getX(7), rebuilt.getX(7));
        assertEquals(circle.getTotalLength(), rebuilt.getTotalLength(), 1e-9);
    }

    @Test
    @DisplayName("Curvatura con signo: un giro horario es negativo")
    void signedCurvature_clockwiseLoop_shouldBeNegative() {
        int m = 36;
        double[] x = new double[m];
        double[] y = new double[m];
        for (int i = 0; i < m; i++) {
            double angle = -2 * Math.PI * i / m;
            x[i] = 20 * Math.cos(angle);
            y[i] = 20 * Math.sin(angle);
        }

        double[] curvature = TrackGeometryFactory.signedCurvature(x, y);

        for (double k : curvature) {
            assertTrue(k < 0);
            assertEquals(-1.0 / 20, k, 1e-3);
        }
    }
}
