package racingline.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import racingline.domain.dto.TrackPoint;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SampleTrackFactoryTest {

    @Test
    @DisplayName("El círculo de muestra cierra en el punto inicial")
    void circle_shouldRepeatFirstPoint() {
        List<TrackPoint> points = SampleTrackFactory.circle(100.0, 100);

        assertEquals(100, points.size());
        assertEquals(points.get(0).x(), points.get(99).x(), 1e-9);
        assertEquals(points.get(0).y(), points.get(99).y(), 1e-9);
        assertEquals(100.0, Math.hypot(points.get(37).x(), points.get(37).y()), 1e-9);
    }

    @Test
    @DisplayName("El rectángulo recorre los cuatro lados con el espaciado pedido")
    void rectangle_shouldSampleAllSides() {
        List<TrackPoint> points = SampleTrackFactory.rectangle(400, 200, 10);

        assertEquals(120, points.size());
        assertEquals(new TrackPoint(0, 0), points.get(0));
        assertEquals(new TrackPoint(400, 0), points.get(40));
        assertEquals(new TrackPoint(400, 200), points.get(60));
    }
}
