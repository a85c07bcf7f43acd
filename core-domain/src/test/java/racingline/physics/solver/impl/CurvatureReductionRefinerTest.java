package racingline.physics.solver.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import racingline.config.OptimizerConfig;
import racingline.domain.track.TrackGeometry;
import racingline.factory.SampleTrackFactory;
import racingline.factory.TrackGeometryFactory;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CurvatureReductionRefinerTest {

    private static final double MAX_OFFSET = 8.0;

    private final CurvatureReductionRefiner refiner = new CurvatureReductionRefiner(0.5);

    private static TrackGeometry rectangle() {
        return TrackGeometryFactory.fromCenterline(SampleTrackFactory.rectangle(400.0, 400.0, 10.0), 20.0,
                OptimizerConfig.defaults().withResamplePointCount(400));
    }

    private static int nearest(TrackGeometry geometry, double x, double y) {
        int best = 0;
        for (int i = 1; i < geometry.getLoopSize(); i++) {
            if (Math.hypot(geometry.getX(i) - x, geometry.getY(i) - y)
                    < Math.hypot(geometry.getX(best) - x, geometry.getY(best) - y)) {
                best = i;
            }
        }
        return best;
    }

    @Test
    @DisplayName("Las esquinas a la izquierda se desplazan hacia el interior (+n)")
    void refine_leftCorners_shouldMoveInside() {
        // ARRANGE
        TrackGeometry geometry = rectangle();
        double[] offsets = new double[geometry.getPointCount()];
        double[] speeds = new double[geometry.getPointCount()];
        Arrays.fill(speeds, 50.0);
        int corner = nearest(geometry, 400.0, 0.0);
        int midStraight = nearest(geometry, 200.0, 0.0);

        // ACT
        double[] refined = refiner.refine(geometry, offsets, speeds, MAX_OFFSET);

        // ASSERT
        double cornerMax = Double.NEGATIVE_INFINITY;
        for (int k = -4; k <= 4; k++) {
            cornerMax = Math.max(cornerMax, refined[corner + k]);
        }
        assertTrue(cornerMax > 0.05, "Desplazamiento en esquina: " + cornerMax);
        assertEquals(0.0, refined[midStraight], 1e-6);
    }

    @Test
    @DisplayName("El resultado queda acotado y cerrado")
    void refine_shouldRespectBoundAndClosure() {
        TrackGeometry geometry = rectangle();
        double[] offsets = new double[geometry.getPointCount()];
        Arrays.fill(offsets, MAX_OFFSET);
        double[] speeds = new double[geometry.getPointCount()];
        Arrays.fill(speeds, 90.0);

        double[] refined = refiner.refine(geometry, offsets, speeds, MAX_OFFSET);

        for (double offset : refined) {
            assertTrue(Math.abs(offset) <= MAX_OFFSET + 1e-12);
        }
        assertEquals(refined[0], refined[refined.length - 1]);
    }

    @Test
    @DisplayName("En un círculo la curvatura es uniforme y el refinamiento apenas mueve la línea")
    void refine_circle_shouldBarelyMove() {
        TrackGeometry geometry = TrackGeometryFactory.fromCenterline(
                SampleTrackFactory.circle(80.0, 100), 15.0, OptimizerConfig.defaults());
        double[] offsets = new double[geometry.getPointCount()];
        double[] speeds = new double[geometry.getPointCount()];
        Arrays.fill(speeds, 30.0);

        double[] refined = refiner.refine(geometry, offsets, speeds, MAX_OFFSET);

        for (double offset : refined) {
            assertEquals(0.0, offset, 0.1);
        }
    }
}
