package racingline.physics.solver.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import racingline.config.OptimizerConfig;
import racingline.config.VehicleConfig;
import racingline.domain.track.TrackGeometry;
import racingline.factory.SampleTrackFactory;
import racingline.factory.TrackGeometryFactory;
import racingline.physics.model.AerodynamicModel;
import racingline.physics.solver.SpeedLimits;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SteadyStateSpeedSolverTest {

    private CorneringSpeedCalculator cornering;
    private SteadyStateSpeedSolver solver;
    private VehicleConfig vehicle;

    @BeforeEach
    void setUp() {
        cornering = new CorneringSpeedCalculator(new AerodynamicModel());
        solver = new SteadyStateSpeedSolver(cornering, new SpeedLimits(5.0, 100.0));
        vehicle = VehicleConfig.getTestingVehicle();
    }

    private static TrackGeometry circle(double radius) {
        return TrackGeometryFactory.fromCenterline(SampleTrackFactory.circle(radius, 100), 15.0, OptimizerConfig.defaults());
    }

    @Test
    @DisplayName("Devuelve un array cerrado dentro de los límites")
    void solve_shouldReturnClosedBoundedProfile() {
        TrackGeometry geometry = circle(20.0);

        double[] speeds = solver.solve(geometry, vehicle, 1.0);

        assertEquals(geometry.getPointCount(), speeds.length);
        assertEquals(speeds[0], speeds[speeds.length - 1]);
        for (double speed : speeds) {
            assertTrue(speed >= 5.0 && speed <= 100.0);
        }
    }

    @Test
    @DisplayName("En una curva cerrada la velocidad queda por debajo de la punta")
    void solve_tightCorner_shouldBeBelowTopSpeed() {
        double top = cornering.topSpeed(vehicle);

        double[] speeds = solver.solve(circle(20.0), vehicle, 1.0);

        // Sin carga aerodinámica serían sqrt(g·R) ≈ 14 m/s; la carga añade algo pero lejos de la punta
        assertTrue(speeds[10] > Math.sqrt(CorneringSpeedCalculator.GRAVITY * 20.0) - 0.5);
        assertTrue(speeds[10] < top);
    }

    @Test
    @DisplayName("Más adherencia implica más velocidad en curva")
    void solve_higherFriction_shouldBeFaster() {
        TrackGeometry geometry = circle(20.0);

        double slippery = solver.solve(geometry, vehicle, 0.6)[10];
        double grippy = solver.solve(geometry, vehicle, 1.5)[10];

        assertTrue(grippy > slippery);
    }

    @Test
    @DisplayName("Ningún punto supera la velocidad punta limitada por resistencia")
    void solve_gentleCorner_shouldNotExceedTopSpeed() {
        double top = cornering.topSpeed(vehicle);

        double[] speeds = solver.solve(circle(2000.0), vehicle, 1.0);

        for (double speed : speeds) {
            assertTrue(speed <= top + 1e-9);
        }
        assertEquals(top, speeds[0], 1e-9);
    }
}
