package racingline.strategy;

import racingline.config.VehicleConfig;
import racingline.domain.dto.ModelDescriptor;
import racingline.domain.track.TrackGeometry;
import racingline.physics.solver.SpeedLimits;
import racingline.physics.solver.impl.CorneringSpeedCalculator;
import racingline.physics.solver.impl.LateApexOffsetSolver;
import racingline.physics.solver.impl.LateApexParameters;
import racingline.physics.solver.impl.SmoothingLevel;
import racingline.physics.solver.impl.SteadyStateSpeedSolver;

import java.util.List;

/**
 * Modelo por defecto: velocidades de forma cerrada con aerodinámica y vértice tardío
 * ponderado por la velocidad de paso por curva.
 */
public class PhysicsBasedRacingModel implements RacingLineModel {

    static final LateApexParameters PARAMETERS = LateApexParameters.builder()
            .usageFraction(0.4)
            .cornerThreshold(0.003)
            .curvatureSmoothingSigma(1.0)
            .phaseWindow(10)
            .lookAheadWindow(15)
            .apexWeight(0.9)
            .entryWeight(0.7)
            .exitWeight(0.6)
            .setupWeight(0.7)
            .minTransition(0.1)
            .steadyTolerance(0.1)
            .slowCornerSpeed(30.0)
            .fastCornerSpeed(50.0)
            .slowCornerFactor(1.0)
            .mediumCornerFactor(0.8)
            .fastCornerFactor(0.6)
            .lateApexLag(2)
            .smoothing(SmoothingLevel.MEDIUM)
            .build();

    private final SteadyStateSpeedSolver speedSolver;
    private final LateApexOffsetSolver offsetSolver;

    public PhysicsBasedRacingModel(CorneringSpeedCalculator cornering) {
        this.speedSolver = new SteadyStateSpeedSolver(cornering, new SpeedLimits(5.0, 100.0));
        this.offsetSolver = new LateApexOffsetSolver(PARAMETERS);
    }

    @Override
    public RacingModelId getId() {
        return RacingModelId.PHYSICS_BASED;
    }

    @Override
    public ModelDescriptor describe() {
        return new ModelDescriptor(
                getId().getId(),
                "Physics-Based Model",
                "Velocidades por equilibrio de fuerzas con carga aerodinámica y trazada de vértice tardío",
                getTrackUsageFraction(),
                List.of("Carga aerodinámica dependiente de la velocidad",
                        "Velocidad punta limitada por resistencia",
                        "Fases de curva ponderadas por velocidad"));
    }

    @Override
    public double getTrackUsageFraction() {
        return PARAMETERS.usageFraction();
    }

    @Override
    public double[] speeds(TrackGeometry geometry, VehicleConfig vehicle, double friction) {
        return speedSolver.solve(geometry, vehicle, friction);
    }

    @Override
    public double[] offsets(TrackGeometry geometry, double[] speeds, double trackWidth, VehicleConfig vehicle, double friction) {
        return offsetSolver.computeOffsets(geometry, speeds, trackWidth);
    }
}
