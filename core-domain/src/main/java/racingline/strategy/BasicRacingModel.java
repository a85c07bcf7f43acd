package racingline.strategy;

import racingline.config.VehicleConfig;
import racingline.domain.dto.ModelDescriptor;
import racingline.domain.track.TrackGeometry;
import racingline.physics.solver.SpeedLimits;
import racingline.physics.solver.impl.CorneringSpeedCalculator;
import racingline.physics.solver.impl.LateApexOffsetSolver;
import racingline.physics.solver.impl.LateApexParameters;
import racingline.physics.solver.impl.SmoothingLevel;
import racingline.physics.solver.impl.SteeringLimitedSpeedSolver;

import java.util.List;

/**
 * Modelo geométrico conservador: curvatura muy suavizada, menor uso de pista y
 * velocidades limitadas por el radio de giro del vehículo.
 */
public class BasicRacingModel implements RacingLineModel {

    static final LateApexParameters PARAMETERS = LateApexParameters.builder()
            .usageFraction(0.3)
            .cornerThreshold(0.005)
            .curvatureSmoothingSigma(5.0)
            .phaseWindow(12)
            .lookAheadWindow(12)
            .apexWeight(0.6)
            .entryWeight(0.4)
            .exitWeight(0.4)
            .setupWeight(0.5)
            .minTransition(0.1)
            .steadyTolerance(0.1)
            .slowCornerSpeed(30.0)
            .fastCornerSpeed(50.0)
            .slowCornerFactor(1.0)
            .mediumCornerFactor(0.85)
            .fastCornerFactor(0.7)
            .lateApexLag(1)
            .smoothing(SmoothingLevel.HEAVY)
            .build();

    private final SteeringLimitedSpeedSolver speedSolver;
    private final LateApexOffsetSolver offsetSolver;

    public BasicRacingModel(CorneringSpeedCalculator cornering) {
        this.speedSolver = new SteeringLimitedSpeedSolver(cornering, new SpeedLimits(5.0, 100.0));
        this.offsetSolver = new LateApexOffsetSolver(PARAMETERS);
    }

    @Override
    public RacingModelId getId() {
        return RacingModelId.BASIC;
    }

    @Override
    public ModelDescriptor describe() {
        return new ModelDescriptor(
                getId().getId(),
                "Basic Geometric Model",
                "Trazada geométrica suave con velocidades limitadas por la dirección",
                getTrackUsageFraction(),
                List.of("Curvatura muy suavizada",
                        "Radio mínimo de giro por ángulo de dirección",
                        "Uso moderado del ancho de pista"));
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
