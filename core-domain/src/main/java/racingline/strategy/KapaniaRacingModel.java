package racingline.strategy;

import lombok.extern.slf4j.Slf4j;
import racingline.config.OptimizerConfig;
import racingline.config.VehicleConfig;
import racingline.domain.dto.ModelDescriptor;
import racingline.domain.track.TrackGeometry;
import racingline.factory.TrackGeometryFactory;
import racingline.physics.frame.CurvilinearFrame;
import racingline.physics.solver.LapTimeCalculator;
import racingline.physics.solver.SpeedLimits;
import racingline.physics.solver.impl.CorneringSpeedCalculator;
import racingline.physics.solver.impl.CurvatureReductionRefiner;
import racingline.physics.solver.impl.ForwardBackwardSpeedSolver;
import racingline.physics.solver.impl.LateApexOffsetSolver;
import racingline.physics.solver.impl.LateApexParameters;
import racingline.physics.solver.impl.SmoothingLevel;

import java.util.List;

/**
 * Modelo iterativo de dos pasos (perfil de velocidades / trayectoria) en la línea de Kapania et al.
 * <p>
 * Parte de la trazada de vértice tardío y alterna: velocidades por integración adelante/atrás sobre
 * la línea actual, tiempo de vuelta y refinamiento por reducción de curvatura. Conserva la mejor
 * línea encontrada y se detiene cuando la mejora de tiempo es menor que {@link #CONVERGENCE_SECONDS}
 * o al alcanzar {@link #MAX_ITERATIONS}.
 */
@Slf4j
public class KapaniaRacingModel implements RacingLineModel {

    private static final int MAX_ITERATIONS = 5;
    private static final double CONVERGENCE_SECONDS = 0.1;
    private static final double REFINEMENT_GAIN = 0.5;

    static final LateApexParameters PARAMETERS = LateApexParameters.builder()
            .usageFraction(0.425)
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
            .smoothing(SmoothingLevel.LIGHT)
            .build();

    private final ForwardBackwardSpeedSolver speedSolver;
    private final LateApexOffsetSolver offsetSolver;
    private final CurvatureReductionRefiner refiner;
    private final OptimizerConfig config;

    public KapaniaRacingModel(CorneringSpeedCalculator cornering, OptimizerConfig config) {
        this.speedSolver = new ForwardBackwardSpeedSolver(cornering, new SpeedLimits(5.0, 90.0));
        this.offsetSolver = new LateApexOffsetSolver(PARAMETERS);
        this.refiner = new CurvatureReductionRefiner(REFINEMENT_GAIN);
        this.config = config;
    }

    @Override
    public RacingModelId getId() {
        return RacingModelId.KAPANIA;
    }

    @Override
    public ModelDescriptor describe() {
        return new ModelDescriptor(
                getId().getId(),
                "Kapania Two-Step Model",
                "Algoritmo iterativo de dos pasos: perfil de velocidades y minimización de curvatura",
                getTrackUsageFraction(),
                List.of("Integración de velocidades adelante/atrás",
                        "Refinamiento iterativo por reducción de curvatura",
                        "Uso agresivo del ancho de pista"));
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
        CurvilinearFrame frame = new CurvilinearFrame(geometry, PARAMETERS.cornerThreshold());
        double maxOffset = offsetSolver.maxOffset(trackWidth);
        double[] current = offsetSolver.computeOffsets(geometry, speeds, trackWidth);
        double[] best = current;
        double bestLapTime = Double.POSITIVE_INFINITY;
        double previousLapTime = Double.POSITIVE_INFINITY;

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            // 1. Velocidades sobre la línea actual
            double[][] line = frame.toGlobalLine(current);
            TrackGeometry lineGeometry = TrackGeometryFactory.fromClosedPolyline(line[0], line[1], trackWidth, config);
            double[] lineSpeeds = speedSolver.solve(lineGeometry, vehicle, friction);
            double lapTime = LapTimeCalculator.lapTime(line[0], line[1], lineSpeeds,
                    config.minSegmentLength(), config.speedFloor());

            if (lapTime < bestLapTime) {
                bestLapTime = lapTime;
                best = current;
            }
            log.debug("Iteración {}: tiempo de vuelta {} s", iteration + 1, lapTime);

            // 2. Convergencia
            if (Math.abs(previousLapTime - lapTime) < CONVERGENCE_SECONDS) {
                break;
            }
            previousLapTime = lapTime;

            // 3. Refinamiento de la trayectoria
            current = refiner.refine(geometry, current, lineSpeeds, maxOffset);
        }
        return best.clone();
    }
}
