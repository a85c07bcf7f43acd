package racingline.optimizer;

import lombok.RequiredArgsConstructor;
import racingline.config.OptimizerConfig;
import racingline.config.VehicleConfig;
import racingline.domain.dto.VehicleResult;
import racingline.domain.track.TrackGeometry;
import racingline.factory.TrackGeometryFactory;
import racingline.physics.frame.CurvilinearFrame;
import racingline.physics.solver.LapTimeCalculator;
import racingline.physics.solver.SpeedLimits;
import racingline.strategy.RacingLineModel;

import java.util.concurrent.Callable;

/**
 * Tarea de un vehículo: convierte los desplazamientos de su carril en coordenadas, recalcula la
 * geometría de esa línea y obtiene velocidades y tiempo de vuelta con el modelo elegido.
 * Se ejecuta en el pool del optimizador; solo lee estado compartido inmutable.
 */
@RequiredArgsConstructor
public class VehicleOptimizationTask implements Callable<VehicleResult> {

    private final RacingLineModel model;
    private final CurvilinearFrame frame;
    private final double[] laneOffsets;
    private final VehicleConfig vehicle;
    private final double friction;
    private final OptimizerConfig config;

    @Override
    public VehicleResult call() {
        TrackGeometry centerline = frame.getGeometry();

        // 1. Desplazamientos -> coordenadas globales
        double[][] line = frame.toGlobalLine(laneOffsets);

        // 2. Curvatura y velocidades propias de la línea
        TrackGeometry lineGeometry = TrackGeometryFactory.fromClosedPolyline(
                line[0], line[1], centerline.getTrackWidth(), config);
        double[] speeds = new SpeedLimits(config.speedFloor(), config.speedCeiling())
                .clampAll(model.speeds(lineGeometry, vehicle, friction));

        // 3. Tiempo de vuelta
        double lapTime = LapTimeCalculator.lapTime(line[0], line[1], speeds, config.minSegmentLength(), config.speedFloor());

        return ResultSanitizer.sanitize(VehicleResult.builder()
                .vehicleId(vehicle.id())
                .modelId(model.getId().getId())
                .coordinates(toPairs(line[0], line[1]))
                .speeds(speeds)
                .lapTime(lapTime)
                .fallback(false)
                .build());
    }

    static double[][] toPairs(double[] x, double[] y) {
        double[][] pairs = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            pairs[i] = new double[]{x[i], y[i]};
        }
        return pairs;
    }
}
