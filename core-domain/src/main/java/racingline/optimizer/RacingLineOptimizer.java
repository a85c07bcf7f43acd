package racingline.optimizer;

import lombok.extern.slf4j.Slf4j;
import racingline.config.OptimizerConfig;
import racingline.config.VehicleConfig;
import racingline.domain.dto.ModelDescriptor;
import racingline.domain.dto.OptimizationRequest;
import racingline.domain.dto.VehicleResult;
import racingline.domain.track.TrackGeometry;
import racingline.factory.TrackGeometryFactory;
import racingline.physics.frame.CurvilinearFrame;
import racingline.physics.solver.impl.LaneSeparator;
import racingline.strategy.RacingLineModel;
import racingline.strategy.RacingModelRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fachada del motor de optimización de líneas de carrera.
 * <p>
 * Responsabilidades:
 * 1. Validar la entrada y resolver el modelo (con respaldo al modelo por defecto).
 * 2. Construir la geometría remuestreada y el marco curvilíneo de la petición.
 * 3. Calcular una línea base compartida con el primer vehículo que la resuelva y separarla en carriles.
 * 4. Repartir el trabajo por vehículo en un pool acotado y devolver los resultados en el orden de la petición.
 * <p>
 * El fallo de un vehículo no aborta la petición: ese vehículo recibe la línea central con una
 * velocidad constante conservadora.
 */
@Slf4j
public class RacingLineOptimizer implements AutoCloseable {

    private final RacingModelRegistry registry;
    private final OptimizerConfig config;
    private final OptimizationListener listener;
    private final TrackInputValidator validator;
    private final LaneSeparator laneSeparator;
    private final ExecutorService threadPool;

    public RacingLineOptimizer(RacingModelRegistry registry, OptimizerConfig config, OptimizationListener listener) {
        this.registry = registry;
        this.config = config;
        this.listener = listener == null ? OptimizationListener.NO_OP : listener;
        this.validator = new TrackInputValidator();
        this.laneSeparator = new LaneSeparator(config);
        this.threadPool = Executors.newFixedThreadPool(Math.max(config.parallelism(), 1));
        log.info("RacingLineOptimizer inicializado (hilos: {}, puntos de remuestreo: {})",
                config.parallelism(), config.resamplePointCount());
    }

    public List<VehicleResult> optimize(OptimizationRequest request) {
        long startTime = System.currentTimeMillis();
        validator.validate(request);

        // 1. Modelo
        RacingModelRegistry.Resolution resolution = registry.resolve(request.modelId());
        RacingLineModel model = resolution.model();
        if (resolution.fallback()) {
            listener.onModelFallback(request.modelId(), model.getId());
        }

        List<VehicleConfig> vehicles = request.vehicles() == null ? List.of() : request.vehicles();
        listener.onOptimizationStarted(model.getId(), request.trackPoints().size(), vehicles.size());
        if (vehicles.isEmpty()) {
            listener.onOptimizationFinished(model.getId(), List.of(), System.currentTimeMillis() - startTime);
            return List.of();
        }

        // 2. Geometría y marco de la petición
        TrackGeometry geometry = TrackGeometryFactory.fromCenterline(request.trackPoints(), request.trackWidth(), config);
        CurvilinearFrame frame = new CurvilinearFrame(geometry, config.cornerDetectionThreshold());

        // 3. Línea base y carriles
        BaseLine baseLine = computeBaseLine(model, geometry, request, vehicles);
        List<double[]> lanes = baseLine.lanes();

        // 4. Trabajo por vehículo (los que ya fallaron en la línea base no se relanzan)
        List<VehicleOptimizationTask> tasks = new ArrayList<>(vehicles.size());
        for (int i = 0; i < vehicles.size(); i++) {
            if (baseLine.failures().containsKey(i)) {
                continue;
            }
            double[] laneOffsets = lanes.get(i % lanes.size());
            tasks.add(new VehicleOptimizationTask(model, frame, laneOffsets, vehicles.get(i), request.friction(), config));
        }

        List<Future<VehicleResult>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Optimización interrumpida.", e);
        }

        List<VehicleResult> results = new ArrayList<>(vehicles.size());
        int taskIndex = 0;
        for (int i = 0; i < vehicles.size(); i++) {
            VehicleConfig vehicle = vehicles.get(i);
            RuntimeException baseFailure = baseLine.failures().get(i);
            if (baseFailure != null) {
                listener.onVehicleFallback(vehicle.id(), baseFailure);
                results.add(fallbackResult(vehicle, geometry, model));
                continue;
            }
            VehicleResult result;
            try {
                result = futures.get(taskIndex++).get();
                listener.onVehicleCompleted(result);
            } catch (ExecutionException e) {
                listener.onVehicleFallback(vehicle.id(), e.getCause());
                result = fallbackResult(vehicle, geometry, model);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Optimización interrumpida.", e);
            }
            results.add(result);
        }

        listener.onOptimizationFinished(model.getId(), results, System.currentTimeMillis() - startTime);
        return results;
    }

    public List<ModelDescriptor> listModels() {
        return registry.listModels();
    }

    /** Resultado conservador: línea central remuestreada a velocidad constante. */
    VehicleResult fallbackResult(VehicleConfig vehicle, TrackGeometry geometry, RacingLineModel model) {
        double[] speeds = new double[geometry.getPointCount()];
        Arrays.fill(speeds, config.fallbackSpeed());
        return ResultSanitizer.sanitize(VehicleResult.builder()
                .vehicleId(vehicle.id())
                .modelId(model.getId().getId())
                .coordinates(VehicleOptimizationTask.toPairs(geometry.getX(), geometry.getY()))
                .speeds(speeds)
                .lapTime(geometry.getTotalLength() / config.fallbackSpeed())
                .fallback(true)
                .build());
    }

    /**
     * Prueba cada vehículo, en el orden de la petición, como referencia de la línea base. Los que
     * fallan quedan registrados por índice; si ninguno la resuelve, {@code lanes} queda vacía.
     */
    private BaseLine computeBaseLine(RacingLineModel model, TrackGeometry geometry,
                                     OptimizationRequest request, List<VehicleConfig> vehicles) {
        Map<Integer, RuntimeException> failures = new HashMap<>();
        for (int i = 0; i < vehicles.size(); i++) {
            VehicleConfig leader = vehicles.get(i);
            try {
                double[] baseSpeeds = model.speeds(geometry, leader, request.friction());
                double[] baseOffsets = model.offsets(geometry, baseSpeeds, request.trackWidth(), leader, request.friction());
                List<double[]> lanes = laneSeparator.separate(baseOffsets, request.trackWidth(), vehicles.size());
                return new BaseLine(lanes, failures);
            } catch (RuntimeException e) {
                log.warn("Línea base fallida con el vehículo {} (modelo {}). Se prueba con el siguiente.",
                        leader.id(), model.getId().getId(), e);
                failures.put(i, e);
            }
        }
        log.error("Ningún vehículo pudo calcular la línea base con el modelo {}", model.getId().getId());
        return new BaseLine(List.of(), failures);
    }

    private record BaseLine(List<double[]> lanes, Map<Integer, RuntimeException> failures) {
    }

    @Override
    public void close() {
        if (!threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("RacingLineOptimizer cerrado.");
    }
}
