package racingline.optimizer;

import racingline.domain.dto.VehicleResult;
import racingline.strategy.RacingModelId;

import java.util.List;

/**
 * Punto de observación del ciclo de vida de una optimización.
 * <p>
 * Todos los métodos tienen implementación vacía; se invocan desde el hilo que llama a
 * {@link RacingLineOptimizer#optimize}, nunca desde los hilos del pool.
 */
public interface OptimizationListener {

    OptimizationListener NO_OP = new OptimizationListener() {};

    default void onOptimizationStarted(RacingModelId model, int trackPointCount, int vehicleCount) {}

    default void onModelFallback(String requestedModelId, RacingModelId resolvedModel) {}

    default void onVehicleCompleted(VehicleResult result) {}

    default void onVehicleFallback(String vehicleId, Throwable cause) {}

    default void onOptimizationFinished(RacingModelId model, List<VehicleResult> results, long elapsedMillis) {}
}
