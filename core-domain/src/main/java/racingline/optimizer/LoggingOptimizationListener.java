package racingline.optimizer;

import lombok.extern.slf4j.Slf4j;
import racingline.domain.dto.VehicleResult;
import racingline.strategy.RacingModelId;

import java.util.List;

/** Implementación del listener que vuelca el ciclo de vida a SLF4J. */
@Slf4j
public class LoggingOptimizationListener implements OptimizationListener {

    @Override
    public void onOptimizationStarted(RacingModelId model, int trackPointCount, int vehicleCount) {
        log.info("Optimización iniciada (modelo: {}, puntos: {}, vehículos: {})", model.getId(), trackPointCount, vehicleCount);
    }

    @Override
    public void onModelFallback(String requestedModelId, RacingModelId resolvedModel) {
        log.warn("Modelo '{}' desconocido. Se usa el modelo por defecto '{}'.", requestedModelId, resolvedModel.getId());
    }

    @Override
    public void onVehicleCompleted(VehicleResult result) {
        log.debug("Vehículo {} optimizado: vuelta {} s", result.vehicleId(), String.format("%.2f", result.lapTime()));
    }

    @Override
    public void onVehicleFallback(String vehicleId, Throwable cause) {
        log.warn("Optimización fallida para el vehículo {}. Se devuelve la línea central.", vehicleId, cause);
    }

    @Override
    public void onOptimizationFinished(RacingModelId model, List<VehicleResult> results, long elapsedMillis) {
        long fallbacks = results.stream().filter(VehicleResult::fallback).count();
        log.info("Optimización completada en {} ms ({} vehículos, {} en modo de respaldo)", elapsedMillis, results.size(), fallbacks);
    }
}
