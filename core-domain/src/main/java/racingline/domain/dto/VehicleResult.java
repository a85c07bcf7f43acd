package racingline.domain.dto;

import lombok.Builder;

/**
 * Resultado de la optimización para un vehículo.
 *
 * @param vehicleId   Identificador del vehículo de la petición.
 * @param modelId     Modelo que produjo el resultado.
 * @param coordinates Línea de carrera cerrada, un par [x, y] por punto.
 * @param speeds      Velocidad (m/s) en cada punto de la línea.
 * @param lapTime     Tiempo de vuelta estimado en segundos.
 * @param fallback    true si la optimización falló y se devolvió la línea central con velocidad conservadora.
 */
@Builder
public record VehicleResult(
        String vehicleId,
        String modelId,
        double[][] coordinates,
        double[] speeds,
        double lapTime,
        boolean fallback
) {
}
