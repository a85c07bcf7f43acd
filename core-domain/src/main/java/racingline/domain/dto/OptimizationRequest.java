package racingline.domain.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;
import lombok.With;
import racingline.config.VehicleConfig;

import java.util.List;

/**
 * Entrada de la operación de optimización.
 *
 * @param trackPoints Línea central (al menos 3 puntos; se cierra automáticamente si no lo está).
 * @param trackWidth  Ancho total de la pista en metros.
 * @param friction    Coeficiente de fricción neumático-asfalto.
 * @param vehicles    Vehículos a optimizar; los resultados se devuelven en este mismo orden.
 * @param modelId     Identificador del modelo; si es desconocido se usa el modelo por defecto.
 */
@Builder
@With
public record OptimizationRequest(
        @JsonAlias("track_points") List<TrackPoint> trackPoints,
        @JsonAlias("width") double trackWidth,
        double friction,
        @JsonAlias("cars") List<VehicleConfig> vehicles,
        @JsonAlias("model") String modelId
) {
}
