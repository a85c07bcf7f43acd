package racingline.domain.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import racingline.config.VehicleConfig;

import java.util.List;

/** Cuerpo de la optimización de una pista del catálogo: la geometría la aporta el preset. */
public record PresetOptimizationRequest(
        @JsonAlias("cars") List<VehicleConfig> vehicles,
        @JsonAlias("model") String modelId
) {
}
