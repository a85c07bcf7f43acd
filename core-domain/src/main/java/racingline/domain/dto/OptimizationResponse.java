package racingline.domain.dto;

import java.util.List;

public record OptimizationResponse(
        String modelId,
        List<VehicleResult> optimalLines,
        long executionTimeMs
) {
}
