package racingline.compute.service;

import racingline.domain.dto.ModelDescriptor;
import racingline.domain.dto.OptimizationRequest;
import racingline.domain.dto.OptimizationResponse;

import java.util.List;

public interface OptimizationService {

    OptimizationResponse optimize(OptimizationRequest request);

    List<ModelDescriptor> listModels();
}
