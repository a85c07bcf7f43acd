package racingline.compute.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import racingline.compute.service.OptimizationService;
import racingline.domain.dto.ModelDescriptor;
import racingline.domain.dto.OptimizationRequest;
import racingline.domain.dto.OptimizationResponse;
import racingline.domain.dto.VehicleResult;
import racingline.optimizer.RacingLineOptimizer;
import racingline.strategy.RacingModelRegistry;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class OptimizationServiceImpl implements OptimizationService {

    private final RacingLineOptimizer optimizer;
    private final RacingModelRegistry registry;

    @Override
    public OptimizationResponse optimize(OptimizationRequest request) {
        long start = System.currentTimeMillis();
        List<VehicleResult> results = optimizer.optimize(request);
        long elapsed = System.currentTimeMillis() - start;

        // El modelo de la respuesta es el que se usó realmente, no el pedido
        String modelId = registry.resolve(request.modelId()).model().getId().getId();
        log.info("Petición resuelta con el modelo {} en {} ms ({} líneas)", modelId, elapsed, results.size());
        return new OptimizationResponse(modelId, results, elapsed);
    }

    @Override
    public List<ModelDescriptor> listModels() {
        return optimizer.listModels();
    }
}
