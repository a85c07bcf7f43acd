package racingline.compute.api;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import racingline.compute.service.OptimizationService;
import racingline.config.ApiRoutes;
import racingline.domain.dto.ModelDescriptor;
import racingline.domain.dto.OptimizationRequest;
import racingline.domain.dto.OptimizationResponse;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class OptimizationController {

    private final OptimizationService optimizationService;

    /**
     * Optimiza la línea de carrera de cada vehículo sobre la pista enviada.
     * POST /v1/optimize
     */
    @PostMapping(ApiRoutes.OPTIMIZE)
    public ResponseEntity<OptimizationResponse> optimize(@RequestBody OptimizationRequest request) {
        return ResponseEntity.ok(optimizationService.optimize(request));
    }

    @GetMapping(ApiRoutes.MODELS)
    public ResponseEntity<List<ModelDescriptor>> listModels() {
        return ResponseEntity.ok(optimizationService.listModels());
    }
}
