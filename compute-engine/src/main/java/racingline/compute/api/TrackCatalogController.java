package racingline.compute.api;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import racingline.compute.service.TrackCatalogService;
import racingline.config.ApiRoutes;
import racingline.domain.dto.OptimizationResponse;
import racingline.domain.dto.PresetOptimizationRequest;
import racingline.domain.dto.TrackPresetDTO;
import racingline.domain.dto.TrackSummaryDTO;

import java.util.List;

@RestController
@RequestMapping(ApiRoutes.TRACKS)
@RequiredArgsConstructor
public class TrackCatalogController {

    private final TrackCatalogService trackCatalogService;

    @GetMapping
    public ResponseEntity<List<TrackSummaryDTO>> listTracks() {
        return ResponseEntity.ok(trackCatalogService.listTracks());
    }

    @GetMapping("/{trackId}")
    public ResponseEntity<TrackPresetDTO> getTrack(@PathVariable("trackId") String trackId) {
        return ResponseEntity.ok(trackCatalogService.getTrack(trackId));
    }

    /**
     * Optimiza una pista del catálogo: el cuerpo solo lleva vehículos y modelo.
     * POST /v1/tracks/{trackId}/optimize
     */
    @PostMapping("/{trackId}/optimize")
    public ResponseEntity<OptimizationResponse> optimizeTrack(
            @PathVariable("trackId") String trackId,
            @RequestBody PresetOptimizationRequest request
    ) {
        return ResponseEntity.ok(trackCatalogService.optimizeTrack(trackId, request));
    }
}
