package racingline.compute.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import racingline.compute.repository.TrackCatalogRepository;
import racingline.compute.service.OptimizationService;
import racingline.compute.service.TrackCatalogService;
import racingline.domain.dto.OptimizationRequest;
import racingline.domain.dto.OptimizationResponse;
import racingline.domain.dto.PresetOptimizationRequest;
import racingline.domain.dto.TrackPresetDTO;
import racingline.domain.dto.TrackSummaryDTO;
import racingline.domain.exception.ResourceNotFoundException;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class TrackCatalogServiceImpl implements TrackCatalogService {

    private final TrackCatalogRepository trackRepository;
    private final OptimizationService optimizationService;

    @Override
    public List<TrackSummaryDTO> listTracks() {
        return trackRepository.findAll().stream()
                .map(TrackPresetDTO::toSummary)
                .toList();
    }

    @Override
    public TrackPresetDTO getTrack(String trackId) {
        return trackRepository.findById(trackId)
                .orElseThrow(() -> new ResourceNotFoundException("Pista no encontrada: " + trackId));
    }

    @Override
    public OptimizationResponse optimizeTrack(String trackId, PresetOptimizationRequest request) {
        TrackPresetDTO track = getTrack(trackId);
        log.info("Optimizando la pista del catálogo '{}' ({} puntos)", track.id(), track.trackPoints().size());

        OptimizationRequest optimizationRequest = OptimizationRequest.builder()
                .trackPoints(track.trackPoints())
                .trackWidth(track.width())
                .friction(track.friction())
                .vehicles(request == null ? List.of() : request.vehicles())
                .modelId(request == null ? null : request.modelId())
                .build();
        return optimizationService.optimize(optimizationRequest);
    }
}
