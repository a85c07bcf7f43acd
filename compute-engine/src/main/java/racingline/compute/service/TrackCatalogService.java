package racingline.compute.service;

import racingline.domain.dto.OptimizationResponse;
import racingline.domain.dto.PresetOptimizationRequest;
import racingline.domain.dto.TrackPresetDTO;
import racingline.domain.dto.TrackSummaryDTO;

import java.util.List;

public interface TrackCatalogService {

    List<TrackSummaryDTO> listTracks();

    TrackPresetDTO getTrack(String trackId);

    /** Optimiza una pista del catálogo con su ancho y fricción. */
    OptimizationResponse optimizeTrack(String trackId, PresetOptimizationRequest request);
}
