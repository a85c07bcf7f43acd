package racingline.compute.repository;

import racingline.domain.dto.TrackPresetDTO;

import java.util.List;
import java.util.Optional;

/**
 * Catálogo de pistas predefinidas, solo lectura.
 */
public interface TrackCatalogRepository {

    List<TrackPresetDTO> findAll();

    Optional<TrackPresetDTO> findById(String trackId);
}
