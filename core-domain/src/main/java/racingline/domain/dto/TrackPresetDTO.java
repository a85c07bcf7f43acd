package racingline.domain.dto;

import lombok.Builder;

import java.util.List;

/**
 * Pista predefinida del catálogo.
 */
@Builder
public record TrackPresetDTO(
        String id,
        String name,
        String country,
        String description,
        double width,
        double friction,
        List<TrackPoint> trackPoints
) {

    public TrackSummaryDTO toSummary() {
        return new TrackSummaryDTO(id, name, country, width, friction, trackPoints == null ? 0 : trackPoints.size());
    }
}
