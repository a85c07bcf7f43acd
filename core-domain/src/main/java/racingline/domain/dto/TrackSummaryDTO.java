package racingline.domain.dto;

public record TrackSummaryDTO(
        String id,
        String name,
        String country,
        double width,
        double friction,
        int pointCount
) {
}
