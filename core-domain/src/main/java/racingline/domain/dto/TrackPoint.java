package racingline.domain.dto;

/** Punto 2D de la línea central de una pista, en metros. */
public record TrackPoint(double x, double y) {
}
