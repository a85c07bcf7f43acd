package racingline.domain.track;

/**
 * Propiedades locales de la pista en una abscisa s.
 *
 * @param radius Radio de giro, {@link Double#POSITIVE_INFINITY} en rectas.
 */
public record TrackProperties(
        double s,
        double curvature,
        double radius,
        boolean corner,
        TurnDirection turnDirection
) {
}
