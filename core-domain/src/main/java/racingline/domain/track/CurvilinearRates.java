package racingline.domain.track;

/** Derivadas temporales (ṡ, ṅ, ξ̇) de un estado curvilíneo. */
public record CurvilinearRates(double sDot, double nDot, double xiDot) {
}
