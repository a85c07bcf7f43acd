package racingline.domain.track;

/**
 * Posición relativa a la pista.
 *
 * @param s  Distancia recorrida a lo largo de la línea central (m).
 * @param n  Desplazamiento lateral con signo (m), positivo hacia la normal izquierda.
 * @param xi Rumbo relativo a la tangente local, en (-π, π].
 */
public record CurvilinearState(double s, double n, double xi) {
}
