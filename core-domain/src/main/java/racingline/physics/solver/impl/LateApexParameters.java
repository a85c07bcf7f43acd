package racingline.physics.solver.impl;

import lombok.Builder;
import lombok.With;

/**
 * Constantes ajustables de la heurística de vértice tardío. Cada modelo tiene su propio juego.
 *
 * @param usageFraction           Desplazamiento máximo como fracción del ancho de pista.
 * @param cornerThreshold         |κ| suavizada a partir de la cual un punto es curva.
 * @param curvatureSmoothingSigma Sigma del gaussiano aplicado a la curvatura antes de clasificar.
 * @param phaseWindow             Puntos promediados delante y detrás para decidir la fase de la curva.
 * @param lookAheadWindow         Puntos que una recta mira hacia adelante buscando la siguiente curva.
 * @param apexWeight              Peso hacia el interior en el vértice.
 * @param entryWeight             Peso hacia el exterior en la entrada.
 * @param exitWeight              Peso hacia el exterior en la salida.
 * @param setupWeight             Peso hacia el exterior en la recta previa a una curva.
 * @param minTransition           Factor mínimo de transición en recta.
 * @param steadyTolerance         Variación relativa de curvatura por debajo de la cual el arco es de radio constante.
 * @param slowCornerSpeed         Por debajo de esta velocidad se usa {@code slowCornerFactor}.
 * @param fastCornerSpeed         Por encima de esta velocidad se usa {@code fastCornerFactor}.
 * @param lateApexLag             Puntos que se retrasa el patrón de desplazamientos hacia la salida.
 * @param smoothing               Suavizado final de los desplazamientos.
 */
@Builder
@With
public record LateApexParameters(
        double usageFraction,
        double cornerThreshold,
        double curvatureSmoothingSigma,
        int phaseWindow,
        int lookAheadWindow,
        double apexWeight,
        double entryWeight,
        double exitWeight,
        double setupWeight,
        double minTransition,
        double steadyTolerance,
        double slowCornerSpeed,
        double fastCornerSpeed,
        double slowCornerFactor,
        double mediumCornerFactor,
        double fastCornerFactor,
        int lateApexLag,
        SmoothingLevel smoothing
) {

    public double speedFactor(double speed) {
        if (speed < slowCornerSpeed) return slowCornerFactor;
        if (speed < fastCornerSpeed) return mediumCornerFactor;
        return fastCornerFactor;
    }
}
