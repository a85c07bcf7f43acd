package racingline.config;

import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con los parámetros globales del motor de optimización.
 * <p>
 * Los parámetros propios de cada modelo (fracción de uso de pista, umbrales de curva, pesos de fase)
 * viven en cada modelo; aquí solo están los que comparte toda la tubería.
 *
 * @param resamplePointCount       Número de puntos de la pista remuestreada, incluido el punto de cierre.
 * @param closureTolerance         Distancia bajo la cual el primer y último punto se consideran el mismo.
 * @param minSegmentLength         Longitud mínima de segmento usada en el cálculo del tiempo de vuelta.
 * @param curvatureSmoothingSigma  Sigma (en muestras) del gaussiano aplicado a la curvatura de la pista.
 * @param cornerDetectionThreshold |κ| a partir del cual el marco curvilíneo considera un punto como curva.
 * @param speedFloor               Velocidad mínima (m/s) de cualquier perfil devuelto.
 * @param speedCeiling             Velocidad máxima (m/s) de cualquier perfil devuelto.
 * @param fallbackSpeed            Velocidad constante asignada a un vehículo cuya optimización falla.
 * @param minLaneSeparation        Separación lateral mínima (m) entre carriles de vehículos distintos.
 * @param laneBoundaryFraction     Desplazamiento lateral máximo de un carril como fracción del ancho de pista.
 * @param maxLanes                 Número máximo de carriles distintos.
 * @param parallelism              Hilos del pool de trabajo por vehículo.
 */
@Builder
@With
public record OptimizerConfig(
        int resamplePointCount,
        double closureTolerance,
        double minSegmentLength,
        double curvatureSmoothingSigma,
        double cornerDetectionThreshold,
        double speedFloor,
        double speedCeiling,
        double fallbackSpeed,
        double minLaneSeparation,
        double laneBoundaryFraction,
        int maxLanes,
        int parallelism
) {

    public OptimizerConfig {
        if (resamplePointCount < 4) {
            throw new IllegalArgumentException("resamplePointCount debe ser al menos 4.");
        }
        if (speedFloor <= 0 || speedCeiling <= speedFloor) {
            throw new IllegalArgumentException("Ventana de velocidades inválida: [" + speedFloor + ", " + speedCeiling + "]");
        }
        if (maxLanes < 1 || parallelism < 1) {
            throw new IllegalArgumentException("maxLanes y parallelism deben ser positivos.");
        }
    }

    public static OptimizerConfig defaults() {
        return OptimizerConfig.builder()
                .resamplePointCount(100)
                .closureTolerance(1e-3)
                .minSegmentLength(0.1)
                .curvatureSmoothingSigma(1.0)
                .cornerDetectionThreshold(0.001)
                .speedFloor(1.0)
                .speedCeiling(120.0)
                .fallbackSpeed(10.0)
                .minLaneSeparation(3.0)
                .laneBoundaryFraction(0.45)
                .maxLanes(6)
                .parallelism(4)
                .build();
    }
}
