package racingline.compute.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import racingline.config.OptimizerConfig;

/**
 * Parámetros del motor leídos de {@code racingline.optimizer.*}.
 * <p>
 * Todas las claves son opcionales: las ausentes conservan el valor de {@link OptimizerConfig#defaults()}.
 */
@ConfigurationProperties(prefix = "racingline.optimizer")
public record OptimizerProperties(
        Integer resamplePointCount,
        Double closureTolerance,
        Double minSegmentLength,
        Double curvatureSmoothingSigma,
        Double cornerDetectionThreshold,
        Double speedFloor,
        Double speedCeiling,
        Double fallbackSpeed,
        Double minLaneSeparation,
        Double laneBoundaryFraction,
        Integer maxLanes,
        Integer parallelism
) {

    public OptimizerConfig toOptimizerConfig() {
        OptimizerConfig defaults = OptimizerConfig.defaults();
        return OptimizerConfig.builder()
                .resamplePointCount(resamplePointCount != null ? resamplePointCount : defaults.resamplePointCount())
                .closureTolerance(closureTolerance != null ? closureTolerance : defaults.closureTolerance())
                .minSegmentLength(minSegmentLength != null ? minSegmentLength : defaults.minSegmentLength())
                .curvatureSmoothingSigma(curvatureSmoothingSigma != null ? curvatureSmoothingSigma : defaults.curvatureSmoothingSigma())
                .cornerDetectionThreshold(cornerDetectionThreshold != null ? cornerDetectionThreshold : defaults.cornerDetectionThreshold())
                .speedFloor(speedFloor != null ? speedFloor : defaults.speedFloor())
                .speedCeiling(speedCeiling != null ? speedCeiling : defaults.speedCeiling())
                .fallbackSpeed(fallbackSpeed != null ? fallbackSpeed : defaults.fallbackSpeed())
                .minLaneSeparation(minLaneSeparation != null ? minLaneSeparation : defaults.minLaneSeparation())
                .laneBoundaryFraction(laneBoundaryFraction != null ? laneBoundaryFraction : defaults.laneBoundaryFraction())
                .maxLanes(maxLanes != null ? maxLanes : defaults.maxLanes())
                .parallelism(parallelism != null ? parallelism : defaults.parallelism())
                .build();
    }
}
