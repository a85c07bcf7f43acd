package racingline.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import racingline.config.OptimizerConfig;
import racingline.utils.ClosedLoops;
import racingline.utils.SignalFilters;

import java.util.ArrayList;
import java.util.List;

/**
 * Separación de carriles para varios vehículos.
 * <p>
 * Todos los carriles se derivan de la misma línea base sumando un desplazamiento constante simétrico
 * alrededor de cero. En cada punto el haz completo se traslada hacia dentro si el carril exterior
 * saldría del límite de pista, así que el orden y la separación entre carriles se conservan y las
 * líneas nunca se cruzan. Si el haz no cabe en la pista, el espaciado se comprime.
 */
@Slf4j
public class LaneSeparator {

    private static final double SEPARATION_WIDTH_FRACTION = 0.2;
    // Holgura sobre la separación mínima para que el redondeo no la deje por debajo
    private static final double SEPARATION_MARGIN = 1e-3;
    private static final double[] LANE_SMOOTHING_SIGMAS = {1.0, 1.5, 2.0};

    private final OptimizerConfig config;

    public LaneSeparator(OptimizerConfig config) {
        this.config = config;
    }

    /**
     * @param baseOffsets  desplazamientos cerrados de la línea optimizada compartida.
     * @param vehicleCount número de vehículos; se acota a [1, maxLanes].
     * @return un array cerrado de desplazamientos por carril, del lado derecho al izquierdo.
     */
    public List<double[]> separate(double[] baseOffsets, double trackWidth, int vehicleCount) {
        int lanes = Math.max(1, Math.min(vehicleCount, config.maxLanes()));
        if (lanes == 1) {
            return List.of(baseOffsets.clone());
        }

        double limit = trackWidth * config.laneBoundaryFraction();
        double spacing = laneSpacing(trackWidth, lanes);
        double halfExtent = spacing * (lanes - 1) / 2.0;
        log.debug("Separando {} carriles: espaciado {} m, límite lateral {} m", lanes, spacing, limit);

        double[] base = ClosedLoops.open(baseOffsets);
        int m = base.length;
        double[] bundleCenter = new double[m];
        for (int i = 0; i < m; i++) {
            double center = base[i];
            if (center + halfExtent > limit) center = limit - halfExtent;
            if (center - halfExtent < -limit) center = -limit + halfExtent;
            bundleCenter[i] = center;
        }

        List<double[]> result = new ArrayList<>(lanes);
        for (int lane = 0; lane < lanes; lane++) {
            double shift = -halfExtent + lane * spacing;
            double[] offsets = new double[m];
            for (int i = 0; i < m; i++) {
                offsets[i] = bundleCenter[i] + shift;
            }
            result.add(ClosedLoops.close(SignalFilters.cascadeWrap(offsets, LANE_SMOOTHING_SIGMAS)));
        }
        return result;
    }

    /**
     * Separación efectiva entre carriles adyacentes. Si la pista lo permite queda ligeramente por
     * encima de {@code minLaneSeparation}.
     */
    public double laneSpacing(double trackWidth, int lanes) {
        double spacing = Math.min(config.minLaneSeparation() + SEPARATION_MARGIN,
                trackWidth * SEPARATION_WIDTH_FRACTION);
        if (lanes > 1) {
            double limit = trackWidth * config.laneBoundaryFraction();
            spacing = Math.min(spacing, 2.0 * limit / (lanes - 1));
        }
        return spacing;
    }
}
