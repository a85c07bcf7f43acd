package racingline.physics.solver;

import racingline.config.VehicleConfig;
import racingline.domain.track.TrackGeometry;

/**
 * Estrategia de cálculo del perfil de velocidades máximas sobre una geometría cerrada.
 * <p>
 * Contrato: devuelve un array nuevo con una velocidad por punto de la geometría (incluido el
 * cierre, igual al primero), finita, estrictamente positiva y dentro de los límites del solver.
 */
@FunctionalInterface
public interface SpeedProfileSolver {

    double[] solve(TrackGeometry geometry, VehicleConfig vehicle, double friction);
}
