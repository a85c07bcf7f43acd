package racingline.strategy;

import racingline.config.VehicleConfig;
import racingline.domain.dto.ModelDescriptor;
import racingline.domain.track.TrackGeometry;

/**
 * Estrategia de optimización de la línea de carrera.
 * <p>
 * Cada implementación combina un solver de velocidades y un solver de desplazamientos laterales
 * con sus propias constantes. Las implementaciones no guardan estado entre llamadas y se
 * comparten entre peticiones concurrentes.
 */
public interface RacingLineModel {

    RacingModelId getId();

    ModelDescriptor describe();

    /** Desplazamiento lateral máximo como fracción del ancho de pista. */
    double getTrackUsageFraction();

    /** Perfil de velocidades (cerrado, uno por punto de la geometría). */
    double[] speeds(TrackGeometry geometry, VehicleConfig vehicle, double friction);

    /**
     * Desplazamientos laterales (cerrados) sobre la normal izquierda de la geometría.
     *
     * @param speeds perfil de velocidades de la propia geometría.
     */
    double[] offsets(TrackGeometry geometry, double[] speeds, double trackWidth, VehicleConfig vehicle, double friction);
}
