package racingline.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.With;

/**
 * Parámetros físicos de un vehículo.
 * <p>
 * Los coeficientes aerodinámicos son opcionales en la petición: si faltan se toman los del
 * vehículo de referencia (Cd = 1.0, Cl = 3.0). El área frontal, si no se indica, se deriva
 * como largo × ancho × 0.7. La validación de rangos se hace en la entrada del optimizador,
 * no aquí, para poder devolver mensajes de error concretos.
 *
 * @param id               Identificador del vehículo en la respuesta.
 * @param mass             Masa en kg.
 * @param length           Longitud en metros.
 * @param width            Anchura en metros.
 * @param maxSteeringAngle Ángulo máximo de dirección en grados, en (0, 90).
 * @param maxAcceleration  Aceleración longitudinal máxima en m/s².
 * @param dragCoefficient  Coeficiente de resistencia (Cd).
 * @param liftCoefficient  Coeficiente de carga aerodinámica (Cl, positivo = hacia el suelo).
 * @param frontalArea      Área frontal en m², opcional.
 */
@Builder
@With
public record VehicleConfig(
        String id,
        double mass,
        double length,
        double width,
        @JsonAlias("max_steering_angle") double maxSteeringAngle,
        @JsonAlias("max_acceleration") double maxAcceleration,
        @JsonAlias("drag_coefficient") Double dragCoefficient,
        @JsonAlias("lift_coefficient") Double liftCoefficient,
        @JsonAlias("frontal_area") Double frontalArea
) {

    public static final double DEFAULT_DRAG_COEFFICIENT = 1.0;
    public static final double DEFAULT_LIFT_COEFFICIENT = 3.0;
    public static final double FRONTAL_AREA_FACTOR = 0.7;

    public VehicleConfig {
        dragCoefficient = dragCoefficient == null ? DEFAULT_DRAG_COEFFICIENT : dragCoefficient;
        liftCoefficient = liftCoefficient == null ? DEFAULT_LIFT_COEFFICIENT : liftCoefficient;
    }

    @JsonIgnore
    public double effectiveFrontalArea() {
        return frontalArea != null ? frontalArea : length * width * FRONTAL_AREA_FACTOR;
    }

    /** Vehículo de pruebas: monoplaza ligero con los coeficientes aerodinámicos por defecto. */
    public static VehicleConfig getTestingVehicle() {
        return VehicleConfig.builder()
                .id("car_1")
                .mass(750.0)
                .length(5.0)
                .width(2.0)
                .maxSteeringAngle(30.0)
                .maxAcceleration(10.0)
                .dragCoefficient(1.0)
                .liftCoefficient(3.0)
                .build();
    }
}
