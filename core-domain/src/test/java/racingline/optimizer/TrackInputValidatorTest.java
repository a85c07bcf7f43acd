package racingline.optimizer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import racingline.config.VehicleConfig;
import racingline.domain.dto.OptimizationRequest;
import racingline.domain.dto.TrackPoint;
import racingline.domain.exception.InvalidOptimizationRequestException;
import racingline.factory.SampleTrackFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrackInputValidatorTest {

    private final TrackInputValidator validator = new TrackInputValidator();

    private static OptimizationRequest validRequest() {
        return OptimizationRequest.builder()
                .trackPoints(SampleTrackFactory.circle(50.0, 20))
                .trackWidth(12.0)
                .friction(1.0)
                .vehicles(List.of(VehicleConfig.getTestingVehicle()))
                .build();
    }

    @Test
    @DisplayName("Una petición correcta pasa la validación")
    void validate_validRequest_shouldPass() {
        assertDoesNotThrow(() -> validator.validate(validRequest()));
        assertDoesNotThrow(() -> validator.validate(validRequest().withVehicles(null)));
    }

    @Test
    @DisplayName("Pista: menos de 3 puntos, puntos no finitos, ancho o fricción inválidos")
    void validate_invalidTrack_shouldThrow() {
        OptimizationRequest base = validRequest();

        InvalidOptimizationRequestException tooFew = assertThrows(InvalidOptimizationRequestException.class,
                () -> validator.validate(base.withTrackPoints(List.of(new TrackPoint(0, 0), new TrackPoint(1, 0)))));
        assertTrue(tooFew.getMessage().contains("3 puntos"));

        assertThrows(InvalidOptimizationRequestException.class, () -> validator.validate(base.withTrackPoints(
                List.of(new TrackPoint(0, 0), new TrackPoint(Double.NaN, 0), new TrackPoint(1, 1)))));
        assertThrows(InvalidOptimizationRequestException.class, () -> validator.validate(base.withTrackWidth(0.0)));
        assertThrows(InvalidOptimizationRequestException.class, () -> validator.validate(base.withFriction(-0.5)));
        assertThrows(InvalidOptimizationRequestException.class, () -> validator.validate(base.withFriction(2.5)));
        assertThrows(InvalidOptimizationRequestException.class, () -> validator.validate(null));
    }

    @Test
    @DisplayName("Vehículo: identificador obligatorio y magnitudes físicas positivas")
    void validateVehicle_invalidValues_shouldThrow() {
        VehicleConfig car = VehicleConfig.getTestingVehicle();

        assertThrows(InvalidOptimizationRequestException.class, () -> validator.validateVehicle(car.withId(" "), 0));
        assertThrows(InvalidOptimizationRequestException.class, () -> validator.validateVehicle(car.withMass(0.0), 0));
        assertThrows(InvalidOptimizationRequestException.class, () -> validator.validateVehicle(car.withLength(-2.0), 0));
        assertThrows(InvalidOptimizationRequestException.class,
                () -> validator.validateVehicle(car.withMaxAcceleration(Double.POSITIVE_INFINITY), 0));
        assertThrows(InvalidOptimizationRequestException.class, () -> validator.validateVehicle(car.withFrontalArea(0.0), 0));
        assertThrows(InvalidOptimizationRequestException.class, () -> validator.validateVehicle(null, 1));
    }

    @Test
    @DisplayName("El ángulo de dirección debe estar en (0, 90) grados")
    void validateVehicle_steeringOutOfRange_shouldThrow() {
        VehicleConfig car = VehicleConfig.getTestingVehicle();

        InvalidOptimizationRequestException error = assertThrows(InvalidOptimizationRequestException.class,
                () -> validator.validateVehicle(car.withMaxSteeringAngle(90.0), 0));
        assertTrue(error.getMessage().contains("car_1"));
        assertThrows(InvalidOptimizationRequestException.class,
                () -> validator.validateVehicle(car.withMaxSteeringAngle(0.0), 0));
    }
}
