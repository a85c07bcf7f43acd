package racingline.optimizer;

import racingline.config.VehicleConfig;
import racingline.domain.dto.OptimizationRequest;
import racingline.domain.dto.TrackPoint;
import racingline.domain.exception.InvalidOptimizationRequestException;

import java.util.List;

/**
 * Validación de la entrada antes de cualquier cálculo. Los valores inválidos se rechazan con
 * un mensaje concreto; nunca se corrigen en silencio.
 */
public class TrackInputValidator {

    private static final double MAX_FRICTION = 2.0;

    public void validate(OptimizationRequest request) {
        if (request == null) {
            throw new InvalidOptimizationRequestException("La petición de optimización es obligatoria.");
        }
        validateTrack(request.trackPoints(), request.trackWidth(), request.friction());
        List<VehicleConfig> vehicles = request.vehicles();
        if (vehicles != null) {
            for (int i = 0; i < vehicles.size(); i++) {
                validateVehicle(vehicles.get(i), i);
            }
        }
    }

    public void validateTrack(List<TrackPoint> points, double trackWidth, double friction) {
        if (points == null || points.size() < 3) {
            throw new InvalidOptimizationRequestException(
                    "Se requieren al menos 3 puntos de pista (recibidos: " + (points == null ? 0 : points.size()) + ")");
        }
        for (int i = 0; i < points.size(); i++) {
            TrackPoint p = points.get(i);
            if (p == null || !Double.isFinite(p.x()) || !Double.isFinite(p.y())) {
                throw new InvalidOptimizationRequestException("El punto de pista " + i + " no es un punto finito.");
            }
        }
        if (!Double.isFinite(trackWidth) || trackWidth <= 0) {
            throw new InvalidOptimizationRequestException("El ancho de pista debe ser positivo (recibido: " + trackWidth + ")");
        }
        if (!Double.isFinite(friction) || friction <= 0 || friction > MAX_FRICTION) {
            throw new InvalidOptimizationRequestException(
                    "La fricción debe estar en (0, " + MAX_FRICTION + "] (recibida: " + friction + ")");
        }
    }

    public void validateVehicle(VehicleConfig vehicle, int index) {
        if (vehicle == null) {
            throw new InvalidOptimizationRequestException("El vehículo " + index + " es nulo.");
        }
        String label = vehicle.id() == null || vehicle.id().isBlank() ? "#" + index : vehicle.id();
        if (vehicle.id() == null || vehicle.id().isBlank()) {
            throw new InvalidOptimizationRequestException("El vehículo " + label + " no tiene identificador.");
        }
        requirePositive(vehicle.mass(), "mass", label);
        requirePositive(vehicle.length(), "length", label);
        requirePositive(vehicle.width(), "width", label);
        requirePositive(vehicle.maxAcceleration(), "maxAcceleration", label);
        requirePositive(vehicle.dragCoefficient(), "dragCoefficient", label);
        requirePositive(vehicle.liftCoefficient(), "liftCoefficient", label);
        if (vehicle.frontalArea() != null) {
            requirePositive(vehicle.frontalArea(), "frontalArea", label);
        }
        double steering = vehicle.maxSteeringAngle();
        if (!Double.isFinite(steering) || steering <= 0 || steering >= 90) {
            throw new InvalidOptimizationRequestException(
                    "Vehículo " + label + ": maxSteeringAngle debe estar en (0, 90) grados (recibido: " + steering + ")");
        }
    }

    private static void requirePositive(double value, String field, String vehicleLabel) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidOptimizationRequestException(
                    "Vehículo " + vehicleLabel + ": " + field + " debe ser positivo (recibido: " + value + ")");
        }
    }
}
