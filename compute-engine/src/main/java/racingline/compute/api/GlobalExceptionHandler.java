package racingline.compute.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import racingline.domain.exception.InvalidOptimizationRequestException;
import racingline.domain.exception.ResourceNotFoundException;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Entrada inválida (pista o vehículo fuera de rango).
     * Log: WARN (es un error de la petición, no del sistema).
     */
    @ExceptionHandler(InvalidOptimizationRequestException.class)
    public ResponseEntity<Object> handleInvalidRequest(InvalidOptimizationRequestException ex) {
        log.warn("Petición de optimización rechazada: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Optimization Request", ex.getMessage());
    }

    /**
     * JSON mal formado o con tipos incorrectos.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Cuerpo de petición ilegible: {}", ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "El cuerpo de la petición no es un JSON válido.");
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Recurso no encontrado: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    /**
     * Todo lo demás.
     * Log: ERROR (incluye la traza completa).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected System Error occurred", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support referencing this timestamp.");
    }

    private static ResponseEntity<Object> build(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", status.value(),
                "error", error,
                "message", message
        ));
    }
}
