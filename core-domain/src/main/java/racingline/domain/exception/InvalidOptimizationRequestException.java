package racingline.domain.exception;

/**
 * Petición de optimización rechazada por datos de entrada inválidos
 * (pocos puntos de pista, parámetros físicos no positivos, etc.).
 */
public class InvalidOptimizationRequestException extends RuntimeException {

    public InvalidOptimizationRequestException(String message) {
        super(message);
    }
}
