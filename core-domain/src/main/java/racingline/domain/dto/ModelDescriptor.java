package racingline.domain.dto;

import java.util.List;

/**
 * Metadatos de un modelo de línea de carrera para el listado público.
 *
 * @param trackUsageFraction Desplazamiento lateral máximo como fracción del ancho de pista.
 */
public record ModelDescriptor(
        String id,
        String name,
        String description,
        double trackUsageFraction,
        List<String> characteristics
) {
}
