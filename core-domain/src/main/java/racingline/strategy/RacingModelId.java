package racingline.strategy;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Conjunto cerrado de modelos de línea de carrera disponibles.
 */
public enum RacingModelId {
    PHYSICS_BASED("physics_based"),
    BASIC("basic"),
    KAPANIA("kapania");

    private final String id;

    RacingModelId(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Busca un modelo por su identificador público, sin distinguir mayúsculas y aceptando guiones.
     */
    public static Optional<RacingModelId> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(model -> model.id.equals(normalized))
                .findFirst();
    }
}
