package racingline.strategy;

import lombok.extern.slf4j.Slf4j;
import racingline.config.OptimizerConfig;
import racingline.domain.dto.ModelDescriptor;
import racingline.physics.model.AerodynamicModel;
import racingline.physics.solver.impl.CorneringSpeedCalculator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registro explícito de modelos, construido una vez al arrancar y pasado por referencia al optimizador.
 * <p>
 * Un identificador desconocido o vacío no es un error: se resuelve al modelo por defecto y la
 * resolución lo indica para que el llamador pueda notificarlo.
 */
@Slf4j
public class RacingModelRegistry {

    public static final RacingModelId DEFAULT_MODEL = RacingModelId.PHYSICS_BASED;

    private final Map<RacingModelId, RacingLineModel> models;
    private final RacingModelId defaultModel;

    public RacingModelRegistry(List<RacingLineModel> models, RacingModelId defaultModel) {
        Map<RacingModelId, RacingLineModel> byId = new EnumMap<>(RacingModelId.class);
        for (RacingLineModel model : models) {
            if (byId.put(model.getId(), model) != null) {
                throw new IllegalArgumentException("Modelo registrado dos veces: " + model.getId());
            }
        }
        if (!byId.containsKey(defaultModel)) {
            throw new IllegalArgumentException("El modelo por defecto " + defaultModel + " no está registrado.");
        }
        this.models = Collections.unmodifiableMap(byId);
        this.defaultModel = defaultModel;
        log.info("Registro de modelos inicializado: {} (por defecto: {})", byId.keySet(), defaultModel.getId());
    }

    /** Registro con los tres modelos del motor compartiendo un único modelo aerodinámico. */
    public static RacingModelRegistry withDefaultModels(OptimizerConfig config) {
        CorneringSpeedCalculator cornering = new CorneringSpeedCalculator(new AerodynamicModel());
        return new RacingModelRegistry(List.of(
                new PhysicsBasedRacingModel(cornering),
                new BasicRacingModel(cornering),
                new KapaniaRacingModel(cornering, config)
        ), DEFAULT_MODEL);
    }

    public Resolution resolve(String modelId) {
        Optional<RacingLineModel> found = RacingModelId.fromId(modelId).map(models::get);
        return found
                .map(model -> new Resolution(model, false))
                .orElseGet(() -> new Resolution(models.get(defaultModel), true));
    }

    public RacingLineModel get(RacingModelId id) {
        RacingLineModel model = models.get(id);
        if (model == null) {
            throw new IllegalArgumentException("Modelo no registrado: " + id);
        }
        return model;
    }

    public List<ModelDescriptor> listModels() {
        return models.values().stream()
                .map(RacingLineModel::describe)
                .toList();
    }

    public RacingModelId getDefaultModel() {
        return defaultModel;
    }

    /**
     * Resultado de resolver un identificador.
     *
     * @param fallback true si el identificador no correspondía a ningún modelo registrado.
     */
    public record Resolution(RacingLineModel model, boolean fallback) {
    }
}
