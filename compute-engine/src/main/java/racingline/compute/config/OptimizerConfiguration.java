package racingline.compute.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import racingline.config.OptimizerConfig;
import racingline.optimizer.LoggingOptimizationListener;
import racingline.optimizer.OptimizationListener;
import racingline.optimizer.RacingLineOptimizer;
import racingline.strategy.RacingModelRegistry;

/**
 * Construye una única vez el registro de modelos y el optimizador que comparten todas las peticiones.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(OptimizerProperties.class)
public class OptimizerConfiguration {

    @Bean
    public OptimizerConfig optimizerConfig(OptimizerProperties properties) {
        OptimizerConfig config = properties.toOptimizerConfig();
        log.info("Configuración del optimizador: {}", config);
        return config;
    }

    @Bean
    public RacingModelRegistry racingModelRegistry(OptimizerConfig config) {
        return RacingModelRegistry.withDefaultModels(config);
    }

    @Bean
    public OptimizationListener optimizationListener() {
        return new LoggingOptimizationListener();
    }

    // El pool de hilos se libera al cerrar el contexto
    @Bean(destroyMethod = "close")
    public RacingLineOptimizer racingLineOptimizer(RacingModelRegistry registry,
                                                   OptimizerConfig config,
                                                   OptimizationListener listener) {
        return new RacingLineOptimizer(registry, config, listener);
    }
}
