package racingline.compute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Punto de entrada del servicio REST de optimización de líneas de carrera.
 */
@SpringBootApplication(scanBasePackages = "racingline")
public class ComputeEngineApplication {

    public static void main(String[] args) {
        // El puerto se puede configurar vía args: --server.port=9090
        SpringApplication.run(ComputeEngineApplication.class, args);
    }
}
