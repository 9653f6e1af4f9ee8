package surfacetexture.compute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Punto de entrada principal del motor de descomposición de superficies.
 */
@SpringBootApplication(scanBasePackages = "surfacetexture")
public class SurfaceEngineApplication {

    public static void main(String[] args) {
        // El puerto se puede configurar vía args: --server.port=9090
        SpringApplication.run(SurfaceEngineApplication.class, args);
    }
}
