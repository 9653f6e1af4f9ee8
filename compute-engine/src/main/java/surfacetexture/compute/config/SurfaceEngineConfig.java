package surfacetexture.compute.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import surfacetexture.config.SurfaceConfig;
import surfacetexture.io.DecompositionReportWriter;
import surfacetexture.io.SurfaceCsvReader;

/**
 * Beans del motor: configuración por defecto del filtro (desde application.yml) y colaboradores de E/S.
 */
@Slf4j
@Configuration
public class SurfaceEngineConfig {

    @Bean
    public SurfaceConfig defaultSurfaceConfig(
            @Value("${surface.filter.cutoff:80}") double cutoff,
            @Value("${surface.filter.sample-width:643}") double sampleWidth,
            @Value("${surface.filter.worker-threads:0}") int workerThreads,
            @Value("${surface.filter.allow-truncated-input:false}") boolean allowTruncatedInput) {

        // 0 o negativo: un hilo por núcleo disponible
        int threads = workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();

        SurfaceConfig config = SurfaceConfig.builder()
                .cutoff(cutoff)
                .sampleWidth(sampleWidth)
                .workerThreads(threads)
                .allowTruncatedInput(allowTruncatedInput)
                .build();

        log.info(">>> CONFIG: Corte {} | Ancho de muestra {} | Hilos {} | Truncado {}",
                config.cutoff(), config.sampleWidth(), config.workerThreads(), config.allowTruncatedInput());
        return config;
    }

    @Bean
    public SurfaceCsvReader surfaceCsvReader() {
        return new SurfaceCsvReader();
    }

    @Bean
    public DecompositionReportWriter decompositionReportWriter() {
        return new DecompositionReportWriter();
    }
}
