package surfacetexture.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import surfacetexture.domain.decomposition.SurfaceDecomposition;
import surfacetexture.domain.dto.DecompositionReportDTO;
import surfacetexture.domain.metrics.MetricSeries;
import surfacetexture.domain.metrics.SurfaceMetric;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exporta el resumen de una descomposición (parámetros y series Wa/Ra) a JSON.
 */
@Slf4j
public class DecompositionReportWriter {

    // Costoso de crear y thread-safe: se reutiliza.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Módulos para java.time
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Construye el informe a partir de una descomposición.
     *
     * @param source Identificador del origen de los datos (ej: nombre del fichero CSV).
     */
    public DecompositionReportDTO toReport(SurfaceDecomposition decomposition, String source) {
        MetricSeries metrics = decomposition.metrics();

        Map<String, Double> averages = new LinkedHashMap<>();
        for (SurfaceMetric metric : SurfaceMetric.values()) {
            averages.put(metric.getSymbol(), metrics.average(metric));
        }

        return new DecompositionReportDTO(
                source,
                LocalDateTime.now(),
                decomposition.config().cutoff(),
                decomposition.config().sampleWidth(),
                decomposition.dimension(),
                averages,
                metrics.asMap()
        );
    }

    /**
     * Escribe el informe en la ruta indicada. Si el archivo ya existe, será sobrescrito.
     *
     * @throws IOException Si ocurre un error durante la escritura del archivo.
     */
    public void write(SurfaceDecomposition decomposition, String source, Path target) throws IOException {
        log.info("Exportando informe de descomposición ({}x{}) a {}",
                decomposition.dimension(), decomposition.dimension(), target.toAbsolutePath());

        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(target.toFile(), toReport(decomposition, source));
            log.debug("Escritura del informe completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el informe JSON en {}", target.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Lee un informe previamente exportado.
     *
     * @throws IOException Si el archivo no existe o no es un informe válido.
     */
    public DecompositionReportDTO read(Path source) throws IOException {
        if (!Files.exists(source)) {
            throw new IOException("El archivo especificado no existe: " + source.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(source.toFile(), DecompositionReportDTO.class);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el informe JSON desde {}", source.toAbsolutePath(), e);
            throw e;
        }
    }
}
