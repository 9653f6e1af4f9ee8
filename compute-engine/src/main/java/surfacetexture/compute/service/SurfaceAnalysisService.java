package surfacetexture.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import surfacetexture.config.ApiRoutes;
import surfacetexture.config.SurfaceConfig;
import surfacetexture.domain.decomposition.SurfaceDecomposition;
import surfacetexture.domain.dto.DecompositionReportDTO;
import surfacetexture.domain.dto.DecompositionSummaryDTO;
import surfacetexture.domain.dto.MetricSeriesDTO;
import surfacetexture.domain.dto.PrimaryGridDTO;
import surfacetexture.domain.dto.ProfileSectionDTO;
import surfacetexture.domain.exception.InputShapeException;
import surfacetexture.domain.exception.InvalidParameterException;
import surfacetexture.domain.exception.ResourceNotFoundException;
import surfacetexture.domain.metrics.MetricSeries;
import surfacetexture.domain.metrics.SurfaceMetric;
import surfacetexture.domain.profile.ProfileGrid;
import surfacetexture.domain.profile.ProfileSection;
import surfacetexture.io.DecompositionReportWriter;
import surfacetexture.io.SurfaceCsvReader;
import surfacetexture.physics.simulator.SurfaceDecomposer;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Servicio de análisis: descompone superficies y sirve las vistas derivadas
 * (sección transversal, series de métricas, rejilla primaria, informe).
 * <p>
 * Los resultados se guardan en memoria, indexados por un UUID, hasta que el cliente los borra
 * con {@link #delete(String)}. No hay expiración automática.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SurfaceAnalysisService {

    private final SurfaceConfig defaultConfig;
    private final SurfaceDecomposerFactory decomposerFactory;
    private final SurfaceCsvReader csvReader;
    private final DecompositionReportWriter reportWriter;

    // "Persistencia en memoria" de los resultados
    private final ConcurrentHashMap<String, SurfaceDecomposition> resultCache = new ConcurrentHashMap<>();

    /**
     * Descompone una superficie dada como muestras planas en orden por filas.
     *
     * @param samples     Muestras (N² valores).
     * @param cutoff      Corte opcional; nulo para usar el configurado.
     * @param sampleWidth Ancho opcional; nulo para usar el configurado.
     */
    public DecompositionSummaryDTO decompose(double[] samples, Double cutoff, Double sampleWidth) {
        if (samples == null) {
            throw new InputShapeException(0, "La petición no contiene muestras.");
        }
        SurfaceConfig config = resolveConfig(cutoff, sampleWidth);
        ProfileGrid primary = ProfileGrid.fromSamples(samples, config.allowTruncatedInput());

        log.info("Descomposición solicitada ({}x{}, corte {}, ancho {})",
                primary.dimension(), primary.dimension(), config.cutoff(), config.sampleWidth());

        SurfaceDecomposition result;
        try (SurfaceDecomposer decomposer = decomposerFactory.createDecomposer(config)) {
            result = decomposer.decompose(primary);
        }

        String id = UUID.randomUUID().toString();
        resultCache.put(id, result);
        log.info("Descomposición {} almacenada.", id);

        MetricSeries metrics = result.metrics();
        return new DecompositionSummaryDTO(
                id,
                result.dimension(),
                config.cutoff(),
                config.sampleWidth(),
                metrics.average(SurfaceMetric.WA),
                metrics.average(SurfaceMetric.RA),
                result.computationTimeMs(),
                ApiRoutes.SURFACES + "/" + id + "/sections/0"
        );
    }

    /**
     * Descompone el contenido de un CSV exportado por LEXT (todas las muestras en la primera línea).
     */
    public DecompositionSummaryDTO decomposeCsv(String csvContent, Double cutoff, Double sampleWidth) {
        double[] samples = csvReader.parseSamples(csvContent == null ? "" : csvContent);
        return decompose(samples, cutoff, sampleWidth);
    }

    /**
     * @throws InvalidParameterException si la fila no existe en la superficie.
     */
    public ProfileSectionDTO getSection(String id, int rowIndex) {
        SurfaceDecomposition result = findResult(id);
        if (rowIndex < 0 || rowIndex >= result.dimension()) {
            throw new InvalidParameterException("La fila " + rowIndex + " no existe; la superficie tiene "
                    + result.dimension() + " filas.");
        }
        ProfileSection section = result.section(rowIndex);
        return new ProfileSectionDTO(
                section.rowIndex(),
                section.positions(),
                section.primary(),
                section.waviness(),
                section.roughness()
        );
    }

    /**
     * @param symbol   "Wa" o "Ra".
     * @param centered Si es cierto se resta la media de la serie (vista centrada en cero).
     * @throws InvalidParameterException si el símbolo no corresponde a ninguna métrica.
     */
    public MetricSeriesDTO getMetric(String id, String symbol, boolean centered) {
        MetricSeries metrics = findResult(id).metrics();
        SurfaceMetric metric;
        try {
            metric = SurfaceMetric.fromSymbol(symbol);
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException(e.getMessage(), e);
        }
        return new MetricSeriesDTO(
                metric.getSymbol(),
                centered,
                metrics.average(metric),
                centered ? metrics.centered(metric) : metrics.get(metric)
        );
    }

    public PrimaryGridDTO getPrimary(String id) {
        SurfaceDecomposition result = findResult(id);
        return new PrimaryGridDTO(result.dimension(), result.config().sampleWidth(), result.primary().toArray());
    }

    public DecompositionReportDTO getReport(String id) {
        return reportWriter.toReport(findResult(id), id);
    }

    /**
     * Elimina una descomposición almacenada y libera sus rejillas.
     *
     * @throws ResourceNotFoundException si el id no existe (o ya se borró).
     */
    public void delete(String id) {
        if (resultCache.remove(id) == null) {
            throw new ResourceNotFoundException("No existe ninguna descomposición con id " + id);
        }
        log.info("Descomposición {} eliminada. Quedan {} en memoria.", id, resultCache.size());
    }

    int storedCount() {
        return resultCache.size();
    }

    /**
     * @throws InvalidParameterException si el corte o el ancho pedidos no son positivos y finitos.
     */
    SurfaceConfig resolveConfig(Double cutoff, Double sampleWidth) {
        SurfaceConfig config = defaultConfig;
        try {
            if (cutoff != null) {
                config = config.withCutoff(cutoff);
            }
            if (sampleWidth != null) {
                config = config.withSampleWidth(sampleWidth);
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException(e.getMessage(), e);
        }
        return config;
    }

    private SurfaceDecomposition findResult(String id) {
        SurfaceDecomposition result = resultCache.get(id);
        if (result == null) {
            throw new ResourceNotFoundException("No existe ninguna descomposición con id " + id);
        }
        return result;
    }
}
