package surfacetexture.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import surfacetexture.config.SurfaceConfig;
import surfacetexture.domain.decomposition.SurfaceDecomposition;
import surfacetexture.domain.metrics.MetricSeries;
import surfacetexture.domain.metrics.SurfaceMetric;
import surfacetexture.domain.profile.ProfileGrid;
import surfacetexture.domain.profile.RoughnessGrid;
import surfacetexture.domain.profile.WavinessGrid;
import surfacetexture.physics.filter.WavelengthTable;
import surfacetexture.physics.solver.impl.MetricAggregator;
import surfacetexture.physics.solver.impl.RoughnessExtractor;
import surfacetexture.physics.solver.impl.SpectralLowPassRowFilter;

/**
 * Orquesta la descomposición de una superficie en ondulación y rugosidad.
 * <p>
 * Facade de alto nivel que encadena funciones puras:
 * <ol>
 * <li>Tabla de corte (una vez, compartida entre filas).</li>
 * <li>Primario → ondulación, delegando el filtrado por filas al {@link WavinessBatchProcessor}.</li>
 * <li>(Primario, ondulación) → rugosidad.</li>
 * <li>(Ondulación, rugosidad) → series Wa/Ra.</li>
 * </ol>
 */
@Slf4j
public class SurfaceDecomposer implements AutoCloseable {

    @Getter
    private final SurfaceConfig config;

    private final WavinessBatchProcessor batchProcessor;

    public SurfaceDecomposer(SurfaceConfig config) {
        this(config, new WavinessBatchProcessor(new SpectralLowPassRowFilter(), config.workerThreads()));
    }

    SurfaceDecomposer(SurfaceConfig config, WavinessBatchProcessor batchProcessor) {
        this.config = config;
        this.batchProcessor = batchProcessor;
        log.info("SurfaceDecomposer listo. (Corte: {}, Ancho: {})", config.cutoff(), config.sampleWidth());
    }

    /**
     * Descompone la rejilla primaria con la configuración de este descomponedor.
     *
     * @return Resultado inmutable con las tres rejillas y las métricas por fila.
     * @throws surfacetexture.domain.exception.DegenerateRowException     si N &lt; 2.
     * @throws surfacetexture.domain.exception.CutoffUnreachableException si el corte no se alcanza para N.
     */
    public SurfaceDecomposition decompose(ProfileGrid primary) {
        long startTime = System.currentTimeMillis();
        final int n = primary.dimension();
        log.info("Iniciando descomposición de superficie {}x{}...", n, n);

        // 1. Tabla de corte (invariante para todas las filas)
        WavelengthTable table = WavelengthTable.compute(n, config);
        log.debug("Índice de corte: {} (λ = {})", table.stopIndex(),
                WavelengthTable.candidateWavelength(config.sampleWidth(), table.stopIndex()));

        // 2. Ondulación
        WavinessGrid waviness = batchProcessor.process(primary, table);

        // 3. Rugosidad
        RoughnessGrid roughness = RoughnessExtractor.extract(primary, waviness);

        // 4. Métricas
        MetricSeries metrics = MetricAggregator.aggregate(waviness, roughness);

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Descomposición finalizada en {}ms. (Wa medio: {}, Ra medio: {})",
                elapsed, metrics.average(SurfaceMetric.WA), metrics.average(SurfaceMetric.RA));

        return SurfaceDecomposition.builder()
                .config(config)
                .primary(primary)
                .waviness(waviness)
                .roughness(roughness)
                .metrics(metrics)
                .computationTimeMs(elapsed)
                .build();
    }

    /**
     * Atajo: construye la rejilla desde muestras planas respetando {@link SurfaceConfig#allowTruncatedInput()}.
     */
    public SurfaceDecomposition decompose(double[] samples) {
        return decompose(ProfileGrid.fromSamples(samples, config.allowTruncatedInput()));
    }

    @Override
    public void close() {
        if (batchProcessor != null) {
            batchProcessor.close();
        }
        log.info("SurfaceDecomposer cerrado y recursos liberados.");
    }
}
