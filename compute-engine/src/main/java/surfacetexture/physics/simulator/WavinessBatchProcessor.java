package surfacetexture.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import surfacetexture.domain.exception.SurfaceAnalysisException;
import surfacetexture.domain.profile.ProfileGrid;
import surfacetexture.domain.profile.WavinessGrid;
import surfacetexture.physics.filter.WavelengthTable;
import surfacetexture.physics.impl.RowFilterTask;
import surfacetexture.physics.solver.RowFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Ejecuta el filtro de filas sobre toda la rejilla primaria en un pool de hilos fijo.
 * <p>
 * Cada fila es independiente (misma tabla de corte, sin estado compartido mutable), así que
 * el único punto de sincronización es recoger los resultados en orden de fila.
 */
@Slf4j
public class WavinessBatchProcessor implements AutoCloseable {

    private final RowFilter rowFilter;
    private final ExecutorService threadPool;
    private final int workerCount;

    public WavinessBatchProcessor(RowFilter rowFilter, int workerThreads) {
        this.rowFilter = rowFilter;
        this.workerCount = Math.max(workerThreads, 1);
        this.threadPool = Executors.newFixedThreadPool(workerCount);
        log.info("WavinessBatchProcessor inicializado. (Hilos: {})", workerCount);
    }

    public WavinessGrid process(ProfileGrid primary, WavelengthTable table) {
        final int n = primary.dimension();
        if (table.rowLength() != n) {
            throw new IllegalArgumentException("La tabla de corte es para filas de " + table.rowLength()
                    + " muestras, pero la rejilla tiene " + n + ".");
        }

        List<RowFilterTask> tasks = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            tasks.add(new RowFilterTask(i, primary.getRowAt(i), table, rowFilter));
        }

        List<Future<RowFilterTask>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Filtrado de ondulación interrumpido.", e);
        }

        double[][] waviness = new double[n][];
        for (int i = 0; i < n; i++) {
            try {
                waviness[i] = futures.get(i).get().getCalculatedWaviness();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Filtrado de ondulación interrumpido en la fila " + i + ".", e);
            } catch (ExecutionException e) {
                // Los errores con nombre del dominio se propagan tal cual
                if (e.getCause() instanceof SurfaceAnalysisException analysisException) {
                    throw analysisException;
                }
                throw new IllegalStateException("Error filtrando la fila " + i, e.getCause());
            }
        }

        log.debug("Ondulación calculada para {} filas.", n);
        return new WavinessGrid(waviness);
    }

    public int getWorkerCount() {
        return workerCount;
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("WavinessBatchProcessor cerrado.");
    }
}
