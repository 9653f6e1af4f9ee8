package surfacetexture.config;

import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con los parámetros de una descomposición de superficie.
 * <p>
 * Las longitudes se expresan en la misma unidad que los datos de entrada (típicamente µm);
 * no se realiza ninguna conversión de unidades.
 *
 * @param cutoff              Longitud de onda de corte que separa ondulación (onda larga) de rugosidad.
 * @param sampleWidth         Ancho físico del área muestreada. Se usa para traducir índices de frecuencia
 *                            a longitudes de onda y como extensión del eje X en las vistas.
 * @param workerThreads       Número de hilos para filtrar filas en paralelo (mínimo efectivo: 1).
 * @param allowTruncatedInput Si es {@code true}, un número de muestras que no es cuadrado perfecto se trunca
 *                            (con aviso) en lugar de rechazarse.
 */
@Builder
@With
public record SurfaceConfig(
        double cutoff,
        double sampleWidth,
        int workerThreads,
        boolean allowTruncatedInput
) {
    /** Corte por defecto: 80 µm. */
    public static final double DEFAULT_CUTOFF = 80.0;

    /** Ancho por defecto: 643 µm (objetivo 10x en el microscopio Olympus LEXT). */
    public static final double DEFAULT_SAMPLE_WIDTH = 643.0;

    public SurfaceConfig {
        if (!(cutoff > 0) || Double.isInfinite(cutoff)) {
            throw new IllegalArgumentException("La longitud de onda de corte debe ser un valor finito positivo: " + cutoff);
        }
        if (!(sampleWidth > 0) || Double.isInfinite(sampleWidth)) {
            throw new IllegalArgumentException("El ancho de muestra debe ser un valor finito positivo: " + sampleWidth);
        }
    }

    public static SurfaceConfig getDefault() {
        return SurfaceConfig.builder()
                .cutoff(DEFAULT_CUTOFF)
                .sampleWidth(DEFAULT_SAMPLE_WIDTH)
                .workerThreads(Runtime.getRuntime().availableProcessors())
                .allowTruncatedInput(false)
                .build();
    }
}
