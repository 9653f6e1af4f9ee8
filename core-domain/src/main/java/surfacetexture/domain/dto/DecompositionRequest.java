package surfacetexture.domain.dto;

/**
 * Petición de descomposición con las muestras en orden por filas.
 * Si {@code cutoff} o {@code sampleWidth} son nulos se usan los valores configurados en el servidor.
 */
public record DecompositionRequest(
        double[] samples,
        Double cutoff,
        Double sampleWidth
) {}
