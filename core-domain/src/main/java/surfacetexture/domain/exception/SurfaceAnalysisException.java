package surfacetexture.domain.exception;

/**
 * Raíz de los errores con nombre del motor de análisis de superficies.
 * Ninguno es recuperable dentro del algoritmo de filtrado; se propagan al llamador.
 */
public class SurfaceAnalysisException extends RuntimeException {

    public SurfaceAnalysisException(String message) {
        super(message);
    }

    public SurfaceAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
