package surfacetexture.domain.exception;

/**
 * Parámetro de una petición fuera de dominio: corte o ancho no válidos, métrica desconocida
 * o fila inexistente. Es un error del cliente, a diferencia de los IllegalArgumentException internos.
 */
public class InvalidParameterException extends SurfaceAnalysisException {

    public InvalidParameterException(String message) {
        super(message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
