package surfacetexture.domain.exception;

import lombok.Getter;

/**
 * La fila es demasiado corta para calcular un índice de corte con sentido.
 */
@Getter
public class DegenerateRowException extends SurfaceAnalysisException {

    private final int rowLength;

    public DegenerateRowException(int rowLength, int minimumLength) {
        super("Fila degenerada: " + rowLength + " muestras (mínimo " + minimumLength + ").");
        this.rowLength = rowLength;
    }
}
