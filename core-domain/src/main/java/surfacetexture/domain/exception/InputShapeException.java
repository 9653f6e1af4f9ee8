package surfacetexture.domain.exception;

import lombok.Getter;

/**
 * El número de muestras no permite construir una rejilla cuadrada N×N.
 */
@Getter
public class InputShapeException extends SurfaceAnalysisException {

    private final int sampleCount;

    public InputShapeException(int sampleCount, String message) {
        super(message);
        this.sampleCount = sampleCount;
    }
}
