package surfacetexture.domain.exception;

import lombok.Getter;

/**
 * Un token del fichero de entrada no es un número real.
 */
@Getter
public class InputFormatException extends SurfaceAnalysisException {

    private final int position;

    public InputFormatException(int position, String token, Throwable cause) {
        super("Valor no numérico en la posición " + position + ": '" + token + "'", cause);
        this.position = position;
    }
}
