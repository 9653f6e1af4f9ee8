package surfacetexture.domain.exception;

import lombok.Getter;

import java.util.Locale;

/**
 * Ningún índice de frecuencia representable alcanza una longitud de onda menor o igual al corte.
 * Error de configuración fatal: no se reintenta.
 */
@Getter
public class CutoffUnreachableException extends SurfaceAnalysisException {

    private final double cutoff;
    private final double shortestWavelength;

    public CutoffUnreachableException(double cutoff, double shortestWavelength, int rowLength) {
        super(String.format(Locale.ROOT,
                "Corte inalcanzable: %.4f es menor que la longitud de onda más corta representable (%.4f) para filas de %d muestras.",
                cutoff, shortestWavelength, rowLength));
        this.cutoff = cutoff;
        this.shortestWavelength = shortestWavelength;
    }
}
