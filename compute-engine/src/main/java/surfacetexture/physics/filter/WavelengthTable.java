package surfacetexture.physics.filter;

import surfacetexture.config.SurfaceConfig;
import surfacetexture.domain.exception.CutoffUnreachableException;
import surfacetexture.domain.exception.DegenerateRowException;

import java.util.Arrays;

/**
 * Tabla de longitudes de onda candidatas y el índice de corte que de ella se deriva.
 * <p>
 * Para el índice de frecuencia j (base 1) la longitud de onda candidata es
 * {@code 2 · (3 · sampleWidth) / j}; el factor 3 corresponde a la secuencia reflejada de longitud 3N.
 * El barrido se detiene en el primer j cuya longitud de onda es menor o igual al corte.
 * <p>
 * Solo depende de (N, corte, ancho de muestra), así que se calcula una vez por descomposición
 * y se comparte en solo lectura entre todas las filas. Stateless y Thread-Safe.
 *
 * @param rowLength   Número de muestras por fila (N).
 * @param cutoff      Longitud de onda de corte.
 * @param sampleWidth Ancho físico de la muestra.
 * @param wavelengths Candidatas barridas, de j = 1 hasta el índice de corte incluido.
 * @param stopIndex   Primer índice descartado por el filtro paso bajo.
 */
public record WavelengthTable(
        int rowLength,
        double cutoff,
        double sampleWidth,
        double[] wavelengths,
        int stopIndex
) {
    public static final int MINIMUM_ROW_LENGTH = 2;

    /**
     * Factor de la secuencia reflejada (invertida + original + invertida).
     */
    public static final int PADDING_FACTOR = 3;

    public WavelengthTable {
        wavelengths = wavelengths.clone();
    }

    @Override
    public double[] wavelengths() {
        return wavelengths.clone();
    }

    /**
     * Calcula la tabla para filas de {@code rowLength} muestras.
     *
     * @throws DegenerateRowException     si la fila tiene menos de {@value #MINIMUM_ROW_LENGTH} muestras.
     * @throws CutoffUnreachableException si ningún j en [1, N] alcanza una longitud de onda ≤ corte.
     */
    public static WavelengthTable compute(int rowLength, SurfaceConfig config) {
        if (rowLength < MINIMUM_ROW_LENGTH) {
            throw new DegenerateRowException(rowLength, MINIMUM_ROW_LENGTH);
        }

        final double cutoff = config.cutoff();
        final double sampleWidth = config.sampleWidth();
        final double[] scanned = new double[rowLength];

        for (int j = 1; j <= rowLength; j++) {
            double wavelength = candidateWavelength(sampleWidth, j);
            scanned[j - 1] = wavelength;

            if (wavelength <= cutoff) {
                return new WavelengthTable(rowLength, cutoff, sampleWidth, Arrays.copyOf(scanned, j), j);
            }
        }

        throw new CutoffUnreachableException(cutoff, candidateWavelength(sampleWidth, rowLength), rowLength);
    }

    /**
     * Longitud de onda asociada al índice de frecuencia j de la secuencia reflejada.
     */
    public static double candidateWavelength(double sampleWidth, int frequencyIndex) {
        return 2.0 * (PADDING_FACTOR * sampleWidth) / frequencyIndex;
    }

    public int paddedLength() {
        return PADDING_FACTOR * rowLength;
    }
}
