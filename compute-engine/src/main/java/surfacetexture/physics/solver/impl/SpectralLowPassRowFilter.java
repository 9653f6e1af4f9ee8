package surfacetexture.physics.solver.impl;

import edu.emory.mathcs.jtransforms.fft.DoubleFFT_1D;
import lombok.extern.slf4j.Slf4j;
import surfacetexture.physics.filter.WavelengthTable;
import surfacetexture.physics.solver.RowFilter;

/**
 * Filtro paso bajo en el dominio de la frecuencia que extrae la ondulación de una fila.
 * <p>
 * Pasos:
 * <ol>
 * <li>Reflexión: la fila se extiende a 3N concatenando [invertida, original, invertida] para que
 *     la transformada no vea discontinuidades en los bordes.</li>
 * <li>DFT compleja de la secuencia extendida.</li>
 * <li>Los datos son reales y el espectro simétrico, así que se duplica la magnitud de todos los
 *     coeficientes salvo el índice 0 (DC) y el último.</li>
 * <li>Se anulan los coeficientes desde el índice de corte hasta el penúltimo (el último se conserva).</li>
 * <li>DFT inversa escalada, parte real, y se recorta el tercio central [N, 2N).</li>
 * </ol>
 * Stateless y Thread-Safe: cada llamada reserva su propio buffer de 3N complejos.
 */
@Slf4j
public class SpectralLowPassRowFilter implements RowFilter {

    @Override
    public double[] filterRow(double[] row, WavelengthTable table) {
        final int n = row.length;
        if (n != table.rowLength()) {
            throw new IllegalArgumentException("La fila tiene " + n + " muestras, pero la tabla de corte se calculó para "
                    + table.rowLength() + ".");
        }

        final int paddedLength = table.paddedLength();
        final int stopIndex = table.stopIndex();

        // Layout intercalado de JTransforms: [re0, im0, re1, im1, ...]
        double[] spectrum = mirrorPad(row, paddedLength);

        DoubleFFT_1D fft = new DoubleFFT_1D(paddedLength);
        fft.complexForward(spectrum);

        // Duplicado y paso bajo en una sola pasada sobre [1, L-1)
        for (int k = 1; k < paddedLength - 1; k++) {
            if (k < stopIndex) {
                spectrum[2 * k] *= 2.0;
                spectrum[2 * k + 1] *= 2.0;
            } else {
                spectrum[2 * k] = 0.0;
                spectrum[2 * k + 1] = 0.0;
            }
        }

        fft.complexInverse(spectrum, true);

        double[] waviness = new double[n];
        for (int i = 0; i < n; i++) {
            waviness[i] = spectrum[2 * (n + i)];
        }

        log.trace("Fila filtrada (N={}, corte en índice {}).", n, stopIndex);
        return waviness;
    }

    /**
     * Construye la secuencia [invertida, original, invertida] como array complejo intercalado
     * (partes imaginarias a cero).
     */
    static double[] mirrorPad(double[] row, int paddedLength) {
        final int n = row.length;
        double[] padded = new double[2 * paddedLength];
        for (int i = 0; i < n; i++) {
            double mirrored = row[n - 1 - i];
            padded[2 * i] = mirrored;
            padded[2 * (n + i)] = row[i];
            padded[2 * (2 * n + i)] = mirrored;
        }
        return padded;
    }
}
