package surfacetexture.domain.profile;

import lombok.extern.slf4j.Slf4j;
import surfacetexture.domain.exception.InputShapeException;

import java.util.Objects;

/**
 * Perfil primario: la matriz cuadrada N×N de alturas tal y como se midió.
 * <p>
 * Se construye una única vez a partir de la secuencia plana (orden por filas) que entrega
 * el lector de entrada y es inmutable desde ese momento.
 *
 * @param rows Filas de la rejilla; cada fila es una línea de barrido de la superficie.
 */
@Slf4j
public record ProfileGrid(double[][] rows) implements HeightGrid {

    public ProfileGrid {
        rows = HeightGrid.copySquare(rows, "primaria");
    }

    /**
     * Construye la rejilla exigiendo que el número de muestras sea un cuadrado perfecto.
     *
     * @param samples Muestras en orden por filas.
     * @throws InputShapeException si no hay muestras o su número no es un cuadrado perfecto.
     */
    public static ProfileGrid fromSamples(double[] samples) {
        return fromSamples(samples, false);
    }

    /**
     * Construye la rejilla a partir de una secuencia plana de N² muestras.
     * <p>
     * N es la raíz cuadrada entera del número de muestras. Si el número no es un cuadrado
     * perfecto y {@code allowTruncation} está activo, las muestras sobrantes del final se
     * descartan y se emite un aviso; en caso contrario se rechaza la entrada.
     *
     * @param samples         Muestras en orden por filas.
     * @param allowTruncation Permite el comportamiento heredado de truncado silencioso (ahora con aviso).
     * @throws InputShapeException si no hay muestras, o si sobran muestras y no se permite truncar.
     */
    public static ProfileGrid fromSamples(double[] samples, boolean allowTruncation) {
        Objects.requireNonNull(samples, "El array de muestras no puede ser nulo.");
        final int count = samples.length;
        if (count == 0) {
            throw new InputShapeException(0, "La entrada no contiene ninguna muestra.");
        }

        final int n = integerSqrt(count);
        final int used = n * n;

        if (used != count) {
            if (!allowTruncation) {
                throw new InputShapeException(count, "El número de muestras (" + count
                        + ") no es un cuadrado perfecto: una rejilla " + n + "x" + n
                        + " descartaría " + (count - used) + " muestras.");
            }
            log.warn("Entrada truncada: {} muestras no forman un cuadrado perfecto. Se descartan las {} últimas (N={}).",
                    count, count - used, n);
        }

        double[][] rows = new double[n][n];
        for (int i = 0; i < n; i++) {
            System.arraycopy(samples, i * n, rows[i], 0, n);
        }
        return new ProfileGrid(rows);
    }

    /**
     * Construye la rejilla a partir de filas ya separadas.
     *
     * @throws InputShapeException si la matriz está vacía o no es cuadrada.
     */
    public static ProfileGrid fromRows(double[][] rows) {
        Objects.requireNonNull(rows, "Las filas no pueden ser nulas.");
        int n = rows.length;
        for (int i = 0; i < n; i++) {
            if (rows[i] == null || rows[i].length != n) {
                int width = rows[i] == null ? 0 : rows[i].length;
                throw new InputShapeException(n * width,
                        "La fila " + i + " tiene " + width + " muestras; una rejilla de " + n + " filas necesita " + n + ".");
            }
        }
        if (n == 0) {
            throw new InputShapeException(0, "La entrada no contiene ninguna muestra.");
        }
        return new ProfileGrid(rows);
    }

    // Raíz entera exacta: Math.sqrt puede redondear hacia arriba en cuadrados grandes.
    static int integerSqrt(int value) {
        int root = (int) Math.sqrt(value);
        while ((long) root * root > value) {
            root--;
        }
        while ((long) (root + 1) * (root + 1) <= value) {
            root++;
        }
        return root;
    }

    @Override
    public double[][] rows() {
        return toArray();
    }

    @Override
    public int dimension() {
        return rows.length;
    }

    @Override
    public double[] getRowAt(int rowIndex) {
        HeightGrid.checkRowIndex(rowIndex, rows.length);
        return rows[rowIndex].clone();
    }

    @Override
    public double getValueAt(int rowIndex, int columnIndex) {
        HeightGrid.checkRowIndex(rowIndex, rows.length);
        return rows[rowIndex][columnIndex];
    }

    @Override
    public double[][] toArray() {
        return HeightGrid.copySquare(rows, "primaria");
    }
}
