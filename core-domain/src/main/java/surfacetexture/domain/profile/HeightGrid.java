package surfacetexture.domain.profile;

import java.util.Objects;

/**
 * Contrato común para las rejillas cuadradas de alturas (primario, ondulación y rugosidad).
 * <p>
 * Todas las implementaciones son inmutables: los accesores devuelven copias.
 */
public interface HeightGrid {

    /**
     * Dimensión N de la rejilla (número de filas y de muestras por fila).
     */
    int dimension();

    /**
     * Devuelve una copia de la fila indicada.
     *
     * @param rowIndex Índice de fila (0 a dimension() - 1).
     * @throws IndexOutOfBoundsException si el índice es inválido.
     */
    double[] getRowAt(int rowIndex);

    double getValueAt(int rowIndex, int columnIndex);

    /**
     * Copia profunda de la rejilla completa, fila a fila.
     */
    double[][] toArray();

    /**
     * Valida que la matriz es cuadrada y no vacía y devuelve una copia profunda.
     *
     * @param rows  Filas de la rejilla.
     * @param label Nombre de la rejilla para los mensajes de error.
     * @return Copia independiente de {@code rows}.
     * @throws IllegalArgumentException si la matriz es nula, vacía o no cuadrada.
     */
    static double[][] copySquare(double[][] rows, String label) {
        Objects.requireNonNull(rows, "La rejilla " + label + " no puede ser nula.");
        int n = rows.length;
        if (n == 0) {
            throw new IllegalArgumentException("La rejilla " + label + " no puede estar vacía.");
        }
        double[][] copy = new double[n][];
        for (int i = 0; i < n; i++) {
            Objects.requireNonNull(rows[i], "La fila " + i + " de la rejilla " + label + " es nula.");
            if (rows[i].length != n) {
                throw new IllegalArgumentException("La rejilla " + label + " no es cuadrada: la fila " + i
                        + " tiene " + rows[i].length + " muestras, se esperaban " + n + ".");
            }
            copy[i] = rows[i].clone();
        }
        return copy;
    }

    static void checkRowIndex(int rowIndex, int dimension) {
        if (rowIndex < 0 || rowIndex >= dimension) {
            throw new IndexOutOfBoundsException("El índice de fila " + rowIndex + " está fuera de los límites [0, " + (dimension - 1) + "].");
        }
    }
}
