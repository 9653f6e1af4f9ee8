package surfacetexture.domain.profile;

/**
 * Componente de onda corta: primario menos ondulación, fila a fila y de forma exacta.
 *
 * @param rows Filas de rugosidad; misma forma que el {@link ProfileGrid} de origen.
 */
public record RoughnessGrid(double[][] rows) implements HeightGrid {

    public RoughnessGrid {
        rows = HeightGrid.copySquare(rows, "de rugosidad");
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
        return HeightGrid.copySquare(rows, "de rugosidad");
    }
}
