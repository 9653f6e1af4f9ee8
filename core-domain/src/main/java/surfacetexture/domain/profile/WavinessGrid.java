package surfacetexture.domain.profile;

/**
 * Componente de onda larga (baja frecuencia) del perfil primario, obtenido fila a fila
 * con el filtro paso bajo espectral.
 *
 * @param rows Filas filtradas; misma forma que el {@link ProfileGrid} de origen.
 */
public record WavinessGrid(double[][] rows) implements HeightGrid {

    public WavinessGrid {
        rows = HeightGrid.copySquare(rows, "de ondulación");
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
        return HeightGrid.copySquare(rows, "de ondulación");
    }
}
