package surfacetexture.physics.solver;

import surfacetexture.physics.filter.WavelengthTable;

/**
 * Filtro que transforma una fila del perfil primario en su fila de ondulación.
 * <p>
 * Las implementaciones deben ser funciones puras: sin estado compartido entre filas,
 * para poder ejecutarse en paralelo sin sincronización.
 */
@FunctionalInterface
public interface RowFilter {

    /**
     * @param row   Fila del perfil primario (N muestras). No se modifica.
     * @param table Tabla de corte precalculada para filas de N muestras.
     * @return Nueva fila de ondulación de longitud N.
     */
    double[] filterRow(double[] row, WavelengthTable table);
}
