package surfacetexture.physics.impl;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import surfacetexture.physics.filter.WavelengthTable;
import surfacetexture.physics.solver.RowFilter;

import java.util.concurrent.Callable;

/**
 * Tarea ejecutable que calcula la ondulación de una única fila.
 * Está diseñada para ser ejecutada en un pool de hilos; no comparte estado mutable con otras filas.
 */
@Getter
@RequiredArgsConstructor
public class RowFilterTask implements Callable<RowFilterTask> {

    // --- Entradas para la tarea ---
    private final int rowIndex;
    private final double[] primaryRow;
    private final WavelengthTable table; // Compartida, solo lectura
    private final RowFilter rowFilter;

    // --- Resultado de la tarea ---
    private double[] calculatedWaviness;

    @Override
    public RowFilterTask call() {
        this.calculatedWaviness = rowFilter.filterRow(primaryRow, table);
        return this;
    }
}
