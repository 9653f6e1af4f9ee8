package surfacetexture.physics.solver.impl;

import surfacetexture.domain.profile.ProfileGrid;
import surfacetexture.domain.profile.RoughnessGrid;
import surfacetexture.domain.profile.WavinessGrid;

/**
 * Obtiene la rugosidad como diferencia exacta primario − ondulación, fila a fila.
 * <p>
 * Sin filtrado ni dependencia de la configuración. Stateless y Thread-Safe.
 */
public final class RoughnessExtractor {

    private RoughnessExtractor() {}

    public static RoughnessGrid extract(ProfileGrid primary, WavinessGrid waviness) {
        final int n = primary.dimension();
        if (waviness.dimension() != n) {
            throw new IllegalArgumentException("Inconsistencia de dimensiones: primario " + n
                    + ", ondulación " + waviness.dimension() + ".");
        }

        double[][] roughness = new double[n][];
        for (int i = 0; i < n; i++) {
            roughness[i] = subtractRow(primary.getRowAt(i), waviness.getRowAt(i));
        }
        return new RoughnessGrid(roughness);
    }

    /**
     * Resta elemento a elemento de dos filas de igual longitud.
     */
    public static double[] subtractRow(double[] primaryRow, double[] wavinessRow) {
        if (primaryRow.length != wavinessRow.length) {
            throw new IllegalArgumentException("Las filas deben tener la misma longitud: "
                    + primaryRow.length + " != " + wavinessRow.length + ".");
        }
        double[] roughnessRow = new double[primaryRow.length];
        for (int j = 0; j < primaryRow.length; j++) {
            roughnessRow[j] = primaryRow[j] - wavinessRow[j];
        }
        return roughnessRow;
    }
}
