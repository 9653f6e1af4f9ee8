package surfacetexture.physics.solver.impl;

import surfacetexture.domain.metrics.MetricSeries;
import surfacetexture.domain.profile.HeightGrid;
import surfacetexture.domain.profile.RoughnessGrid;
import surfacetexture.domain.profile.WavinessGrid;

/**
 * Reduce cada fila de ondulación y rugosidad a su media de valores absolutos (Wa, Ra).
 * <p>
 * La media es por fila, con N como divisor; no es un valor global ni un RMS.
 */
public final class MetricAggregator {

    private MetricAggregator() {}

    public static MetricSeries aggregate(WavinessGrid waviness, RoughnessGrid roughness) {
        if (waviness.dimension() != roughness.dimension()) {
            throw new IllegalArgumentException("Inconsistencia de dimensiones: ondulación " + waviness.dimension()
                    + ", rugosidad " + roughness.dimension() + ".");
        }
        return new MetricSeries(rowMeanAbsolute(waviness), rowMeanAbsolute(roughness));
    }

    static double[] rowMeanAbsolute(HeightGrid grid) {
        final int n = grid.dimension();
        double[] series = new double[n];
        for (int i = 0; i < n; i++) {
            series[i] = meanAbsolute(grid.getRowAt(i));
        }
        return series;
    }

    public static double meanAbsolute(double[] row) {
        double sum = 0.0;
        for (double value : row) {
            sum += Math.abs(value);
        }
        return sum / row.length;
    }
}
