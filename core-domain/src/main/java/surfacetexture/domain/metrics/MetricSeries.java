package surfacetexture.domain.metrics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Series de métricas por fila: un valor de Wa y otro de Ra por cada fila de la superficie.
 * <p>
 * No es un escalar global; el índice i de cada serie corresponde a la fila i.
 *
 * @param wa Ondulación media por fila.
 * @param ra Rugosidad media por fila.
 */
public record MetricSeries(double[] wa, double[] ra) {

    public MetricSeries {
        Objects.requireNonNull(wa, "La serie Wa no puede ser nula.");
        Objects.requireNonNull(ra, "La serie Ra no puede ser nula.");
        if (wa.length != ra.length) {
            throw new IllegalArgumentException("Las series Wa (" + wa.length + ") y Ra (" + ra.length + ") deben tener la misma longitud.");
        }
        wa = wa.clone();
        ra = ra.clone();
    }

    @Override
    public double[] wa() {
        return wa.clone();
    }

    @Override
    public double[] ra() {
        return ra.clone();
    }

    public int size() {
        return wa.length;
    }

    public double[] get(SurfaceMetric metric) {
        return switch (metric) {
            case WA -> wa.clone();
            case RA -> ra.clone();
        };
    }

    /**
     * @param symbol Símbolo de la métrica ("Wa" o "Ra").
     * @throws IllegalArgumentException si el símbolo es desconocido.
     */
    public double[] get(String symbol) {
        return get(SurfaceMetric.fromSymbol(symbol));
    }

    /**
     * Media de la serie completa. Una serie vacía tiene media 0.
     */
    public double average(SurfaceMetric metric) {
        double[] values = metric == SurfaceMetric.WA ? wa : ra;
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Serie centrada en cero (se resta su propia media), como la usa el gráfico de métricas.
     */
    public double[] centered(SurfaceMetric metric) {
        double mean = average(metric);
        double[] centered = get(metric);
        for (int i = 0; i < centered.length; i++) {
            centered[i] -= mean;
        }
        return centered;
    }

    /**
     * Vista nombre → serie, en el orden Wa, Ra.
     */
    public Map<String, double[]> asMap() {
        Map<String, double[]> map = new LinkedHashMap<>();
        for (SurfaceMetric metric : SurfaceMetric.values()) {
            map.put(metric.getSymbol(), get(metric));
        }
        return map;
    }
}
