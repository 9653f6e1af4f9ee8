package surfacetexture.domain.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MetricSeriesTest {

    private final MetricSeries series = new MetricSeries(
            new double[]{1.0, 2.0, 3.0},
            new double[]{0.5, 0.5, 2.0});

    @Test
    @DisplayName("Acceso por símbolo, sin distinguir mayúsculas")
    void get_bySymbol_shouldResolveMetric() {
        assertArrayEquals(new double[]{1.0, 2.0, 3.0}, series.get("Wa"));
        assertArrayEquals(new double[]{0.5, 0.5, 2.0}, series.get("ra"));
        assertArrayEquals(series.get(SurfaceMetric.RA), series.get("RA"));
    }

    @Test
    @DisplayName("Símbolo desconocido: IllegalArgumentException")
    void get_unknownSymbol_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> series.get("Rq"));
    }

    @Test
    @DisplayName("Centrado: se resta la media y la serie resultante suma cero")
    void centered_shouldSubtractOwnMean() {
        double[] centered = series.centered(SurfaceMetric.WA);

        assertEquals(2.0, series.average(SurfaceMetric.WA), 1e-12);
        assertArrayEquals(new double[]{-1.0, 0.0, 1.0}, centered, 1e-12);

        double sum = 0;
        for (double v : series.centered(SurfaceMetric.RA)) sum += v;
        assertEquals(0.0, sum, 1e-12);
    }

    @Test
    @DisplayName("Vista nombre -> serie en orden Wa, Ra")
    void asMap_shouldKeepOrder() {
        Map<String, double[]> map = series.asMap();

        assertThat(List.copyOf(map.keySet())).containsExactly("Wa", "Ra");
        assertArrayEquals(series.wa(), map.get("Wa"));
    }

    @Test
    @DisplayName("Las series de distinta longitud se rechazan")
    void constructor_lengthMismatch_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> new MetricSeries(new double[2], new double[3]));
    }

    @Test
    @DisplayName("Inmutabilidad: modificar la copia devuelta no altera la serie")
    void accessors_shouldReturnCopies() {
        series.wa()[0] = 42.0;
        series.get(SurfaceMetric.RA)[0] = 42.0;

        assertEquals(1.0, series.wa()[0]);
        assertEquals(0.5, series.ra()[0]);
    }
}
