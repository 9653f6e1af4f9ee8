package surfacetexture.domain.metrics;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Métricas por fila que produce la descomposición.
 */
@Getter
@RequiredArgsConstructor
public enum SurfaceMetric {

    /** Ondulación media: media del valor absoluto de la ondulación de la fila. */
    WA("Wa"),

    /** Rugosidad media: media del valor absoluto de la rugosidad de la fila. */
    RA("Ra");

    private final String symbol;

    /**
     * Resuelve una métrica a partir de su símbolo ("Wa", "Ra"), sin distinguir mayúsculas.
     *
     * @throws IllegalArgumentException si el símbolo no corresponde a ninguna métrica.
     */
    public static SurfaceMetric fromSymbol(String symbol) {
        for (SurfaceMetric metric : values()) {
            if (metric.symbol.equalsIgnoreCase(symbol)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Métrica desconocida: '" + symbol + "'. Valores válidos: Wa, Ra.");
    }
}
