package surfacetexture.domain.dto;

/**
 * Serie de una métrica por fila. Si {@code centered} es cierto, los valores ya tienen restada la media.
 */
public record MetricSeriesDTO(
        String metric,
        boolean centered,
        double average,
        double[] values
) {}
