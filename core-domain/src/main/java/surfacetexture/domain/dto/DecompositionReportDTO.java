package surfacetexture.domain.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Informe exportable de una descomposición: parámetros, dimensión y series Wa/Ra.
 */
@JsonPropertyOrder({"source", "generatedAt", "cutoff", "sampleWidth", "dimension", "averages", "metrics"})
public record DecompositionReportDTO(
        String source,
        LocalDateTime generatedAt,
        double cutoff,
        double sampleWidth,
        int dimension,
        Map<String, Double> averages,
        Map<String, double[]> metrics
) {}
