package surfacetexture.domain.dto;

public record DecompositionSummaryDTO(
        String id,
        int dimension,
        double cutoff,
        double sampleWidth,
        double averageWa,
        double averageRa,
        long computationTimeMs,
        String sectionsLink
) {}
