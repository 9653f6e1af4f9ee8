package surfacetexture.domain.dto;

/**
 * Rejilla primaria para la vista cenital. La extensión es [0, sampleWidth] en ambos ejes.
 */
public record PrimaryGridDTO(
        int dimension,
        double sampleWidth,
        double[][] rows
) {}
