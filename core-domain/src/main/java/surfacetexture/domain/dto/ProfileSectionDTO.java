package surfacetexture.domain.dto;

public record ProfileSectionDTO(
        int rowIndex,
        double[] positions,
        double[] primary,
        double[] waviness,
        double[] roughness
) {}
