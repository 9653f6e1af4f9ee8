package surfacetexture.domain.profile;

import java.util.Objects;

/**
 * Corte transversal de una fila: primario, ondulación y rugosidad sobre el mismo eje X.
 * <p>
 * Es la vista que consume el gráfico de sección (las tres curvas superpuestas).
 *
 * @param rowIndex  Índice de la fila (base 0; el software LEXT numera desde 1).
 * @param positions Posiciones X equiespaciadas de 0 al ancho de muestra, ambos incluidos.
 * @param primary   Alturas del perfil primario.
 * @param waviness  Alturas de la ondulación.
 * @param roughness Alturas de la rugosidad.
 */
public record ProfileSection(
        int rowIndex,
        double[] positions,
        double[] primary,
        double[] waviness,
        double[] roughness
) {
    public ProfileSection {
        Objects.requireNonNull(positions, "Las posiciones no pueden ser nulas.");
        Objects.requireNonNull(primary, "El perfil primario no puede ser nulo.");
        Objects.requireNonNull(waviness, "La ondulación no puede ser nula.");
        Objects.requireNonNull(roughness, "La rugosidad no puede ser nula.");

        int length = primary.length;
        if (positions.length != length || waviness.length != length || roughness.length != length) {
            throw new IllegalArgumentException("Todas las series de la sección deben tener la misma longitud.");
        }

        positions = positions.clone();
        primary = primary.clone();
        waviness = waviness.clone();
        roughness = roughness.clone();
    }

    @Override
    public double[] positions() {
        return positions.clone();
    }

    @Override
    public double[] primary() {
        return primary.clone();
    }

    @Override
    public double[] waviness() {
        return waviness.clone();
    }

    @Override
    public double[] roughness() {
        return roughness.clone();
    }

    /**
     * Genera N posiciones equiespaciadas en [0, width]. Con N = 1 devuelve {0}.
     */
    public static double[] linearPositions(double width, int count) {
        double[] positions = new double[count];
        if (count <= 1) {
            return positions;
        }
        double step = width / (count - 1);
        for (int i = 0; i < count; i++) {
            positions[i] = i * step;
        }
        // Último punto exacto, sin error acumulado
        positions[count - 1] = width;
        return positions;
    }
}
