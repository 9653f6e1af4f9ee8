package surfacetexture.domain.decomposition;

import lombok.Builder;
import surfacetexture.config.SurfaceConfig;
import surfacetexture.domain.metrics.MetricSeries;
import surfacetexture.domain.profile.HeightGrid;
import surfacetexture.domain.profile.ProfileGrid;
import surfacetexture.domain.profile.ProfileSection;
import surfacetexture.domain.profile.RoughnessGrid;
import surfacetexture.domain.profile.WavinessGrid;

import java.util.Objects;

/**
 * Resultado inmutable de descomponer una superficie: primario = ondulación + rugosidad.
 * <p>
 * Una nueva configuración produce siempre una descomposición nueva; no hay actualización in situ.
 *
 * @param config            Configuración con la que se calculó.
 * @param primary           Perfil primario de entrada.
 * @param waviness          Ondulación (paso bajo).
 * @param roughness         Rugosidad (primario − ondulación).
 * @param metrics           Series Wa/Ra por fila.
 * @param computationTimeMs Tiempo de cálculo en milisegundos (métrica de rendimiento).
 */
@Builder
public record SurfaceDecomposition(
        SurfaceConfig config,
        ProfileGrid primary,
        WavinessGrid waviness,
        RoughnessGrid roughness,
        MetricSeries metrics,
        long computationTimeMs
) {
    public SurfaceDecomposition {
        Objects.requireNonNull(config, "La configuración no puede ser nula.");
        Objects.requireNonNull(primary, "El perfil primario no puede ser nulo.");
        Objects.requireNonNull(waviness, "La ondulación no puede ser nula.");
        Objects.requireNonNull(roughness, "La rugosidad no puede ser nula.");
        Objects.requireNonNull(metrics, "Las métricas no pueden ser nulas.");

        int n = primary.dimension();
        if (waviness.dimension() != n || roughness.dimension() != n || metrics.size() != n) {
            throw new IllegalArgumentException("Inconsistencia de dimensiones: primario " + n
                    + ", ondulación " + waviness.dimension()
                    + ", rugosidad " + roughness.dimension()
                    + ", métricas " + metrics.size() + ".");
        }
    }

    public int dimension() {
        return primary.dimension();
    }

    /**
     * Corte transversal de la fila indicada, con el eje X de 0 al ancho de muestra.
     *
     * @throws IndexOutOfBoundsException si la fila no existe.
     */
    public ProfileSection section(int rowIndex) {
        HeightGrid.checkRowIndex(rowIndex, dimension());
        return new ProfileSection(
                rowIndex,
                ProfileSection.linearPositions(config.sampleWidth(), dimension()),
                primary.getRowAt(rowIndex),
                waviness.getRowAt(rowIndex),
                roughness.getRowAt(rowIndex)
        );
    }
}
