package surfacetexture.compute.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import surfacetexture.config.ApiRoutes;
import surfacetexture.config.SurfaceConfig;
import surfacetexture.domain.dto.DecompositionReportDTO;
import surfacetexture.domain.dto.DecompositionSummaryDTO;
import surfacetexture.domain.dto.MetricSeriesDTO;
import surfacetexture.domain.dto.PrimaryGridDTO;
import surfacetexture.domain.dto.ProfileSectionDTO;
import surfacetexture.domain.exception.CutoffUnreachableException;
import surfacetexture.domain.exception.InputShapeException;
import surfacetexture.domain.exception.InvalidParameterException;
import surfacetexture.domain.exception.ResourceNotFoundException;
import surfacetexture.io.DecompositionReportWriter;
import surfacetexture.io.SurfaceCsvReader;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SurfaceAnalysisServiceTest {

    private static final double TOLERANCE = 1e-9;

    private SurfaceDecomposerFactory decomposerFactory;
    private SurfaceAnalysisService service;

    @BeforeEach
    void setUp() {
        SurfaceConfig defaults = SurfaceConfig.builder()
                .cutoff(80.0)
                .sampleWidth(100.0)
                .workerThreads(2)
                .build();
        decomposerFactory = spy(new SurfaceDecomposerFactory());
        service = new SurfaceAnalysisService(defaults, decomposerFactory,
                new SurfaceCsvReader(), new DecompositionReportWriter());
    }

    private static double[] constantSamples(int n, double value) {
        double[] samples = new double[n * n];
        Arrays.fill(samples, value);
        return samples;
    }

    @Test
    @DisplayName("Descomposición con la configuración por defecto y enlace a la primera sección")
    void decompose_withDefaults_shouldReturnSummary() {
        // ARRANGE
        double[] samples = constantSamples(8, 5.0);

        // ACT
        DecompositionSummaryDTO summary = service.decompose(samples, null, null);

        // ASSERT
        assertNotNull(summary.id());
        assertEquals(8, summary.dimension());
        assertEquals(80.0, summary.cutoff());
        assertEquals(100.0, summary.sampleWidth());
        assertEquals(5.0, summary.averageWa(), TOLERANCE);
        assertEquals(0.0, summary.averageRa(), TOLERANCE);
        assertEquals(ApiRoutes.SURFACES + "/" + summary.id() + "/sections/0", summary.sectionsLink());
        verify(decomposerFactory).createDecomposer(any(SurfaceConfig.class));
    }

    @Test
    @DisplayName("La petición puede sobrescribir el corte y el ancho de muestra")
    void resolveConfig_shouldApplyOverrides() {
        SurfaceConfig config = service.resolveConfig(200.0, 643.0);

        assertEquals(200.0, config.cutoff());
        assertEquals(643.0, config.sampleWidth());
        assertEquals(2, config.workerThreads());
        assertEquals(80.0, service.resolveConfig(null, null).cutoff());
    }

    @Test
    @DisplayName("Un corte inalcanzable se propaga como error de configuración")
    void decompose_unreachableCutoff_shouldPropagate() {
        double[] samples = constantSamples(4, 1.0);

        assertThrows(CutoffUnreachableException.class, () -> service.decompose(samples, 100.0, null));
    }

    @Test
    @DisplayName("Muestras nulas o no cuadradas: InputShapeException")
    void decompose_invalidSamples_shouldThrowInputShape() {
        assertThrows(InputShapeException.class, () -> service.decompose(null, null, null));
        assertThrows(InputShapeException.class, () -> service.decompose(new double[5], null, null));
    }

    @Test
    @DisplayName("Sección, métrica centrada, primario e informe de una descomposición almacenada")
    void views_shouldBeServedFromStoredResult() {
        // ARRANGE
        double[] samples = new double[64];
        for (int i = 0; i < 8; i++) {
            Arrays.fill(samples, i * 8, i * 8 + 8, i + 1.0);
        }
        String id = service.decompose(samples, null, null).id();

        // ACT
        ProfileSectionDTO section = service.getSection(id, 3);
        MetricSeriesDTO wa = service.getMetric(id, "Wa", false);
        MetricSeriesDTO waCentered = service.getMetric(id, "wa", true);
        PrimaryGridDTO primary = service.getPrimary(id);
        DecompositionReportDTO report = service.getReport(id);

        // ASSERT
        assertEquals(3, section.rowIndex());
        assertEquals(100.0, section.positions()[7], TOLERANCE);
        assertArrayEquals(new double[]{4, 4, 4, 4, 4, 4, 4, 4}, section.waviness(), TOLERANCE);

        assertEquals("Wa", wa.metric());
        assertFalse(wa.centered());
        assertEquals(4.5, wa.average(), TOLERANCE);
        assertArrayEquals(new double[]{1, 2, 3, 4, 5, 6, 7, 8}, wa.values(), TOLERANCE);

        assertTrue(waCentered.centered());
        assertArrayEquals(new double[]{-3.5, -2.5, -1.5, -0.5, 0.5, 1.5, 2.5, 3.5}, waCentered.values(), TOLERANCE);

        assertEquals(8, primary.dimension());
        assertEquals(100.0, primary.sampleWidth());
        assertEquals(8.0, primary.rows()[7][0]);

        assertEquals(id, report.source());
        assertEquals(8, report.dimension());
    }

    @Test
    @DisplayName("Contenido CSV: se procesa igual que las muestras en JSON")
    void decomposeCsv_shouldParseFirstLine() {
        String csv = "5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,"
                + "5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5,5\nignorada";

        DecompositionSummaryDTO summary = service.decomposeCsv(csv, null, null);

        assertEquals(8, summary.dimension());
        assertEquals(5.0, summary.averageWa(), TOLERANCE);
    }

    @Test
    @DisplayName("Identificador desconocido o métrica desconocida")
    void lookups_unknownIdOrMetric_shouldThrow() {
        assertThrows(ResourceNotFoundException.class, () -> service.getSection("missing", 0));
        assertThrows(ResourceNotFoundException.class, () -> service.getPrimary("missing"));

        String id = service.decompose(constantSamples(8, 1.0), null, null).id();
        assertThrows(InvalidParameterException.class, () -> service.getMetric(id, "Rz", false));
        assertThrows(InvalidParameterException.class, () -> service.getSection(id, 8));
        assertThrows(InvalidParameterException.class, () -> service.getSection(id, -1));
    }

    @Test
    @DisplayName("Corte o ancho no positivos en la petición: error del cliente, no invariante interno")
    void resolveConfig_invalidOverrides_shouldThrowInvalidParameter() {
        assertThrows(InvalidParameterException.class, () -> service.resolveConfig(-1.0, null));
        assertThrows(InvalidParameterException.class, () -> service.resolveConfig(null, 0.0));
        assertThrows(InvalidParameterException.class,
                () -> service.decompose(constantSamples(8, 1.0), Double.NaN, null));
    }

    @Test
    @DisplayName("Borrado: libera la descomposición y deja de servirla")
    void delete_shouldEvictStoredResult() {
        // ARRANGE
        String kept = service.decompose(constantSamples(8, 1.0), null, null).id();
        String removed = service.decompose(constantSamples(8, 2.0), null, null).id();
        assertEquals(2, service.storedCount());

        // ACT
        service.delete(removed);

        // ASSERT
        assertEquals(1, service.storedCount());
        assertThrows(ResourceNotFoundException.class, () -> service.getPrimary(removed));
        assertThrows(ResourceNotFoundException.class, () -> service.delete(removed));
        assertEquals(8, service.getPrimary(kept).dimension());
    }

    @Test
    @DisplayName("Cada petición crea su propio descompositor")
    void decompose_shouldUseFreshDecomposerPerRequest() {
        service.decompose(constantSamples(8, 1.0), null, null);
        service.decompose(constantSamples(8, 2.0), null, null);

        verify(decomposerFactory, times(2)).createDecomposer(any(SurfaceConfig.class));
    }
}
