package surfacetexture.compute.api;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import surfacetexture.compute.service.SurfaceAnalysisService;
import surfacetexture.config.ApiRoutes;
import surfacetexture.domain.dto.DecompositionReportDTO;
import surfacetexture.domain.dto.DecompositionRequest;
import surfacetexture.domain.dto.DecompositionSummaryDTO;
import surfacetexture.domain.dto.MetricSeriesDTO;
import surfacetexture.domain.dto.PrimaryGridDTO;
import surfacetexture.domain.dto.ProfileSectionDTO;

@Slf4j
@RestController
@RequestMapping(ApiRoutes.SURFACES)
@RequiredArgsConstructor
public class SurfaceController {

    private final SurfaceAnalysisService analysisService;

    /**
     * Descompone una superficie enviada como JSON.
     * POST /v1/surfaces
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DecompositionSummaryDTO> decompose(@RequestBody DecompositionRequest request) {
        log.info(">>> API: Recibida petición de descomposición (Corte: {}, Ancho: {})",
                request.cutoff(), request.sampleWidth());
        return ResponseEntity.ok(analysisService.decompose(request.samples(), request.cutoff(), request.sampleWidth()));
    }

    /**
     * Descompone un CSV de LEXT enviado tal cual.
     * POST /v1/surfaces/csv?cutoff=80&sampleWidth=643
     */
    @PostMapping(value = "/csv", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<DecompositionSummaryDTO> decomposeCsv(
            @RequestBody String csvContent,
            @RequestParam(required = false) Double cutoff,
            @RequestParam(required = false) Double sampleWidth) {
        log.info(">>> API: Recibido CSV de {} caracteres", csvContent.length());
        return ResponseEntity.ok(analysisService.decomposeCsv(csvContent, cutoff, sampleWidth));
    }

    @GetMapping("/{id}/sections/{row}")
    public ResponseEntity<ProfileSectionDTO> getSection(@PathVariable String id, @PathVariable int row) {
        return ResponseEntity.ok(analysisService.getSection(id, row));
    }

    @GetMapping("/{id}/metrics/{metric}")
    public ResponseEntity<MetricSeriesDTO> getMetric(
            @PathVariable String id,
            @PathVariable String metric,
            @RequestParam(defaultValue = "false") boolean centered) {
        return ResponseEntity.ok(analysisService.getMetric(id, metric, centered));
    }

    @GetMapping("/{id}/primary")
    public ResponseEntity<PrimaryGridDTO> getPrimary(@PathVariable String id) {
        return ResponseEntity.ok(analysisService.getPrimary(id));
    }

    @GetMapping("/{id}/report")
    public ResponseEntity<DecompositionReportDTO> getReport(@PathVariable String id) {
        return ResponseEntity.ok(analysisService.getReport(id));
    }

    /**
     * Libera una descomposición almacenada.
     * DELETE /v1/surfaces/{id}
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        log.info(">>> API: Eliminando descomposición {}", id);
        analysisService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
