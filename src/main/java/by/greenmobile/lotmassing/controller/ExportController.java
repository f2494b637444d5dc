package by.greenmobile.lotmassing.controller;

import by.greenmobile.lotmassing.entity.LotResult;
import by.greenmobile.lotmassing.service.export.FloorGeoJsonExporter;
import by.greenmobile.lotmassing.service.export.MassingSvgService;
import by.greenmobile.lotmassing.service.export.SummaryCsvWriter;
import by.greenmobile.lotmassing.service.report.PdfReportService;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

@RestController
@RequiredArgsConstructor
public class ExportController {

    private final FloorGeoJsonExporter geoJsonExporter;
    private final SummaryCsvWriter csvWriter;
    private final MassingSvgService svgService;
    private final PdfReportService pdfReportService;

    @GetMapping("/export/floors")
    public ResponseEntity<byte[]> exportFloors(@RequestParam(defaultValue = "baseline") String variant,
                                               HttpSession session) {
        FloorGeoJsonExporter.Variant v = FloorGeoJsonExporter.Variant.valueOf(variant.toUpperCase(Locale.ROOT));
        String json = geoJsonExporter.export(getLast(session), v);

        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        return ResponseEntity.ok()
                .headers(fileHeaders("floors_" + variant.toLowerCase(Locale.ROOT) + ".geojson"))
                .contentType(MediaType.valueOf("application/geo+json"))
                .body(bytes);
    }

    @GetMapping("/export/summary")
    public ResponseEntity<byte[]> exportSummary(HttpSession session) {
        String csv = csvWriter.write(getLast(session));

        byte[] bytes = csv.getBytes(StandardCharsets.UTF_8);
        return ResponseEntity.ok()
                .headers(fileHeaders("summary.csv"))
                .contentType(MediaType.valueOf("text/csv"))
                .body(bytes);
    }

    @GetMapping("/export/svg")
    public ResponseEntity<byte[]> exportSvg(@RequestParam(required = false) String lotId, HttpSession session) {
        String svg = svgService.generateSvg(pick(getLast(session), lotId));

        byte[] bytes = svg.getBytes(StandardCharsets.UTF_8);
        return ResponseEntity.ok()
                .headers(fileHeaders("plan.svg"))
                .contentType(MediaType.valueOf("image/svg+xml"))
                .body(bytes);
    }

    @GetMapping("/export/pdf")
    public ResponseEntity<byte[]> exportPdf(@RequestParam(required = false) String lotId, HttpSession session)
            throws IOException {
        byte[] pdf = pdfReportService.buildLotReport(pick(getLast(session), lotId));

        return ResponseEntity.ok()
                .headers(fileHeaders("report.pdf"))
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<String> noResult(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
    }

    private List<LotResult> getLast(HttpSession session) {
        Object obj = session.getAttribute(SessionResults.ATTRIBUTE);
        if (obj instanceof SessionResults last && !last.isEmpty()) return last.getResults();
        throw new IllegalStateException("No result in session. Run a lot or batch evaluation first.");
    }

    private LotResult pick(List<LotResult> results, String lotId) {
        if (lotId == null || lotId.isBlank()) return results.get(0);
        return results.stream()
                .filter(r -> lotId.equals(r.getLotId()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No result for lot " + lotId + " in session."));
    }

    private HttpHeaders fileHeaders(String baseName) {
        String ts = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        int dot = baseName.lastIndexOf('.');
        String name = baseName.substring(0, dot) + "_" + ts + baseName.substring(dot);

        HttpHeaders h = new HttpHeaders();
        h.setContentDisposition(ContentDisposition.attachment().filename(name, StandardCharsets.UTF_8).build());
        h.setCacheControl("no-cache, no-store, must-revalidate");
        h.setPragma("no-cache");
        return h;
    }
}
