package com.exportscan.controller;

import com.exportscan.config.MatchingDefaults;
import com.exportscan.model.MatchingConfiguration;
import com.exportscan.model.RawBatch;
import com.exportscan.model.ReconciliationResult;
import com.exportscan.model.RunSnapshot;
import com.exportscan.repository.CsvBatchReader;
import com.exportscan.repository.CsvResultWriter;
import com.exportscan.service.ReconciliationException;
import com.exportscan.service.ReconciliationOrchestrator;
import com.exportscan.service.cache.RecentRunsService;
import com.exportscan.service.normalize.MissingColumnsException;
import com.exportscan.service.progress.CollectingProgressSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST entry point for reconciliation runs.
 *
 * POST /api/reconcile         - reconcile two uploaded CSV files, JSON summary
 * POST /api/reconcile/export  - same, returns the target file with a Status column
 * GET  /api/runs              - recent runs, newest first
 * GET  /api/runs/{runId}      - one recent run
 * GET  /api/health
 */
@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationOrchestrator orchestrator;
    private final CsvBatchReader batchReader;
    private final CsvResultWriter resultWriter;
    private final RecentRunsService recentRuns;
    private final MatchingDefaults matchingDefaults;

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "message", "Export scan reconciliation is running"
        ));
    }

    @PostMapping(value = "/reconcile", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> reconcile(
            @RequestPart("source") MultipartFile source,
            @RequestPart("target") MultipartFile target,
            @RequestParam(required = false) Boolean buyerSpecific,
            @RequestParam(required = false) String combinePoIn,
            @RequestParam(required = false) String flaggedBuyers) {

        Run run = execute(source, target, buyerSpecific, combinePoIn, flaggedBuyers);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", run.result().runId());
        body.put("summary", run.result().summary());
        body.put("buyerSpecificApplied", run.result().buyerSpecificApplied());
        body.put("warnings", run.result().warnings());
        body.put("progress", run.progress());
        body.put("timing", run.result().timing());
        return ResponseEntity.ok(body);
    }

    @PostMapping(value = "/reconcile/export", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> export(
            @RequestPart("source") MultipartFile source,
            @RequestPart("target") MultipartFile target,
            @RequestParam(required = false) Boolean buyerSpecific,
            @RequestParam(required = false) String combinePoIn,
            @RequestParam(required = false) String flaggedBuyers) {

        Run run = execute(source, target, buyerSpecific, combinePoIn, flaggedBuyers);
        byte[] csv = resultWriter.write(run.target(), run.result().demandRecords());

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(exportName(run.target().name()))
                        .build()
                        .toString())
                .header("X-Run-Id", run.result().runId())
                .contentType(new MediaType("text", "csv"))
                .body(csv);
    }

    @GetMapping("/runs")
    public List<RunSnapshot> runs() {
        return recentRuns.list();
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<RunSnapshot> run(@PathVariable String runId) {
        return recentRuns.find(runId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @ExceptionHandler(MissingColumnsException.class)
    public ResponseEntity<Map<String, Object>> handleMissingColumns(MissingColumnsException e) {
        log.warn("Rejected run: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("missing", e.getMissingByBatch());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadInput(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<Map<String, Object>> handleFailure(ReconciliationException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
    }

    private Run execute(MultipartFile sourceFile, MultipartFile targetFile,
                        Boolean buyerSpecific, String combinePoIn, String flaggedBuyers) {
        MatchingConfiguration configuration = matchingDefaults.resolve(buyerSpecific, combinePoIn, flaggedBuyers);
        RawBatch source = batchReader.read(bytes(sourceFile), nameOf(sourceFile, "source"));
        RawBatch target = batchReader.read(bytes(targetFile), nameOf(targetFile, "target"));

        CollectingProgressSink progress = new CollectingProgressSink();
        ReconciliationResult result = orchestrator.reconcile(source, target, configuration, progress);
        recentRuns.record(RunSnapshot.of(result, source.name(), target.name(), configuration));
        return new Run(target, result, progress.getLines());
    }

    private static byte[] bytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read upload " + file.getOriginalFilename(), e);
        }
    }

    private static String nameOf(MultipartFile file, String fallback) {
        String name = file.getOriginalFilename();
        return name == null || name.isBlank() ? fallback : name;
    }

    static String exportName(String targetName) {
        int dot = targetName.lastIndexOf('.');
        String base = dot > 0 ? targetName.substring(0, dot) : targetName;
        return base + "_result.csv";
    }

    private record Run(RawBatch target, ReconciliationResult result, List<String> progress) {}
}
