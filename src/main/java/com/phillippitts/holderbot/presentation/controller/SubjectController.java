package com.phillippitts.holderbot.presentation.controller;

import com.phillippitts.holderbot.domain.Decision;
import com.phillippitts.holderbot.domain.PatternHypothesis;
import com.phillippitts.holderbot.domain.SubjectRecord;
import com.phillippitts.holderbot.service.correction.CorrectionService;
import com.phillippitts.holderbot.service.ensemble.BatchDecisionService;
import com.phillippitts.holderbot.service.ensemble.EnsembleDecisionEngine;
import com.phillippitts.holderbot.service.export.ExportService;
import com.phillippitts.holderbot.service.store.AppliedCorrection;
import com.phillippitts.holderbot.service.store.PatternLearningStore;
import com.phillippitts.holderbot.service.store.StoreStatistics;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Subject decisions, stored records and corrections.
 */
@RestController
@RequestMapping("/api/subjects")
class SubjectController {

    private static final Logger LOG = LogManager.getLogger(SubjectController.class);

    private final EnsembleDecisionEngine engine;
    private final BatchDecisionService batch;
    private final PatternLearningStore store;
    private final CorrectionService corrections;
    private final ExportService export;

    SubjectController(EnsembleDecisionEngine engine, BatchDecisionService batch, PatternLearningStore store,
                      CorrectionService corrections, ExportService export) {
        this.engine = engine;
        this.batch = batch;
        this.store = store;
        this.corrections = corrections;
        this.export = export;
    }

    @PostMapping("/{id}/decision")
    ResponseEntity<Decision> decide(@PathVariable("id") String id,
                                    @RequestParam(name = "forceRefresh", defaultValue = "false") boolean forceRefresh) {
        return ResponseEntity.ok(engine.decide(id, forceRefresh));
    }

    @PostMapping("/decisions")
    ResponseEntity<List<Decision>> decideAll(@RequestBody List<String> ids,
                                             @RequestParam(name = "forceRefresh", defaultValue = "false")
                                             boolean forceRefresh) {
        LOG.info("Batch decision requested for {} subjects", ids.size());
        return ResponseEntity.ok(batch.decideAll(ids, forceRefresh));
    }

    @PostMapping("/decisions/stop")
    ResponseEntity<Map<String, Object>> stopBatch() {
        batch.requestStop();
        return ResponseEntity.accepted().body(Map.of("running", batch.isRunning()));
    }

    @GetMapping("/{id}")
    ResponseEntity<SubjectRecord> getAnalysis(@PathVariable("id") String id) {
        return store.getAnalysis(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}/correction")
    ResponseEntity<AppliedCorrection> correct(@PathVariable("id") String id,
                                              @Valid @RequestBody CorrectionRequest request) {
        return ResponseEntity.ok(corrections.applyCorrection(id, request.material(), request.type()));
    }

    @GetMapping("/{id}/learned")
    ResponseEntity<PatternHypothesis> learned(@PathVariable("id") String id) {
        return store.queryLearnedPrediction(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/export")
    ResponseEntity<String> export(@RequestParam(name = "format", defaultValue = "json") String format) {
        return switch (format.toLowerCase(Locale.ROOT)) {
            case "json" -> ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(export.exportJson());
            case "csv" -> ResponseEntity.ok()
                    .contentType(new MediaType("text", "csv"))
                    .header("Content-Disposition", "attachment; filename=\"subjects.csv\"")
                    .body(export.exportCsv());
            default -> throw new IllegalArgumentException("Unsupported export format: " + format);
        };
    }

    @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<Map<String, Object>> importRecords(@RequestBody String body) {
        int written = export.importJson(body);
        return ResponseEntity.ok(Map.of("imported", written));
    }

    @GetMapping("/statistics")
    ResponseEntity<StoreStatistics> statistics() {
        return ResponseEntity.ok(store.statistics());
    }

    record CorrectionRequest(@NotBlank String material, @NotBlank String type) {
    }
}
