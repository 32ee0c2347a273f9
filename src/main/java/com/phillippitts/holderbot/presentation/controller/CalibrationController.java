package com.phillippitts.holderbot.presentation.controller;

import com.phillippitts.holderbot.domain.AccuracyTrend;
import com.phillippitts.holderbot.domain.Axis;
import com.phillippitts.holderbot.domain.ConfusionTally;
import com.phillippitts.holderbot.service.calibration.BinReport;
import com.phillippitts.holderbot.service.calibration.CalibrationReport;
import com.phillippitts.holderbot.service.calibration.CalibrationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/calibration")
class CalibrationController {

    private final CalibrationService calibration;

    CalibrationController(CalibrationService calibration) {
        this.calibration = calibration;
    }

    @PostMapping("/outcomes")
    ResponseEntity<Void> recordOutcome(@Valid @RequestBody OutcomeRequest request) {
        calibration.recordOutcome(request.predictedConfidence(), request.wasCorrect());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @GetMapping("/bins")
    ResponseEntity<List<BinReport>> bins() {
        return ResponseEntity.ok(calibration.binReports());
    }

    @GetMapping("/confusions")
    ResponseEntity<List<ConfusionTally>> confusions(
            @RequestParam(name = "axis", defaultValue = "material") String axis,
            @RequestParam(name = "limit", defaultValue = "5") int limit) {
        Axis parsed = Axis.valueOf(axis.toUpperCase(Locale.ROOT));
        return ResponseEntity.ok(calibration.topConfusions(parsed, limit));
    }

    @GetMapping("/trend")
    ResponseEntity<Map<String, AccuracyTrend>> trend() {
        return ResponseEntity.ok(Map.of("trend", calibration.accuracyTrend()));
    }

    @GetMapping("/report")
    ResponseEntity<CalibrationReport> report() {
        return ResponseEntity.ok(calibration.report());
    }

    record OutcomeRequest(@NotNull Double predictedConfidence, @NotNull Boolean wasCorrect) {
    }
}
