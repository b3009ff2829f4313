package org.surveyworkbench.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.surveyworkbench.models.dto.*;
import org.surveyworkbench.models.enums.ExtractionStatus;
import org.surveyworkbench.service.extraction.ExtractionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/extractions")
@RequiredArgsConstructor
public class ExtractionController {

    private final ExtractionService extractionService;

    @PostMapping("/preview")
    public ExtractionPreview preview(@RequestBody ExtractionRequest request) {
        return extractionService.preview(request.participantId(), request.sourcePath(),
                request.masterfilePath(), request.expectedSurveyCount());
    }

    // 409 carries the outcome when a duplicate or incomplete participant was not forced
    @PostMapping
    public ResponseEntity<ExtractionOutcome> extract(@RequestBody ExtractionRequest request) {
        log.info("Received extraction request for participant {} (force={})", request.participantId(), request.force());
        ExtractionOutcome outcome = extractionService.extract(request.participantId(), request.sourcePath(),
                request.masterfilePath(), request.expectedSurveyCount(), request.force());
        if (outcome.status() != ExtractionStatus.EXTRACTED) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(outcome);
        }
        return ResponseEntity.ok(outcome);
    }

    @PostMapping("/batch")
    public BatchResult extractBatch(@Valid @RequestBody BatchExtractionRequest request) {
        return extractionService.extractBatch(request.participantIds(), request.sourcePath(),
                request.masterfilePath(), request.expectedSurveyCount());
    }

    @PostMapping("/duplicate-check")
    public Map<String, Object> checkDuplicate(@Valid @RequestBody DuplicateCheckRequest request) {
        boolean duplicate = extractionService.checkDuplicate(request.participantId(), request.masterfilePath());
        return Map.of("participantId", request.participantId(), "duplicate", duplicate);
    }

    @PostMapping("/completeness")
    public CompletenessReport checkCompleteness(@Valid @RequestBody CompletenessRequest request) {
        return extractionService.checkCompleteness(request.participantId(), request.sourcePath(),
                request.expectedSurveyCount());
    }

    @GetMapping("/missing-data-report")
    public MissingDataReport missingDataReport(@RequestParam("sourcePath") String sourcePath,
                                               @RequestParam(value = "expectedSurveyCount", required = false) Integer expectedSurveyCount) {
        return extractionService.missingDataReport(sourcePath, expectedSurveyCount);
    }
}
