package org.surveyworkbench.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.surveyworkbench.models.dto.BatchGenerateRequest;
import org.surveyworkbench.models.dto.BatchResult;
import org.surveyworkbench.models.dto.FolderGenerationResult;
import org.surveyworkbench.models.dto.GenerateFolderRequest;
import org.surveyworkbench.service.FolderGenerationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/folders")
@RequiredArgsConstructor
public class FolderController {

    private final FolderGenerationService folderGenerationService;

    @PostMapping("/generate")
    public ResponseEntity<FolderGenerationResult> generate(@RequestBody GenerateFolderRequest request) {
        log.info("Received folder generation request for participant {}", request.participantId());
        return ResponseEntity.ok(folderGenerationService.generate(
                request.participantId(), request.targetPath(), request.questionnaires()));
    }

    @PostMapping("/generate/batch")
    public ResponseEntity<BatchResult> generateBatch(@Valid @RequestBody BatchGenerateRequest request) {
        return ResponseEntity.ok(folderGenerationService.generateBatch(
                request.participantIds(), request.targetPath(), request.questionnaires()));
    }
}
