package org.surveyworkbench.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.surveyworkbench.service.ParticipantListService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/participants")
@RequiredArgsConstructor
public class ParticipantListController {

    private final ParticipantListService participantListService;

    @PostMapping("/parse")
    public Map<String, Object> parse(@RequestBody(required = false) String text) {
        List<String> ids = participantListService.parse(text);
        return Map.of("participantIds", ids, "count", ids.size());
    }

    @PostMapping("/import")
    public ResponseEntity<Map<String, Object>> importList(@RequestParam("file") MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "File is empty"));
        }
        try (InputStream content = file.getInputStream()) {
            List<String> ids = participantListService.importList(file.getOriginalFilename(), content);
            Map<String, Object> response = new HashMap<>();
            response.put("participantIds", ids);
            response.put("count", ids.size());
            response.put("filename", file.getOriginalFilename());
            return ResponseEntity.ok(response);
        } catch (IOException e) {
            log.error("Error importing participant list: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Error importing participant list: " + e.getMessage()));
        }
    }
}
