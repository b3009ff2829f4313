package org.surveyworkbench.controllers;

import lombok.RequiredArgsConstructor;
import org.surveyworkbench.models.dto.WorkbenchConfiguration;
import org.surveyworkbench.service.ConfigurationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/configurations")
@RequiredArgsConstructor
public class ConfigurationController {

    private final ConfigurationService configurationService;

    @GetMapping
    public Map<String, Object> listConfigurations() {
        return Map.of("configurations", configurationService.listNames());
    }

    @GetMapping("/{name}")
    public WorkbenchConfiguration loadConfiguration(@PathVariable String name) {
        return configurationService.load(name);
    }

    @PutMapping("/{name}")
    public WorkbenchConfiguration saveConfiguration(@PathVariable String name,
                                                    @RequestBody WorkbenchConfiguration configuration) {
        return configurationService.save(name, configuration);
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> deleteConfiguration(@PathVariable String name) {
        configurationService.delete(name);
        return ResponseEntity.noContent().build();
    }
}
