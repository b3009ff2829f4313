package org.surveyworkbench.controllers;

import lombok.RequiredArgsConstructor;
import org.surveyworkbench.models.dto.QuestionnaireSpec;
import org.surveyworkbench.models.dto.TemplateBundle;
import org.surveyworkbench.service.TemplateBundleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/bundles")
@RequiredArgsConstructor
public class TemplateBundleController {

    private final TemplateBundleService templateBundleService;

    @GetMapping
    public Map<String, Object> listBundles() {
        return Map.of("bundles", templateBundleService.listBundles());
    }

    @GetMapping("/{name}")
    public Map<String, Object> loadBundle(@PathVariable String name) {
        TemplateBundle bundle = templateBundleService.load(name);
        return Map.of(
                "bundle", bundle,
                "questionnaires", templateBundleService.questionnaires(bundle)
        );
    }

    @PutMapping("/{name}")
    public TemplateBundle saveBundle(@PathVariable String name,
                                     @RequestParam(value = "overwrite", defaultValue = "false") boolean overwrite,
                                     @RequestBody List<QuestionnaireSpec> questionnaires) {
        return templateBundleService.save(name, questionnaires, overwrite);
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> deleteBundle(@PathVariable String name) {
        templateBundleService.delete(name);
        return ResponseEntity.noContent().build();
    }
}
