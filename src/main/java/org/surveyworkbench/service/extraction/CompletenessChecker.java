package org.surveyworkbench.service.extraction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.surveyworkbench.models.dto.CompletenessReport;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class CompletenessChecker {

    private final ExtractDataLocator locator;

    public CompletenessReport check(String participantId, Path sourceFolder, Integer expectedCount) {
        Path participantFolder = locator.participantFolder(sourceFolder, participantId);
        if (!Files.isDirectory(participantFolder)) {
            return new CompletenessReport(participantId, false,
                    List.of("Folder not found: " + participantFolder), List.of());
        }

        List<String> files = locator.locate(participantFolder).stream()
                .map(path -> path.getFileName().toString())
                .toList();
        if (files.isEmpty()) {
            return new CompletenessReport(participantId, false, List.of("No Extract Data CSV files found"), files);
        }

        List<String> issues = new ArrayList<>();
        if (expectedCount != null && expectedCount > 0 && files.size() < expectedCount) {
            issues.add("Expected " + expectedCount + " CSV files, found " + files.size());
        }
        log.debug("Completeness for {}: {} file(s), {} issue(s)", participantId, files.size(), issues.size());
        return new CompletenessReport(participantId, issues.isEmpty(), List.copyOf(issues), files);
    }
}
