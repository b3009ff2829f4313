package org.surveyworkbench.service.extraction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.surveyworkbench.models.dto.BatchResult;
import org.surveyworkbench.models.dto.CompletenessReport;
import org.surveyworkbench.models.dto.ExtractionOutcome;
import org.surveyworkbench.models.dto.ExtractionPreview;
import org.surveyworkbench.models.dto.MissingDataReport;
import org.surveyworkbench.models.entity.ParticipantRecord;
import org.surveyworkbench.models.enums.ExtractionStatus;
import org.surveyworkbench.models.enums.MasterfileFormat;
import org.surveyworkbench.service.ParticipantListService;
import org.surveyworkbench.service.masterfile.MasterfileService;
import org.surveyworkbench.utils.InputValidator;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionService {

    private final ExtractDataLocator locator;
    private final CompletenessChecker completenessChecker;
    private final FieldMerger fieldMerger;
    private final MasterfileService masterfileService;
    private final ParticipantListService participantListService;

    public ExtractionPreview preview(String participantId, String sourcePath, String masterfilePath, Integer expectedCount) {
        String id = InputValidator.requireSegment(participantId, "Please enter a participant ID!");
        Path source = InputValidator.requirePath(sourcePath, "Please select a source folder!");
        Path masterfile = requireMasterfile(masterfilePath);

        ParticipantRecord record = prepareRecord(id, source);
        boolean duplicate = masterfileService.checkDuplicate(masterfile, id);
        CompletenessReport completeness = completenessChecker.check(id, source, expectedCount);
        return new ExtractionPreview(id, record.toRow(), duplicate, completeness);
    }

    /**
     * Extracts one participant. Without {@code force} a duplicate or incomplete participant is
     * reported back and nothing is written.
     */
    public ExtractionOutcome extract(String participantId, String sourcePath, String masterfilePath,
                                     Integer expectedCount, boolean force) {
        String id = InputValidator.requireSegment(participantId, "Please enter a participant ID!");
        Path source = InputValidator.requirePath(sourcePath, "Please select a source folder!");
        Path masterfile = requireMasterfile(masterfilePath);

        CompletenessReport completeness = completenessChecker.check(id, source, expectedCount);
        if (!force) {
            if (masterfileService.checkDuplicate(masterfile, id)) {
                log.warn("Participant {} already exists in masterfile {}", id, masterfile);
                return new ExtractionOutcome(id, ExtractionStatus.DUPLICATE, 0, masterfile.toString(), completeness);
            }
            if (!completeness.complete()) {
                log.warn("Participant {} has incomplete data: {}", id, completeness.issues());
                return new ExtractionOutcome(id, ExtractionStatus.INCOMPLETE, 0, masterfile.toString(), completeness);
            }
        }

        ParticipantRecord record = prepareRecord(id, source);
        Path written = masterfileService.append(masterfile, record);
        log.info("Data extracted successfully for {} into {}", id, written);
        return new ExtractionOutcome(id, ExtractionStatus.EXTRACTED, record.getFields().size(), written.toString(), completeness);
    }

    public BatchResult extractBatch(String participantIds, String sourcePath, String masterfilePath, Integer expectedCount) {
        Path masterfile = requireMasterfile(masterfilePath);
        List<String> ids = participantListService.parse(participantIds);
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("Please enter at least one participant ID!");
        }
        Path source = InputValidator.requirePath(sourcePath, "Please select a source folder!");

        List<String> succeeded = new ArrayList<>();
        List<String> duplicates = new ArrayList<>();
        List<String> incomplete = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (String id : ids) {
            try {
                InputValidator.requireSegment(id, "Please enter a participant ID!");
                if (masterfileService.checkDuplicate(masterfile, id)) {
                    duplicates.add(id);
                    continue;
                }
                CompletenessReport completeness = completenessChecker.check(id, source, expectedCount);
                if (!completeness.complete()) {
                    incomplete.add(id + ": " + String.join(", ", completeness.issues()));
                    continue;
                }
                masterfile = masterfileService.append(masterfile, prepareRecord(id, source));
                succeeded.add(id);
            } catch (Exception exception) {
                log.error("Extraction failed for participant {}", id, exception);
                failed.add(id + ": " + exception.getMessage());
            }
        }
        log.info("Extracted {} of {} participants into {}", succeeded.size(), ids.size(), masterfile);
        return new BatchResult(ids.size(), succeeded, duplicates, incomplete, failed, masterfile.toString());
    }

    public boolean checkDuplicate(String participantId, String masterfilePath) {
        String id = InputValidator.requireText(participantId, "Please enter a participant ID!");
        return masterfileService.checkDuplicate(requireMasterfile(masterfilePath), id);
    }

    public CompletenessReport checkCompleteness(String participantId, String sourcePath, Integer expectedCount) {
        String id = InputValidator.requireSegment(participantId, "Please enter a participant ID!");
        Path source = InputValidator.requirePath(sourcePath, "Please select a source folder!");
        return completenessChecker.check(id, source, expectedCount);
    }

    public MissingDataReport missingDataReport(String sourcePath, Integer expectedCount) {
        Path source = InputValidator.requirePath(sourcePath, "Please select a source folder!");
        if (!Files.isDirectory(source)) {
            throw new IllegalArgumentException("Source folder not found: " + source);
        }
        List<String> folders;
        try (Stream<Path> stream = Files.list(source)) {
            folders = stream
                    .filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to list source folder: " + source, ioException);
        }
        if (folders.isEmpty()) {
            throw new IllegalArgumentException("No participant folders found in source directory!");
        }

        List<CompletenessReport> reports = folders.stream()
                .map(folder -> completenessChecker.check(folder, source, expectedCount))
                .toList();
        int complete = (int) reports.stream().filter(CompletenessReport::complete).count();
        return new MissingDataReport(complete, reports.size() - complete, reports.size(), reports);
    }

    private ParticipantRecord prepareRecord(String participantId, Path source) {
        Path participantFolder = locator.participantFolder(source, participantId);
        if (!Files.isDirectory(participantFolder)) {
            throw new IllegalArgumentException("Participant folder not found: " + participantFolder);
        }
        List<Path> files = locator.locate(participantFolder);
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No Extract Data CSV files found in participant folder!");
        }
        return fieldMerger.merge(participantId, files);
    }

    private Path requireMasterfile(String masterfilePath) {
        Path masterfile = InputValidator.requirePath(masterfilePath, "Please select a masterfile!");
        MasterfileFormat.fromPath(masterfile);
        return masterfileService.resolveTarget(masterfile);
    }
}
