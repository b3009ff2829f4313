package org.surveyworkbench.service.masterfile;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.surveyworkbench.models.entity.ParticipantRecord;
import org.surveyworkbench.models.enums.MasterfileFormat;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MasterfileService {

    private final List<MasterfileWriter> writers;

    // an .xlsx masterfile is replaced by its .xls copy once that copy exists
    public Path resolveTarget(Path masterfile) {
        if (MasterfileFormat.fromPath(masterfile) != MasterfileFormat.XLSX) {
            return masterfile;
        }
        Path legacy = SpreadsheetMasterfileWriter.legacyPath(masterfile);
        if (Files.exists(legacy)) {
            log.debug("Masterfile {} retargeted to {}", masterfile, legacy);
            return legacy;
        }
        return masterfile;
    }

    // an unreadable masterfile is reported as "not a duplicate"
    public boolean checkDuplicate(Path requested, String participantId) {
        Path masterfile = resolveTarget(requested);
        MasterfileWriter writer = resolveWriter(MasterfileFormat.fromPath(masterfile));
        try {
            return writer.containsParticipant(masterfile, participantId);
        } catch (IOException | RuntimeException exception) {
            log.warn("Duplicate check skipped, could not read masterfile {}: {}", masterfile, exception.getMessage());
            return false;
        }
    }

    public Path append(Path requested, ParticipantRecord record) {
        Path masterfile = resolveTarget(requested);
        MasterfileWriter writer = resolveWriter(MasterfileFormat.fromPath(masterfile));
        try {
            return writer.append(masterfile, record);
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to write masterfile " + masterfile + ": " + ioException.getMessage(), ioException);
        }
    }

    private MasterfileWriter resolveWriter(MasterfileFormat format) {
        return writers.stream()
                .filter(writer -> writer.supports(format))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported format: " + format));
    }
}
