package org.surveyworkbench.service.masterfile;

import org.surveyworkbench.models.entity.ParticipantRecord;
import org.surveyworkbench.models.enums.MasterfileFormat;

import java.io.IOException;
import java.nio.file.Path;

public interface MasterfileWriter {

    boolean supports(MasterfileFormat format);

    boolean containsParticipant(Path masterfile, String participantId) throws IOException;

    /**
     * Appends the record and returns the path later operations must target.
     */
    Path append(Path masterfile, ParticipantRecord record) throws IOException;
}
