package org.surveyworkbench.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.surveyworkbench.models.entity.ParticipantRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Merges the Extract Data CSVs of one participant into a single record, prefixing every column
 * with the survey name recovered from the file name.
 */
@Slf4j
@Component
public class FieldMerger {

    public static final String DEFAULT_IGNORED_COLUMN = "File";

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ExtractDataLocator locator;
    private final String ignoredColumn;

    public FieldMerger(ExtractDataLocator locator,
                       @Value("${workbench.extract.ignored-column:" + DEFAULT_IGNORED_COLUMN + "}") String ignoredColumn) {
        this.locator = locator;
        this.ignoredColumn = ignoredColumn;
    }

    public ParticipantRecord merge(String participantId, List<Path> files) {
        ParticipantRecord record = new ParticipantRecord(participantId);
        for (Path file : files) {
            String survey = locator.surveyName(participantId, file);
            mergeFile(record, survey, file);
        }
        log.info("Merged {} field(s) from {} file(s) for participant {}",
                record.getFields().size(), files.size(), participantId);
        return record;
    }

    private void mergeFile(ParticipantRecord record, String survey, Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.parse(reader)) {
            List<String> headers = null;
            for (CSVRecord row : parser) {
                if (headers == null) {
                    headers = row.toList();
                    continue;
                }
                for (int column = 0; column < headers.size(); column++) {
                    String key = column == 0 ? stripByteOrderMark(headers.get(column)) : headers.get(column);
                    if (ignoredColumn.equals(key)) {
                        continue;
                    }
                    record.addField(survey + "_" + key, column < row.size() ? row.get(column) : "");
                }
            }
        } catch (IOException | UncheckedIOException exception) {
            throw new IllegalStateException("Failed to read " + file.getFileName() + ": " + exception.getMessage(), exception);
        }
    }

    private String stripByteOrderMark(String header) {
        if (!header.isEmpty() && header.charAt(0) == BYTE_ORDER_MARK) {
            return header.substring(1);
        }
        return header;
    }
}
