package org.surveyworkbench.service.masterfile;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.surveyworkbench.models.entity.ParticipantRecord;
import org.surveyworkbench.models.enums.MasterfileFormat;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
public class CsvMasterfileWriter implements MasterfileWriter {

    @Override
    public boolean supports(MasterfileFormat format) {
        return format == MasterfileFormat.CSV;
    }

    @Override
    public boolean containsParticipant(Path masterfile, String participantId) throws IOException {
        if (!hasContent(masterfile)) {
            return false;
        }
        List<String> header = readHeader(masterfile);
        int idColumn = header.indexOf(ParticipantRecord.PARTICIPANT_ID);
        if (idColumn < 0) {
            return false;
        }
        try (Reader reader = Files.newBufferedReader(masterfile, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.parse(reader)) {
            boolean first = true;
            for (CSVRecord row : parser) {
                if (first) {
                    first = false;
                    continue;
                }
                if (idColumn < row.size() && participantId.equals(row.get(idColumn))) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public Path append(Path masterfile, ParticipantRecord record) throws IOException {
        Map<String, String> row = record.toRow();
        boolean fileExists = hasContent(masterfile);
        List<String> existingHeader = fileExists ? readHeader(masterfile) : List.of();

        Set<String> header = new LinkedHashSet<>(existingHeader);
        header.addAll(row.keySet());

        if (!fileExists) {
            if (masterfile.getParent() != null) {
                Files.createDirectories(masterfile.getParent());
            }
            try (BufferedWriter writer = Files.newBufferedWriter(masterfile, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
                 CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
                printer.printRecord(header);
                printer.printRecord(valuesFor(header, row));
            }
            log.info("Created CSV masterfile {} with {} column(s)", masterfile, header.size());
        } else if (header.size() > existingHeader.size()) {
            rewriteWithHeader(masterfile, new ArrayList<>(header), row);
            log.info("Widened CSV masterfile {} from {} to {} column(s)", masterfile, existingHeader.size(), header.size());
        } else {
            boolean needsLineBreak = !endsWithLineBreak(masterfile);
            try (BufferedWriter writer = Files.newBufferedWriter(masterfile, StandardCharsets.UTF_8,
                    StandardOpenOption.APPEND);
                 CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
                if (needsLineBreak) {
                    printer.println();
                }
                printer.printRecord(valuesFor(header, row));
            }
        }
        return masterfile;
    }

    private void rewriteWithHeader(Path masterfile, List<String> header, Map<String, String> newRow) throws IOException {
        Path temp = Files.createTempFile(masterfile.toAbsolutePath().getParent(), ".masterfile", ".csv");
        try {
            try (Reader reader = Files.newBufferedReader(masterfile, StandardCharsets.UTF_8);
                 CSVParser parser = CSVFormat.DEFAULT.parse(reader);
                 BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
                printer.printRecord(header);
                boolean first = true;
                for (CSVRecord existing : parser) {
                    if (first) {
                        first = false;
                        continue;
                    }
                    List<String> values = new ArrayList<>(existing.toList());
                    while (values.size() < header.size()) {
                        values.add("");
                    }
                    printer.printRecord(values);
                }
                printer.printRecord(valuesFor(header, newRow));
            }
            Files.move(temp, masterfile, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private List<String> readHeader(Path masterfile) throws IOException {
        try (Reader reader = Files.newBufferedReader(masterfile, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.parse(reader)) {
            for (CSVRecord first : parser) {
                return first.toList();
            }
        }
        return List.of();
    }

    private List<String> valuesFor(Iterable<String> header, Map<String, String> row) {
        List<String> values = new ArrayList<>();
        for (String column : header) {
            String value = row.get(column);
            values.add(value == null ? "" : value);
        }
        return values;
    }

    private boolean hasContent(Path masterfile) throws IOException {
        return Files.exists(masterfile) && Files.size(masterfile) > 0;
    }

    private boolean endsWithLineBreak(Path masterfile) throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(masterfile.toFile(), "r")) {
            file.seek(file.length() - 1);
            int last = file.read();
            return last == '\n' || last == '\r';
        }
    }
}
