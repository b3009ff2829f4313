package org.surveyworkbench.service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ParticipantListService {

    public List<String> parse(String text) {
        List<String> ids = new ArrayList<>();
        if (text == null) {
            return ids;
        }
        for (String line : text.replace(',', '\n').split("\n")) {
            String id = line.trim();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    public List<String> importList(String filename, InputStream content) throws IOException {
        List<String> ids = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(content, StandardCharsets.UTF_8))) {
            if (filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
                try (CSVReader csvReader = new CSVReader(reader)) {
                    for (String[] row : csvReader.readAll()) {
                        for (String cell : row) {
                            if (cell != null && !cell.trim().isEmpty()) {
                                ids.add(cell.trim());
                            }
                        }
                    }
                } catch (CsvException e) {
                    throw new IllegalArgumentException("Failed to parse participant list: " + e.getMessage(), e);
                }
            } else {
                ids.addAll(parse(reader.lines().collect(Collectors.joining("\n"))));
            }
        }

        List<String> unique = new ArrayList<>(new LinkedHashSet<>(ids));
        if (unique.isEmpty()) {
            throw new IllegalArgumentException("No participant IDs found in the file!");
        }
        log.info("Imported {} unique participant IDs from {}", unique.size(), filename);
        return unique;
    }
}
