package org.surveyworkbench.service.extraction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.surveyworkbench.models.dto.CompletenessReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CompletenessCheckerTest {

    @TempDir
    Path source;

    private CompletenessChecker checker;

    @BeforeEach
    void setUp() {
        checker = new CompletenessChecker(new ExtractDataLocator(ExtractDataLocator.DEFAULT_SUFFIX));
    }

    private void present(String participantId, String... surveys) throws IOException {
        Path folder = Files.createDirectories(source.resolve(participantId));
        for (String survey : surveys) {
            Files.writeString(folder.resolve(participantId + "_" + survey + "_Extract Data.csv"), "");
        }
    }

    @Test
    void twoOfThreeIsIncomplete() throws IOException {
        present("P001", "A", "B");

        CompletenessReport report = checker.check("P001", source, 3);

        assertThat(report.complete()).isFalse();
        assertThat(report.issues()).containsExactly("Expected 3 CSV files, found 2");
        assertThat(report.files()).hasSize(2);
    }

    @Test
    void threeOfThreeIsComplete() throws IOException {
        present("P001", "A", "B", "C");

        CompletenessReport report = checker.check("P001", source, 3);

        assertThat(report.complete()).isTrue();
        assertThat(report.issues()).isEmpty();
        assertThat(report.files()).containsExactly(
                "P001_A_Extract Data.csv", "P001_B_Extract Data.csv", "P001_C_Extract Data.csv");
    }

    @Test
    void emptyFilesStillCount() throws IOException {
        present("P001", "A");

        assertThat(checker.check("P001", source, 1).complete()).isTrue();
    }

    @Test
    void noMatchingFilesIsIncompleteEvenWithoutExpectation() throws IOException {
        Path folder = Files.createDirectories(source.resolve("P001"));
        Files.writeString(folder.resolve("P001_A.pdf"), "");

        CompletenessReport report = checker.check("P001", source, null);

        assertThat(report.complete()).isFalse();
        assertThat(report.issues()).containsExactly("No Extract Data CSV files found");
    }

    @Test
    void unknownExpectationOnlyNeedsOneFile() throws IOException {
        present("P001", "A");

        assertThat(checker.check("P001", source, null).complete()).isTrue();
        assertThat(checker.check("P001", source, 0).complete()).isTrue();
    }

    @Test
    void missingFolderIsReported() {
        CompletenessReport report = checker.check("P404", source, 2);

        assertThat(report.complete()).isFalse();
        assertThat(report.issues()).hasSize(1);
        assertThat(report.issues().get(0)).startsWith("Folder not found: ");
    }
}
