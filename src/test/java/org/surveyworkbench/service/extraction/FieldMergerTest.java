package org.surveyworkbench.service.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.surveyworkbench.models.entity.ParticipantRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class FieldMergerTest {

    @TempDir
    Path folder;

    private final ExtractDataLocator locator = new ExtractDataLocator(ExtractDataLocator.DEFAULT_SUFFIX);
    private final FieldMerger merger = new FieldMerger(locator, FieldMerger.DEFAULT_IGNORED_COLUMN);

    private Path extract(String name, String content) throws IOException {
        Path file = folder.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("disjoint surveys merge into the exact union of prefixed fields")
    void mergesDisjointSurveys() throws IOException {
        Path phq = extract("P001_PHQ9_Extract Data.csv", "File,q1,q2\nphq.pdf,3,1\n");
        Path gad = extract("P001_GAD7_Extract Data.csv", "File,q1,total\ngad.pdf,2,11\n");

        ParticipantRecord record = merger.merge("P001", locator.locate(folder));

        assertThat(record.getParticipantId()).isEqualTo("P001");
        assertThat(record.getFields()).containsExactly(
                entry("GAD7_q1", "2"),
                entry("GAD7_total", "11"),
                entry("PHQ9_q1", "3"),
                entry("PHQ9_q2", "1"));
        assertThat(phq).exists();
        assertThat(gad).exists();
    }

    @Test
    @DisplayName("the File column is never merged")
    void skipsIgnoredColumn() throws IOException {
        Path file = extract("P001_BDI_Extract Data.csv", "q1,File,q2\n1,bdi.pdf,2\n");

        ParticipantRecord record = merger.merge("P001", List.of(file));

        assertThat(record.getFields()).containsOnlyKeys("BDI_q1", "BDI_q2");
    }

    @Test
    @DisplayName("colliding prefixed keys keep the value read last")
    void lastWriteWins() throws IOException {
        Path first = extract("P001_A_Extract Data.csv", "x_y\n1\n");
        Path second = extract("P001_A_x_Extract Data.csv", "y\n2\n");

        ParticipantRecord record = merger.merge("P001", List.of(first, second));

        assertThat(record.getFields()).containsOnlyKeys("A_x_y");
        assertThat(record.getField("A_x_y")).isEqualTo("2");
    }

    @Test
    void headerOnlyAndEmptyFilesContributeNothing() throws IOException {
        Path headerOnly = extract("P001_A_Extract Data.csv", "File,q1\n");
        Path empty = extract("P001_B_Extract Data.csv", "");

        ParticipantRecord record = merger.merge("P001", List.of(headerOnly, empty));

        assertThat(record.getFields()).isEmpty();
        assertThat(record.toRow()).containsOnlyKeys(ParticipantRecord.PARTICIPANT_ID);
    }

    @Test
    void stripsByteOrderMarkFromFirstHeader() throws IOException {
        Path file = extract("P001_A_Extract Data.csv", "\uFEFFq1,q2\n5,6\n");

        ParticipantRecord record = merger.merge("P001", List.of(file));

        assertThat(record.getFields()).containsOnlyKeys("A_q1", "A_q2");
    }

    @Test
    void quotedValuesKeepCommas() throws IOException {
        Path file = extract("P001_Notes_Extract Data.csv", "comment\n\"late, rescheduled\"\n");

        ParticipantRecord record = merger.merge("P001", List.of(file));

        assertThat(record.getField("Notes_comment")).isEqualTo("late, rescheduled");
    }

    @Test
    void shortRowKeepsTrailingColumnsAsEmpty() throws IOException {
        Path file = extract("P001_A_Extract Data.csv", "File,q1,q2,q3\nx.pdf,1\n");

        ParticipantRecord record = merger.merge("P001", List.of(file));

        assertThat(record.getFields()).containsExactly(entry("A_q1", "1"), entry("A_q2", ""), entry("A_q3", ""));
    }

    @Test
    void unreadableFileFails() {
        Path missing = folder.resolve("P001_A_Extract Data.csv");

        assertThatThrownBy(() -> merger.merge("P001", List.of(missing)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("P001_A_Extract Data.csv");
    }
}
