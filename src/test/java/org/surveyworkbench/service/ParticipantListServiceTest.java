package org.surveyworkbench.service;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParticipantListServiceTest {

    private final ParticipantListService service = new ParticipantListService();

    private static InputStream content(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void parsesCommaAndNewlineSeparatedIds() {
        assertThat(service.parse("P001, P002\n\n P003 ,,P001\n"))
                .containsExactly("P001", "P002", "P003", "P001");
    }

    @Test
    void nullTextIsEmpty() {
        assertThat(service.parse(null)).isEmpty();
    }

    @Test
    void importsCsvCellsWithoutRepeats() throws IOException {
        String csv = "P001,P002\n P003 ,\n\"P002\",P004\n";

        assertThat(service.importList("ids.CSV", content(csv)))
                .containsExactly("P001", "P002", "P003", "P004");
    }

    @Test
    void importsTextFile() throws IOException {
        assertThat(service.importList("ids.txt", content("P001\r\nP002,P003\nP001\n")))
                .containsExactly("P001", "P002", "P003");
    }

    @Test
    void emptyImportIsAnInputError() {
        assertThatThrownBy(() -> service.importList("ids.txt", content(" \n , \n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No participant IDs found in the file!");
    }
}
