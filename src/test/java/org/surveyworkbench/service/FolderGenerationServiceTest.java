package org.surveyworkbench.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.surveyworkbench.models.dto.BatchResult;
import org.surveyworkbench.models.dto.FolderGenerationResult;
import org.surveyworkbench.models.dto.QuestionnaireSpec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FolderGenerationServiceTest {

    @TempDir
    Path workspace;

    private Path target;
    private Path template;
    private FolderGenerationService service;

    @BeforeEach
    void setUp() throws IOException {
        target = Files.createDirectories(workspace.resolve("participants"));
        template = Files.writeString(workspace.resolve("phq9_template.pdf"), "template");
        service = new FolderGenerationService(new ParticipantListService());
    }

    private List<String> filesIn(Path folder) throws IOException {
        try (Stream<Path> stream = Files.list(folder)) {
            return stream.map(path -> path.getFileName().toString()).sorted().toList();
        }
    }

    @Nested
    @DisplayName("copy naming")
    class CopyNaming {

        @Test
        void threeCopiesAreNumbered() throws IOException {
            FolderGenerationResult result = service.generate("P001", target.toString(),
                    List.of(new QuestionnaireSpec("PHQ9", template.toString(), 3)));

            assertThat(filesIn(target.resolve("P001")))
                    .containsExactly("P001_PHQ91.pdf", "P001_PHQ92.pdf", "P001_PHQ93.pdf");
            assertThat(result.files()).hasSize(3);
            assertThat(Files.readString(target.resolve("P001").resolve("P001_PHQ92.pdf"))).isEqualTo("template");
        }

        @Test
        void singleCopyHasNoSuffix() throws IOException {
            service.generate("P001", target.toString(), List.of(new QuestionnaireSpec("PHQ9", template.toString(), 1)));

            assertThat(filesIn(target.resolve("P001"))).containsExactly("P001_PHQ9.pdf");
        }

        @Test
        void missingOrInvalidCountMeansOneCopy() throws IOException {
            service.generate("P001", target.toString(), List.of(
                    new QuestionnaireSpec("A", template.toString(), null),
                    new QuestionnaireSpec("B", template.toString(), 0)));

            assertThat(filesIn(target.resolve("P001"))).containsExactly("P001_A.pdf", "P001_B.pdf");
        }

        @Test
        void blankNameFallsBackToPosition() throws IOException {
            service.generate("P001", target.toString(), List.of(
                    new QuestionnaireSpec("A", template.toString(), 1),
                    new QuestionnaireSpec("  ", template.toString(), 1)));

            assertThat(filesIn(target.resolve("P001"))).containsExactly("P001_A.pdf", "P001_survey_2.pdf");
        }

        @Test
        void rowsWithoutTemplateAreSkipped() throws IOException {
            service.generate("P001", target.toString(), List.of(
                    new QuestionnaireSpec("A", "", 2),
                    new QuestionnaireSpec("B", template.toString(), 1)));

            assertThat(filesIn(target.resolve("P001"))).containsExactly("P001_B.pdf");
        }

        @Test
        void copyNameFormat() {
            assertThat(FolderGenerationService.copyName("P9", "GAD", 1, 1, ".docx")).isEqualTo("P9_GAD.docx");
            assertThat(FolderGenerationService.copyName("P9", "GAD", 2, 4, ".docx")).isEqualTo("P9_GAD2.docx");
            assertThat(FolderGenerationService.copyName("P9", "GAD", 1, 2, "")).isEqualTo("P9_GAD1");
        }
    }

    @Test
    @DisplayName("re-generating replaces every earlier file")
    void regenerationReplacesFolder() throws IOException {
        Path folder = Files.createDirectories(target.resolve("P001").resolve("nested"));
        Files.writeString(folder.resolve("stale.txt"), "old");
        Files.writeString(target.resolve("P001").resolve("P001_OLD.pdf"), "old");

        service.generate("P001", target.toString(), List.of(new QuestionnaireSpec("PHQ9", template.toString(), 1)));

        assertThat(filesIn(target.resolve("P001"))).containsExactly("P001_PHQ9.pdf");
    }

    @Nested
    @DisplayName("input validation")
    class Validation {

        @Test
        void emptyParticipantId() {
            assertThatThrownBy(() -> service.generate(" ", target.toString(),
                    List.of(new QuestionnaireSpec("A", template.toString(), 1))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Please enter a participant ID!");
        }

        @Test
        void missingTargetFolder() {
            assertThatThrownBy(() -> service.generate("P001", null,
                    List.of(new QuestionnaireSpec("A", template.toString(), 1))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Please select a target folder!");
        }

        @Test
        void noQuestionnaires() {
            assertThatThrownBy(() -> service.generate("P001", target.toString(), List.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Please configure questionnaires!");
        }

        @Test
        void missingTemplateLeavesExistingFolderUntouched() throws IOException {
            Path existing = Files.createDirectories(target.resolve("P001"));
            Files.writeString(existing.resolve("keep.pdf"), "data");

            assertThatThrownBy(() -> service.generate("P001", target.toString(),
                    List.of(new QuestionnaireSpec("A", workspace.resolve("gone.pdf").toString(), 1))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Template file not found");
            assertThat(existing.resolve("keep.pdf")).exists();
        }

        @Test
        void pathSeparatorsInIdAreRejected() {
            assertThatThrownBy(() -> service.generate("../P001", target.toString(),
                    List.of(new QuestionnaireSpec("A", template.toString(), 1))))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Batch {

        @Test
        void generatesEveryParticipant() throws IOException {
            BatchResult result = service.generateBatch("P001, P002\nP003", target.toString(),
                    List.of(new QuestionnaireSpec("A", template.toString(), 1)));

            assertThat(result.total()).isEqualTo(3);
            assertThat(result.succeeded()).containsExactly("P001", "P002", "P003");
            assertThat(result.failed()).isEmpty();
            assertThat(filesIn(target)).containsExactly("P001", "P002", "P003");
        }

        @Test
        void oneFailureDoesNotStopTheBatch() throws IOException {
            BatchResult result = service.generateBatch("P001\nbad/id\nP003", target.toString(),
                    List.of(new QuestionnaireSpec("A", template.toString(), 1)));

            assertThat(result.succeeded()).containsExactly("P001", "P003");
            assertThat(result.failed()).hasSize(1);
            assertThat(result.failed().get(0)).startsWith("bad/id: ");
        }

        @Test
        void emptyListIsAnInputError() {
            assertThatThrownBy(() -> service.generateBatch(" , \n", target.toString(),
                    List.of(new QuestionnaireSpec("A", template.toString(), 1))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Please enter at least one participant ID!");
        }
    }
}
