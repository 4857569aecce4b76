package uk.gegc.questionextractor.features.extraction.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.springframework.boot.DefaultApplicationArguments;
import uk.gegc.questionextractor.BaseUnitTest;
import uk.gegc.questionextractor.features.export.application.QuestionExportService;
import uk.gegc.questionextractor.features.export.domain.model.ExportFile;
import uk.gegc.questionextractor.features.export.domain.model.ExportFormat;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionRecord;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("QuestionExtractionRunner Tests")
class QuestionExtractionRunnerTest extends BaseUnitTest {

    @Mock
    private QuestionExportService exportService;

    @TempDir
    Path tempDir;

    private QuestionExtractionRunner runner;

    @BeforeEach
    void setUp() {
        runner = new QuestionExtractionRunner(exportService);
    }

    @Test
    @DisplayName("run: extracts the input and writes the rendered file")
    void run_writesOutput() throws Exception {
        Path input = Files.write(tempDir.resolve("exam.docx"), new byte[]{'P', 'K'});
        Path output = tempDir.resolve("exam.zip");
        List<QuestionRecord> questions = List.of(
                new QuestionRecord(1, "x".repeat(80), Map.of("a", "1"), "a", "hint", List.of()));
        byte[] rendered = "zip-bytes".getBytes(StandardCharsets.UTF_8);
        when(exportService.extract(eq("exam.docx"), any(byte[].class))).thenReturn(questions);
        when(exportService.render("exam.docx", questions, ExportFormat.ZIP))
                .thenReturn(new ExportFile("exam.zip", "application/zip", rendered));

        runner.run(new DefaultApplicationArguments(
                "--input=" + input, "--output=" + output, "--format=zip"));

        assertThat(output).hasBinaryContent(rendered);
    }

    @Test
    @DisplayName("run: missing output does nothing")
    void run_missingOutput_skips() throws Exception {
        runner.run(new DefaultApplicationArguments("--input=exam.docx"));

        verifyNoInteractions(exportService);
    }

    @Test
    @DisplayName("run: unknown format does nothing")
    void run_unknownFormat_skips() throws Exception {
        Path input = Files.write(tempDir.resolve("exam.docx"), new byte[]{'P', 'K'});

        runner.run(new DefaultApplicationArguments(
                "--input=" + input, "--output=" + tempDir.resolve("out"), "--format=pdf"));

        verifyNoInteractions(exportService);
    }

    @Test
    @DisplayName("run: missing input file does nothing")
    void run_missingInput_skips() throws Exception {
        Path output = tempDir.resolve("out.json");

        runner.run(new DefaultApplicationArguments(
                "--input=" + tempDir.resolve("absent.docx"), "--output=" + output));

        verifyNoInteractions(exportService);
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("run: empty question list still renders JSON by default")
    void run_defaultFormat_json() throws Exception {
        Path input = Files.write(tempDir.resolve("exam.docx"), new byte[]{'P', 'K'});
        Path output = tempDir.resolve("exam.json");
        when(exportService.extract(eq("exam.docx"), any(byte[].class))).thenReturn(List.of());
        when(exportService.render("exam.docx", List.of(), ExportFormat.JSON))
                .thenReturn(new ExportFile("exam.json", "application/json", "{}".getBytes(StandardCharsets.UTF_8)));

        runner.run(new DefaultApplicationArguments("--input=" + input, "--output=" + output));

        verify(exportService).render("exam.docx", List.of(), ExportFormat.JSON);
        assertThat(output).hasContent("{}");
    }

    @Test
    @DisplayName("parseFormat: case-insensitive, JSON when absent")
    void parseFormat_variants() {
        assertThat(QuestionExtractionRunner.parseFormat(null)).isEqualTo(ExportFormat.JSON);
        assertThat(QuestionExtractionRunner.parseFormat(" Zip ")).isEqualTo(ExportFormat.ZIP);
        assertThatThrownBy(() -> QuestionExtractionRunner.parseFormat("xml"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
