package uk.gegc.questionextractor.features.extraction.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.questionextractor.features.export.application.QuestionExportService;
import uk.gegc.questionextractor.features.export.domain.model.ExportFile;
import uk.gegc.questionextractor.features.export.domain.model.ExportFormat;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Extracts a document given on the command line:
 * <pre>
 * --input=exam.docx --output=exam.json [--format=JSON|ZIP]
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.extractor.cli", name = "enabled", havingValue = "true")
public class QuestionExtractionRunner implements ApplicationRunner {

    static final String INPUT_OPTION = "input";
    static final String OUTPUT_OPTION = "output";
    static final String FORMAT_OPTION = "format";

    private static final int STEM_PREVIEW_LENGTH = 60;

    private final QuestionExportService exportService;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        String input = singleOption(args, INPUT_OPTION);
        String output = singleOption(args, OUTPUT_OPTION);
        if (input == null || output == null) {
            log.error("Usage: --{}=<file.docx> --{}=<file> [--{}=JSON|ZIP]", INPUT_OPTION, OUTPUT_OPTION, FORMAT_OPTION);
            return;
        }
        ExportFormat format;
        try {
            format = parseFormat(singleOption(args, FORMAT_OPTION));
        } catch (IllegalArgumentException ex) {
            log.error("Unknown output format: {}", singleOption(args, FORMAT_OPTION));
            return;
        }
        Path inputPath = Path.of(input);
        if (!Files.isRegularFile(inputPath)) {
            log.error("Input file {} does not exist", inputPath.toAbsolutePath());
            return;
        }

        List<QuestionRecord> questions = exportService.extract(inputPath.getFileName().toString(), Files.readAllBytes(inputPath));
        questions.forEach(QuestionExtractionRunner::logSummary);

        ExportFile file = exportService.render(inputPath.getFileName().toString(), questions, format);
        Path outputPath = Path.of(output);
        Files.write(outputPath, file.content());
        log.info("Wrote {} questions to {}", questions.size(), outputPath.toAbsolutePath());
    }

    private static void logSummary(QuestionRecord question) {
        String stem = question.stem();
        String preview = stem.length() > STEM_PREVIEW_LENGTH ? stem.substring(0, STEM_PREVIEW_LENGTH) + "..." : stem;
        log.info("Question {}: \"{}\" options={} key={} hint={} images={}",
                question.number(),
                preview,
                question.options().size(),
                question.key(),
                question.hint() != null ? "yes" : "no",
                question.images().size());
    }

    private static String singleOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }

    static ExportFormat parseFormat(String value) {
        return value == null ? ExportFormat.JSON : ExportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
