package uk.gegc.questionextractor.features.export.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.questionextractor.features.export.application.ExportRenderer;
import uk.gegc.questionextractor.features.export.application.QuestionExportService;
import uk.gegc.questionextractor.features.export.domain.model.ExportFile;
import uk.gegc.questionextractor.features.export.domain.model.ExportFormat;
import uk.gegc.questionextractor.features.export.domain.model.ExportPayload;
import uk.gegc.questionextractor.features.extraction.application.QuestionExtractionService;
import uk.gegc.questionextractor.features.extraction.config.ExtractorProperties;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionRecord;
import uk.gegc.questionextractor.shared.exception.UnsupportedFormatException;
import uk.gegc.questionextractor.shared.exception.ValidationException;

import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionExportServiceImpl implements QuestionExportService {

    static final String DOCX_EXTENSION = ".docx";

    private final QuestionExtractionService extractionService;
    private final List<ExportRenderer> renderers;
    private final ExtractorProperties properties;

    @Override
    public ExportFile export(String originalName, byte[] document, ExportFormat format) {
        return render(originalName, extract(originalName, document), format);
    }

    @Override
    public List<QuestionRecord> extract(String originalName, byte[] document) {
        if (document == null || document.length == 0) {
            throw new ValidationException("Uploaded document is empty");
        }
        if (originalName == null || !originalName.toLowerCase(Locale.ROOT).endsWith(DOCX_EXTENSION)) {
            throw new UnsupportedFormatException(String.valueOf(originalName), DOCX_EXTENSION);
        }
        if (document.length > properties.getMaxDocumentSizeBytes()) {
            throw new ValidationException(String.format(
                    "Document size %d bytes exceeds the limit of %d bytes",
                    document.length, properties.getMaxDocumentSizeBytes()));
        }
        return extractionService.extract(document);
    }

    @Override
    public ExportFile render(String originalName, List<QuestionRecord> questions, ExportFormat format) {
        ExportFormat effectiveFormat = format != null ? format : ExportFormat.JSON;
        ExportFile result = resolveRenderer(effectiveFormat)
                .render(new ExportPayload(questions, filenamePrefix(originalName)));

        log.info("Question export completed: file={}, format={}, questionCount={}, bytes={}",
                originalName, effectiveFormat, questions.size(), result.contentLength());
        return result;
    }

    static String filenamePrefix(String originalName) {
        if (originalName == null) {
            return null;
        }
        String name = originalName.substring(Math.max(originalName.lastIndexOf('/'), originalName.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private ExportRenderer resolveRenderer(ExportFormat format) {
        return renderers.stream()
                .filter(r -> r.supports(format))
                .findFirst()
                .orElseThrow(() -> new UnsupportedFormatException("Unsupported export format: " + format));
    }
}
