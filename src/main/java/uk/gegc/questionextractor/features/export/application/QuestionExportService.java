package uk.gegc.questionextractor.features.export.application;

import uk.gegc.questionextractor.features.export.domain.model.ExportFile;
import uk.gegc.questionextractor.features.export.domain.model.ExportFormat;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionRecord;

import java.util.List;

public interface QuestionExportService {

    /**
     * Extracts the questions of a {@code .docx} document and renders them in the requested format.
     *
     * @param originalName name of the uploaded or input file; must end with {@code .docx}
     * @param document     document bytes
     * @param format       output format, {@link ExportFormat#JSON} when {@code null}
     */
    ExportFile export(String originalName, byte[] document, ExportFormat format);

    /**
     * Validates the document name and size, then extracts its questions.
     */
    List<QuestionRecord> extract(String originalName, byte[] document);

    /**
     * Renders already extracted questions; the filename is derived from {@code originalName}.
     */
    ExportFile render(String originalName, List<QuestionRecord> questions, ExportFormat format);
}
