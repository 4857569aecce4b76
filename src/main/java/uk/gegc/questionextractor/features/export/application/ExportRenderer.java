package uk.gegc.questionextractor.features.export.application;

import uk.gegc.questionextractor.features.export.domain.model.ExportFile;
import uk.gegc.questionextractor.features.export.domain.model.ExportFormat;
import uk.gegc.questionextractor.features.export.domain.model.ExportPayload;

/**
 * SPI for rendering extracted questions into downloadable files.
 */
public interface ExportRenderer {
    boolean supports(ExportFormat format);

    ExportFile render(ExportPayload payload);
}
