package uk.gegc.questionextractor.features.export.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.questionextractor.features.export.api.dto.QuestionExportDocument;
import uk.gegc.questionextractor.features.export.api.dto.QuestionExportDto;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionImage;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionRecord;

import java.util.List;

/**
 * Maps extracted questions to the versioned export shape.
 */
@Component
public class QuestionExportAssembler {

    public QuestionExportDto toExportDto(QuestionRecord record) {
        List<String> images = record.images().stream()
                .map(QuestionImage::filename)
                .toList();
        return new QuestionExportDto(
                record.number(),
                record.stem(),
                record.options(),
                record.key(),
                record.hint(),
                images
        );
    }

    public QuestionExportDocument toExportDocument(List<QuestionRecord> records) {
        return QuestionExportDocument.of(records.stream().map(this::toExportDto).toList());
    }
}
