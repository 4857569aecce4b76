package uk.gegc.questionextractor.features.export.domain.model;

import uk.gegc.questionextractor.features.extraction.domain.model.QuestionRecord;

import java.util.List;

/**
 * Extracted questions handed to an {@code ExportRenderer}.
 *
 * @param questions      questions in document order
 * @param filenamePrefix filename prefix without extension
 */
public record ExportPayload(
    List<QuestionRecord> questions,
    String filenamePrefix
) {
    public static final String DEFAULT_PREFIX = "questions";

    public ExportPayload {
        if (questions == null) {
            throw new IllegalArgumentException("Questions list cannot be null");
        }
        questions = List.copyOf(questions);
        if (filenamePrefix == null || filenamePrefix.isBlank()) {
            filenamePrefix = DEFAULT_PREFIX;
        }
    }
}
