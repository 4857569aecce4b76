package uk.gegc.questionextractor.features.export.api.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Top-level JSON document of an export.
 */
@JsonPropertyOrder({"schemaVersion", "questions"})
public record QuestionExportDocument(
    int schemaVersion,
    List<QuestionExportDto> questions
) {
    public static final int CURRENT_SCHEMA_VERSION = 1;

    public static QuestionExportDocument of(List<QuestionExportDto> questions) {
        return new QuestionExportDocument(CURRENT_SCHEMA_VERSION, questions);
    }
}
