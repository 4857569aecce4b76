package uk.gegc.questionextractor.features.export.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * Export DTO for one extracted question.
 * {@code number}, {@code key} and {@code hint} are written as {@code null} when absent.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"number", "qstem", "options", "key", "hint", "images"})
public record QuestionExportDto(
    Integer number,
    @JsonProperty("qstem") String stem,
    Map<String, String> options,
    String key,
    String hint,
    List<String> images
) {
}
