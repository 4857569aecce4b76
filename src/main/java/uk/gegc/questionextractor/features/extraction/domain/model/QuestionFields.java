package uk.gegc.questionextractor.features.extraction.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Text fields split out of one accumulated question.
 *
 * @param number  leading question number, or {@code null} when the text has none
 * @param stem    question text without number, options, key and hint
 * @param options option letter to option text, in source order
 * @param key     answer key, or {@code null}
 * @param hint    hint, or {@code null}
 */
public record QuestionFields(
        Integer number,
        String stem,
        Map<String, String> options,
        String key,
        String hint
) {
    public QuestionFields {
        stem = stem != null ? stem : "";
        options = options != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(options))
                : Map.of();
    }
}
