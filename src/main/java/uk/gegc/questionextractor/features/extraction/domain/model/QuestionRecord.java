package uk.gegc.questionextractor.features.extraction.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One extracted exam question. Created when a question is flushed and never changed afterwards.
 *
 * @param number  leading question number, or {@code null}
 * @param stem    question text without numbering and marker text
 * @param options option letter to option text, in source order
 * @param key     answer key, or {@code null}
 * @param hint    hint, or {@code null}
 * @param images  images bound to this question, in the order they were found
 */
public record QuestionRecord(
        Integer number,
        String stem,
        Map<String, String> options,
        String key,
        String hint,
        List<QuestionImage> images
) {
    public QuestionRecord {
        QuestionFields normalized = new QuestionFields(number, stem, options, key, hint);
        stem = normalized.stem();
        options = normalized.options();
        images = images != null ? List.copyOf(images) : List.of();
    }

    public static QuestionRecord of(QuestionFields fields, List<QuestionImage> images) {
        return new QuestionRecord(
                fields.number(),
                fields.stem(),
                fields.options(),
                fields.key(),
                fields.hint(),
                images
        );
    }

    public Optional<QuestionImage> image(String filename) {
        return images.stream()
                .filter(image -> image.filename().equals(filename))
                .findFirst();
    }
}
