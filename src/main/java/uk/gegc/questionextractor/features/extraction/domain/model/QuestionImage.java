package uk.gegc.questionextractor.features.extraction.domain.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Image bytes bound to a question under a synthetic filename ({@code image_<n>.<ext>}).
 * Equality compares content, so two extractions of the same document compare equal.
 */
public record QuestionImage(
        String filename,
        byte[] content
) {
    public QuestionImage {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Image filename cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("Image content cannot be null");
        }
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof QuestionImage that)) {
            return false;
        }
        return filename.equals(that.filename) && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, Arrays.hashCode(content));
    }

    @Override
    public String toString() {
        return "QuestionImage[filename=" + filename + ", size=" + content.length + "]";
    }
}
