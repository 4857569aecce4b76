package uk.gegc.questionextractor.features.extraction.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Paragraph-level chunks of the question currently being read.
 */
public class QuestionBuffer {

    private final List<String> chunks = new ArrayList<>();

    public void start(String firstChunk) {
        chunks.clear();
        append(firstChunk);
    }

    public void append(String chunk) {
        if (chunk != null && !chunk.isEmpty()) {
            chunks.add(chunk);
        }
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public void clear() {
        chunks.clear();
    }

    /**
     * Chunks joined with single spaces, trimmed.
     */
    public String joinedText() {
        return String.join(" ", chunks).trim();
    }
}
