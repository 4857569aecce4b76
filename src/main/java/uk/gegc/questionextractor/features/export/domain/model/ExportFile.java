package uk.gegc.questionextractor.features.export.domain.model;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/**
 * A rendered question export: the download filename, its media type and the complete bytes.
 * Exports are built in memory from one document, so the content is always available.
 */
public record ExportFile(
    String filename,
    String contentType,
    byte[] content
) {
    public ExportFile {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or blank");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("Content type cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("Content cannot be null");
        }
    }

    public InputStream openStream() {
        return new ByteArrayInputStream(content);
    }

    public long contentLength() {
        return content.length;
    }
}
