package uk.gegc.questionextractor.features.extraction.domain;

/**
 * Exception thrown when the uploaded bytes are not a readable word-processing package.
 */
public class DocumentExtractionException extends RuntimeException {

    public DocumentExtractionException(String message) {
        super(message);
    }

    public DocumentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
