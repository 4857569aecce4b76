package uk.gegc.questionextractor.shared.exception;

/**
 * Exception thrown when an input document or a requested output format is not supported.
 */
public class UnsupportedFormatException extends RuntimeException {

    public UnsupportedFormatException(String message) {
        super(message);
    }

    public UnsupportedFormatException(String filename, String supportedTypes) {
        super(String.format("Unsupported file '%s'. Supported types: %s", filename, supportedTypes));
    }
}
