package uk.gegc.questionextractor.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://question-extractor.gegc.uk/docs/errors";

    // ==================== Request Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI MISSING_PARAMETER = URI.create(BASE_URL + "/missing-parameter");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI PAYLOAD_TOO_LARGE = URI.create(BASE_URL + "/payload-too-large");

    // ==================== Document Errors ====================
    public static final URI UNSUPPORTED_FORMAT = URI.create(BASE_URL + "/unsupported-format");
    public static final URI DOCUMENT_EXTRACTION_FAILED = URI.create(BASE_URL + "/document-extraction-failed");

    // ==================== Server Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
