package uk.gegc.questionextractor.shared.util;

/**
 * Namespace URIs of the OOXML vocabularies the extractor reads.
 */
public final class OoxmlNamespaces {

    public static final String WORDPROCESSING = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String MATH = "http://schemas.openxmlformats.org/officeDocument/2006/math";
    public static final String RELATIONSHIPS = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    public static final String DRAWING = "http://schemas.openxmlformats.org/drawingml/2006/main";
    public static final String OFFICE = "urn:schemas-microsoft-com:office:office";
    public static final String VML = "urn:schemas-microsoft-com:vml";
    public static final String MARKUP_COMPATIBILITY = "http://schemas.openxmlformats.org/markup-compatibility/2006";

    private OoxmlNamespaces() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
