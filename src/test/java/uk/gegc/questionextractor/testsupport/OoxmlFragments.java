package uk.gegc.questionextractor.testsupport;

import org.apache.poi.ooxml.util.DocumentHelper;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Parses WordprocessingML snippets into namespace-aware DOM elements.
 */
public final class OoxmlFragments {

    private static final String NAMESPACES = " xmlns:w=\"http://schemas.openxmlformats.org/wordprocessingml/2006/main\""
            + " xmlns:r=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships\""
            + " xmlns:m=\"http://schemas.openxmlformats.org/officeDocument/2006/math\""
            + " xmlns:a=\"http://schemas.openxmlformats.org/drawingml/2006/main\""
            + " xmlns:pic=\"http://schemas.openxmlformats.org/drawingml/2006/picture\""
            + " xmlns:wp=\"http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing\""
            + " xmlns:v=\"urn:schemas-microsoft-com:vml\""
            + " xmlns:o=\"urn:schemas-microsoft-com:office:office\""
            + " xmlns:wps=\"http://schemas.microsoft.com/office/word/2010/wordprocessingShape\""
            + " xmlns:mc=\"http://schemas.openxmlformats.org/markup-compatibility/2006\"";

    private OoxmlFragments() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * A {@code w:p} element holding the given runs.
     */
    public static Element paragraph(String... runs) {
        return parse("<w:p" + NAMESPACES + ">" + String.join("", runs) + "</w:p>");
    }

    /**
     * An {@code m:oMath} element holding the given content.
     */
    public static Element officeMath(String content) {
        return parse("<m:oMath" + NAMESPACES + ">" + content + "</m:oMath>");
    }

    private static Element parse(String xml) {
        try {
            return DocumentHelper.readDocument(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)))
                    .getDocumentElement();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (SAXException e) {
            throw new IllegalArgumentException("Invalid XML fragment: " + xml, e);
        }
    }
}
