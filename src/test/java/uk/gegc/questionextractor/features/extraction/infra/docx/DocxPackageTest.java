package uk.gegc.questionextractor.features.extraction.infra.docx;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.questionextractor.features.extraction.domain.DocumentExtractionException;
import uk.gegc.questionextractor.testsupport.DocxTestDocuments;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.questionextractor.testsupport.DocxTestDocuments.HYPERLINK_RELATIONSHIP;
import static uk.gegc.questionextractor.testsupport.DocxTestDocuments.text;

@DisplayName("DocxPackage")
class DocxPackageTest {

    @Test
    @DisplayName("open: empty input is rejected")
    void open_empty() {
        assertThatThrownBy(() -> DocxPackage.open(null))
                .isInstanceOf(DocumentExtractionException.class)
                .hasMessage("Document is empty");
        assertThatThrownBy(() -> DocxPackage.open(new byte[0]))
                .isInstanceOf(DocumentExtractionException.class);
    }

    @Test
    @DisplayName("open: bytes that are not a package are rejected")
    void open_notAPackage() {
        assertThatThrownBy(() -> DocxPackage.open("This is not a ZIP file".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(DocumentExtractionException.class)
                .hasMessageContaining("not a readable");
    }

    @Test
    @DisplayName("open: malformed body XML is rejected")
    void open_malformedBody() {
        byte[] docx = DocxTestDocuments.builder().block("<w:p><w:r>").build();

        assertThatThrownBy(() -> DocxPackage.open(docx))
                .isInstanceOf(DocumentExtractionException.class)
                .hasMessageContaining("well-formed");
    }

    @Test
    @DisplayName("a package without document relationships has no body")
    void open_withoutRelationships() {
        byte[] docx = DocxTestDocuments.builder()
                .paragraph(text("1. Question"))
                .withoutDocumentRelationships()
                .build();

        try (DocxPackage document = DocxPackage.open(docx)) {
            assertThat(document.body()).isEmpty();
            assertThat(document.paragraphs()).isEmpty();
        }
    }

    @Test
    @DisplayName("paragraphs: only direct body paragraphs, tables are skipped")
    void paragraphs_directChildrenOnly() {
        byte[] docx = DocxTestDocuments.builder()
                .paragraph(text("first"))
                .block("<w:tbl><w:tr><w:tc><w:p>" + text("in table") + "</w:p></w:tc></w:tr></w:tbl>")
                .paragraph(text("second"))
                .build();

        try (DocxPackage document = DocxPackage.open(docx)) {
            assertThat(document.paragraphs())
                    .extracting(paragraph -> paragraph.getTextContent())
                    .containsExactly("first", "second");
        }
    }

    @Test
    @DisplayName("relationships resolve to absolute part names; external ones are left out")
    void relationships_resolved() {
        byte[] content = {4, 2};
        byte[] docx = DocxTestDocuments.builder()
                .paragraph(text("x"))
                .image("rId5", "media/image1.png", content)
                .externalRelationship("rId6", HYPERLINK_RELATIONSHIP, "https://example.org")
                .build();

        try (DocxPackage document = DocxPackage.open(docx)) {
            assertThat(document.resolveRelationship("rId5")).contains("/word/media/image1.png");
            assertThat(document.resolveRelationship("rId6")).isEmpty();
            assertThat(document.resolveRelationship(null)).isEmpty();
            assertThat(document.readPart("/word/media/image1.png")).hasValueSatisfying(
                    bytes -> assertThat(bytes).containsExactly(content));
            assertThat(document.readPart("/word/media/missing.png")).isEmpty();
        }
    }
}
