package uk.gegc.questionextractor.features.extraction.infra.docx;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ooxml.util.DocumentHelper;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackagePartName;
import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.PackageRelationshipTypes;
import org.apache.poi.openxml4j.opc.PackagingURIHelper;
import org.apache.poi.openxml4j.opc.TargetMode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;
import uk.gegc.questionextractor.features.extraction.domain.DocumentExtractionException;
import uk.gegc.questionextractor.shared.util.DomUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static uk.gegc.questionextractor.shared.util.OoxmlNamespaces.WORDPROCESSING;

/**
 * Read-only view of a word-processing package: the main body, the main part's relationships
 * (id to resolved part name) and raw part bytes.
 * <p>
 * A package without a main document part or without its relationships part has no body;
 * extraction then produces no questions.
 */
@Slf4j
public final class DocxPackage implements AutoCloseable {

    static final String DEFAULT_MAIN_PART = "/word/document.xml";

    private final OPCPackage opcPackage;
    private final Element body;
    private final Map<String, String> relationships;

    private DocxPackage(OPCPackage opcPackage, Element body, Map<String, String> relationships) {
        this.opcPackage = opcPackage;
        this.body = body;
        this.relationships = relationships;
    }

    public static DocxPackage open(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DocumentExtractionException("Document is empty");
        }
        OPCPackage opcPackage;
        try {
            opcPackage = OPCPackage.open(new ByteArrayInputStream(bytes));
        } catch (Exception ex) {
            throw new DocumentExtractionException("Document is not a readable word-processing package", ex);
        }

        try {
            PackagePart mainPart = findMainPart(opcPackage);
            if (mainPart == null) {
                log.warn("Document has no main part");
                return new DocxPackage(opcPackage, null, Map.of());
            }
            PackagePartName relationshipsPartName = PackagingURIHelper.getRelationshipPartName(mainPart.getPartName());
            if (!opcPackage.containPart(relationshipsPartName)) {
                log.warn("Document has no relationships part for {}", mainPart.getPartName().getName());
                return new DocxPackage(opcPackage, null, Map.of());
            }
            Element body = readBody(mainPart);
            return new DocxPackage(opcPackage, body, readRelationships(mainPart));
        } catch (RuntimeException ex) {
            opcPackage.revert();
            throw ex;
        }
    }

    /**
     * The {@code w:body} element, empty when the package lacks its main or relationships part.
     */
    public Optional<Element> body() {
        return Optional.ofNullable(body);
    }

    /**
     * Direct {@code w:p} children of the body in document order. Other blocks are not paragraphs.
     */
    public List<Element> paragraphs() {
        return body().map(b -> DomUtils.childElements(b, WORDPROCESSING, "p")).orElse(List.of());
    }

    public Map<String, String> relationships() {
        return relationships;
    }

    /**
     * @return the absolute part name (e.g. {@code /word/media/image1.png}) of an internal relationship
     */
    public Optional<String> resolveRelationship(String relationshipId) {
        if (relationshipId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(relationships.get(relationshipId));
    }

    public Optional<byte[]> readPart(String partName) {
        try {
            PackagePart part = opcPackage.getPart(PackagingURIHelper.createPartName(partName));
            if (part == null) {
                log.debug("Part {} is not present in the package", partName);
                return Optional.empty();
            }
            try (InputStream in = part.getInputStream()) {
                return Optional.of(in.readAllBytes());
            }
        } catch (InvalidFormatException | IOException ex) {
            log.warn("Could not read part {}: {}", partName, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void close() {
        opcPackage.revert();
    }

    private static PackagePart findMainPart(OPCPackage opcPackage) {
        for (String type : List.of(PackageRelationshipTypes.CORE_DOCUMENT, PackageRelationshipTypes.STRICT_CORE_DOCUMENT)) {
            List<PackagePart> parts = opcPackage.getPartsByRelationshipType(type);
            if (!parts.isEmpty()) {
                return parts.get(0);
            }
        }
        try {
            return opcPackage.getPart(PackagingURIHelper.createPartName(DEFAULT_MAIN_PART));
        } catch (InvalidFormatException ex) {
            throw new DocumentExtractionException("Invalid main part name", ex);
        }
    }

    private static Element readBody(PackagePart mainPart) {
        try (InputStream in = mainPart.getInputStream()) {
            Document document = DocumentHelper.readDocument(in);
            Element root = document.getDocumentElement();
            return DomUtils.firstChild(root, WORDPROCESSING, "body").orElse(null);
        } catch (IOException | SAXException ex) {
            throw new DocumentExtractionException("Main document part is not well-formed XML", ex);
        }
    }

    private static Map<String, String> readRelationships(PackagePart mainPart) {
        Map<String, String> targets = new LinkedHashMap<>();
        try {
            for (PackageRelationship relationship : mainPart.getRelationships()) {
                if (relationship.getTargetMode() == TargetMode.EXTERNAL) {
                    continue;
                }
                URI target = PackagingURIHelper.resolvePartUri(
                        mainPart.getPartName().getURI(), relationship.getTargetURI());
                targets.put(relationship.getId(), target.getPath());
            }
        } catch (InvalidFormatException ex) {
            throw new DocumentExtractionException("Document relationships cannot be read", ex);
        }
        return Collections.unmodifiableMap(targets);
    }
}
