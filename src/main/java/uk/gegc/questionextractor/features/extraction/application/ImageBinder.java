package uk.gegc.questionextractor.features.extraction.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import uk.gegc.questionextractor.features.extraction.config.ExtractorProperties;
import uk.gegc.questionextractor.features.extraction.domain.model.ExtractionContext;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionImage;
import uk.gegc.questionextractor.features.extraction.infra.docx.DocxPackage;
import uk.gegc.questionextractor.shared.util.DomUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static uk.gegc.questionextractor.shared.util.OoxmlNamespaces.DRAWING;
import static uk.gegc.questionextractor.shared.util.OoxmlNamespaces.RELATIONSHIPS;
import static uk.gegc.questionextractor.shared.util.OoxmlNamespaces.VML;
import static uk.gegc.questionextractor.shared.util.OoxmlNamespaces.WORDPROCESSING;

/**
 * Binds the pictures of a paragraph to the open question and produces their inline markers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImageBinder {

    static final String BARE_MARKER = "<img/>";

    private final ExtractorProperties properties;

    /**
     * Reads every picture referenced by the paragraph, registers its bytes under the next synthetic
     * filename for {@code questionNumber} and returns one marker per picture.
     * Unresolvable references produce nothing; without a question number a bare marker is
     * returned and no bytes are kept.
     */
    public List<String> bind(Element paragraph, DocxPackage docx, ExtractionContext context, Integer questionNumber) {
        List<String> markers = new ArrayList<>();
        for (String relationshipId : imageReferences(paragraph)) {
            Optional<String> target = docx.resolveRelationship(relationshipId);
            if (target.isEmpty()) {
                log.debug("Image relationship {} is not mapped, skipping", relationshipId);
                continue;
            }
            if (questionNumber == null) {
                markers.add(BARE_MARKER);
                continue;
            }
            Optional<byte[]> content = docx.readPart(target.get());
            if (content.isEmpty()) {
                continue;
            }
            String filename = "image_" + context.nextImageIndex() + "." + extensionOf(target.get());
            context.bindImage(questionNumber, new QuestionImage(filename, content.get()));
            markers.add("<img src=\"" + filename + "\"/>");
        }
        return markers;
    }

    /**
     * Relationship ids of {@code a:blip} elements in drawings and {@code v:imagedata} elements in
     * legacy pictures, in document order. Previews of embedded objects are not pictures, and the
     * {@code mc:Fallback} copy of an alternate-content picture is not counted again.
     */
    List<String> imageReferences(Element paragraph) {
        List<String> ids = new ArrayList<>();
        collect(paragraph, ids);
        return ids;
    }

    private void collect(Element element, List<String> ids) {
        for (Element child : DomUtils.childElements(element)) {
            if (DomUtils.is(child, WORDPROCESSING, "object") || DomUtils.isFallback(child)) {
                continue;
            }
            if (DomUtils.is(child, WORDPROCESSING, "drawing")) {
                for (Element blip : DomUtils.descendants(child, DRAWING, "blip")) {
                    addIfPresent(ids, DomUtils.attribute(blip, RELATIONSHIPS, "embed"));
                }
            } else if (DomUtils.is(child, WORDPROCESSING, "pict")) {
                for (Element imageData : DomUtils.descendants(child, VML, "imagedata")) {
                    addIfPresent(ids, DomUtils.attribute(imageData, RELATIONSHIPS, "id"));
                }
            } else {
                collect(child, ids);
            }
        }
    }

    private static void addIfPresent(List<String> ids, String id) {
        if (id != null && !id.isBlank()) {
            ids.add(id);
        }
    }

    private String extensionOf(String partName) {
        String name = partName.substring(partName.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return properties.getDefaultImageExtension();
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
