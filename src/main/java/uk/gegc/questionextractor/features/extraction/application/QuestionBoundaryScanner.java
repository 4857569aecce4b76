package uk.gegc.questionextractor.features.extraction.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import uk.gegc.questionextractor.features.extraction.config.ExtractorProperties;
import uk.gegc.questionextractor.features.extraction.domain.model.ExtractionContext;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionBuffer;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionFields;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionImage;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionRecord;
import uk.gegc.questionextractor.features.extraction.infra.docx.DocxPackage;
import uk.gegc.questionextractor.features.math.application.EquationNormalizer;
import uk.gegc.questionextractor.shared.util.DomUtils;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static uk.gegc.questionextractor.shared.util.OoxmlNamespaces.MATH;
import static uk.gegc.questionextractor.shared.util.OoxmlNamespaces.OFFICE;
import static uk.gegc.questionextractor.shared.util.OoxmlNamespaces.RELATIONSHIPS;

/**
 * Walks the body paragraphs in order and groups them into questions.
 * <p>
 * A paragraph whose text starts with {@code digits. Capital} opens a new question and closes the
 * previous one. Following paragraphs are appended to the open question; paragraphs before the
 * first question are dropped. While a question is open, pictures, legacy equation objects and
 * Office Math of each paragraph are appended after its text, in that order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionBoundaryScanner {

    static final Pattern QUESTION_START = Pattern.compile("^\\d+\\.\\s*[A-Z]");

    private final RunClassifier runClassifier;
    private final ScriptMerger scriptMerger;
    private final QuestionFieldSplitter fieldSplitter;
    private final ImageBinder imageBinder;
    private final EquationNormalizer equationNormalizer;
    private final ExtractorProperties properties;

    public List<QuestionRecord> scan(DocxPackage docx) {
        ExtractionContext context = new ExtractionContext();
        for (Element paragraph : docx.paragraphs()) {
            readParagraph(paragraph, docx, context);
        }
        if (context.isInsideQuestion()) {
            flush(context);
        }
        return context.records();
    }

    private void readParagraph(Element paragraph, DocxPackage docx, ExtractionContext context) {
        String text = scriptMerger.merge(runClassifier.classify(paragraph)).trim();
        QuestionBuffer buffer = context.buffer();

        if (!text.isEmpty() && QUESTION_START.matcher(text).find()) {
            if (context.isInsideQuestion()) {
                flush(context);
            }
            buffer.start(text);
            context.setInsideQuestion(true);
        } else if (context.isInsideQuestion()) {
            buffer.append(text);
        } else {
            if (!text.isEmpty()) {
                log.trace("Skipping paragraph outside of any question");
            }
            return;
        }

        Integer openNumber = fieldSplitter.leadingNumber(buffer.joinedText());
        imageBinder.bind(paragraph, docx, context, openNumber).forEach(buffer::append);
        appendLegacyEquations(paragraph, docx, buffer);
        for (Element oMath : DomUtils.primaryDescendants(paragraph, MATH, "oMath")) {
            buffer.append(equationNormalizer.officeMath(oMath));
        }
    }

    private void appendLegacyEquations(Element paragraph, DocxPackage docx, QuestionBuffer buffer) {
        for (Element oleObject : DomUtils.primaryDescendants(paragraph, OFFICE, "OLEObject")) {
            String progId = oleObject.getAttribute("ProgID");
            if (!isEquation(progId)) {
                log.debug("Skipping embedded object with ProgID {}", progId);
                continue;
            }
            String relationshipId = DomUtils.attribute(oleObject, RELATIONSHIPS, "id");
            Optional<String> target = docx.resolveRelationship(relationshipId);
            if (target.isEmpty()) {
                log.debug("Equation relationship {} is not mapped, skipping", relationshipId);
                continue;
            }
            docx.readPart(target.get())
                    .map(equationNormalizer::equationBlob)
                    .ifPresent(buffer::append);
        }
    }

    private boolean isEquation(String progId) {
        if (progId == null || progId.isEmpty()) {
            return true;
        }
        return properties.getEquations().getProgIdPrefixes().stream().anyMatch(progId::startsWith);
    }

    private void flush(ExtractionContext context) {
        QuestionFields fields = fieldSplitter.split(context.buffer().joinedText());
        List<QuestionImage> images = context.takeImages(fields.number());
        context.addRecord(QuestionRecord.of(fields, images));
        context.buffer().clear();
        context.setInsideQuestion(false);
    }
}
