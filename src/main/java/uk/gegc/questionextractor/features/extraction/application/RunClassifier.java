package uk.gegc.questionextractor.features.extraction.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import uk.gegc.questionextractor.features.extraction.domain.model.RunFragment;
import uk.gegc.questionextractor.features.extraction.domain.model.ScriptPosition;
import uk.gegc.questionextractor.features.math.application.EquationNormalizer;
import uk.gegc.questionextractor.shared.util.DomUtils;

import java.util.ArrayList;
import java.util.List;

import static uk.gegc.questionextractor.shared.util.OoxmlNamespaces.WORDPROCESSING;

/**
 * Turns the runs of a paragraph into tagged fragments, one per text, symbol or tab token.
 * Runs under {@code mc:Fallback} duplicate the preferred choice and are ignored.
 */
@Component
@RequiredArgsConstructor
public class RunClassifier {

    private final EquationNormalizer equationNormalizer;

    public List<RunFragment> classify(Element paragraph) {
        List<RunFragment> fragments = new ArrayList<>();
        for (Element run : DomUtils.primaryDescendants(paragraph, WORDPROCESSING, "r")) {
            ScriptPosition position = positionOf(run);
            for (Element token : DomUtils.childElements(run)) {
                if (!WORDPROCESSING.equals(token.getNamespaceURI())) {
                    continue;
                }
                String text = switch (token.getLocalName()) {
                    case "t" -> token.getTextContent();
                    case "sym" -> equationNormalizer.symbol(
                            DomUtils.attribute(token, WORDPROCESSING, "font"),
                            DomUtils.attribute(token, WORDPROCESSING, "char"));
                    case "tab" -> " ";
                    default -> "";
                };
                if (text != null && !text.isEmpty()) {
                    fragments.add(new RunFragment(position, text));
                }
            }
        }
        return fragments;
    }

    private ScriptPosition positionOf(Element run) {
        return DomUtils.firstChild(run, WORDPROCESSING, "rPr")
                .flatMap(properties -> DomUtils.firstChild(properties, WORDPROCESSING, "vertAlign"))
                .map(vertAlign -> ScriptPosition.fromVertAlign(DomUtils.attribute(vertAlign, WORDPROCESSING, "val")))
                .orElse(ScriptPosition.NORMAL);
    }
}
