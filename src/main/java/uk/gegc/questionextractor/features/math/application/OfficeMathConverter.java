package uk.gegc.questionextractor.features.math.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import uk.gegc.questionextractor.shared.util.DomUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static uk.gegc.questionextractor.shared.util.OoxmlNamespaces.MATH;

/**
 * Converts native Office Math ({@code m:oMath}) to MathML.
 * <p>
 * Children are mixed content, so they are visited in document order and each known kind is
 * translated on its own: {@code m:sSub}, {@code m:sSup}, {@code m:f} and {@code m:r}. Anything
 * else is skipped. Fraction numerators and denominators only take subscripts and runs.
 */
@Slf4j
@Component
public class OfficeMathConverter {

    private static final Map<Character, String> OPERATORS = Map.of(
            '=', "=",
            '×', "×",
            '*', "×",
            '+', "+",
            '-', "-",
            '−', "-"
    );

    /**
     * @return a {@code <math display="block">} element, or an empty string when nothing converts
     */
    public String toMathMl(Element oMath) {
        if (oMath == null) {
            return "";
        }
        List<String> pieces = convertChildren(oMath, false);
        if (pieces.isEmpty()) {
            return "";
        }
        return MathMl.block(pieces);
    }

    private List<String> convertChildren(Element container, boolean fractionPart) {
        List<String> pieces = new ArrayList<>();
        for (Element child : DomUtils.childElements(container)) {
            if (!MATH.equals(child.getNamespaceURI())) {
                continue;
            }
            switch (child.getLocalName()) {
                case "sSub" -> script(child, "msub", "sub").ifPresent(pieces::add);
                case "sSup" -> {
                    if (!fractionPart) {
                        script(child, "msup", "sup").ifPresent(pieces::add);
                    }
                }
                case "f" -> {
                    if (!fractionPart) {
                        fraction(child).ifPresent(pieces::add);
                    }
                }
                case "r" -> pieces.addAll(run(child));
                default -> log.trace("Skipping unsupported math element m:{}", child.getLocalName());
            }
        }
        return pieces;
    }

    private Optional<String> script(Element node, String tag, String scriptName) {
        List<String> base = DomUtils.firstChild(node, MATH, "e")
                .map(e -> convertChildren(e, false))
                .orElse(List.of());
        List<String> script = DomUtils.firstChild(node, MATH, scriptName)
                .map(s -> convertChildren(s, false))
                .orElse(List.of());
        if (base.isEmpty() || script.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("<" + tag + ">" + MathMl.group(base) + MathMl.group(script) + "</" + tag + ">");
    }

    private Optional<String> fraction(Element node) {
        List<String> numerator = DomUtils.firstChild(node, MATH, "num")
                .map(n -> convertChildren(n, true))
                .orElse(List.of());
        List<String> denominator = DomUtils.firstChild(node, MATH, "den")
                .map(d -> convertChildren(d, true))
                .orElse(List.of());
        if (numerator.isEmpty() || denominator.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("<mfrac><mrow>" + String.join("", numerator) + "</mrow><mrow>"
                + String.join("", denominator) + "</mrow></mfrac>");
    }

    /**
     * Splits run text on operator characters: operators become {@code <mo>}, numbers
     * {@code <mn>}, everything else {@code <mi>}.
     */
    private List<String> run(Element run) {
        String text = DomUtils.joinedText(run, MATH, "t");
        List<String> pieces = new ArrayList<>();
        StringBuilder operand = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String operator = OPERATORS.get(c);
            if (operator == null) {
                operand.append(c);
                continue;
            }
            flushOperand(operand, pieces);
            pieces.add(MathMl.mo(operator));
        }
        flushOperand(operand, pieces);
        return pieces;
    }

    private void flushOperand(StringBuilder operand, List<String> pieces) {
        String value = operand.toString().trim();
        if (!value.isEmpty()) {
            pieces.add(MathMl.token(value));
        }
        operand.setLength(0);
    }
}
