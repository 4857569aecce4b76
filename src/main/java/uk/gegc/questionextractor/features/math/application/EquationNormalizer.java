package uk.gegc.questionextractor.features.math.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import uk.gegc.questionextractor.features.math.domain.EquationBlobConverter;
import uk.gegc.questionextractor.features.math.domain.EquationConversionException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single entry point for the three math encodings found in documents.
 * None of the methods throw: a failed conversion yields an empty string (or a bracketed
 * placeholder for unknown symbols) and the caller carries on with the rest of the paragraph.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EquationNormalizer {

    private static final Pattern MATH_ELEMENT = Pattern.compile("<math\\b.*?</math>", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final SymbolTable symbolTable;
    private final OfficeMathConverter officeMathConverter;
    private final EquationBlobConverter equationBlobConverter;

    /**
     * Resolves a symbol-font reference. Unknown references are kept visible as {@code [CODE]}.
     */
    public String symbol(String font, String code) {
        if (code == null || code.isBlank()) {
            return "";
        }
        return symbolTable.lookup(font, code).orElseGet(() -> {
            log.debug("Unknown symbol {} in font {}", code, font);
            return "[" + code + "]";
        });
    }

    public String officeMath(Element oMath) {
        try {
            return officeMathConverter.toMathMl(oMath);
        } catch (RuntimeException ex) {
            log.warn("Skipping Office Math element: {}", ex.getMessage());
            return "";
        }
    }

    /**
     * Converts a legacy equation blob and keeps only the first {@code <math>} element of the
     * converter output, with whitespace runs collapsed.
     */
    public String equationBlob(byte[] blob) {
        if (blob == null || blob.length == 0) {
            return "";
        }
        try {
            String output = equationBlobConverter.toMathMl(blob);
            if (output == null) {
                log.warn("Equation converter returned no output");
                return "";
            }
            Matcher matcher = MATH_ELEMENT.matcher(output);
            if (!matcher.find()) {
                log.warn("Equation converter output contains no <math> element");
                return "";
            }
            return WHITESPACE.matcher(matcher.group()).replaceAll(" ").trim();
        } catch (EquationConversionException ex) {
            log.warn("Skipping legacy equation: {}", ex.getMessage());
            return "";
        } catch (RuntimeException ex) {
            log.warn("Equation converter failed unexpectedly: {}", ex.getMessage(), ex);
            return "";
        }
    }
}
