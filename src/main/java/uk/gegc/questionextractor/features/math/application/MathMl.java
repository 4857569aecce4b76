package uk.gegc.questionextractor.features.math.application;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Small builders for the MathML dialect every converter emits.
 */
public final class MathMl {

    private static final Pattern NUMBER = Pattern.compile("[+-]?\\d+(?:[.,]\\d+)?");

    private MathMl() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String mi(String text) {
        return "<mi>" + escape(text) + "</mi>";
    }

    public static String mn(String text) {
        return "<mn>" + escape(text) + "</mn>";
    }

    public static String mo(String text) {
        return "<mo>" + escape(text) + "</mo>";
    }

    /**
     * Numbers become {@code <mn>}, anything else {@code <mi>}.
     */
    public static String token(String text) {
        return isNumber(text) ? mn(text) : mi(text);
    }

    public static boolean isNumber(String text) {
        return text != null && NUMBER.matcher(text).matches();
    }

    /**
     * Wraps several sibling pieces in {@code <mrow>}; a single piece is returned unchanged.
     */
    public static String group(List<String> pieces) {
        if (pieces.size() == 1) {
            return pieces.get(0);
        }
        return "<mrow>" + String.join("", pieces) + "</mrow>";
    }

    public static String inline(String body) {
        return "<math>" + body + "</math>";
    }

    public static String block(List<String> pieces) {
        return "<math display=\"block\"><mrow>" + String.join("", pieces) + "</mrow></math>";
    }

    public static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '&' -> escaped.append("&amp;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
