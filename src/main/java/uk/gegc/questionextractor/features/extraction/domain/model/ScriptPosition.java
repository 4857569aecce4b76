package uk.gegc.questionextractor.features.extraction.domain.model;

import java.util.Locale;

/**
 * Vertical alignment of a text run ({@code w:vertAlign}).
 */
public enum ScriptPosition {
    NORMAL,
    SUPERSCRIPT,
    SUBSCRIPT;

    public static ScriptPosition fromVertAlign(String value) {
        if (value == null) {
            return NORMAL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "superscript" -> SUPERSCRIPT;
            case "subscript" -> SUBSCRIPT;
            default -> NORMAL;
        };
    }
}
