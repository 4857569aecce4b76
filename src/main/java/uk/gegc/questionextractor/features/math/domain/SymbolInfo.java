package uk.gegc.questionextractor.features.math.domain;

/**
 * One symbol-font mapping entry.
 *
 * @param code        normalized (upper-case) character code, e.g. {@code F0B4}
 * @param font        normalized (lower-case) font name
 * @param unicode     the Unicode replacement
 * @param description human readable name of the symbol
 */
public record SymbolInfo(
        String code,
        String font,
        String unicode,
        String description
) {
}
