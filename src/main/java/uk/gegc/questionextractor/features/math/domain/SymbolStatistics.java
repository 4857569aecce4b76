package uk.gegc.questionextractor.features.math.domain;

import java.util.Map;

public record SymbolStatistics(
        int totalFonts,
        int totalSymbols,
        Map<String, Integer> symbolsPerFont
) {
}
