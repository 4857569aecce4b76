package uk.gegc.questionextractor.features.math.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.questionextractor.features.math.domain.SymbolInfo;
import uk.gegc.questionextractor.features.math.domain.SymbolStatistics;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SymbolTable")
class SymbolTableTest {

    private final SymbolTable symbolTable = new SymbolTable();

    @ParameterizedTest
    @CsvSource({
            "symbol, F0B4, ×",
            "Symbol, f0b4, ×",
            "SYMBOL, F070, π",
            "symbol, F061, α",
            "symbol, F0A3, ≤",
            "symbol, F0D6, √",
            "Wingdings, F0FC, ✓",
            "webdings, F021, ♠"
    })
    @DisplayName("lookup: font and code are matched case-insensitively")
    void lookup_caseInsensitive(String font, String code, String expected) {
        assertThat(symbolTable.lookup(font, code)).contains(expected);
    }

    @Test
    @DisplayName("lookup: surrounding whitespace is ignored")
    void lookup_trimsArguments() {
        assertThat(symbolTable.lookup(" symbol ", " F0B4 ")).contains("×");
    }

    @Test
    @DisplayName("lookup: unknown pairs are not found")
    void lookup_unknownPairs() {
        assertThat(symbolTable.lookup("symbol", "FFFF")).isEmpty();
        assertThat(symbolTable.lookup("Comic Sans", "F0B4")).isEmpty();
        assertThat(symbolTable.lookup("webdings", "F0B4")).isEmpty();
        assertThat(symbolTable.lookup(null, "F0B4")).isEmpty();
        assertThat(symbolTable.lookup("symbol", null)).isEmpty();
    }

    @Test
    @DisplayName("lookup: the same code means different things in different fonts")
    void lookup_codeIsScopedToFont() {
        assertThat(symbolTable.lookup("wingdings", "F021")).contains("✁");
        assertThat(symbolTable.lookup("webdings", "F021")).contains("♠");
    }

    @Test
    @DisplayName("symbolInfo: returns normalized font, code and description")
    void symbolInfo_normalized() {
        SymbolInfo info = symbolTable.symbolInfo("Symbol", "f070").orElseThrow();

        assertThat(info.font()).isEqualTo("symbol");
        assertThat(info.code()).isEqualTo("F070");
        assertThat(info.unicode()).isEqualTo("π");
        assertThat(info.description()).isEqualTo("Pi");
    }

    @Test
    @DisplayName("supported fonts and codes")
    void supportedFontsAndCodes() {
        assertThat(symbolTable.supportedFonts()).containsExactly("symbol", "wingdings", "webdings");
        assertThat(symbolTable.isFontSupported("WingDings")).isTrue();
        assertThat(symbolTable.isFontSupported("Arial")).isFalse();
        assertThat(symbolTable.isFontSupported(null)).isFalse();
        assertThat(symbolTable.supportedCodes("symbol")).contains("F0B4", "F070").hasSizeGreaterThan(90);
        assertThat(symbolTable.supportedCodes("Arial")).isEmpty();
    }

    @Test
    @DisplayName("statistics: totals match per-font counts")
    void statistics_consistent() {
        SymbolStatistics statistics = symbolTable.statistics();

        assertThat(statistics.totalFonts()).isEqualTo(3);
        assertThat(statistics.symbolsPerFont()).containsKeys("symbol", "wingdings", "webdings");
        assertThat(statistics.totalSymbols())
                .isEqualTo(statistics.symbolsPerFont().values().stream().mapToInt(Integer::intValue).sum());
        assertThat(statistics.symbolsPerFont().get("webdings")).isEqualTo(2);
    }
}
