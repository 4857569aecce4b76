package uk.gegc.questionextractor.features.math.application;

import org.springframework.stereotype.Component;
import uk.gegc.questionextractor.features.math.domain.SymbolInfo;
import uk.gegc.questionextractor.features.math.domain.SymbolStatistics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps symbol-font character references ({@code w:sym}) to Unicode.
 * <p>
 * Font names and character codes are matched case-insensitively and exactly. Unknown pairs are
 * reported as empty results; the table never invents a replacement, callers pick the fallback.
 */
@Component
public class SymbolTable {

    public static final String SYMBOL_FONT = "symbol";
    public static final String WINGDINGS_FONT = "wingdings";
    public static final String WEBDINGS_FONT = "webdings";

    private static final Map<String, Map<String, SymbolInfo>> FONTS = buildFonts();

    public Optional<String> lookup(String font, String code) {
        return symbolInfo(font, code).map(SymbolInfo::unicode);
    }

    public Optional<SymbolInfo> symbolInfo(String font, String code) {
        if (font == null || code == null) {
            return Optional.empty();
        }
        Map<String, SymbolInfo> codes = FONTS.get(normalizeFont(font));
        if (codes == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(codes.get(normalizeCode(code)));
    }

    public Set<String> supportedFonts() {
        return FONTS.keySet();
    }

    public Set<String> supportedCodes(String font) {
        if (font == null) {
            return Set.of();
        }
        Map<String, SymbolInfo> codes = FONTS.get(normalizeFont(font));
        return codes != null ? codes.keySet() : Set.of();
    }

    public boolean isFontSupported(String font) {
        return font != null && FONTS.containsKey(normalizeFont(font));
    }

    public SymbolStatistics statistics() {
        Map<String, Integer> perFont = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<String, Map<String, SymbolInfo>> entry : FONTS.entrySet()) {
            perFont.put(entry.getKey(), entry.getValue().size());
            total += entry.getValue().size();
        }
        return new SymbolStatistics(FONTS.size(), total, Collections.unmodifiableMap(perFont));
    }

    private static String normalizeFont(String font) {
        return font.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizeCode(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }

    private static Map<String, Map<String, SymbolInfo>> buildFonts() {
        FontMap symbol = new FontMap(SYMBOL_FONT);
        // Arithmetic
        symbol.put("F02B", "+", "Plus");
        symbol.put("F02D", "−", "Minus (Unicode minus, not hyphen)");
        symbol.put("F0B4", "×", "Multiplication operator");
        symbol.put("F0B8", "÷", "Division operator");
        symbol.put("F0B1", "±", "Plus-minus");
        symbol.put("F0F1", "∓", "Minus-plus");

        // Comparison
        symbol.put("F03D", "=", "Equals");
        symbol.put("F0B9", "≠", "Not equal");
        symbol.put("F03C", "<", "Less than");
        symbol.put("F03E", ">", "Greater than");
        symbol.put("F0A3", "≤", "Less than or equal");
        symbol.put("F0B3", "≥", "Greater than or equal");
        symbol.put("F0BB", "≈", "Approximately equal");
        symbol.put("F040", "≅", "Congruent");
        symbol.put("F07E", "∼", "Similar");

        // Greek, lower case
        symbol.put("F061", "α", "Alpha (lowercase)");
        symbol.put("F062", "β", "Beta (lowercase)");
        symbol.put("F067", "γ", "Gamma (lowercase)");
        symbol.put("F064", "δ", "Delta (lowercase)");
        symbol.put("F065", "ε", "Epsilon (lowercase)");
        symbol.put("F07A", "ζ", "Zeta (lowercase)");
        symbol.put("F068", "η", "Eta (lowercase)");
        symbol.put("F071", "θ", "Theta (lowercase)");
        symbol.put("F069", "ι", "Iota (lowercase)");
        symbol.put("F06B", "κ", "Kappa (lowercase)");
        symbol.put("F06C", "λ", "Lambda (lowercase)");
        symbol.put("F06D", "μ", "Mu (lowercase)");
        symbol.put("F06E", "ν", "Nu (lowercase)");
        symbol.put("F078", "ξ", "Xi (lowercase)");
        symbol.put("F06F", "ο", "Omicron (lowercase)");
        symbol.put("F070", "π", "Pi");
        symbol.put("F072", "ρ", "Rho (lowercase)");
        symbol.put("F073", "σ", "Sigma (lowercase)");
        symbol.put("F074", "τ", "Tau (lowercase)");
        symbol.put("F075", "υ", "Upsilon (lowercase)");
        symbol.put("F066", "φ", "Phi (lowercase)");
        symbol.put("F063", "χ", "Chi (lowercase)");
        symbol.put("F079", "ψ", "Psi (lowercase)");
        symbol.put("F077", "ω", "Omega (lowercase)");

        // Greek, upper case
        symbol.put("F041", "Α", "Alpha (uppercase)");
        symbol.put("F042", "Β", "Beta (uppercase)");
        symbol.put("F047", "Γ", "Gamma (uppercase)");
        symbol.put("F044", "Δ", "Delta (uppercase)");
        symbol.put("F045", "Ε", "Epsilon (uppercase)");
        symbol.put("F05A", "Ζ", "Zeta (uppercase)");
        symbol.put("F048", "Η", "Eta (uppercase)");
        symbol.put("F051", "Θ", "Theta (uppercase)");
        symbol.put("F049", "Ι", "Iota (uppercase)");
        symbol.put("F04B", "Κ", "Kappa (uppercase)");
        symbol.put("F04C", "Λ", "Lambda (uppercase)");
        symbol.put("F04D", "Μ", "Mu (uppercase)");
        symbol.put("F04E", "Ν", "Nu (uppercase)");
        symbol.put("F058", "Ξ", "Xi (uppercase)");
        symbol.put("F04F", "Ο", "Omicron (uppercase)");
        symbol.put("F050", "Π", "Pi (uppercase)");
        symbol.put("F052", "Ρ", "Rho (uppercase)");
        symbol.put("F053", "Σ", "Sigma (uppercase)");
        symbol.put("F054", "Τ", "Tau (uppercase)");
        symbol.put("F055", "Υ", "Upsilon (uppercase)");
        symbol.put("F046", "Φ", "Phi (uppercase)");
        symbol.put("F043", "Χ", "Chi (uppercase)");
        symbol.put("F059", "Ψ", "Psi (uppercase)");
        symbol.put("F057", "Ω", "Omega (uppercase)");

        // Calculus and general operators
        symbol.put("F0A5", "∞", "Infinity");
        symbol.put("F0D1", "∇", "Nabla (gradient)");
        symbol.put("F0B6", "∂", "Partial derivative");
        symbol.put("F0F2", "∫", "Integral");
        symbol.put("F0E5", "∑", "Summation");
        symbol.put("F0D5", "∏", "Product");
        symbol.put("F0D6", "√", "Square root");
        symbol.put("F0D0", "∠", "Angle");

        // Sets
        symbol.put("F0CE", "∈", "Element of");
        symbol.put("F0CF", "∋", "Contains");
        symbol.put("F0C9", "∉", "Not element of");
        symbol.put("F0C7", "∩", "Intersection");
        symbol.put("F0C8", "∪", "Union");
        symbol.put("F0C6", "∅", "Empty set");
        symbol.put("F0C5", "⊂", "Subset of");
        symbol.put("F0C3", "⊃", "Superset of");
        symbol.put("F0CA", "⊆", "Subset of or equal");
        symbol.put("F0CB", "⊇", "Superset of or equal");

        // Logic
        symbol.put("F0D9", "∧", "Logical AND");
        symbol.put("F0DA", "∨", "Logical OR");
        symbol.put("F0D8", "¬", "Logical NOT");
        symbol.put("F0A0", "∀", "For all (universal quantifier)");
        symbol.put("F024", "∃", "There exists (existential quantifier)");

        // Arrows
        symbol.put("F0AC", "←", "Left arrow");
        symbol.put("F0AE", "→", "Right arrow");
        symbol.put("F0AD", "↑", "Up arrow");
        symbol.put("F0AF", "↓", "Down arrow");
        symbol.put("F0AB", "↔", "Left-right arrow");
        symbol.put("F0DC", "⇐", "Left double arrow");
        symbol.put("F0DE", "⇒", "Right double arrow");
        symbol.put("F0DD", "⇑", "Up double arrow");
        symbol.put("F0DF", "⇓", "Down double arrow");
        symbol.put("F0DB", "⇔", "Left-right double arrow");

        // Vulgar fractions
        symbol.put("F0BD", "½", "One half");
        symbol.put("F0BC", "¼", "One quarter");
        symbol.put("F0BE", "¾", "Three quarters");

        FontMap wingdings = new FontMap(WINGDINGS_FONT);
        wingdings.put("F021", "✁", "Scissors");
        wingdings.put("F022", "✂", "Scissors (solid)");
        wingdings.put("F04A", "☺", "Smiling face");
        wingdings.put("F04C", "☹", "Frowning face");
        wingdings.put("F0FC", "✓", "Check mark");

        FontMap webdings = new FontMap(WEBDINGS_FONT);
        webdings.put("F021", "♠", "Spade suit");
        webdings.put("F022", "♣", "Club suit");

        Map<String, Map<String, SymbolInfo>> fonts = new LinkedHashMap<>();
        fonts.put(SYMBOL_FONT, symbol.freeze());
        fonts.put(WINGDINGS_FONT, wingdings.freeze());
        fonts.put(WEBDINGS_FONT, webdings.freeze());
        return Collections.unmodifiableMap(fonts);
    }

    private static final class FontMap {
        private final String font;
        private final Map<String, SymbolInfo> codes = new LinkedHashMap<>();

        private FontMap(String font) {
            this.font = font;
        }

        private void put(String code, String unicode, String description) {
            if (codes.putIfAbsent(code, new SymbolInfo(code, font, unicode, description)) != null) {
                throw new IllegalStateException("Duplicate code " + code + " for font " + font);
            }
        }

        private Map<String, SymbolInfo> freeze() {
            return Collections.unmodifiableMap(codes);
        }
    }
}
