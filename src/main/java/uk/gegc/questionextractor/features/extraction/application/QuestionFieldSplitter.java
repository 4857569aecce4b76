package uk.gegc.questionextractor.features.extraction.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import uk.gegc.questionextractor.features.extraction.config.ExtractorProperties;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionFields;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the text of one question into number, stem, options, key and hint.
 * <p>
 * Markers are read left to right and the first occurrence wins:
 * <ol>
 *     <li>leading {@code N.} gives the number,</li>
 *     <li>{@code Hint:} separates the hint, which is cut at the first {@code N.Capital} inside it,</li>
 *     <li>{@code Key:} separates the answer key,</li>
 *     <li>{@code a)}, {@code b)}, ... or {@code (a)}, {@code (b)}, ... separate the options; each
 *     letter must follow the previous one and the marker must be preceded by whitespace or the
 *     start of the text.</li>
 * </ol>
 * Marker text inside {@code <math>...</math>} never counts as a marker.
 */
@Slf4j
@Component
public class QuestionFieldSplitter {

    static final String HINT_MARKER = "Hint:";
    static final String KEY_MARKER = "Key:";

    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+)\\.");
    private static final Pattern NEXT_QUESTION = Pattern.compile("(?<!\\d)\\d+\\.\\s?[A-Z]");
    private static final Pattern OPTION_MARKER = Pattern.compile("(?<!\\S)\\(?([a-z])\\)");
    private static final Pattern MATH_SPAN = Pattern.compile("<math\\b.*?</math>", Pattern.DOTALL);

    private final String optionLetters;

    @Autowired
    public QuestionFieldSplitter(ExtractorProperties properties) {
        this(properties.getOptionLetters());
    }

    public QuestionFieldSplitter(String optionLetters) {
        if (optionLetters == null || optionLetters.isEmpty()) {
            throw new IllegalArgumentException("Option letters must not be empty");
        }
        this.optionLetters = optionLetters;
    }

    /**
     * @return the leading question number of the text, or {@code null} when there is none
     */
    public Integer leadingNumber(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = LEADING_NUMBER.matcher(text.trim());
        return matcher.find() ? parseNumber(matcher.group(1)) : null;
    }

    public QuestionFields split(String text) {
        String content = text != null ? text.trim() : "";
        Integer number = null;
        Matcher numberMatcher = LEADING_NUMBER.matcher(content);
        if (numberMatcher.find()) {
            number = parseNumber(numberMatcher.group(1));
            content = content.substring(numberMatcher.end()).trim();
        }

        String main = content;
        String hint = null;
        int hintAt = indexOfMarker(content, HINT_MARKER);
        if (hintAt >= 0) {
            main = content.substring(0, hintAt);
            hint = truncateAtNextQuestion(content.substring(hintAt + HINT_MARKER.length()));
        }

        String optionText = main;
        String key = null;
        int keyAt = indexOfMarker(main, KEY_MARKER);
        if (keyAt >= 0) {
            optionText = main.substring(0, keyAt);
            key = blankToNull(main.substring(keyAt + KEY_MARKER.length()));
        }

        List<OptionMarker> markers = findOptionMarkers(optionText);
        if (markers.isEmpty()) {
            return new QuestionFields(number, optionText.trim(), Map.of(), key, hint);
        }
        String stem = optionText.substring(0, markers.get(0).start()).trim();
        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 0; i < markers.size(); i++) {
            OptionMarker marker = markers.get(i);
            int end = i + 1 < markers.size() ? markers.get(i + 1).start() : optionText.length();
            options.put(marker.letter(), optionText.substring(marker.end(), end).trim());
        }
        return new QuestionFields(number, stem, options, key, hint);
    }

    private List<OptionMarker> findOptionMarkers(String text) {
        List<int[]> mathSpans = mathSpans(text);
        List<OptionMarker> markers = new ArrayList<>();
        Matcher matcher = OPTION_MARKER.matcher(text);
        while (matcher.find() && markers.size() < optionLetters.length()) {
            char expected = optionLetters.charAt(markers.size());
            if (matcher.group(1).charAt(0) != expected || insideAny(mathSpans, matcher.start())) {
                continue;
            }
            markers.add(new OptionMarker(String.valueOf(expected), matcher.start(), matcher.end()));
        }
        return markers;
    }

    private String truncateAtNextQuestion(String rawHint) {
        String hint = rawHint.trim();
        List<int[]> mathSpans = mathSpans(hint);
        Matcher matcher = NEXT_QUESTION.matcher(hint);
        while (matcher.find()) {
            if (matcher.start() > 0 && !insideAny(mathSpans, matcher.start())) {
                log.debug("Hint truncated at position {}", matcher.start());
                hint = hint.substring(0, matcher.start());
                break;
            }
        }
        return blankToNull(hint);
    }

    private int indexOfMarker(String text, String marker) {
        List<int[]> mathSpans = mathSpans(text);
        int from = 0;
        while (true) {
            int index = text.indexOf(marker, from);
            if (index < 0 || !insideAny(mathSpans, index)) {
                return index;
            }
            from = index + marker.length();
        }
    }

    private static List<int[]> mathSpans(String text) {
        List<int[]> spans = new ArrayList<>();
        Matcher matcher = MATH_SPAN.matcher(text);
        while (matcher.find()) {
            spans.add(new int[]{matcher.start(), matcher.end()});
        }
        return spans;
    }

    private static boolean insideAny(List<int[]> spans, int index) {
        for (int[] span : spans) {
            if (index >= span[0] && index < span[1]) {
                return true;
            }
        }
        return false;
    }

    private static Integer parseNumber(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException ex) {
            log.debug("Question number {} is out of range", digits);
            return null;
        }
    }

    private static String blankToNull(String value) {
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private record OptionMarker(String letter, int start, int end) {
    }
}
