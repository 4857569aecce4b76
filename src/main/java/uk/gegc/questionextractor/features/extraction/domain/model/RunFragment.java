package uk.gegc.questionextractor.features.extraction.domain.model;

/**
 * One text or symbol token of a run, tagged with the run's vertical alignment.
 */
public record RunFragment(
        ScriptPosition position,
        String text
) {
    public RunFragment {
        if (position == null) {
            throw new IllegalArgumentException("Script position cannot be null");
        }
        if (text == null) {
            throw new IllegalArgumentException("Fragment text cannot be null");
        }
    }

    public static RunFragment normal(String text) {
        return new RunFragment(ScriptPosition.NORMAL, text);
    }

    public static RunFragment superscript(String text) {
        return new RunFragment(ScriptPosition.SUPERSCRIPT, text);
    }

    public static RunFragment subscript(String text) {
        return new RunFragment(ScriptPosition.SUBSCRIPT, text);
    }
}
