package uk.gegc.questionextractor.features.extraction.application;

import org.springframework.stereotype.Component;
import uk.gegc.questionextractor.features.extraction.domain.model.RunFragment;
import uk.gegc.questionextractor.features.extraction.domain.model.ScriptPosition;
import uk.gegc.questionextractor.features.math.application.MathMl;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Joins the fragments of one paragraph into text, turning scripted fragments into MathML.
 * <p>
 * A superscript takes the trailing digits of the preceding normal fragment as its base
 * ({@code 10} + {@code -19} gives {@code <msup>}); a subscript takes the trailing ASCII letters
 * ({@code v} + {@code 0} gives {@code <msub>}). Adjacent fragments with the same position count as
 * one, since Word splits words across runs freely. The base is removed from the literal text. When
 * the preceding fragment is not normal or has no such tail, the scripted text is kept as plain text.
 */
@Component
public class ScriptMerger {

    private static final Pattern TRAILING_DIGITS = Pattern.compile("\\d+$");
    private static final Pattern TRAILING_LETTERS = Pattern.compile("[A-Za-z]+$");

    public String merge(List<RunFragment> fragments) {
        StringBuilder out = new StringBuilder();
        // normal text since the last script, held back until we know whether a script consumes its tail
        String pending = null;
        for (RunFragment fragment : coalesce(fragments)) {
            if (fragment.position() == ScriptPosition.NORMAL) {
                pending = fragment.text();
                continue;
            }
            String merged = pending != null ? mergeScript(pending, fragment) : null;
            if (merged != null) {
                out.append(merged);
            } else {
                if (pending != null) {
                    out.append(pending);
                }
                out.append(fragment.text());
            }
            pending = null;
        }
        if (pending != null) {
            out.append(pending);
        }
        return out.toString();
    }

    private static List<RunFragment> coalesce(List<RunFragment> fragments) {
        List<RunFragment> result = new ArrayList<>();
        for (RunFragment fragment : fragments) {
            int last = result.size() - 1;
            if (last >= 0 && result.get(last).position() == fragment.position()) {
                RunFragment previous = result.get(last);
                result.set(last, new RunFragment(previous.position(), previous.text() + fragment.text()));
            } else {
                result.add(fragment);
            }
        }
        return result;
    }

    private String mergeScript(String base, RunFragment script) {
        String scriptText = script.text().trim();
        if (scriptText.isEmpty()) {
            return null;
        }
        boolean superscript = script.position() == ScriptPosition.SUPERSCRIPT;
        Matcher matcher = (superscript ? TRAILING_DIGITS : TRAILING_LETTERS).matcher(base);
        if (!matcher.find()) {
            return null;
        }
        String prefix = base.substring(0, matcher.start());
        String baseToken = superscript ? MathMl.mn(matcher.group()) : MathMl.mi(matcher.group());
        String tag = superscript ? "msup" : "msub";
        String markup = "<" + tag + ">" + baseToken + MathMl.token(scriptText) + "</" + tag + ">";
        return prefix + MathMl.inline(markup);
    }
}
