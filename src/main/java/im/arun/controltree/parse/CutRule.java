package im.arun.controltree.parse;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Transition phrases that separate a requirement statement from the enumeration or testing detail
 * that follows it in the same cell. Declaration order is evaluation priority: the most specific
 * phrase comes first and the generic colon rule near the end, so it never shadows a phrase rule.
 */
public enum CutRule {
    NOT_LIMITED_TO_FAILURE_OF("including,? but not limited to failure of"),
    NOT_LIMITED_TO("including,? but not limited to"),
    INCLUDING_MECHANISMS("including mechanisms that are"),
    MEETS_THE_FOLLOWING("that meets the following"),
    CODE_CHANGES_ARE("code changes are"),
    THAT_INCLUDES("that includes"),
    AND_INCLUDES("and includes"),
    AND_INCLUDE("and include"),
    AS_FOLLOWS("as follows"),
    INCLUDING("including"),
    SUCH_THAT("such that"),
    ARE("are"),
    IS("is"),
    GENERIC_COLON(Pattern.compile("(?s)(.*):[ \\t]*\\r?\\n")),
    CROSS_REFERENCE(Pattern.compile("(?s)(.*)PCI DSS Reference:"));

    // Phrases start on a word boundary so that "malware:" never reads as "are:".
    private static final String PHRASE_START = "\\b";
    // Phrase rules accept the colon before any whitespace or at the end; joined cells lose their line breaks.
    private static final String PHRASE_TERMINATOR = ":(?=\\s|$)";

    private final Pattern pattern;

    CutRule(String phrase) {
        this(Pattern.compile("(?s)(.*)" + PHRASE_START + phrase + PHRASE_TERMINATOR));
    }

    CutRule(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * Apply this rule to the text.
     *
     * @return The text captured before the phrase, or null if the rule does not match
     */
    public String cut(String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return stripTrailingSeparators(matcher.group(1));
    }

    private static String stripTrailingSeparators(String text) {
        int end = text.length();
        while (end > 0) {
            char c = text.charAt(end - 1);
            if (c == ',' || Character.isWhitespace(c)) {
                end--;
            } else {
                break;
            }
        }
        return text.substring(0, end);
    }
}
