package im.arun.controltree.parse;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes a leading hierarchical requirement identifier such as {@code 1}, {@code 1.2.3} or {@code A1.1}.
 * The identifier must start the string and be followed by whitespace.
 */
public final class IdentifierMatcher {

    // Optional leading letter (A1, A2 appendices), dot-separated numeric segments, then whitespace.
    static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Z]?\\d+(?:\\.\\d+)*\\s");

    private IdentifierMatcher() {}

    /**
     * Extract the identifier that starts the given text.
     *
     * @param text Text to examine, used as-is (not trimmed)
     * @return The identifier without its trailing whitespace, or empty if the text does not start with one
     */
    public static Optional<String> match(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = IDENTIFIER_PATTERN.matcher(text);
        if (matcher.find()) {
            return Optional.of(matcher.group().strip());
        }
        return Optional.empty();
    }

    public static boolean startsWithIdentifier(String text) {
        return match(text).isPresent();
    }

    /**
     * Number of dot-separated segments, e.g. "A1.2.3" -> 3.
     */
    public static int depthOf(String identifier) {
        return identifier.split("\\.").length;
    }
}
