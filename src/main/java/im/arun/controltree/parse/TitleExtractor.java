package im.arun.controltree.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Derives the requirement identifier and a single-line title from a raw blob.
 */
public class TitleExtractor {
    private static final Logger logger = LoggerFactory.getLogger(TitleExtractor.class);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    /**
     * Parse a blob.
     *
     * <p>The identifier is taken first and removed from the title text. The cut rules are then
     * tried in {@link CutRule} order and only the first match is applied. Finally whitespace is
     * collapsed to single spaces and a trailing comma becomes a period.
     *
     * @param blob Raw blob text, possibly spanning several lines
     * @return Parsed identifier (null when absent) and title (never null)
     */
    public ParsedBlob extract(String blob) {
        String text = blob == null ? "" : blob.strip();
        if (text.isEmpty()) {
            return new ParsedBlob(null, "", null);
        }

        String identifier = null;
        Optional<String> match = IdentifierMatcher.match(text);
        if (match.isPresent()) {
            identifier = match.get();
            text = text.substring(identifier.length()).strip();
        }

        String candidate = text;
        CutRule applied = null;
        for (CutRule rule : CutRule.values()) {
            String cut = rule.cut(candidate);
            if (cut != null) {
                candidate = cut;
                applied = rule;
                break;
            }
        }
        if (applied != null) {
            logger.debug("Title of {} cut by {}", identifier, applied);
        }

        return new ParsedBlob(identifier, normalize(candidate), applied);
    }

    static String normalize(String text) {
        String cleaned = WHITESPACE_RUN.matcher(text.replace('\n', ' ')).replaceAll(" ").strip();
        if (cleaned.endsWith(",")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1) + ".";
        }
        return cleaned;
    }
}
