package im.arun.controltree.output;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy word wrapping at whitespace. Words are never split or hyphenated; a word longer than the
 * width occupies a line of its own.
 */
public final class TextWrapper {

    private TextWrapper() {}

    public static List<String> wrap(String text, int width) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return lines;
        }

        int effectiveWidth = Math.max(1, width);
        StringBuilder line = new StringBuilder();
        for (String word : text.strip().split("\\s+")) {
            if (line.length() == 0) {
                line.append(word);
            } else if (line.length() + 1 + word.length() <= effectiveWidth) {
                line.append(' ').append(word);
            } else {
                lines.add(line.toString());
                line.setLength(0);
                line.append(word);
            }
        }
        if (line.length() > 0) {
            lines.add(line.toString());
        }
        return lines;
    }
}
