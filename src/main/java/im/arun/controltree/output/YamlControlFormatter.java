package im.arun.controltree.output;

import im.arun.controltree.config.ControlTreeConfig;
import im.arun.controltree.model.ControlNode;
import im.arun.controltree.model.ControlTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured-document encoding: a static header block followed by one control record per node.
 *
 * <p>Records are indented two spaces per tree level, top-level controls at level 1:
 * <pre>
 *   - id: Req-1
 *     title: 'Install and maintain network security controls.'
 *     levels:
 *       - base
 *     status: not applicable
 *     controls:
 * </pre>
 * Leaves end with {@code rules: []} and a blank line instead of {@code controls:}.
 */
public class YamlControlFormatter implements ControlTreeFormatter {
    private static final String INDENT = "  ";
    private static final String TITLE_LABEL = "  title: ";

    private final ControlTreeConfig config;

    public YamlControlFormatter(ControlTreeConfig config) {
        this.config = config;
    }

    @Override
    public String format(ControlTree tree) {
        List<String> lines = new ArrayList<>();
        lines.add(config.getHeaderTemplate().stripTrailing());
        for (ControlNode child : tree.getTopLevel()) {
            walk(child, 1, lines);
        }
        return String.join("\n", lines);
    }

    private void walk(ControlNode node, int level, List<String> lines) {
        lines.addAll(formatNode(node, level));
        for (ControlNode child : node.getChildren()) {
            walk(child, level + 1, lines);
        }
    }

    List<String> formatNode(ControlNode node, int level) {
        String indent = INDENT.repeat(level);
        List<String> lines = new ArrayList<>();

        lines.add(indent + "- id: " + config.getIdPrefix() + node.getIdentifier());
        lines.addAll(formatTitle(node.getTitle(), indent));
        lines.add(indent + "  levels:");
        lines.add(indent + "    - " + config.getLevel());
        lines.add(indent + "  status: " + config.getStatus());
        if (node.hasChildren()) {
            lines.add(indent + "  controls:");
        } else {
            lines.add(indent + "  rules: []");
            lines.add("");
        }
        return lines;
    }

    /**
     * Render the title as a single-quoted scalar wrapped to the configured width. Continuation
     * lines sit under the first title character, deeper than the key, so YAML folds them back
     * into one line.
     */
    private List<String> formatTitle(String title, String indent) {
        String prefix = indent + TITLE_LABEL;
        int width = config.getWrapWidth() - prefix.length();
        List<String> wrapped = TextWrapper.wrap(escapeSingleQuoted(title), width);

        List<String> lines = new ArrayList<>();
        if (wrapped.isEmpty()) {
            lines.add(prefix + "''");
            return lines;
        }

        String continuation = " ".repeat(prefix.length() + 1);
        for (int i = 0; i < wrapped.size(); i++) {
            StringBuilder line = new StringBuilder();
            line.append(i == 0 ? prefix + "'" : continuation).append(wrapped.get(i));
            if (i == wrapped.size() - 1) {
                line.append('\'');
            }
            lines.add(line.toString());
        }
        return lines;
    }

    private static String escapeSingleQuoted(String text) {
        return text == null ? "" : text.replace("'", "''");
    }
}
