package im.arun.controltree.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The assembled control tree: a synthetic root plus the diagnostics gathered while building it.
 */
public class ControlTree {
    public static final String ROOT_TITLE = "ROOT";

    private final ControlNode root;
    private final BuildDiagnostics diagnostics;

    public ControlTree(ControlNode root, BuildDiagnostics diagnostics) {
        this.root = root;
        this.diagnostics = diagnostics;
    }

    public static ControlNode newRoot() {
        return ControlNode.root(ROOT_TITLE);
    }

    public ControlNode getRoot() {
        return root;
    }

    public List<ControlNode> getTopLevel() {
        return root.getChildren();
    }

    public BuildDiagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * Represent the tree as the list of top-level requirements, root omitted.
     */
    public List<ControlItem> toItems() {
        List<ControlItem> items = new ArrayList<>();
        for (ControlNode child : root.getChildren()) {
            items.add(child.toItem());
        }
        return items;
    }

    /** Total number of nodes below the root. */
    public int size() {
        return countBelow(root);
    }

    private int countBelow(ControlNode node) {
        int count = 0;
        for (ControlNode child : node.getChildren()) {
            count += 1 + countBelow(child);
        }
        return count;
    }
}
