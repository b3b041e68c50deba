package im.arun.controltree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One requirement in the control tree.
 *
 * <p>Nodes are owned top-down through {@link #getChildren()}; {@link #getParent()} is a
 * navigation aid only. The identifier and title are fixed at construction.
 */
public class ControlNode {
    private final String identifier;
    private final String title;
    private final int depth;
    private final List<ControlNode> children = new ArrayList<>();
    private ControlNode parent;

    public ControlNode(String identifier, String title, int depth) {
        this.identifier = identifier;
        this.title = title;
        this.depth = depth;
    }

    static ControlNode root(String title) {
        return new ControlNode(null, title, 0);
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getTitle() {
        return title;
    }

    /** Number of identifier segments, or 0 for the root. */
    public int getDepth() {
        return depth;
    }

    public List<ControlNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public ControlNode getParent() {
        return parent;
    }

    public boolean isRoot() {
        return identifier == null;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public void addChild(ControlNode child) {
        children.add(child);
        child.parent = this;
    }

    /**
     * Convert node (and its children) into the nested-object view.
     */
    public ControlItem toItem() {
        List<ControlItem> items = new ArrayList<>(children.size());
        for (ControlNode child : children) {
            items.add(child.toItem());
        }
        return new ControlItem(identifier, title, items);
    }

    @Override
    public String toString() {
        return "ControlNode{" + identifier + ", '" + title + "', children=" + children.size() + "}";
    }
}
