package im.arun.controltree.output;

import im.arun.controltree.model.ControlTree;

/**
 * Renders a control tree as text. Implementations walk the tree depth first, parent before
 * children, children in insertion order.
 */
public interface ControlTreeFormatter {

    String format(ControlTree tree);
}
