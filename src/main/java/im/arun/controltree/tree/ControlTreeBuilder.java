package im.arun.controltree.tree;

import im.arun.controltree.model.BuildDiagnostics;
import im.arun.controltree.model.ControlNode;
import im.arun.controltree.model.ControlTree;
import im.arun.controltree.parse.IdentifierMatcher;
import im.arun.controltree.parse.ParsedBlob;
import im.arun.controltree.parse.TitleExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the control tree from blobs using identifier depth (1 -> 1.1 -> 1.1.1, A1 -> A1.1).
 *
 * <p>The parent of a depth-{@code d} node is the node most recently attached at depth {@code d-1},
 * or the root when there is none. Depths may be skipped or revisited, so the index is a sparse
 * "last seen at level" map rather than a stack. A builder is single-use.
 */
public class ControlTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ControlTreeBuilder.class);

    /** Result of offering one blob to the builder. */
    public enum Outcome {
        ATTACHED,
        /** The blob does not start with an identifier; it contributes no node. */
        UNPARSEABLE_BLOB
    }

    private final TitleExtractor titleExtractor;
    private final ControlNode root = ControlTree.newRoot();
    private final Map<Integer, ControlNode> lastByDepth = new HashMap<>();
    private final Set<String> seenIdentifiers = new HashSet<>();
    private final List<String> unparseableBlobs = new ArrayList<>();
    private final List<String> duplicateIdentifiers = new ArrayList<>();
    private boolean built;

    public ControlTreeBuilder() {
        this(new TitleExtractor());
    }

    public ControlTreeBuilder(TitleExtractor titleExtractor) {
        this.titleExtractor = titleExtractor;
        lastByDepth.put(0, root);
    }

    /**
     * Build a tree from blobs in one pass.
     */
    public static ControlTree fromBlobs(List<String> blobs) {
        ControlTreeBuilder builder = new ControlTreeBuilder();
        for (String blob : blobs) {
            builder.addBlob(blob);
        }
        return builder.build();
    }

    /**
     * Create a node from the blob and attach it according to its identifier depth.
     */
    public Outcome addBlob(String blob) {
        checkNotBuilt();

        ParsedBlob parsed = titleExtractor.extract(blob);
        if (!parsed.hasIdentifier()) {
            unparseableBlobs.add(blob);
            logger.debug("Skipping blob without identifier: {}", abbreviate(blob));
            return Outcome.UNPARSEABLE_BLOB;
        }
        attach(parsed.getIdentifier(), parsed.getTitle());
        return Outcome.ATTACHED;
    }

    /**
     * Attach an already parsed identifier and title, e.g. when rebuilding from serialized items.
     * The title is taken as-is and may be empty.
     */
    public void addNode(String identifier, String title) {
        checkNotBuilt();
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be blank");
        }
        attach(identifier.strip(), title == null ? "" : title);
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("Tree already built");
        }
    }

    private void attach(String identifier, String title) {
        int depth = IdentifierMatcher.depthOf(identifier);
        ControlNode node = new ControlNode(identifier, title, depth);

        ControlNode parent = lastByDepth.getOrDefault(depth - 1, root);
        parent.addChild(node);
        lastByDepth.put(depth, node);

        if (!seenIdentifiers.add(identifier)) {
            duplicateIdentifiers.add(identifier);
            logger.debug("Identifier {} seen again, attached as a separate sibling", identifier);
        }
    }

    /**
     * Finish construction. The depth index is released; further blobs are rejected.
     */
    public ControlTree build() {
        built = true;
        lastByDepth.clear();
        seenIdentifiers.clear();
        return new ControlTree(root, new BuildDiagnostics(unparseableBlobs, duplicateIdentifiers));
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 60 ? text.substring(0, 60) + "..." : text;
    }
}
