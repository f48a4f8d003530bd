package org.dynamis.async.ast;

import com.github.javaparser.ast.Node;
import com.github.javaparser.utils.PositionUtils;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pre-order numbering of a subtree. A node's ordinal orders it against every other node of the
 * same tree the way their source text is ordered; {@link #end(Node)} is the largest ordinal found
 * inside the node, so {@code [ordinal, end]} is the node's extent.
 */
public final class SourceOrder {

    private final Map<Node, Integer> ordinals = new IdentityHashMap<>();
    private final Map<Node, Integer> ends = new IdentityHashMap<>();

    private SourceOrder() {}

    public static SourceOrder of(Node root) {
        SourceOrder order = new SourceOrder();
        order.number(root, 0);
        return order;
    }

    public int ordinal(Node node) {
        Integer ordinal = ordinals.get(node);
        if (ordinal == null) {
            throw new IllegalArgumentException("Node is not part of the numbered tree: " + node);
        }
        return ordinal;
    }

    public int end(Node node) {
        Integer end = ends.get(node);
        if (end == null) {
            throw new IllegalArgumentException("Node is not part of the numbered tree: " + node);
        }
        return end;
    }

    private int number(Node node, int next) {
        ordinals.put(node, next++);
        for (Node child : childrenInSourceOrder(node)) {
            next = number(child, next);
        }
        ends.put(node, next - 1);
        return next;
    }

    private static List<Node> childrenInSourceOrder(Node node) {
        List<Node> children = new ArrayList<>(node.getChildNodes());
        // Synthesized nodes have no range; their construction order is the best we have.
        if (children.stream().allMatch(c -> c.getRange().isPresent())) {
            PositionUtils.sortByBeginPosition(children);
        }
        return children;
    }
}
