package ai.brokk.doctest.source;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Small helpers over tree-sitter nodes that hide the difference between a Java null and a null node. */
final class AstTraversal {
    static final String COMMENT = "comment";

    private AstTraversal() {}

    static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    static List<TSNode> namedChildren(TSNode node) {
        var children = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (isPresent(child)) {
                children.add(child);
            }
        }
        return children;
    }

    /** The named children of a statement container that are statements, i.e. everything except comments. */
    static List<TSNode> statements(TSNode container) {
        return namedChildren(container).stream()
                .filter(n -> !COMMENT.equals(n.getType()))
                .toList();
    }

    /** 0-based line on which {@code node} starts. */
    static int row(TSNode node) {
        return node.getStartPoint().getRow();
    }
}
