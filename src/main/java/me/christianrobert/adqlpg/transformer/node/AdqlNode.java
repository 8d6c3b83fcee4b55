package me.christianrobert.adqlpg.transformer.node;

import me.christianrobert.adqlpg.transformer.context.AmbiguousChildException;
import me.christianrobert.adqlpg.transformer.context.NoSuchChildException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Base class of the ADQL syntax tree.
 * <p>
 * Nodes are immutable apart from their annotation slot (see {@link FieldInfoedNode}
 * and {@link ColumnBearingNode}). Rewrites go through {@link #withChildren(List)},
 * which returns a copy with the given children and the annotation of this node.
 * </p>
 */
public abstract class AdqlNode {

    private final NodeKind kind;

    protected AdqlNode(NodeKind kind) {
        this.kind = kind;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * Direct children in source order, including {@link Lexeme} tokens.
     */
    public abstract List<AdqlNode> children();

    /**
     * Returns a copy of this node with the children replaced. The list must match
     * {@link #children()} in size and order.
     */
    public abstract AdqlNode withChildren(List<AdqlNode> newChildren);

    /**
     * Renders this node as SQL text.
     */
    public String flatten() {
        return joinFlattened(children());
    }

    /**
     * Direct children that are not raw tokens.
     */
    public List<AdqlNode> iterNodes() {
        return children().stream().filter(c -> c.kind() != NodeKind.LEXEME).toList();
    }

    /**
     * First descendant of the given kind, depth first, this node excluded; null if none.
     */
    public AdqlNode findFirst(NodeKind wanted) {
        Deque<AdqlNode> stack = new ArrayDeque<>();
        pushReversed(stack, children());
        while (!stack.isEmpty()) {
            AdqlNode current = stack.pop();
            if (current.kind() == wanted) {
                return current;
            }
            pushReversed(stack, current.children());
        }
        return null;
    }

    /**
     * All descendants of the given kind in depth-first order, this node excluded.
     */
    public List<AdqlNode> findAll(NodeKind wanted) {
        List<AdqlNode> result = new ArrayList<>();
        Deque<AdqlNode> stack = new ArrayDeque<>();
        pushReversed(stack, children());
        while (!stack.isEmpty()) {
            AdqlNode current = stack.pop();
            if (current.kind() == wanted) {
                result.add(current);
            }
            pushReversed(stack, current.children());
        }
        return result;
    }

    public List<AdqlNode> childrenOfKind(NodeKind wanted) {
        return children().stream().filter(c -> c.kind() == wanted).toList();
    }

    public AdqlNode uniqueChildOfKind(NodeKind wanted) {
        List<AdqlNode> matches = childrenOfKind(wanted);
        if (matches.isEmpty()) {
            throw new NoSuchChildException("No " + wanted + " child in " + kind);
        }
        if (matches.size() > 1) {
            throw new AmbiguousChildException("More than one " + wanted + " child in " + kind);
        }
        return matches.get(0);
    }

    /**
     * Copies the annotation of this node to a freshly built copy.
     */
    protected void copyAnnotationTo(AdqlNode copy) {
    }

    protected final <T extends AdqlNode> T carryAnnotation(T copy) {
        copyAnnotationTo(copy);
        return copy;
    }

    protected final void checkChildCount(List<AdqlNode> newChildren, int expected) {
        if (newChildren.size() != expected) {
            throw new IllegalArgumentException(kind + " expects " + expected
                    + " children, got " + newChildren.size());
        }
    }

    /**
     * Joins flattened nodes with single spaces, without space before a comma or a
     * closing parenthesis and after an opening one.
     */
    public static String joinFlattened(List<? extends AdqlNode> nodes) {
        StringBuilder sb = new StringBuilder();
        String previous = null;
        for (AdqlNode node : nodes) {
            String text = node.flatten();
            if (text.isEmpty()) {
                continue;
            }
            if (previous != null && !previous.endsWith("(")
                    && !text.equals(",") && !text.equals(")")) {
                sb.append(' ');
            }
            sb.append(text);
            previous = text;
        }
        return sb.toString();
    }

    private static void pushReversed(Deque<AdqlNode> stack, List<AdqlNode> nodes) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            stack.push(nodes.get(i));
        }
    }

    @Override
    public String toString() {
        return kind + "<" + flatten() + ">";
    }
}
