package me.christianrobert.adqlpg.transformer.node;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Union, intersection or negation of regions, produced when a REGION argument
 * is an STC-S compound. Only usable as an operand of CONTAINS or INTERSECTS.
 */
public class CompoundRegion extends FieldInfoedNode {

    private final String frame;
    private final List<AdqlNode> operands;
    private final String sourceText;

    /**
     * @param sourceText the region specification this was parsed from; null for nested compounds
     */
    public CompoundRegion(NodeKind kind, String frame, List<AdqlNode> operands, String sourceText) {
        super(kind);
        if (!kind.isCompoundRegion()) {
            throw new IllegalArgumentException("Not a compound region kind: " + kind);
        }
        if (kind == NodeKind.REGION_NOT ? operands.size() != 1 : operands.size() < 2) {
            throw new IllegalArgumentException("Bad operand count for " + kind + ": " + operands.size());
        }
        this.frame = frame;
        this.operands = List.copyOf(operands);
        this.sourceText = sourceText;
    }

    public String getFrame() {
        return frame;
    }

    public List<AdqlNode> getOperands() {
        return operands;
    }

    public String getSourceText() {
        return sourceText;
    }

    @Override
    public List<AdqlNode> children() {
        return operands;
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        return carryAnnotation(new CompoundRegion(kind(), frame, newChildren, sourceText));
    }

    @Override
    public String flatten() {
        if (sourceText != null) {
            return "REGION('" + sourceText.replace("'", "''") + "')";
        }
        return kind().name() + "("
                + operands.stream().map(AdqlNode::flatten).collect(Collectors.joining(", ")) + ")";
    }
}
