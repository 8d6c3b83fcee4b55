package me.christianrobert.adqlpg.transformer.node;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Function call: numeric and trig functions, aggregates, user defined functions
 * and the geometry functions that are not constructors.
 */
public class FunctionNode extends FieldInfoedNode implements Functional {

    private static final Set<NodeKind> FUNCTION_KINDS = EnumSet.of(
            NodeKind.SET_FUNCTION, NodeKind.COUNT_ALL, NodeKind.NUMERIC_FUNCTION,
            NodeKind.USER_FUNCTION, NodeKind.REGION, NodeKind.CENTROID,
            NodeKind.PREDICATE_GEOMETRY_FUNCTION, NodeKind.DISTANCE_FUNCTION,
            NodeKind.POINT_FUNCTION, NodeKind.AREA);

    private final String functionName;
    private final String quantifier;
    private final List<AdqlNode> args;
    private final List<String> flattenedArgs;

    public FunctionNode(NodeKind kind, String functionName, List<AdqlNode> args) {
        this(kind, functionName, null, args);
    }

    /**
     * @param quantifier DISTINCT or ALL inside an aggregate, null otherwise
     */
    public FunctionNode(NodeKind kind, String functionName, String quantifier, List<AdqlNode> args) {
        super(kind);
        if (!FUNCTION_KINDS.contains(kind)) {
            throw new IllegalArgumentException("Not a function kind: " + kind);
        }
        this.functionName = functionName.toUpperCase(Locale.ROOT);
        this.quantifier = quantifier;
        this.args = List.copyOf(args);
        this.flattenedArgs = this.args.stream().map(AdqlNode::flatten).toList();
    }

    @Override
    public String getFunctionName() {
        return functionName;
    }

    public String getQuantifier() {
        return quantifier;
    }

    @Override
    public List<AdqlNode> getArgs() {
        return args;
    }

    @Override
    public List<String> getFlattenedArgs() {
        return flattenedArgs;
    }

    public AdqlNode getArg(int index) {
        return args.get(index);
    }

    @Override
    public List<AdqlNode> children() {
        return args;
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, args.size());
        return carryAnnotation(new FunctionNode(kind(), functionName, quantifier, newChildren));
    }

    @Override
    public String flatten() {
        if (kind() == NodeKind.COUNT_ALL) {
            return "COUNT(*)";
        }
        return functionName + "(" + (quantifier != null ? quantifier + " " : "")
                + String.join(", ", flattenedArgs) + ")";
    }
}
