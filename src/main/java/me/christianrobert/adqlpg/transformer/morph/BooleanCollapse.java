package me.christianrobert.adqlpg.transformer.morph;

import me.christianrobert.adqlpg.transformer.context.PseudoBooleanException;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.Comparison;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import me.christianrobert.adqlpg.transformer.node.PseudoBoolean;
import me.christianrobert.adqlpg.transformer.node.SqlFragment;

/**
 * Comparison handler shared by the passes that produce pseudo-booleans.
 * <p>
 * {@code CONTAINS(...) = 1} and {@code CONTAINS(...) != 0} become the boolean
 * SQL, {@code = 0} and {@code != 1} its negation. Any other comparison of a
 * pseudo-boolean is an error.
 * </p>
 */
public final class BooleanCollapse {

    private BooleanCollapse() {
        // Static utility class - prevent instantiation
    }

    public static AdqlNode collapse(AdqlNode node, MorphState state) {
        if (!state.consumeKillParentOperator()) {
            return node;
        }
        Comparison comparison = (Comparison) node;
        PseudoBoolean pseudoBoolean;
        AdqlNode operand;
        if (comparison.getOp1() instanceof PseudoBoolean) {
            pseudoBoolean = (PseudoBoolean) comparison.getOp1();
            operand = comparison.getOp2();
        } else if (comparison.getOp2() instanceof PseudoBoolean) {
            pseudoBoolean = (PseudoBoolean) comparison.getOp2();
            operand = comparison.getOp1();
        } else {
            // The predicate sits deeper in an expression; its integer form stays
            return node;
        }

        String value = operand.flatten().trim();
        if (!"0".equals(value) && !"1".equals(value)) {
            throw new PseudoBooleanException("Pseudo-Booleans in ADQL may only be compared against 0 or 1");
        }
        String operator = comparison.getOperator();
        boolean equals = "=".equals(operator);
        if (!equals && !"!=".equals(operator) && !"<>".equals(operator)) {
            throw new PseudoBooleanException("Pseudo-Booleans in ADQL may only be compared using = or !=");
        }

        boolean negate = equals == "0".equals(value);
        String sql = negate ? "NOT " + pseudoBoolean.getBooleanSql() : pseudoBoolean.getBooleanSql();
        return new SqlFragment(sql, NodeKind.COMPARISON, null);
    }
}
