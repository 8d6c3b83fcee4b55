package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * A character string literal; the value is unescaped.
 */
public class StringLiteral extends FieldInfoedNode {

    private final String value;

    public StringLiteral(String value) {
        super(NodeKind.STRING_LITERAL);
        this.value = value;
    }

    /**
     * Builds the literal from one or more adjacent quoted tokens.
     */
    public static StringLiteral fromTokens(List<String> tokens) {
        StringBuilder sb = new StringBuilder();
        for (String token : tokens) {
            sb.append(token, 1, token.length() - 1);
        }
        return new StringLiteral(sb.toString().replace("''", "'"));
    }

    public String getValue() {
        return value;
    }

    @Override
    public List<AdqlNode> children() {
        return List.of();
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, 0);
        return this;
    }

    @Override
    public String flatten() {
        return "'" + value.replace("'", "''") + "'";
    }
}
