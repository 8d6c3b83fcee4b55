package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * A raw token (keyword, operator, punctuation) kept between node children.
 */
public class Lexeme extends AdqlNode {

    private final String text;

    public Lexeme(String text) {
        super(NodeKind.LEXEME);
        this.text = text;
    }

    public static Lexeme of(String text) {
        return new Lexeme(text);
    }

    public String getText() {
        return text;
    }

    public boolean is(String keyword) {
        return text.equalsIgnoreCase(keyword);
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
        return text;
    }
}
