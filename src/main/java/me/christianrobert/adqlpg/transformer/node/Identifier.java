package me.christianrobert.adqlpg.transformer.node;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A regular or delimited (double-quoted) SQL identifier.
 */
public class Identifier {

    private final String text;
    private final boolean delimited;

    public Identifier(String text, boolean delimited) {
        if (text == null || (text.isEmpty() && !delimited)) {
            throw new IllegalArgumentException("Identifier text cannot be empty");
        }
        this.text = text;
        this.delimited = delimited;
    }

    public static Identifier regular(String text) {
        return new Identifier(text, false);
    }

    public static Identifier delimited(String text) {
        return new Identifier(text, true);
    }

    /**
     * Parses the token text of an identifier, unquoting delimited ones.
     */
    public static Identifier fromToken(String tokenText) {
        if (tokenText.startsWith("\"")) {
            return delimited(tokenText.substring(1, tokenText.length() - 1).replace("\"\"", "\""));
        }
        return regular(tokenText);
    }

    public String getText() {
        return text;
    }

    public boolean isDelimited() {
        return delimited;
    }

    /**
     * Lookup key: lower case for regular identifiers, exact text for delimited ones.
     */
    public String normalized() {
        return delimited ? text : text.toLowerCase(Locale.ROOT);
    }

    public String flatten() {
        return delimited ? "\"" + text.replace("\"", "\"\"") + "\"" : text;
    }

    public static String flattenAll(List<Identifier> parts) {
        return parts.stream().map(Identifier::flatten).collect(Collectors.joining("."));
    }

    public static String normalizeAll(List<Identifier> parts) {
        return parts.stream().map(Identifier::normalized).collect(Collectors.joining("."));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identifier that = (Identifier) o;
        return delimited == that.delimited && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, delimited);
    }

    @Override
    public String toString() {
        return flatten();
    }
}
