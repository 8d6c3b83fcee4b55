package me.christianrobert.adqlpg.transformer.parser;

import me.christianrobert.adqlpg.transformer.context.AdqlSyntaxException;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of parsing an ADQL statement.
 * Contains the parse tree and any syntax errors encountered.
 */
public class ParseResult {

    private final ParserRuleContext tree;
    private final List<SyntaxError> errors;
    private final String originalAdql;

    public ParseResult(ParserRuleContext tree, List<SyntaxError> errors, String originalAdql) {
        this.tree = tree;
        this.errors = new ArrayList<>(errors);
        this.originalAdql = originalAdql;
    }

    /**
     * Gets the ANTLR parse tree root node.
     */
    public ParserRuleContext getTree() {
        return tree;
    }

    /**
     * Gets the syntax errors encountered during lexing and parsing, in order.
     */
    public List<SyntaxError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Gets the original ADQL that was parsed.
     */
    public String getOriginalAdql() {
        return originalAdql;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Gets a formatted error message combining all errors.
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        List<String> lines = new ArrayList<>();
        for (SyntaxError error : errors) {
            lines.add(error.toString());
        }
        return String.join("\n", lines);
    }

    /**
     * Converts the first error into the exception callers see; null if parsing succeeded.
     */
    public AdqlSyntaxException toException() {
        if (errors.isEmpty()) {
            return null;
        }
        SyntaxError first = errors.get(0);
        return new AdqlSyntaxException("Could not parse your query: " + first.getMessage(),
                originalAdql, first.getOffset(), first.getLine(), first.getColumn());
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + isSuccess() + ", errors=" + errors.size() + "}";
    }

    /**
     * One syntax error with its position in the statement.
     */
    public static class SyntaxError {

        private final int offset;
        private final int line;
        private final int column;
        private final String message;

        public SyntaxError(int offset, int line, int column, String message) {
            this.offset = offset;
            this.line = line;
            this.column = column;
            this.message = message;
        }

        public int getOffset() {
            return offset;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return String.format("Line %d:%d - %s", line, column, message);
        }
    }
}
