package me.christianrobert.adqlpg.transformer.context;

/**
 * Raised when a statement is rejected by the grammar or by the identifier rules
 * (reserved words, user function prefixes).
 */
public class AdqlSyntaxException extends AdqlException {

    private final int offset;
    private final int line;
    private final int column;

    public AdqlSyntaxException(String message, int offset, int line, int column) {
        super(message);
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    public AdqlSyntaxException(String message, String adql, int offset, int line, int column) {
        super(message, adql, "ANTLR parsing");
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    /**
     * Character offset of the offending token in the statement, -1 if unknown.
     */
    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getDetailedMessage() {
        return super.getDetailedMessage() + "\nPosition: line " + line + ", column " + column
                + " (offset " + offset + ")";
    }
}
