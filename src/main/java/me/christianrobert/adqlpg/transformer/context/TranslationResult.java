package me.christianrobert.adqlpg.transformer.context;

import me.christianrobert.adqlpg.transformer.fieldinfo.OutputColumn;

import java.util.List;

/**
 * Result of translating one ADQL statement.
 * Contains either the PostgreSQL text with its output columns and warnings, or an error message.
 * Optionally includes the node tree dump for debugging.
 */
public class TranslationResult {

    private final boolean success;
    private final String adql;
    private final String sql;
    private final List<OutputColumn> outputColumns;
    private final List<String> warnings;
    private final String errorMessage;
    private final String nodeTree;  // Optional tree dump (null by default)

    private TranslationResult(boolean success, String adql, String sql, List<OutputColumn> outputColumns,
                              List<String> warnings, String errorMessage, String nodeTree) {
        this.success = success;
        this.adql = adql;
        this.sql = sql;
        this.outputColumns = outputColumns;
        this.warnings = warnings;
        this.errorMessage = errorMessage;
        this.nodeTree = nodeTree;
    }

    /**
     * Creates a successful translation result.
     */
    public static TranslationResult success(String adql, String sql, List<OutputColumn> outputColumns,
                                            List<String> warnings) {
        return successWithTree(adql, sql, outputColumns, warnings, null);
    }

    /**
     * Creates a successful translation result with the node tree dump.
     */
    public static TranslationResult successWithTree(String adql, String sql, List<OutputColumn> outputColumns,
                                                    List<String> warnings, String nodeTree) {
        return new TranslationResult(true, adql, sql, List.copyOf(outputColumns), List.copyOf(warnings), null,
                nodeTree);
    }

    /**
     * Creates a failed translation result.
     */
    public static TranslationResult failure(String adql, String errorMessage) {
        return new TranslationResult(false, adql, null, List.of(), List.of(), errorMessage, null);
    }

    /**
     * Creates a failed translation result from an exception.
     */
    public static TranslationResult failure(String adql, AdqlException exception) {
        return failure(adql, exception.getDetailedMessage());
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getAdql() {
        return adql;
    }

    public String getSql() {
        return sql;
    }

    public List<OutputColumn> getOutputColumns() {
        return outputColumns;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getNodeTree() {
        return nodeTree;
    }

    public boolean hasNodeTree() {
        return nodeTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "TranslationResult{success=true, sql='" + sql + "', warnings=" + warnings.size()
                    + (nodeTree != null ? ", hasNodeTree=true" : "") + "}";
        }
        return "TranslationResult{success=false, error='" + errorMessage + "'}";
    }
}
