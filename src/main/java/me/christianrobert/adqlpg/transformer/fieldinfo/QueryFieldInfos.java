package me.christianrobert.adqlpg.transformer.fieldinfo;

import me.christianrobert.adqlpg.transformer.context.ColumnNotFoundException;

/**
 * Column metadata of a query specification.
 * <p>
 * The query's own columns are its select list. Expressions in the select list
 * are resolved against the FROM clause only
 * ({@link #getFieldInfoFromSources}); WHERE, GROUP BY, HAVING and ORDER BY
 * also see the select list aliases, which take precedence ({@link #getFieldInfo}).
 * </p>
 */
public class QueryFieldInfos extends FieldInfos {

    private final FieldInfos fromInfos;

    public QueryFieldInfos(FieldInfos fromInfos) {
        this.fromInfos = fromInfos;
        addSubTables(fromInfos.getSubTables());
    }

    /**
     * Copies the columns of another query under the same names; used for set operations.
     */
    public static QueryFieldInfos copyOf(FieldInfos other) {
        QueryFieldInfos result = new QueryFieldInfos(other instanceof QueryFieldInfos
                ? ((QueryFieldInfos) other).fromInfos
                : other);
        for (OutputColumn column : other.getSeq()) {
            result.addColumn(column.getName(), column.getFieldInfo());
        }
        return result;
    }

    public void addOutputColumn(String normalizedName, FieldInfo info) {
        addColumn(normalizedName, info);
    }

    public FieldInfos getFromInfos() {
        return fromInfos;
    }

    public FieldInfo getFieldInfoFromSources(String normalizedName, String qualifier) {
        return fromInfos.getFieldInfo(normalizedName, qualifier);
    }

    @Override
    public FieldInfo getFieldInfo(String normalizedName, String qualifier) {
        if (qualifier == null && hasColumn(normalizedName)) {
            return lookupColumn(normalizedName);
        }
        try {
            return getFieldInfoFromSources(normalizedName, qualifier);
        } catch (ColumnNotFoundException e) {
            if (qualifier == null && isAmbiguous(normalizedName)) {
                return lookupColumn(normalizedName);
            }
            throw e;
        }
    }
}
