package me.christianrobert.adqlpg.transformer.fieldinfo;

/**
 * A single table in a FROM clause (catalog table or derived table) as seen by
 * column qualifiers.
 */
public class TableSource {

    private final String originalName;
    private final String alias;
    private final FieldInfos fieldInfos;

    /**
     * @param originalName normalized catalog name, null for derived tables
     * @param alias normalized correlation name, null if unaliased
     */
    public TableSource(String originalName, String alias, FieldInfos fieldInfos) {
        if (originalName == null && alias == null) {
            throw new IllegalArgumentException("A table source needs a name or an alias");
        }
        this.originalName = originalName;
        this.alias = alias;
        this.fieldInfos = fieldInfos;
    }

    public String getOriginalName() {
        return originalName;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * The name columns use to refer to this table.
     */
    public String getReferenceName() {
        return alias != null ? alias : originalName;
    }

    public FieldInfos getFieldInfos() {
        return fieldInfos;
    }

    /**
     * An aliased table only answers to its alias. An unaliased one answers to its
     * qualified name and to its unqualified table name.
     */
    public boolean matches(String qualifier) {
        if (alias != null) {
            return alias.equals(qualifier);
        }
        if (originalName.equals(qualifier)) {
            return true;
        }
        int dot = originalName.lastIndexOf('.');
        return dot >= 0 && originalName.substring(dot + 1).equals(qualifier);
    }

    @Override
    public String toString() {
        return alias != null ? originalName + " AS " + alias : originalName;
    }
}
