package me.christianrobert.adqlpg.transformer.fieldinfo;

import me.christianrobert.adqlpg.transformer.context.AmbiguousColumnException;
import me.christianrobert.adqlpg.transformer.context.ColumnNotFoundException;
import me.christianrobert.adqlpg.transformer.context.TableNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Column metadata of something that has columns (a table, a join, a query).
 * <p>
 * Keeps a name to {@link FieldInfo} map for lookups and the ordered sequence
 * of columns as they appear in the result. A name added twice is marked
 * ambiguous; looking it up raises {@link AmbiguousColumnException}.
 * </p>
 * <p>
 * Names are normalized with {@link #normalizeName(String)}: regular names are
 * compared case-insensitively, quoted names exactly.
 * </p>
 */
public abstract class FieldInfos {

    private final Map<String, FieldInfo> columns = new HashMap<>();
    private final Set<String> ambiguousNames = new HashSet<>();
    private final List<OutputColumn> seq = new ArrayList<>();
    private final List<TableSource> subTables = new ArrayList<>();

    /**
     * Normalizes a column or table name for lookup: names in double quotes lose
     * the quotes and keep their case, all others are lower-cased.
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return null;
        }
        if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
            return name.substring(1, name.length() - 1).replace("\"\"", "\"");
        }
        return name.toLowerCase(Locale.ROOT);
    }

    protected void addColumn(String normalizedName, FieldInfo info) {
        if (columns.containsKey(normalizedName) || ambiguousNames.contains(normalizedName)) {
            columns.remove(normalizedName);
            ambiguousNames.add(normalizedName);
        } else {
            columns.put(normalizedName, info);
        }
        seq.add(new OutputColumn(normalizedName, info));
    }

    protected void addSubTable(TableSource source) {
        subTables.add(source);
    }

    protected void addSubTables(List<TableSource> sources) {
        subTables.addAll(sources);
    }

    public boolean hasColumn(String normalizedName) {
        return columns.containsKey(normalizedName);
    }

    public boolean isAmbiguous(String normalizedName) {
        return ambiguousNames.contains(normalizedName);
    }

    /**
     * Looks up an unqualified column among the columns of this object.
     *
     * @throws AmbiguousColumnException if more than one column has this name
     * @throws ColumnNotFoundException if there is no such column
     */
    public FieldInfo lookupColumn(String normalizedName) {
        if (ambiguousNames.contains(normalizedName)) {
            throw new AmbiguousColumnException(
                    "Column name " + normalizedName + " is ambiguous", normalizedName);
        }
        FieldInfo info = columns.get(normalizedName);
        if (info == null) {
            throw new ColumnNotFoundException("No such field known: " + normalizedName, normalizedName);
        }
        return info;
    }

    /**
     * Resolves a column reference, optionally qualified by a table or correlation name.
     */
    public FieldInfo getFieldInfo(String normalizedName, String qualifier) {
        if (qualifier == null) {
            return lookupColumn(normalizedName);
        }
        return locateTable(qualifier).getFieldInfos().lookupColumn(normalizedName);
    }

    /**
     * Finds the table the qualifier refers to among the tables this object was built from.
     *
     * @throws TableNotFoundException if no table matches
     */
    public TableSource locateTable(String qualifier) {
        for (TableSource source : subTables) {
            if (source.matches(qualifier)) {
                return source;
            }
        }
        throw new TableNotFoundException("No table " + qualifier + " found in FROM clause", qualifier);
    }

    public List<OutputColumn> getSeq() {
        return Collections.unmodifiableList(seq);
    }

    public List<TableSource> getSubTables() {
        return Collections.unmodifiableList(subTables);
    }

    public List<String> getColumnNames() {
        return seq.stream().map(OutputColumn::getName).toList();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + seq;
    }
}
