package me.christianrobert.adqlpg.transformer.fieldinfo;

import java.util.List;
import java.util.Set;

/**
 * Column metadata of a table-like FROM clause element.
 */
public class TableFieldInfos extends FieldInfos {

    private TableFieldInfos() {
    }

    /**
     * Columns of a catalog table.
     */
    public static TableFieldInfos forTable(String originalName, String alias, List<CatalogColumn> catalogColumns) {
        TableFieldInfos result = new TableFieldInfos();
        for (CatalogColumn column : catalogColumns) {
            result.addColumn(normalizeName(column.getName()), column.getFieldInfo());
        }
        result.addSubTable(new TableSource(originalName, alias, result));
        return result;
    }

    /**
     * Columns of a subquery used as a table.
     */
    public static TableFieldInfos forDerivedTable(String alias, FieldInfos queryInfos) {
        TableFieldInfos result = new TableFieldInfos();
        for (OutputColumn column : queryInfos.getSeq()) {
            result.addColumn(column.getName(), column.getFieldInfo());
        }
        result.addSubTable(new TableSource(null, alias, result));
        return result;
    }

    /**
     * Columns of a join. Common columns (the shared names of a NATURAL join, the
     * USING list) appear once, at the position and with the metadata of the left side.
     */
    public static TableFieldInfos forJoin(FieldInfos left, FieldInfos right, Set<String> commonColumns) {
        TableFieldInfos result = new TableFieldInfos();
        for (OutputColumn column : left.getSeq()) {
            result.addColumn(column.getName(), column.getFieldInfo());
        }
        for (OutputColumn column : right.getSeq()) {
            if (!commonColumns.contains(column.getName())) {
                result.addColumn(column.getName(), column.getFieldInfo());
            }
        }
        result.addSubTables(left.getSubTables());
        result.addSubTables(right.getSubTables());
        return result;
    }

    /**
     * Columns of a comma separated FROM list: the plain concatenation of its elements.
     */
    public static TableFieldInfos forFromClause(List<FieldInfos> elements) {
        TableFieldInfos result = new TableFieldInfos();
        for (FieldInfos element : elements) {
            for (OutputColumn column : element.getSeq()) {
                result.addColumn(column.getName(), column.getFieldInfo());
            }
            result.addSubTables(element.getSubTables());
        }
        return result;
    }
}
