package me.christianrobert.adqlpg.transformer.fieldinfo;

import java.util.List;

/**
 * Source of column metadata for the tables a query references.
 * <p>
 * Called once per table reference in the FROM clause with the table name as
 * written (qualified parts joined by dots, regular identifiers lower-cased).
 * Implementations throw {@link me.christianrobert.adqlpg.transformer.context.TableNotFoundException}
 * for unknown tables; any other exception propagates unchanged.
 * </p>
 */
@FunctionalInterface
public interface TableCatalog {

    List<CatalogColumn> getColumns(String qualifiedTableName);
}
