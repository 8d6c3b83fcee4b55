package me.christianrobert.adqlpg.transformer.fieldinfo;

/**
 * Resolves a (normalized) column name and optional qualifier to its metadata.
 */
@FunctionalInterface
public interface ColumnResolver {

    FieldInfo resolve(String normalizedName, String qualifier);
}
