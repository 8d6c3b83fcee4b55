package me.christianrobert.adqlpg.transformer.fieldinfo;

import java.util.Objects;

/**
 * A column as supplied by a {@link TableCatalog}.
 */
public class CatalogColumn {

    private final String name;
    private final FieldInfo fieldInfo;

    public CatalogColumn(String name, FieldInfo fieldInfo) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Column name cannot be null or empty");
        }
        this.name = name;
        this.fieldInfo = fieldInfo == null ? FieldInfo.DIMENSIONLESS : fieldInfo;
    }

    public String getName() {
        return name;
    }

    public FieldInfo getFieldInfo() {
        return fieldInfo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CatalogColumn that = (CatalogColumn) o;
        return name.equals(that.name) && fieldInfo.equals(that.fieldInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fieldInfo);
    }

    @Override
    public String toString() {
        return name + ": " + fieldInfo;
    }
}
