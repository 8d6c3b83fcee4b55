package me.christianrobert.adqlpg.transformer.fieldinfo;

import java.util.Objects;

/**
 * One column of a query result: its output name and inferred metadata.
 */
public class OutputColumn {

    private final String name;
    private final FieldInfo fieldInfo;

    public OutputColumn(String name, FieldInfo fieldInfo) {
        this.name = name;
        this.fieldInfo = fieldInfo;
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
        OutputColumn that = (OutputColumn) o;
        return name.equals(that.name) && Objects.equals(fieldInfo, that.fieldInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fieldInfo);
    }

    @Override
    public String toString() {
        return name + " " + fieldInfo;
    }
}
