package me.christianrobert.adqlpg.transformer.node;

import me.christianrobert.adqlpg.transformer.fieldinfo.FieldInfos;

/**
 * A node that produces columns (tables, joins, derived tables, queries).
 */
public interface ColumnBearing {

    FieldInfos getFieldInfos();

    void setFieldInfos(FieldInfos fieldInfos);
}
