package me.christianrobert.adqlpg.transformer.node;

import me.christianrobert.adqlpg.transformer.fieldinfo.FieldInfo;

/**
 * A node with an expression value, annotated with its metadata.
 */
public interface FieldInfoed {

    FieldInfo getFieldInfo();

    void setFieldInfo(FieldInfo fieldInfo);
}
