package me.christianrobert.adqlpg.transformer.node;

import me.christianrobert.adqlpg.transformer.fieldinfo.FieldInfo;

public abstract class FieldInfoedNode extends AdqlNode implements FieldInfoed {

    private FieldInfo fieldInfo;

    protected FieldInfoedNode(NodeKind kind) {
        super(kind);
    }

    @Override
    public FieldInfo getFieldInfo() {
        return fieldInfo;
    }

    @Override
    public void setFieldInfo(FieldInfo fieldInfo) {
        this.fieldInfo = fieldInfo;
    }

    @Override
    protected void copyAnnotationTo(AdqlNode copy) {
        if (copy instanceof FieldInfoed && ((FieldInfoed) copy).getFieldInfo() == null) {
            ((FieldInfoed) copy).setFieldInfo(fieldInfo);
        }
    }
}
