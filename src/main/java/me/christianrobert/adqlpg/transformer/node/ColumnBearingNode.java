package me.christianrobert.adqlpg.transformer.node;

import me.christianrobert.adqlpg.transformer.fieldinfo.FieldInfos;

public abstract class ColumnBearingNode extends AdqlNode implements ColumnBearing {

    private FieldInfos fieldInfos;

    protected ColumnBearingNode(NodeKind kind) {
        super(kind);
    }

    @Override
    public FieldInfos getFieldInfos() {
        return fieldInfos;
    }

    @Override
    public void setFieldInfos(FieldInfos fieldInfos) {
        this.fieldInfos = fieldInfos;
    }

    @Override
    protected void copyAnnotationTo(AdqlNode copy) {
        if (copy instanceof ColumnBearing && ((ColumnBearing) copy).getFieldInfos() == null) {
            ((ColumnBearing) copy).setFieldInfos(fieldInfos);
        }
    }
}
