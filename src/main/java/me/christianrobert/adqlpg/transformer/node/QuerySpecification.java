package me.christianrobert.adqlpg.transformer.node;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code SELECT [quantifier] [TOP n] select_list FROM ... [WHERE] [GROUP BY] [HAVING] [ORDER BY] [OFFSET n]}.
 * <p>
 * {@code limit} is not ADQL; the syntax pass moves TOP there so that it renders
 * as a trailing {@code LIMIT n}.
 * </p>
 */
public class QuerySpecification extends ColumnBearingNode {

    private final String setQuantifier;
    private final Integer setLimit;
    private final SelectList selectList;
    private final FromClause fromClause;
    private final AdqlNode whereClause;
    private final AdqlNode groupByClause;
    private final AdqlNode havingClause;
    private final AdqlNode orderByClause;
    private final Integer offset;
    private final Integer limit;

    public QuerySpecification(String setQuantifier, Integer setLimit, SelectList selectList, FromClause fromClause,
                              AdqlNode whereClause, AdqlNode groupByClause, AdqlNode havingClause,
                              AdqlNode orderByClause, Integer offset, Integer limit) {
        super(NodeKind.QUERY_SPECIFICATION);
        if (selectList == null || fromClause == null) {
            throw new IllegalArgumentException("A query needs a select list and a FROM clause");
        }
        this.setQuantifier = setQuantifier;
        this.setLimit = setLimit;
        this.selectList = selectList;
        this.fromClause = fromClause;
        this.whereClause = whereClause;
        this.groupByClause = groupByClause;
        this.havingClause = havingClause;
        this.orderByClause = orderByClause;
        this.offset = offset;
        this.limit = limit;
    }

    /** DISTINCT, ALL or null. */
    public String getSetQuantifier() {
        return setQuantifier;
    }

    /** The TOP value, null if not given. */
    public Integer getSetLimit() {
        return setLimit;
    }

    public SelectList getSelectList() {
        return selectList;
    }

    public FromClause getFromClause() {
        return fromClause;
    }

    public AdqlNode getWhereClause() {
        return whereClause;
    }

    public AdqlNode getGroupByClause() {
        return groupByClause;
    }

    public AdqlNode getHavingClause() {
        return havingClause;
    }

    public AdqlNode getOrderByClause() {
        return orderByClause;
    }

    public Integer getOffset() {
        return offset;
    }

    public Integer getLimit() {
        return limit;
    }

    public List<String> getContributingNames() {
        return TableName.collectNames(this);
    }

    public QuerySpecification withSetLimit(Integer newSetLimit) {
        return carryAnnotation(new QuerySpecification(setQuantifier, newSetLimit, selectList, fromClause,
                whereClause, groupByClause, havingClause, orderByClause, offset, limit));
    }

    public QuerySpecification withOffset(Integer newOffset) {
        return carryAnnotation(new QuerySpecification(setQuantifier, setLimit, selectList, fromClause,
                whereClause, groupByClause, havingClause, orderByClause, newOffset, limit));
    }

    public QuerySpecification withLimit(Integer newLimit) {
        return carryAnnotation(new QuerySpecification(setQuantifier, setLimit, selectList, fromClause,
                whereClause, groupByClause, havingClause, orderByClause, offset, newLimit));
    }

    @Override
    public List<AdqlNode> children() {
        List<AdqlNode> result = new ArrayList<>();
        result.add(selectList);
        result.add(fromClause);
        for (AdqlNode clause : new AdqlNode[]{whereClause, groupByClause, havingClause, orderByClause}) {
            if (clause != null) {
                result.add(clause);
            }
        }
        return result;
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, children().size());
        int index = 2;
        AdqlNode newWhere = whereClause == null ? null : newChildren.get(index++);
        AdqlNode newGroupBy = groupByClause == null ? null : newChildren.get(index++);
        AdqlNode newHaving = havingClause == null ? null : newChildren.get(index++);
        AdqlNode newOrderBy = orderByClause == null ? null : newChildren.get(index);
        return carryAnnotation(new QuerySpecification(setQuantifier, setLimit,
                (SelectList) newChildren.get(0), (FromClause) newChildren.get(1),
                newWhere, newGroupBy, newHaving, newOrderBy, offset, limit));
    }

    @Override
    public String flatten() {
        StringBuilder sb = new StringBuilder("SELECT");
        if (setQuantifier != null) {
            sb.append(' ').append(setQuantifier);
        }
        if (setLimit != null) {
            sb.append(" TOP ").append(setLimit);
        }
        sb.append(' ').append(selectList.flatten());
        sb.append(' ').append(fromClause.flatten());
        for (AdqlNode clause : new AdqlNode[]{whereClause, groupByClause, havingClause, orderByClause}) {
            if (clause != null) {
                sb.append(' ').append(clause.flatten());
            }
        }
        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        }
        if (offset != null) {
            sb.append(" OFFSET ").append(offset);
        }
        return sb.toString();
    }
}
