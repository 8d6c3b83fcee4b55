package me.christianrobert.adqlpg.transformer.node;

/**
 * Closed set of node kinds. Morph handlers are registered per kind.
 */
public enum NodeKind {
    // Queries
    QUERY_SPECIFICATION,
    SET_EXPRESSION,
    SUBQUERY,
    SELECT_LIST,
    DERIVED_COLUMN,
    QUALIFIED_STAR,

    // FROM clause
    FROM_CLAUSE,
    TABLE_NAME,
    PLAIN_TABLE_REFERENCE,
    DERIVED_TABLE,
    JOINED_TABLE,
    JOIN_SPECIFICATION,

    // Other clauses
    WHERE_CLAUSE,
    GROUP_BY_CLAUSE,
    HAVING_CLAUSE,
    ORDER_BY_CLAUSE,
    SORT_SPECIFICATION,

    // Search conditions
    SEARCH_CONDITION,
    BOOLEAN_TERM,
    BOOLEAN_FACTOR,
    PARENTHESIZED_CONDITION,
    COMPARISON,
    BETWEEN_PREDICATE,
    IN_PREDICATE,
    LIKE_PREDICATE,
    NULL_PREDICATE,
    EXISTS_PREDICATE,

    // Value expressions
    COLUMN_REFERENCE,
    NUMERIC_LITERAL,
    STRING_LITERAL,
    NUMERIC_VALUE_EXPRESSION,
    TERM,
    FACTOR,
    CHARACTER_VALUE_EXPRESSION,
    PARENTHESIZED_EXPRESSION,

    // Functions
    SET_FUNCTION,
    COUNT_ALL,
    NUMERIC_FUNCTION,
    USER_FUNCTION,

    // Geometry
    POINT,
    CIRCLE,
    BOX,
    POLYGON,
    REGION,
    REGION_UNION,
    REGION_INTERSECTION,
    REGION_NOT,
    CENTROID,
    PREDICATE_GEOMETRY_FUNCTION,
    DISTANCE_FUNCTION,
    POINT_FUNCTION,
    AREA,

    // Produced by morphing
    SQL_FRAGMENT,
    PSEUDO_BOOLEAN,

    // Raw token kept for flattening
    LEXEME;

    public boolean isGeometryConstructor() {
        return this == POINT || this == CIRCLE || this == BOX || this == POLYGON;
    }

    public boolean isCompoundRegion() {
        return this == REGION_UNION || this == REGION_INTERSECTION || this == REGION_NOT;
    }
}
