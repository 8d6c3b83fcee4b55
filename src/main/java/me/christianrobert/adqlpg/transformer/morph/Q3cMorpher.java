package me.christianrobert.adqlpg.transformer.morph;

import me.christianrobert.adqlpg.transformer.fieldinfo.StcFrames;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.ColumnReference;
import me.christianrobert.adqlpg.transformer.node.FunctionNode;
import me.christianrobert.adqlpg.transformer.node.GeometryNode;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import me.christianrobert.adqlpg.transformer.node.NumericLiteral;
import me.christianrobert.adqlpg.transformer.node.PseudoBoolean;
import me.christianrobert.adqlpg.transformer.node.SqlFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites point-in-shape tests into q3c index functions.
 * <p>
 * Handles {@code CONTAINS(POINT(...), CIRCLE(...))},
 * {@code CONTAINS(POINT(...), POLYGON(...))} and {@code CONTAINS(POINT(...), BOX(...))}
 * with literal geometries in compatible frames. Everything else is left for
 * the pgSphere pass. Coordinates stay in degrees, as q3c expects them.
 * </p>
 */
public class Q3cMorpher {

    private static final Logger log = LoggerFactory.getLogger(Q3cMorpher.class);

    private final Morpher morpher;

    public Q3cMorpher() {
        Map<NodeKind, MorphHandler> handlers = new EnumMap<>(NodeKind.class);
        handlers.put(NodeKind.PREDICATE_GEOMETRY_FUNCTION, Q3cMorpher::morphContains);
        handlers.put(NodeKind.COMPARISON, BooleanCollapse::collapse);
        this.morpher = new Morpher(handlers);
    }

    public MorphResult morph(AdqlNode tree) {
        MorphResult result = morpher.morph(tree);
        log.debug("q3c pass finished with {} warnings", result.getWarnings().size());
        return result;
    }

    private static AdqlNode morphContains(AdqlNode node, MorphState state) {
        FunctionNode predicate = (FunctionNode) node;
        if (!"CONTAINS".equals(predicate.getFunctionName())
                || predicate.getArg(0).kind() != NodeKind.POINT
                || !(predicate.getArg(1) instanceof GeometryNode)) {
            return node;
        }
        GeometryNode point = (GeometryNode) predicate.getArg(0);
        GeometryNode shape = (GeometryNode) predicate.getArg(1);
        if (!StcFrames.isCompatible(point.getFrame(), shape.getFrame())) {
            return node;
        }

        String booleanSql;
        switch (shape.kind()) {
            case CIRCLE:
                booleanSql = circleQuery(point, shape);
                break;
            case POLYGON:
                booleanSql = polyQuery(point, polygonCorners(shape));
                break;
            case BOX:
                booleanSql = polyQuery(point, boxCorners(shape));
                break;
            default:
                return node;
        }
        log.trace("CONTAINS({}, {}) handled by q3c", point.getFunctionName(), shape.getFunctionName());

        state.setKillParentOperator(true);
        PseudoBoolean result = new PseudoBoolean(
                SqlFragment.replacing(node, "(CASE WHEN " + booleanSql + " THEN 1 ELSE 0 END)"), booleanSql);
        result.setFieldInfo(predicate.getFieldInfo());
        return result;
    }

    private static String circleQuery(GeometryNode point, GeometryNode circle) {
        String pointCoords = point.getX().flatten() + ", " + point.getY().flatten();
        String centerCoords = circle.getX().flatten() + ", " + circle.getY().flatten();
        String radius = circle.getRadius().flatten();
        // The index is used on the first pair, which must hold the column coordinates
        if (isLiteral(point.getX()) && isLiteral(point.getY())) {
            return "q3c_join_symmetric(" + pointCoords + ", " + centerCoords + ", " + radius + ")";
        }
        return "q3c_join_symmetric(" + centerCoords + ", " + pointCoords + ", " + radius + ")";
    }

    private static String polyQuery(GeometryNode point, List<String> corners) {
        return "q3c_poly_query(" + point.getX().flatten() + ", " + point.getY().flatten()
                + ", ARRAY[" + String.join(", ", corners) + "])";
    }

    private static List<String> polygonCorners(GeometryNode polygon) {
        List<String> result = new ArrayList<>();
        for (AdqlNode coordinate : polygon.getCoordinates()) {
            result.add(coordinate.flatten());
        }
        return result;
    }

    /**
     * Corners of a box, counterclockwise starting at the lower left.
     */
    private static List<String> boxCorners(GeometryNode box) {
        String x = operand(box.getX());
        String y = operand(box.getY());
        String w = operand(box.getWidth());
        String h = operand(box.getHeight());
        return List.of(
                x + "-" + w + "/2.0", y + "-" + h + "/2.0",
                x + "-" + w + "/2.0", y + "+" + h + "/2.0",
                x + "+" + w + "/2.0", y + "+" + h + "/2.0",
                x + "+" + w + "/2.0", y + "-" + h + "/2.0");
    }

    private static String operand(AdqlNode node) {
        String sql = node.flatten();
        return isSimple(node) ? sql : "(" + sql + ")";
    }

    private static boolean isLiteral(AdqlNode node) {
        return node instanceof NumericLiteral;
    }

    private static boolean isSimple(AdqlNode node) {
        return node instanceof NumericLiteral || node instanceof ColumnReference;
    }
}
