package me.christianrobert.adqlpg.transformer.morph;

import me.christianrobert.adqlpg.transformer.context.NoDualTransformException;
import me.christianrobert.adqlpg.transformer.context.UnsupportedConstructException;
import me.christianrobert.adqlpg.transformer.fieldinfo.FieldInfo;
import me.christianrobert.adqlpg.transformer.fieldinfo.StcFrames;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.CompoundRegion;
import me.christianrobert.adqlpg.transformer.node.FieldInfoed;
import me.christianrobert.adqlpg.transformer.node.FunctionNode;
import me.christianrobert.adqlpg.transformer.node.GeometryNode;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import me.christianrobert.adqlpg.transformer.node.NumericLiteral;
import me.christianrobert.adqlpg.transformer.node.PseudoBoolean;
import me.christianrobert.adqlpg.transformer.node.SqlFragment;
import me.christianrobert.adqlpg.transformer.ufunc.UserFunction;
import me.christianrobert.adqlpg.transformer.ufunc.UserFunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Translates ADQL geometry and math into pgSphere and PostgreSQL.
 * <p>
 * Geometry constructors become pgSphere values (angles in radians),
 * CONTAINS and INTERSECTS become the {@code @} and {@code &&} operators,
 * and functions PostgreSQL spells differently are rewritten. User defined
 * functions with an SQL expansion are expanded here as well.
 * </p>
 */
public class PgSphereMorpher {

    private static final Logger log = LoggerFactory.getLogger(PgSphereMorpher.class);

    /** Square degrees per steradian. */
    private static final String SQDEG_PER_SR = "3282.806350011744";

    private static final BigInteger SEED_MODULUS = BigInteger.ONE.shiftLeft(31);

    private final UserFunctionRegistry userFunctions;
    private final Morpher morpher;

    public PgSphereMorpher() {
        this(new UserFunctionRegistry());
    }

    public PgSphereMorpher(UserFunctionRegistry userFunctions) {
        this.userFunctions = userFunctions;
        Map<NodeKind, MorphHandler> handlers = new EnumMap<>(NodeKind.class);
        handlers.put(NodeKind.POINT, PgSphereMorpher::morphPoint);
        handlers.put(NodeKind.CIRCLE, PgSphereMorpher::morphCircle);
        handlers.put(NodeKind.POLYGON, PgSphereMorpher::morphPolygon);
        handlers.put(NodeKind.BOX, PgSphereMorpher::morphBox);
        handlers.put(NodeKind.PREDICATE_GEOMETRY_FUNCTION, PgSphereMorpher::morphPredicate);
        handlers.put(NodeKind.COMPARISON, BooleanCollapse::collapse);
        handlers.put(NodeKind.POINT_FUNCTION, PgSphereMorpher::morphPointFunction);
        handlers.put(NodeKind.AREA, PgSphereMorpher::morphArea);
        handlers.put(NodeKind.DISTANCE_FUNCTION, PgSphereMorpher::morphDistance);
        handlers.put(NodeKind.CENTROID, PgSphereMorpher::morphCentroid);
        handlers.put(NodeKind.NUMERIC_FUNCTION, PgSphereMorpher::morphNumericFunction);
        handlers.put(NodeKind.USER_FUNCTION, this::morphUserFunction);
        this.morpher = new Morpher(handlers);
    }

    public MorphResult morph(AdqlNode tree) {
        checkCompoundRegions(tree, null);
        MorphResult result = morpher.morph(tree);
        log.debug("pgSphere pass finished with {} warnings", result.getWarnings().size());
        return result;
    }

    /**
     * Compound regions have no pgSphere type; they are only translatable as an operand of a predicate.
     */
    private static void checkCompoundRegions(AdqlNode node, NodeKind parentKind) {
        if (node.kind().isCompoundRegion() && parentKind != NodeKind.PREDICATE_GEOMETRY_FUNCTION
                && (parentKind == null || !parentKind.isCompoundRegion())) {
            throw new UnsupportedConstructException(
                    "Compound regions can only be used as arguments of CONTAINS or INTERSECTS");
        }
        for (AdqlNode child : node.children()) {
            checkCompoundRegions(child, node.kind());
        }
    }

    // ---- geometry constructors

    private static AdqlNode morphPoint(AdqlNode node, MorphState state) {
        GeometryNode point = (GeometryNode) node;
        return SqlFragment.replacing(node, spoint(point.getX().flatten(), point.getY().flatten()));
    }

    private static AdqlNode morphCircle(AdqlNode node, MorphState state) {
        GeometryNode circle = (GeometryNode) node;
        return SqlFragment.replacing(node, "scircle(" + spoint(circle.getX().flatten(), circle.getY().flatten())
                + ", RADIANS(" + circle.getRadius().flatten() + "))");
    }

    private static AdqlNode morphPolygon(AdqlNode node, MorphState state) {
        GeometryNode polygon = (GeometryNode) node;
        List<String> points = new ArrayList<>();
        for (List<AdqlNode> vertex : polygon.getVertices()) {
            points.add(spoint(vertex.get(0).flatten(), vertex.get(1).flatten()));
        }
        return SqlFragment.replacing(node, spoly(points));
    }

    private static AdqlNode morphBox(AdqlNode node, MorphState state) {
        GeometryNode box = (GeometryNode) node;
        String x = "RADIANS(" + box.getX().flatten() + ")";
        String y = "RADIANS(" + box.getY().flatten() + ")";
        String w = "RADIANS(" + box.getWidth().flatten() + ")/2";
        String h = "RADIANS(" + box.getHeight().flatten() + ")/2";
        List<String> points = List.of(
                "spoint(" + x + "-" + w + ", " + y + "-" + h + ")",
                "spoint(" + x + "-" + w + ", " + y + "+" + h + ")",
                "spoint(" + x + "+" + w + ", " + y + "+" + h + ")",
                "spoint(" + x + "+" + w + ", " + y + "-" + h + ")");
        return SqlFragment.replacing(node, spoly(points));
    }

    private static String spoint(String x, String y) {
        return "spoint(RADIANS(" + x + "), RADIANS(" + y + "))";
    }

    /**
     * spoly has no constructor from a list of points; the aggregate needs the vertices in order.
     */
    private static String spoly(List<String> points) {
        List<String> rows = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            rows.add("(" + i + ", " + points.get(i) + ")");
        }
        return "(SELECT spoly(q.p) FROM (VALUES " + String.join(", ", rows)
                + " ORDER BY column1) as q(ind,p))";
    }

    // ---- CONTAINS and INTERSECTS

    private static AdqlNode morphPredicate(AdqlNode node, MorphState state) {
        FunctionNode predicate = (FunctionNode) node;
        AdqlNode arg1 = predicate.getArg(0);
        AdqlNode arg2 = predicate.getArg(1);
        String operator = "CONTAINS".equals(predicate.getFunctionName()) ? "@" : "&&";

        // There is no && for points; a point intersecting a region is contained in it
        if ("&&".equals(operator)) {
            if (isConstructed(arg2, NodeKind.POINT)) {
                AdqlNode swap = arg1;
                arg1 = arg2;
                arg2 = swap;
                operator = "@";
            } else if (isConstructed(arg1, NodeKind.POINT)) {
                operator = "@";
            }
        }

        if (arg1 instanceof CompoundRegion && arg2 instanceof CompoundRegion) {
            throw new NoDualTransformException("Cannot handle compound regions on both sides of "
                    + predicate.getFunctionName());
        }

        // The literal operand is rotated into the frame of the other one
        String targetFrame;
        boolean transformFirst;
        if (isLiteral(arg1) == isLiteral(arg2)) {
            transformFirst = true;
            targetFrame = frameOf(arg2);
        } else {
            transformFirst = isLiteral(arg1);
            targetFrame = frameOf(transformFirst ? arg2 : arg1);
        }

        String booleanSql;
        if (arg1 instanceof CompoundRegion) {
            String other = transformFirst ? arg2.flatten() : transformed(arg2, frameOf(arg1), state);
            booleanSql = distribute((CompoundRegion) arg1, other, true, operator, transformFirst ? targetFrame : null,
                    state);
        } else if (arg2 instanceof CompoundRegion) {
            String other = transformFirst ? transformed(arg1, frameOf(arg2), state) : arg1.flatten();
            booleanSql = distribute((CompoundRegion) arg2, other, false, operator, transformFirst ? null : targetFrame,
                    state);
        } else {
            String sql1 = transformFirst ? transformed(arg1, targetFrame, state) : arg1.flatten();
            String sql2 = transformFirst ? arg2.flatten() : transformed(arg2, targetFrame, state);
            booleanSql = compare(sql1, operator, sql2);
        }

        state.setKillParentOperator(true);
        PseudoBoolean result = new PseudoBoolean(
                SqlFragment.replacing(node, "(CASE WHEN " + booleanSql + " THEN 1 ELSE 0 END)"), booleanSql);
        result.setFieldInfo(predicate.getFieldInfo());
        return result;
    }

    private static String compare(String sql1, String operator, String sql2) {
        return "((" + sql1 + ") " + operator + " (" + sql2 + "))";
    }

    /**
     * Expands a compound region operand into a boolean combination of simple predicates.
     *
     * @param targetFrame frame the leaves are rotated into, null to leave them alone
     */
    private static String distribute(CompoundRegion region, String other, boolean regionFirst, String operator,
                                     String targetFrame, MorphState state) {
        List<String> parts = new ArrayList<>();
        for (AdqlNode operand : region.getOperands()) {
            if (operand instanceof CompoundRegion) {
                parts.add(distribute((CompoundRegion) operand, other, regionFirst, operator, targetFrame, state));
            } else {
                String leaf = targetFrame == null ? operand.flatten() : transformed(operand, targetFrame, state);
                parts.add(regionFirst ? compare(leaf, operator, other) : compare(other, operator, leaf));
            }
        }
        switch (region.kind()) {
            case REGION_UNION:
                return "(" + String.join(" OR ", parts) + ")";
            case REGION_INTERSECTION:
                return "(" + String.join(" AND ", parts) + ")";
            default:
                return "(NOT " + parts.get(0) + ")";
        }
    }

    private static String transformed(AdqlNode operand, String targetFrame, MorphState state) {
        String sourceFrame = frameOf(operand);
        String sql = operand.flatten();
        String result = PgSphereTransforms.transform(sql, sourceFrame, targetFrame);
        if (result == null) {
            log.warn("No transform from {} to {}", sourceFrame, targetFrame);
            state.addWarning("Cannot transform from " + sourceFrame + " to " + targetFrame
                    + "; comparing coordinates as they are");
            return sql;
        }
        return result;
    }

    private static boolean isConstructed(AdqlNode node, NodeKind sourceKind) {
        return node instanceof SqlFragment && ((SqlFragment) node).getSourceKind() == sourceKind;
    }

    private static boolean isLiteral(AdqlNode node) {
        return node instanceof CompoundRegion
                || node instanceof SqlFragment && ((SqlFragment) node).getSourceKind().isGeometryConstructor();
    }

    private static String frameOf(AdqlNode node) {
        if (node instanceof SqlFragment && ((SqlFragment) node).getFrame() != null) {
            return ((SqlFragment) node).getFrame();
        }
        if (node instanceof CompoundRegion) {
            return ((CompoundRegion) node).getFrame();
        }
        if (node instanceof FieldInfoed) {
            FieldInfo info = ((FieldInfoed) node).getFieldInfo();
            return info == null ? null : info.getStc();
        }
        return null;
    }

    // ---- other geometry functions

    private static AdqlNode morphPointFunction(AdqlNode node, MorphState state) {
        FunctionNode function = (FunctionNode) node;
        String arg = function.getArg(0).flatten();
        switch (function.getFunctionName()) {
            case "COORD1":
                return SqlFragment.replacing(node, "DEGREES(long(" + arg + "))");
            case "COORD2":
                return SqlFragment.replacing(node, "DEGREES(lat(" + arg + "))");
            default:
                String frame = frameOf(function.getArg(0));
                if (frame == null || frame.isEmpty() || StcFrames.BROKEN.equals(frame)) {
                    frame = StcFrames.UNKNOWN;
                }
                return SqlFragment.replacing(node, "'" + frame + "'");
        }
    }

    private static AdqlNode morphArea(AdqlNode node, MorphState state) {
        FunctionNode function = (FunctionNode) node;
        return SqlFragment.replacing(node, SQDEG_PER_SR + "*AREA(" + function.getArg(0).flatten() + ")");
    }

    private static AdqlNode morphDistance(AdqlNode node, MorphState state) {
        FunctionNode function = (FunctionNode) node;
        return SqlFragment.replacing(node, "DEGREES((" + function.getArg(0).flatten() + ") <-> ("
                + function.getArg(1).flatten() + "))");
    }

    private static AdqlNode morphCentroid(AdqlNode node, MorphState state) {
        FunctionNode function = (FunctionNode) node;
        AdqlNode arg = function.getArg(0);
        if (!isConstructed(arg, NodeKind.CIRCLE) && !isConstructed(arg, NodeKind.POINT)) {
            throw new UnsupportedConstructException("Can only compute centroids of circles and points yet."
                    + "  Complain to make us implement other geometries faster.");
        }
        return SqlFragment.replacing(node, "@@(" + arg.flatten() + ")");
    }

    // ---- math

    private static AdqlNode morphNumericFunction(AdqlNode node, MorphState state) {
        FunctionNode function = (FunctionNode) node;
        List<String> args = function.getFlattenedArgs();
        switch (function.getFunctionName()) {
            case "ROUND":
                if (args.size() == 2) {
                    return SqlFragment.replacing(node, "(ROUND((" + args.get(0) + ")*10^(" + args.get(1)
                            + ")) / 10^(" + args.get(1) + "))");
                }
                return node;
            case "TRUNCATE":
                if (args.size() == 2) {
                    return SqlFragment.replacing(node, "(TRUNC((" + args.get(0) + ")*10^(" + args.get(1)
                            + ")) / 10^(" + args.get(1) + "))");
                }
                return SqlFragment.replacing(node, "TRUNC(" + args.get(0) + ")");
            case "LOG":
                return SqlFragment.replacing(node, "LN(" + args.get(0) + ")");
            case "LOG10":
                return SqlFragment.replacing(node, "LOG(" + args.get(0) + ")");
            case "SQUARE":
                return SqlFragment.replacing(node, "((" + args.get(0) + ")^2)");
            case "RAND":
                if (args.isEmpty()) {
                    return SqlFragment.replacing(node, "random()");
                }
                return SqlFragment.replacing(node, "(SELECT random() FROM (SELECT setseed("
                        + normalizeSeed(function.getArg(0)) + ")) AS q)");
            default:
                return node;
        }
    }

    /**
     * PostgreSQL seeds lie in [-1, 1]; ADQL seeds are arbitrary integers, mapped
     * into [0, 1) as {@code (seed mod 2^31) / 2^31}.
     */
    static String normalizeSeed(AdqlNode seed) {
        BigInteger value = seed instanceof NumericLiteral
                ? ((NumericLiteral) seed).getValue().toBigInteger()
                : new BigDecimal(seed.flatten().replace(" ", "")).toBigInteger();
        BigDecimal normalized = new BigDecimal(value.mod(SEED_MODULUS))
                .divide(new BigDecimal(SEED_MODULUS));
        return normalized.stripTrailingZeros().toPlainString();
    }

    private AdqlNode morphUserFunction(AdqlNode node, MorphState state) {
        FunctionNode function = (FunctionNode) node;
        UserFunction userFunction = userFunctions.lookup(function.getFunctionName());
        if (!userFunction.hasExpansion()) {
            return node;
        }
        return SqlFragment.replacing(node, userFunction.expand(function.getFlattenedArgs()));
    }
}
