package me.christianrobert.adqlpg.transformer.region;

import me.christianrobert.adqlpg.transformer.context.RegionException;
import me.christianrobert.adqlpg.transformer.fieldinfo.StcFrames;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.CompoundRegion;
import me.christianrobert.adqlpg.transformer.node.GeometryNode;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import me.christianrobert.adqlpg.transformer.node.NumericLiteral;
import me.christianrobert.adqlpg.transformer.node.StringLiteral;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the spatial subset of STC-S used in TAP into geometry nodes.
 * <p>
 * Supported:
 * </p>
 * <pre>
 * region   := shape | compound
 * shape    := ("Position" | "Circle" | "Box" | "Polygon") frame? refpos? flavor? number+ ("unit" "deg")?
 * compound := ("Union" | "Intersection") frame? "(" region region+ ")"
 *           | "Not" frame? "(" region ")"
 * </pre>
 * <p>
 * Operands of a compound without their own frame inherit the compound's frame.
 * A specification not starting with one of the shape words is left to other resolvers.
 * </p>
 */
public class StcsRegionResolver implements RegionResolver {

    private static final Pattern TOKEN = Pattern.compile("\\(|\\)|[^\\s()]+");

    private static final Map<String, NodeKind> SHAPES = Map.of(
            "POSITION", NodeKind.POINT,
            "CIRCLE", NodeKind.CIRCLE,
            "BOX", NodeKind.BOX,
            "POLYGON", NodeKind.POLYGON);

    private static final Map<String, NodeKind> COMPOUNDS = Map.of(
            "UNION", NodeKind.REGION_UNION,
            "INTERSECTION", NodeKind.REGION_INTERSECTION,
            "NOT", NodeKind.REGION_NOT);

    private static final Set<String> FRAMES = Set.of(
            "ICRS", "FK4", "FK5", "J2000", "B1950", "GALACTIC", "GALACTIC_II", "ECLIPTIC",
            "SUPER_GALACTIC", "GEO_C", "GEO_D", "UNKNOWNFRAME");

    private static final Set<String> REFERENCE_POSITIONS = Set.of(
            "GEOCENTER", "BARYCENTER", "HELIOCENTER", "TOPOCENTER", "LSR", "LSRK", "LSRD",
            "GALACTIC_CENTER", "LOCAL_GROUP_CENTER", "MOON", "EMBARYCENTER", "RELOCATABLE",
            "UNKNOWNREFPOS");

    private static final Set<String> FLAVORS = Set.of("SPHERICAL2", "UNITSPHERE", "CARTESIAN2");

    @Override
    public AdqlNode resolve(String specification) {
        List<String> tokens = tokenize(specification);
        if (tokens.isEmpty()) {
            return null;
        }
        String first = upper(tokens.get(0));
        if (!SHAPES.containsKey(first) && !COMPOUNDS.containsKey(first)) {
            return null;
        }

        Cursor cursor = new Cursor(specification, tokens);
        AdqlNode result = parseRegion(cursor, "", specification);
        if (!cursor.atEnd()) {
            throw cursor.error("unexpected '" + cursor.peek() + "'");
        }
        return result;
    }

    private AdqlNode parseRegion(Cursor cursor, String inheritedFrame, String sourceText) {
        String word = upper(cursor.next("a shape"));
        NodeKind shape = SHAPES.get(word);
        if (shape != null) {
            return parseShape(cursor, shape, inheritedFrame);
        }
        NodeKind compound = COMPOUNDS.get(word);
        if (compound == null) {
            throw cursor.error("expected a shape, found '" + word + "'");
        }

        String frame = parseFrame(cursor, inheritedFrame);
        cursor.expect("(");
        List<AdqlNode> operands = new ArrayList<>();
        while (!")".equals(cursor.peek())) {
            operands.add(parseRegion(cursor, frame, null));
        }
        cursor.expect(")");
        if (compound == NodeKind.REGION_NOT ? operands.size() != 1 : operands.size() < 2) {
            throw cursor.error(word.charAt(0) + word.substring(1).toLowerCase(Locale.ROOT)
                    + " cannot have " + operands.size() + " operands");
        }
        return new CompoundRegion(compound, frame, operands, sourceText);
    }

    private AdqlNode parseShape(Cursor cursor, NodeKind shape, String inheritedFrame) {
        String frame = parseFrame(cursor, inheritedFrame);
        List<AdqlNode> numbers = new ArrayList<>();
        while (cursor.peek() != null && isNumber(cursor.peek())) {
            numbers.add(new NumericLiteral(cursor.next("a number")));
        }
        if ("UNIT".equals(upper(cursor.peek()))) {
            cursor.next("unit");
            String unit = cursor.next("a unit");
            if (!"deg".equals(unit)) {
                throw cursor.error("only deg is supported as unit, not " + unit);
            }
        }
        try {
            return new GeometryNode(shape, new StringLiteral(frame), numbers);
        } catch (IllegalArgumentException e) {
            throw cursor.error(e.getMessage(), e);
        }
    }

    /**
     * Consumes the optional frame, reference position and flavor.
     */
    private String parseFrame(Cursor cursor, String inheritedFrame) {
        String frame = inheritedFrame;
        if (FRAMES.contains(upper(cursor.peek()))) {
            frame = StcFrames.fromCoordSys(cursor.next("a frame"));
            if ("J2000".equals(frame)) {
                frame = "FK5";
            } else if ("B1950".equals(frame)) {
                frame = "FK4";
            }
        }
        if (REFERENCE_POSITIONS.contains(upper(cursor.peek()))) {
            cursor.next("a reference position");
        }
        if (FLAVORS.contains(upper(cursor.peek()))) {
            cursor.next("a flavor");
        }
        return frame;
    }

    private static boolean isNumber(String token) {
        try {
            new BigDecimal(token);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String upper(String token) {
        return token == null ? null : token.toUpperCase(Locale.ROOT);
    }

    private static List<String> tokenize(String text) {
        List<String> result = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            result.add(matcher.group());
        }
        return result;
    }

    private static class Cursor {
        private final String text;
        private final List<String> tokens;
        private int position;

        Cursor(String text, List<String> tokens) {
            this.text = text;
            this.tokens = tokens;
        }

        boolean atEnd() {
            return position >= tokens.size();
        }

        String peek() {
            return atEnd() ? null : tokens.get(position);
        }

        String next(String expected) {
            if (atEnd()) {
                throw error("expected " + expected + " at end of input");
            }
            return tokens.get(position++);
        }

        void expect(String token) {
            String found = next("'" + token + "'");
            if (!token.equals(found)) {
                throw error("expected '" + token + "', found '" + found + "'");
            }
        }

        RegionException error(String reason) {
            return new RegionException("Invalid STC-S region '" + text + "': " + reason);
        }

        RegionException error(String reason, Throwable cause) {
            return new RegionException("Invalid STC-S region '" + text + "': " + reason, cause);
        }
    }
}
