package me.christianrobert.adqlpg.transformer.node;

import me.christianrobert.adqlpg.transformer.fieldinfo.StcFrames;

import java.util.ArrayList;
import java.util.List;

/**
 * Geometry constructor: POINT, CIRCLE, BOX or POLYGON. The first argument is the
 * coordinate system; the rest are numeric.
 */
public class GeometryNode extends FieldInfoedNode implements Functional {

    private final AdqlNode coordSys;
    private final List<AdqlNode> coordinates;
    private final List<String> flattenedArgs;

    public GeometryNode(NodeKind kind, AdqlNode coordSys, List<AdqlNode> coordinates) {
        super(kind);
        if (!kind.isGeometryConstructor()) {
            throw new IllegalArgumentException("Not a geometry kind: " + kind);
        }
        checkArgCount(kind, coordinates.size());
        this.coordSys = coordSys;
        this.coordinates = List.copyOf(coordinates);
        this.flattenedArgs = getArgs().stream().map(AdqlNode::flatten).toList();
    }

    private static void checkArgCount(NodeKind kind, int count) {
        boolean ok;
        switch (kind) {
            case POINT:
                ok = count == 2;
                break;
            case CIRCLE:
                ok = count == 3;
                break;
            case BOX:
                ok = count == 4;
                break;
            default:
                ok = count >= 6 && count % 2 == 0;
        }
        if (!ok) {
            throw new IllegalArgumentException(kind + " cannot have " + count + " coordinate arguments");
        }
    }

    public AdqlNode getCoordSys() {
        return coordSys;
    }

    /**
     * Frame named by a literal coordinate system, null if the coordinate system is computed.
     */
    public String getFrame() {
        if (coordSys instanceof StringLiteral) {
            return StcFrames.fromCoordSys(((StringLiteral) coordSys).getValue());
        }
        return null;
    }

    public List<AdqlNode> getCoordinates() {
        return coordinates;
    }

    public AdqlNode getX() {
        return coordinates.get(0);
    }

    public AdqlNode getY() {
        return coordinates.get(1);
    }

    /** Radius of a circle. */
    public AdqlNode getRadius() {
        return coordinates.get(2);
    }

    /** Width of a box. */
    public AdqlNode getWidth() {
        return coordinates.get(2);
    }

    /** Height of a box. */
    public AdqlNode getHeight() {
        return coordinates.get(3);
    }

    /**
     * Coordinate pairs of a polygon.
     */
    public List<List<AdqlNode>> getVertices() {
        List<List<AdqlNode>> result = new ArrayList<>();
        for (int i = 0; i + 1 < coordinates.size(); i += 2) {
            result.add(List.of(coordinates.get(i), coordinates.get(i + 1)));
        }
        return result;
    }

    @Override
    public String getFunctionName() {
        return kind().name();
    }

    @Override
    public List<AdqlNode> getArgs() {
        List<AdqlNode> result = new ArrayList<>();
        result.add(coordSys);
        result.addAll(coordinates);
        return result;
    }

    @Override
    public List<String> getFlattenedArgs() {
        return flattenedArgs;
    }

    @Override
    public List<AdqlNode> children() {
        return getArgs();
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, coordinates.size() + 1);
        return carryAnnotation(new GeometryNode(kind(), newChildren.get(0),
                newChildren.subList(1, newChildren.size())));
    }

    @Override
    public String flatten() {
        return getFunctionName() + "(" + String.join(", ", flattenedArgs) + ")";
    }
}
