package me.christianrobert.adqlpg.transformer.builder;

import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.FunctionNode;
import me.christianrobert.adqlpg.transformer.node.GeometryNode;
import me.christianrobert.adqlpg.transformer.node.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for geometry constructors and geometry functions.
 */
public class VisitGeometry {

  public static AdqlNode v(AdqlParser.PointContext ctx, AdqlTreeBuilder b) {
    return new GeometryNode(NodeKind.POINT, b.visit(ctx.coord_sys()), coordinates(List.of(ctx.coordinates()), b));
  }

  public static AdqlNode v(AdqlParser.CircleContext ctx, AdqlTreeBuilder b) {
    List<AdqlNode> args = coordinates(List.of(ctx.coordinates()), b);
    args.add(b.visit(ctx.numeric_value_expression()));
    return new GeometryNode(NodeKind.CIRCLE, b.visit(ctx.coord_sys()), args);
  }

  public static AdqlNode v(AdqlParser.BoxContext ctx, AdqlTreeBuilder b) {
    // Grammar: BOX '(' coord_sys ',' coordinates ',' width ',' height ')'
    List<AdqlNode> args = coordinates(List.of(ctx.coordinates()), b);
    args.add(b.visit(ctx.numeric_value_expression(0)));
    args.add(b.visit(ctx.numeric_value_expression(1)));
    return new GeometryNode(NodeKind.BOX, b.visit(ctx.coord_sys()), args);
  }

  public static AdqlNode v(AdqlParser.PolygonContext ctx, AdqlTreeBuilder b) {
    return new GeometryNode(NodeKind.POLYGON, b.visit(ctx.coord_sys()), coordinates(ctx.coordinates(), b));
  }

  public static AdqlNode v(AdqlParser.RegionContext ctx, AdqlTreeBuilder b) {
    // Resolved into geometries by the region resolvers after building
    return new FunctionNode(NodeKind.REGION, "REGION", List.of(b.visit(ctx.string_value_expression())));
  }

  public static AdqlNode v(AdqlParser.CentroidContext ctx, AdqlTreeBuilder b) {
    return new FunctionNode(NodeKind.CENTROID, "CENTROID", List.of(b.visit(ctx.geometry_value_expression())));
  }

  public static AdqlNode v(AdqlParser.PredicateGeometryFunctionContext ctx, AdqlTreeBuilder b) {
    // Grammar: (CONTAINS | INTERSECTS) '(' geometry_value_expression ',' geometry_value_expression ')'
    return new FunctionNode(NodeKind.PREDICATE_GEOMETRY_FUNCTION, ctx.getChild(0).getText(), List.of(
        b.visit(ctx.geometry_value_expression(0)),
        b.visit(ctx.geometry_value_expression(1))));
  }

  public static AdqlNode v(AdqlParser.DistanceFunctionContext ctx, AdqlTreeBuilder b) {
    return new FunctionNode(NodeKind.DISTANCE_FUNCTION, "DISTANCE", List.of(
        b.visit(ctx.coord_value(0)),
        b.visit(ctx.coord_value(1))));
  }

  public static AdqlNode v(AdqlParser.PointFunctionContext ctx, AdqlTreeBuilder b) {
    // COORD1, COORD2 or COORDSYS
    return new FunctionNode(NodeKind.POINT_FUNCTION, ctx.getChild(0).getText(), List.of(b.visit(ctx.coord_value())));
  }

  public static AdqlNode v(AdqlParser.AreaFunctionContext ctx, AdqlTreeBuilder b) {
    return new FunctionNode(NodeKind.AREA, "AREA", List.of(b.visit(ctx.geometry_value_expression())));
  }

  private static List<AdqlNode> coordinates(List<AdqlParser.CoordinatesContext> pairs, AdqlTreeBuilder b) {
    List<AdqlNode> result = new ArrayList<>();
    for (AdqlParser.CoordinatesContext pair : pairs) {
      result.add(b.visit(pair.numeric_value_expression(0)));
      result.add(b.visit(pair.numeric_value_expression(1)));
    }
    return result;
  }
}
