package me.christianrobert.adqlpg.transformer.node;

import me.christianrobert.adqlpg.transformer.TestFixtures;
import me.christianrobert.adqlpg.transformer.context.AmbiguousChildException;
import me.christianrobert.adqlpg.transformer.context.NoSuchChildException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdqlNodeTest {

    @Nested
    class Identifiers {

        @Test
        void regularIdentifiersNormalizeToLowerCase() {
            Identifier id = Identifier.regular("Alpha");

            assertEquals("alpha", id.normalized());
            assertEquals("Alpha", id.flatten());
        }

        @Test
        void delimitedIdentifiersKeepCaseAndQuoting() {
            Identifier id = Identifier.fromToken("\"My \"\"odd\"\" Col\"");

            assertTrue(id.isDelimited());
            assertEquals("My \"odd\" Col", id.normalized());
            assertEquals("\"My \"\"odd\"\" Col\"", id.flatten());
        }

        @Test
        void emptyRegularIdentifierIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> Identifier.regular(""));
        }
    }

    @Nested
    class TableNames {

        @Test
        void partsAreAssignedFromTheRight() {
            TableName name = new TableName(List.of(
                    Identifier.regular("Cat"), Identifier.regular("PPMX"), Identifier.delimited("Data")));

            assertEquals("Data", name.getTable().getText());
            assertEquals("PPMX", name.getSchema().getText());
            assertEquals("Cat", name.getCatalog().getText());
            assertEquals("cat.ppmx.Data", name.getQualifiedName());
            assertEquals("Cat.PPMX.\"Data\"", name.flatten());
        }

        @Test
        void singlePartHasNoSchema() {
            TableName name = new TableName(List.of(Identifier.regular("data")));

            assertNull(name.getSchema());
            assertNull(name.getCatalog());
        }

        @Test
        void partCountIsLimited() {
            assertThrows(IllegalArgumentException.class, () -> new TableName(List.of()));
            assertThrows(IllegalArgumentException.class, () -> new TableName(List.of(
                    Identifier.regular("a"), Identifier.regular("b"),
                    Identifier.regular("c"), Identifier.regular("d"))));
        }

        @Test
        void collectNamesListsEachTableOnce() {
            // Given
            AdqlNode tree = TestFixtures.parse(
                    "SELECT * FROM ppmx.data AS a JOIN ppmx.data AS b ON a.objid = b.objid, "
                            + "gal.stars WHERE a.objid IN (SELECT objid FROM PPMX.Data)");

            // When
            List<String> names = TableName.collectNames(tree);

            // Then
            assertEquals(List.of("ppmx.data", "gal.stars"), names);
        }
    }

    @Nested
    class ContributingNames {

        @Test
        void queryListsJoinedAndSubqueryTables() {
            // Given
            QuerySpecification query = (QuerySpecification) TestFixtures.parse(
                    "SELECT a.alpha FROM ppmx.data AS a JOIN gal.stars AS s ON a.mag = s.mag"
                            + " WHERE a.objid IN (SELECT objid FROM tap_upload.objects)");

            // When
            List<String> names = query.getContributingNames();

            // Then
            assertEquals(List.of("ppmx.data", "gal.stars", "tap_upload.objects"), names);
        }

        @Test
        void setExpressionListsAllOperands() {
            SetExpression union = (SetExpression) TestFixtures.parse(
                    "SELECT alpha FROM ppmx.data UNION SELECT ra FROM tap_upload.objects");

            assertEquals(List.of("ppmx.data", "tap_upload.objects"), union.getContributingNames());
        }
    }

    @Nested
    class Geometries {

        @Test
        void argumentCountIsCheckedPerShape() {
            AdqlNode frame = new StringLiteral("ICRS");
            List<AdqlNode> three = List.of(
                    new NumericLiteral("1"), new NumericLiteral("2"), new NumericLiteral("3"));

            assertThrows(IllegalArgumentException.class,
                    () -> new GeometryNode(NodeKind.POINT, frame, three));
            assertThrows(IllegalArgumentException.class,
                    () -> new GeometryNode(NodeKind.POLYGON, frame, three));
            assertEquals("CIRCLE('ICRS', 1, 2, 3)", new GeometryNode(NodeKind.CIRCLE, frame, three).flatten());
        }

        @Test
        void withChildrenRebuildsTheShape() {
            GeometryNode point = new GeometryNode(NodeKind.POINT, new StringLiteral("ICRS"),
                    List.of(new NumericLiteral("1"), new NumericLiteral("2")));

            AdqlNode moved = point.withChildren(List.of(
                    new StringLiteral(""), new NumericLiteral("3"), new NumericLiteral("4")));

            assertEquals("POINT('', 3, 4)", moved.flatten());
            assertThrows(IllegalArgumentException.class,
                    () -> point.withChildren(List.of(new NumericLiteral("3"))));
        }
    }

    @Nested
    class CompoundRegions {

        private final AdqlNode point = new GeometryNode(NodeKind.POINT, new StringLiteral("ICRS"),
                List.of(new NumericLiteral("1"), new NumericLiteral("2")));

        @Test
        void operandCountDependsOnOperator() {
            assertThrows(IllegalArgumentException.class,
                    () -> new CompoundRegion(NodeKind.REGION_UNION, "ICRS", List.of(point), null));
            assertThrows(IllegalArgumentException.class,
                    () -> new CompoundRegion(NodeKind.REGION_NOT, "ICRS", List.of(point, point), null));
            assertThrows(IllegalArgumentException.class,
                    () -> new CompoundRegion(NodeKind.POINT, "ICRS", List.of(point), null));
        }

        @Test
        void topLevelRegionFlattensToItsSource() {
            CompoundRegion region = new CompoundRegion(NodeKind.REGION_NOT, "ICRS",
                    List.of(point), "Not (Position ICRS 1 2) 'x'");

            assertEquals("REGION('Not (Position ICRS 1 2) ''x''')", region.flatten());
        }

        @Test
        void nestedRegionFlattensStructurally() {
            CompoundRegion region = new CompoundRegion(NodeKind.REGION_UNION, "ICRS",
                    List.of(point, point), null);

            assertEquals("REGION_UNION(POINT('ICRS', 1, 2), POINT('ICRS', 1, 2))", region.flatten());
        }
    }

    @Nested
    class Traversal {

        @Test
        void findFirstIsDepthFirstAndExcludesSelf() {
            AdqlNode tree = TestFixtures.parse("SELECT alpha, delta FROM ppmx.data");

            AdqlNode first = tree.findFirst(NodeKind.COLUMN_REFERENCE);

            assertNotNull(first);
            assertEquals("alpha", first.flatten());
            assertNull(first.findFirst(NodeKind.COLUMN_REFERENCE));
        }

        @Test
        void uniqueChildOfKindReportsMissingAndDuplicateChildren() {
            GenericNode node = new GenericNode(NodeKind.TERM,
                    List.of(new NumericLiteral("1"), Lexeme.of("*"), new NumericLiteral("2")));

            assertThrows(NoSuchChildException.class, () -> node.uniqueChildOfKind(NodeKind.STRING_LITERAL));
            assertThrows(AmbiguousChildException.class, () -> node.uniqueChildOfKind(NodeKind.NUMERIC_LITERAL));
            assertEquals(2, node.iterNodes().size());
        }

        @Test
        void joinFlattenedHandlesPunctuation() {
            List<AdqlNode> nodes = List.of(Lexeme.of("f"), Lexeme.of("("), Lexeme.of("a"),
                    Lexeme.of(","), Lexeme.of("b"), Lexeme.of(")"));

            assertEquals("f (a, b)", AdqlNode.joinFlattened(nodes));
        }
    }
}
