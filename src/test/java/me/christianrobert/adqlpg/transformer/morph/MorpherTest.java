package me.christianrobert.adqlpg.transformer.morph;

import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.ColumnReference;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import me.christianrobert.adqlpg.transformer.node.NumericLiteral;
import me.christianrobert.adqlpg.transformer.node.SqlFragment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static me.christianrobert.adqlpg.transformer.TestFixtures.parse;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the generic postorder rewriter.
 */
class MorpherTest {

    @Test
    void morphWithoutHandlersReturnsSameTree() {
        // Given
        AdqlNode tree = parse("SELECT alpha FROM ppmx.data WHERE mag < 10");

        // When
        MorphResult result = new Morpher(Map.of()).morph(tree);

        // Then
        assertSame(tree, result.getNode());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void replacedChildRebuildsAncestorsOnly() {
        // Given
        AdqlNode tree = parse("SELECT alpha FROM ppmx.data WHERE mag < 10");
        Map<NodeKind, MorphHandler> handlers = new EnumMap<>(NodeKind.class);
        handlers.put(NodeKind.NUMERIC_LITERAL, (node, state) -> new NumericLiteral("11"));

        // When
        MorphResult result = new Morpher(handlers).morph(tree);

        // Then
        assertNotSame(tree, result.getNode());
        assertEquals("SELECT alpha FROM ppmx.data WHERE mag < 11", result.getNode().flatten());
        assertEquals("SELECT alpha FROM ppmx.data WHERE mag < 10", tree.flatten(), "Input tree must stay unchanged");
        // The unchanged FROM clause is shared between both trees
        assertSame(tree.children().get(1), result.getNode().children().get(1));
    }

    @Test
    void handlersRunChildrenFirst() {
        // Given
        AdqlNode tree = parse("SELECT alpha FROM ppmx.data WHERE alpha < delta");
        List<String> visited = new ArrayList<>();
        Map<NodeKind, MorphHandler> handlers = new EnumMap<>(NodeKind.class);
        handlers.put(NodeKind.COLUMN_REFERENCE, (node, state) -> {
            visited.add(((ColumnReference) node).getColumnName());
            return node;
        });
        handlers.put(NodeKind.COMPARISON, (node, state) -> {
            visited.add("comparison");
            return node;
        });

        // When
        new Morpher(handlers).morph(tree);

        // Then
        assertEquals(List.of("alpha", "alpha", "delta", "comparison"), visited);
    }

    @Test
    void handlerSeesRebuiltNode() {
        // Given
        AdqlNode tree = parse("SELECT alpha FROM ppmx.data WHERE mag < 10");
        Map<NodeKind, MorphHandler> handlers = new EnumMap<>(NodeKind.class);
        handlers.put(NodeKind.NUMERIC_LITERAL, (node, state) -> new SqlFragment("42", NodeKind.NUMERIC_LITERAL, null));
        handlers.put(NodeKind.COMPARISON, (node, state) -> new SqlFragment("<" + node.flatten() + ">",
                NodeKind.COMPARISON, null));

        // When
        MorphResult result = new Morpher(handlers).morph(tree);

        // Then
        assertEquals("SELECT alpha FROM ppmx.data WHERE <mag < 42>", result.getNode().flatten());
    }

    @Test
    void nullFromHandlerIsRejected() {
        // Given
        AdqlNode tree = parse("SELECT alpha FROM ppmx.data");
        Map<NodeKind, MorphHandler> handlers = new EnumMap<>(NodeKind.class);
        handlers.put(NodeKind.COLUMN_REFERENCE, (node, state) -> null);

        // When / Then
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new Morpher(handlers).morph(tree));
        assertTrue(e.getMessage().contains("COLUMN_REFERENCE"));
    }

    @Test
    void stateCollectsWarningsAndKillFlag() {
        // Given
        MorphState state = new MorphState();

        // When
        state.addWarning("first");
        state.setKillParentOperator(true);

        // Then
        assertEquals(List.of("first"), state.getWarnings());
        assertTrue(state.consumeKillParentOperator());
        assertFalse(state.consumeKillParentOperator(), "Consuming clears the flag");
    }
}
