package me.christianrobert.adqlpg.transformer.ufunc;

import me.christianrobert.adqlpg.transformer.context.UfuncException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UserFunctionRegistryTest {

    private final UserFunctionRegistry registry = new UserFunctionRegistry();

    @Test
    void builtinsAreRegistered() {
        assertTrue(registry.isKnown("gavo_match"));
        assertTrue(registry.isKnown("IVO_HASWORD"));
        assertTrue(registry.isKnown("ivo_nocasecmp"));
        assertTrue(registry.isKnown("ivo_hashlist_has"));
        assertFalse(registry.isKnown("ivo_nope"));
    }

    @Test
    void gavoMatchExpandsToRegexMatch() {
        // When
        String sql = registry.lookup("gavo_match").expand(List.of("'^M'", "name"));

        // Then
        assertEquals("(CASE WHEN name ~ '^M' THEN 1 ELSE 0 END)", sql);
    }

    @Test
    void nocasecmpExpansion() {
        assertEquals("(CASE WHEN UPPER(a)=UPPER('b') THEN 1 ELSE 0 END)",
                registry.lookup("ivo_nocasecmp").expand(List.of("a", "'b'")));
    }

    @Test
    void functionWithoutExpansionRendersCall() {
        // Given
        registry.register(new UserFunction("gavo_specconv", "gavo_specconv(x, unit)", "Converts spectral units.",
                "DOUBLE PRECISION", "", "", 2, null));

        // When
        UserFunction function = registry.lookup("GAVO_SPECCONV");

        // Then
        assertFalse(function.hasExpansion());
        assertEquals("GAVO_SPECCONV(x, 'm')", function.expand(List.of("x", "'m'")));
    }

    @Test
    void registeringAgainReplaces() {
        registry.register(new UserFunction("gavo_match", null, null, "INTEGER", "", "", 2, args -> "replaced"));

        assertEquals("replaced", registry.lookup("gavo_match").expand(List.of("a", "b")));
        assertEquals("GAVO_MATCH", registry.lookup("gavo_match").toString());
    }

    @Test
    void unknownFunctionFails() {
        UfuncException e = assertThrows(UfuncException.class, () -> registry.lookup("gavo_unknown"));
        assertEquals("No such function: gavo_unknown", e.getMessage());
    }

    @Test
    void checkCallRejectsWrongArity() {
        UfuncException e = assertThrows(UfuncException.class, () -> registry.checkCall("gavo_match", 3));
        assertEquals("GAVO_MATCH takes exactly two arguments", e.getMessage());
    }

    @Test
    void singularArgumentWording() {
        registry.register(new UserFunction("gavo_one", null, null, "INTEGER", "", "", 1, null));

        UfuncException e = assertThrows(UfuncException.class, () -> registry.checkCall("gavo_one", 0));
        assertEquals("GAVO_ONE takes exactly one argument", e.getMessage());
    }

    @Test
    void getAllIsSortedByName() {
        List<UserFunction> all = registry.getAll();

        assertEquals("GAVO_MATCH", all.get(0).getName());
        for (int i = 1; i < all.size(); i++) {
            assertTrue(all.get(i - 1).getName().compareTo(all.get(i).getName()) < 0);
        }
    }

    @Test
    void blankNameIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new UserFunction("", null, null, "INTEGER", "", "", 0, null));
    }
}
