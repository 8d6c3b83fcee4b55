package me.christianrobert.adqlpg.transformer.region;

import me.christianrobert.adqlpg.transformer.context.RegionException;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.GeometryNode;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NamedObjectRegionResolverTest {

    @Mock
    private ObjectPositionLookup lookup;

    private NamedObjectRegionResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new NamedObjectRegionResolver("simbad", lookup);
    }

    @Test
    void resolvesObjectNameWithoutBlanks() {
        // Given
        when(lookup.getPosition("M31")).thenReturn(new double[]{10.6847083, 41.26875});

        // When
        AdqlNode node = resolver.resolve("Simbad M 31");

        // Then
        assertEquals(NodeKind.POINT, node.kind());
        assertEquals("ICRS", ((GeometryNode) node).getFrame());
        assertEquals("POINT('ICRS', 10.6847083000, 41.2687500000)", node.flatten());
        verify(lookup).getPosition("M31");
    }

    @Test
    void otherServicesAreNotHandled() {
        assertNull(resolver.resolve("Circle ICRS 10 20 1"));
        verifyNoInteractions(lookup);
    }

    @Test
    void missingObjectNameFails() {
        RegionException e = assertThrows(RegionException.class, () -> resolver.resolve("simbad"));
        assertTrue(e.getMessage().startsWith("No object name given"));
        verify(lookup, never()).getPosition(anyString());
    }

    @Test
    void unknownObjectFails() {
        when(lookup.getPosition("Aldebaran2")).thenReturn(null);

        RegionException e = assertThrows(RegionException.class, () -> resolver.resolve("simbad Aldebaran2"));
        assertEquals("No simbad position for 'Aldebaran2'", e.getMessage());
    }
}
