package com.kgraph.resolution.merge;

import com.kgraph.resolution.core.model.EntityType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntityArena Tests")
class EntityArenaTest {

    private EntityArena arena;

    @BeforeEach
    void setUp() {
        arena = new EntityArena();
    }

    @Test
    @DisplayName("Ids should be allocated from 1 upwards")
    void allocatesIds() {
        assertEquals(1, arena.allocate(EntityType.PERSON).id());
        assertEquals(2, arena.allocate(EntityType.ORGANIZATION).id());
        assertEquals(2, arena.size());
    }

    @Test
    @DisplayName("find should follow unions to the root and compress the path")
    void findCompressesPath() {
        int a = arena.allocate(EntityType.PERSON).id();
        int b = arena.allocate(EntityType.PERSON).id();
        int c = arena.allocate(EntityType.PERSON).id();
        arena.union(a, b);
        arena.union(b, c);

        assertEquals(c, arena.root(a));
        assertEquals(c, arena.find(a));
        assertTrue(arena.isRoot(c));
        assertFalse(arena.isRoot(a));
    }

    @Test
    @DisplayName("union should only join roots")
    void unionRequiresRoots() {
        int a = arena.allocate(EntityType.PERSON).id();
        int b = arena.allocate(EntityType.PERSON).id();
        int c = arena.allocate(EntityType.PERSON).id();
        arena.union(a, b);

        assertThrows(IllegalArgumentException.class, () -> arena.union(a, c));
    }

    @Test
    @DisplayName("A cycle in the parent index should be reported as corruption")
    void cycleIsCorruption() {
        int a = arena.allocate(EntityType.PERSON).id();
        int b = arena.allocate(EntityType.PERSON).id();
        arena.forceParent(a, b);
        arena.forceParent(b, a);

        assertThrows(RegistryCorruptionException.class, () -> arena.root(a));
    }

    @Test
    @DisplayName("A dangling parent or unknown id should be reported as corruption")
    void danglingParentIsCorruption() {
        int a = arena.allocate(EntityType.PERSON).id();
        arena.forceParent(a, 99);

        assertThrows(RegistryCorruptionException.class, () -> arena.root(a));
        assertThrows(RegistryCorruptionException.class, () -> arena.root(12));
        assertThrows(RegistryCorruptionException.class, () -> arena.record(12));
    }

    @Test
    @DisplayName("Primary label should be the most frequent, then longest, then smallest alias")
    void chooseLabel() {
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        frequencies.put("Apple", 1);
        frequencies.put("Apple Inc", 1);
        frequencies.put("Apple Inc.", 1);
        assertEquals("Apple Inc.", EntityRecord.chooseLabel(frequencies));

        frequencies.put("Apple", 2);
        assertEquals("Apple", EntityRecord.chooseLabel(frequencies));

        Map<String, Integer> sameLength = new LinkedHashMap<>();
        sameLength.put("IBM Co", 1);
        sameLength.put("IBM AG", 1);
        assertEquals("IBM AG", EntityRecord.chooseLabel(sameLength));
    }
}
