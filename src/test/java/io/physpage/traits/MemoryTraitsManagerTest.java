package io.physpage.traits;

import io.physpage.memory.AddressRangeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class MemoryTraitsManagerTest {
    private MemoryTraitsRegistry registry;
    private MemoryTraitsManager manager;

    @BeforeEach
    public void setUp() {
        this.registry = new MemoryTraitsRegistry();
        this.manager = new MemoryTraitsManager(this.registry);
    }

    @Test
    public void testTraitIdsAreStable() {
        int a = this.registry.resolveTraitId("A");
        int b = this.registry.resolveTraitId("B");
        assertThat(a, is(1));
        assertThat(b, is(2));
        assertThat(this.registry.resolveTraitId("A"), is(1));
        assertThat(this.registry.getTraitName(2), is("B"));
    }

    @Test
    public void testTraitsAreScopedPerThread() {
        int a = this.registry.resolveTraitId("A");
        this.manager.addTrait(0, a, 0, 0xfff);
        this.manager.addTrait(0, a, 0x1000, 0x1fff);
        assertThat(this.manager.getTraitAddressRanges(0, a), is(AddressRangeSet.of(0, 0x1fff)));
        assertThat(this.manager.getTraitAddressRanges(1, a), is(nullValue()));
    }

    @Test
    public void testGlobalTraitsAreShared() {
        this.registry.addGlobalTrait("G");
        int g = this.registry.resolveTraitId("G");
        this.manager.addTrait(3, g, 0x4000, 0x4fff);
        assertThat(this.manager.getTraitAddressRanges(5, g), is(AddressRangeSet.of(0x4000, 0x4fff)));
        assertThat(this.manager.createTraitsRange(7, 0x4000, 0x4fff).getTraitIds(), is(Set.of(g)));
    }

    @Test
    public void testTraitsRangeIsClipped() {
        int a = this.registry.resolveTraitId("A");
        int b = this.registry.resolveTraitId("B");
        this.manager.addTrait(0, a, 0, 0x2fff);
        this.manager.addTrait(0, b, 0x8000, 0x8fff);
        var range = this.manager.createTraitsRange(0, 0x1000, 0x1fff);
        assertThat(range.getTraitIds(), is(Set.of(a)));
        assertThat(range.getTraitRanges(a), is(AddressRangeSet.of(0x1000, 0x1fff)));
        assertThat(this.manager.createTraitsRange(0, 0x4000, 0x4fff).isEmpty(), is(true));
    }

    @Test
    public void testExclusiveTraitsAreIncompatible() {
        this.registry.addExclusiveTraits("MainRegion", "IORegion");
        int main = this.registry.resolveTraitId("MainRegion");
        int io = this.registry.resolveTraitId("IORegion");
        int shared = this.registry.resolveTraitId("CacheableShared");
        assertThat(this.registry.isExclusive(main, io), is(true));
        assertThat(this.registry.isExclusive(io, main), is(true));
        assertThat(this.registry.isExclusive(main, shared), is(false));

        var mainRange = new MemoryTraitsRange(this.registry, List.of(main), 0, 0xfff);
        var ioRange = new MemoryTraitsRange(this.registry, List.of(io, shared), 0, 0xfff);
        var sharedRange = new MemoryTraitsRange(this.registry, List.of(shared), 0, 0xfff);
        assertThat(mainRange.isCompatible(ioRange), is(false));
        assertThat(ioRange.isCompatible(mainRange), is(false));
        assertThat(mainRange.isCompatible(sharedRange), is(true));
    }

    @Test
    public void testHasTraitNeedsFullCoverage() {
        int a = this.registry.resolveTraitId("A");
        this.manager.addTrait(0, a, 0x1000, 0x2fff);
        assertThat(this.manager.hasTrait(0, a, 0x1000, 0x2fff), is(true));
        assertThat(this.manager.hasTrait(0, a, 0x1800, 0x18ff), is(true));
        assertThat(this.manager.hasTrait(0, a, 0x2000, 0x3fff), is(false));
        assertThat(this.manager.hasTrait(1, a, 0x1000, 0x1fff), is(false));
        assertThat(this.manager.hasTrait(0, this.registry.resolveTraitId("B"), 0x1000, 0x1fff), is(false));

        this.registry.addGlobalTrait("G");
        int g = this.registry.resolveTraitId("G");
        this.manager.addTrait(2, g, 0x4000, 0x4fff);
        assertThat(this.manager.hasTrait(9, g, 0x4000, 0x4fff), is(true));
    }

    @Test
    public void testLookupsDoNotTrackUnknownThreads() {
        int a = this.registry.resolveTraitId("A");
        assertThat(this.manager.getTraitAddressRanges(4, a), is(nullValue()));
        assertThat(this.manager.hasTrait(4, a, 0, 0xfff), is(false));
        assertThat(this.manager.isThreadTracked(4), is(false));
        this.manager.addTrait(4, a, 0, 0xfff);
        assertThat(this.manager.isThreadTracked(4), is(true));
    }
}
