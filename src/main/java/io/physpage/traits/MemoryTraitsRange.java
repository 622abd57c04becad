package io.physpage.traits;

import io.physpage.memory.AddressRangeSet;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public class MemoryTraitsRange {
    private final MemoryTraitsRegistry registry;
    private final Map<Integer, AddressRangeSet> traitRanges = new TreeMap<>();
    private final long lower;
    private final long upper;

    MemoryTraitsRange(MemoryTraitsRegistry registry, Map<Integer, AddressRangeSet> traitRanges, long lower, long upper) {
        this.registry = registry;
        this.traitRanges.putAll(traitRanges);
        this.lower = lower;
        this.upper = upper;
    }

    public MemoryTraitsRange(MemoryTraitsRegistry registry, Iterable<Integer> traitIds, long lower, long upper) {
        this.registry = registry;
        for (int traitId : traitIds) {
            this.traitRanges.put(traitId, AddressRangeSet.of(lower, upper));
        }
        this.lower = lower;
        this.upper = upper;
    }

    public boolean isEmpty() {
        return this.traitRanges.isEmpty();
    }

    public long getLower() {
        return this.lower;
    }

    public long getUpper() {
        return this.upper;
    }

    public Set<Integer> getTraitIds() {
        return Collections.unmodifiableSet(this.traitRanges.keySet());
    }

    public AddressRangeSet getTraitRanges(int traitId) {
        var ranges = this.traitRanges.get(traitId);
        return ranges == null ? new AddressRangeSet() : ranges.copy();
    }

    public boolean isCompatible(MemoryTraitsRange other) {
        for (int traitId : this.traitRanges.keySet()) {
            for (int otherTraitId : other.traitRanges.keySet()) {
                if (this.registry.isExclusive(traitId, otherTraitId)) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (var entry : this.traitRanges.entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(this.registry.getTraitName(entry.getKey())).append('=').append(entry.getValue());
        }
        return String.format("0x%x-0x%x {%s}", this.lower, this.upper, sb);
    }
}
