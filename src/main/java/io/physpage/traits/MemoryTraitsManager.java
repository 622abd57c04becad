package io.physpage.traits;

import io.physpage.memory.AddressRangeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

public class MemoryTraitsManager {
    private static final Logger log = LoggerFactory.getLogger(MemoryTraitsManager.class);

    private final MemoryTraitsRegistry registry;
    private final Map<Integer, AddressRangeSet> globalTraitRanges = new HashMap<>();
    private final Map<Integer, Map<Integer, AddressRangeSet>> threadTraitRanges = new HashMap<>();

    public MemoryTraitsManager(MemoryTraitsRegistry registry) {
        this.registry = registry;
    }

    public MemoryTraitsRegistry getRegistry() {
        return this.registry;
    }

    public void addTrait(int threadId, int traitId, long lower, long upper) {
        var traitRanges = this.getTraitRangesMap(threadId, traitId);
        traitRanges.computeIfAbsent(traitId, k -> new AddressRangeSet()).addRange(lower, upper);
        if (log.isTraceEnabled()) {
            log.trace("thread {} trait {} tagged 0x{}-0x{}",
                    threadId, this.registry.getTraitName(traitId), Long.toHexString(lower), Long.toHexString(upper));
        }
    }

    // null if the trait was never applied in the thread's scope
    public AddressRangeSet getTraitAddressRanges(int threadId, int traitId) {
        var ranges = this.findTraitRanges(threadId, traitId);
        return ranges == null ? null : ranges.copy();
    }

    public boolean hasTrait(int threadId, int traitId, long lower, long upper) {
        var ranges = this.findTraitRanges(threadId, traitId);
        return ranges != null && ranges.encloses(lower, upper);
    }

    public MemoryTraitsRange createTraitsRange(int threadId, long lower, long upper) {
        var clipped = new HashMap<Integer, AddressRangeSet>();
        MemoryTraitsManager.collectOverlapping(this.globalTraitRanges, lower, upper, clipped);
        var threadRanges = this.threadTraitRanges.get(threadId);
        if (threadRanges != null) {
            MemoryTraitsManager.collectOverlapping(threadRanges, lower, upper, clipped);
        }
        return new MemoryTraitsRange(this.registry, clipped, lower, upper);
    }

    boolean isThreadTracked(int threadId) {
        return this.threadTraitRanges.containsKey(threadId);
    }

    private AddressRangeSet findTraitRanges(int threadId, int traitId) {
        if (this.registry.isGlobal(traitId)) {
            return this.globalTraitRanges.get(traitId);
        }
        var threadRanges = this.threadTraitRanges.get(threadId);
        return threadRanges == null ? null : threadRanges.get(traitId);
    }

    private Map<Integer, AddressRangeSet> getTraitRangesMap(int threadId, int traitId) {
        if (this.registry.isGlobal(traitId)) {
            return this.globalTraitRanges;
        }
        return this.threadTraitRanges.computeIfAbsent(threadId, k -> new HashMap<>());
    }

    private static void collectOverlapping(Map<Integer, AddressRangeSet> source,
                                           long lower,
                                           long upper,
                                           Map<Integer, AddressRangeSet> target) {
        var window = AddressRangeSet.of(lower, upper);
        for (var entry : source.entrySet()) {
            if (entry.getValue().overlaps(lower, upper)) {
                target.put(entry.getKey(), entry.getValue().copy().intersect(window));
            }
        }
    }
}
