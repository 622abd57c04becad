package io.physpage.traits;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class MemoryTraitsRegistry {
    private final Map<String, Integer> traitIds = new HashMap<>();
    private final List<String> traitNames = new ArrayList<>();
    private final Map<Integer, Set<Integer>> exclusiveTraits = new HashMap<>();
    private final Set<Integer> globalTraits = new HashSet<>();

    public int resolveTraitId(String name) {
        var id = this.traitIds.get(name);
        if (id == null) {
            this.traitNames.add(name);
            id = this.traitNames.size();
            this.traitIds.put(name, id);
        }
        return id;
    }

    public String getTraitName(int traitId) {
        if (traitId < 1 || traitId > this.traitNames.size()) {
            throw new IllegalArgumentException("unknown trait id " + traitId);
        }
        return this.traitNames.get(traitId - 1);
    }

    public void addExclusiveTraits(String... names) {
        var ids = new ArrayList<Integer>();
        for (var name : names) {
            ids.add(this.resolveTraitId(name));
        }
        for (int id : ids) {
            var exclusive = this.exclusiveTraits.computeIfAbsent(id, k -> new HashSet<>());
            for (int other : ids) {
                if (other != id) {
                    exclusive.add(other);
                }
            }
        }
    }

    public boolean isExclusive(int traitId, int otherTraitId) {
        var exclusive = this.exclusiveTraits.get(traitId);
        return exclusive != null && exclusive.contains(otherTraitId);
    }

    public void addGlobalTrait(String name) {
        this.globalTraits.add(this.resolveTraitId(name));
    }

    public boolean isGlobal(int traitId) {
        return this.globalTraits.contains(traitId);
    }
}
