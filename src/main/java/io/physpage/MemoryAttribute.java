package io.physpage;

public enum MemoryAttribute {
    MAIN_REGION("MainRegion"),
    IO_REGION("IORegion"),
    CACHEABLE_SHARED("CacheableShared"),
    UNCACHEABLE("Uncacheable");

    private final String traitName;

    MemoryAttribute(String traitName) {
        this.traitName = traitName;
    }

    public String getTraitName() {
        return this.traitName;
    }
}
