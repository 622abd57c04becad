package io.physpage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class PhysicalPage {
    private final long pageId;
    private long lower;
    private long upper;
    private boolean aliasable;
    private final List<VirtualPage> virtualPages = new ArrayList<>();

    public PhysicalPage(long lower, long upper, boolean aliasable, long pageId) {
        if (lower > upper) {
            throw new IllegalArgumentException(
                    String.format("lower 0x%x is above upper 0x%x", lower, upper));
        }
        this.lower = lower;
        this.upper = upper;
        this.aliasable = aliasable;
        this.pageId = pageId;
    }

    public long getPageId() {
        return this.pageId;
    }

    public long getLower() {
        return this.lower;
    }

    public long getUpper() {
        return this.upper;
    }

    public boolean isAliasable() {
        return this.aliasable;
    }

    void clearAliasable() {
        this.aliasable = false;
    }

    public boolean contains(long address) {
        return this.lower <= address && address <= this.upper;
    }

    public boolean contains(long lower, long upper) {
        return this.lower <= lower && upper <= this.upper;
    }

    public boolean overlaps(long lower, long upper) {
        return this.lower <= upper && lower <= this.upper;
    }

    // the other page keeps no virtual pages afterwards, the caller drops it
    public void merge(PhysicalPage other) {
        this.lower = Math.min(this.lower, other.lower);
        this.upper = Math.max(this.upper, other.upper);
        // a range that was excluded from aliasing stays excluded
        this.aliasable &= other.aliasable;
        this.virtualPages.addAll(other.virtualPages);
        other.virtualPages.clear();
    }

    public void addPage(VirtualPage virtualPage) {
        this.virtualPages.add(virtualPage);
    }

    public List<VirtualPage> getVirtualPages() {
        return Collections.unmodifiableList(this.virtualPages);
    }

    public VirtualPage getVirtualPage(long pa, AddressSpace addressSpace) {
        for (var virtualPage : this.virtualPages) {
            if (virtualPage.getAddressSpace() == addressSpace
                    && virtualPage.getPhysicalLower() <= pa
                    && pa <= virtualPage.getPhysicalUpper()) {
                return virtualPage;
            }
        }
        return null;
    }

    public void handleMemoryConstraintUpdate(MemoryConstraintUpdate update) {
        for (var virtualPage : this.virtualPages) {
            virtualPage.handleMemoryConstraintUpdate(update);
        }
    }

    @Override
    public String toString() {
        return String.format("PhysicalPage#%d[0x%x-0x%x%s]",
                this.pageId, this.lower, this.upper, this.aliasable ? "" : " no-alias");
    }
}
