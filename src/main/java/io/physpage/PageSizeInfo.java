package io.physpage;

import com.google.common.base.MoreObjects;
import io.physpage.memory.PageSizeClass;

public class PageSizeInfo {
    private final PageSizeClass sizeClass;
    private final long size;
    private final long maxPhysical;
    private long physicalStart;
    private long physicalEnd;
    private long physicalPageId;

    public PageSizeInfo(PageSizeClass sizeClass, long size, long maxPhysical) {
        if (size <= 0 || (size & sizeClass.getPageMask()) != 0) {
            throw new IllegalArgumentException(
                    String.format("size 0x%x is not a multiple of the %s page size", size, sizeClass));
        }
        this.sizeClass = sizeClass;
        this.size = size;
        this.maxPhysical = maxPhysical;
    }

    public PageSizeClass getSizeClass() {
        return this.sizeClass;
    }

    public int getPageShift() {
        return this.sizeClass.getPageShift();
    }

    public long getSize() {
        return this.size;
    }

    public long getPageCount() {
        return this.size >>> this.sizeClass.getPageShift();
    }

    public long getMaxPhysical() {
        return this.maxPhysical;
    }

    public long getPhysicalStart() {
        return this.physicalStart;
    }

    public long getPhysicalEnd() {
        return this.physicalEnd;
    }

    // 0 until an allocation succeeds
    public long getPhysicalPageId() {
        return this.physicalPageId;
    }

    void updatePhysicalStart(long physicalStart) {
        this.physicalStart = physicalStart;
        this.physicalEnd = physicalStart + this.size - 1;
    }

    void updatePhysicalPageId(long physicalPageId) {
        this.physicalPageId = physicalPageId;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("sizeClass", this.sizeClass)
                .add("size", "0x" + Long.toHexString(this.size))
                .add("physicalStart", "0x" + Long.toHexString(this.physicalStart))
                .add("physicalEnd", "0x" + Long.toHexString(this.physicalEnd))
                .add("physicalPageId", this.physicalPageId)
                .toString();
    }
}
