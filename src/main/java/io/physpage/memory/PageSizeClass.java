package io.physpage.memory;

import io.physpage.PageManagerError;

import java.util.List;

import static io.physpage.memory.Constants.GB;
import static io.physpage.memory.Constants.KB;
import static io.physpage.memory.Constants.MB;

public class PageSizeClass {
    public static final PageSizeClass S4K = new PageSizeClass("4K", 4 * KB);
    public static final PageSizeClass S2M = new PageSizeClass("2M", 2 * MB);
    public static final PageSizeClass S1G = new PageSizeClass("1G", GB);
    public static final PageSizeClass S512G = new PageSizeClass("512G", 512 * GB);

    public static final List<PageSizeClass> SIZE_CLASSES = List.of(S4K, S2M, S1G, S512G);

    private final String name;
    private final int pageShift;

    private PageSizeClass(String name, long pageSize) {
        this.name = name;
        this.pageShift = Long.numberOfTrailingZeros(pageSize);
    }

    public static PageSizeClass forName(String name) {
        for (var sizeClass : SIZE_CLASSES) {
            if (sizeClass.name.equalsIgnoreCase(name)) {
                return sizeClass;
            }
        }
        throw new PageManagerError("unknown_page_size_class", "no page size class named " + name);
    }

    public static PageSizeClass forShift(int pageShift) {
        for (var sizeClass : SIZE_CLASSES) {
            if (sizeClass.pageShift == pageShift) {
                return sizeClass;
            }
        }
        throw new PageManagerError("unknown_page_size_class", "no page size class with shift " + pageShift);
    }

    public String getName() {
        return this.name;
    }

    public int getPageShift() {
        return this.pageShift;
    }

    public long getPageSize() {
        return 1L << this.pageShift;
    }

    public long getPageMask() {
        return this.getPageSize() - 1;
    }

    public long alignDown(long address) {
        return address & ~this.getPageMask();
    }

    public boolean isAligned(long address) {
        return (address & this.getPageMask()) == 0;
    }

    public long toPageNumber(long address) {
        return address >>> this.pageShift;
    }

    public long toAddress(long pageNumber) {
        return pageNumber << this.pageShift;
    }

    @Override
    public String toString() {
        return this.name;
    }
}
