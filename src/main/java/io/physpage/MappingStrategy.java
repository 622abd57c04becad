package io.physpage;

import io.physpage.memory.AddressRangeSet;
import io.physpage.memory.Constants;

import java.util.Random;

// alignedFree holds page numbers of the size class, boundary holds byte addresses
public enum MappingStrategy {
    FLAT {
        @Override
        public boolean carve(long va,
                             AddressRangeSet alignedFree,
                             AddressRangeSet boundary,
                             PageRequest request,
                             PageSizeInfo sizeInfo,
                             Random random) {
            var sizeClass = sizeInfo.getSizeClass();
            long end = va + sizeInfo.getSize() - 1;
            if (va < 0 || !sizeClass.isAligned(va) || end < va) {
                return false;
            }
            if (end > sizeInfo.getMaxPhysical() || end > Constants.MAX_ADDRESS) {
                return false;
            }
            if (!alignedFree.encloses(sizeClass.toPageNumber(va), sizeClass.toPageNumber(end))) {
                return false;
            }
            if (!boundary.encloses(va, end)) {
                return false;
            }
            sizeInfo.updatePhysicalStart(va);
            return true;
        }
    },

    RANDOM {
        @Override
        public boolean carve(long va,
                             AddressRangeSet alignedFree,
                             AddressRangeSet boundary,
                             PageRequest request,
                             PageSizeInfo sizeInfo,
                             Random random) {
            int pageShift = sizeInfo.getPageShift();
            long lastPage = ((sizeInfo.getMaxPhysical() + 1) >>> pageShift) - 1;
            if (lastPage < 0 || alignedFree.isEmpty()) {
                return false;
            }
            var candidates = alignedFree.copy().intersect(boundary.copy().alignWithPage(pageShift));
            if (!candidates.isEmpty() && candidates.upperBound() > lastPage) {
                candidates.subRange(lastPage + 1, candidates.upperBound());
            }
            if (candidates.isEmpty()) {
                return false;
            }
            var starts = candidates.runStarts(sizeInfo.getPageCount());
            if (starts.isEmpty()) {
                return false;
            }
            sizeInfo.updatePhysicalStart(sizeInfo.getSizeClass().toAddress(starts.chooseValueUniformly(random)));
            return true;
        }
    };

    // writes the start into sizeInfo on success only
    public abstract boolean carve(long va,
                                  AddressRangeSet alignedFree,
                                  AddressRangeSet boundary,
                                  PageRequest request,
                                  PageSizeInfo sizeInfo,
                                  Random random);

    public static MappingStrategy select(PageRequest request) {
        return request.isFlatMap() ? FLAT : RANDOM;
    }
}
