package io.physpage.memory;

import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

// bounds are inclusive, stored half-open so adjacent intervals coalesce
public class AddressRangeSet {
    private final RangeSet<Long> ranges;

    public AddressRangeSet() {
        this.ranges = TreeRangeSet.create();
    }

    private AddressRangeSet(RangeSet<Long> ranges) {
        this.ranges = TreeRangeSet.create(ranges);
    }

    public static AddressRangeSet of(long lower, long upper) {
        return new AddressRangeSet().addRange(lower, upper);
    }

    public AddressRangeSet copy() {
        return new AddressRangeSet(this.ranges);
    }

    public AddressRangeSet addRange(long lower, long upper) {
        this.ranges.add(AddressRangeSet.toRange(lower, upper));
        return this;
    }

    public AddressRangeSet subRange(long lower, long upper) {
        this.ranges.remove(AddressRangeSet.toRange(lower, upper));
        return this;
    }

    public AddressRangeSet subtract(AddressRangeSet other) {
        this.ranges.removeAll(other.ranges);
        return this;
    }

    public AddressRangeSet union(AddressRangeSet other) {
        this.ranges.addAll(other.ranges);
        return this;
    }

    public AddressRangeSet intersect(AddressRangeSet other) {
        this.ranges.removeAll(other.ranges.complement());
        return this;
    }

    public boolean isEmpty() {
        return this.ranges.isEmpty();
    }

    public long lowerBound() {
        this.checkNotEmpty();
        return this.ranges.span().lowerEndpoint();
    }

    public long upperBound() {
        this.checkNotEmpty();
        return this.ranges.span().upperEndpoint() - 1;
    }

    public long size() {
        long size = 0;
        for (var range : this.ranges.asRanges()) {
            size += range.upperEndpoint() - range.lowerEndpoint();
        }
        return size;
    }

    public boolean contains(long value) {
        return this.ranges.contains(value);
    }

    public boolean encloses(long lower, long upper) {
        return this.ranges.encloses(AddressRangeSet.toRange(lower, upper));
    }

    public boolean overlaps(long lower, long upper) {
        return this.ranges.intersects(AddressRangeSet.toRange(lower, upper));
    }

    public long chooseValueUniformly(Random random) {
        this.checkNotEmpty();
        long offset = random.nextLong(this.size());
        for (var range : this.ranges.asRanges()) {
            long length = range.upperEndpoint() - range.lowerEndpoint();
            if (offset < length) {
                return range.lowerEndpoint() + offset;
            }
            offset -= length;
        }
        throw new IllegalStateException("offset beyond set size");
    }

    // replaces the set with the numbers of the pages lying entirely inside it
    public AddressRangeSet alignWithPage(int pageShift) {
        long pageMask = (1L << pageShift) - 1;
        var aligned = new ArrayList<Range<Long>>();
        for (var range : this.ranges.asRanges()) {
            long lower = range.lowerEndpoint();
            long firstPage = (lower >>> pageShift) + ((lower & pageMask) != 0 ? 1 : 0);
            long endPage = range.upperEndpoint() >>> pageShift;
            if (firstPage < endPage) {
                aligned.add(Range.closedOpen(firstPage, endPage));
            }
        }
        this.ranges.clear();
        aligned.forEach(this.ranges::add);
        return this;
    }

    public AddressRangeSet filterAlignedElements(long alignMask) {
        if (alignMask == 0) {
            return this;
        }
        var filtered = new ArrayList<Range<Long>>();
        for (var range : this.ranges.asRanges()) {
            long value = range.lowerEndpoint();
            if ((value & alignMask) != 0) {
                value = (value | alignMask) + 1;
            }
            for (; value >= 0 && value < range.upperEndpoint(); value += alignMask + 1) {
                filtered.add(Range.closedOpen(value, value + 1));
            }
        }
        this.ranges.clear();
        filtered.forEach(this.ranges::add);
        return this;
    }

    public AddressRangeSet shiftElements(long delta) {
        var shifted = new ArrayList<Range<Long>>();
        for (var range : this.ranges.asRanges()) {
            shifted.add(AddressRangeSet.toRange(range.lowerEndpoint() + delta, range.upperEndpoint() - 1 + delta));
        }
        this.ranges.clear();
        shifted.forEach(this.ranges::add);
        return this;
    }

    // values v for which [v, v + length - 1] is entirely inside this set
    public AddressRangeSet runStarts(long length) {
        if (length <= 0) {
            throw new IllegalArgumentException("run length must be positive: " + length);
        }
        var result = new AddressRangeSet();
        for (var range : this.ranges.asRanges()) {
            long lower = range.lowerEndpoint();
            long end = range.upperEndpoint();
            if (end - lower >= length) {
                result.ranges.add(Range.closedOpen(lower, end - length + 1));
            }
        }
        return result;
    }

    public List<Range<Long>> ranges() {
        var result = new ArrayList<Range<Long>>();
        for (var range : this.ranges.asRanges()) {
            result.add(Range.closed(range.lowerEndpoint(), range.upperEndpoint() - 1));
        }
        return result;
    }

    public String toSimpleString() {
        var sb = new StringBuilder();
        for (var range : this.ranges.asRanges()) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            long lower = range.lowerEndpoint();
            long upper = range.upperEndpoint() - 1;
            sb.append("0x").append(Long.toHexString(lower));
            if (upper != lower) {
                sb.append("-0x").append(Long.toHexString(upper));
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AddressRangeSet)) {
            return false;
        }
        return this.ranges.equals(((AddressRangeSet) o).ranges);
    }

    @Override
    public int hashCode() {
        return this.ranges.hashCode();
    }

    @Override
    public String toString() {
        return "[" + this.toSimpleString() + "]";
    }

    private void checkNotEmpty() {
        if (this.ranges.isEmpty()) {
            throw new IllegalStateException("address range set is empty");
        }
    }

    private static Range<Long> toRange(long lower, long upper) {
        if (lower < 0 || upper > Constants.MAX_ADDRESS || lower > upper) {
            throw new IllegalArgumentException(
                    String.format("invalid address range 0x%x-0x%x", lower, upper));
        }
        return Range.closedOpen(lower, upper + 1);
    }
}
