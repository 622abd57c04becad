package io.physpage;

import io.physpage.memory.AddressRangeSet;
import io.physpage.memory.PageSizeClass;
import io.physpage.traits.MemoryTraitsManager;
import io.physpage.traits.MemoryTraitsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Random;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;

public class PhysicalPageManagerRandomTest {
    private static final long USABLE_UPPER = 0xfffffL;

    private final AddressRangeSet usable = AddressRangeSet.of(0, USABLE_UPPER);
    private PhysicalPageManager manager;
    private PagingChoicesAdapter choices;

    @BeforeEach
    public void setUp() {
        var config = Config.newBuilder().setRandomSeed(17).build();
        this.manager = new PhysicalPageManager(config, new MemoryTraitsManager(new MemoryTraitsRegistry()));
        this.manager.initialize(this.usable, AddressRangeSet.of(0, USABLE_UPPER));
        this.choices = this.manager.newPagingChoices();
    }

    private PageRequest randomRequest(Random random) {
        var builder = PageRequest.newBuilder()
                .setInstructionAddress(random.nextBoolean())
                .setCanAlias(random.nextInt(10) != 0);
        switch (random.nextInt(4)) {
            case 0:
                builder.setFlatMap(true);
                break;
            case 1:
                var pages = this.manager.getPhysicalPages();
                if (!pages.isEmpty()) {
                    var page = pages.get(random.nextInt(pages.size()));
                    builder.setPhysicalAddress(page.getLower());
                }
                break;
            case 2:
                if (random.nextBoolean()) {
                    builder.setForceAlias(true);
                }
                break;
            default:
                break;
        }
        return builder.build();
    }

    @Test
    public void testBookkeepingHoldsAcrossRandomOperations() {
        var random = new Random(5);
        var pageSize = PageSizeClass.S4K.getPageSize();
        var previousAllocated = this.manager.getAllocatedRanges();
        int successes = 0;
        for (int i = 0; i < 2000; ++i) {
            long size = pageSize * (random.nextInt(3) + 1);
            long va = pageSize * random.nextInt((int) ((USABLE_UPPER + 1) / pageSize));
            var request = this.randomRequest(random);
            var sizeInfo = new PageSizeInfo(PageSizeClass.S4K, size, USABLE_UPPER);

            var before = new ArrayList<Object>();
            before.add(this.manager.getFreeRanges());
            before.add(this.manager.getAllocatedRanges());
            before.add(this.manager.getAliasExcludeRanges());

            var allocated = this.manager.allocatePage(0, va, size, request, sizeInfo, this.choices);
            this.manager.validate();

            var free = this.manager.getFreeRanges();
            var allocatedRanges = this.manager.getAllocatedRanges();
            assertThat(free.copy().union(allocatedRanges), is(this.usable));
            assertThat(allocatedRanges.copy().intersect(previousAllocated), is(previousAllocated));
            assertThat(this.manager.getUsablePageAligned(PageSizeClass.S4K),
                    is(free.copy().alignWithPage(PageSizeClass.S4K.getPageShift())));

            if (allocated) {
                ++successes;
                assertThat(PageSizeClass.S4K.isAligned(sizeInfo.getPhysicalStart()), is(true));
                assertThat(sizeInfo.getPhysicalEnd() - sizeInfo.getPhysicalStart() + 1, is(size));
                assertThat(allocatedRanges.encloses(sizeInfo.getPhysicalStart(), sizeInfo.getPhysicalEnd()), is(true));
                var page = this.manager.findPhysicalPage(sizeInfo.getPhysicalPageId());
                assertThat(page, is(notNullValue()));
                assertThat(page.contains(sizeInfo.getPhysicalStart(), sizeInfo.getPhysicalEnd()), is(true));
                if (request.isFlatMap()) {
                    assertThat(sizeInfo.getPhysicalStart(), is(va));
                }
            } else {
                assertThat(sizeInfo.getPhysicalPageId(), is(0L));
                var after = new ArrayList<Object>();
                after.add(free);
                after.add(allocatedRanges);
                after.add(this.manager.getAliasExcludeRanges());
                assertThat(after, is(before));
            }
            previousAllocated = allocatedRanges;
        }
        assertThat(successes > 0, is(true));
    }
}
