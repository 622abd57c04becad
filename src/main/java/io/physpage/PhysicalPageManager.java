package io.physpage;

import io.physpage.memory.AddressRangeSet;
import io.physpage.memory.Constants;
import io.physpage.memory.PageSizeClass;
import io.physpage.traits.MemoryTraitsManager;
import io.physpage.traits.MemoryTraitsRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Random;
import java.util.TreeMap;

public class PhysicalPageManager {
    private static final Logger log = LoggerFactory.getLogger(PhysicalPageManager.class);

    private final Config config;
    private final MemoryTraitsManager memoryTraitsManager;
    private final Random random;
    private final Map<Long, PhysicalPage> pages = new HashMap<>();
    private final TreeMap<Long, Long> pageIndex = new TreeMap<>();
    private final Map<PageSizeClass, AddressRangeSet> usablePageAligned = new LinkedHashMap<>();
    private AddressRangeSet boundary;
    private AddressRangeSet freeRanges;
    private AddressRangeSet allocatedRanges;
    private AddressRangeSet aliasExcludeRanges;
    private long nextPageId = 1;
    private boolean initialized;

    public PhysicalPageManager(Config config, MemoryTraitsManager memoryTraitsManager) {
        this.config = config;
        this.memoryTraitsManager = memoryTraitsManager;
        this.random = new Random(config.getRandomSeed());
    }

    public void initialize(AddressRangeSet usableMemory, AddressRangeSet boundary) {
        if (this.initialized) {
            log.error("page manager initialized twice");
            throw new PageManagerError("already_initialized", "the page manager can only be initialized once");
        }
        if (usableMemory == null) {
            log.error("null passed as usable physical memory");
            throw new PageManagerError("nullptr_usable_memory", "usable physical memory is required");
        }
        if (boundary == null) {
            log.error("null passed as physical boundary");
            throw new PageManagerError("nullptr_boundary", "a physical boundary is required");
        }
        if (usableMemory.isEmpty()) {
            log.error("attempting to initialize with empty usable memory");
            throw new PageManagerError("empty_usable_memory", "usable physical memory is empty");
        }
        this.boundary = boundary.copy();
        this.freeRanges = usableMemory.copy();
        this.allocatedRanges = new AddressRangeSet();
        this.aliasExcludeRanges = new AddressRangeSet();
        for (var sizeClass : this.config.getPageSizeClasses()) {
            this.usablePageAligned.put(sizeClass, this.freeRanges.copy().alignWithPage(sizeClass.getPageShift()));
        }
        this.initialized = true;
        log.info("init complete, boundary={}, usable={}",
                this.boundary.toSimpleString(), this.freeRanges.toSimpleString());
    }

    public boolean isInitialized() {
        return this.initialized;
    }

    public PagingChoicesAdapter newPagingChoices() {
        return new WeightedPagingChoices(this.config, this.random);
    }

    public PageSizeInfo newPageSizeInfo(PageSizeClass sizeClass, long size) {
        return new PageSizeInfo(sizeClass, size, this.config.getMaxPhysicalAddress());
    }

    public void subFromBoundary(AddressRangeSet ranges) {
        this.checkInitialized();
        this.boundary.subtract(ranges);
    }

    public void addToBoundary(AddressRangeSet ranges) {
        this.checkInitialized();
        this.boundary.union(ranges);
    }

    public boolean allocatePage(int threadId,
                                long va,
                                long size,
                                PageRequest request,
                                PageSizeInfo sizeInfo,
                                PagingChoicesAdapter choicesAdapter) {
        this.checkInitialized();
        if (size != sizeInfo.getSize()) {
            throw new IllegalArgumentException(
                    String.format("size 0x%x does not match page size info %s", size, sizeInfo));
        }
        if (request.isForceAlias()) {
            return this.aliasAllocation(threadId, va, sizeInfo, request);
        }

        var choiceName = request.isInstructionAddress()
                ? PagingChoicesAdapter.INSTRUCTION_PAGE_ALIASING
                : PagingChoicesAdapter.DATA_PAGE_ALIASING;
        if (choicesAdapter.getPlainPagingChoice(choiceName) == 1) {
            return this.aliasAllocation(threadId, va, sizeInfo, request)
                    || this.newAllocation(threadId, va, sizeInfo, request);
        }
        return this.newAllocation(threadId, va, sizeInfo, request)
                || this.aliasAllocation(threadId, va, sizeInfo, request);
    }

    public boolean newAllocation(int threadId, long va, PageSizeInfo sizeInfo, PageRequest request) {
        this.checkInitialized();
        var alignedFree = this.getAlignedCache(sizeInfo.getSizeClass());
        var strategy = MappingStrategy.select(request);
        if (!strategy.carve(va, alignedFree, this.boundary, request, sizeInfo, this.random)) {
            log.debug("{} mapping found no free {} region for va=0x{} size=0x{}",
                    strategy, sizeInfo.getSizeClass(), Long.toHexString(va), Long.toHexString(sizeInfo.getSize()));
            return false;
        }

        var page = new PhysicalPage(
                sizeInfo.getPhysicalStart(), sizeInfo.getPhysicalEnd(), request.canAlias(), this.nextPageId++);
        sizeInfo.updatePhysicalPageId(page.getPageId());
        this.tagMemoryAttributes(threadId, this.getPageMemoryAttributes(request), page);
        this.addPhysicalPage(page);
        log.debug("new allocation {} for va=0x{}", page, Long.toHexString(va));
        return true;
    }

    // target precedence: flat va, physical address, page id, solved constraints
    public boolean aliasAllocation(int threadId, long va, PageSizeInfo sizeInfo, PageRequest request) {
        this.checkInitialized();
        long target;
        if (request.isFlatMap()) {
            target = va;
        } else if (request.getPhysicalAddress().isPresent()) {
            target = request.getPhysicalAddress().getAsLong();
        } else if (request.getAliasPageId().isPresent()) {
            var targetPage = this.findPhysicalPage(request.getAliasPageId().getAsLong());
            if (targetPage == null) {
                log.debug("alias target page id {} is not live", request.getAliasPageId().getAsLong());
                return false;
            }
            target = targetPage.getLower();
        } else {
            var solved = this.solveAliasConstraints(threadId, sizeInfo, request);
            if (solved.isEmpty()) {
                log.debug("no alias target satisfies the constraints of {}", request);
                return false;
            }
            target = solved.getAsLong();
        }

        long lower = target;
        long upper = target + sizeInfo.getSize() - 1;
        if (lower < 0 || upper < lower || upper > Constants.MAX_ADDRESS) {
            log.debug("alias target 0x{} size 0x{} is outside the address range",
                    Long.toHexString(target), Long.toHexString(sizeInfo.getSize()));
            return false;
        }

        var overlapped = this.getOverlappingPages(lower, upper);
        if (overlapped.isEmpty()) {
            log.warn("aliased allocation not possible to phys page target, no overlapping pages. start=0x{} end=0x{}",
                    Long.toHexString(lower), Long.toHexString(upper));
            return false;
        }
        if (!this.freeRanges.copy().union(this.allocatedRanges).encloses(lower, upper)) {
            log.debug("alias range 0x{}-0x{} extends past usable memory", Long.toHexString(lower), Long.toHexString(upper));
            return false;
        }

        var aliasAttributes = this.getPageMemoryAttributesForAliasing(request);
        for (var page : overlapped) {
            if (!request.isForceMemoryAttributes()) {
                var allocTraits = new MemoryTraitsRange(
                        this.memoryTraitsManager.getRegistry(), aliasAttributes, lower, upper);
                var pageTraits = this.memoryTraitsManager.createTraitsRange(threadId, page.getLower(), page.getUpper());
                if (!this.memAttrCompatibility(allocTraits, pageTraits)) {
                    return false;
                }
            }
            if (!request.isFlatMap() && !page.isAliasable()) {
                log.trace("targeted alias page {} is marked as not aliasable", page);
                return false;
            }
        }

        if (overlapped.size() == 1 && overlapped.get(0).contains(lower, upper)) {
            var existing = overlapped.get(0);
            if (!request.isFlatMap() && !request.canAlias() && existing.isAliasable()) {
                existing.clearAliasable();
                this.aliasExcludeRanges.addRange(existing.getLower(), existing.getUpper());
                log.trace("cleared can-alias flag of {}, alias excludes={}",
                        existing, this.aliasExcludeRanges.toSimpleString());
            }
            this.tagMemoryAttributes(threadId, aliasAttributes, existing);
            sizeInfo.updatePhysicalStart(lower);
            sizeInfo.updatePhysicalPageId(existing.getPageId());
            log.trace("single overlap, alias 0x{}-0x{} reuses {}", Long.toHexString(lower), Long.toHexString(upper), existing);
            return true;
        }

        var merged = new PhysicalPage(lower, upper, request.canAlias(), this.nextPageId++);
        for (var page : overlapped) {
            merged.merge(page);
            this.removePhysicalPage(page);
        }
        this.tagMemoryAttributes(threadId, aliasAttributes, merged);
        this.addPhysicalPage(merged);
        sizeInfo.updatePhysicalStart(lower);
        sizeInfo.updatePhysicalPageId(merged.getPageId());
        log.trace("{} overlapped page(s) {} merged into {}", overlapped.size(), overlapped, merged);
        return true;
    }

    public OptionalLong solveAliasConstraints(int threadId, PageSizeInfo sizeInfo, PageRequest request) {
        this.checkInitialized();
        var candidates = this.allocatedRanges.copy().subtract(this.aliasExcludeRanges);
        long maxPhysical = sizeInfo.getMaxPhysical();
        if (!candidates.isEmpty() && candidates.upperBound() > maxPhysical) {
            candidates.subRange(maxPhysical + 1, candidates.upperBound());
        }

        for (int traitId : this.getPageMemoryAttributesForAliasing(request)) {
            var traitRanges = this.memoryTraitsManager.getTraitAddressRanges(threadId, traitId);
            if (traitRanges != null) {
                candidates.intersect(traitRanges);
            }
        }

        candidates.alignWithPage(sizeInfo.getPageShift());
        if (candidates.isEmpty()) {
            return OptionalLong.empty();
        }
        long pageNumber = candidates.chooseValueUniformly(this.random);
        return OptionalLong.of(sizeInfo.getSizeClass().toAddress(pageNumber));
    }

    public boolean memAttrCompatibility(MemoryTraitsRange allocAttributes, MemoryTraitsRange aliasAttributes) {
        if (allocAttributes.isEmpty()) {
            log.trace("alloc page has no attributes, should match any page. can alias");
            return true;
        }
        if (aliasAttributes.isEmpty()) {
            log.trace("alias page has no attributes, can alias");
            return true;
        }
        if (aliasAttributes.isCompatible(allocAttributes)) {
            log.trace("pages memory attributes are compatible. allow aliasing");
            return true;
        }
        log.trace("memory attributes {} and {} are incompatible, not allowing aliasing", allocAttributes, aliasAttributes);
        return false;
    }

    public void commitPage(VirtualPage virtualPage) {
        this.checkInitialized();
        var physicalPage = this.findPhysicalPage(virtualPage.getPhysicalLower(), virtualPage.getPhysicalUpper());
        if (physicalPage == null) {
            log.error("unable to find physical page to propagate virtual page link to");
            throw new PageManagerError("unable_to_find_phys_page_for_commit",
                    String.format("no physical page backs 0x%x-0x%x",
                            virtualPage.getPhysicalLower(), virtualPage.getPhysicalUpper()));
        }
        physicalPage.addPage(virtualPage);
    }

    public void handleMemoryConstraintUpdate(MemoryConstraintUpdate update) {
        this.checkInitialized();
        for (var page : this.getOverlappingPages(update.getPhysicalStart(), update.getPhysicalEnd())) {
            page.handleMemoryConstraintUpdate(update);
        }
    }

    public VirtualPage getVirtualPage(long pa, AddressSpace addressSpace) {
        this.checkInitialized();
        var physicalPage = this.findPhysicalPage(pa, pa);
        if (physicalPage == null) {
            log.warn("unable to find physical page, can't return virtual page");
            return null;
        }
        return physicalPage.getVirtualPage(pa, addressSpace);
    }

    public PhysicalPage findPhysicalPage(long lower, long upper) {
        this.checkInitialized();
        var found = this.getOverlappingPages(lower, upper);
        if (found.size() > 1) {
            log.error("found multiple allocated physical pages for range lower=0x{} to upper=0x{}",
                    Long.toHexString(lower), Long.toHexString(upper));
            throw new PageManagerError("find_physical_page_returned_multiple_pages",
                    String.format("%d pages overlap 0x%x-0x%x", found.size(), lower, upper));
        }
        if (found.isEmpty()) {
            log.warn("unable to find allocated physical page for range lower=0x{} to upper=0x{}",
                    Long.toHexString(lower), Long.toHexString(upper));
            return null;
        }
        return found.get(0);
    }

    public PhysicalPage findPhysicalPage(long pageId) {
        this.checkInitialized();
        return this.pages.get(pageId);
    }

    public List<PhysicalPage> getPhysicalPages() {
        var result = new ArrayList<PhysicalPage>(this.pageIndex.size());
        for (long pageId : this.pageIndex.values()) {
            result.add(this.pages.get(pageId));
        }
        return result;
    }

    public AddressRangeSet getBoundary() {
        this.checkInitialized();
        return this.boundary.copy();
    }

    public AddressRangeSet getFreeRanges() {
        this.checkInitialized();
        return this.freeRanges.copy();
    }

    public AddressRangeSet getAllocatedRanges() {
        this.checkInitialized();
        return this.allocatedRanges.copy();
    }

    public AddressRangeSet getAliasExcludeRanges() {
        this.checkInitialized();
        return this.aliasExcludeRanges.copy();
    }

    public AddressRangeSet getUsablePageAligned(PageSizeClass sizeClass) {
        this.checkInitialized();
        return this.getAlignedCache(sizeClass).copy();
    }

    public void validate() {
        this.checkInitialized();
        var pageUnion = new AddressRangeSet();
        PhysicalPage previous = null;
        for (var entry : this.pageIndex.entrySet()) {
            var page = this.pages.get(entry.getValue());
            if (page == null || page.getLower() != entry.getKey()) {
                throw this.invalidState("index entry 0x" + Long.toHexString(entry.getKey()) + " is stale");
            }
            if (previous != null && previous.getUpper() >= page.getLower()) {
                throw this.invalidState(previous + " overlaps " + page);
            }
            if (page.getPageId() <= 0 || page.getPageId() >= this.nextPageId) {
                throw this.invalidState(page + " has an id that was never issued");
            }
            pageUnion.addRange(page.getLower(), page.getUpper());
            previous = page;
        }
        if (this.pages.size() != this.pageIndex.size()) {
            throw this.invalidState("page arena and index disagree");
        }
        if (!pageUnion.equals(this.allocatedRanges)) {
            throw this.invalidState("allocated " + this.allocatedRanges + " differs from pages " + pageUnion);
        }
        if (!this.aliasExcludeRanges.copy().subtract(this.allocatedRanges).isEmpty()) {
            throw this.invalidState("alias excludes " + this.aliasExcludeRanges + " are not all allocated");
        }
        if (!this.freeRanges.copy().intersect(this.allocatedRanges).isEmpty()) {
            throw this.invalidState("free and allocated ranges intersect");
        }
    }

    private PageManagerError invalidState(String message) {
        log.error("invalid page manager state: {}", message);
        return new PageManagerError("invalid_page_manager_state", message);
    }

    private List<PhysicalPage> getOverlappingPages(long lower, long upper) {
        var result = new ArrayList<PhysicalPage>();
        var floor = this.pageIndex.floorEntry(lower);
        long from = lower;
        if (floor != null && this.pages.get(floor.getValue()).getUpper() >= lower) {
            from = floor.getKey();
        }
        for (long pageId : this.pageIndex.subMap(from, true, upper, true).values()) {
            result.add(this.pages.get(pageId));
        }
        return result;
    }

    private void addPhysicalPage(PhysicalPage page) {
        this.pages.put(page.getPageId(), page);
        this.pageIndex.put(page.getLower(), page.getPageId());
        this.freeRanges.subRange(page.getLower(), page.getUpper());
        this.allocatedRanges.addRange(page.getLower(), page.getUpper());
        if (!page.isAliasable()) {
            this.aliasExcludeRanges.addRange(page.getLower(), page.getUpper());
        }
        for (var entry : this.usablePageAligned.entrySet()) {
            var sizeClass = entry.getKey();
            entry.getValue().subRange(sizeClass.toPageNumber(page.getLower()), sizeClass.toPageNumber(page.getUpper()));
        }
    }

    private void removePhysicalPage(PhysicalPage page) {
        this.pages.remove(page.getPageId());
        this.pageIndex.remove(page.getLower());
    }

    private AddressRangeSet getAlignedCache(PageSizeClass sizeClass) {
        var aligned = this.usablePageAligned.get(sizeClass);
        if (aligned == null) {
            log.error("no aligned free cache for page size class {}", sizeClass);
            throw new PageManagerError("unknown_page_size_class", "page size class " + sizeClass + " is not configured");
        }
        return aligned;
    }

    private void tagMemoryAttributes(int threadId, List<Integer> traitIds, PhysicalPage page) {
        for (int traitId : traitIds) {
            this.memoryTraitsManager.addTrait(threadId, traitId, page.getLower(), page.getUpper());
        }
    }

    private List<Integer> getPageMemoryAttributes(PageRequest request) {
        var registry = this.memoryTraitsManager.getRegistry();
        var traitIds = new ArrayList<Integer>();
        for (var attribute : request.getArchitectureMemoryAttributes()) {
            traitIds.add(registry.resolveTraitId(attribute.getTraitName()));
        }
        for (var attribute : request.getImplementationMemoryAttributes()) {
            traitIds.add(registry.resolveTraitId(attribute));
        }
        return traitIds;
    }

    private List<Integer> getPageMemoryAttributesForAliasing(PageRequest request) {
        var aliasAttributes = request.getAliasImplementationMemoryAttributes();
        if (aliasAttributes.isEmpty()) {
            return this.getPageMemoryAttributes(request);
        }
        var registry = this.memoryTraitsManager.getRegistry();
        var traitIds = new ArrayList<Integer>();
        for (var attribute : aliasAttributes) {
            traitIds.add(registry.resolveTraitId(attribute));
        }
        return traitIds;
    }

    private void checkInitialized() {
        if (!this.initialized) {
            log.error("page manager used before initialization");
            throw new PageManagerError("not_initialized", "the page manager has not been initialized");
        }
    }
}
