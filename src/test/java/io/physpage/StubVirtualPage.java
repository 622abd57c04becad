package io.physpage;

import java.util.ArrayList;
import java.util.List;

class StubVirtualPage implements VirtualPage {
    private final long physicalLower;
    private final long physicalUpper;
    private final AddressSpace addressSpace;
    final List<MemoryConstraintUpdate> updates = new ArrayList<>();

    StubVirtualPage(long physicalLower, long physicalUpper, AddressSpace addressSpace) {
        this.physicalLower = physicalLower;
        this.physicalUpper = physicalUpper;
        this.addressSpace = addressSpace;
    }

    @Override
    public long getPhysicalLower() {
        return this.physicalLower;
    }

    @Override
    public long getPhysicalUpper() {
        return this.physicalUpper;
    }

    @Override
    public AddressSpace getAddressSpace() {
        return this.addressSpace;
    }

    @Override
    public void handleMemoryConstraintUpdate(MemoryConstraintUpdate update) {
        this.updates.add(update);
    }
}
