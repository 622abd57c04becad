package io.physpage;

public interface VirtualPage {
    long getPhysicalLower();

    long getPhysicalUpper();

    AddressSpace getAddressSpace();

    void handleMemoryConstraintUpdate(MemoryConstraintUpdate update);
}
