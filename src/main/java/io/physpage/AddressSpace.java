package io.physpage;

public interface AddressSpace {
    long getId();
}
