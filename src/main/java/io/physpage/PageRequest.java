package io.physpage;

import com.google.common.base.MoreObjects;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

public class PageRequest {
    public static class Builder {
        private final PageRequest request = new PageRequest();

        public Builder setFlatMap(boolean flatMap) {
            this.request.flatMap = flatMap;
            return this;
        }

        public Builder setCanAlias(boolean canAlias) {
            this.request.canAlias = canAlias;
            return this;
        }

        public Builder setForceMemoryAttributes(boolean forceMemoryAttributes) {
            this.request.forceMemoryAttributes = forceMemoryAttributes;
            return this;
        }

        public Builder setForceAlias(boolean forceAlias) {
            this.request.forceAlias = forceAlias;
            return this;
        }

        public Builder setInstructionAddress(boolean instructionAddress) {
            this.request.instructionAddress = instructionAddress;
            return this;
        }

        public Builder setAliasPageId(long aliasPageId) {
            this.request.aliasPageId = OptionalLong.of(aliasPageId);
            return this;
        }

        public Builder setPhysicalAddress(long physicalAddress) {
            this.request.physicalAddress = OptionalLong.of(physicalAddress);
            return this;
        }

        public Builder addArchitectureMemoryAttribute(MemoryAttribute attribute) {
            this.request.architectureMemoryAttributes.add(attribute);
            return this;
        }

        public Builder addImplementationMemoryAttribute(String attribute) {
            this.request.implementationMemoryAttributes.add(attribute);
            return this;
        }

        public Builder addAliasImplementationMemoryAttribute(String attribute) {
            this.request.aliasImplementationMemoryAttributes.add(attribute);
            return this;
        }

        public PageRequest build() {
            return new PageRequest(this.request);
        }
    }

    private boolean flatMap;
    private boolean canAlias = true;
    private boolean forceMemoryAttributes;
    private boolean forceAlias;
    private boolean instructionAddress;
    private OptionalLong aliasPageId = OptionalLong.empty();
    private OptionalLong physicalAddress = OptionalLong.empty();
    private final List<MemoryAttribute> architectureMemoryAttributes = new ArrayList<>();
    private final List<String> implementationMemoryAttributes = new ArrayList<>();
    private final List<String> aliasImplementationMemoryAttributes = new ArrayList<>();

    private PageRequest() {
    }

    private PageRequest(PageRequest request) {
        this.flatMap = request.flatMap;
        this.canAlias = request.canAlias;
        this.forceMemoryAttributes = request.forceMemoryAttributes;
        this.forceAlias = request.forceAlias;
        this.instructionAddress = request.instructionAddress;
        this.aliasPageId = request.aliasPageId;
        this.physicalAddress = request.physicalAddress;
        this.architectureMemoryAttributes.addAll(request.architectureMemoryAttributes);
        this.implementationMemoryAttributes.addAll(request.implementationMemoryAttributes);
        this.aliasImplementationMemoryAttributes.addAll(request.aliasImplementationMemoryAttributes);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public boolean isFlatMap() {
        return this.flatMap;
    }

    public boolean canAlias() {
        return this.canAlias;
    }

    public boolean isForceMemoryAttributes() {
        return this.forceMemoryAttributes;
    }

    public boolean isForceAlias() {
        return this.forceAlias;
    }

    public boolean isInstructionAddress() {
        return this.instructionAddress;
    }

    public OptionalLong getAliasPageId() {
        return this.aliasPageId;
    }

    public OptionalLong getPhysicalAddress() {
        return this.physicalAddress;
    }

    public List<MemoryAttribute> getArchitectureMemoryAttributes() {
        return Collections.unmodifiableList(this.architectureMemoryAttributes);
    }

    public List<String> getImplementationMemoryAttributes() {
        return Collections.unmodifiableList(this.implementationMemoryAttributes);
    }

    public List<String> getAliasImplementationMemoryAttributes() {
        return Collections.unmodifiableList(this.aliasImplementationMemoryAttributes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("flatMap", this.flatMap)
                .add("canAlias", this.canAlias)
                .add("forceMemoryAttributes", this.forceMemoryAttributes)
                .add("forceAlias", this.forceAlias)
                .add("instructionAddress", this.instructionAddress)
                .add("aliasPageId", this.aliasPageId)
                .add("physicalAddress", this.physicalAddress)
                .add("architectureMemoryAttributes", this.architectureMemoryAttributes)
                .add("implementationMemoryAttributes", this.implementationMemoryAttributes)
                .add("aliasImplementationMemoryAttributes", this.aliasImplementationMemoryAttributes)
                .toString();
    }
}
