package io.physpage;

public class MemoryConstraintUpdate {
    public enum Type {
        INITIALIZATION,
        RESERVATION,
        UNRESERVATION
    }

    private final long physicalStart;
    private final long physicalEnd;
    private final Type type;

    public MemoryConstraintUpdate(long physicalStart, long physicalEnd, Type type) {
        if (physicalStart > physicalEnd) {
            throw new IllegalArgumentException(
                    String.format("start 0x%x is above end 0x%x", physicalStart, physicalEnd));
        }
        this.physicalStart = physicalStart;
        this.physicalEnd = physicalEnd;
        this.type = type;
    }

    public long getPhysicalStart() {
        return this.physicalStart;
    }

    public long getPhysicalEnd() {
        return this.physicalEnd;
    }

    public Type getType() {
        return this.type;
    }

    @Override
    public String toString() {
        return String.format("%s 0x%x-0x%x", this.type, this.physicalStart, this.physicalEnd);
    }
}
