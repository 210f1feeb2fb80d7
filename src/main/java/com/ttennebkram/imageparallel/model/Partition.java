package com.ttennebkram.imageparallel.model;

/**
 * A contiguous half-open index range [start, end) of one axis, owned by one worker for one stage.
 */
public final class Partition {

    private final int index;
    private final int start;
    private final int end;

    public Partition(int index, int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid partition range [" + start + ", " + end + ")");
        }
        this.index = index;
        this.start = start;
        this.end = end;
    }

    /**
     * A single partition covering [0, length).
     */
    public static Partition whole(int length) {
        return new Partition(0, 0, length);
    }

    public int getIndex() {
        return index;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return end == start;
    }

    public boolean contains(int i) {
        return i >= start && i < end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Partition)) return false;
        Partition other = (Partition) o;
        return index == other.index && start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * index + start) + end;
    }

    @Override
    public String toString() {
        return "Partition#" + index + "[" + start + ", " + end + ")";
    }
}
