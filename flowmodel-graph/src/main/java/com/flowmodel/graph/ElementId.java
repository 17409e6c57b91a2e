package com.flowmodel.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identity of a graph element or presentation entry. Assigned once by the store when the
 * creation is committed and never reused; carried as an opaque handle by callers and
 * persisted as a plain number in snapshots so identities survive a save/reload cycle.
 */
public record ElementId(long value) implements Comparable<ElementId> {

    public ElementId {
        if (value <= 0) {
            throw new IllegalArgumentException("Element id must be positive: " + value);
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ElementId of(long value) {
        return new ElementId(value);
    }

    @JsonValue
    public long toValue() {
        return value;
    }

    @Override
    public int compareTo(ElementId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
