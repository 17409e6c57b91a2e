package com.flowmodel.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** Diagram extent, in 1/100th of mm. */
public record Size(int width, int height) {

    public static final Size EMPTY = new Size(0, 0);

    public Size {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative size: " + width + "x" + height);
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }
}
