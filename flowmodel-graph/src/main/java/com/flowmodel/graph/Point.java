package com.flowmodel.graph;

/** Diagram coordinates, in 1/100th of mm. */
public record Point(int x, int y) {

    public static final Point ORIGIN = new Point(0, 0);

    public Point translate(int dx, int dy) {
        return new Point(x + dx, y + dy);
    }
}
