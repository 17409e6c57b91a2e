package com.flowmodel.graph;

/**
 * Axis-aligned bounding box of a presented element. Edges are exclusive on the right and bottom,
 * so two boxes that only touch do not overlap.
 */
public record Box(Point position, Size size) {

    public static Box of(int x, int y, int width, int height) {
        return new Box(new Point(x, y), new Size(width, height));
    }

    public int left() {
        return position.x();
    }

    public int top() {
        return position.y();
    }

    public int right() {
        return position.x() + size.width();
    }

    public int bottom() {
        return position.y() + size.height();
    }

    public boolean overlaps(Box other) {
        return left() < other.right() && other.left() < right()
                && top() < other.bottom() && other.top() < bottom();
    }

    public boolean contains(Box other) {
        return left() <= other.left() && top() <= other.top()
                && other.right() <= right() && other.bottom() <= bottom();
    }
}
