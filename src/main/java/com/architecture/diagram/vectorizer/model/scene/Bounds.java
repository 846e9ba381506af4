package com.architecture.diagram.vectorizer.model.scene;

import lombok.Value;

/**
 * Axis-aligned bounding box of a raw scene element.
 * Negative extents (elements drawn right-to-left) are normalized on construction.
 */
@Value
public class Bounds {

    double x;
    double y;
    double width;
    double height;

    public static Bounds of(double x, double y, double width, double height) {
        double left = width < 0 ? x + width : x;
        double top = height < 0 ? y + height : y;
        return new Bounds(left, top, Math.abs(width), Math.abs(height));
    }

    public double getRight() {
        return x + width;
    }

    public double getBottom() {
        return y + height;
    }

    public double area() {
        return width * height;
    }

    public Point centroid() {
        return new Point(x + width / 2, y + height / 2);
    }

    public boolean contains(Point point) {
        return point.getX() >= x && point.getX() <= getRight()
                && point.getY() >= y && point.getY() <= getBottom();
    }

    /**
     * True when {@code other} lies fully inside this box, allowing {@code slack} units of overhang.
     */
    public boolean encloses(Bounds other, double slack) {
        return other.x >= x - slack && other.y >= y - slack
                && other.getRight() <= getRight() + slack
                && other.getBottom() <= getBottom() + slack;
    }

    /**
     * Euclidean distance from a point to this box; 0 when the point is inside.
     */
    public double distanceTo(Point point) {
        double dx = Math.max(Math.max(x - point.getX(), 0), point.getX() - getRight());
        double dy = Math.max(Math.max(y - point.getY(), 0), point.getY() - getBottom());
        return Math.hypot(dx, dy);
    }
}
