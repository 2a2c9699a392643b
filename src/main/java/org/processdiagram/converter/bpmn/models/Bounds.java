package org.processdiagram.converter.bpmn.models;

/**
 * Axis-aligned rectangle in absolute diagram coordinates.
 */
public record Bounds(double x, double y, double width, double height) {

    public double maxX() {
        return x + width;
    }

    public double maxY() {
        return y + height;
    }

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }

    public Point center() {
        return new Point(centerX(), centerY());
    }

    public boolean contains(Bounds other) {
        return other.x >= x && other.y >= y && other.maxX() <= maxX() && other.maxY() <= maxY();
    }

    /**
     * True when the interiors overlap. Rectangles that only share an edge do not intersect.
     */
    public boolean intersects(Bounds other) {
        return other.x < maxX() && x < other.maxX() && other.y < maxY() && y < other.maxY();
    }

    public Bounds union(Bounds other) {
        double minX = Math.min(x, other.x);
        double minY = Math.min(y, other.y);
        double maxX = Math.max(maxX(), other.maxX());
        double maxY = Math.max(maxY(), other.maxY());
        return new Bounds(minX, minY, maxX - minX, maxY - minY);
    }

    public Bounds inflate(double amount) {
        return new Bounds(x - amount, y - amount, width + 2 * amount, height + 2 * amount);
    }

    public Bounds translate(double dx, double dy) {
        return new Bounds(x + dx, y + dy, width, height);
    }
}
