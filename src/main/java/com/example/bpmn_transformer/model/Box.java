package com.example.bpmn_transformer.model;

/** Axis-aligned rectangle in diagram coordinates (y grows downwards). */
public final class Box {
    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public Box(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }

    public double left() { return x; }
    public double top() { return y; }
    public double right() { return x + width; }
    public double bottom() { return y + height; }
    public double centerX() { return x + width / 2; }
    public double centerY() { return y + height / 2; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Box)) return false;
        Box b = (Box) o;
        return Double.compare(x, b.x) == 0 && Double.compare(y, b.y) == 0
                && Double.compare(width, b.width) == 0 && Double.compare(height, b.height) == 0;
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return "Box[x=" + x + ", y=" + y + ", w=" + width + ", h=" + height + "]";
    }
}
