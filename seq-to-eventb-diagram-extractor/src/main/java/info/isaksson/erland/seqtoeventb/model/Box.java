package info.isaksson.erland.seqtoeventb.model;

import java.util.Objects;

/** Axis-aligned rectangle; y grows downwards as in draw.io. */
public final class Box {

    public static final Box ZERO = new Box(0, 0, 0, 0);

    public final double x;
    public final double y;
    public final double width;
    public final double height;

    public Box(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double centerX() {
        return x + width / 2;
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public Box withOrigin(Point origin) {
        return new Box(origin.x, origin.y, width, height);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Box)) return false;
        Box b = (Box) o;
        return Double.compare(x, b.x) == 0 && Double.compare(y, b.y) == 0
                && Double.compare(width, b.width) == 0 && Double.compare(height, b.height) == 0;
    }

    @Override public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override public String toString() {
        return "Box{" + x + "," + y + "," + width + "x" + height + "}";
    }
}
