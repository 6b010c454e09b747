package gov.nih.ncats.objdetect;

import java.awt.geom.Rectangle2D;
import java.util.Comparator;
import java.util.Objects;

/**
 * A detected object: a rectangle in image coordinates and the number of raw
 * windows that were merged into it. A raw, ungrouped detection has a
 * neighbor count of 1.
 */
public final class Detection {

    /**
     * Orders detections by descending neighbor count.
     */
    public static final Comparator<Detection> BY_NEIGHBORS_DESCENDING =
            Comparator.comparingInt(Detection::getNeighbors).reversed();

    private final double x, y, width, height;
    private final int neighbors;

    public Detection(double x, double y, double width, double height) {
        this(x, y, width, height, 1);
    }

    public Detection(double x, double y, double width, double height, int neighbors) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.neighbors = neighbors;
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }

    /**
     * Number of raw detections this one represents, used as a confidence score.
     */
    public int getNeighbors() { return neighbors; }

    /**
     * Create a copy with all coordinates multiplied by the given factor.
     */
    public Detection scale(double factor){
        return new Detection(x * factor, y * factor, width * factor, height * factor, neighbors);
    }

    public Rectangle2D toRectangle2D(){
        return new Rectangle2D.Double(x, y, width, height);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Detection)) return false;
        Detection that = (Detection) o;
        return Double.compare(that.x, x) == 0 && Double.compare(that.y, y) == 0
                && Double.compare(that.width, width) == 0 && Double.compare(that.height, height) == 0
                && neighbors == that.neighbors;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height, neighbors);
    }

    @Override
    public String toString() {
        return "Detection{x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + ", neighbors=" + neighbors + "}";
    }
}
