package gov.nih.ncats.objdetect.cascade;

import java.util.Objects;

/**
 * A weighted rectangle of a Haar-like feature, in window coordinates.
 * For a tilted feature {@code (x,y)} is the top corner of the 45 degree rotated
 * rectangle, {@code width} runs down and to the right and {@code height}
 * runs down and to the left.
 */
public final class Feature {
    private final int x, y, width, height;
    private final double weight;

    public Feature(int x, int y, int width, int height, double weight) {
        if(width <= 0 || height <= 0){
            throw new InvalidClassifierException("feature width and height must be positive but were " + width + "x" + height);
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.weight = weight;
    }

    public int getX() { return x; }
    public int getY() { return y; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public double getWeight() { return weight; }

    /**
     * Does this feature lie inside a window of the given size.
     */
    boolean fits(int windowWidth, int windowHeight, boolean tilted){
        if(tilted){
            return x - height >= 0 && x + width <= windowWidth
                    && y >= 0 && y + width + height <= windowHeight;
        }
        return x >= 0 && y >= 0 && x + width <= windowWidth && y + height <= windowHeight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Feature)) return false;
        Feature feature = (Feature) o;
        return x == feature.x && y == feature.y && width == feature.width && height == feature.height
                && Double.compare(feature.weight, weight) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height, weight);
    }

    @Override
    public String toString() {
        return "Feature{" + x + "," + y + "," + width + "x" + height + " w=" + weight + "}";
    }
}
