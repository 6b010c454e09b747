package gov.nih.ncats.objdetect.cascade;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A stump: a depth one decision tree over 1 to 3 weighted rectangles.
 * The left value is chosen when the normalized feature response is below
 * the node threshold, the right value otherwise.
 */
public final class Tree {
    public static final int MAX_FEATURES = 3;

    private final boolean tilted;
    private final List<Feature> features;
    private final double threshold;
    private final double leftValue, rightValue;

    public Tree(boolean tilted, List<Feature> features, double threshold, double leftValue, double rightValue) {
        Objects.requireNonNull(features, "features can not be null");
        if(features.isEmpty() || features.size() > MAX_FEATURES){
            throw new InvalidClassifierException("a tree needs 1 to " + MAX_FEATURES + " features but had " + features.size());
        }
        this.tilted = tilted;
        this.features = Collections.unmodifiableList(new ArrayList<>(features));
        this.threshold = threshold;
        this.leftValue = leftValue;
        this.rightValue = rightValue;
    }

    public boolean isTilted() { return tilted; }
    public List<Feature> getFeatures() { return features; }
    public double getThreshold() { return threshold; }
    public double getLeftValue() { return leftValue; }
    public double getRightValue() { return rightValue; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tree)) return false;
        Tree tree = (Tree) o;
        return tilted == tree.tilted
                && Double.compare(tree.threshold, threshold) == 0
                && Double.compare(tree.leftValue, leftValue) == 0
                && Double.compare(tree.rightValue, rightValue) == 0
                && features.equals(tree.features);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tilted, features, threshold, leftValue, rightValue);
    }
}
