package gov.nih.ncats.objdetect.cascade;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One stage of the cascade. A window passes the stage when the sum of
 * the values chosen by its trees is not below the stage threshold.
 */
public final class Stage {
    private final double threshold;
    private final List<Tree> trees;

    public Stage(double threshold, List<Tree> trees) {
        Objects.requireNonNull(trees, "trees can not be null");
        if(trees.isEmpty()){
            throw new InvalidClassifierException("a stage needs at least one tree");
        }
        this.threshold = threshold;
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
    }

    public double getThreshold() { return threshold; }
    public List<Tree> getTrees() { return trees; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Stage)) return false;
        Stage stage = (Stage) o;
        return Double.compare(stage.threshold, threshold) == 0 && trees.equals(stage.trees);
    }

    @Override
    public int hashCode() {
        return Objects.hash(threshold, trees);
    }
}
