package gov.nih.ncats.objdetect.cascade;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Portable, hierarchical description of a stump based cascade classifier:
 * a window size and an ordered list of {@link Stage}s.
 * Instances are immutable and validated on construction so a malformed cascade
 * is rejected before any image is processed.
 *
 * <pre>
 * Cascade cascade = Cascade.builder(20, 20)
 *                      .stage(0.8)
 *                          .tree(false, 0.004, 0.03, 0.8)
 *                              .feature(3, 7, 14, 4, -1)
 *                              .feature(3, 9, 14, 2, 2)
 *                      .build();
 * </pre>
 */
public final class Cascade {

    private final int windowWidth, windowHeight;
    private final List<Stage> stages;
    private final boolean tilted;

    public Cascade(int windowWidth, int windowHeight, List<Stage> stages) {
        if(windowWidth <= 0 || windowHeight <= 0){
            throw new InvalidClassifierException("window dimensions must be positive but were " + windowWidth + "x" + windowHeight);
        }
        Objects.requireNonNull(stages, "stages can not be null");
        if(stages.isEmpty()){
            throw new InvalidClassifierException("a cascade needs at least one stage");
        }
        boolean anyTilted = false;
        for(int s=0; s< stages.size(); s++){
            for(Tree tree : stages.get(s).getTrees()){
                anyTilted |= tree.isTilted();
                for(Feature f : tree.getFeatures()){
                    if(!f.fits(windowWidth, windowHeight, tree.isTilted())){
                        throw new InvalidClassifierException("stage " + s + " has " + f + (tree.isTilted()? " (tilted)" : "")
                                + " outside of the " + windowWidth + "x" + windowHeight + " window");
                    }
                }
            }
        }
        this.windowWidth = windowWidth;
        this.windowHeight = windowHeight;
        this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
        this.tilted = anyTilted;
    }

    public int getWindowWidth() { return windowWidth; }
    public int getWindowHeight() { return windowHeight; }
    public List<Stage> getStages() { return stages; }

    /**
     * Does any tree of this cascade use tilted features; if so a rotated
     * integral image has to be computed for detection.
     */
    public boolean hasTiltedFeatures() { return tilted; }

    public int getTreeCount(){
        int count=0;
        for(Stage s : stages){
            count += s.getTrees().size();
        }
        return count;
    }

    public int getFeatureCount(){
        int count=0;
        for(Stage s : stages){
            for(Tree t : s.getTrees()){
                count += t.getFeatures().size();
            }
        }
        return count;
    }

    public static Builder builder(int windowWidth, int windowHeight){
        return new Builder(windowWidth, windowHeight);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cascade)) return false;
        Cascade cascade = (Cascade) o;
        return windowWidth == cascade.windowWidth && windowHeight == cascade.windowHeight
                && stages.equals(cascade.stages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(windowWidth, windowHeight, stages);
    }

    @Override
    public String toString() {
        return "Cascade{" + windowWidth + "x" + windowHeight + ", stages=" + stages.size()
                + ", trees=" + getTreeCount() + ", tilted=" + tilted + "}";
    }

    /**
     * Fluent builder. {@link #stage(double)} opens a new stage,
     * {@link #tree(boolean, double, double, double)} opens a new tree in the current stage and
     * {@link #feature(int, int, int, int, double)} adds a rectangle to the current tree.
     */
    public static final class Builder{
        private final int windowWidth, windowHeight;

        private final List<StageBuilder> stages = new ArrayList<>();

        private Builder(int windowWidth, int windowHeight){
            this.windowWidth = windowWidth;
            this.windowHeight = windowHeight;
        }

        public Builder stage(double threshold){
            stages.add(new StageBuilder(threshold));
            return this;
        }

        public Builder tree(boolean tilted, double threshold, double leftValue, double rightValue){
            if(stages.isEmpty()){
                throw new IllegalStateException("call stage() before tree()");
            }
            stages.get(stages.size()-1).trees.add(new TreeBuilder(tilted, threshold, leftValue, rightValue));
            return this;
        }

        public Builder feature(int x, int y, int width, int height, double weight){
            if(stages.isEmpty() || stages.get(stages.size()-1).trees.isEmpty()){
                throw new IllegalStateException("call tree() before feature()");
            }
            List<TreeBuilder> trees = stages.get(stages.size()-1).trees;
            trees.get(trees.size()-1).features.add(new Feature(x, y, width, height, weight));
            return this;
        }

        public Cascade build(){
            List<Stage> list = new ArrayList<>(stages.size());
            for(StageBuilder sb : stages){
                List<Tree> trees = new ArrayList<>(sb.trees.size());
                for(TreeBuilder tb : sb.trees){
                    trees.add(new Tree(tb.tilted, tb.features, tb.threshold, tb.leftValue, tb.rightValue));
                }
                list.add(new Stage(sb.threshold, trees));
            }
            return new Cascade(windowWidth, windowHeight, list);
        }
    }

    private static final class StageBuilder{
        private final double threshold;
        private final List<TreeBuilder> trees = new ArrayList<>();

        StageBuilder(double threshold){
            this.threshold = threshold;
        }
    }

    private static final class TreeBuilder{
        private final boolean tilted;
        private final double threshold, leftValue, rightValue;
        private final List<Feature> features = new ArrayList<>();

        TreeBuilder(boolean tilted, double threshold, double leftValue, double rightValue){
            this.tilted = tilted;
            this.threshold = threshold;
            this.leftValue = leftValue;
            this.rightValue = rightValue;
        }
    }
}
