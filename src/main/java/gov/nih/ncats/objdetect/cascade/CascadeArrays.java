package gov.nih.ncats.objdetect.cascade;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts between {@link Cascade} and the flat numeric layout stump cascades
 * are commonly distributed in after conversion from OpenCV's haar xml files:
 *
 * <pre>
 * windowWidth, windowHeight,
 *   stageThreshold, treeCount,
 *     tilted, featureCount,
 *       x, y, width, height, weight   (featureCount times)
 *     nodeThreshold, leftValue, rightValue
 *   ...
 * </pre>
 *
 * The flat layout itself carries no tilted marker for the whole cascade, the
 * {@code tilted} argument of {@link #fromArray(double[], boolean)} tells whether
 * tilted trees are allowed.
 */
public final class CascadeArrays {

    private CascadeArrays(){
        //can not instantiate
    }

    /**
     * Parse the flat layout.
     * @param data the flat cascade; can not be null.
     * @param tilted if false, a tree flagged as tilted is an error.
     * @return a new Cascade.
     * @throws InvalidClassifierException if the array is truncated, has trailing values,
     * has a tilted tree while {@code tilted} is false, or describes an invalid cascade.
     */
    public static Cascade fromArray(double[] data, boolean tilted){
        Objects.requireNonNull(data, "data can not be null");
        if(data.length < 2){
            throw new InvalidClassifierException("cascade array needs at least the window dimensions");
        }
        Reader r = new Reader(data);
        int windowWidth = r.nextInt("window width");
        int windowHeight = r.nextInt("window height");
        List<Stage> stages = new ArrayList<>();
        while(r.hasNext()){
            double stageThreshold = r.next("stage threshold");
            int numTrees = r.nextInt("tree count");
            List<Tree> trees = new ArrayList<>(Math.max(numTrees, 0));
            for(int j=0; j< numTrees; j++){
                boolean treeTilted = r.next("tilted flag") != 0;
                if(treeTilted && !tilted){
                    throw new InvalidClassifierException("tree " + j + " of stage " + stages.size()
                            + " is tilted but tilted features were not allowed");
                }
                int numFeatures = r.nextInt("feature count");
                if(numFeatures < 1 || numFeatures > Tree.MAX_FEATURES){
                    throw new InvalidClassifierException("a tree needs 1 to " + Tree.MAX_FEATURES + " features but had " + numFeatures
                            + " at index " + (r.index - 1));
                }
                List<Feature> features = new ArrayList<>(numFeatures);
                for(int k=0; k< numFeatures; k++){
                    features.add(new Feature(r.nextInt("x"), r.nextInt("y"), r.nextInt("width"), r.nextInt("height"), r.next("weight")));
                }
                trees.add(new Tree(treeTilted, features, r.next("node threshold"), r.next("left value"), r.next("right value")));
            }
            stages.add(new Stage(stageThreshold, trees));
        }
        return new Cascade(windowWidth, windowHeight, stages);
    }

    /**
     * Write a cascade in the flat layout.
     * @param cascade the cascade; can not be null.
     * @return a new array; {@code fromArray(toArray(c), true)} equals {@code c}.
     */
    public static double[] toArray(Cascade cascade){
        Objects.requireNonNull(cascade, "cascade can not be null");
        int length = 2 + cascade.getStages().size() * 2 + cascade.getTreeCount() * 5 + cascade.getFeatureCount() * 5;
        double[] out = new double[length];
        int i=0;
        out[i++] = cascade.getWindowWidth();
        out[i++] = cascade.getWindowHeight();
        for(Stage stage : cascade.getStages()){
            out[i++] = stage.getThreshold();
            out[i++] = stage.getTrees().size();
            for(Tree tree : stage.getTrees()){
                out[i++] = tree.isTilted()? 1 : 0;
                out[i++] = tree.getFeatures().size();
                for(Feature f : tree.getFeatures()){
                    out[i++] = f.getX();
                    out[i++] = f.getY();
                    out[i++] = f.getWidth();
                    out[i++] = f.getHeight();
                    out[i++] = f.getWeight();
                }
                out[i++] = tree.getThreshold();
                out[i++] = tree.getLeftValue();
                out[i++] = tree.getRightValue();
            }
        }
        return out;
    }

    private static final class Reader{
        private final double[] data;
        private int index;

        Reader(double[] data){
            this.data = data;
        }

        boolean hasNext(){
            return index < data.length;
        }

        double next(String what){
            if(index >= data.length){
                throw new InvalidClassifierException("cascade array truncated: expected " + what + " at index " + index);
            }
            return data[index++];
        }

        int nextInt(String what){
            double v = next(what);
            if(v != Math.rint(v)){
                throw new InvalidClassifierException(what + " must be an integer but was " + v + " at index " + (index - 1));
            }
            return (int) v;
        }
    }
}
