package gov.nih.ncats.objdetect.cascade;

import java.util.Arrays;
import java.util.Objects;

/**
 * A {@link Cascade} flattened for one particular integral table stride.
 * All values live in flat primitive arrays indexed by running stage, tree
 * and feature counters, so evaluating a window allocates nothing.
 *
 * Per feature only the offset of its first corner is stored, the other two corners
 * are packed as 16 bit deltas in a single int (low half: corner 2, high half: corner 3),
 * the fourth corner is {@code c2 + c3 - c1}. Feature weights are already multiplied by the
 * reciprocal of their tree's threshold and the two leaf values are stored so that
 * the value to use is always {@code values[2*tree + (response > std ? 1 : 0)]}.
 *
 * Instances are created by {@link CascadeCompiler} and are immutable.
 */
public final class CompiledClassifier {

    private final int windowWidth, windowHeight;
    private final int width;
    private final boolean tilted;

    private final float[] stageThresholds;
    private final int[] stageTreeCounts;

    private final boolean[] treeTilted;
    private final int[] treeFeatureCounts;
    private final float[] treeValues;

    private final int[] featureOffsets;
    private final int[] featureDeltas;
    private final float[] featureWeights;

    CompiledClassifier(int windowWidth, int windowHeight, int width,
                       float[] stageThresholds, int[] stageTreeCounts,
                       boolean[] treeTilted, int[] treeFeatureCounts, float[] treeValues,
                       int[] featureOffsets, int[] featureDeltas, float[] featureWeights) {
        this.windowWidth = windowWidth;
        this.windowHeight = windowHeight;
        this.width = width;
        this.stageThresholds = stageThresholds;
        this.stageTreeCounts = stageTreeCounts;
        this.treeTilted = treeTilted;
        this.treeFeatureCounts = treeFeatureCounts;
        this.treeValues = treeValues;
        this.featureOffsets = featureOffsets;
        this.featureDeltas = featureDeltas;
        this.featureWeights = featureWeights;

        boolean anyTilted = false;
        for(boolean b : treeTilted){
            anyTilted |= b;
        }
        this.tilted = anyTilted;
    }

    public int getWindowWidth() { return windowWidth; }

    public int getWindowHeight() { return windowHeight; }

    /**
     * The image width this classifier was compiled for. The integral tables
     * it reads must have a row stride of {@code getWidth()+1}.
     */
    public int getWidth() { return width; }

    public int getStride() { return width + 1; }

    public boolean isTilted() { return tilted; }

    public int getStageCount() { return stageThresholds.length; }

    public int getTreeCount() { return treeTilted.length; }

    public int getFeatureCount() { return featureOffsets.length; }

    /**
     * Run all stages on the window whose top left integral table cell is {@code index}.
     *
     * @param sat the summed area table.
     * @param rsat the rotated summed area table; only read by tilted trees.
     * @param index offset of the window's top left corner in the tables.
     * @param std the window's normalization factor, at least 1.
     * @return {@code true} if every stage passed; evaluation stops at the first
     * stage whose sum is below its threshold.
     */
    public boolean accepts(int[] sat, int[] rsat, int index, double std){
        int tree = 0;
        int feature = 0;
        for(int stage = 0; stage < stageThresholds.length; stage++){
            double stageSum = 0;
            for(int treeEnd = tree + stageTreeCounts[stage]; tree < treeEnd; tree++){
                int[] table = treeTilted[tree] ? rsat : sat;
                double treeSum = 0;
                for(int featureEnd = feature + treeFeatureCounts[tree]; feature < featureEnd; feature++){
                    int f1 = index + featureOffsets[feature];
                    int packed = featureDeltas[feature];
                    int f2 = f1 + (packed & 0xffff);
                    int f3 = f1 + (packed >>> 16);
                    treeSum += (double) featureWeights[feature]
                            * (table[f1] - table[f2] - table[f3] + table[f2 + f3 - f1]);
                }
                stageSum += treeValues[2 * tree + (treeSum > std ? 1 : 0)];
            }
            if(stageSum < stageThresholds[stage]){
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompiledClassifier)) return false;
        CompiledClassifier that = (CompiledClassifier) o;
        return windowWidth == that.windowWidth && windowHeight == that.windowHeight && width == that.width
                && Arrays.equals(stageThresholds, that.stageThresholds)
                && Arrays.equals(stageTreeCounts, that.stageTreeCounts)
                && Arrays.equals(treeTilted, that.treeTilted)
                && Arrays.equals(treeFeatureCounts, that.treeFeatureCounts)
                && Arrays.equals(treeValues, that.treeValues)
                && Arrays.equals(featureOffsets, that.featureOffsets)
                && Arrays.equals(featureDeltas, that.featureDeltas)
                && Arrays.equals(featureWeights, that.featureWeights);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(windowWidth, windowHeight, width);
        result = 31 * result + Arrays.hashCode(featureOffsets);
        result = 31 * result + Arrays.hashCode(featureDeltas);
        result = 31 * result + Arrays.hashCode(featureWeights);
        return result;
    }

    @Override
    public String toString() {
        return "CompiledClassifier{" + windowWidth + "x" + windowHeight + " for width " + width
                + ", stages=" + getStageCount() + ", trees=" + getTreeCount() + ", features=" + getFeatureCount() + "}";
    }

    // layout accessors for tests in this package
    int featureOffset(int i){ return featureOffsets[i]; }
    int featureDelta(int i){ return featureDeltas[i]; }
    float featureWeight(int i){ return featureWeights[i]; }
    float treeValue(int i){ return treeValues[i]; }
}
