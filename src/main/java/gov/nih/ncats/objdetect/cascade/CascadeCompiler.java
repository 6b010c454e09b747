package gov.nih.ncats.objdetect.cascade;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import gov.nih.ncats.objdetect.DimensionMismatchException;

/**
 * Compiles a {@link Cascade} into a {@link CompiledClassifier} for images
 * of a given width. The result depends on the width only through the
 * integral table stride ({@code width+1}), so a multi-scale detector compiles
 * the same cascade once per pyramid level.
 */
public final class CascadeCompiler {
    private static final Logger logger = Logger.getLogger(CascadeCompiler.class.getName());

    private static final int MAX_DELTA = 0xffff;

    private CascadeCompiler(){
        //can not instantiate
    }

    /**
     * Compile the given cascade for images of the given width.
     *
     * @param cascade the cascade to compile; can not be null.
     * @param width the width of the images (not of the integral tables) the classifier will be run on.
     * @return a new CompiledClassifier.
     * @throws NullPointerException if cascade is null.
     * @throws DimensionMismatchException if the width is smaller than the cascade window,
     * or if a feature corner is too far from its first corner to be packed into 16 bits.
     */
    public static CompiledClassifier compile(Cascade cascade, int width){
        Objects.requireNonNull(cascade, "cascade can not be null");
        if(width < cascade.getWindowWidth()){
            throw new DimensionMismatchException("image width " + width + " is smaller than the window width " + cascade.getWindowWidth());
        }
        final int stride = width + 1;

        int numStages = cascade.getStages().size();
        int numTrees = cascade.getTreeCount();
        int numFeatures = cascade.getFeatureCount();

        float[] stageThresholds = new float[numStages];
        int[] stageTreeCounts = new int[numStages];
        boolean[] treeTilted = new boolean[numTrees];
        int[] treeFeatureCounts = new int[numTrees];
        float[] treeValues = new float[numTrees * 2];
        int[] featureOffsets = new int[numFeatures];
        int[] featureDeltas = new int[numFeatures];
        float[] featureWeights = new float[numFeatures];

        int t = 0, f = 0;
        for(int s = 0; s < numStages; s++){
            Stage stage = cascade.getStages().get(s);
            stageThresholds[s] = (float) stage.getThreshold();
            stageTreeCounts[s] = stage.getTrees().size();

            for(Tree tree : stage.getTrees()){
                boolean tilted = tree.isTilted();
                treeTilted[t] = tilted;
                treeFeatureCounts[t] = tree.getFeatures().size();

                double inverseThreshold = 1D / (float) tree.getThreshold();
                for(Feature feature : tree.getFeatures()){
                    int delta2, delta3;
                    if(tilted){
                        delta2 = feature.getWidth() * (stride + 1);
                        delta3 = feature.getHeight() * (stride - 1);
                    }else{
                        delta2 = feature.getWidth();
                        delta3 = feature.getHeight() * stride;
                    }
                    if(delta2 > MAX_DELTA || delta3 > MAX_DELTA){
                        throw new DimensionMismatchException(feature + " can not be packed for width " + width
                                + ": corner offsets " + delta2 + " and " + delta3 + " must not exceed " + MAX_DELTA);
                    }
                    featureOffsets[f] = feature.getX() + feature.getY() * stride;
                    featureDeltas[f] = delta2 | (delta3 << 16);
                    featureWeights[f] = (float) ((float) feature.getWeight() * inverseThreshold);
                    f++;
                }
                //a negative threshold flips the comparison, so swap the leaves instead
                if(inverseThreshold < 0){
                    treeValues[2 * t] = (float) tree.getRightValue();
                    treeValues[2 * t + 1] = (float) tree.getLeftValue();
                }else{
                    treeValues[2 * t] = (float) tree.getLeftValue();
                    treeValues[2 * t + 1] = (float) tree.getRightValue();
                }
                t++;
            }
        }
        CompiledClassifier compiled = new CompiledClassifier(cascade.getWindowWidth(), cascade.getWindowHeight(), width,
                stageThresholds, stageTreeCounts,
                treeTilted, treeFeatureCounts, treeValues,
                featureOffsets, featureDeltas, featureWeights);
        if(logger.isLoggable(Level.FINE)){
            logger.fine("compiled " + compiled);
        }
        return compiled;
    }
}
