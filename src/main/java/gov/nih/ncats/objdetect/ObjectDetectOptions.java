package gov.nih.ncats.objdetect;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import gov.nih.ncats.objdetect.image.EdgeDensity;
import gov.nih.ncats.objdetect.internal.algo.RectangleGrouper;

/**
 * Settings for multi-scale detection. All setters return {@code this}
 * so calls can be chained; invalid values are rejected immediately.
 *
 * <pre>
 * new ObjectDetectOptions().setScaleFactor(1.1)
 *                          .setMinNeighbors(3)
 *                          .setUseEdgeFilter(true);
 * </pre>
 */
public class ObjectDetectOptions {

    public static final double DEFAULT_SCALE_FACTOR = 1.2;
    public static final int DEFAULT_STEP = 1;
    public static final int DEFAULT_MIN_NEIGHBORS = 1;

    private double scaleFactor = DEFAULT_SCALE_FACTOR;
    private int step = DEFAULT_STEP;
    private int minNeighbors = DEFAULT_MIN_NEIGHBORS;
    private double confluence = RectangleGrouper.DEFAULT_CONFLUENCE;

    private boolean useEdgeFilter;
    private double edgeDensityMin = EdgeDensity.DEFAULT_MIN_DENSITY;
    private double edgeDensityMax = EdgeDensity.DEFAULT_MAX_DENSITY;

    private boolean equalizeHistogram;

    private boolean parallel;
    private Executor executor;

    public ObjectDetectOptions(){
    }

    public ObjectDetectOptions(ObjectDetectOptions copy){
        this.scaleFactor = copy.scaleFactor;
        this.step = copy.step;
        this.minNeighbors = copy.minNeighbors;
        this.confluence = copy.confluence;
        this.useEdgeFilter = copy.useEdgeFilter;
        this.edgeDensityMin = copy.edgeDensityMin;
        this.edgeDensityMax = copy.edgeDensityMax;
        this.equalizeHistogram = copy.equalizeHistogram;
        this.parallel = copy.parallel;
        this.executor = copy.executor;
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    /**
     * Ratio between two consecutive levels of the image pyramid.
     * @param scaleFactor must be greater than 1.
     */
    public ObjectDetectOptions setScaleFactor(double scaleFactor) {
        if(!(scaleFactor > 1)){
            throw new IllegalArgumentException("scale factor must be > 1 but was " + scaleFactor);
        }
        this.scaleFactor = scaleFactor;
        return this;
    }

    public int getStep() {
        return step;
    }

    /**
     * Distance in pixels between two evaluated windows; larger is faster but may miss objects.
     * @param step must be at least 1.
     */
    public ObjectDetectOptions setStep(int step) {
        if(step < 1){
            throw new IllegalArgumentException("step must be >= 1 but was " + step);
        }
        this.step = step;
        return this;
    }

    public int getMinNeighbors() {
        return minNeighbors;
    }

    /**
     * Minimum number of raw detections a group needs to be reported.
     * 0 turns grouping off and returns the raw detections.
     */
    public ObjectDetectOptions setMinNeighbors(int minNeighbors) {
        if(minNeighbors < 0){
            throw new IllegalArgumentException("min neighbors must be >= 0 but was " + minNeighbors);
        }
        this.minNeighbors = minNeighbors;
        return this;
    }

    public boolean isGrouping(){
        return minNeighbors > 0;
    }

    /**
     * Turn grouping on (with at least 1 neighbor) or off.
     */
    public ObjectDetectOptions setGrouping(boolean group){
        if(!group){
            minNeighbors = 0;
        }else if(minNeighbors == 0){
            minNeighbors = DEFAULT_MIN_NEIGHBORS;
        }
        return this;
    }

    public double getConfluence() {
        return confluence;
    }

    /**
     * Tolerance factor, relative to rectangle size, for two detections to be
     * considered the same object.
     * @param confluence must be positive.
     */
    public ObjectDetectOptions setConfluence(double confluence) {
        if(!(confluence > 0)){
            throw new IllegalArgumentException("confluence must be > 0 but was " + confluence);
        }
        this.confluence = confluence;
        return this;
    }

    public boolean isUseEdgeFilter() {
        return useEdgeFilter;
    }

    /**
     * Skip windows whose mean gradient magnitude is outside
     * [{@link #getEdgeDensityMin()}, {@link #getEdgeDensityMax()}] before running the cascade.
     */
    public ObjectDetectOptions setUseEdgeFilter(boolean useEdgeFilter) {
        this.useEdgeFilter = useEdgeFilter;
        return this;
    }

    public double getEdgeDensityMin() {
        return edgeDensityMin;
    }

    public double getEdgeDensityMax() {
        return edgeDensityMax;
    }

    public ObjectDetectOptions setEdgeDensityRange(double min, double max) {
        if(!(min <= max)){
            throw new IllegalArgumentException("edge density range is empty: [" + min + ", " + max + "]");
        }
        this.edgeDensityMin = min;
        this.edgeDensityMax = max;
        return this;
    }

    public boolean isEqualizeHistogram() {
        return equalizeHistogram;
    }

    /**
     * Equalize the gray image before building the pyramid.
     */
    public ObjectDetectOptions setEqualizeHistogram(boolean equalizeHistogram) {
        this.equalizeHistogram = equalizeHistogram;
        return this;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Evaluate the pyramid levels concurrently. Results are the same as sequential detection.
     */
    public ObjectDetectOptions setParallel(boolean parallel) {
        this.parallel = parallel;
        return this;
    }

    /**
     * The executor used for parallel detection; the common fork join pool if none was set.
     */
    public Executor getExecutor() {
        return executor == null ? ForkJoinPool.commonPool() : executor;
    }

    public ObjectDetectOptions setExecutor(Executor executor) {
        this.executor = executor;
        return this;
    }

    @Override
    public String toString() {
        return "ObjectDetectOptions{scaleFactor=" + scaleFactor + ", step=" + step + ", minNeighbors=" + minNeighbors
                + ", confluence=" + confluence + ", useEdgeFilter=" + useEdgeFilter
                + ", edgeDensity=[" + edgeDensityMin + ", " + edgeDensityMax + "], equalizeHistogram=" + equalizeHistogram
                + ", parallel=" + parallel + "}";
    }
}
