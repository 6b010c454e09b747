package gov.nih.ncats.objdetect;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import gov.nih.ncats.objdetect.cascade.Cascade;
import gov.nih.ncats.objdetect.cascade.CascadeCompiler;
import gov.nih.ncats.objdetect.cascade.CompiledClassifier;
import gov.nih.ncats.objdetect.image.EdgeDensity;
import gov.nih.ncats.objdetect.internal.algo.CascadeEvaluator;
import gov.nih.ncats.objdetect.internal.algo.RectangleGrouper;

/**
 * Entry point for detecting objects with a Viola-Jones stump cascade.
 *
 * The four building blocks ({@link #compile(Cascade, int)}, {@link #buildTables(int[], int, int)},
 * {@link #evaluate(IntegralTables, int, CompiledClassifier)} and {@link #group(List, int)})
 * can be used on their own; {@code detectMultiScale} chains them over an image pyramid.
 * Callers that process many frames of the same size should keep an {@link ObjectDetector}
 * instead, which compiles the cascade once and reuses its buffers.
 */
public final class ObjectDetect {

    private static final ObjectDetectOptions DEFAULT_OPTIONS = new ObjectDetectOptions();

    private ObjectDetect(){
        //can not instantiate
    }

    /**
     * Compile a cascade for images of the given width.
     * @see CascadeCompiler#compile(Cascade, int)
     */
    public static CompiledClassifier compile(Cascade cascade, int width){
        return CascadeCompiler.compile(cascade, width);
    }

    /**
     * Build the summed area, squared summed area and rotated tables of a gray image.
     */
    public static IntegralTables buildTables(int[] gray, int width, int height){
        return IntegralTables.compute(gray, width, height, true, false);
    }

    /**
     * Build the integral tables of a gray image.
     * @param gray gray values in [0,255], row major.
     * @param width image width.
     * @param height image height.
     * @param rotated also build the rotated table, needed by cascades with tilted features.
     * @param edges also build the edge magnitude table, needed for edge pre-rejection.
     * @return the tables.
     * @throws DimensionMismatchException if the image is shorter than {@code width*height}.
     */
    public static IntegralTables buildTables(int[] gray, int width, int height, boolean rotated, boolean edges){
        return IntegralTables.compute(gray, width, height, rotated, edges);
    }

    /**
     * Run a compiled classifier on every window position of one image, using the default
     * edge density band if the tables include an edge table.
     * @return the accepted windows, each with a neighbor count of 1.
     */
    public static List<Detection> evaluate(IntegralTables tables, int step, CompiledClassifier classifier){
        return CascadeEvaluator.detect(tables, step, classifier, EdgeDensity.DEFAULT_MIN_DENSITY, EdgeDensity.DEFAULT_MAX_DENSITY);
    }

    public static List<Detection> evaluate(IntegralTables tables, int step, CompiledClassifier classifier,
                                           double minEdgeDensity, double maxEdgeDensity){
        return CascadeEvaluator.detect(tables, step, classifier, minEdgeDensity, maxEdgeDensity);
    }

    /**
     * Merge overlapping detections using the default confluence of
     * {@value RectangleGrouper#DEFAULT_CONFLUENCE}.
     */
    public static List<Detection> group(List<Detection> rects, int minNeighbors){
        return RectangleGrouper.group(rects, minNeighbors);
    }

    /**
     * Merge overlapping detections.
     * @param rects the raw detections.
     * @param minNeighbors groups with fewer members are dropped.
     * @param confluence how close, relative to their size, two detections must be to be merged.
     * @return the groups sorted by descending neighbor count.
     */
    public static List<Detection> group(List<Detection> rects, int minNeighbors, double confluence){
        return RectangleGrouper.group(rects, minNeighbors, confluence);
    }

    /**
     * Detect objects at every scale of an RGBA image.
     * @param rgba 4 bytes per pixel, row major.
     * @param width image width.
     * @param height image height.
     * @param cascade the cascade to run; can not be null.
     * @param options the options to use; if null the defaults are used.
     * @return the detections sorted by descending neighbor count.
     * @throws NullPointerException if image or cascade is null.
     * @throws DimensionMismatchException if the buffer does not match the dimensions
     * or the image is smaller than the cascade window.
     */
    public static List<Detection> detectMultiScale(byte[] rgba, int width, int height, Cascade cascade, ObjectDetectOptions options){
        checkNotNull(rgba);
        options = Optional.ofNullable(options).orElse(DEFAULT_OPTIONS);
        return new ObjectDetector(width, height, cascade, options).detectRgba(rgba);
    }

    public static List<Detection> detectMultiScale(byte[] rgba, int width, int height, Cascade cascade){
        return detectMultiScale(rgba, width, height, cascade, DEFAULT_OPTIONS);
    }

    /**
     * Detect objects at every scale of a {@link BufferedImage}.
     * @param image the image; can not be null.
     * @param cascade the cascade to run; can not be null.
     * @param options the options to use; if null the defaults are used.
     * @return the detections in image coordinates, sorted by descending neighbor count.
     */
    public static List<Detection> detectMultiScale(BufferedImage image, Cascade cascade, ObjectDetectOptions options){
        checkNotNull(image);
        options = Optional.ofNullable(options).orElse(DEFAULT_OPTIONS);
        return new ObjectDetector(image.getWidth(), image.getHeight(), cascade, options).detect(image);
    }

    public static List<Detection> detectMultiScale(BufferedImage image, Cascade cascade){
        return detectMultiScale(image, cascade, DEFAULT_OPTIONS);
    }

    /**
     * Run {@link #detectMultiScale(byte[], int, int, Cascade, ObjectDetectOptions)} on the common pool.
     * Any failure completes the returned future exceptionally.
     */
    public static CompletableFuture<List<Detection>> detectMultiScaleAsync(byte[] rgba, int width, int height,
                                                                          Cascade cascade, ObjectDetectOptions options){
        return CompletableFuture.supplyAsync(() -> detectMultiScale(rgba, width, height, cascade, options));
    }

    public static CompletableFuture<List<Detection>> detectMultiScaleAsync(byte[] rgba, int width, int height,
                                                                          Cascade cascade, ObjectDetectOptions options,
                                                                          Executor executor){
        return CompletableFuture.supplyAsync(() -> detectMultiScale(rgba, width, height, cascade, options), executor);
    }

    public static CompletableFuture<List<Detection>> detectMultiScaleAsync(BufferedImage image, Cascade cascade,
                                                                          ObjectDetectOptions options){
        return CompletableFuture.supplyAsync(() -> detectMultiScale(image, cascade, options));
    }

    public static CompletableFuture<List<Detection>> detectMultiScaleAsync(BufferedImage image, Cascade cascade,
                                                                          ObjectDetectOptions options, Executor executor){
        return CompletableFuture.supplyAsync(() -> detectMultiScale(image, cascade, options), executor);
    }

    private static void checkNotNull(Object obj){
        Objects.requireNonNull(obj, "image can not be null");
    }
}
