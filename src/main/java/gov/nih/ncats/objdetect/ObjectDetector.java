package gov.nih.ncats.objdetect;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

import gov.nih.ncats.objdetect.cascade.Cascade;
import gov.nih.ncats.objdetect.cascade.CascadeCompiler;
import gov.nih.ncats.objdetect.cascade.CompiledClassifier;
import gov.nih.ncats.objdetect.image.EdgeDensity;
import gov.nih.ncats.objdetect.image.Grayscale;
import gov.nih.ncats.objdetect.image.HistogramEqualizer;
import gov.nih.ncats.objdetect.image.ImageCanvas;
import gov.nih.ncats.objdetect.image.ImageResampler;
import gov.nih.ncats.objdetect.image.IntegralImage;
import gov.nih.ncats.objdetect.internal.algo.CascadeEvaluator;
import gov.nih.ncats.objdetect.internal.algo.RectangleGrouper;
import gov.nih.ncats.objdetect.internal.util.ScratchBuffer;

/**
 * Multi-scale detector for images of one fixed size.
 *
 * The cascade is compiled once per level of the image pyramid when the detector
 * is created; every {@code detect} call then converts the frame to gray, builds
 * the integral tables of each level in buffers owned by the detector, runs the
 * cascade on every level and merges the results.
 *
 * Instances are not thread safe: a detector reuses its buffers from frame to frame,
 * so concurrent calls on the same instance need external synchronization.
 * Use one detector per thread instead.
 */
public class ObjectDetector {
    private static final Logger logger = Logger.getLogger(ObjectDetector.class.getName());

    private final int width, height;
    private final Cascade cascade;
    private final ObjectDetectOptions options;
    private final boolean tilted;
    private final List<ScaleLevel> levels;

    private final ScratchBuffer gray = new ScratchBuffer();
    private final ScratchBuffer equalized = new ScratchBuffer();
    private final ScratchBuffer argb = new ScratchBuffer();
    private ImageCanvas canvas;

    public ObjectDetector(int width, int height, Cascade cascade){
        this(width, height, cascade, null);
    }

    /**
     * Create a new detector.
     * @param width the width of the frames this detector will be given.
     * @param height the height of the frames this detector will be given.
     * @param cascade the cascade to run; can not be null.
     * @param options the options to use, or null for the defaults. The options are copied,
     *                later changes to them have no effect on this detector.
     * @throws DimensionMismatchException if the frame is smaller than the cascade window.
     */
    public ObjectDetector(int width, int height, Cascade cascade, ObjectDetectOptions options){
        this.cascade = Objects.requireNonNull(cascade, "cascade can not be null");
        this.options = options == null ? new ObjectDetectOptions() : new ObjectDetectOptions(options);
        if(width <= 0 || height <= 0){
            throw new DimensionMismatchException("image dimensions must be positive but were " + width + "x" + height);
        }
        if(width < cascade.getWindowWidth() || height < cascade.getWindowHeight()){
            throw new DimensionMismatchException("image " + width + "x" + height + " is smaller than the "
                    + cascade.getWindowWidth() + "x" + cascade.getWindowHeight() + " window");
        }
        this.width = width;
        this.height = height;
        this.tilted = cascade.hasTiltedFeatures();

        int numScales = computeNumScales(width, height, cascade, this.options.getScaleFactor());
        List<ScaleLevel> list = new ArrayList<>(numScales);
        double scale = 1;
        for(int i = 0; i < numScales; i++){
            list.add(new ScaleLevel(scale));
            scale *= this.options.getScaleFactor();
        }
        this.levels = Collections.unmodifiableList(list);

        if(logger.isLoggable(Level.FINE)){
            logger.fine("created " + width + "x" + height + " detector with " + numScales + " scales for " + cascade
                    + " using " + this.options);
        }
    }

    /**
     * Number of pyramid levels, {@code floor(log(min(W/winW, H/winH)) / log(scaleFactor))}
     * but always at least 1 so a frame that barely fits the window is still searched at its own size.
     */
    static int computeNumScales(int width, int height, Cascade cascade, double scaleFactor){
        double ratio = Math.min(width / (double) cascade.getWindowWidth(), height / (double) cascade.getWindowHeight());
        int n = (int) Math.floor(Math.log(ratio) / Math.log(scaleFactor));
        return Math.max(1, n);
    }

    public int getWidth() { return width; }

    public int getHeight() { return height; }

    public Cascade getCascade() { return cascade; }

    public int getNumScales(){
        return levels.size();
    }

    /**
     * The scale factor of each pyramid level, starting with 1.
     */
    public double[] getScales(){
        double[] scales = new double[levels.size()];
        for(int i = 0; i < scales.length; i++){
            scales[i] = levels.get(i).scale;
        }
        return scales;
    }

    /**
     * Detect objects in a frame of interleaved RGBA samples.
     * @param rgba 4 bytes per pixel, row major, at least {@code 4*width*height} long.
     * @return the detections sorted by descending neighbor count.
     * @throws DimensionMismatchException if the buffer is too short.
     */
    public List<Detection> detectRgba(byte[] rgba){
        Objects.requireNonNull(rgba, "image can not be null");
        int[] base = Grayscale.fromRgba(rgba, width, height, gray.ensureCapacity(width * height));
        return detectGray(base);
    }

    /**
     * Detect objects in a gray image. The image is only read.
     * @param grayImage gray values in [0,255], row major, at least {@code width*height} long.
     * @return the detections sorted by descending neighbor count.
     * @throws DimensionMismatchException if the buffer is too short.
     */
    public List<Detection> detect(int[] grayImage){
        Objects.requireNonNull(grayImage, "image can not be null");
        DimensionMismatchException.checkBuffer("gray image", grayImage.length, width, height);
        return detectGray(grayImage);
    }

    /**
     * Detect objects in an image of any size. The image is stretched to this detector's size
     * and the detections are mapped back to the image's coordinates.
     */
    public List<Detection> detect(BufferedImage image){
        return detect(image, null);
    }

    /**
     * Detect objects in a region of an image of any size. The region is scaled to fit this
     * detector's frame keeping its aspect ratio and centered on a black background.
     * @param image the image; can not be null.
     * @param roi the region to search, or null for the whole image.
     * @return the detections in the coordinates of {@code image}, sorted by descending neighbor count.
     * @throws IllegalArgumentException if the region is empty or not inside the image.
     */
    public List<Detection> detect(BufferedImage image, Rectangle roi){
        Objects.requireNonNull(image, "image can not be null");
        if(canvas == null){
            canvas = new ImageCanvas(width, height);
        }
        ImageCanvas.Placement placement = canvas.draw(image, roi);
        int[] pixels = canvas.getArgb(argb.ensureCapacity(width * height));
        int[] base = Grayscale.fromArgb(pixels, width, height, gray.ensureCapacity(width * height));

        List<Detection> found = detectGray(base);
        List<Detection> mapped = new ArrayList<>(found.size());
        for(Detection d : found){
            mapped.add(new Detection(placement.toSourceX(d.getX()), placement.toSourceY(d.getY()),
                    placement.toSourceWidth(d.getWidth()), placement.toSourceHeight(d.getHeight()),
                    d.getNeighbors()));
        }
        return mapped;
    }

    private List<Detection> detectGray(int[] base){
        if(options.isEqualizeHistogram()){
            base = HistogramEqualizer.equalize(base, width, height, equalized.ensureCapacity(width * height));
        }

        List<Detection> rects;
        if(options.isParallel() && levels.size() > 1){
            rects = detectParallel(base);
        }else{
            rects = new ArrayList<>();
            for(ScaleLevel level : levels){
                rects.addAll(level.detect(base));
            }
        }

        if(options.isGrouping()){
            List<Detection> groups = RectangleGrouper.group(rects, options.getMinNeighbors(), options.getConfluence());
            logger.finer(() -> "grouped " + rects.size() + " raw detections into " + groups.size());
            return groups;
        }
        rects.sort(Detection.BY_NEIGHBORS_DESCENDING);
        return rects;
    }

    private List<Detection> detectParallel(int[] base){
        List<CompletableFuture<List<Detection>>> futures = new ArrayList<>(levels.size());
        for(ScaleLevel level : levels){
            futures.add(CompletableFuture.supplyAsync(() -> level.detect(base), options.getExecutor()));
        }
        List<Detection> rects = new ArrayList<>();
        for(CompletableFuture<List<Detection>> future : futures){
            try{
                rects.addAll(future.join());
            }catch(CompletionException e){
                Throwable cause = e.getCause();
                if(cause instanceof RuntimeException){
                    throw (RuntimeException) cause;
                }
                if(cause instanceof Error){
                    throw (Error) cause;
                }
                throw e;
            }
        }
        return rects;
    }

    @Override
    public String toString() {
        return "ObjectDetector{" + width + "x" + height + ", scales=" + levels.size() + ", tilted=" + tilted + "}";
    }

    /**
     * One level of the pyramid: its compiled classifier and the buffers its tables are built in.
     */
    private final class ScaleLevel{
        private final double scale;
        private final int scaledWidth, scaledHeight;
        private final CompiledClassifier classifier;

        private final ScratchBuffer scaled = new ScratchBuffer();
        private final ScratchBuffer sat = new ScratchBuffer();
        private final ScratchBuffer ssat = new ScratchBuffer();
        private final ScratchBuffer rsat = new ScratchBuffer();
        private final ScratchBuffer edges = new ScratchBuffer();
        private final ScratchBuffer edgeHorizontal = new ScratchBuffer();
        private final ScratchBuffer edgeSmoothed = new ScratchBuffer();
        private final ScratchBuffer edgeSat = new ScratchBuffer();

        ScaleLevel(double scale){
            this.scale = scale;
            if(scale == 1){
                scaledWidth = width;
                scaledHeight = height;
            }else{
                scaledWidth = ImageResampler.scaledLength(width, scale);
                scaledHeight = ImageResampler.scaledLength(height, scale);
            }
            this.classifier = CascadeCompiler.compile(cascade, scaledWidth);
        }

        List<Detection> detect(int[] base){
            int[] image;
            if(scale == 1){
                image = base;
            }else{
                image = ImageResampler.rescale(base, width, height, scale,
                        scaled.ensureCapacity(scaledWidth * scaledHeight));
            }
            int tableLength = IntegralImage.tableLength(scaledWidth, scaledHeight);
            int[] satTable = IntegralImage.sat(image, scaledWidth, scaledHeight, sat.ensureCapacity(tableLength));
            int[] ssatTable = IntegralImage.squaredSat(image, scaledWidth, scaledHeight, ssat.ensureCapacity(tableLength));
            int[] rsatTable = null;
            if(tilted){
                rsatTable = IntegralImage.rotatedSat(image, scaledWidth, scaledHeight, rsat.ensureCapacity(tableLength));
            }
            int[] edgeTable = null;
            if(options.isUseEdgeFilter()){
                int area = scaledWidth * scaledHeight;
                int[] magnitude = EdgeDensity.gradientMagnitude(image, scaledWidth, scaledHeight,
                        edges.ensureCapacity(area), edgeHorizontal.ensureCapacity(area), edgeSmoothed.ensureCapacity(area));
                edgeTable = IntegralImage.sat(magnitude, scaledWidth, scaledHeight, edgeSat.ensureCapacity(tableLength));
            }
            IntegralTables tables = new IntegralTables(scaledWidth, scaledHeight, satTable, ssatTable, rsatTable, edgeTable);

            List<Detection> found = CascadeEvaluator.detect(tables, options.getStep(), classifier,
                    options.getEdgeDensityMin(), options.getEdgeDensityMax());
            logger.finer(() -> "scale " + scale + " (" + scaledWidth + "x" + scaledHeight + "): " + found.size() + " windows accepted");

            if(scale == 1){
                return found;
            }
            List<Detection> rescaled = new ArrayList<>(found.size());
            for(Detection d : found){
                rescaled.add(d.scale(scale));
            }
            return rescaled;
        }

        int reallocations(){
            return scaled.getReallocations() + sat.getReallocations() + ssat.getReallocations()
                    + rsat.getReallocations() + edges.getReallocations() + edgeHorizontal.getReallocations()
                    + edgeSmoothed.getReallocations() + edgeSat.getReallocations();
        }
    }

    /**
     * Total number of times any buffer of this detector had to grow.
     * Stays constant once the first frame has been processed.
     */
    int getBufferReallocations(){
        int total = gray.getReallocations() + equalized.getReallocations() + argb.getReallocations();
        for(ScaleLevel level : levels){
            total += level.reallocations();
        }
        return total;
    }
}
