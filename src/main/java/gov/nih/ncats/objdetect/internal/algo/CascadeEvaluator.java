package gov.nih.ncats.objdetect.internal.algo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import gov.nih.ncats.objdetect.Detection;
import gov.nih.ncats.objdetect.DimensionMismatchException;
import gov.nih.ncats.objdetect.IntegralTables;
import gov.nih.ncats.objdetect.cascade.CompiledClassifier;
import gov.nih.ncats.objdetect.image.EdgeDensity;

/**
 * Slides the window of a {@link CompiledClassifier} over the integral tables of
 * one image and returns every window that passes all stages.
 *
 * Windows are visited column by column (x outer, y inner). For each window:
 * <ol>
 *     <li>if an edge table is present, windows whose mean gradient magnitude is outside
 *     the accepted band are skipped;</li>
 *     <li>the normalization factor {@code std = sqrt(ssum*area - sum^2)} is computed,
 *     floored at 1 so flat regions are not amplified;</li>
 *     <li>the stages run in order and the first failing stage rejects the window.</li>
 * </ol>
 */
public final class CascadeEvaluator {

    private CascadeEvaluator(){
        //can not instantiate
    }

    public static List<Detection> detect(IntegralTables tables, int step, CompiledClassifier classifier){
        return detect(tables, step, classifier, EdgeDensity.DEFAULT_MIN_DENSITY, EdgeDensity.DEFAULT_MAX_DENSITY);
    }

    /**
     * Evaluate every window position.
     * @param tables the tables of the image; the rotated table must be present if the classifier is tilted.
     * @param step distance between window positions, at least 1.
     * @param classifier a classifier compiled for {@code tables.getWidth()}.
     * @param minEdgeDensity lower bound of the edge band, only used if the tables have an edge table.
     * @param maxEdgeDensity upper bound of the edge band, only used if the tables have an edge table.
     * @return the accepted windows in image coordinates, each with a neighbor count of 1.
     * @throws DimensionMismatchException if the classifier was compiled for another width
     * or the window is larger than the image.
     */
    public static List<Detection> detect(IntegralTables tables, int step, CompiledClassifier classifier,
                                         double minEdgeDensity, double maxEdgeDensity){
        Objects.requireNonNull(tables, "tables can not be null");
        Objects.requireNonNull(classifier, "classifier can not be null");
        if(step < 1){
            throw new IllegalArgumentException("step must be >= 1 but was " + step);
        }
        if(classifier.getWidth() != tables.getWidth()){
            throw new DimensionMismatchException("classifier was compiled for width " + classifier.getWidth()
                    + " but the tables are for width " + tables.getWidth());
        }
        final int windowWidth = classifier.getWindowWidth();
        final int windowHeight = classifier.getWindowHeight();
        if(windowWidth > tables.getWidth() || windowHeight > tables.getHeight()){
            throw new DimensionMismatchException("the " + windowWidth + "x" + windowHeight + " window does not fit a "
                    + tables.getWidth() + "x" + tables.getHeight() + " image");
        }
        final int[] sat = tables.getSat();
        final int[] ssat = tables.getSquaredSat();
        final int[] rsat = tables.getRotatedSat().orElse(null);
        final int[] edgeSat = tables.getEdgeSat().orElse(null);
        if(classifier.isTilted() && rsat == null){
            throw new IllegalArgumentException("classifier has tilted features but no rotated table was computed");
        }

        final int width = tables.getWidth() + 1;
        final int height = tables.getHeight() + 1;
        final int windowHeightTimesWidth = windowHeight * width;
        final int area = windowWidth * windowHeight;
        final double inverseArea = 1D / area;
        final int widthTimesStep = width * step;

        List<Detection> rects = new ArrayList<>();
        for(int x = 0; x + windowWidth < width; x += step){
            int satIndex = x;
            for(int y = 0; y + windowHeight < height; y += step, satIndex += widthTimesStep){
                int satIndex1 = satIndex + windowWidth;
                int satIndex2 = satIndex + windowHeightTimesWidth;
                int satIndex3 = satIndex2 + windowWidth;

                if(edgeSat != null){
                    double edgeDensity = (edgeSat[satIndex] - edgeSat[satIndex1] - edgeSat[satIndex2] + edgeSat[satIndex3])
                            * inverseArea;
                    if(edgeDensity < minEdgeDensity || edgeDensity > maxEdgeDensity){
                        continue;
                    }
                }

                double mean = sat[satIndex] - sat[satIndex1] - sat[satIndex2] + sat[satIndex3];
                double variance = (double) (ssat[satIndex] - ssat[satIndex1] - ssat[satIndex2] + ssat[satIndex3]) * area
                        - mean * mean;
                double std = variance > 1 ? Math.sqrt(variance) : 1;

                if(classifier.accepts(sat, rsat, satIndex, std)){
                    rects.add(new Detection(x, y, windowWidth, windowHeight));
                }
            }
        }
        return rects;
    }
}
