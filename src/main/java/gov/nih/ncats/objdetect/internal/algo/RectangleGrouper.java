package gov.nih.ncats.objdetect.internal.algo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import gov.nih.ncats.objdetect.Detection;

/**
 * Merges overlapping raw detections into one representative detection per object.
 *
 * <ol>
 *     <li>Rectangles are labeled in input order: a rectangle joins the class of the first
 *     earlier rectangle whose four edges are all within
 *     {@code confluence * (min(w1,w2) + min(h1,h2))} of its own, otherwise it opens a new class.
 *     This is a single greedy pass; classes are never merged afterwards.</li>
 *     <li>Each class with at least {@code minNeighbors} members becomes its mean rectangle,
 *     with the member count as neighbor count.</li>
 *     <li>Groups lying inside another group, within a tolerance of {@code confluence} times the
 *     size of the later group of the pair, are dropped. A group is dropped if any later group
 *     contains it, whether or not that later group survives itself.</li>
 * </ol>
 * The result is sorted by descending neighbor count.
 */
public final class RectangleGrouper {

    public static final double DEFAULT_CONFLUENCE = 0.25;

    private RectangleGrouper(){
        //can not instantiate
    }

    public static List<Detection> group(List<Detection> rects, int minNeighbors){
        return group(rects, minNeighbors, DEFAULT_CONFLUENCE);
    }

    public static List<Detection> group(List<Detection> rects, int minNeighbors, double confluence){
        Objects.requireNonNull(rects, "rectangles can not be null");
        if(!(confluence > 0)){
            throw new IllegalArgumentException("confluence must be > 0 but was " + confluence);
        }
        int n = rects.size();

        int numClasses = 0;
        int[] labels = new int[n];
        for(int i = 0; i < n; ++i){
            Detection r1 = rects.get(i);
            boolean found = false;
            for(int j = 0; j < i; ++j){
                Detection r2 = rects.get(j);
                if(similar(r1, r2, confluence)){
                    labels[i] = labels[j];
                    found = true;
                    break;
                }
            }
            if(!found){
                labels[i] = numClasses++;
            }
        }

        double[][] sums = new double[numClasses][4];
        int[] counts = new int[numClasses];
        for(int i = 0; i < n; ++i){
            Detection r = rects.get(i);
            double[] sum = sums[labels[i]];
            sum[0] += r.getX();
            sum[1] += r.getY();
            sum[2] += r.getWidth();
            sum[3] += r.getHeight();
            counts[labels[i]]++;
        }

        List<Detection> groups = new ArrayList<>(numClasses);
        for(int c = 0; c < numClasses; ++c){
            int count = counts[c];
            if(count >= minNeighbors){
                double[] sum = sums[c];
                groups.add(new Detection(sum[0] / count, sum[1] / count, sum[2] / count, sum[3] / count, count));
            }
        }

        int numGroups = groups.size();
        boolean[] dropped = new boolean[numGroups];
        for(int i = 0; i < numGroups; ++i){
            if(dropped[i]){
                continue;
            }
            Detection r1 = groups.get(i);
            //later groups count even when already dropped
            for(int j = i + 1; j < numGroups; ++j){
                Detection r2 = groups.get(j);
                double dx = r2.getWidth() * confluence;
                double dy = r2.getHeight() * confluence;
                if(inside(r1, r2, dx, dy)){
                    dropped[i] = true;
                    break;
                }
                if(inside(r2, r1, dx, dy)){
                    dropped[j] = true;
                }
            }
        }

        List<Detection> filtered = new ArrayList<>(numGroups);
        for(int i = 0; i < numGroups; ++i){
            if(!dropped[i]){
                filtered.add(groups.get(i));
            }
        }
        filtered.sort(Detection.BY_NEIGHBORS_DESCENDING);
        return filtered;
    }

    private static boolean similar(Detection r1, Detection r2, double confluence){
        double delta = confluence * (Math.min(r1.getWidth(), r2.getWidth()) + Math.min(r1.getHeight(), r2.getHeight()));
        return Math.abs(r1.getX() - r2.getX()) <= delta
                && Math.abs(r1.getY() - r2.getY()) <= delta
                && Math.abs(r1.getX() + r1.getWidth() - r2.getX() - r2.getWidth()) <= delta
                && Math.abs(r1.getY() + r1.getHeight() - r2.getY() - r2.getHeight()) <= delta;
    }

    /**
     * Is {@code inner} inside {@code outer} widened by {@code dx, dy} on every side.
     * Not antisymmetric, so callers check both orders.
     */
    private static boolean inside(Detection inner, Detection outer, double dx, double dy){
        return inner.getX() >= outer.getX() - dx
                && inner.getY() >= outer.getY() - dy
                && inner.getX() + inner.getWidth() <= outer.getX() + outer.getWidth() + dx
                && inner.getY() + inner.getHeight() <= outer.getY() + outer.getHeight() + dy;
    }
}
