package gov.nih.ncats.objdetect.image;

import gov.nih.ncats.objdetect.DimensionMismatchException;

/**
 * Spreads the gray levels of an 8 bit image over the full [0,255] range
 * through its cumulative histogram, which makes detection less sensitive
 * to exposure.
 */
public final class HistogramEqualizer {

    private HistogramEqualizer(){
        //can not instantiate
    }

    /**
     * Equalize an image. Each level {@code v} maps to
     * {@code round(255 * (cdf(v) - cdfMin) / (n - cdfMin))} where {@code cdfMin} is the
     * cumulative count of the darkest level present. A single level image is copied unchanged.
     *
     * @param src gray values in [0,255].
     * @param width source width.
     * @param height source height.
     * @param dst destination to reuse, may be src; if null or too short a new array is allocated.
     * @return the destination.
     * @throws IllegalArgumentException if a sample is outside [0,255].
     */
    public static int[] equalize(int[] src, int width, int height, int[] dst){
        DimensionMismatchException.checkBuffer("source image", src.length, width, height);
        int n = width * height;
        dst = IntegralImage.ensure(dst, n);

        int[] histogram = new int[256];
        for(int i = 0; i < n; i++){
            int v = src[i];
            if(v < 0 || v > 255){
                throw new IllegalArgumentException("gray value " + v + " at index " + i + " is outside [0,255]");
            }
            histogram[v]++;
        }
        int cdfMin = 0;
        for(int h : histogram){
            if(h > 0){
                cdfMin = h;
                break;
            }
        }
        if(cdfMin == n){
            System.arraycopy(src, 0, dst, 0, n);
            return dst;
        }
        int[] lut = new int[256];
        int cdf = 0;
        double scale = 255D / (n - cdfMin);
        for(int v = 0; v < 256; v++){
            cdf += histogram[v];
            lut[v] = cdf <= cdfMin ? 0 : (int) Math.round((cdf - cdfMin) * scale);
        }
        for(int i = 0; i < n; i++){
            dst[i] = lut[src[i]];
        }
        return dst;
    }
}
