package gov.nih.ncats.objdetect.image;

import gov.nih.ncats.objdetect.DimensionMismatchException;

/**
 * Converts interleaved RGBA samples into a single channel luma image.
 * Uses the fixed point version of the ITU-R 601 weights (0.299, 0.587, 0.114)
 * scaled by 2^14, so white stays 255 and black stays 0.
 * The alpha channel is ignored.
 */
public final class Grayscale {

    private static final int R_WEIGHT = 4899;
    private static final int G_WEIGHT = 9617;
    private static final int B_WEIGHT = 1868;
    private static final int ROUNDING = 1 << 13;
    private static final int SHIFT = 14;

    private Grayscale(){
        //can not instantiate
    }

    /**
     * Convert RGBA samples to gray.
     * @param rgba 4 unsigned bytes per pixel, row major.
     * @param width the image width.
     * @param height the image height.
     * @param dst destination to reuse; if null or shorter than {@code width*height}
     *            a new array is allocated.
     * @return the destination holding {@code width*height} gray values in [0,255].
     * @throws DimensionMismatchException if rgba is shorter than {@code 4*width*height}.
     */
    public static int[] fromRgba(byte[] rgba, int width, int height, int[] dst){
        DimensionMismatchException.checkBuffer("rgba image", rgba.length / 4, width, height);
        int n = width * height;
        if(dst == null || dst.length < n){
            dst = new int[n];
        }
        for(int i=0, j=0; i< n; i++, j+=4){
            dst[i] = ((rgba[j] & 0xff) * R_WEIGHT
                    + (rgba[j+1] & 0xff) * G_WEIGHT
                    + (rgba[j+2] & 0xff) * B_WEIGHT
                    + ROUNDING) >> SHIFT;
        }
        return dst;
    }

    /**
     * Convert packed {@code 0xAARRGGBB} pixels, as returned by
     * {@link java.awt.image.BufferedImage#getRGB(int, int, int, int, int[], int, int)}, to gray.
     * Produces the same values as {@link #fromRgba(byte[], int, int, int[])}.
     */
    public static int[] fromArgb(int[] argb, int width, int height, int[] dst){
        DimensionMismatchException.checkBuffer("argb image", argb.length, width, height);
        int n = width * height;
        if(dst == null || dst.length < n){
            dst = new int[n];
        }
        for(int i=0; i< n; i++){
            int p = argb[i];
            dst[i] = (((p >> 16) & 0xff) * R_WEIGHT
                    + ((p >> 8) & 0xff) * G_WEIGHT
                    + (p & 0xff) * B_WEIGHT
                    + ROUNDING) >> SHIFT;
        }
        return dst;
    }
}
