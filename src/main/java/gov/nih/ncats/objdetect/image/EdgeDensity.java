package gov.nih.ncats.objdetect.image;

import java.util.Arrays;

import gov.nih.ncats.objdetect.DimensionMismatchException;

/**
 * Gradient magnitude image used to skip windows that are too flat or too
 * busy to contain an object before running the cascade (canny pruning).
 * The image is smoothed by a separable 5x5 Gaussian (sigma = sqrt(2)) and the
 * magnitude is the L1 norm of the two 3x3 Sobel responses. A 2 pixel border is left at 0.
 */
public final class EdgeDensity {

    public static final double DEFAULT_MIN_DENSITY = 60;
    public static final double DEFAULT_MAX_DENSITY = 200;

    private static final double K0 = 0.3036, K1 = 0.2365, K2 = 0.1117;

    private EdgeDensity(){
        //can not instantiate
    }

    /**
     * Compute the gradient magnitude image.
     * Intermediate smoothing results are truncated to ints, like the gray values they come from.
     *
     * @param src the source gray image.
     * @param width source width.
     * @param height source height.
     * @param dst destination to reuse, must not be src; if null or too short a new array is allocated.
     * @return the magnitude image.
     */
    public static int[] gradientMagnitude(int[] src, int width, int height, int[] dst){
        return gradientMagnitude(src, width, height, dst, null, null);
    }

    /**
     * Compute the gradient magnitude image using caller owned work buffers, so that
     * repeated frames of the same size do not allocate.
     *
     * @param horizontal work buffer for the horizontal pass; if null or too short a new array is allocated.
     * @param smoothed work buffer for the smoothed image; if null or too short a new array is allocated.
     * @see #gradientMagnitude(int[], int, int, int[])
     * @throws IllegalArgumentException if any two of the buffers are the same array.
     */
    public static int[] gradientMagnitude(int[] src, int width, int height, int[] dst,
                                          int[] horizontal, int[] smoothed){
        DimensionMismatchException.checkBuffer("source image", src.length, width, height);
        int n = width * height;
        dst = IntegralImage.ensure(dst, n);
        horizontal = IntegralImage.ensure(horizontal, n);
        smoothed = IntegralImage.ensure(smoothed, n);
        if(dst == src){
            throw new IllegalArgumentException("destination must not be the source image");
        }
        if(horizontal == src || horizontal == dst || smoothed == src || smoothed == dst || horizontal == smoothed){
            throw new IllegalArgumentException("work buffers must be distinct from each other and from the images");
        }
        //border cells of both passes are read but never written
        Arrays.fill(horizontal, 0, n, 0);
        Arrays.fill(smoothed, 0, n, 0);

        for(int y = 0; y < height; ++y){
            int row = y * width;
            for(int x = 2; x < width - 2; ++x){
                int i = row + x;
                horizontal[i] = (int) (K2 * src[i - 2] + K1 * src[i - 1] + K0 * src[i]
                        + K1 * src[i + 1] + K2 * src[i + 2]);
            }
        }
        for(int y = 2; y < height - 2; ++y){
            int row = y * width;
            for(int x = 0; x < width; ++x){
                int i = row + x;
                smoothed[i] = (int) (K2 * horizontal[i - 2 * width] + K1 * horizontal[i - width] + K0 * horizontal[i]
                        + K1 * horizontal[i + width] + K2 * horizontal[i + 2 * width]);
            }
        }

        Arrays.fill(dst, 0, n, 0);
        for(int y = 2; y < height - 2; ++y){
            int row = y * width;
            for(int x = 2; x < width - 2; ++x){
                int i = row + x;
                int gx = -smoothed[i - 1 - width] + smoothed[i + 1 - width]
                        - 2 * smoothed[i - 1] + 2 * smoothed[i + 1]
                        - smoothed[i - 1 + width] + smoothed[i + 1 + width];
                int gy = smoothed[i - 1 - width] + 2 * smoothed[i - width] + smoothed[i + 1 - width]
                        - smoothed[i - 1 + width] - 2 * smoothed[i + width] - smoothed[i + 1 + width];
                dst[i] = Math.abs(gx) + Math.abs(gy);
            }
        }
        return dst;
    }
}
