package gov.nih.ncats.objdetect.image;

import gov.nih.ncats.objdetect.DimensionMismatchException;

/**
 * Summed area tables of single channel images.
 *
 * All tables are {@code (width+1) x (height+1)}, row major, with a zero first
 * row and first column. Cell {@code (x,y)} of the plain table holds the sum of
 * the source samples in {@code [0,x) x [0,y)}, so any upright rectangle sum is
 * four lookups. The squared table does the same for squared samples (for window
 * variance), the rotated table for 45 degree tilted rectangles.
 *
 * Accumulation is in 32 bit ints. Cells of large images may wrap around, but
 * a four corner query stays exact as long as the true sum of the queried
 * region fits in an int; for 8 bit samples this holds for any region of up
 * to 33025 pixels in the squared table.
 */
public final class IntegralImage {

    private IntegralImage(){
        //can not instantiate
    }

    /**
     * Number of cells of a table for a {@code width x height} image.
     */
    public static int tableLength(int width, int height){
        return (width + 1) * (height + 1);
    }

    /**
     * Compute the summed area table.
     * @param src the source image, row major.
     * @param width the source width.
     * @param height the source height.
     * @param dst destination to reuse; if null or too short a new array is allocated.
     * @return the table.
     */
    public static int[] sat(int[] src, int width, int height, int[] dst){
        return accumulate(src, width, height, dst, false);
    }

    /**
     * Compute the summed area table of the squared samples.
     * @see #sat(int[], int, int, int[])
     */
    public static int[] squaredSat(int[] src, int width, int height, int[] dst){
        return accumulate(src, width, height, dst, true);
    }

    private static int[] accumulate(int[] src, int width, int height, int[] dst, boolean square){
        DimensionMismatchException.checkBuffer("source image", src.length, width, height);
        final int dstWidth = width + 1;
        dst = ensure(dst, tableLength(width, height));

        for(int i = height * dstWidth; i >= 0; i -= dstWidth){
            dst[i] = 0;
        }
        for(int x = 1; x <= width; ++x){
            int columnSum = 0;
            int index = x;
            dst[x] = 0;
            for(int y = 1; y <= height; ++y){
                int v = src[index - y];
                columnSum += square ? v * v : v;
                index += dstWidth;
                dst[index] = dst[index - 1] + columnSum;
            }
        }
        return dst;
    }

    /**
     * Compute the rotated summed area table used by tilted features.
     * A forward pass sums every sample with its up-left diagonal predecessor
     * ({@code dst[x+1,y+1] = src[x,y] + dst[x,y]}), then a backward pass over columns
     * right to left and rows bottom to top adds the two cells above
     * ({@code dst[x,y+1] += dst[x,y] + dst[x+1,y]}).
     *
     * @see #rotatedSum(int[], int, int, int, int, int)
     */
    public static int[] rotatedSat(int[] src, int width, int height, int[] dst){
        DimensionMismatchException.checkBuffer("source image", src.length, width, height);
        final int dstWidth = width + 1;
        final int heightTimesDstWidth = height * dstWidth;
        dst = ensure(dst, tableLength(width, height));

        for(int i = heightTimesDstWidth; i >= 0; i -= dstWidth){
            dst[i] = 0;
        }
        for(int i = 0; i < dstWidth; ++i){
            dst[i] = 0;
        }

        int index = 0;
        for(int y = 0; y < height; ++y){
            for(int x = 0; x < width; ++x){
                dst[index + dstWidth + 1] = src[index - y] + dst[index];
                ++index;
            }
            dst[index + dstWidth] += dst[index];
            index++;
        }

        for(int x = width - 1; x > 0; --x){
            index = x + heightTimesDstWidth;
            for(int y = height; y > 0; --y){
                index -= dstWidth;
                dst[index + dstWidth] += dst[index] + dst[index + 1];
            }
        }
        return dst;
    }

    /**
     * Sum of the upright rectangle {@code [x, x+w) x [y, y+h)}.
     * @param table a table computed by {@link #sat(int[], int, int, int[])} or
     * {@link #squaredSat(int[], int, int, int[])}.
     * @param width the width of the source image (not the table).
     */
    public static int sum(int[] table, int width, int x, int y, int w, int h){
        final int dstWidth = width + 1;
        int i1 = x + y * dstWidth;
        int i2 = i1 + w;
        int i3 = i1 + h * dstWidth;
        return table[i1] - table[i2] - table[i3] + table[i3 + w];
    }

    /**
     * Sum of the 45 degree rotated rectangle whose top corner is {@code (x,y)},
     * extending {@code w} steps down-right and {@code h} steps down-left.
     * The rectangle covers {@code 2*w*h} samples: the pixels {@code (px,py)} with
     * {@code x+y-1 <= px+py <= x+y+2w-2} and {@code x-y-2h <= px-py <= x-y-1}.
     * Requires {@code x-h > 0}.
     *
     * @param rsat a table computed by {@link #rotatedSat(int[], int, int, int[])}.
     * @param width the width of the source image (not the table).
     */
    public static int rotatedSum(int[] rsat, int width, int x, int y, int w, int h){
        final int dstWidth = width + 1;
        int f1 = x + y * dstWidth;
        int f2 = f1 + w * (dstWidth + 1);
        int f3 = f1 + h * (dstWidth - 1);
        return rsat[f1] - rsat[f2] - rsat[f3] + rsat[f2 + f3 - f1];
    }

    /**
     * The un-normalized variance of a window, {@code ssum*area - sum*sum},
     * which equals {@code area^2} times the sample variance. The cascade evaluator
     * uses its square root (at least 1) to normalize feature responses.
     */
    public static double variance(int[] sat, int[] ssat, int width, int x, int y, int w, int h){
        double mean = sum(sat, width, x, y, w, h);
        return (double) sum(ssat, width, x, y, w, h) * (w * h) - mean * mean;
    }

    static int[] ensure(int[] dst, int length){
        if(dst == null || dst.length < length){
            return new int[length];
        }
        return dst;
    }
}
