package gov.nih.ncats.objdetect.image;

import gov.nih.ncats.objdetect.DimensionMismatchException;

/**
 * Cheap geometric operations on single channel images: nearest sample
 * decimation for building the scale pyramid, and horizontal mirroring.
 */
public final class ImageResampler {

    private ImageResampler(){
        //can not instantiate
    }

    /**
     * Width of an image downscaled by the given factor.
     */
    public static int scaledLength(int length, double factor){
        return (int) (length / factor);
    }

    /**
     * Shrink an image by keeping, for every output pixel {@code (x,y)}, the source
     * pixel {@code (floor(x*factor), floor(y*factor))}. No interpolation is done.
     *
     * @param src the source image.
     * @param width source width.
     * @param height source height.
     * @param factor the scaling down factor, at least 1.
     * @param dst destination to reuse; if null or too short a new array is allocated.
     * @return the destination holding {@code floor(width/factor) x floor(height/factor)} samples.
     */
    public static int[] rescale(int[] src, int width, int height, double factor, int[] dst){
        DimensionMismatchException.checkBuffer("source image", src.length, width, height);
        if(!(factor >= 1)){
            throw new IllegalArgumentException("scale factor must be >= 1 but was " + factor);
        }
        int dstWidth = scaledLength(width, factor);
        int dstHeight = scaledLength(height, factor);
        dst = IntegralImage.ensure(dst, dstWidth * dstHeight);

        int[] columns = new int[dstWidth];
        for(int x = 0; x < dstWidth; ++x){
            columns[x] = (int) (x * factor);
        }
        int dstIndex = 0;
        for(int y = 0; y < dstHeight; ++y){
            int rowOffset = (int) (y * factor) * width;
            for(int x = 0; x < dstWidth; ++x){
                dst[dstIndex++] = src[rowOffset + columns[x]];
            }
        }
        return dst;
    }

    /**
     * Flip an image horizontally. {@code dst} may be {@code src} itself.
     *
     * @param src the source image.
     * @param width source width.
     * @param height source height.
     * @param dst destination to reuse; if null or too short a new array is allocated.
     * @return the destination holding the mirrored image.
     */
    public static int[] mirror(int[] src, int width, int height, int[] dst){
        DimensionMismatchException.checkBuffer("source image", src.length, width, height);
        dst = IntegralImage.ensure(dst, width * height);

        int index = 0;
        for(int y = 0; y < height; ++y){
            for(int x = 0, x2 = width - 1; x <= x2; ++x, --x2){
                int swap = src[index + x];
                dst[index + x] = src[index + x2];
                dst[index + x2] = swap;
            }
            index += width;
        }
        return dst;
    }
}
