package gov.nih.ncats.objdetect.image;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Objects;
import java.util.logging.Logger;

import com.mortennobel.imagescaling.ResampleOp;

/**
 * A fixed size drawing surface a detector reads its pixels from.
 * Any {@link BufferedImage}, or a region of interest of one, is scaled
 * onto the canvas and read back as packed ARGB pixels.
 *
 * Without a region of interest the whole image is stretched to the canvas.
 * With one, the region keeps its aspect ratio and is centered on a black
 * background. The returned {@link Placement} maps canvas coordinates back
 * to the source image.
 *
 * Not thread safe.
 */
public final class ImageCanvas {
    private static final Logger logger = Logger.getLogger(ImageCanvas.class.getName());

    /**
     * ResampleOp refuses targets smaller than this.
     */
    private static final int MIN_RESAMPLE_SIZE = 3;

    private final int width, height;
    private final BufferedImage canvas;

    public ImageCanvas(int width, int height){
        if(width <= 0 || height <= 0){
            throw new IllegalArgumentException("canvas dimensions must be positive but were " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    }

    public int getWidth() { return width; }

    public int getHeight() { return height; }

    /**
     * Draw an image onto the canvas, replacing what was there.
     * @param image the image to draw; can not be null.
     * @param roi the region of the image to draw, or null for the whole image.
     * @return how the drawn region maps onto the canvas.
     * @throws IllegalArgumentException if roi is empty or not inside the image.
     */
    public Placement draw(BufferedImage image, Rectangle roi){
        Objects.requireNonNull(image, "image can not be null");
        BufferedImage region;
        int targetWidth, targetHeight;
        int offsetX, offsetY;
        int originX, originY;
        if(roi == null){
            region = image;
            targetWidth = width;
            targetHeight = height;
            offsetX = offsetY = 0;
            originX = originY = 0;
        }else{
            if(roi.isEmpty() || !new Rectangle(0, 0, image.getWidth(), image.getHeight()).contains(roi)){
                throw new IllegalArgumentException("region of interest " + roi + " is not inside the "
                        + image.getWidth() + "x" + image.getHeight() + " image");
            }
            region = image.getSubimage(roi.x, roi.y, roi.width, roi.height);
            double ratio = Math.max(roi.width / (double) width, roi.height / (double) height);
            targetWidth = Math.max(1, Math.min(width, (int) Math.round(roi.width / ratio)));
            targetHeight = Math.max(1, Math.min(height, (int) Math.round(roi.height / ratio)));
            offsetX = (width - targetWidth) / 2;
            offsetY = (height - targetHeight) / 2;
            originX = roi.x;
            originY = roi.y;
        }

        BufferedImage scaled = scale(region, targetWidth, targetHeight);
        Graphics2D g2d = canvas.createGraphics();
        try{
            g2d.setColor(Color.BLACK);
            g2d.fillRect(0, 0, width, height);
            g2d.drawImage(scaled, offsetX, offsetY, null);
        }finally{
            g2d.dispose();
        }
        return new Placement(originX, originY, offsetX, offsetY,
                region.getWidth() / (double) targetWidth,
                region.getHeight() / (double) targetHeight);
    }

    /**
     * Read the canvas as packed {@code 0xAARRGGBB} pixels.
     * @param dst destination to reuse; if null or too short a new array is allocated.
     */
    public int[] getArgb(int[] dst){
        dst = IntegralImage.ensure(dst, width * height);
        return canvas.getRGB(0, 0, width, height, dst, 0, width);
    }

    private static BufferedImage scale(BufferedImage region, int targetWidth, int targetHeight){
        if(region.getWidth() == targetWidth && region.getHeight() == targetHeight){
            return region;
        }
        BufferedImage rgb = toRgb(region);
        if(targetWidth >= MIN_RESAMPLE_SIZE && targetHeight >= MIN_RESAMPLE_SIZE){
            return new ResampleOp(targetWidth, targetHeight).filter(rgb, null);
        }
        logger.fine("target " + targetWidth + "x" + targetHeight + " too small to resample, using bilinear drawing");
        BufferedImage out = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = out.createGraphics();
        try{
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.drawImage(rgb, 0, 0, targetWidth, targetHeight, null);
        }finally{
            g2d.dispose();
        }
        return out;
    }

    private static BufferedImage toRgb(BufferedImage image){
        //subimages share their parent's raster, copy so the resampler sees a plain image
        BufferedImage out = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = out.createGraphics();
        try{
            g2d.drawImage(image, 0, 0, null);
        }finally{
            g2d.dispose();
        }
        return out;
    }

    /**
     * Where a source region ended up on the canvas.
     */
    public static final class Placement{
        private final int originX, originY;
        private final int offsetX, offsetY;
        private final double scaleX, scaleY;

        Placement(int originX, int originY, int offsetX, int offsetY, double scaleX, double scaleY){
            this.originX = originX;
            this.originY = originY;
            this.offsetX = offsetX;
            this.offsetY = offsetY;
            this.scaleX = scaleX;
            this.scaleY = scaleY;
        }

        public double toSourceX(double canvasX){
            return originX + (canvasX - offsetX) * scaleX;
        }

        public double toSourceY(double canvasY){
            return originY + (canvasY - offsetY) * scaleY;
        }

        public double toSourceWidth(double canvasWidth){
            return canvasWidth * scaleX;
        }

        public double toSourceHeight(double canvasHeight){
            return canvasHeight * scaleY;
        }

        public int getOffsetX() { return offsetX; }
        public int getOffsetY() { return offsetY; }
        public double getScaleX() { return scaleX; }
        public double getScaleY() { return scaleY; }
    }
}
