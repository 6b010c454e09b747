package gov.nih.ncats.objdetect;

import java.util.Objects;
import java.util.Optional;

import gov.nih.ncats.objdetect.image.EdgeDensity;
import gov.nih.ncats.objdetect.image.IntegralImage;

/**
 * The integral tables of one image that the cascade evaluator reads:
 * the summed area table, the squared summed area table and, when needed,
 * the rotated table (tilted features) and the summed edge magnitude table
 * (edge pre-rejection).
 */
public final class IntegralTables {

    private final int width, height;
    private final int[] sat, ssat, rsat, edgeSat;

    /**
     * Wrap already computed tables.
     * @param width the width of the source image.
     * @param height the height of the source image.
     * @param sat summed area table; can not be null.
     * @param ssat squared summed area table; can not be null.
     * @param rsat rotated summed area table or null.
     * @param edgeSat summed area table of the gradient magnitude or null.
     * @throws DimensionMismatchException if a table is shorter than {@code (width+1)*(height+1)}.
     */
    public IntegralTables(int width, int height, int[] sat, int[] ssat, int[] rsat, int[] edgeSat) {
        this.width = width;
        this.height = height;
        this.sat = check("sat", sat, width, height);
        this.ssat = check("ssat", ssat, width, height);
        this.rsat = rsat == null ? null : check("rsat", rsat, width, height);
        this.edgeSat = edgeSat == null ? null : check("edge sat", edgeSat, width, height);
    }

    private static int[] check(String name, int[] table, int width, int height){
        Objects.requireNonNull(table, name + " can not be null");
        DimensionMismatchException.checkBuffer(name, table.length, width + 1, height + 1);
        return table;
    }

    /**
     * Compute fresh tables for a gray image.
     * @param gray the gray image, row major.
     * @param width image width.
     * @param height image height.
     * @param rotated also compute the rotated table.
     * @param edges also compute the edge magnitude table.
     * @return a new IntegralTables.
     */
    public static IntegralTables compute(int[] gray, int width, int height, boolean rotated, boolean edges){
        Objects.requireNonNull(gray, "image can not be null");
        DimensionMismatchException.checkBuffer("gray image", gray.length, width, height);
        int[] sat = IntegralImage.sat(gray, width, height, null);
        int[] ssat = IntegralImage.squaredSat(gray, width, height, null);
        int[] rsat = rotated ? IntegralImage.rotatedSat(gray, width, height, null) : null;
        int[] edgeSat = edges ? IntegralImage.sat(EdgeDensity.gradientMagnitude(gray, width, height, null), width, height, null) : null;
        return new IntegralTables(width, height, sat, ssat, rsat, edgeSat);
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int[] getSat() { return sat; }
    public int[] getSquaredSat() { return ssat; }
    public Optional<int[]> getRotatedSat() { return Optional.ofNullable(rsat); }
    public Optional<int[]> getEdgeSat() { return Optional.ofNullable(edgeSat); }
}
