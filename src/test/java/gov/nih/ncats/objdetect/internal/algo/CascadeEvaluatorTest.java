package gov.nih.ncats.objdetect.internal.algo;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import gov.nih.ncats.objdetect.Detection;
import gov.nih.ncats.objdetect.DimensionMismatchException;
import gov.nih.ncats.objdetect.IntegralTables;
import gov.nih.ncats.objdetect.TestImages;
import gov.nih.ncats.objdetect.cascade.Cascade;
import gov.nih.ncats.objdetect.cascade.CascadeCompiler;
import gov.nih.ncats.objdetect.cascade.CompiledClassifier;
import gov.nih.ncats.objdetect.image.IntegralImage;

public class CascadeEvaluatorTest {

    private static final int WIDTH = 10, HEIGHT = 8;

    private static IntegralTables constantTables(boolean rotated, boolean edges){
        return IntegralTables.compute(TestImages.constant(WIDTH, HEIGHT, 50), WIDTH, HEIGHT, rotated, edges);
    }

    @Test
    public void acceptAllVisitsEveryWindowColumnByColumn(){
        CompiledClassifier compiled = CascadeCompiler.compile(TestImages.acceptAll(4, 4), WIDTH);
        List<Detection> found = CascadeEvaluator.detect(constantTables(false, false), 1, compiled);

        //x in [0,6], y in [0,4]
        assertEquals(7 * 5, found.size());
        assertEquals(new Detection(0, 0, 4, 4), found.get(0));
        assertEquals(new Detection(0, 1, 4, 4), found.get(1));
        assertEquals(new Detection(1, 0, 4, 4), found.get(5));
        assertEquals(new Detection(6, 4, 4, 4), found.get(found.size() - 1));
        for(Detection d : found){
            assertEquals(1, d.getNeighbors());
        }
    }

    @Test
    public void windowTouchingTheImageEdgeIsEvaluated(){
        CompiledClassifier compiled = CascadeCompiler.compile(TestImages.acceptAll(WIDTH, HEIGHT), WIDTH);
        List<Detection> found = CascadeEvaluator.detect(constantTables(false, false), 1, compiled);
        assertEquals(1, found.size());
        assertEquals(new Detection(0, 0, WIDTH, HEIGHT), found.get(0));
    }

    @Test
    public void stepSkipsPositions(){
        CompiledClassifier compiled = CascadeCompiler.compile(TestImages.acceptAll(4, 4), WIDTH);
        List<Detection> found = CascadeEvaluator.detect(constantTables(false, false), 2, compiled);
        assertEquals(4 * 3, found.size());
        for(Detection d : found){
            assertEquals(0D, d.getX() % 2, 0D);
            assertEquals(0D, d.getY() % 2, 0D);
        }
    }

    @Test
    public void infiniteStageThresholdRejectsEverything(){
        Cascade cascade = Cascade.builder(4, 4)
                .stage(Double.POSITIVE_INFINITY)
                    .tree(false, 0, 0, 1)
                        .feature(0, 0, 4, 4, 1)
                .build();
        CompiledClassifier compiled = CascadeCompiler.compile(cascade, WIDTH);
        assertTrue(CascadeEvaluator.detect(constantTables(false, false), 1, compiled).isEmpty());
    }

    @Test
    public void tiltedFeaturesReadRotatedTable(){
        Cascade cascade = Cascade.builder(4, 4)
                .stage(0.5)
                    .tree(true, 0, 0, 1)
                        .feature(2, 0, 1, 1, 1)
                .build();
        CompiledClassifier compiled = CascadeCompiler.compile(cascade, WIDTH);
        assertEquals(35, CascadeEvaluator.detect(constantTables(true, false), 1, compiled).size());
    }

    @Test
    public void tiltedFeatureDecisionsMatchBruteForceSums(){
        int width = 16, height = 14;
        int[] image = TestImages.random(width, height, 7);
        Cascade cascade = Cascade.builder(8, 8)
                .stage(0.5)
                    .tree(true, 0.2, 0, 1)
                        .feature(4, 1, 2, 2, 1)
                .build();
        IntegralTables tables = IntegralTables.compute(image, width, height, true, false);
        List<Detection> found = CascadeEvaluator.detect(tables, 1, CascadeCompiler.compile(cascade, width));

        float weight = (float) ((float) 1 * (1D / (float) 0.2));
        int[] rsat = tables.getRotatedSat().get();
        List<Detection> expected = new ArrayList<>();
        int rejected = 0;
        for(int x = 0; x + 8 <= width; x++){
            for(int y = 0; y + 8 <= height; y++){
                int sum = 0;
                for(int py = 0; py < height; py++){
                    for(int px = 0; px < width; px++){
                        if(insideRotated(px, py, x + 4, y + 1, 2, 2)){
                            sum += image[px + py * width];
                        }
                    }
                }
                assertEquals(sum, IntegralImage.rotatedSum(rsat, width, x + 4, y + 1, 2, 2));

                double variance = IntegralImage.variance(tables.getSat(), tables.getSquaredSat(), width, x, y, 8, 8);
                double std = variance > 1 ? Math.sqrt(variance) : 1;
                if((double) weight * sum > std){
                    expected.add(new Detection(x, y, 8, 8));
                }else{
                    rejected++;
                }
            }
        }
        assertFalse(expected.isEmpty());
        assertTrue(rejected > 0);
        assertEquals(expected, found);
    }

    private static boolean insideRotated(int px, int py, int x, int y, int w, int h){
        int a = px + py;
        int b = px - py;
        return a >= x + y - 1 && a <= x + y + 2 * w - 2
                && b >= x - y - 2 * h && b <= x - y - 1;
    }

    @Test(expected = IllegalArgumentException.class)
    public void tiltedClassifierWithoutRotatedTableThrows(){
        Cascade cascade = Cascade.builder(4, 4)
                .stage(0.5)
                    .tree(true, 0, 0, 1)
                        .feature(2, 0, 1, 1, 1)
                .build();
        CascadeEvaluator.detect(constantTables(false, false), 1, CascadeCompiler.compile(cascade, WIDTH));
    }

    @Test(expected = DimensionMismatchException.class)
    public void classifierForAnotherWidthThrows(){
        CompiledClassifier compiled = CascadeCompiler.compile(TestImages.acceptAll(4, 4), WIDTH + 2);
        CascadeEvaluator.detect(constantTables(false, false), 1, compiled);
    }

    @Test(expected = DimensionMismatchException.class)
    public void windowTallerThanImageThrows(){
        CompiledClassifier compiled = CascadeCompiler.compile(TestImages.acceptAll(4, HEIGHT + 1), WIDTH);
        CascadeEvaluator.detect(constantTables(false, false), 1, compiled);
    }

    @Test
    public void flatWindowsAreRejectedByTheEdgeFilter(){
        CompiledClassifier compiled = CascadeCompiler.compile(TestImages.acceptAll(4, 4), WIDTH);
        assertTrue(CascadeEvaluator.detect(constantTables(false, true), 1, compiled).isEmpty());
        assertEquals(35, CascadeEvaluator.detect(constantTables(false, true), 1, compiled, 0, 200).size());
    }

    @Test
    public void edgeBandIsIgnoredWithoutEdgeTable(){
        CompiledClassifier compiled = CascadeCompiler.compile(TestImages.acceptAll(4, 4), WIDTH);
        assertEquals(35, CascadeEvaluator.detect(constantTables(false, false), 1, compiled, 1000, 2000).size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroStepThrows(){
        CascadeEvaluator.detect(constantTables(false, false), 0, CascadeCompiler.compile(TestImages.acceptAll(4, 4), WIDTH));
    }
}
