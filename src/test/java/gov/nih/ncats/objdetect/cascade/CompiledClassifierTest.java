package gov.nih.ncats.objdetect.cascade;

import static org.junit.Assert.*;

import org.junit.Test;

import gov.nih.ncats.objdetect.TestImages;
import gov.nih.ncats.objdetect.image.IntegralImage;

public class CompiledClassifierTest {

    private static final int WIDTH = 10, HEIGHT = 10;

    private static int[] constantSat(){
        return IntegralImage.sat(TestImages.constant(WIDTH, HEIGHT, 50), WIDTH, HEIGHT, null);
    }

    @Test
    public void zeroNodeThresholdAcceptsPositiveWindow(){
        CompiledClassifier compiled = CascadeCompiler.compile(TestImages.acceptAll(4, 4), WIDTH);
        assertTrue(compiled.accepts(constantSat(), null, 0, 1));
    }

    @Test
    public void infiniteStageThresholdRejects(){
        Cascade cascade = Cascade.builder(4, 4)
                .stage(Double.POSITIVE_INFINITY)
                    .tree(false, 0, 0, 1)
                        .feature(0, 0, 4, 4, 1)
                .build();
        CompiledClassifier compiled = CascadeCompiler.compile(cascade, WIDTH);
        assertFalse(compiled.accepts(constantSat(), null, 0, 1));
    }

    @Test
    public void laterStagesAreSkippedOnceAStageFails(){
        //the second stage reads the rotated table, which is not there
        Cascade cascade = Cascade.builder(4, 4)
                .stage(Double.POSITIVE_INFINITY)
                    .tree(false, 0, 0, 1)
                        .feature(0, 0, 4, 4, 1)
                .stage(0.5)
                    .tree(true, 0, 0, 1)
                        .feature(2, 0, 1, 1, 1)
                .build();
        CompiledClassifier compiled = CascadeCompiler.compile(cascade, WIDTH);
        assertFalse(compiled.accepts(constantSat(), null, 0, 1));
    }

    @Test(expected = NullPointerException.class)
    public void laterStagesRunWhenEarlierOnesPass(){
        Cascade cascade = Cascade.builder(4, 4)
                .stage(0.5)
                    .tree(false, 0, 0, 1)
                        .feature(0, 0, 4, 4, 1)
                .stage(0.5)
                    .tree(true, 0, 0, 1)
                        .feature(2, 0, 1, 1, 1)
                .build();
        CascadeCompiler.compile(cascade, WIDTH).accepts(constantSat(), null, 0, 1);
    }

    @Test
    public void responseIsComparedToStandardDeviation(){
        //sum of the window is 800, weight 1/100 gives a response of 8
        Cascade cascade = Cascade.builder(4, 4)
                .stage(0.5)
                    .tree(false, 100, 0, 1)
                        .feature(0, 0, 4, 4, 1)
                .build();
        CompiledClassifier compiled = CascadeCompiler.compile(cascade, WIDTH);
        assertTrue(compiled.accepts(constantSat(), null, 0, 7.9));
        assertFalse(compiled.accepts(constantSat(), null, 0, 8.1));
    }

    @Test
    public void stageSumsTreeValues(){
        Cascade cascade = Cascade.builder(4, 4)
                .stage(1.5)
                    .tree(false, 0, 0, 1)
                        .feature(0, 0, 4, 4, 1)
                    .tree(false, 0, 0, 0.6)
                        .feature(0, 0, 2, 2, 1)
                .build();
        assertTrue(CascadeCompiler.compile(cascade, WIDTH).accepts(constantSat(), null, 0, 1));

        Cascade tooHigh = Cascade.builder(4, 4)
                .stage(1.7)
                    .tree(false, 0, 0, 1)
                        .feature(0, 0, 4, 4, 1)
                    .tree(false, 0, 0, 0.6)
                        .feature(0, 0, 2, 2, 1)
                .build();
        assertFalse(CascadeCompiler.compile(tooHigh, WIDTH).accepts(constantSat(), null, 0, 1));
    }
}
