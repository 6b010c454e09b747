package gov.nih.ncats.objdetect.image;

import static org.junit.Assert.*;

import org.junit.Test;

import gov.nih.ncats.objdetect.TestImages;

public class HistogramEqualizerTest {

    @Test
    public void levelsAreSpreadThroughTheCumulativeHistogram(){
        int[] image = {0, 0, 100, 200};
        assertArrayEquals(new int[]{0, 0, 128, 255}, HistogramEqualizer.equalize(image, 2, 2, null));
    }

    @Test
    public void darkestLevelMapsTo0AndBrightestTo255(){
        int[] image = {50, 60, 60, 70, 70, 70};
        int[] out = HistogramEqualizer.equalize(image, 3, 2, null);
        assertEquals(0, out[0]);
        assertEquals(255, out[5]);
        assertTrue(out[1] > out[0] && out[3] > out[1]);
    }

    @Test
    public void constantImageIsUnchanged(){
        int[] image = TestImages.constant(4, 3, 77);
        assertArrayEquals(image, HistogramEqualizer.equalize(image, 4, 3, null));
    }

    @Test
    public void canEqualizeInPlace(){
        int[] image = {0, 0, 100, 200};
        assertSame(image, HistogramEqualizer.equalize(image, 2, 2, image));
        assertArrayEquals(new int[]{0, 0, 128, 255}, image);
    }

    @Test(expected = IllegalArgumentException.class)
    public void valueAbove255Throws(){
        HistogramEqualizer.equalize(new int[]{0, 256}, 2, 1, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeValueThrows(){
        HistogramEqualizer.equalize(new int[]{-1, 0}, 1, 2, null);
    }
}
