package gov.nih.ncats.objdetect.cascade;

import static org.junit.Assert.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import gov.nih.ncats.objdetect.Detection;
import gov.nih.ncats.objdetect.ObjectDetect;
import gov.nih.ncats.objdetect.TestImages;
import gov.nih.ncats.objdetect.image.ImageResampler;

public class CascadeMirrorTest {

    private static Cascade leftBrighterThanRight(){
        return Cascade.builder(8, 8)
                .stage(0.5)
                    .tree(false, 0.1, 0, 1)
                        .feature(0, 0, 3, 8, 1)
                        .feature(5, 1, 3, 6, -1)
                .build();
    }

    @Test
    public void uprightFeaturesAreReflected(){
        Cascade mirrored = CascadeMirror.mirror(leftBrighterThanRight());
        List<Feature> features = mirrored.getStages().get(0).getTrees().get(0).getFeatures();
        assertEquals(new Feature(5, 0, 3, 8, 1), features.get(0));
        assertEquals(new Feature(0, 1, 3, 6, -1), features.get(1));
    }

    @Test
    public void tiltedFeaturesSwapWidthAndHeight(){
        Cascade cascade = Cascade.builder(10, 10)
                .stage(0)
                    .tree(true, 1, 0, 1)
                        .feature(4, 1, 5, 2, 1)
                .build();
        Feature f = CascadeMirror.mirror(cascade).getStages().get(0).getTrees().get(0).getFeatures().get(0);
        assertEquals(new Feature(6, 1, 2, 5, 1), f);
    }

    @Test
    public void mirroringTwiceGivesBackTheCascade(){
        Cascade cascade = Cascade.builder(10, 10)
                .stage(0.3)
                    .tree(true, 1, 0, 1)
                        .feature(4, 1, 5, 2, 1)
                    .tree(false, -2, 0.1, 0.9)
                        .feature(1, 2, 3, 4, 2)
                        .feature(0, 0, 10, 10, -0.5)
                .build();
        assertEquals(cascade, CascadeMirror.mirror(CascadeMirror.mirror(cascade)));
    }

    @Test
    public void mirroredCascadeFindsMirroredWindows(){
        int width = 16, height = 12;
        int[] image = TestImages.random(width, height, 42);
        int[] mirroredImage = ImageResampler.mirror(image, width, height, null);

        Cascade cascade = leftBrighterThanRight();
        List<Detection> found = ObjectDetect.evaluate(ObjectDetect.buildTables(image, width, height, false, false),
                1, ObjectDetect.compile(cascade, width));
        List<Detection> foundMirrored = ObjectDetect.evaluate(ObjectDetect.buildTables(mirroredImage, width, height, false, false),
                1, ObjectDetect.compile(CascadeMirror.mirror(cascade), width));

        assertFalse(found.isEmpty());
        assertEquals(found.size(), foundMirrored.size());
        Set<Detection> expected = new HashSet<>();
        for(Detection d : found){
            expected.add(new Detection(width - d.getX() - d.getWidth(), d.getY(), d.getWidth(), d.getHeight()));
        }
        assertEquals(expected, new HashSet<>(foundMirrored));
    }
}
