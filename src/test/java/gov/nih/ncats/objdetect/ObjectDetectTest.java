package gov.nih.ncats.objdetect;

import static org.junit.Assert.*;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.Test;

import gov.nih.ncats.objdetect.cascade.Cascade;
import gov.nih.ncats.objdetect.cascade.CompiledClassifier;

public class ObjectDetectTest {

    private static final int SIZE = 24;

    private static final List<Detection> SQUARE_AT_8 = Collections.singletonList(new Detection(8, 8, 8, 8, 1));

    @Test
    public void buildingBlocksCanBeChained(){
        int[] gray = TestImages.brightSquare(SIZE, SIZE, 8, 8, 8);
        CompiledClassifier compiled = ObjectDetect.compile(TestImages.brightSquareCascade(), SIZE);
        IntegralTables tables = ObjectDetect.buildTables(gray, SIZE, SIZE);
        assertTrue(tables.getRotatedSat().isPresent());
        assertFalse(tables.getEdgeSat().isPresent());

        List<Detection> raw = ObjectDetect.evaluate(tables, 1, compiled);
        assertEquals(SQUARE_AT_8, raw);
        assertEquals(SQUARE_AT_8, ObjectDetect.group(raw, 1));
        assertEquals(SQUARE_AT_8, ObjectDetect.group(raw, 1, 0.5));
    }

    @Test
    public void detectMultiScaleFindsTheSquare(){
        byte[] rgba = TestImages.toRgba(TestImages.brightSquare(SIZE, SIZE, 8, 8, 8));
        ObjectDetectOptions options = new ObjectDetectOptions().setScaleFactor(1.2).setStep(1).setMinNeighbors(1);
        assertEquals(SQUARE_AT_8, ObjectDetect.detectMultiScale(rgba, SIZE, SIZE, TestImages.brightSquareCascade(), options));
        assertEquals(SQUARE_AT_8, ObjectDetect.detectMultiScale(rgba, SIZE, SIZE, TestImages.brightSquareCascade(), null));
        assertEquals(SQUARE_AT_8, ObjectDetect.detectMultiScale(rgba, SIZE, SIZE, TestImages.brightSquareCascade()));
    }

    @Test
    public void detectMultiScaleOnBufferedImage(){
        int[] gray = TestImages.brightSquare(30, 26, 12, 9, 8);
        List<Detection> found = ObjectDetect.detectMultiScale(TestImages.toImage(gray, 30, 26), TestImages.brightSquareCascade());
        assertEquals(Collections.singletonList(new Detection(12, 9, 8, 8, 1)), found);
    }

    @Test
    public void asyncGivesSameResult() throws Exception{
        byte[] rgba = TestImages.toRgba(TestImages.brightSquare(SIZE, SIZE, 8, 8, 8));
        Cascade cascade = TestImages.brightSquareCascade();
        assertEquals(SQUARE_AT_8, ObjectDetect.detectMultiScaleAsync(rgba, SIZE, SIZE, cascade, null).get());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try{
            assertEquals(SQUARE_AT_8, ObjectDetect.detectMultiScaleAsync(rgba, SIZE, SIZE, cascade, null, executor).get());
            assertEquals(SQUARE_AT_8, ObjectDetect.detectMultiScaleAsync(
                    TestImages.toImage(TestImages.brightSquare(SIZE, SIZE, 8, 8, 8), SIZE, SIZE), cascade, null, executor).get());
        }finally{
            executor.shutdownNow();
        }
    }

    @Test
    public void asyncFailureCompletesExceptionally(){
        Cascade tooBig = TestImages.acceptAll(30, 30);
        CompletableFuture<List<Detection>> future = ObjectDetect.detectMultiScaleAsync(
                TestImages.toImage(TestImages.constant(SIZE, SIZE, 10), SIZE, SIZE), tooBig, null);
        try{
            future.join();
            fail("image smaller than the window should fail");
        }catch(CompletionException e){
            assertTrue(e.getCause() instanceof DimensionMismatchException);
        }
        assertTrue(future.isCompletedExceptionally());
    }

    @Test(expected = NullPointerException.class)
    public void nullImageThrows(){
        ObjectDetect.detectMultiScale((byte[]) null, SIZE, SIZE, TestImages.brightSquareCascade());
    }

    @Test(expected = NullPointerException.class)
    public void nullCascadeThrows(){
        ObjectDetect.detectMultiScale(new byte[4 * SIZE * SIZE], SIZE, SIZE, null);
    }
}
