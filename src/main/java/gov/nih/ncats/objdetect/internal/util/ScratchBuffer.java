package gov.nih.ncats.objdetect.internal.util;

/**
 * A resizable {@code int[]} that is reused from frame to frame.
 * The backing array only ever grows; callers ask for the length they
 * need and get an array at least that long.
 *
 * Not thread safe. A buffer belongs to exactly one detector (or one scale level
 * of a detector).
 */
public final class ScratchBuffer {

    private int[] data;
    private int reallocations;

    public ScratchBuffer(){
        this(0);
    }

    public ScratchBuffer(int initialCapacity){
        if(initialCapacity < 0){
            throw new IllegalArgumentException("capacity must be >= 0");
        }
        data = new int[initialCapacity];
    }

    /**
     * Get an array with at least the given length, reallocating only
     * when the current one is too short. The contents are not cleared.
     * @param length the minimum length needed.
     * @return the backing array.
     */
    public int[] ensureCapacity(int length){
        if(length < 0){
            throw new IllegalArgumentException("length must be >= 0");
        }
        if(data.length < length){
            data = new int[length];
            reallocations++;
        }
        return data;
    }

    public int[] array(){
        return data;
    }

    public int capacity(){
        return data.length;
    }

    /**
     * Number of times the backing array had to grow, used to check that
     * repeated frames of the same size do not allocate.
     */
    public int getReallocations(){
        return reallocations;
    }
}
