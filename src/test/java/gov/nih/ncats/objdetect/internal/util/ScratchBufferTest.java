package gov.nih.ncats.objdetect.internal.util;

import static org.junit.Assert.*;

import org.junit.Test;

public class ScratchBufferTest {

    @Test
    public void growsOnlyWhenNeeded(){
        ScratchBuffer buffer = new ScratchBuffer();
        int[] first = buffer.ensureCapacity(100);
        assertEquals(100, buffer.capacity());
        assertSame(first, buffer.ensureCapacity(100));
        assertSame(first, buffer.ensureCapacity(10));
        assertEquals(1, buffer.getReallocations());

        int[] second = buffer.ensureCapacity(101);
        assertNotSame(first, second);
        assertSame(second, buffer.array());
        assertEquals(2, buffer.getReallocations());
    }

    @Test
    public void initialCapacityIsNotCountedAsReallocation(){
        ScratchBuffer buffer = new ScratchBuffer(64);
        buffer.ensureCapacity(64);
        assertEquals(0, buffer.getReallocations());
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeLengthThrows(){
        new ScratchBuffer().ensureCapacity(-1);
    }
}
