package db.pagestore.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ContiguousPageHeaderTest {
    private static final int PAGE_SIZE = 4096;

    @Test
    void packUnpackRoundTrip() {
        ByteBuffer buffer = ByteBuffer.allocate(PAGE_SIZE);
        ContiguousPageHeader header = new ContiguousPageHeader(buffer, 16);
        assertEquals(header, ContiguousPageHeader.unpack(buffer));

        header.nextFreeTuple();
        header.nextFreeTuple();
        header.setDirty(true);
        header.packInto(buffer);
        ContiguousPageHeader copy = ContiguousPageHeader.unpack(buffer);
        assertEquals(header, copy);
        assertTrue(copy.isDirty());
        assertEquals(2, copy.numTuples());
    }

    @Test
    void roundTripAcrossSizes() {
        for (int capacity : new int[] {64, 512, 4096, 65535}) {
            for (int tupleSize : new int[] {1, 8, 16, 56}) {
                ByteBuffer buffer = ByteBuffer.allocate(capacity);
                ContiguousPageHeader header = new ContiguousPageHeader(buffer, tupleSize);
                header.nextFreeTuple();
                header.packInto(buffer);
                assertEquals(header, ContiguousPageHeader.unpack(buffer), capacity + "/" + tupleSize);
            }
        }
    }

    @Test
    void binaryLayoutIsBigEndianWithReservedByte() {
        ByteBuffer buffer = ByteBuffer.allocate(PAGE_SIZE);
        ContiguousPageHeader header = new ContiguousPageHeader(buffer, 16);
        header.setDirty(true);
        byte[] packed = header.pack();
        assertArrayEquals(new byte[] {1, 0, 0, 16, 0, 8, 0x10, 0}, packed);
        assertEquals(8, header.headerSize());
    }

    @Test
    void dirtyBit() {
        ContiguousPageHeader header = new ContiguousPageHeader(ByteBuffer.allocate(PAGE_SIZE), 16);
        assertFalse(header.isDirty());
        header.setDirty(true);
        assertTrue(header.isDirty());
        header.setDirty(false);
        assertFalse(header.isDirty());
    }

    @Test
    void allocationIsMonotonicUntilFull() {
        ContiguousPageHeader header = new ContiguousPageHeader(ByteBuffer.allocate(PAGE_SIZE), 16);
        // First tuple allocated at the header boundary
        assertEquals(header.headerSize(), header.nextFreeTuple());
        assertEquals(1, header.numTuples());

        List<Integer> offsets = new ArrayList<>();
        int offset;
        while ((offset = header.nextFreeTuple()) != PageHeader.NO_SPACE) {
            offsets.add(offset);
        }
        assertEquals(24, offsets.get(0));
        for (int i = 1; i < offsets.size(); i++) {
            assertEquals(offsets.get(i - 1) + 16, offsets.get(i));
        }
        assertEquals(4072, offsets.get(offsets.size() - 1));
        assertFalse(header.hasFreeTuple());

        // Stays full and does not move the offset
        int before = header.freeSpaceOffset();
        assertEquals(PageHeader.NO_SPACE, header.nextFreeTuple());
        assertEquals(PageHeader.NO_SPACE, header.nextFreeTuple());
        assertEquals(before, header.freeSpaceOffset());
    }

    @Test
    void spaceAccounting() {
        ContiguousPageHeader header = new ContiguousPageHeader(ByteBuffer.allocate(PAGE_SIZE), 16);
        for (int i = 0; i < 10; i++) header.nextFreeTuple();
        assertEquals(10, header.numTuples());
        assertEquals(160, header.usedSpace());
        assertEquals(PAGE_SIZE - 8 - 160, header.freeSpace());
        assertTrue(header.hasFreeTuple());
    }

    @Test
    void tupleRangeReportsIndexBeforeAllocation() {
        ContiguousPageHeader header = new ContiguousPageHeader(ByteBuffer.allocate(64), 16);
        assertEquals(new TupleRange(0, 8, 24), header.nextTupleRange());
        assertEquals(new TupleRange(1, 24, 40), header.nextTupleRange());
        assertEquals(new TupleRange(2, 40, 56), header.nextTupleRange());
        assertNull(header.nextTupleRange());
    }

    @Test
    void exactFitReportsSpaceButRefusesAllocation() {
        // 8 + 3 * 16 == 56: the third tuple would end exactly at the boundary
        ContiguousPageHeader header = new ContiguousPageHeader(ByteBuffer.allocate(56), 16);
        assertEquals(8, header.nextFreeTuple());
        assertEquals(24, header.nextFreeTuple());

        assertEquals(16, header.freeSpace());
        assertTrue(header.hasFreeTuple());
        assertEquals(PageHeader.NO_SPACE, header.nextFreeTuple());
        assertEquals(40, header.freeSpaceOffset());
        assertEquals(2, header.numTuples());
    }

    @Test
    void constructionWritesHeaderIntoBuffer() {
        ByteBuffer buffer = ByteBuffer.allocate(PAGE_SIZE);
        new ContiguousPageHeader(buffer, 16);
        assertEquals(16, buffer.getShort(2));
        assertEquals(8, buffer.getShort(4));
        assertEquals(PAGE_SIZE, buffer.getShort(6));
    }

    @Test
    void invalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new ContiguousPageHeader(null, 16));
        assertThrows(IllegalArgumentException.class, () -> new ContiguousPageHeader(ByteBuffer.allocate(PAGE_SIZE), 0));
        assertThrows(IllegalArgumentException.class, () -> new ContiguousPageHeader(ByteBuffer.allocate(70_000), 16));
        assertThrows(IllegalArgumentException.class, () -> new ContiguousPageHeader(ByteBuffer.allocate(16), 16));
        assertThrows(IllegalArgumentException.class, () -> ContiguousPageHeader.unpack(ByteBuffer.allocate(PAGE_SIZE)));
    }
}
