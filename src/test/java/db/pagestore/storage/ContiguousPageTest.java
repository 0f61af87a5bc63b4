package db.pagestore.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.Test;

import db.pagestore.catalog.ColumnSchema;
import db.pagestore.catalog.DataType;
import db.pagestore.catalog.Record;
import db.pagestore.catalog.TupleSchema;

public class ContiguousPageTest {
    private static final int PAGE_SIZE = 4096;
    private static final PageId PID = new PageId(1, 0);

    private final TupleSchema schema = new TupleSchema("employee", List.of(
        new ColumnSchema("id", DataType.INT, 0),
        new ColumnSchema("age", DataType.INT, 0),
        new ColumnSchema("name", DataType.CHAR, 8)
    ));

    private byte[] employee(int id, int age) {
        return schema.pack(new Record(List.of(id, age, "e" + id)));
    }

    private int ageOf(ByteBuffer tuple) {
        return (Integer) schema.unpack(tuple).get(1);
    }

    private List<Integer> ages(Page page) {
        List<Integer> out = new ArrayList<>();
        for (ByteBuffer t : page) out.add(ageOf(t));
        return out;
    }

    private ContiguousPage freshPage() {
        return new ContiguousPage(PID, ByteBuffer.allocate(PAGE_SIZE), schema);
    }

    @Test
    void insertGetAndUpdate() {
        ContiguousPage page = freshPage();
        TupleId tid = page.insertTuple(employee(1, 25));
        assertEquals(new TupleId(PID, 0), tid);
        assertEquals(new Record(List.of(1, 25, "e1")), schema.unpack(page.getTuple(tid)));

        page.putTuple(tid, employee(1, 28));
        assertEquals(28, ageOf(page.getTuple(tid)));
        assertEquals(1, page.numTuples());
    }

    @Test
    void getTupleOutsideLiveRangeIsAbsent() {
        ContiguousPage page = freshPage();
        page.insertTuple(employee(1, 20));
        assertNull(page.getTuple(new TupleId(PID, 1)));
        assertNull(page.getTuple(new TupleId(PID, -1)));
    }

    @Test
    void tupleViewsWriteThroughToPage() {
        ContiguousPage page = freshPage();
        TupleId tid = page.insertTuple(employee(1, 20));
        page.getTuple(tid).putInt(4, 99);
        assertEquals(99, page.buffer().getInt(8 + 4));
        assertEquals(99, ageOf(page.getTuple(tid)));
    }

    @Test
    void iterationYieldsTuplesInOrderAndRestarts() {
        ContiguousPage page = freshPage();
        for (int i = 0; i < 4; i++) page.insertTuple(employee(i, 20 + i));
        assertEquals(List.of(20, 21, 22, 23), ages(page));
        // A second pass starts from the beginning again
        assertEquals(List.of(20, 21, 22, 23), ages(page));

        Iterator<ByteBuffer> it = page.iterator();
        for (int i = 0; i < 4; i++) it.next();
        assertFalse(it.hasNext());
        assertThrows(java.util.NoSuchElementException.class, it::next);
        assertThrows(UnsupportedOperationException.class, it::remove);
    }

    @Test
    void clearTupleErasesContentsOnly() {
        ContiguousPage page = freshPage();
        for (int i = 0; i < 3; i++) page.insertTuple(employee(i + 1, 20 + i));
        page.clearTuple(new TupleId(PID, 0));
        assertEquals(new Record(List.of(0, 0, "")), schema.unpack(page.getTuple(new TupleId(PID, 0))));
        assertEquals(3, page.numTuples());
        assertEquals(List.of(0, 21, 22), ages(page));
    }

    @Test
    void deleteCompactsFollowingTuples() {
        ContiguousPage page = freshPage();
        for (int i = 0; i < 10; i++) page.insertTuple(employee(i, 100 + i));
        int offsetBefore = page.header().freeSpaceOffset();

        assertTrue(page.deleteTuple(new TupleId(PID, 0)));

        assertEquals(9, page.numTuples());
        assertEquals(9 * 16, page.header().usedSpace());
        assertEquals(offsetBefore - 16, page.header().freeSpaceOffset());
        for (int i = 0; i < 9; i++) {
            assertEquals(101 + i, ageOf(page.getTuple(new TupleId(PID, i))));
        }
        assertNull(page.getTuple(new TupleId(PID, 9)));
        // Vacated last slot is zeroed
        byte[] vacated = new byte[16];
        page.buffer().get(8 + 9 * 16, vacated);
        assertArrayEquals(new byte[16], vacated);
    }

    @Test
    void deleteInMiddleAndLast() {
        ContiguousPage page = freshPage();
        for (int i = 0; i < 5; i++) page.insertTuple(employee(i, 10 + i));
        assertTrue(page.deleteTuple(new TupleId(PID, 2)));
        assertEquals(List.of(10, 11, 13, 14), ages(page));
        assertTrue(page.deleteTuple(new TupleId(PID, 3)));
        assertEquals(List.of(10, 11, 13), ages(page));
        assertFalse(page.deleteTuple(new TupleId(PID, 3)));
        assertFalse(page.deleteTuple(new TupleId(PID, -1)));
    }

    @Test
    void insertIntoFullPageReturnsNull() {
        ContiguousPage page = new ContiguousPage(PID, ByteBuffer.allocate(64), 16);
        assertNotNull(page.insertTuple(new byte[16]));
        assertNotNull(page.insertTuple(new byte[16]));
        assertNotNull(page.insertTuple(new byte[16]));
        assertNull(page.insertTuple(new byte[16]));
        assertEquals(3, page.numTuples());
    }

    @Test
    void rejectsWrongTupleWidth() {
        ContiguousPage page = freshPage();
        assertThrows(IllegalArgumentException.class, () -> page.insertTuple(new byte[15]));
        assertThrows(IllegalArgumentException.class, () -> page.putTuple(new TupleId(PID, 0), new byte[17]));
        assertThrows(IndexOutOfBoundsException.class, () -> page.putTuple(new TupleId(PID, 300), new byte[16]));
    }

    @Test
    void dirtyFlagDiscipline() {
        ContiguousPage page = freshPage();
        assertFalse(page.isDirty());

        TupleId tid = page.insertTuple(employee(1, 1));
        assertTrue(page.isDirty());

        page.setDirty(false);
        page.putTuple(tid, employee(1, 2));
        assertTrue(page.isDirty());

        page.setDirty(false);
        page.clearTuple(tid);
        assertTrue(page.isDirty());

        page.setDirty(false);
        page.deleteTuple(tid);
        assertTrue(page.isDirty());

        page.setDirty(false);
        assertFalse(page.deleteTuple(tid));
        assertFalse(page.isDirty());
    }

    @Test
    void packAndUnpackPage() {
        ContiguousPage page = freshPage();
        for (int i = 0; i < 11; i++) page.insertTuple(employee(i, 20 + 2 * i));

        ByteBuffer packed = page.pack();
        assertEquals(PAGE_SIZE, packed.remaining());
        byte[] copy = new byte[PAGE_SIZE];
        packed.get(copy);

        ContiguousPage restored = ContiguousPage.unpack(PID, ByteBuffer.wrap(copy));
        assertEquals(page.header(), restored.header());
        assertEquals(11, restored.numTuples());
        assertEquals(ages(page), ages(restored));
        assertEquals(PID, restored.pageId());
    }

    @Test
    void headerIsRefreshedOnlyOnPack() {
        ContiguousPage page = freshPage();
        page.insertTuple(employee(1, 1));
        assertEquals(8, page.buffer().getShort(4));
        page.pack();
        assertEquals(24, page.buffer().getShort(4));
    }

    @Test
    void invalidConstruction() {
        ByteBuffer buf = ByteBuffer.allocate(PAGE_SIZE);
        assertThrows(IllegalArgumentException.class, () -> new ContiguousPage(null, buf, schema));
        assertThrows(IllegalArgumentException.class, () -> new ContiguousPage(PID, null, schema));
        assertThrows(IllegalArgumentException.class, () -> new ContiguousPage(PID, buf, (TupleSchema) null));
        assertThrows(IllegalArgumentException.class, () -> new ContiguousPage(PID, buf, (ContiguousPageHeader) null));
    }

    @Test
    void adoptsSuppliedHeader() {
        ByteBuffer buf = ByteBuffer.allocate(PAGE_SIZE);
        ContiguousPageHeader header = new ContiguousPageHeader(buf, 16);
        ContiguousPage page = new ContiguousPage(PID, buf, header);
        assertSame(header, page.header());
    }
}
