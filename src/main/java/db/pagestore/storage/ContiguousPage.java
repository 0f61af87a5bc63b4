package db.pagestore.storage;

import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;

import db.pagestore.catalog.TupleSchema;

/**
 * Fixed-slot page: tuples are appended at the header's free space offset and
 * deletes compact the data area, so tuple index always equals physical slot.
 *
 * Layout (pageCapacity bytes):
 * [0..7]                    header, see {@link ContiguousPageHeader}
 * [8 .. freeSpaceOffset-1]  tuples 0..n-1 at tupleSize stride
 * [freeSpaceOffset ..]      unallocated
 */
public final class ContiguousPage implements Page {
    private final PageId pageId;
    private final ByteBuffer buffer;
    private final ContiguousPageHeader header;

    /** Wraps a buffer whose header has already been read. */
    public ContiguousPage(PageId pageId, ByteBuffer buffer, ContiguousPageHeader header) {
        requireIdentity(pageId, buffer);
        if (header == null) throw new IllegalArgumentException("No header provided when constructing a page");
        this.pageId = pageId;
        this.buffer = buffer;
        this.header = header;
    }

    /** Formats a fresh page for tuples of the given schema. */
    public ContiguousPage(PageId pageId, ByteBuffer buffer, TupleSchema schema) {
        this(pageId, buffer, tupleSizeOf(schema));
    }

    /** Formats a fresh page for tuples of {@code tupleSize} bytes. */
    public ContiguousPage(PageId pageId, ByteBuffer buffer, int tupleSize) {
        requireIdentity(pageId, buffer);
        this.pageId = pageId;
        this.buffer = buffer;
        this.header = new ContiguousPageHeader(buffer, tupleSize);
    }

    /** Creates a page from its packed bytes; the page id is not part of them. */
    public static ContiguousPage unpack(PageId pageId, ByteBuffer buffer) {
        requireIdentity(pageId, buffer);
        return new ContiguousPage(pageId, buffer, ContiguousPageHeader.unpack(buffer));
    }

    static void requireIdentity(PageId pageId, ByteBuffer buffer) {
        if (buffer == null) throw new IllegalArgumentException("No backing buffer provided to page constructor.");
        if (pageId == null) throw new IllegalArgumentException("No page identifier provided to page constructor.");
    }

    static int tupleSizeOf(TupleSchema schema) {
        if (schema == null) throw new IllegalArgumentException("No schema provided when constructing a page.");
        return schema.size();
    }

    @Override public PageId pageId() { return pageId; }
    @Override public ContiguousPageHeader header() { return header; }
    @Override public ByteBuffer buffer() { return buffer; }

    private int offsetOf(int tupleIndex) {
        return header.headerSize() + tupleIndex * header.tupleSize();
    }

    // Slot must lie within the page; liveness is the caller's business
    private int checkedOffset(TupleId tupleId) {
        int index = tupleId.tupleIndex();
        int offset = offsetOf(index);
        if (index < 0 || offset + header.tupleSize() > header.pageCapacity()) {
            throw new IndexOutOfBoundsException("Tuple index " + index + " outside page " + pageId);
        }
        return offset;
    }

    private void checkLength(byte[] tupleData) {
        if (tupleData == null || tupleData.length != header.tupleSize()) {
            throw new IllegalArgumentException("Expected tuple of " + header.tupleSize() + " bytes, got "
                + (tupleData == null ? "null" : tupleData.length));
        }
    }

    @Override
    public ByteBuffer getTuple(TupleId tupleId) {
        int index = tupleId.tupleIndex();
        if (index < 0 || index >= header.numTuples()) return null;
        return buffer.slice(offsetOf(index), header.tupleSize());
    }

    @Override
    public void putTuple(TupleId tupleId, byte[] tupleData) {
        checkLength(tupleData);
        buffer.put(checkedOffset(tupleId), tupleData);
        header.setDirty(true);
    }

    @Override
    public TupleId insertTuple(byte[] tupleData) {
        checkLength(tupleData);
        TupleRange range = header.nextTupleRange();
        if (range == null) return null;
        buffer.put(range.start(), tupleData);
        header.setDirty(true);
        return new TupleId(pageId, range.index());
    }

    @Override
    public void clearTuple(TupleId tupleId) {
        buffer.put(checkedOffset(tupleId), new byte[header.tupleSize()]);
        header.setDirty(true);
    }

    /**
     * Shifts every later tuple left by one slot, zeroes the vacated last slot
     * and gives its width back to the free space offset.
     */
    @Override
    public boolean deleteTuple(TupleId tupleId) {
        int index = tupleId.tupleIndex();
        int count = header.numTuples();
        if (index < 0 || index >= count) return false;

        int tupleSize = header.tupleSize();
        int tailLength = (count - index - 1) * tupleSize;
        if (tailLength > 0) {
            byte[] tail = new byte[tailLength];
            buffer.get(offsetOf(index + 1), tail);
            buffer.put(offsetOf(index), tail);
        }
        buffer.put(offsetOf(count - 1), new byte[tupleSize]);
        header.releaseLastTuple();
        header.setDirty(true);
        return true;
    }

    /** Yields tuples 0..numTuples-1 in order; each call starts a new pass. */
    @Override
    public Iterator<ByteBuffer> iterator() {
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < header.numTuples();
            }

            @Override
            public ByteBuffer next() {
                if (!hasNext()) throw new NoSuchElementException();
                return getTuple(new TupleId(pageId, next++));
            }
        };
    }

    @Override
    public String toString() {
        return "ContiguousPage{id=" + pageId +
               ", tuples=" + header.numTuples() +
               ", freeSpaceOffset=" + header.freeSpaceOffset() +
               ", dirty=" + header.isDirty() + "}";
    }
}
