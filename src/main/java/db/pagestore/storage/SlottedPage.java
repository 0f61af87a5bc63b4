package db.pagestore.storage;

import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;

import db.pagestore.catalog.TupleSchema;

/**
 * Slotted page: the tuple index of a {@link TupleId} is a slot index, and an
 * occupancy bitmap in the header says which slots hold live tuples.
 *
 * Deleting only clears a bit; no bytes move. Freed slots are handed out again
 * by the next insert, lowest index first.
 */
public final class SlottedPage implements Page {
    private final PageId pageId;
    private final ByteBuffer buffer;
    private final SlottedPageHeader header;

    public SlottedPage(PageId pageId, ByteBuffer buffer, SlottedPageHeader header) {
        ContiguousPage.requireIdentity(pageId, buffer);
        if (header == null) throw new IllegalArgumentException("No header provided when constructing a slotted page");
        this.pageId = pageId;
        this.buffer = buffer;
        this.header = header;
    }

    public SlottedPage(PageId pageId, ByteBuffer buffer, TupleSchema schema) {
        this(pageId, buffer, ContiguousPage.tupleSizeOf(schema));
    }

    public SlottedPage(PageId pageId, ByteBuffer buffer, int tupleSize) {
        ContiguousPage.requireIdentity(pageId, buffer);
        this.pageId = pageId;
        this.buffer = buffer;
        this.header = new SlottedPageHeader(buffer, tupleSize);
    }

    public static SlottedPage unpack(PageId pageId, ByteBuffer buffer) {
        ContiguousPage.requireIdentity(pageId, buffer);
        return new SlottedPage(pageId, buffer, SlottedPageHeader.unpack(buffer));
    }

    @Override public PageId pageId() { return pageId; }
    @Override public SlottedPageHeader header() { return header; }
    @Override public ByteBuffer buffer() { return buffer; }

    private void checkLength(byte[] tupleData) {
        if (tupleData == null || tupleData.length != header.tupleSize()) {
            throw new IllegalArgumentException("Expected tuple of " + header.tupleSize() + " bytes, got "
                + (tupleData == null ? "null" : tupleData.length));
        }
    }

    @Override
    public ByteBuffer getTuple(TupleId tupleId) {
        int slot = tupleId.tupleIndex();
        if (!header.hasSlot(slot)) return null;
        return buffer.slice(header.offsetOfSlot(slot), header.tupleSize());
    }

    @Override
    public void putTuple(TupleId tupleId, byte[] tupleData) {
        checkLength(tupleData);
        buffer.put(header.offsetOfSlot(tupleId.tupleIndex()), tupleData);
        header.setDirty(true);
    }

    @Override
    public TupleId insertTuple(byte[] tupleData) {
        checkLength(tupleData);
        int slot = header.nextFreeTuple();
        if (slot == PageHeader.NO_SPACE) return null;
        buffer.put(header.offsetOfSlot(slot), tupleData);
        header.setDirty(true);
        return new TupleId(pageId, slot);
    }

    @Override
    public void clearTuple(TupleId tupleId) {
        buffer.put(header.offsetOfSlot(tupleId.tupleIndex()), new byte[header.tupleSize()]);
        header.setDirty(true);
    }

    @Override
    public boolean deleteTuple(TupleId tupleId) {
        int slot = tupleId.tupleIndex();
        if (!header.hasSlot(slot)) return false;
        header.resetSlot(slot);
        header.setDirty(true);
        return true;
    }

    /** Walks the bitmap upwards, yielding occupied slots and skipping holes. */
    @Override
    public Iterator<ByteBuffer> iterator() {
        return new Iterator<>() {
            private int next = header.nextUsedSlot(0);

            @Override
            public boolean hasNext() {
                return next >= 0;
            }

            @Override
            public ByteBuffer next() {
                if (next < 0) throw new NoSuchElementException();
                ByteBuffer tuple = getTuple(new TupleId(pageId, next));
                next = header.nextUsedSlot(next + 1);
                return tuple;
            }
        };
    }

    @Override
    public String toString() {
        return "SlottedPage{id=" + pageId +
               ", tuples=" + header.numTuples() +
               ", slots=" + header.slotCapacity() +
               ", dirty=" + header.isDirty() + "}";
    }
}
