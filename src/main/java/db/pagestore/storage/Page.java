package db.pagestore.storage;

import java.nio.ByteBuffer;

/**
 * A fixed-size page of fixed-width tuples over a mutable byte buffer.
 *
 * The buffer is usually a slice of the buffer pool arena, so tuple mutations
 * are visible there immediately. Tuple views returned by {@link #getTuple} and
 * by iteration share the page bytes; writes through them are writes to the page.
 *
 * Layout: header bytes at offset 0, tuples packed at {@code tupleSize} stride
 * from {@code header().headerSize()}.
 */
public interface Page extends Iterable<ByteBuffer> {

    PageId pageId();

    PageHeader header();

    /** The full page buffer, {@code pageCapacity} bytes. */
    ByteBuffer buffer();

    /** View of the tuple's bytes, or null when no live tuple has that index. */
    ByteBuffer getTuple(TupleId tupleId);

    /** Overwrites an allocated tuple in place. */
    void putTuple(TupleId tupleId, byte[] tupleData);

    /** Stores a new tuple and returns its id, or null when the page is full. */
    TupleId insertTuple(byte[] tupleData);

    /** Zeroes a tuple's bytes without changing which tuples are live. */
    void clearTuple(TupleId tupleId);

    /** Removes a live tuple; returns false if there was none at that index. */
    boolean deleteTuple(TupleId tupleId);

    default int numTuples() {
        return header().numTuples();
    }

    default boolean isDirty() {
        return header().isDirty();
    }

    default void setDirty(boolean dirty) {
        header().setDirty(dirty);
    }

    /**
     * Refreshes the header bytes at the head of the buffer and returns the whole
     * page, positioned at 0, ready to be written out.
     */
    default ByteBuffer pack() {
        ByteBuffer buf = buffer();
        header().packInto(buf);
        return buf.duplicate().clear();
    }
}
