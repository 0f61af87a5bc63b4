package db.pagestore.storage;

import java.nio.ByteBuffer;

/**
 * Bookkeeping metadata stored at the start of every page.
 *
 * Both page layouts share this capability set but keep their own state:
 * a contiguous header tracks a free space offset, a slotted header tracks
 * an occupancy bitmap. Headers are maintained in memory and only written
 * back into the page buffer when the page is packed.
 *
 * Common record prefix (big-endian, 8 bytes):
 * [0]      u8  flags            (bit 0 = dirty)
 * [1]      u8  reserved         (always zero)
 * [2..3]   u16 tupleSize
 * [4..5]   u16 freeSpaceOffset
 * [6..7]   u16 pageCapacity
 */
public interface PageHeader {
    /** Size of the common record prefix in bytes. */
    int BASE_SIZE = 8;

    /** Largest page capacity the u16 field can describe. */
    int MAX_PAGE_CAPACITY = 0xFFFF;

    /** Returned by {@link #nextFreeTuple()} when the page is full. */
    int NO_SPACE = -1;

    byte DIRTY_MASK = 0b1;

    int headerSize();

    int tupleSize();

    int pageCapacity();

    int freeSpaceOffset();

    int numTuples();

    int freeSpace();

    int usedSpace();

    /**
     * Whether the free space could hold one more tuple. This is a space estimate, not an
     * allocation guarantee: {@link #nextFreeTuple()} may still return {@link #NO_SPACE}.
     */
    boolean hasFreeTuple();

    /**
     * Allocates the next free tuple and returns its position, or {@link #NO_SPACE}.
     * A contiguous header returns a byte offset, a slotted header returns a slot index.
     * Every successful call allocates, so the result must be consumed.
     */
    int nextFreeTuple();

    boolean isDirty();

    void setDirty(boolean dirty);

    /** Binary representation of exactly {@link #headerSize()} bytes. */
    byte[] pack();

    /** Writes the packed header at offset 0 of the given page buffer. */
    default void packInto(ByteBuffer pageBuffer) {
        pageBuffer.put(0, pack());
    }
}
