package db.pagestore.storage;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Header for fixed-slot pages with write-once, append-only tuple placement.
 *
 * Tuples are allocated by advancing a free space offset that starts right
 * after the header. The offset only moves back when a page compacts a
 * deleted tuple, so tuple index always equals physical slot.
 */
public final class ContiguousPageHeader implements PageHeader {
    private byte flags;
    private final int tupleSize;
    private int freeSpaceOffset;
    private final int pageCapacity;

    /**
     * Initializes a fresh header for the given page buffer and writes its
     * packed form at the start of the buffer.
     */
    public ContiguousPageHeader(ByteBuffer buffer, int tupleSize) {
        if (buffer == null) throw new IllegalArgumentException("No backing buffer supplied for page header");
        if (tupleSize <= 0) throw new IllegalArgumentException("Tuple size must be positive, got " + tupleSize);
        int capacity = buffer.capacity();
        checkCapacity(capacity, tupleSize);
        this.flags = 0;
        this.tupleSize = tupleSize;
        this.pageCapacity = capacity;
        this.freeSpaceOffset = BASE_SIZE;
        packInto(buffer);
    }

    private ContiguousPageHeader(byte flags, int tupleSize, int freeSpaceOffset, int pageCapacity) {
        this.flags = flags;
        this.tupleSize = tupleSize;
        this.freeSpaceOffset = freeSpaceOffset;
        this.pageCapacity = pageCapacity;
    }

    static void checkCapacity(int capacity, int tupleSize) {
        if (capacity > MAX_PAGE_CAPACITY) {
            throw new IllegalArgumentException("Page capacity " + capacity + " exceeds " + MAX_PAGE_CAPACITY);
        }
        if (BASE_SIZE + tupleSize > capacity) {
            throw new IllegalArgumentException("Tuple size " + tupleSize + " does not fit in a page of " + capacity + " bytes");
        }
    }

    @Override public int headerSize() { return BASE_SIZE; }
    @Override public int tupleSize() { return tupleSize; }
    @Override public int pageCapacity() { return pageCapacity; }
    @Override public int freeSpaceOffset() { return freeSpaceOffset; }

    @Override
    public int numTuples() {
        return usedSpace() / tupleSize;
    }

    @Override
    public int freeSpace() {
        return pageCapacity - (tupleSize * numTuples() + BASE_SIZE);
    }

    @Override
    public int usedSpace() {
        return freeSpaceOffset - BASE_SIZE;
    }

    /**
     * True when at least one tuple's width of free space remains. A tuple that would end
     * exactly at the page boundary still counts here, while {@link #nextFreeTuple()} refuses
     * it, so at an exact fit this returns true and the next insert fails.
     */
    @Override
    public boolean hasFreeTuple() {
        return freeSpace() >= tupleSize;
    }

    /** Allocates at the free space offset unless the tuple would reach the page capacity. */
    @Override
    public int nextFreeTuple() {
        int offset = freeSpaceOffset;
        if (offset + tupleSize >= pageCapacity) return NO_SPACE;
        freeSpaceOffset += tupleSize;
        return offset;
    }

    /**
     * Allocates the next tuple and describes it as (index, start, end),
     * or returns null when the page is full.
     */
    public TupleRange nextTupleRange() {
        int index = numTuples();
        int start = nextFreeTuple();
        if (start == NO_SPACE) return null;
        return new TupleRange(index, start, start + tupleSize);
    }

    /** Gives back the last tuple's width after a page compacts a delete. */
    void releaseLastTuple() {
        if (freeSpaceOffset - tupleSize < BASE_SIZE) {
            throw new IllegalStateException("No allocated tuple to release");
        }
        freeSpaceOffset -= tupleSize;
    }

    @Override
    public boolean isDirty() {
        return (flags & DIRTY_MASK) != 0;
    }

    @Override
    public void setDirty(boolean dirty) {
        flags = dirty ? (byte) (flags | DIRTY_MASK) : (byte) (flags & ~DIRTY_MASK);
    }

    @Override
    public byte[] pack() {
        ByteBuffer out = ByteBuffer.allocate(BASE_SIZE);
        out.put(flags);
        out.put((byte) 0);
        out.putShort((short) tupleSize);
        out.putShort((short) freeSpaceOffset);
        out.putShort((short) pageCapacity);
        return out.array();
    }

    /** Reconstructs a header from the record at the start of the buffer. */
    public static ContiguousPageHeader unpack(ByteBuffer buffer) {
        if (buffer == null) throw new IllegalArgumentException("No backing buffer supplied for page header");
        byte flags = buffer.get(0);
        int tupleSize = Short.toUnsignedInt(buffer.getShort(2));
        int freeSpaceOffset = Short.toUnsignedInt(buffer.getShort(4));
        int pageCapacity = Short.toUnsignedInt(buffer.getShort(6));
        if (tupleSize == 0) throw new IllegalArgumentException("Buffer does not hold a formatted page header");
        if (freeSpaceOffset < BASE_SIZE || freeSpaceOffset > pageCapacity) {
            throw new IllegalArgumentException("Corrupt free space offset " + freeSpaceOffset);
        }
        return new ContiguousPageHeader(flags, tupleSize, freeSpaceOffset, pageCapacity);
    }

    @Override // structural equality over all header fields
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContiguousPageHeader h)) return false;
        return flags == h.flags
            && tupleSize == h.tupleSize
            && freeSpaceOffset == h.freeSpaceOffset
            && pageCapacity == h.pageCapacity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(flags, tupleSize, freeSpaceOffset, pageCapacity);
    }

    @Override
    public String toString() {
        return "ContiguousPageHeader{flags=" + flags +
               ", tupleSize=" + tupleSize +
               ", freeSpaceOffset=" + freeSpaceOffset +
               ", pageCapacity=" + pageCapacity + "}";
    }
}
