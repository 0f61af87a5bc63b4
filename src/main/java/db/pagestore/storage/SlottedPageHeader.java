package db.pagestore.storage;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Header for slotted pages: the common record prefix followed by a slot occupancy bitmap.
 *
 * Layout:
 * [0..7]                    common prefix, see {@link PageHeader}
 * [8..8+ceil(capacity/8))   bitmap, slot i in byte i/8 at mask 0x80 >>> (i % 8)
 *
 * Slot capacity is the largest n with 8 + tupleSize*n + ceil(n/8) <= pageCapacity.
 * It is derived from (tupleSize, pageCapacity) only, both on construction and on
 * unpack, so the two always agree.
 */
public final class SlottedPageHeader implements PageHeader {
    private byte flags;
    private final int tupleSize;
    private final int pageCapacity;
    private final int slotCapacity;
    private final int headerSize;
    private final BitSet bitmap;

    /**
     * Initializes a header with every slot free and writes it at the start of the buffer.
     */
    public SlottedPageHeader(ByteBuffer buffer, int tupleSize) {
        if (buffer == null) throw new IllegalArgumentException("No backing buffer supplied for slotted page header");
        if (tupleSize <= 0) throw new IllegalArgumentException("Tuple size must be positive, got " + tupleSize);
        int capacity = buffer.capacity();
        ContiguousPageHeader.checkCapacity(capacity, tupleSize);
        this.flags = 0;
        this.tupleSize = tupleSize;
        this.pageCapacity = capacity;
        this.slotCapacity = computeSlotCapacity(capacity, tupleSize);
        if (slotCapacity == 0) {
            throw new IllegalArgumentException("No slot of " + tupleSize + " bytes fits in a page of " + capacity + " bytes");
        }
        this.headerSize = BASE_SIZE + bitmapBytes(slotCapacity);
        this.bitmap = new BitSet(slotCapacity);
        packInto(buffer);
    }

    private SlottedPageHeader(byte flags, int tupleSize, int pageCapacity, int slotCapacity, BitSet bitmap) {
        this.flags = flags;
        this.tupleSize = tupleSize;
        this.pageCapacity = pageCapacity;
        this.slotCapacity = slotCapacity;
        this.headerSize = BASE_SIZE + bitmapBytes(slotCapacity);
        this.bitmap = bitmap;
    }

    static int computeSlotCapacity(int pageCapacity, int tupleSize) {
        // Closed-form estimate, then settle on the exact largest fitting count.
        int n = (8 * (pageCapacity - BASE_SIZE)) / (1 + 8 * tupleSize);
        while (n > 0 && !fits(n, pageCapacity, tupleSize)) n--;
        while (fits(n + 1, pageCapacity, tupleSize)) n++;
        return n;
    }

    private static boolean fits(int slots, int pageCapacity, int tupleSize) {
        return BASE_SIZE + (long) tupleSize * slots + bitmapBytes(slots) <= pageCapacity;
    }

    private static int bitmapBytes(int slots) {
        return (slots + 7) / 8;
    }

    @Override public int headerSize() { return headerSize; }
    @Override public int tupleSize() { return tupleSize; }
    @Override public int pageCapacity() { return pageCapacity; }

    /** Slotted pages never move their data boundary; it always sits right after the bitmap. */
    @Override public int freeSpaceOffset() { return headerSize; }

    public int slotCapacity() { return slotCapacity; }

    @Override
    public int numTuples() {
        return bitmap.cardinality();
    }

    @Override
    public int freeSpace() {
        return (slotCapacity - numTuples()) * tupleSize;
    }

    @Override
    public int usedSpace() {
        return numTuples() * tupleSize;
    }

    @Override
    public boolean hasFreeTuple() {
        return bitmap.nextClearBit(0) < slotCapacity;
    }

    /** First-fit: claims the lowest free slot and returns its index. */
    @Override
    public int nextFreeTuple() {
        int slot = bitmap.nextClearBit(0);
        if (slot >= slotCapacity) return NO_SPACE;
        bitmap.set(slot);
        return slot;
    }

    // Slot operations

    public boolean hasSlot(int slot) {
        return slot >= 0 && slot < slotCapacity && bitmap.get(slot);
    }

    public void setSlot(int slot) {
        checkSlot(slot);
        bitmap.set(slot);
    }

    public void resetSlot(int slot) {
        checkSlot(slot);
        bitmap.clear(slot);
    }

    public int offsetOfSlot(int slot) {
        checkSlot(slot);
        return headerSize + slot * tupleSize;
    }

    /** Index of the first occupied slot at or after {@code from}, or -1. */
    public int nextUsedSlot(int from) {
        int slot = bitmap.nextSetBit(Math.max(from, 0));
        return slot >= 0 && slot < slotCapacity ? slot : -1;
    }

    public List<Integer> usedSlots() {
        List<Integer> out = new ArrayList<>();
        for (int i = bitmap.nextSetBit(0); i >= 0 && i < slotCapacity; i = bitmap.nextSetBit(i + 1)) {
            out.add(i);
        }
        return out;
    }

    public List<Integer> freeSlots() {
        List<Integer> out = new ArrayList<>();
        for (int i = bitmap.nextClearBit(0); i < slotCapacity; i = bitmap.nextClearBit(i + 1)) {
            out.add(i);
        }
        return out;
    }

    private void checkSlot(int slot) {
        if (slot < 0 || slot >= slotCapacity) {
            throw new IndexOutOfBoundsException("Slot " + slot + " outside [0, " + slotCapacity + ")");
        }
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
        ByteBuffer out = ByteBuffer.allocate(headerSize);
        out.put(flags);
        out.put((byte) 0);
        out.putShort((short) tupleSize);
        out.putShort((short) headerSize);
        out.putShort((short) pageCapacity);
        byte[] bits = new byte[bitmapBytes(slotCapacity)];
        for (int i = bitmap.nextSetBit(0); i >= 0 && i < slotCapacity; i = bitmap.nextSetBit(i + 1)) {
            bits[i >>> 3] |= (byte) (0x80 >>> (i & 7));
        }
        out.put(bits);
        return out.array();
    }

    /** Reconstructs a header, bitmap included, from the record at the start of the buffer. */
    public static SlottedPageHeader unpack(ByteBuffer buffer) {
        if (buffer == null) throw new IllegalArgumentException("No backing buffer supplied for slotted page header");
        byte flags = buffer.get(0);
        int tupleSize = Short.toUnsignedInt(buffer.getShort(2));
        int pageCapacity = Short.toUnsignedInt(buffer.getShort(6));
        if (tupleSize == 0) throw new IllegalArgumentException("Buffer does not hold a formatted page header");
        int slotCapacity = computeSlotCapacity(pageCapacity, tupleSize);
        if (slotCapacity <= 0) {
            throw new IllegalArgumentException("Corrupt slotted header: tupleSize=" + tupleSize + ", pageCapacity=" + pageCapacity);
        }
        BitSet bitmap = new BitSet(slotCapacity);
        for (int i = 0; i < slotCapacity; i++) {
            byte b = buffer.get(BASE_SIZE + (i >>> 3));
            if ((b & (0x80 >>> (i & 7))) != 0) bitmap.set(i);
        }
        return new SlottedPageHeader(flags, tupleSize, pageCapacity, slotCapacity, bitmap);
    }

    @Override // structural equality, bitmap contents included
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SlottedPageHeader h)) return false;
        return flags == h.flags
            && tupleSize == h.tupleSize
            && pageCapacity == h.pageCapacity
            && slotCapacity == h.slotCapacity
            && bitmap.equals(h.bitmap);
    }

    @Override
    public int hashCode() {
        return Objects.hash(flags, tupleSize, pageCapacity, bitmap);
    }

    @Override
    public String toString() {
        return "SlottedPageHeader{flags=" + flags +
               ", tupleSize=" + tupleSize +
               ", slots=" + numTuples() + "/" + slotCapacity +
               ", pageCapacity=" + pageCapacity + "}";
    }
}
