package db.pagestore.storage;

import java.nio.ByteBuffer;

/**
 * Page organizations a file can use.
 */
public enum PageLayout {
    CONTIGUOUS {
        @Override
        public Page initialize(PageId pageId, ByteBuffer buffer, int tupleSize) {
            return new ContiguousPage(pageId, buffer, tupleSize);
        }

        @Override
        public Page unpack(PageId pageId, ByteBuffer buffer) {
            return ContiguousPage.unpack(pageId, buffer);
        }
    },
    SLOTTED {
        @Override
        public Page initialize(PageId pageId, ByteBuffer buffer, int tupleSize) {
            return new SlottedPage(pageId, buffer, tupleSize);
        }

        @Override
        public Page unpack(PageId pageId, ByteBuffer buffer) {
            return SlottedPage.unpack(pageId, buffer);
        }
    };

    /** Formats an empty page over the buffer. */
    public abstract Page initialize(PageId pageId, ByteBuffer buffer, int tupleSize);

    /** Reads a page previously packed into the buffer. */
    public abstract Page unpack(PageId pageId, ByteBuffer buffer);
}
