package db.pagestore.buffer;

import db.pagestore.storage.PageId;

/**
 * Observability hook for buffer pool events. All methods default to no-ops.
 */
public interface BufferPoolListener {
    BufferPoolListener NONE = new BufferPoolListener() {};

    /** A requested page was already resident. */
    default void pageHit(PageId pageId) {}

    /** A requested page was faulted in from the file manager. */
    default void pageLoaded(PageId pageId) {}

    /** A page was evicted to make room; {@code dirty} if it had to be written back first. */
    default void pageEvicted(PageId pageId, boolean dirty) {}

    default void pageFlushed(PageId pageId) {}

    /** A page was dropped without being written back. */
    default void pageDiscarded(PageId pageId) {}
}
