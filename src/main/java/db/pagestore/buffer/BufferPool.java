package db.pagestore.buffer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.pagestore.config.StorageConfig;
import db.pagestore.storage.FileManager;
import db.pagestore.storage.Page;
import db.pagestore.storage.PageId;

/**
 * Fixed-capacity Least Recently Used (LRU) cache of pages over one contiguous arena.
 *
 * The arena is split into {@code poolSize / pageSize} slots. Every resident page has
 * a directory entry pointing at its slot; every other slot is on the free list. Pages
 * handed out are views over their slot, so tuple writes land in the arena directly.
 *
 * Not thread-safe, and pages are not pinned: a page view obtained earlier becomes
 * invalid once its page is evicted or discarded.
 */
public class BufferPool {
    private static final Logger LOGGER = LoggerFactory.getLogger(BufferPool.class);

    private final int pageSize;
    private final int poolSize;
    private final ByteBuffer pool;

    private final Deque<Integer> freeList = new ArrayDeque<>();
    // Iteration order is recency order: least recently used first
    private final LinkedHashMap<PageId, Frame> pageDirectory = new LinkedHashMap<>();

    private FileManager fileManager;
    private BufferPoolListener listener = BufferPoolListener.NONE;

    public BufferPool(int pageSize, int poolSize) {
        if (pageSize <= 0) throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        if (poolSize / pageSize == 0) {
            throw new IllegalArgumentException("Pool of " + poolSize + " bytes cannot hold a page of " + pageSize + " bytes");
        }
        this.pageSize = pageSize;
        this.poolSize = poolSize;
        this.pool = ByteBuffer.allocate(poolSize);
        resetFreeList();
    }

    public BufferPool(int pageSize, int poolSize, FileManager fileManager) {
        this(pageSize, poolSize);
        if (fileManager == null) throw new IllegalArgumentException("No file manager provided to buffer pool");
        this.fileManager = fileManager;
    }

    public BufferPool(StorageConfig config, FileManager fileManager) {
        this(config.pageSize(), config.poolSize(), fileManager);
    }

    // Allow late binding to avoid circular construction concerns
    public void setFileManager(FileManager fileManager) {
        this.fileManager = fileManager;
    }

    public void setListener(BufferPoolListener listener) {
        this.listener = listener == null ? BufferPoolListener.NONE : listener;
    }

    public int pageSize() { return pageSize; }

    // Basic statistics

    public int numPages() {
        return poolSize / pageSize;
    }

    public int numFreePages() {
        return freeList.size();
    }

    public int size() {
        return poolSize;
    }

    public int freeSpace() {
        return numFreePages() * pageSize;
    }

    public int usedSpace() {
        return size() - freeSpace();
    }

    /** Resident page ids from least to most recently used. */
    public List<PageId> residentPages() {
        return new ArrayList<>(pageDirectory.keySet());
    }

    // Buffer pool operations

    public boolean hasPage(PageId pageId) {
        return pageDirectory.containsKey(pageId);
    }

    /**
     * Returns the page, faulting it in from the file manager if it is not resident.
     * When no slot is free the least recently used page is evicted first.
     * Either way the page becomes the most recently used.
     */
    public Page getPage(PageId pageId) throws IOException {
        if (pageId == null) throw new IllegalArgumentException("No page identifier provided");
        Frame frame = pageDirectory.get(pageId);
        if (frame != null) {
            touch(pageId, frame);
            listener.pageHit(pageId);
            return frame.page();
        }

        FileManager fm = requireFileManager();
        if (freeList.isEmpty()) evictPage();
        int offset = freeList.pollFirst();

        Page page;
        try {
            page = fm.readPage(pageId, pool.slice(offset, pageSize));
        } catch (IOException | RuntimeException e) {
            freeList.addFirst(offset);
            throw e;
        }
        touch(pageId, new Frame(offset, page));
        listener.pageLoaded(pageId);
        LOGGER.debug("Loaded page {} into slot at offset {}", pageId, offset);
        return page;
    }

    /**
     * Evicts the least recently used page and returns its slot offset to the free list.
     * A dirty victim is written back first; if that write fails the victim stays resident.
     */
    public int evictPage() throws IOException {
        if (pageDirectory.isEmpty()) throw new IllegalStateException("No resident page to evict");
        Map.Entry<PageId, Frame> eldest = pageDirectory.entrySet().iterator().next();
        PageId victim = eldest.getKey();
        Frame frame = eldest.getValue();

        boolean dirty = frame.page().isDirty();
        if (dirty) write(victim, frame.page());

        pageDirectory.remove(victim);
        freeList.addLast(frame.offset());
        listener.pageEvicted(victim, dirty);
        LOGGER.debug("Evicted page {} (dirty={}) from offset {}", victim, dirty, frame.offset());
        return frame.offset();
    }

    /**
     * Drops a resident page without writing it back, abandoning any changes.
     * Returns false if the page was not resident.
     */
    public boolean discardPage(PageId pageId) {
        Frame frame = pageDirectory.remove(pageId);
        if (frame == null) return false;
        freeList.addLast(frame.offset());
        listener.pageDiscarded(pageId);
        LOGGER.debug("Discarded page {} (dirty={})", pageId, frame.page().isDirty());
        return true;
    }

    /** Writes a resident page back if it is dirty. Does not change its recency. */
    public void flushPage(PageId pageId) throws IOException {
        Frame frame = pageDirectory.get(pageId);
        if (frame == null) throw new IllegalArgumentException("Page not resident: " + pageId);
        if (frame.page().isDirty()) write(pageId, frame.page());
    }

    /** Writes back every dirty resident page. */
    public void flushAll() throws IOException {
        for (Map.Entry<PageId, Frame> e : new ArrayList<>(pageDirectory.entrySet())) {
            Page page = e.getValue().page();
            if (page.isDirty()) write(e.getKey(), page);
        }
    }

    /** Flushes every dirty page, then returns all slots to the free list. */
    public void clear() throws IOException {
        flushAll();
        pageDirectory.clear();
        resetFreeList();
        LOGGER.debug("Cleared buffer pool ({} slots free)", freeList.size());
    }

    // The page is written clean, so the dirty bit never reaches disk
    private void write(PageId pageId, Page page) throws IOException {
        FileManager fm = requireFileManager();
        page.setDirty(false);
        try {
            fm.writePage(page);
        } catch (IOException | RuntimeException e) {
            page.setDirty(true);
            LOGGER.warn("Failed flushing page {}", pageId, e);
            throw e;
        }
        listener.pageFlushed(pageId);
    }

    // Moves the page to the most recently used end
    private void touch(PageId pageId, Frame frame) {
        pageDirectory.remove(pageId);
        pageDirectory.put(pageId, frame);
    }

    private FileManager requireFileManager() {
        if (fileManager == null) throw new IllegalStateException("No file manager attached to buffer pool");
        return fileManager;
    }

    private void resetFreeList() {
        freeList.clear();
        for (int i = 0; i < numPages(); i++) {
            freeList.addLast(i * pageSize);
        }
    }

    private record Frame(int offset, Page page) {}
}
