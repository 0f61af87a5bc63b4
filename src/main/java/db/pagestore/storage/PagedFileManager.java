package db.pagestore.storage;

import java.io.Closeable;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.pagestore.catalog.TupleSchema;
import db.pagestore.config.StorageConfig;

/**
 * File manager over plain files of fixed-size pages.
 *
 * Page {@code i} of a file lives at byte offset {@code i * pageSize}. A page that lies
 * beyond end-of-file, or whose header was never written, is read back as a freshly
 * formatted empty page of the file's layout. Pages are stored clean: the dirty flag is
 * never written, and a written page is marked clean once the write succeeds.
 */
public class PagedFileManager implements FileManager, Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(PagedFileManager.class);

    private final int pageSize;
    private final PageLayout defaultLayout;
    private final Map<Integer, HeapFile> files = new HashMap<>();
    private int nextFileId = 0;

    public PagedFileManager(int pageSize) {
        this(pageSize, PageLayout.CONTIGUOUS);
    }

    /** Uses the configured page size, and the configured layout for files created without one. */
    public PagedFileManager(StorageConfig config) {
        this(config.pageSize(), config.pageLayout());
    }

    private PagedFileManager(int pageSize, PageLayout defaultLayout) {
        if (pageSize <= 0) throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        if (defaultLayout == null) throw new IllegalArgumentException("No default page layout provided");
        this.pageSize = pageSize;
        this.defaultLayout = defaultLayout;
    }

    public int getPageSize() { return pageSize; }

    public PageLayout getDefaultLayout() { return defaultLayout; }

    public int createFile(Path path, TupleSchema schema) throws IOException {
        return createFile(path, schema, defaultLayout);
    }

    public int createFile(Path path, TupleSchema schema, PageLayout layout) throws IOException {
        if (schema == null) throw new IllegalArgumentException("No schema provided for file " + path);
        return createFile(path, schema.size(), layout);
    }

    /**
     * Opens (creating if needed) a file of pages holding tuples of {@code tupleSize} bytes.
     * Returns the file id to use in {@link PageId}s.
     */
    public int createFile(Path path, int tupleSize, PageLayout layout) throws IOException {
        if (path == null) throw new IllegalArgumentException("No path provided");
        if (layout == null) throw new IllegalArgumentException("No page layout provided for file " + path);
        if (tupleSize <= 0) throw new IllegalArgumentException("Tuple size must be positive, got " + tupleSize);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        RandomAccessFile raf = new RandomAccessFile(path.toFile(), "rw");
        int existingPages = (int) ((raf.length() + pageSize - 1) / pageSize);
        int fileId = nextFileId++;
        files.put(fileId, new HeapFile(path, tupleSize, layout, raf, existingPages));
        LOGGER.debug("Registered file {} as id {} ({} layout, {} existing pages)", path, fileId, layout, existingPages);
        return fileId;
    }

    /** Reserves the identifier of a new page at the end of the file. */
    public PageId allocatePage(int fileId) {
        HeapFile f = file(fileId);
        return new PageId(fileId, f.numPages++);
    }

    public int numPages(int fileId) {
        return file(fileId).numPages;
    }

    public PageLayout layout(int fileId) {
        return file(fileId).layout;
    }

    @Override
    public Page readPage(PageId pageId, ByteBuffer target) throws IOException {
        if (pageId == null) throw new IllegalArgumentException("No page identifier provided");
        if (target == null || target.capacity() != pageSize) {
            throw new IllegalArgumentException("Target buffer must be exactly " + pageSize + " bytes");
        }
        HeapFile f = file(pageId.fileId());
        // Arena slots are reused, so wipe whatever the previous page left behind
        target.put(0, new byte[pageSize]);

        long offset = (long) pageId.pageIndex() * pageSize;
        long length = f.raf.length();
        if (offset < length) {
            byte[] bytes = new byte[(int) Math.min(pageSize, length - offset)];
            f.raf.seek(offset);
            f.raf.readFully(bytes);
            target.put(0, bytes);
        }

        if (target.getShort(2) == 0) {
            // Never written: hand out an empty page
            return f.layout.initialize(pageId, target, f.tupleSize);
        }
        return f.layout.unpack(pageId, target);
    }

    @Override
    public void writePage(Page page) throws IOException {
        PageId pageId = page.pageId();
        HeapFile f = file(pageId.fileId());
        ByteBuffer packed = page.pack();
        byte[] bytes = new byte[packed.remaining()];
        packed.get(bytes);
        bytes[0] &= (byte) ~PageHeader.DIRTY_MASK;
        f.raf.seek((long) pageId.pageIndex() * pageSize);
        f.raf.write(bytes);
        page.setDirty(false);
        if (pageId.pageIndex() >= f.numPages) f.numPages = pageId.pageIndex() + 1;
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (HeapFile f : files.values()) {
            try {
                f.raf.close();
            } catch (IOException e) {
                LOGGER.warn("Failed closing {}", f.path, e);
                if (failure == null) failure = e;
            }
        }
        files.clear();
        if (failure != null) throw failure;
    }

    private HeapFile file(int fileId) {
        HeapFile f = files.get(fileId);
        if (f == null) throw new IllegalArgumentException("Unknown file id: " + fileId);
        return f;
    }

    private static final class HeapFile {
        final Path path;
        final int tupleSize;
        final PageLayout layout;
        final RandomAccessFile raf;
        int numPages;

        HeapFile(Path path, int tupleSize, PageLayout layout, RandomAccessFile raf, int numPages) {
            this.path = path;
            this.tupleSize = tupleSize;
            this.layout = layout;
            this.raf = raf;
            this.numPages = numPages;
        }
    }
}
