package db.pagestore.storage;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Maps page identifiers to locations in backing files and performs the page I/O.
 * The buffer pool depends on nothing else.
 */
public interface FileManager {

    /**
     * Materializes the page's bytes into {@code target} (exactly one page long)
     * and returns a page object over that region.
     */
    Page readPage(PageId pageId, ByteBuffer target) throws IOException;

    /** Persists the page's current packed bytes. */
    void writePage(Page page) throws IOException;
}
