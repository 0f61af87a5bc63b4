package db.pagestore.buffer;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import db.pagestore.storage.PageId;

/**
 * Counting listener for capacity planning and tests.
 */
public class BufferPoolStats implements BufferPoolListener {
    private long hits;
    private long misses;
    private long evictions;
    private long dirtyEvictions;
    private long flushes;
    private long discards;

    @Override public void pageHit(PageId pageId) { hits++; }
    @Override public void pageLoaded(PageId pageId) { misses++; }
    @Override public void pageFlushed(PageId pageId) { flushes++; }
    @Override public void pageDiscarded(PageId pageId) { discards++; }

    @Override
    public void pageEvicted(PageId pageId, boolean dirty) {
        evictions++;
        if (dirty) dirtyEvictions++;
    }

    public long hits() { return hits; }
    public long misses() { return misses; }
    public long evictions() { return evictions; }
    public long dirtyEvictions() { return dirtyEvictions; }
    public long flushes() { return flushes; }
    public long discards() { return discards; }

    public long requests() { return hits + misses; }

    public double hitRatio() {
        long requests = requests();
        return requests == 0 ? 0.0 : (double) hits / requests;
    }

    public void reset() {
        hits = misses = evictions = dirtyEvictions = flushes = discards = 0;
    }

    // JSON snapshot of the counters
    public String toJson() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("hits", hits);
        root.put("misses", misses);
        root.put("evictions", evictions);
        root.put("dirty_evictions", dirtyEvictions);
        root.put("flushes", flushes);
        root.put("discards", discards);
        // Round to 4 decimals
        root.put("hit_ratio", Math.round(hitRatio() * 10_000.0) / 10_000.0);
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        return gson.toJson(root);
    }

    @Override
    public String toString() {
        return "BufferPoolStats{hits=" + hits + ", misses=" + misses + ", evictions=" + evictions + "}";
    }
}
