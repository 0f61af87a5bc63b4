package db.pagestore.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import db.pagestore.storage.PageHeader;
import db.pagestore.storage.PageLayout;

/**
 * Construction parameters of the storage layer, loadable from JSON:
 * <pre>{ "pageSize": 4096, "poolSize": 10485760, "pageLayout": "SLOTTED" }</pre>
 * Fields left out of the JSON keep their defaults.
 */
public class StorageConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

    public static final int DEFAULT_PAGE_SIZE = 4096;
    public static final int DEFAULT_POOL_SIZE = 10 * (1 << 20); // 10 MB

    private static final Gson GSON = new Gson();

    private int pageSize = DEFAULT_PAGE_SIZE;
    private int poolSize = DEFAULT_POOL_SIZE;
    private PageLayout pageLayout = PageLayout.CONTIGUOUS;

    // Used by Gson so missing fields keep their defaults
    private StorageConfig() {}

    public StorageConfig(int pageSize, int poolSize, PageLayout pageLayout) {
        this.pageSize = pageSize;
        this.poolSize = poolSize;
        this.pageLayout = pageLayout;
        validate();
    }

    public static StorageConfig defaults() {
        return new StorageConfig();
    }

    public int pageSize() { return pageSize; }
    public int poolSize() { return poolSize; }
    public PageLayout pageLayout() { return pageLayout; }

    /** Number of page slots a pool of this size holds. */
    public int numSlots() { return poolSize / pageSize; }

    /** Reads a JSON config file; a missing file yields the defaults. */
    public static StorageConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            LOGGER.debug("No storage config at {}, using defaults", file);
            return defaults();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader, file.toString());
        }
    }

    /** Reads a JSON config from the classpath. */
    public static StorageConfig fromResource(String name) throws IOException {
        InputStream in = StorageConfig.class.getClassLoader().getResourceAsStream(name);
        if (in == null) throw new IllegalArgumentException("Storage config resource not found: " + name);
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader, name);
        }
    }

    private static StorageConfig parse(Reader reader, String source) {
        StorageConfig cfg;
        try {
            cfg = GSON.fromJson(reader, StorageConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed storage config " + source, e);
        }
        if (cfg == null) cfg = defaults(); // empty document
        cfg.validate();
        LOGGER.debug("Loaded storage config from {}: {}", source, cfg);
        return cfg;
    }

    private void validate() {
        if (pageSize <= 0 || pageSize > PageHeader.MAX_PAGE_CAPACITY) {
            throw new IllegalArgumentException("Page size must be in [1, " + PageHeader.MAX_PAGE_CAPACITY + "], got " + pageSize);
        }
        if (poolSize < pageSize) {
            throw new IllegalArgumentException("Pool size " + poolSize + " cannot hold a single page of " + pageSize + " bytes");
        }
        if (pageLayout == null) throw new IllegalArgumentException("Unknown page layout");
    }

    @Override
    public String toString() {
        return "StorageConfig{pageSize=" + pageSize + ", poolSize=" + poolSize + ", pageLayout=" + pageLayout + "}";
    }
}
