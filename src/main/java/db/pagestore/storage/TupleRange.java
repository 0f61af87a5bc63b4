package db.pagestore.storage;

/**
 * Freshly allocated tuple position: its index and its [start, end) byte range in the page.
 */
public record TupleRange(int index, int start, int end) {}
