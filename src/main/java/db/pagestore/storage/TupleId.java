package db.pagestore.storage;

/**
 * Tuple identifier: identifies a tuple by (pageId, tupleIndex) within that page.
 * For slotted pages the tuple index is the slot index.
 */
public record TupleId(PageId pageId, int tupleIndex) {
	@Override
	public String toString() {
		// For debugging
		return "(" + pageId + "," + tupleIndex + ")";
	}
}
