package db.pagestore.storage;

/**
 * Page identifier: identifies a page by (fileId, pageIndex) within that file.
 * Not stored in the page bytes; the owning file structure injects it on load.
 */
public record PageId(int fileId, int pageIndex) {
	@Override
	public String toString() {
		return fileId + ":" + pageIndex;
	}
}
