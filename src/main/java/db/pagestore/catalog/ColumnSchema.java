package db.pagestore.catalog;

// Immutable data carrier for a table column.
// length: only matters for CHAR (declared byte length), ignored otherwise.
public record ColumnSchema(String name, DataType type, int length) {

    public ColumnSchema {
        if (type == null) throw new IllegalArgumentException("Column '" + name + "' has no type");
        if (type == DataType.CHAR && length <= 0) {
            throw new IllegalArgumentException("CHAR column '" + name + "' needs a positive length");
        }
    }

    /** Bytes this column occupies in a packed tuple. */
    public int width() {
        return switch (type) {
            case INT -> 4;
            case BOOLEAN -> 1;
            case CHAR -> length;
        };
    }
}
