package db.pagestore.catalog;

/**
 * Supported fixed-width column data types
 */
public enum DataType {
    INT,
    BOOLEAN,
    CHAR;
}
