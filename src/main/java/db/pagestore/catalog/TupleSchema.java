package db.pagestore.catalog;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-width tuple layout: columns packed back to back in declaration order.
 * INT is 4 bytes big-endian, BOOLEAN one byte (1 or 0), CHAR(n) n bytes of UTF-8
 * padded with zero bytes.
 */
public record TupleSchema(String name, List<ColumnSchema> columns) {

    public TupleSchema {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Schema '" + name + "' has no columns");
        }
        columns = List.copyOf(columns);
    }

    /** Width of a packed tuple in bytes. */
    public int size() {
        int size = 0;
        for (ColumnSchema col : columns) size += col.width();
        return size;
    }

    public byte[] pack(Record record) {
        validateRecord(record);
        ByteBuffer buffer = ByteBuffer.allocate(size());
        List<Object> values = record.getValues();
        for (int i = 0; i < columns.size(); i++) {
            ColumnSchema col = columns.get(i);
            Object val = values.get(i);
            switch (col.type()) {
                case INT -> buffer.putInt((Integer) val);
                case BOOLEAN -> buffer.put((byte) ((Boolean) val ? 1 : 0));
                case CHAR -> {
                    byte[] strBytes = ((String) val).getBytes(StandardCharsets.UTF_8);
                    buffer.put(strBytes);
                    buffer.position(buffer.position() + col.length() - strBytes.length);
                }
            }
        }
        return buffer.array();
    }

    /** Decodes a packed tuple starting at the buffer's position, without moving it. */
    public Record unpack(ByteBuffer tuple) {
        if (tuple == null) throw new IllegalArgumentException("No tuple bytes to unpack");
        if (tuple.remaining() < size()) {
            throw new IllegalArgumentException("Tuple needs " + size() + " bytes, got " + tuple.remaining());
        }
        ByteBuffer buffer = tuple.duplicate();
        List<Object> values = new ArrayList<>();
        for (ColumnSchema col : columns) {
            switch (col.type()) {
                case INT -> values.add(buffer.getInt());
                case BOOLEAN -> values.add(buffer.get() == 1);
                case CHAR -> {
                    byte[] strBytes = new byte[col.length()];
                    buffer.get(strBytes);
                    int len = strBytes.length;
                    while (len > 0 && strBytes[len - 1] == 0) len--;
                    values.add(new String(strBytes, 0, len, StandardCharsets.UTF_8));
                }
            }
        }
        return new Record(values);
    }

    public Record unpack(byte[] tuple) {
        return unpack(ByteBuffer.wrap(tuple));
    }

    // Validation: arity, type consistency, CHAR length constraint
    private void validateRecord(Record record) {
        if (record == null) throw new IllegalArgumentException("No record to pack");
        List<Object> vals = record.getValues();
        if (vals.size() != columns.size()) {
            throw new IllegalArgumentException("Arity mismatch: expected " + columns.size() + " values, got " + vals.size());
        }
        for (int i = 0; i < columns.size(); i++) {
            ColumnSchema col = columns.get(i);
            Object v = vals.get(i);
            switch (col.type()) {
                case INT -> {
                    if (!(v instanceof Integer)) throw typeError(col, v);
                }
                case BOOLEAN -> {
                    if (!(v instanceof Boolean)) throw typeError(col, v);
                }
                case CHAR -> {
                    if (!(v instanceof String s)) throw typeError(col, v);
                    int byteLen = s.getBytes(StandardCharsets.UTF_8).length;
                    if (byteLen > col.length()) {
                        throw new IllegalArgumentException("Value too long for column '" + col.name() + "' (max=" + col.length() + " bytes, got=" + byteLen + ")");
                    }
                }
            }
        }
    }

    private IllegalArgumentException typeError(ColumnSchema col, Object v) {
        return new IllegalArgumentException("Type mismatch for column '" + col.name() + "' expected " + col.type() + ", got " + (v == null ? "null" : v.getClass().getSimpleName()));
    }
}
