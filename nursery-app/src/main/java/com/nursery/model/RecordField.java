package com.nursery.model;

/**
 * One column of a record kind. The name doubles as JSON property and table column.
 */
public record RecordField(
    String name,
    FieldType type
) {

    public enum FieldType {
        STRING,
        INTEGER,
        DECIMAL
    }

    public static RecordField text(String name) {
        return new RecordField(name, FieldType.STRING);
    }

    public static RecordField integer(String name) {
        return new RecordField(name, FieldType.INTEGER);
    }

    public static RecordField decimal(String name) {
        return new RecordField(name, FieldType.DECIMAL);
    }
}
