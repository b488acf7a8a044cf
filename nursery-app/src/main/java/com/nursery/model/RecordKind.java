package com.nursery.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.nursery.model.RecordField.decimal;
import static com.nursery.model.RecordField.integer;
import static com.nursery.model.RecordField.text;

/**
 * The six inventory event streams. Each kind carries its REST path segment, its table,
 * its field schema and, when it takes part in the CSV export, the section title and
 * the columns written for it.
 */
public enum RecordKind {

    SEEDLINGS_RECEIVED(
        "seedlings-received", "seedlings_received",
        List.of(text("date"), text("type"), text("supplier"), decimal("price"), text("lot_number"), integer("quantity")),
        "SEEDLINGS RECEIVED",
        List.of("date", "type", "supplier", "price", "lot_number", "quantity")
    ),
    DELIVERY_NOTES(
        "delivery-notes", "delivery_notes",
        List.of(text("date"), text("type"), integer("expected_quantity"), integer("actual_quantity")),
        "DELIVERY NOTES",
        List.of("date", "type", "expected_quantity", "actual_quantity")
    ),
    DEAD_SEEDLINGS(
        "dead-seedlings", "dead_seedlings",
        List.of(text("date"), text("type"), integer("quantity")),
        "DEAD SEEDLINGS",
        List.of("date", "type", "quantity")
    ),
    DISCARDED_SEEDLINGS(
        "discarded-seedlings", "discarded_seedlings",
        List.of(text("date"), text("type"), integer("quantity")),
        "DISCARDED SEEDLINGS",
        List.of("date", "type", "quantity")
    ),
    NURSERY_PRODUCED(
        "nursery-produced", "nursery_produced",
        List.of(text("date"), text("type"), integer("quantity"), text("parent_plant"), text("propagation_method")),
        "NURSERY PRODUCED",
        List.of("date", "type", "quantity", "parent_plant", "propagation_method")
    ),
    // Not part of the CSV export.
    DISTRIBUTED_SEEDLINGS(
        "distributed-seedlings", "distributed_seedlings",
        List.of(text("date"), text("type"), integer("quantity"), text("destination"), text("location")),
        null,
        List.of()
    );

    private final String path;
    private final String table;
    private final List<RecordField> fields;
    private final String exportTitle;
    private final List<String> exportColumns;

    RecordKind(String path, String table, List<RecordField> fields, String exportTitle, List<String> exportColumns) {
        this.path = path;
        this.table = table;
        this.fields = fields;
        this.exportTitle = exportTitle;
        this.exportColumns = exportColumns;
    }

    public String path() { return path; }

    public String table() { return table; }

    public List<RecordField> fields() { return fields; }

    public String exportTitle() { return exportTitle; }

    public List<String> exportColumns() { return exportColumns; }

    public boolean isExported() {
        return exportTitle != null;
    }

    public boolean hasField(String name) {
        return fields.stream().anyMatch(f -> f.name().equals(name));
    }

    public static Optional<RecordKind> fromPath(String path) {
        return Arrays.stream(values())
            .filter(kind -> kind.path.equals(path))
            .findFirst();
    }

    /**
     * Kinds written by the CSV export, in section order.
     */
    public static List<RecordKind> exported() {
        return Arrays.stream(values())
            .filter(RecordKind::isExported)
            .toList();
    }
}
