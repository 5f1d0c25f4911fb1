package io.github.drompincen.polarionclient.protocol.field;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Value of a table custom field: column keys plus rows of rich-text cells.
 */
public record TableField(List<String> keys, List<TableRow> rows) {

    public TableField {
        keys = keys == null ? List.of() : List.copyOf(keys);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public int columnIndex(String key) {
        return keys.indexOf(key);
    }

    public String cell(int row, String key) {
        int column = columnIndex(key);
        if (column < 0 || row < 0 || row >= rows.size()) {
            return null;
        }
        return rows.get(row).cellText(column);
    }

    public List<String> column(String key) {
        int column = columnIndex(key);
        if (column < 0) {
            throw new IllegalArgumentException("Unknown column: " + key);
        }
        List<String> out = new ArrayList<>(rows.size());
        for (TableRow row : rows) {
            out.add(row.cellText(column));
        }
        return out;
    }

    public TableField withRow(TableRow row) {
        if (row.values().size() != keys.size()) {
            throw new IllegalArgumentException(
                    "Row has " + row.values().size() + " cells, table has " + keys.size() + " columns");
        }
        List<TableRow> next = new ArrayList<>(rows);
        next.add(row);
        return new TableField(keys, next);
    }

    public TableField withRow(String... plainCells) {
        return withRow(TableRow.ofPlain(plainCells));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
