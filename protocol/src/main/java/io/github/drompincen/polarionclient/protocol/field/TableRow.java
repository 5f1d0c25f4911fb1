package io.github.drompincen.polarionclient.protocol.field;

import io.github.drompincen.polarionclient.protocol.api.TextContent;

import java.util.Arrays;
import java.util.List;

public record TableRow(List<TextContent> values) {

    public TableRow {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static TableRow ofPlain(String... cells) {
        return new TableRow(Arrays.stream(cells).map(TextContent::plain).toList());
    }

    public String cellText(int column) {
        if (column < 0 || column >= values.size()) {
            return null;
        }
        TextContent cell = values.get(column);
        return cell != null ? cell.value() : null;
    }
}
